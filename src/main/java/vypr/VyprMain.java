package vypr;

import vypr.cli.Arg;
import vypr.codegen.PythonRunner;
import vypr.exception.Diagnostic;
import vypr.exception.VyprRuntimeException;
import vypr.ir.IRPrinter;
import vypr.runtime.IRExecutor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class VyprMain {
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Arg arg;
        try {
            arg = Arg.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        String source;
        try {
            source = Files.readString(Paths.get(arg.srcFilename), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Error reading " + arg.srcFilename + ": " + e.getMessage());
            return 1;
        }

        CompileResult result = new VyprCompiler(CompilerOptions.DEFAULT).compile(source);
        for (Diagnostic warning : result.warnings()) {
            System.err.println(warning);
        }
        if (!result.success()) {
            System.err.println("Compilation failed in the " + result.phase().displayName().toLowerCase() + " phase:");
            for (Diagnostic diagnostic : result.diagnostics()) {
                System.err.println("  " + diagnostic);
            }
            return 1;
        }

        if (arg.dumpIr) {
            System.out.print(IRPrinter.print(result.ir()));
        }

        if (arg.interpret) {
            try {
                new IRExecutor(result.ir()).execute();
                return 0;
            } catch (VyprRuntimeException e) {
                System.out.flush();
                System.err.println("Runtime error: " + e.getMessage());
                return 1;
            }
        }

        if (arg.compileOnly && !arg.hasOutputFile()) {
            System.out.print(result.python());
            return 0;
        }

        try {
            Path output = arg.hasOutputFile() ? Paths.get(arg.outputFilename) : Files.createTempFile("vypr-", ".py");
            Files.writeString(output, result.python(), StandardCharsets.UTF_8);
            if (arg.compileOnly) {
                System.err.println("Wrote " + output);
                return 0;
            }
            try {
                return new PythonRunner(arg.python).run(output);
            } finally {
                if (!arg.keep && !arg.hasOutputFile()) {
                    Files.deleteIfExists(output);
                } else {
                    System.err.println("Kept " + output);
                }
            }
        } catch (IOException e) {
            System.err.println("Error running " + arg.python + ": " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted while waiting for " + arg.python);
            return 1;
        }
    }
}
