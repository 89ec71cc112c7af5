package vypr.cli;

import vypr.codegen.PythonRunner;

/**
 * Command line of the compiler.
 */
public class Arg {
    public static final String USAGE =
            "Usage: vypr <source.vy> [-o <file.py>] [-S] [-ir] [-interpret] [-keep] [-python <exe>]";

    public final String srcFilename; // source file, e.g. "hello.vy"
    public final String outputFilename; // generated python file, empty for a temporary file
    public final boolean compileOnly; // -S: write the python file, do not run it
    public final boolean dumpIr; // -ir: print the IR to stdout
    public final boolean interpret; // -interpret: run with the IR executor
    public final boolean keep; // -keep: keep the generated file after running
    public final String python; // interpreter executable

    private Arg(String src, String output, boolean compileOnly, boolean dumpIr, boolean interpret,
                boolean keep, String python) {
        this.srcFilename = src;
        this.outputFilename = output;
        this.compileOnly = compileOnly;
        this.dumpIr = dumpIr;
        this.interpret = interpret;
        this.keep = keep;
        this.python = python;
    }

    public boolean hasOutputFile() {
        return !outputFilename.isEmpty();
    }

    public static Arg parse(String[] args) {
        String src = "", output = "", python = "";
        boolean compileOnly = false, dumpIr = false, interpret = false, keep = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("-o expected a filename\n" + USAGE);
                    }
                    if (!output.isEmpty()) {
                        throw new IllegalArgumentException("We got more than one output file when we expected only one.");
                    }
                    output = args[++i];
                    continue;
                case "-python":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("-python expected an executable\n" + USAGE);
                    }
                    python = args[++i];
                    continue;
                case "-S":
                    compileOnly = true;
                    continue;
                case "-ir":
                    dumpIr = true;
                    continue;
                case "-interpret":
                    interpret = true;
                    continue;
                case "-keep":
                    keep = true;
                    continue;
                default:
                    break;
            }
            if (args[i].startsWith("-")) {
                throw new IllegalArgumentException("Unknown option " + args[i] + "\n" + USAGE);
            }
            if (!src.isEmpty()) {
                throw new IllegalArgumentException("We got more than one source file when we expected only one.");
            }
            src = args[i];
        }
        if (src.isEmpty()) {
            throw new IllegalArgumentException("No source file given\n" + USAGE);
        }
        if (compileOnly && interpret) {
            throw new IllegalArgumentException("-S and -interpret cannot be combined");
        }
        return new Arg(src, output, compileOnly, dumpIr, interpret, keep,
                python.isEmpty() ? PythonRunner.DEFAULT_EXECUTABLE : python);
    }
}
