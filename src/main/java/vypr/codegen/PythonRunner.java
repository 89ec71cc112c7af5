package vypr.codegen;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs generated Python with an external interpreter.
 */
public class PythonRunner {
    public static final String DEFAULT_EXECUTABLE = "python3";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String executable;
    private final Duration timeout;

    public PythonRunner() {
        this(DEFAULT_EXECUTABLE);
    }

    public PythonRunner(String executable) {
        this(executable, DEFAULT_TIMEOUT);
    }

    /** timeout bounds {@link #capture}; {@link #run} waits for as long as the program runs. */
    public PythonRunner(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    public String getExecutable() {
        return executable;
    }

    /** Runs the script with inherited stdio and returns the interpreter's exit code. */
    public int run(Path script) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(executable, script.toString())
                .inheritIO()
                .start();
        return process.waitFor();
    }

    /**
     * Runs {@code code} from a temporary file, feeding {@code stdin} and collecting stdout.
     * The temporary file is removed afterwards.
     */
    public Captured capture(String code, String stdin) throws IOException, InterruptedException {
        Path script = Files.createTempFile("vypr-", ".py");
        Path output = Files.createTempFile("vypr-", ".out");
        try {
            Files.writeString(script, code, StandardCharsets.UTF_8);
            Process process = new ProcessBuilder(executable, script.toString())
                    .redirectOutput(output.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            try (OutputStream in = process.getOutputStream()) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException(executable + " did not finish within " + timeout.toSeconds() + " seconds");
            }
            return new Captured(process.exitValue(), Files.readString(output, StandardCharsets.UTF_8));
        } finally {
            Files.deleteIfExists(script);
            Files.deleteIfExists(output);
        }
    }

    /** True when the interpreter can be started at all. */
    public boolean isAvailable() {
        try {
            Process process = new ProcessBuilder(executable, "--version")
                    .redirectErrorStream(true)
                    .start();
            readAll(process.getInputStream());
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String readAll(InputStream stream) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        stream.transferTo(buffer);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    public record Captured(int exitCode, String stdout) {
    }
}
