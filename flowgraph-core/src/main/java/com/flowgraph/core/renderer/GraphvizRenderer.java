package com.flowgraph.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the Graphviz command line: {@code <command> -T<format> -o<image> <artifact>}.
 *
 * <p>Standard output and error are merged into a temporary capture file rather than a
 * pipe, so a chatty renderer can never block on a full buffer. A process that outlives
 * the timeout is destroyed and reported as timed out. The image content is never read.
 *
 * <p>The command may carry leading arguments separated by whitespace, e.g.
 * {@code "dot -Gdpi=150"}.
 */
public class GraphvizRenderer implements RendererInvoker {

    private static final Logger log = LoggerFactory.getLogger(GraphvizRenderer.class);

    /** Default command, resolved on the PATH */
    public static final String DEFAULT_COMMAND = "dot";

    /** Default per-invocation timeout */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final int MAX_CAPTURED_CHARS = 4096;
    private static final long DESTROY_WAIT_SECONDS = 5;

    private final List<String> command;
    private final Duration timeout;

    /**
     * Creates a renderer.
     *
     * @param command renderer command line prefix
     * @param timeout maximum time per invocation
     * @throws IllegalArgumentException if the command is blank or the timeout not positive
     */
    public GraphvizRenderer(String command, Duration timeout) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.command = List.of(command.strip().split("\\s+"));
        this.timeout = timeout;
    }

    public GraphvizRenderer() {
        this(DEFAULT_COMMAND, DEFAULT_TIMEOUT);
    }

    @Override
    public RenderResult render(Path artifact, Path image, String format) throws IOException, InterruptedException {
        Objects.requireNonNull(artifact, "artifact must not be null");
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(format, "format must not be null");

        List<String> arguments = new ArrayList<>(command);
        arguments.addAll(Arrays.asList("-T" + format, "-o" + image, artifact.toString()));

        Path capture = Files.createTempFile("flowgraph-render-", ".log");
        try {
            ProcessBuilder builder = new ProcessBuilder(arguments)
                .redirectErrorStream(true)
                .redirectOutput(Redirect.appendTo(capture.toFile()));
            Path workingDirectory = artifact.getParent();
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }

            log.debug("Executing renderer: {}", String.join(" ", arguments));
            Process process = builder.start();
            try {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Renderer exceeded {}s on {}, destroying it", timeout.toSeconds(), artifact.getFileName());
                    destroy(process);
                    return RenderResult.timeout(readCapture(capture));
                }
            } catch (InterruptedException e) {
                destroy(process);
                throw e;
            }

            int exitCode = process.exitValue();
            String output = readCapture(capture);
            if (exitCode != 0) {
                log.debug("Renderer exited with code {} on {}: {}", exitCode, artifact.getFileName(), output.strip());
            }
            return new RenderResult(exitCode, false, output);
        } finally {
            Files.deleteIfExists(capture);
        }
    }

    @Override
    public long timeoutSeconds() {
        return timeout.toSeconds();
    }

    public List<String> command() {
        return command;
    }

    private static void destroy(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        process.waitFor(DESTROY_WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private static String readCapture(Path capture) throws IOException {
        String output = new String(Files.readAllBytes(capture), StandardCharsets.UTF_8);
        if (output.length() > MAX_CAPTURED_CHARS) {
            return output.substring(0, MAX_CAPTURED_CHARS) + "... (truncated)";
        }
        return output;
    }
}
