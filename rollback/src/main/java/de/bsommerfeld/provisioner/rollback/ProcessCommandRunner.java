package de.bsommerfeld.provisioner.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands through {@code sh -c} with stderr merged into stdout. A
 * command exceeding the timeout is force-killed.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Duration timeout;

    public ProcessCommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public CommandResult run(String command) throws IOException, InterruptedException {
        LOG.debug("Running: {}", command);
        Process process = new ProcessBuilder("sh", "-c", command)
                .redirectErrorStream(true)
                .start();
        process.getOutputStream().close();

        StringBuilder output = new StringBuilder();
        Thread reader = new Thread(() -> drain(process.getInputStream(), output), "rollback-output");
        reader.setDaemon(true);
        reader.start();

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            LOG.warn("Command timed out after {}s: {}", timeout.toSeconds(), command);
            reader.join(1000);
            return new CommandResult(-1, snapshot(output), true);
        }

        reader.join();
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            LOG.debug("Command exited with code {}: {}", exitCode, command);
        }
        return new CommandResult(exitCode, snapshot(output), false);
    }

    private static void drain(InputStream in, StringBuilder sink) {
        try (in) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            synchronized (sink) {
                sink.append(text);
            }
        } catch (IOException e) {
            LOG.debug("Stopped reading command output: {}", e.getMessage());
        }
    }

    private static String snapshot(StringBuilder output) {
        synchronized (output) {
            return output.toString().strip();
        }
    }
}
