package com.adlanda.repoindexer.vcs;

import com.adlanda.repoindexer.config.VcsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the git executable as a subprocess.
 *
 * Standard output goes to a temporary file rather than a pipe, so a chatty
 * command cannot block on a full pipe buffer while we wait for it to exit.
 */
@Component
public class ProcessVcsCommandRunner implements VcsCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessVcsCommandRunner.class);

    private final String executable;

    public ProcessVcsCommandRunner(VcsProperties properties) {
        this.executable = properties.getExecutable();
    }

    @Override
    public VcsResult<CommandOutput> run(Path workingDir, List<String> args, Duration timeout) {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(executable);
        command.addAll(args);

        Path stdout = null;
        Process process = null;
        try {
            stdout = Files.createTempFile("vcs-", ".out");
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDir.toFile());
            builder.redirectOutput(stdout.toFile());
            builder.redirectError(ProcessBuilder.Redirect.DISCARD);
            builder.redirectInput(ProcessBuilder.Redirect.PIPE);

            process = builder.start();
            process.getOutputStream().close();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return VcsResult.failure(VcsError.Kind.TIMEOUT,
                        String.join(" ", command) + " exceeded " + timeout.toMillis() + "ms");
            }

            String output = new String(Files.readAllBytes(stdout), StandardCharsets.UTF_8);
            return VcsResult.ok(new CommandOutput(process.exitValue(), output));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            return VcsResult.failure(VcsError.Kind.TIMEOUT, "Interrupted: " + String.join(" ", command));
        } catch (IOException e) {
            // Also raised when the executable is not on PATH
            return VcsResult.failure(VcsError.Kind.IO_ERROR, e.getMessage());
        } finally {
            if (stdout != null) {
                try {
                    Files.deleteIfExists(stdout);
                } catch (IOException e) {
                    log.debug("Could not delete temporary output {}: {}", stdout, e.getMessage());
                }
            }
        }
    }
}
