package com.adlanda.repoindexer.vcs;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs git commands. Implementations never throw; every failure is reported
 * as a {@link VcsResult} failure.
 */
public interface VcsCommandRunner {

    /**
     * Runs {@code git <args>} in the given directory.
     *
     * @param workingDir Directory the command runs in
     * @param args       Arguments after the executable
     * @param timeout    Upper bound on the call; the process is killed when exceeded
     */
    VcsResult<CommandOutput> run(Path workingDir, List<String> args, Duration timeout);
}
