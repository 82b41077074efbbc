package com.adlanda.repoindexer.vcs;

/**
 * Exit code and standard output of a finished git invocation.
 */
public record CommandOutput(int exitCode, String stdout) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
