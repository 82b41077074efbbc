package com.adlanda.repoindexer.vcs;

/**
 * Why a git query produced no value.
 */
public record VcsError(Kind kind, String message) {

    public enum Kind {
        UNAVAILABLE,
        NOT_A_REPOSITORY,
        TIMEOUT,
        COMMAND_FAILED,
        IO_ERROR
    }

    public static VcsError of(Kind kind, String message) {
        return new VcsError(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
