package com.docloom.git;

import java.util.List;

/**
 * Outcome of one {@code git} invocation; {@code arguments} excludes the {@code git} executable.
 * {@code exitCode} is only meaningful when the process exited on its own.
 */
public record GitCommandResult(List<String> arguments, Status status, int exitCode, String stdout, String stderr) {

    public enum Status {
        EXITED,
        TIMED_OUT,
        INTERRUPTED,
        NOT_STARTED
    }

    public GitCommandResult {
        arguments = List.copyOf(arguments);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    static GitCommandResult exited(List<String> arguments, int exitCode, String stdout, String stderr) {
        return new GitCommandResult(arguments, Status.EXITED, exitCode, stdout, stderr);
    }

    static GitCommandResult timedOut(List<String> arguments, String stderr) {
        return new GitCommandResult(arguments, Status.TIMED_OUT, -1, "", stderr);
    }

    static GitCommandResult interrupted(List<String> arguments) {
        return new GitCommandResult(arguments, Status.INTERRUPTED, -1, "", "");
    }

    static GitCommandResult notStarted(List<String> arguments, String reason) {
        return new GitCommandResult(arguments, Status.NOT_STARTED, -1, "", reason);
    }

    public boolean isSuccess() {
        return status == Status.EXITED && exitCode == 0;
    }

    public String commandLine() {
        return "git " + String.join(" ", arguments);
    }

    public String describe() {
        return switch (status) {
            case EXITED -> "exitCode=" + exitCode + " stderr=" + stderr;
            case TIMED_OUT -> stderr.isEmpty() ? "timed out" : "timed out stderr=" + stderr;
            case INTERRUPTED -> "interrupted";
            case NOT_STARTED -> "could not start git: " + stderr;
        };
    }
}
