package com.docloom.source;

public record SourceOutcome(String source, Status status, int documentCount, String detail) {

    public enum Status {
        LOADED,
        SKIPPED,
        FAILED,
        TIMED_OUT
    }

    static SourceOutcome loaded(String source, int documentCount) {
        return new SourceOutcome(source, Status.LOADED, documentCount, "");
    }

    static SourceOutcome skipped(String source, String reason) {
        return new SourceOutcome(source, Status.SKIPPED, 0, reason);
    }

    static SourceOutcome failed(String source, String detail) {
        return new SourceOutcome(source, Status.FAILED, 0, detail);
    }

    static SourceOutcome timedOut(String source, String detail) {
        return new SourceOutcome(source, Status.TIMED_OUT, 0, detail);
    }

    public boolean isFailure() {
        return status == Status.FAILED || status == Status.TIMED_OUT;
    }
}
