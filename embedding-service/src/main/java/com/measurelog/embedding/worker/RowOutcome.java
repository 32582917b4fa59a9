package com.measurelog.embedding.worker;

/**
 * What one embedding invocation did to one row.
 */
public record RowOutcome(Long id, Result result, String reason) {

    public enum Result {
        COMPLETED, // embedding written
        FAILED, // marked failed; reason says why
        SKIPPED // deadline reached before the model call; row still pending
    }

    public static RowOutcome completed(Long id) {
        return new RowOutcome(id, Result.COMPLETED, null);
    }

    public static RowOutcome failed(Long id, String reason) {
        return new RowOutcome(id, Result.FAILED, reason);
    }

    public static RowOutcome skipped(Long id) {
        return new RowOutcome(id, Result.SKIPPED, "deadline reached");
    }

    public boolean isCompleted() {
        return result == Result.COMPLETED;
    }
}
