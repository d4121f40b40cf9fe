package com.jobprogress.core;

/**
 * Result of one atomic check-remove-decrement step performed by a backend.
 *
 * <p>Each constant carries the integer code returned by the Redis completion script so the
 * Redis backend can map replies without a lookup table.</p>
 */
public enum CompletionOutcome {
    /** No job record exists for the id. */
    NO_SUCH_JOB(-1),
    /** The index is not in {@code [0, total)}. */
    INDEX_OUT_OF_RANGE(-2),
    /** The part had already been removed by an earlier call; nothing changed. */
    ALREADY_COMPLETE(0),
    /** The part was removed and remaining was decremented, but parts are still pending. */
    PART_COMPLETED(1),
    /** The part was removed and this call drove remaining to zero. */
    JOB_COMPLETED(2);

    private final int code;

    CompletionOutcome(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Resolve a script reply code.
     *
     * @param code the numeric reply
     * @return the matching outcome
     * @throws IllegalArgumentException if the code is unknown
     */
    public static CompletionOutcome fromCode(long code) {
        for (CompletionOutcome outcome : values()) {
            if (outcome.code == code) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown completion code: " + code);
    }
}
