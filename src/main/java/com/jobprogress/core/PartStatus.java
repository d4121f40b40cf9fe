package com.jobprogress.core;

/** Completion state of a single part, as returned by {@link ProgressStore#status(String, int)}. */
public final class PartStatus {
    private final int part;
    private final boolean complete;

    PartStatus(int part, boolean complete) {
        this.part = part;
        this.complete = complete;
    }

    public int getPart() {
        return part;
    }

    public boolean isComplete() {
        return complete;
    }

    @Override
    public String toString() {
        return "PartStatus{part=" + part + ", complete=" + complete + "}";
    }
}
