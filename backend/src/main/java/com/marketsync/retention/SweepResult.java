package com.marketsync.retention;

/**
 * archived counts documents newly copied to the archive; deleted counts documents removed from the source.
 * After a partial failure a re-run may delete documents it did not archive itself.
 */
public record SweepResult(long archived, long deleted) {

    public static final SweepResult EMPTY = new SweepResult(0, 0);

    public SweepResult plus(SweepResult other) {
        return new SweepResult(archived + other.archived, deleted + other.deleted);
    }
}
