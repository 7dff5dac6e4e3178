package io.petitions.mover.model;

/**
 * Counters for one drain of one queue into one table.
 *
 * <p>{@code retrieved} counts every claimed item, so
 * {@code retrieved == saved + skipped + failed + malformed} always holds. {@code queued} is the
 * queue depth observed before the first claim.</p>
 */
public record BatchResult(String queue,
                          String table,
                          int queued,
                          int retrieved,
                          int saved,
                          int skipped,
                          int failed,
                          int malformed) {

    public boolean clean() {
        return failed == 0 && malformed == 0;
    }
}
