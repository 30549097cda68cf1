package domain.model;

/**
 * Immutable snapshot of run counters, attached to every {@link SearchOutcome}.
 *
 * <p>Advisory telemetry only: no counter takes part in any search decision.
 */
public final class SearchStatistics {

    private final long expansions;
    private final int settledCount;
    private final int openCount;
    private final long deadCount;
    private final long staleSkipped;
    private final long candidatesGenerated;
    private final long candidatesAccepted;
    private final long elapsedMs;

    public SearchStatistics(long expansions, int settledCount, int openCount, long deadCount,
                            long staleSkipped, long candidatesGenerated, long candidatesAccepted,
                            long elapsedMs) {
        this.expansions = expansions;
        this.settledCount = settledCount;
        this.openCount = openCount;
        this.deadCount = deadCount;
        this.staleSkipped = staleSkipped;
        this.candidatesGenerated = candidatesGenerated;
        this.candidatesAccepted = candidatesAccepted;
        this.elapsedMs = elapsedMs;
    }

    /** Number of nodes popped from the frontier. */
    public long getExpansions() { return expansions; }

    /** Number of values with proven-minimal cost. */
    public int getSettledCount() { return settledCount; }

    /** Live frontier entries when the search stopped. */
    public int getOpenCount() { return openCount; }

    /** Frontier entries evicted because they could no longer beat the goal bound. */
    public long getDeadCount() { return deadCount; }

    /** Superseded frontier records skipped during extraction. */
    public long getStaleSkipped() { return staleSkipped; }

    public long getCandidatesGenerated() { return candidatesGenerated; }
    public long getCandidatesAccepted() { return candidatesAccepted; }
    public long getElapsedMs() { return elapsedMs; }

    @Override
    public String toString() {
        return "SearchStatistics{expansions=" + expansions
            + ", settled=" + settledCount
            + ", open=" + openCount
            + ", dead=" + deadCount
            + ", staleSkipped=" + staleSkipped
            + ", generated=" + candidatesGenerated
            + ", accepted=" + candidatesAccepted
            + ", elapsedMs=" + elapsedMs + "}";
    }
}
