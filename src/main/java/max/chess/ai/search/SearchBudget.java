package max.chess.ai.search;

import java.time.Clock;

/**
 * Node and time allowance for one depth iteration. Shared by the whole recursive descent,
 * polled at every node.
 */
public final class SearchBudget {
    public static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long nodeLimit;
    private final long deadlineMillis;
    private final Clock clock;
    private long nodes;

    /**
     * @param nodeLimit      maximum nodes to visit, 0 for no limit
     * @param deadlineMillis absolute {@link Clock#millis()} value, or {@link #NO_DEADLINE}
     */
    public SearchBudget(long nodeLimit, long deadlineMillis, Clock clock) {
        this.nodeLimit = nodeLimit <= 0 ? Long.MAX_VALUE : nodeLimit;
        this.deadlineMillis = deadlineMillis;
        this.clock = clock;
    }

    public static SearchBudget unlimited() {
        return new SearchBudget(0, NO_DEADLINE, Clock.systemUTC());
    }

    public boolean nodesExhausted() {
        return nodes >= nodeLimit;
    }

    public boolean deadlinePassed() {
        return deadlineMillis != NO_DEADLINE && clock.millis() >= deadlineMillis;
    }

    void visit() {
        nodes++;
    }

    public long nodes() {
        return nodes;
    }
}
