package com.substitution.solver.solver;

/**
 * Optional cap on the number of mappings the stages may produce in one run.
 * Once spent, stages stop fanning out and the traversal unwinds normally.
 */
public class SearchBudget {

    private final long limit;
    private long produced;
    private boolean exhausted;

    private SearchBudget(long limit) {
        this.limit = limit;
    }

    public static SearchBudget unlimited() {
        return new SearchBudget(0);
    }

    /**
     * @param limit maximum mappings to produce; 0 or less means unlimited
     */
    public static SearchBudget of(long limit) {
        return new SearchBudget(Math.max(0, limit));
    }

    /**
     * Claim one unit. Returns false, and marks the budget exhausted, once the limit
     * has been reached.
     */
    public boolean tryConsume() {
        if (limit > 0 && produced >= limit) {
            exhausted = true;
            return false;
        }
        produced++;
        return true;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public long getProduced() {
        return produced;
    }

    public long getLimit() {
        return limit;
    }
}
