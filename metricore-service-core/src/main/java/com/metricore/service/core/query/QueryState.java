package com.metricore.service.core.query;

/** Lifecycle of a query run. Every state may move to {@link #FAILED}; otherwise states advance in order. */
public enum QueryState {
    PARSED,
    RESOLVED,
    AGGREGATED,
    EVALUATED,
    FILTERED,
    RESPONDED,
    FAILED;

    public boolean isTerminal() {
        return this == RESPONDED || this == FAILED;
    }

    boolean canAdvanceTo(QueryState next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() == ordinal() + 1;
    }
}
