package com.agentmux.core.error;

public class CapacityExceededException extends AgentmuxException {

    private final int limit;

    public CapacityExceededException(int requested, int live, int limit) {
        super(ErrorKind.CAPACITY_EXCEEDED,
                "Cannot spawn " + requested + " session(s): " + live + " of " + limit + " slots in use");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
