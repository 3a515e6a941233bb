package com.taskgraph.engine.graph;

/**
 * Result of evaluating a waiting node's dependencies.
 *
 * @param state READY, WAITING or BLOCKED
 * @param reason Why the node is not ready, null when it is
 * @param cause The upstream or owner responsible for a block, if any
 */
public record Readiness(State state, String reason, String cause) {

    public enum State {
        /** Every dependency and structural gate is satisfied. */
        READY,
        /** Something upstream is still in progress. */
        WAITING,
        /** Can never become ready; the node is cancelled. */
        BLOCKED
    }

    private static final Readiness READY_RESULT = new Readiness(State.READY, null, null);

    public static Readiness ready() {
        return READY_RESULT;
    }

    public static Readiness waiting(String reason) {
        return new Readiness(State.WAITING, reason, null);
    }

    public static Readiness blocked(String reason, String cause) {
        return new Readiness(State.BLOCKED, reason, cause);
    }

    public boolean isReady() {
        return state == State.READY;
    }

    public boolean isBlocked() {
        return state == State.BLOCKED;
    }
}
