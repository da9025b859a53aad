package com.compara.model;

/**
 * Lifecycle of one model within a comparison. Transitions only move forward.
 */
public enum ModelStreamState {
    PENDING,
    RUNNING,
    TIMED_OUT,
    DONE,
    ERRORED;

    public boolean isTerminal() {
        return this == TIMED_OUT || this == DONE || this == ERRORED;
    }

    public boolean canTransitionTo(ModelStreamState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next.isTerminal();
            case RUNNING -> next.isTerminal();
            case TIMED_OUT, DONE, ERRORED -> false;
        };
    }
}
