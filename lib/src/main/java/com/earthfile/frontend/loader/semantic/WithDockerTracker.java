package com.earthfile.frontend.loader.semantic;

/**
 * Pairs {@code WITH DOCKER} with its {@code END} and allows exactly one RUN in between. Only one
 * block can be open at a time.
 */
final class WithDockerTracker {

    enum State {
        IDLE,
        AWAITING_RUN,
        RUN_DONE
    }

    private State state = State.IDLE;
    private WithDockerBlock block;

    State getState() {
        return state;
    }

    boolean isOpen() {
        return state != State.IDLE;
    }

    void requireIdle() throws StateInvariantException {
        if (state != State.IDLE) {
            throw new StateInvariantException("cannot use WITH DOCKER within WITH DOCKER");
        }
    }

    void open(WithDockerBlock opened) throws StateInvariantException {
        requireIdle();
        block = opened;
        state = State.AWAITING_RUN;
    }

    /** Marks the block's RUN as taken and returns the configuration it runs with. */
    WithDockerBlock beginRun() throws StateInvariantException {
        switch (state) {
            case IDLE:
                throw new IllegalStateException("no WITH DOCKER block is open");
            case RUN_DONE:
                throw new StateInvariantException("only one RUN command allowed in WITH DOCKER");
            default:
                state = State.RUN_DONE;
                return block;
        }
    }

    void close() throws StateInvariantException {
        switch (state) {
            case IDLE:
                throw new StateInvariantException("END can only be used to end a WITH DOCKER clause");
            case AWAITING_RUN:
                throw new StateInvariantException("no RUN command found in WITH DOCKER");
            default:
                state = State.IDLE;
                block = null;
        }
    }

    void requireClosed() throws StateInvariantException {
        if (state != State.IDLE) {
            throw new StateInvariantException("no matching END found for WITH DOCKER");
        }
    }
}
