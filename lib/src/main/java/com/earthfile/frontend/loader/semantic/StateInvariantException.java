package com.earthfile.frontend.loader.semantic;

/**
 * A statement is valid on its own but not where it appears: push-only violations, WITH DOCKER
 * pairing, reserved or duplicated target names.
 */
public final class StateInvariantException extends InterpreterException {
    StateInvariantException(String message) {
        super(message);
    }
}
