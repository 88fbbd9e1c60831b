package io.github.sigwasm.core.dom;

import java.io.Serializable;

/**
 * An event handler.
 * <p>
 * Handlers are compiled from their bytecode, so they must be written as lambdas that capture only
 * signal getters, signal setters and primitive constants.
 */
@FunctionalInterface
public interface Handler extends Serializable {
    void handle();
}
