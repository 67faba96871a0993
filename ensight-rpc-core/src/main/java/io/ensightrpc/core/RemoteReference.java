package io.ensightrpc.core;

/**
 * Something that names an object living in the engine.
 */
@FunctionalInterface
public interface RemoteReference {

    /**
     * @return a Python expression that evaluates to the object inside the engine
     */
    String remoteExpression();
}
