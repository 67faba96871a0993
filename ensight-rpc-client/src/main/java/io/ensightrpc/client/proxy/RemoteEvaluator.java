package io.ensightrpc.client.proxy;

import io.ensightrpc.core.EngineConnectionException;

/**
 * The owner of proxies: evaluates and executes command strings in the engine.
 */
public interface RemoteEvaluator {

    /**
     * Evaluates an expression remotely and marshals the result.
     *
     * @return the local value; object references become {@link ProxyHandle}s
     */
    Object eval(String expression) throws EngineConnectionException;

    /**
     * Executes a statement remotely. Nothing is returned.
     */
    void exec(String statement) throws EngineConnectionException;
}
