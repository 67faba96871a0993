package io.ensightrpc.core;

/**
 * Base class for failures that are not transport failures.
 *
 * <p>Transport failures are reported as {@link EngineConnectionException}, a checked
 * {@link java.io.IOException}. Everything here is either a failure reported by the engine
 * after a successful round-trip, or a violated precondition detected locally.
 */
public abstract class EnsightRpcException extends RuntimeException {

    protected EnsightRpcException(String message) {
        super(message);
    }

    protected EnsightRpcException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the engine answers with a negative error code.
     */
    public static class RemoteExecutionFailed extends EnsightRpcException {
        public RemoteExecutionFailed() {
            super(Protocol.MSG_REMOTE_ERROR);
        }

        public RemoteExecutionFailed(String message) {
            super(message);
        }
    }

    /**
     * Raised when a callback is registered under a short tag that is already taken.
     */
    public static class DuplicateCallback extends EnsightRpcException {
        public DuplicateCallback(String shortTag) {
            super("A callback for tag '" + shortTag + "' already exists");
        }
    }

    /**
     * Raised when unregistering a tag that has no registration.
     */
    public static class UnknownCallback extends EnsightRpcException {
        public UnknownCallback(String tag) {
            super("A callback for tag '" + tag + "' does not exist");
        }
    }

    /**
     * Raised when an evaluated-mode result cannot be turned into local values.
     */
    public static class MalformedResult extends EnsightRpcException {
        private final String text;
        private final int position;

        public MalformedResult(String message, String text, int position) {
            super(message + " at position " + position);
            this.text = text;
            this.position = position;
        }

        /**
         * @return the text that failed to parse
         */
        public String text() {
            return text;
        }

        /**
         * @return offset into {@link #text()} where parsing stopped
         */
        public int position() {
            return position;
        }
    }
}
