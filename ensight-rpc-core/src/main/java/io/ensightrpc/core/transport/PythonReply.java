package io.ensightrpc.core.transport;

/**
 * Raw reply to a command.
 *
 * @param error engine status code; negative on failure
 * @param value the reply text, empty when nothing was returned
 */
public record PythonReply(int error, String value) {
    public PythonReply {
        value = value == null ? "" : value;
    }

    public boolean failed() {
        return error < 0;
    }
}
