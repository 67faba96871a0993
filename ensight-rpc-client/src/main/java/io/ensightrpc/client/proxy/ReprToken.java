package io.ensightrpc.client.proxy;

import java.util.Objects;

/**
 * A span of an evaluated-mode result: either plain literal text or an object description.
 */
public sealed interface ReprToken permits ReprToken.Literal, ReprToken.ObjectRef {

    /**
     * Text copied through unchanged.
     *
     * @param text the span
     */
    record Literal(String text) implements ReprToken {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * One {@code Class: <name>, ..., CvfObjID: <id>, cached:<yes|no>} description.
     *
     * @param className the class name as reported, before subtype resolution
     * @param objectId the remote identity
     * @param cached the engine's own cached flag; informational only
     * @param start offset of {@code Class: } in the scanned text
     * @param end offset just past the cached flag
     */
    record ObjectRef(String className, long objectId, boolean cached, int start, int end) implements ReprToken {
        public ObjectRef {
            Objects.requireNonNull(className, "className");
        }
    }
}
