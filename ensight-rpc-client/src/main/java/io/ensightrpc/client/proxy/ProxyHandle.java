package io.ensightrpc.client.proxy;

import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.Protocol;
import io.ensightrpc.core.PythonRepr;
import io.ensightrpc.core.RemoteReference;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Local stand-in for one remote engine object.
 *
 * <p>Handles are created only by the {@link ResultMarshaller} and are identity-stable:
 * while the owning cache holds an entry for an object id, every result naming that id
 * yields this same instance.
 */
public final class ProxyHandle implements RemoteReference {
    private final RemoteEvaluator owner;
    private final long objectId;
    private final String className;
    private final Discriminator discriminator;

    /**
     * The attribute that selected a subclass, recorded when subtype resolution succeeded.
     *
     * @param attribute attribute enum name, such as {@code PARTTYPE}
     * @param attributeId numeric attribute id, when the session knew it
     * @param value the value the engine reported
     */
    public record Discriminator(String attribute, OptionalInt attributeId, int value) {
        public Discriminator {
            Objects.requireNonNull(attribute, "attribute");
            Objects.requireNonNull(attributeId, "attributeId");
        }
    }

    ProxyHandle(RemoteEvaluator owner, long objectId, String className, Discriminator discriminator) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.objectId = objectId;
        this.className = Objects.requireNonNull(className, "className");
        this.discriminator = discriminator;
    }

    public long objectId() {
        return objectId;
    }

    /**
     * @return the resolved class name, such as {@code ENS_PART_MODEL}
     */
    public String className() {
        return className;
    }

    public Optional<Discriminator> discriminator() {
        return Optional.ofNullable(discriminator);
    }

    /**
     * True when this handle's class is {@code baseClass} or one of its resolved subclasses.
     */
    public boolean isA(String baseClass) {
        return className.equals(baseClass) || className.startsWith(baseClass + "_");
    }

    @Override
    public String remoteExpression() {
        return Protocol.WRAP_ID + "(" + objectId + ")";
    }

    /**
     * Reads one attribute of the remote object.
     *
     * @param attribute an attribute name or a numeric attribute id
     */
    public Object getAttr(Object attribute) throws EngineConnectionException {
        return owner.eval(remoteExpression() + ".getattr(" + PythonRepr.repr(attribute) + ")");
    }

    public void setAttr(Object attribute, Object value) throws EngineConnectionException {
        owner.exec(remoteExpression() + ".setattr(" + PythonRepr.repr(attribute) + ", " + PythonRepr.repr(value) + ")");
    }

    @Override
    public String toString() {
        return className + "(" + objectId + ")";
    }
}
