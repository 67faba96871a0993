package io.ensightrpc.grpc;

import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.transport.EventSubscription;
import io.ensightrpc.grpc.proto.EnsightProto;
import io.grpc.Context;
import io.grpc.StatusRuntimeException;

import java.io.IOException;
import java.util.Iterator;

/**
 * Blocking iterator over a {@code GetEventStream} call, cancellable through its context.
 */
final class GrpcEventSubscription implements EventSubscription {

    private final Context.CancellableContext context;
    private final Iterator<EnsightProto.EventReply> replies;

    GrpcEventSubscription(Context.CancellableContext context, Iterator<EnsightProto.EventReply> replies) {
        this.context = context;
        this.replies = replies;
    }

    @Override
    public String next() throws IOException {
        try {
            if (!replies.hasNext()) {
                return null;
            }
            return replies.next().getTag();
        } catch (StatusRuntimeException e) {
            throw EngineConnectionException.dropped(e);
        }
    }

    @Override
    public void close() {
        context.cancel(null);
    }
}
