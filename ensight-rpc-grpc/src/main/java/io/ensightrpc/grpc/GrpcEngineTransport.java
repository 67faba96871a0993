package io.ensightrpc.grpc;

import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.ExecMode;
import io.ensightrpc.core.transport.EngineTransport;
import io.ensightrpc.core.transport.EventSubscription;
import io.ensightrpc.core.transport.PythonReply;
import io.ensightrpc.core.transport.RenderOptions;
import io.ensightrpc.grpc.proto.EnSightServiceGrpc;
import io.ensightrpc.grpc.proto.EnsightProto;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.MetadataUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link EngineTransport} over a gRPC {@link ManagedChannel}.
 *
 * <p>Any {@link StatusRuntimeException} is reported as a dropped connection.
 */
public final class GrpcEngineTransport implements EngineTransport {

    private static final Logger log = LoggerFactory.getLogger(GrpcEngineTransport.class);

    private final ManagedChannel channel;
    private final EnSightServiceGrpc.EnSightServiceBlockingStub stub;

    public GrpcEngineTransport(ManagedChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.stub = EnSightServiceGrpc.newBlockingStub(channel);
    }

    @Override
    public PythonReply runPython(ExecMode mode, String command, Map<String, String> metadata) throws EngineConnectionException {
        EnsightProto.PythonRequest request = EnsightProto.PythonRequest.newBuilder()
                .setType(execType(mode))
                .setCommand(command)
                .build();
        try {
            EnsightProto.PythonReply reply = stub(metadata).runPython(request);
            return new PythonReply(reply.getError(), reply.getValue());
        } catch (StatusRuntimeException e) {
            throw EngineConnectionException.dropped(e);
        }
    }

    @Override
    public byte[] renderImage(RenderOptions options, Map<String, String> metadata) throws EngineConnectionException {
        EnsightProto.RenderRequest request = EnsightProto.RenderRequest.newBuilder()
                .setType(options.png() ? EnsightProto.RenderRequest.ImageType.IMAGE_PNG : EnsightProto.RenderRequest.ImageType.IMAGE_RAW)
                .setImageWidth(options.width())
                .setImageHeight(options.height())
                .setImageAaPasses(options.aaPasses())
                .setIncludeHighlighting(options.highlighting())
                .build();
        try {
            return stub(metadata).renderImage(request).getValue().toByteArray();
        } catch (StatusRuntimeException e) {
            throw EngineConnectionException.dropped(e);
        }
    }

    @Override
    public byte[] geometry(Map<String, String> metadata) throws EngineConnectionException {
        EnsightProto.GeometryRequest request = EnsightProto.GeometryRequest.newBuilder()
                .setType(EnsightProto.GeometryRequest.GeomType.GEOMETRY_GLB)
                .build();
        try {
            return stub(metadata).getGeometry(request).getValue().toByteArray();
        } catch (StatusRuntimeException e) {
            throw EngineConnectionException.dropped(e);
        }
    }

    @Override
    public void exit(Map<String, String> metadata) throws EngineConnectionException {
        try {
            stub(metadata).exit(EnsightProto.ExitRequest.getDefaultInstance());
        } catch (StatusRuntimeException e) {
            throw EngineConnectionException.dropped(e);
        }
    }

    @Override
    public EventSubscription openEventStream(String prefix, Map<String, String> metadata) throws EngineConnectionException {
        EnsightProto.EventStreamRequest request = EnsightProto.EventStreamRequest.newBuilder()
                .setPrefix(prefix)
                .build();
        // The call binds to the context current at start; cancelling it ends the stream.
        Context.CancellableContext context = Context.current().withCancellation();
        Context previous = context.attach();
        try {
            Iterator<EnsightProto.EventReply> replies = stub(metadata).getEventStream(request);
            return new GrpcEventSubscription(context, replies);
        } catch (StatusRuntimeException e) {
            context.cancel(e);
            throw EngineConnectionException.dropped(e);
        } finally {
            context.detach(previous);
        }
    }

    @Override
    public void close() {
        if (channel.isShutdown()) {
            return;
        }
        channel.shutdownNow();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("gRPC channel did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private EnSightServiceGrpc.EnSightServiceBlockingStub stub(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return stub;
        }
        Metadata headers = new Metadata();
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                headers.put(Metadata.Key.of(e.getKey(), Metadata.ASCII_STRING_MARSHALLER), e.getValue());
            }
        }
        return stub.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
    }

    private static EnsightProto.PythonRequest.ExecType execType(ExecMode mode) {
        return switch (mode) {
            case NO_RESULT -> EnsightProto.PythonRequest.ExecType.EXEC_NO_RESULT;
            case EVALUATED -> EnsightProto.PythonRequest.ExecType.EXEC_RETURN_PYTHON;
            case STRUCTURED -> EnsightProto.PythonRequest.ExecType.EXEC_RETURN_JSON;
        };
    }
}
