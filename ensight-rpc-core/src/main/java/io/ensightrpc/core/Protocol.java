package io.ensightrpc.core;

/**
 * Constants of the engine RPC contract.
 */
public final class Protocol {
    private Protocol() {}

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 12345;

    // Per-call metadata
    public static final String MD_SHARED_SECRET = "shared_secret";

    // Notification URLs: grpc://{session-id}/{tag}?enum={attribute}&uid={object-id}
    public static final String NOTIFY_SCHEME = "grpc";
    public static final String Q_ENUM = "enum";
    public static final String Q_UID = "uid";

    // Object descriptions emitted by evaluated-mode results
    public static final String M_CLASS = "Class: ";
    public static final String M_OBJECT_ID = "CvfObjID:";
    public static final String M_CACHED = ", cached:";

    // Remote expressions
    public static final String WRAP_ID = "ensight.objs.wrap_id";
    public static final String ENUMS = "ensight.objs.enums";
    public static final String ADD_CALLBACK = "ensight.objs.addcallback";
    public static final String REMOVE_CALLBACK = "ensight.objs.removecallback";
    public static final String FLAG_COMPRESS = "ensight.objs.EVENTMAP_FLAG_COMP_GLOBAL";

    public static final String MSG_CONNECTION_DROPPED = "gRPC connection dropped";
    public static final String MSG_REMOTE_ERROR = "Remote execution error";
}
