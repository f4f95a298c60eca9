package jsonwriter;

import static jsonwriter.Json.isClassPresent;

/**
 * Encodes Protocol Buffers messages, builders and enums.
 *
 * <p> Registered through {@code META-INF/services}, inactive when protobuf-java is not on the classpath. This class
 * refers to no protobuf type, so {@link java.util.ServiceLoader} can always instantiate it; the work is done by
 * {@link ProtobufSupport}. Fields are streamed in descriptor order under their JSON names; well-known types use
 * their canonical JSON mapping.
 *
 * @since 0.1.0
 */
public final class ProtobufEncoder implements Json.ValueEncoder {

    private static final boolean PROTOBUF_PRESENT = isClassPresent("com.google.protobuf.Message");

    public ProtobufEncoder() {}

    @Override
    public boolean canEncode(Object o) {
        return PROTOBUF_PRESENT && ProtobufSupport.isProtobuf(o);
    }

    @Override
    public void encode(JsonWriter out, Object o) {
        ProtobufSupport.encode(out, o);
    }
}
