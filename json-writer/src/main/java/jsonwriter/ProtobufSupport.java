package jsonwriter;

import com.google.protobuf.BoolValueOrBuilder;
import com.google.protobuf.ByteString;
import com.google.protobuf.BytesValueOrBuilder;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DoubleValueOrBuilder;
import com.google.protobuf.DurationOrBuilder;
import com.google.protobuf.EmptyOrBuilder;
import com.google.protobuf.FieldMaskOrBuilder;
import com.google.protobuf.FloatValueOrBuilder;
import com.google.protobuf.Int32ValueOrBuilder;
import com.google.protobuf.Int64ValueOrBuilder;
import com.google.protobuf.ListValueOrBuilder;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.NullValue;
import com.google.protobuf.ProtocolMessageEnum;
import com.google.protobuf.ProtocolStringList;
import com.google.protobuf.StringValueOrBuilder;
import com.google.protobuf.StructOrBuilder;
import com.google.protobuf.TimestampOrBuilder;
import com.google.protobuf.UInt32ValueOrBuilder;
import com.google.protobuf.UInt64ValueOrBuilder;
import com.google.protobuf.Value;
import com.google.protobuf.ValueOrBuilder;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

/**
 * Protocol Buffers side of {@link ProtobufEncoder}. Only loaded once protobuf-java is known to be present.
 *
 * @since 0.1.0
 */
final class ProtobufSupport {

    private ProtobufSupport() {
        throw new UnsupportedOperationException();
    }

    static void encode(JsonWriter out, Object o) {
        if (o instanceof MessageOrBuilder message) writeMessage(out, message);
        else if (o instanceof ProtocolStringList list) writeStrings(out, list);
        else writeEnum(out, o);
    }

    static boolean isProtobuf(Object o) {
        return o instanceof MessageOrBuilder
                || o instanceof ProtocolMessageEnum
                || o instanceof Descriptors.EnumValueDescriptor
                || o instanceof ProtocolStringList;
    }

    // ============================================================
    // Messages
    // ============================================================

    static void writeMessage(JsonWriter out, MessageOrBuilder message) {
        if (writeWellKnown(out, message)) return;

        var object = out.beginObject();
        for (var field : message.getDescriptorForType().getFields()) {
            if (unsetOptionalField(message, field)) continue;
            writeField(object, field, message.getField(field));
        }
        object.end();
    }

    static boolean unsetOptionalField(MessageOrBuilder message, Descriptors.FieldDescriptor field) {
        if (field.isRepeated()) return false;
        // unset message fields are skipped, otherwise self-referencing types would recurse forever
        if (field.getJavaType() == Descriptors.FieldDescriptor.JavaType.MESSAGE && !message.hasField(field)) {
            return true;
        }
        // oneof members other than the one that is set
        if (field.getContainingOneof() != null && !message.hasField(field)) return true;
        // proto3 `optional`
        return field.hasPresence() && !message.hasField(field);
    }

    static void writeField(ObjectBuilder object, Descriptors.FieldDescriptor field, Object value) {
        var name = field.getJsonName();
        if (field.isMapField()) {
            var map = object.object(name);
            var keyField = field.getMessageType().findFieldByNumber(1);
            var valueField = field.getMessageType().findFieldByNumber(2);
            for (var entry : (List<?>) value) {
                var e = (MessageOrBuilder) entry;
                var key = String.valueOf(singleValue(e.getField(keyField), keyField));
                map.member(key, singleValue(e.getField(valueField), valueField));
            }
            map.end();
        } else if (field.isRepeated()) {
            var array = object.array(name);
            for (var item : (List<?>) value) {
                array.value(singleValue(item, field));
            }
            array.end();
        } else {
            object.member(name, singleValue(value, field));
        }
    }

    /**
     * Maps a singular field value to something {@link Json.Encoder} writes the way the protobuf JSON mapping wants.
     */
    static Object singleValue(Object value, Descriptors.FieldDescriptor field) {
        return switch (field.getType()) {
            case UINT32, FIXED32 -> Integer.toUnsignedLong((Integer) value);
            case UINT64, FIXED64 -> unsigned((Long) value);
            case BYTES -> base64((ByteString) value);
            case ENUM -> (Json.Encodable) out -> writeEnum(out, value);
            case MESSAGE, GROUP -> (Json.Encodable) out -> writeMessage(out, (MessageOrBuilder) value);
            default -> value;
        };
    }

    // ============================================================
    // Well-known types
    // ============================================================

    static boolean writeWellKnown(JsonWriter out, MessageOrBuilder message) {
        if (message instanceof TimestampOrBuilder t) {
            out.value(Instant.ofEpochSecond(t.getSeconds(), t.getNanos()).toString());
        } else if (message instanceof DurationOrBuilder d) {
            out.value(Duration.ofSeconds(d.getSeconds(), d.getNanos()).toString());
        } else if (message instanceof StringValueOrBuilder s) {
            out.value(s.getValue());
        } else if (message instanceof BytesValueOrBuilder b) {
            out.value(base64(b.getValue()));
        } else if (message instanceof BoolValueOrBuilder b) {
            out.value(b.getValue());
        } else if (message instanceof DoubleValueOrBuilder d) {
            out.value(d.getValue());
        } else if (message instanceof FloatValueOrBuilder f) {
            out.value(f.getValue());
        } else if (message instanceof Int32ValueOrBuilder i) {
            out.value(i.getValue());
        } else if (message instanceof UInt32ValueOrBuilder u32) {
            out.value(Integer.toUnsignedLong(u32.getValue()));
        } else if (message instanceof Int64ValueOrBuilder i64) {
            out.value(i64.getValue());
        } else if (message instanceof UInt64ValueOrBuilder u64) {
            out.value(unsigned(u64.getValue()));
        } else if (message instanceof FieldMaskOrBuilder mask) {
            out.value(String.join(",", mask.getPathsList()));
        } else if (message instanceof StructOrBuilder struct) {
            writeStruct(out.beginObject(), struct);
        } else if (message instanceof ListValueOrBuilder list) {
            writeList(out.beginArray(), list);
        } else if (message instanceof ValueOrBuilder value) {
            writeValue(out, value);
        } else if (message instanceof EmptyOrBuilder) {
            out.beginObject().end();
        } else {
            return false;
        }
        return true;
    }

    private static void writeStruct(ObjectBuilder object, StructOrBuilder struct) {
        for (var entry : struct.getFieldsMap().entrySet()) {
            var v = entry.getValue();
            object.member(entry.getKey(), (Json.Encodable) out -> writeValue(out, v));
        }
        object.end();
    }

    private static void writeList(ArrayBuilder array, ListValueOrBuilder list) {
        for (Value v : list.getValuesList()) {
            array.value((Json.Encodable) out -> writeValue(out, v));
        }
        array.end();
    }

    private static void writeValue(JsonWriter out, ValueOrBuilder value) {
        switch (value.getKindCase()) {
            case NUMBER_VALUE -> out.value(value.getNumberValue());
            case STRING_VALUE -> out.value(value.getStringValue());
            case BOOL_VALUE -> out.value(value.getBoolValue());
            case STRUCT_VALUE -> writeStruct(out.beginObject(), value.getStructValue());
            case LIST_VALUE -> writeList(out.beginArray(), value.getListValue());
            default -> out.value(null);
        }
    }

    // ============================================================
    // Enums and special types
    // ============================================================

    static void writeEnum(JsonWriter out, Object e) {
        Descriptors.EnumValueDescriptor evd;
        if (e instanceof ProtocolMessageEnum pme) evd = pme.getValueDescriptor();
        else if (e instanceof Descriptors.EnumValueDescriptor d) evd = d;
        else throw new JsonException.EncodeException("Not a protobuf enum", e.getClass(), null);

        if (evd.getType().getFullName().equals(NullValue.getDescriptor().getFullName())) {
            out.value(null);
        } else {
            out.value(evd.getName());
        }
    }

    static void writeStrings(JsonWriter out, ProtocolStringList list) {
        var array = out.beginArray();
        for (var s : list) array.value(s);
        array.end();
    }

    private static BigInteger unsigned(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }

    private static String base64(ByteString bytes) {
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }
}
