package jsonwriter;

import java.beans.Introspector;
import java.io.IOException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Currency;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.ServiceLoader;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;
import java.util.stream.BaseStream;
import lombok.Builder;
import lombok.Singular;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming JSON writer: values go straight to an {@link Appendable}, no intermediate tree is built.
 *
 * @since 0.1.0
 */
public final class Json {

    private static final Logger LOGGER = LoggerFactory.getLogger(Json.class);

    /**
     * Always written as {@code null}. Unlike {@code null} or {@link Optional#empty()} it does not mean "absent".
     */
    public static final Null NULL = new Null();

    private static final List<ValueEncoder> serviceEncoders = loadEncoders();

    private static final Encoder defaultEncoder = Encoder.builder().build();

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Encode a value into a new string.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.encode("Hello World\n");        // -> "Hello World\n" (escaped)
     * Json.encode(2.0);                    // -> 2
     * Json.encode(List.of(1, 2, 3));       // -> [1,2,3]
     * Json.encode(Map.of("key", "value")); // -> {"key":"value"}
     * }</pre>
     *
     * @param value any value, may be {@code null}
     * @return compact JSON text, never {@code null}
     */
    public static String encode(@Nullable Object value) {
        return defaultEncoder.encode(value);
    }

    /**
     * Encode a value into an existing sink.
     *
     * @param sink  destination, not {@code null}
     * @param value any value, may be {@code null}
     * @throws JsonException.WriteException if the sink fails
     */
    public static void encodeInto(Appendable sink, @Nullable Object value) {
        defaultEncoder.encodeInto(sink, value);
    }

    /**
     * Start writing an object into {@code sink}. Writes <code>{</code> immediately.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var sb = new StringBuilder();
     * var object = Json.beginObject(sb);
     * object.member("number", 42);
     * object.end();
     * // -> {"number":42}
     * }</pre>
     */
    public static ObjectBuilder beginObject(Appendable sink) {
        return defaultEncoder.beginObject(sink);
    }

    /**
     * Start writing an array into {@code sink}. Writes {@code [} immediately.
     */
    public static ArrayBuilder beginArray(Appendable sink) {
        return defaultEncoder.beginArray(sink);
    }

    /**
     * Create a {@link JsonWriter} over {@code sink}, e.g. to close every open builder in one call.
     */
    public static JsonWriter writer(Appendable sink) {
        return defaultEncoder.writer(sink);
    }

    /**
     * Append the escaped body of {@code text}, without the surrounding quotes.
     *
     * <p> For manual composition only: the caller is responsible for a well-formed result.
     */
    public static void escapeInto(Appendable sink, CharSequence text) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(text, "text");
        try {
            StringEscaper.writeEscaped(sink, text);
        } catch (IOException e) {
            throw JsonWriter.writeFailed(e);
        }
    }

    // ============================================================
    // Extension point
    // ============================================================

    /**
     * The JSON {@code null} sentinel, see {@link #NULL}.
     */
    public record Null() {}

    /**
     * A value that writes its own JSON representation.
     *
     * <p> Implementations must write exactly one value through {@code out}, with {@link JsonWriter#value(Object)},
     * {@link JsonWriter#beginObject()} or {@link JsonWriter#beginArray()}. Builders opened and not terminated are
     * closed when the method returns.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * record Point(int x, int y) implements Json.Encodable {
     *     public void encodeJson(JsonWriter out) {
     *         var array = out.beginArray();
     *         array.value(x).value(y);
     *         array.end();
     *     }
     * }
     * Json.encode(new Point(1, 2)); // -> [1,2]
     * }</pre>
     */
    @FunctionalInterface
    public interface Encodable {
        void encodeJson(JsonWriter out);
    }

    /**
     * Encodes values of types that cannot implement {@link Encodable} themselves.
     *
     * <p> Register on {@link Encoder.EncoderBuilder#encoder(ValueEncoder)} or through {@link ServiceLoader}. The
     * same one-value contract as {@link Encodable} applies.
     */
    public interface ValueEncoder {
        boolean canEncode(Object o);

        void encode(JsonWriter out, Object o);
    }

    // ============================================================
    // Encoder
    // ============================================================

    /**
     * Immutable encoding configuration.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var encoder = Json.Encoder.builder()
     *         .encoder(new MoneyEncoder())
     *         .discoverEncoders(false)
     *         .build();
     * encoder.encode(order);
     * }</pre>
     */
    @Builder(toBuilder = true)
    public static final class Encoder {

        @Singular("encoder")
        private final List<ValueEncoder> encoders;

        /**
         * Whether encoders registered through {@link ServiceLoader} are consulted.
         */
        @Builder.Default
        private final boolean discoverEncoders = true;

        public String encode(@Nullable Object value) {
            var sb = new StringBuilder();
            encodeInto(sb, value);
            return sb.toString();
        }

        public void encodeInto(Appendable sink, @Nullable Object value) {
            writer(sink).value(value);
        }

        public ObjectBuilder beginObject(Appendable sink) {
            return writer(sink).beginObject();
        }

        public ArrayBuilder beginArray(Appendable sink) {
            return writer(sink).beginArray();
        }

        public JsonWriter writer(Appendable sink) {
            Objects.requireNonNull(sink, "sink");
            return new JsonWriter(sink, this);
        }

        void write(JsonWriter out, @Nullable Object o) {
            if (o == null || o instanceof Null) {
                out.writeNull();
                return;
            }
            if (o instanceof Encodable e) {
                out.delegate(e);
                return;
            }
            if (writeCustom(out, o)) return;
            if (o instanceof CharSequence s) {
                out.writeString(s);
                return;
            }
            if (o instanceof Character c) {
                out.writeString(String.valueOf(c));
                return;
            }
            if (o instanceof Boolean b) {
                out.writeBoolean(b);
                return;
            }
            if (o instanceof Number n) {
                writeNumber(out, n);
                return;
            }
            if (writeOptional(out, o)) return;
            if (o instanceof AtomicBoolean ab) {
                out.writeBoolean(ab.get());
                return;
            }
            if (o instanceof AtomicReference<?> ar) {
                write(out, ar.get());
                return;
            }
            if (o.getClass().isArray()) {
                writeArray(out, o);
                return;
            }
            if (o instanceof Path path) {
                // a Path iterates over its own name elements
                out.writeString(path.toString());
                return;
            }
            if (o instanceof Iterable<?> it) {
                writeIterator(out, it.iterator());
                return;
            }
            if (o instanceof Iterator<?> it) {
                writeIterator(out, it);
                return;
            }
            if (o instanceof BaseStream<?, ?> stream) {
                try (stream) {
                    writeIterator(out, stream.iterator());
                }
                return;
            }
            if (o instanceof Map<?, ?> m) {
                writeMap(out, m);
                return;
            }
            if (o instanceof Enum<?> e) {
                out.writeString(e.name());
                return;
            }

            // temporal types -> string
            if (writeTemporal(out, o)) return;

            // string-based types -> string
            if (writeStringBasedType(out, o)) return;

            // record / bean
            if (o instanceof Record) {
                writeRecord(out, o);
                return;
            }
            writeBean(out, o);
        }

        boolean writeCustom(JsonWriter out, Object o) {
            for (var encoder : encoders) {
                if (encoder.canEncode(o)) {
                    out.delegate(w -> encoder.encode(w, o));
                    return true;
                }
            }
            if (!discoverEncoders) return false;
            for (var encoder : serviceEncoders) {
                if (encoder.canEncode(o)) {
                    out.delegate(w -> encoder.encode(w, o));
                    return true;
                }
            }
            return false;
        }

        void writeNumber(JsonWriter out, Number n) {
            if (n instanceof Integer
                    || n instanceof Long
                    || n instanceof Short
                    || n instanceof Byte
                    || n instanceof AtomicInteger
                    || n instanceof AtomicLong
                    || n instanceof LongAdder) {
                out.writeLong(n.longValue());
            } else if (n instanceof Double d) {
                out.writeDouble(d);
            } else if (n instanceof Float f) {
                out.writeFloat(f);
            } else if (n instanceof BigInteger bi) {
                out.writeBigInteger(bi);
            } else if (n instanceof BigDecimal bd) {
                out.writeBigDecimal(bd);
            } else {
                out.writeDouble(n.doubleValue());
            }
        }

        boolean writeOptional(JsonWriter out, Object o) {
            if (o instanceof Optional<?> optional) {
                if (optional.isEmpty()) out.writeNull();
                else write(out, optional.get());
                return true;
            }
            if (o instanceof OptionalInt oi) {
                if (oi.isEmpty()) out.writeNull();
                else out.writeLong(oi.getAsInt());
                return true;
            }
            if (o instanceof OptionalLong ol) {
                if (ol.isEmpty()) out.writeNull();
                else out.writeLong(ol.getAsLong());
                return true;
            }
            if (o instanceof OptionalDouble od) {
                if (od.isEmpty()) out.writeNull();
                else out.writeDouble(od.getAsDouble());
                return true;
            }
            return false;
        }

        boolean writeTemporal(JsonWriter out, Object o) {
            if (o instanceof Date d) {
                // java.sql.Date and java.sql.Time reject toInstant()
                var instant = d instanceof Timestamp ts ? ts.toInstant() : Instant.ofEpochMilli(d.getTime());
                out.writeString(instant.toString());
                return true;
            }
            if (o instanceof Instant
                    || o instanceof LocalDate
                    || o instanceof LocalTime
                    || o instanceof LocalDateTime
                    || o instanceof ZonedDateTime
                    || o instanceof OffsetDateTime
                    || o instanceof OffsetTime
                    || o instanceof Duration
                    || o instanceof Year
                    || o instanceof YearMonth
                    || o instanceof MonthDay
                    || o instanceof Period
                    || o instanceof ZoneId) {
                out.writeString(o.toString());
                return true;
            }
            return false;
        }

        boolean writeStringBasedType(JsonWriter out, Object o) {
            if (o instanceof UUID || o instanceof URI || o instanceof URL) {
                out.writeString(o.toString());
                return true;
            }
            if (o instanceof Locale locale) {
                out.writeString(locale.toLanguageTag());
                return true;
            }
            if (o instanceof Currency currency) {
                out.writeString(currency.getCurrencyCode());
                return true;
            }
            if (o instanceof TimeZone tz) {
                out.writeString(tz.getID());
                return true;
            }
            if (o instanceof Pattern pattern) {
                out.writeString(pattern.pattern());
                return true;
            }
            return false;
        }

        private void writeArray(JsonWriter out, Object arr) {
            var array = out.openArray();
            if (arr instanceof int[] ints) {
                for (int i : ints) array.value(i);
            } else if (arr instanceof long[] longs) {
                for (long l : longs) array.value(l);
            } else if (arr instanceof double[] doubles) {
                for (double d : doubles) array.value(d);
            } else {
                int len = Array.getLength(arr);
                for (int i = 0; i < len; i++) array.value(Array.get(arr, i));
            }
            array.end();
        }

        private void writeIterator(JsonWriter out, Iterator<?> it) {
            var array = out.openArray();
            while (it.hasNext()) {
                array.value(it.next());
            }
            array.end();
        }

        private void writeMap(JsonWriter out, Map<?, ?> map) {
            var object = out.openObject();
            for (var en : map.entrySet()) {
                object.member(String.valueOf(en.getKey()), en.getValue()); // JSON keys must be strings
            }
            object.end();
        }

        private void writeRecord(JsonWriter out, Object r) {
            var object = out.openObject();
            for (var c : r.getClass().getRecordComponents()) {
                Object v;
                try {
                    var accessor = c.getAccessor();
                    accessor.setAccessible(true);
                    v = accessor.invoke(r);
                } catch (java.lang.Exception e) {
                    throw new JsonException.EncodeException(
                            "Failed to access record component '" + c.getName() + "'", r.getClass(), e);
                }
                if (c.getType() == Optional.class && isAbsent(v)) continue;
                object.member(c.getName(), v);
            }
            object.end();
        }

        private void writeBean(JsonWriter out, Object bean) {
            var object = out.openObject();
            java.beans.PropertyDescriptor[] properties;
            try {
                properties = Introspector.getBeanInfo(bean.getClass()).getPropertyDescriptors();
            } catch (java.lang.Exception e) {
                throw new JsonException.EncodeException("Failed to introspect bean", bean.getClass(), e);
            }
            for (var pd : properties) {
                if ("class".equals(pd.getName())) continue;
                var read = pd.getReadMethod();
                if (read == null) continue;
                Object v;
                try {
                    v = read.invoke(bean);
                } catch (java.lang.Exception e) {
                    throw new JsonException.EncodeException(
                            "Failed to read bean property '" + pd.getName() + "'", bean.getClass(), e);
                }
                if (read.getReturnType() == Optional.class && isAbsent(v)) continue;
                object.member(pd.getName(), v);
            }
            object.end();
        }

        private static boolean isAbsent(@Nullable Object optional) {
            // null Optional is treated as empty
            return optional == null || ((Optional<?>) optional).isEmpty();
        }
    }

    // ============================================================
    // Utils
    // ============================================================

    static List<ValueEncoder> loadEncoders() {
        var encoders = new ArrayList<ValueEncoder>();
        for (var e : ServiceLoader.load(ValueEncoder.class)) {
            LOGGER.debug("Loaded value encoder {}", e.getClass().getName());
            encoders.add(e);
        }
        return List.copyOf(encoders);
    }

    static boolean isClassPresent(String name) {
        try {
            Class.forName(name);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }
}
