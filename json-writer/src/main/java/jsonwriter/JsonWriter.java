package jsonwriter;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes JSON text into a caller-owned {@link Appendable}.
 *
 * <p> A writer tracks the builders opened on its sink. Only the innermost open builder accepts operations; using
 * an outer one before its child has been terminated throws {@link JsonException.BuilderStateException}. This is
 * what keeps the output well nested without buffering anything.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var sb = new StringBuilder();
 * try (var out = Json.writer(sb)) {
 *     var array = out.beginArray();
 *     for (int i = 0; i < 1_000_000; i++) {
 *         array.value(i);
 *         if (sb.length() > 8192) {
 *             file.write(sb.toString());
 *             sb.setLength(0);
 *         }
 *     }
 *     array.end();
 * }
 * }</pre>
 *
 * <p> Instances are not thread-safe.
 *
 * @since 0.1.0
 */
public final class JsonWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriter.class);

    private final Appendable sink;
    private final Json.Encoder encoder;
    private final Deque<BracketedBuilder> open = new ArrayDeque<>();

    /**
     * Set while an {@link Json.Encodable} owes exactly one value.
     */
    private boolean slotOpen;

    private int delegations;

    JsonWriter(Appendable sink, Json.Encoder encoder) {
        this.sink = sink;
        this.encoder = encoder;
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Writes one complete value at the current position.
     *
     * <p> The current position is the root of the sink, or the value an {@link Json.Encodable} is producing.
     * Inside builders use {@link ObjectBuilder#member(String, Object)} or {@link ArrayBuilder#value(Object)}.
     *
     * @param value any value, may be {@code null}
     */
    public void value(@Nullable Object value) {
        claimSlot();
        write(value);
    }

    /**
     * Starts an object at the current position. Writes <code>{</code> immediately.
     *
     * @return the builder for the new object
     */
    public ObjectBuilder beginObject() {
        claimSlot();
        return openObject();
    }

    /**
     * Starts an array at the current position. Writes <code>[</code> immediately.
     *
     * @return the builder for the new array
     */
    public ArrayBuilder beginArray() {
        claimSlot();
        return openArray();
    }

    /**
     * Appends the escaped body of {@code text} without quotes.
     *
     * <p> No separator or state bookkeeping happens here: the caller is responsible for the surrounding grammar.
     */
    public void escape(CharSequence text) {
        try {
            StringEscaper.writeEscaped(sink, text);
        } catch (IOException e) {
            throw writeFailed(e);
        }
    }

    /**
     * The sink this writer appends to, e.g. to drain it between top-level elements.
     *
     * <p> Never drain in the middle of an element: the part still to be written would be lost with it.
     */
    public Appendable sink() {
        return sink;
    }

    /**
     * Number of builders currently open on this writer.
     */
    public int depth() {
        return open.size();
    }

    /**
     * Ends every open builder, innermost first, surfacing write failures.
     */
    public void finish() {
        while (!open.isEmpty()) {
            open.peek().end();
        }
    }

    /**
     * Closes every open builder, innermost first, ignoring write failures.
     *
     * <p> Prefer {@link #finish()} when failures matter.
     */
    @Override
    public void close() {
        closeAbove(0);
    }

    @Override
    public String toString() {
        return "JsonWriter{depth=" + open.size() + ", sink=" + sink.getClass().getName() + '}';
    }

    // ============================================================
    // Builder bookkeeping
    // ============================================================

    ObjectBuilder openObject() {
        append('{');
        var builder = new ObjectBuilder(this, open.size() + 1);
        open.push(builder);
        return builder;
    }

    ArrayBuilder openArray() {
        append('[');
        var builder = new ArrayBuilder(this, open.size() + 1);
        open.push(builder);
        return builder;
    }

    void checkActive(BracketedBuilder builder) {
        if (builder.isClosed()) throw new JsonException.BuilderStateException(builder.kind() + " is already closed");
        if (open.peek() != builder)
            throw new JsonException.BuilderStateException(
                    builder.kind() + " cannot be used while a nested builder is still open");
        if (slotOpen)
            throw new JsonException.BuilderStateException(
                    builder.kind() + " cannot be used while one of its values is being encoded");
    }

    void release(BracketedBuilder builder) {
        if (open.peek() != builder)
            throw new JsonException.BuilderStateException(builder.kind() + " is not the innermost open builder");
        open.pop();
    }

    /**
     * Best-effort closes builders until at most {@code depth} remain open.
     */
    void closeAbove(int depth) {
        while (open.size() > depth) {
            var builder = open.peek();
            LOGGER.debug("Closing abandoned {}", builder);
            builder.close();
        }
    }

    /**
     * Closes the builders opened above {@code builder}, leaving it as the innermost one.
     */
    void closeChildren(BracketedBuilder builder) {
        closeAbove(builder.depth());
    }

    // ============================================================
    // Value dispatch
    // ============================================================

    void write(@Nullable Object value) {
        encoder.write(this, value);
    }

    /**
     * Lets {@code encodable} fill the current value slot through this writer.
     */
    void delegate(Json.Encodable encodable) {
        int depth = open.size();
        boolean unclaimed;
        slotOpen = true;
        delegations++;
        try {
            encodable.encodeJson(this);
        } finally {
            delegations--;
            unclaimed = slotOpen;
            slotOpen = false;
            closeAbove(depth);
        }
        if (unclaimed)
            throw new JsonException.BuilderStateException(
                    "Encodable " + encodable.getClass().getName() + " did not write a value");
    }

    private void claimSlot() {
        if (slotOpen) {
            slotOpen = false;
            return;
        }
        if (!open.isEmpty() || delegations > 0)
            throw new JsonException.BuilderStateException("A value cannot be written here, "
                    + (delegations > 0 ? "the encodable already wrote its value" : "use the innermost open builder"));
    }

    // ============================================================
    // Sink access
    // ============================================================

    void append(char c) {
        try {
            sink.append(c);
        } catch (IOException e) {
            throw writeFailed(e);
        }
    }

    void append(CharSequence s) {
        try {
            sink.append(s);
        } catch (IOException e) {
            throw writeFailed(e);
        }
    }

    void writeNull() {
        append(NumberFormatter.NULL);
    }

    void writeBoolean(boolean value) {
        append(value ? "true" : "false");
    }

    void writeString(CharSequence value) {
        try {
            StringEscaper.writeQuoted(sink, value);
        } catch (IOException e) {
            throw writeFailed(e);
        }
    }

    void writeLong(long value) {
        try {
            NumberFormatter.writeLong(sink, value);
        } catch (IOException e) {
            throw writeFailed(e);
        }
    }

    void writeDouble(double value) {
        append(NumberFormatter.formatDouble(value));
    }

    void writeFloat(float value) {
        append(NumberFormatter.formatFloat(value));
    }

    void writeBigInteger(BigInteger value) {
        append(value.toString());
    }

    void writeBigDecimal(BigDecimal value) {
        append(value.toString());
    }

    static JsonException.WriteException writeFailed(IOException e) {
        return new JsonException.WriteException("Failed to append to JSON sink", e);
    }
}
