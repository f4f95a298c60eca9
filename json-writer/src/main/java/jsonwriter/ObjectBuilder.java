package jsonwriter;

import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * Appends the members of one JSON object.
 *
 * <p> Writes <code>{</code> on creation and <code>}</code> when terminated. Members are written in call order and
 * keys are never deduplicated.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var sb = new StringBuilder();
 * var object = Json.beginObject(sb);
 * object.member("number", 42);
 * var nested = object.array("array");
 * nested.value("?");
 * nested.end();
 * object.end();
 * // -> {"number":42,"array":["?"]}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ObjectBuilder extends BracketedBuilder {

    ObjectBuilder(JsonWriter writer, int depth) {
        super(writer, depth, '}');
    }

    /**
     * Appends {@code "key":value}, preceded by a comma unless this is the first member.
     *
     * @param key   member name, escaped as needed
     * @param value any value, see {@link Json#encode(Object)} for the supported shapes
     * @return this builder
     */
    public ObjectBuilder member(String key, @Nullable Object value) {
        writeKey(key);
        writer.write(value);
        return this;
    }

    public ObjectBuilder member(String key, @Nullable CharSequence value) {
        writeKey(key);
        if (value == null) writer.writeNull();
        else writer.writeString(value);
        return this;
    }

    public ObjectBuilder member(String key, char value) {
        writeKey(key);
        writer.writeString(String.valueOf(value));
        return this;
    }

    public ObjectBuilder member(String key, boolean value) {
        writeKey(key);
        writer.writeBoolean(value);
        return this;
    }

    public ObjectBuilder member(String key, long value) {
        writeKey(key);
        writer.writeLong(value);
        return this;
    }

    public ObjectBuilder member(String key, float value) {
        writeKey(key);
        writer.writeFloat(value);
        return this;
    }

    public ObjectBuilder member(String key, double value) {
        writeKey(key);
        writer.writeDouble(value);
        return this;
    }

    /**
     * Starts a nested object under {@code key}.
     *
     * <p> This builder is unusable until the returned one is terminated.
     */
    public ObjectBuilder object(String key) {
        writeKey(key);
        return writer.openObject();
    }

    /**
     * Starts a nested array under {@code key}.
     *
     * <p> This builder is unusable until the returned one is terminated.
     */
    public ArrayBuilder array(String key) {
        writeKey(key);
        return writer.openArray();
    }

    /**
     * Writes a nested object under {@code key} and ends it once {@code body} returns.
     */
    public ObjectBuilder object(String key, Consumer<? super ObjectBuilder> body) {
        var child = object(key);
        runScoped(child, body);
        return this;
    }

    /**
     * Writes a nested array under {@code key} and ends it once {@code body} returns.
     */
    public ObjectBuilder array(String key, Consumer<? super ArrayBuilder> body) {
        var child = array(key);
        runScoped(child, body);
        return this;
    }

    /**
     * Writes {@code "key":}, preceded by a comma unless this is the first member.
     *
     * <p> Low-level escape hatch: exactly one value must follow through {@link #sink()}.
     */
    public ObjectBuilder writeKey(String key) {
        checkActive();
        separate();
        writer.writeString(key);
        writer.append(':');
        return this;
    }

    @Override
    String kind() {
        return "ObjectBuilder";
    }
}
