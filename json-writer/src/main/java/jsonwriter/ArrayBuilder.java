package jsonwriter;

import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * Appends the elements of one JSON array.
 *
 * <p> Writes {@code [} on creation and {@code ]} when terminated.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var sb = new StringBuilder();
 * var array = Json.beginArray(sb);
 * array.value(1).value("two");
 * array.object(o -> o.member("three", 3));
 * array.end();
 * // -> [1,"two",{"three":3}]
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ArrayBuilder extends BracketedBuilder {

    ArrayBuilder(JsonWriter writer, int depth) {
        super(writer, depth, ']');
    }

    /**
     * Appends {@code value}, preceded by a comma unless this is the first element.
     *
     * @param value any value, see {@link Json#encode(Object)} for the supported shapes
     * @return this builder
     */
    public ArrayBuilder value(@Nullable Object value) {
        writeComma();
        writer.write(value);
        return this;
    }

    public ArrayBuilder value(@Nullable CharSequence value) {
        writeComma();
        if (value == null) writer.writeNull();
        else writer.writeString(value);
        return this;
    }

    public ArrayBuilder value(char value) {
        writeComma();
        writer.writeString(String.valueOf(value));
        return this;
    }

    public ArrayBuilder value(boolean value) {
        writeComma();
        writer.writeBoolean(value);
        return this;
    }

    public ArrayBuilder value(long value) {
        writeComma();
        writer.writeLong(value);
        return this;
    }

    public ArrayBuilder value(float value) {
        writeComma();
        writer.writeFloat(value);
        return this;
    }

    public ArrayBuilder value(double value) {
        writeComma();
        writer.writeDouble(value);
        return this;
    }

    /**
     * Starts a nested object as the next element.
     *
     * <p> This builder is unusable until the returned one is terminated.
     */
    public ObjectBuilder object() {
        writeComma();
        return writer.openObject();
    }

    /**
     * Starts a nested array as the next element.
     *
     * <p> This builder is unusable until the returned one is terminated.
     */
    public ArrayBuilder array() {
        writeComma();
        return writer.openArray();
    }

    /**
     * Writes a nested object as the next element and ends it once {@code body} returns.
     */
    public ArrayBuilder object(Consumer<? super ObjectBuilder> body) {
        runScoped(object(), body);
        return this;
    }

    /**
     * Writes a nested array as the next element and ends it once {@code body} returns.
     */
    public ArrayBuilder array(Consumer<? super ArrayBuilder> body) {
        runScoped(array(), body);
        return this;
    }

    @Override
    String kind() {
        return "ArrayBuilder";
    }
}
