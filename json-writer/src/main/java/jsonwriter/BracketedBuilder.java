package jsonwriter;

import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared lifecycle of {@link ObjectBuilder} and {@link ArrayBuilder}.
 *
 * <p> The opening bracket is written when the builder is created, the closing bracket exactly once when it is
 * terminated, either by {@link #end()} or by {@link #close()}. A builder only accepts operations while it is the
 * innermost open builder of its {@link JsonWriter}.
 *
 * @since 0.1.0
 */
public abstract sealed class BracketedBuilder implements AutoCloseable permits ObjectBuilder, ArrayBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(BracketedBuilder.class);

    enum State {
        OPEN,
        HAS_CONTENT,
        CLOSED
    }

    final JsonWriter writer;
    private final int depth;
    private final char closing;
    private State state = State.OPEN;

    BracketedBuilder(JsonWriter writer, int depth, char closing) {
        this.writer = writer;
        this.depth = depth;
        this.closing = closing;
    }

    /**
     * Writes a comma unless this is the first entry.
     *
     * <p> Low-level escape hatch: after calling it, exactly one entry must be written through {@link #sink()}.
     */
    public final void writeComma() {
        checkActive();
        separate();
    }

    /**
     * Writes the closing bracket and terminates this builder.
     *
     * <p> Prefer this over {@link #close()}: a failing write is reported here, while {@code close()} ignores it.
     *
     * @throws JsonException.WriteException if the closing bracket could not be written
     */
    public final void end() {
        checkActive();
        state = State.CLOSED;
        writer.release(this);
        writer.append(closing);
    }

    /**
     * Terminates this builder if {@link #end()} has not been called.
     *
     * <p> Nested builders that are still open are closed first, so the brackets stay balanced. Write failures are
     * logged and discarded.
     */
    @Override
    public final void close() {
        if (state == State.CLOSED) return;
        writer.closeChildren(this);
        state = State.CLOSED;
        writer.release(this);
        try {
            writer.append(closing);
        } catch (JsonException.WriteException e) {
            LOGGER.debug("Discarding write failure while closing {}", this, e);
        }
    }

    /**
     * The sink of the underlying writer, e.g. to drain it between entries.
     */
    public final Appendable sink() {
        checkActive();
        return writer.sink();
    }

    public final boolean isClosed() {
        return state == State.CLOSED;
    }

    /**
     * Nesting level on the writer, {@code 1} for a root builder.
     */
    public final int depth() {
        return depth;
    }

    @Override
    public String toString() {
        return kind() + "{depth=" + depth + ", state=" + state + '}';
    }

    abstract String kind();

    final void checkActive() {
        writer.checkActive(this);
    }

    /**
     * Runs {@code body} against a freshly opened child and ends the child afterwards, unless {@code body} did.
     */
    static <B extends BracketedBuilder> void runScoped(B child, Consumer<? super B> body) {
        try {
            body.accept(child);
        } catch (RuntimeException | Error e) {
            child.close();
            throw e;
        }
        if (!child.isClosed()) child.end();
    }

    final void separate() {
        if (state == State.OPEN) state = State.HAS_CONTENT;
        else writer.append(',');
    }
}
