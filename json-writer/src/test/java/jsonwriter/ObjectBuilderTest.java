package jsonwriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ObjectBuilderTest {

    @Test
    void singleMember() {
        var sb = new StringBuilder();
        var object = Json.beginObject(sb);
        object.member("number", 42);
        object.end();

        assertThat(sb).hasToString("{\"number\":42}");
    }

    @Test
    void duplicateKeys_areKeptInOrder() {
        var sb = new StringBuilder();
        var object = Json.beginObject(sb);
        object.member("number", 42);
        object.member("number", 43);
        object.end();

        assertThat(sb).hasToString("{\"number\":42,\"number\":43}");
    }

    @Test
    void nestedBuilders() {
        var sb = new StringBuilder();
        var object = Json.beginObject(sb);
        object.member("number", 42);
        object.member("slice", new int[] {1, 2, 3, 4});

        var array = object.array("array");
        array.value(42);
        array.value("?");
        array.end();

        var nested = object.object("object");
        nested.end();
        object.end();

        assertThat(sb).hasToString("{\"number\":42,\"slice\":[1,2,3,4],\"array\":[42,\"?\"],\"object\":{}}");
    }

    @Test
    void typedMembers() {
        var sb = new StringBuilder();
        var object = Json.beginObject(sb);
        object.member("s", "text")
                .member("nullText", (CharSequence) null)
                .member("c", 'x')
                .member("b", false)
                .member("l", -7L)
                .member("f", 1.5f)
                .member("d", 1e21)
                .member("o", List.of(Json.NULL));
        object.end();

        assertThat(sb)
                .hasToString("{\"s\":\"text\",\"nullText\":null,\"c\":\"x\",\"b\":false,\"l\":-7,\"f\":1.5,"
                        + "\"d\":1e21,\"o\":[null]}");
    }

    @Test
    void keysAreEscaped() {
        var sb = new StringBuilder();
        var object = Json.beginObject(sb);
        object.member("a\"b\n", 1);
        object.end();

        assertThat(sb).hasToString("{\"a\\\"b\\n\":1}");
    }

    @Test
    void writeKey_thenRawValueThroughSink() throws Exception {
        var sb = new StringBuilder();
        var object = Json.beginObject(sb);
        object.writeKey("raw").sink().append("[1,2]");
        object.writeKey("next").sink().append("true");
        object.end();

        assertThat(sb).hasToString("{\"raw\":[1,2],\"next\":true}");
    }

    @Nested
    class ScopedTests {

        @Test
        void scopedChildren_areEndedAutomatically() {
            var sb = new StringBuilder();
            var object = Json.beginObject(sb);
            object.object("a", a -> a.member("x", 1))
                    .array("b", b -> b.value(1).value(2))
                    .member("c", true);
            object.end();

            assertThat(sb).hasToString("{\"a\":{\"x\":1},\"b\":[1,2],\"c\":true}");
        }

        @Test
        void scopedChild_endedInsideBody_isNotEndedTwice() {
            var sb = new StringBuilder();
            var object = Json.beginObject(sb);
            object.array("a", a -> {
                a.value(1);
                a.end();
            });
            object.end();

            assertThat(sb).hasToString("{\"a\":[1]}");
        }

        @Test
        void scopedChild_throwing_isClosedAndParentStaysUsable() {
            var sb = new StringBuilder();
            var object = Json.beginObject(sb);

            assertThatThrownBy(() -> object.object("a", a -> {
                        a.member("x", 1);
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom");

            object.member("b", 2);
            object.end();
            assertThat(sb).hasToString("{\"a\":{\"x\":1},\"b\":2}");
        }
    }

    @Nested
    class StateTests {

        @Test
        void parentUsedWhileChildOpen_throws() {
            var sb = new StringBuilder();
            var object = Json.beginObject(sb);
            var child = object.array("a");

            assertThatThrownBy(() -> object.member("b", 1))
                    .isInstanceOf(JsonException.BuilderStateException.class)
                    .hasMessageContaining("nested builder is still open");
            assertThat(sb).hasToString("{\"a\":[");

            child.end();
            object.member("b", 1);
            object.end();
            assertThat(sb).hasToString("{\"a\":[],\"b\":1}");
        }

        @Test
        void endTwice_throws() {
            var object = Json.beginObject(new StringBuilder());
            object.end();

            assertThatThrownBy(object::end)
                    .isInstanceOf(JsonException.BuilderStateException.class)
                    .hasMessageContaining("already closed");
            assertThatThrownBy(() -> object.member("a", 1)).isInstanceOf(JsonException.BuilderStateException.class);
        }

        @Test
        void closeAfterEnd_isNoop() {
            var sb = new StringBuilder();
            var object = Json.beginObject(sb);
            object.end();

            assertThatCode(object::close).doesNotThrowAnyException();
            assertThat(sb).hasToString("{}");
            assertThat(object.isClosed()).isTrue();
        }

        @Test
        void closeParent_closesOpenChildren() {
            var sb = new StringBuilder();
            var object = Json.beginObject(sb);
            var array = object.array("a");
            array.value(1);
            array.object().member("deep", true);

            object.close();

            assertThat(sb).hasToString("{\"a\":[1,{\"deep\":true}]}");
            assertThat(array.isClosed()).isTrue();
        }

        @Test
        void tryWithResources_closesAbandonedBuilder() {
            var sb = new StringBuilder();
            try (var object = Json.beginObject(sb)) {
                object.member("a", 1);
            }

            assertThat(sb).hasToString("{\"a\":1}");
        }

        @Test
        void depth() {
            var object = Json.beginObject(new StringBuilder());
            var array = object.array("a");

            assertThat(object.depth()).isEqualTo(1);
            assertThat(array.depth()).isEqualTo(2);
            assertThat(array).hasToString("ArrayBuilder{depth=2, state=OPEN}");
        }
    }
}
