package jsonwriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class ArrayBuilderTest {

    private static final JsonMapper mapper = JsonMapper.builder().build();

    @Test
    void values() {
        var sb = new StringBuilder();
        var array = Json.beginArray(sb);
        array.value(1).value("two").value('3').value(true).value(4.5).value(6.25f).value((Object) null);
        array.value(Map.of("k", "v"));
        array.end();

        assertThat(sb).hasToString("[1,\"two\",\"3\",true,4.5,6.25,null,{\"k\":\"v\"}]");
    }

    @Test
    void commas_onlyBetweenElements() {
        for (int n = 0; n < 10; n++) {
            var sb = new StringBuilder();
            var array = Json.beginArray(sb);
            for (int i = 0; i < n; i++) array.value(i);
            array.end();

            var json = sb.toString();
            assertThat(json.chars().filter(c -> c == ',').count()).isEqualTo(Math.max(0, n - 1));
            assertThat(json).doesNotStartWith("[,").doesNotEndWith(",]");
        }
    }

    @Test
    void nestedArraysAndObjects() {
        var sb = new StringBuilder();
        var array = Json.beginArray(sb);
        array.array().end();
        array.object(o -> o.member("a", 1));
        array.array(a -> a.array(b -> b.value("deep")));
        array.end();

        assertThat(sb).hasToString("[[],{\"a\":1},[[\"deep\"]]]");
    }

    @Test
    void writeComma_thenRawElement() throws Exception {
        var sb = new StringBuilder();
        var array = Json.beginArray(sb);
        array.writeComma();
        array.sink().append("1");
        array.writeComma();
        array.sink().append("{}");
        array.end();

        assertThat(sb).hasToString("[1,{}]");
    }

    @Test
    void parentUsedWhileChildOpen_throws() {
        var array = Json.beginArray(new StringBuilder());
        array.object();

        assertThatThrownBy(() -> array.value(1)).isInstanceOf(JsonException.BuilderStateException.class);
        assertThatThrownBy(array::end).isInstanceOf(JsonException.BuilderStateException.class);
    }

    @Test
    void randomAbandonment_keepsBracketsBalanced() throws Exception {
        var random = new Random(7);
        for (int round = 0; round < 200; round++) {
            var sb = new StringBuilder();
            var open = new ArrayDeque<BracketedBuilder>();
            try (var out = Json.writer(sb)) {
                open.push(out.beginArray());
                for (int op = 0; op < 30 && !open.isEmpty(); op++) {
                    var top = open.peek();
                    switch (random.nextInt(5)) {
                        case 0 -> open.push(top instanceof ArrayBuilder a ? a.array() : ((ObjectBuilder) top).array("a"));
                        case 1 -> open.push(top instanceof ArrayBuilder a ? a.object() : ((ObjectBuilder) top).object("o"));
                        case 2 -> open.pop().end();
                        default -> {
                            if (top instanceof ArrayBuilder a) a.value(op);
                            else ((ObjectBuilder) top).member("k" + op, op);
                        }
                    }
                }
            }

            var json = sb.toString();
            assertThat(json.chars().filter(c -> c == '[').count())
                    .isEqualTo(json.chars().filter(c -> c == ']').count());
            assertThat(json.chars().filter(c -> c == '{').count())
                    .isEqualTo(json.chars().filter(c -> c == '}').count());
            // also proves brackets nest correctly
            assertThat(mapper.readTree(json)).isNotNull();
        }
    }
}
