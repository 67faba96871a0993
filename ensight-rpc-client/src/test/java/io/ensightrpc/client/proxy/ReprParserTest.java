package io.ensightrpc.client.proxy;

import io.ensightrpc.core.EnsightRpcException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class ReprParserTest {

    private static Object parse(String text) {
        return ReprParser.parse(text, List.of());
    }

    @Test
    void scalars() {
        assertThat(parse("None")).isNull();
        assertThat(parse("True")).isEqualTo(true);
        assertThat(parse("False")).isEqualTo(false);
        assertThat(parse("14")).isEqualTo(14L);
        assertThat(parse("-3")).isEqualTo(-3L);
        assertThat(parse("2.5")).isEqualTo(2.5);
        assertThat(parse("1e-05")).isEqualTo(1e-05);
        assertThat(parse("123456789012345678901234567890")).isEqualTo(new BigInteger("123456789012345678901234567890"));
    }

    @Test
    void strings() {
        assertThat(parse("'Sphere'")).isEqualTo("Sphere");
        assertThat(parse("\"it's\"")).isEqualTo("it's");
        assertThat(parse("'a\\nb\\t\\'c\\\\'")).isEqualTo("a\nb\t'c\\");
        assertThat(parse("'\\x41\\u00e9'")).isEqualTo("Aé");
        assertThat(parse("r'C:\\temp'")).isEqualTo("C:\\temp");
        assertThat(parse("'''multi\nline'''")).isEqualTo("multi\nline");
    }

    @Test
    void bytesBecomeByteArrays() {
        Object value = parse("b'\\x89PNG'");

        assertThat(value).isInstanceOf(byte[].class);
        assertThat((byte[]) value).isEqualTo(new byte[]{(byte) 0x89, 'P', 'N', 'G'});
    }

    @Test
    void topLevelListIsProxyList() {
        Object value = parse("[1, 'two', None]");

        assertThat(value).isInstanceOf(ProxyList.class);
        assertThat((List<Object>) value).containsExactly(1L, "two", null);
    }

    @Test
    void nestedCollectionsKeepShape() {
        Object value = parse("{'a': [1, (2, 3)], 'b': {'c': ()}, 'd': (4,), 'e': {5, 6}}");

        assertThat(value).isInstanceOf(Map.class);
        Map<Object, Object> map = (Map<Object, Object>) value;
        assertThat(map.keySet()).containsExactly("a", "b", "d", "e");
        assertThat((List<Object>) map.get("a")).containsExactly(1L, List.of(2L, 3L));
        assertThat(map.get("a")).isNotInstanceOf(ProxyList.class);
        assertThat((Map<Object, Object>) map.get("b")).containsExactly(entry("c", List.of()));
        assertThat((List<Object>) map.get("d")).containsExactly(4L);
        assertThat((Iterable<Object>) map.get("e")).containsExactly(5L, 6L);
    }

    @Test
    void parenthesizedValueIsNotATuple() {
        assertThat(parse("(7)")).isEqualTo(7L);
    }

    @Test
    void trailingCommasAreAccepted() {
        assertThat((List<Object>) parse("[1, 2,]")).containsExactly(1L, 2L);
        assertThat((Map<Object, Object>) parse("{'k': 1,}")).containsExactly(entry("k", 1L));
    }

    @Test
    void placeholdersResolveToHandles() {
        RemoteEvaluator owner = new RecordingEvaluator();
        ProxyHandle a = new ProxyHandle(owner, 10, "ENS_PART", null);
        ProxyHandle b = new ProxyHandle(owner, 11, "ENS_VAR", null);
        String text = "[" + ReprParser.placeholder(0) + ", {'v': " + ReprParser.placeholder(1) + "}]";

        Object value = ReprParser.parse(text, Arrays.asList(a, b));

        ProxyList list = (ProxyList) value;
        assertThat(list.get(0)).isSameAs(a);
        assertThat(((Map<?, ?>) list.get(1)).get("v")).isSameAs(b);
        assertThat(list.handles()).containsExactly(a);
    }

    @Test
    void malformedTextReportsPosition() {
        assertThatThrownBy(() -> parse("[1, 2"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class)
                .satisfies(e -> assertThat(((EnsightRpcException.MalformedResult) e).position()).isEqualTo(5));
        assertThatThrownBy(() -> parse("<ensobjlist object>"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class);
        assertThatThrownBy(() -> parse("foo(1)"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class);
        assertThatThrownBy(() -> parse("1 2"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class);
        assertThatThrownBy(() -> parse(""))
                .isInstanceOf(EnsightRpcException.MalformedResult.class);
        assertThatThrownBy(() -> parse("'open"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class);
    }

    @Test
    void badEscapesAreMalformed() {
        assertThatThrownBy(() -> parse("'\\x-1'"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class)
                .hasMessageContaining("bad escape");
        assertThatThrownBy(() -> parse("'\\U00110000'"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class)
                .hasMessageContaining("bad escape");
        assertThatThrownBy(() -> parse("'\\uzz12'"))
                .isInstanceOf(EnsightRpcException.MalformedResult.class);
        assertThat(parse("'\\U0001F600'")).isEqualTo(new String(Character.toChars(0x1F600)));
    }
}
