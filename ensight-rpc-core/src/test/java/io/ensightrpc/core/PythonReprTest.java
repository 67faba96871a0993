package io.ensightrpc.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonReprTest {

    @Test
    void scalars() {
        assertThat(PythonRepr.repr(null)).isEqualTo("None");
        assertThat(PythonRepr.repr(true)).isEqualTo("True");
        assertThat(PythonRepr.repr(42)).isEqualTo("42");
        assertThat(PythonRepr.repr(-7L)).isEqualTo("-7");
        assertThat(PythonRepr.repr(1.5)).isEqualTo("1.5");
        assertThat(PythonRepr.repr(Double.NaN)).isEqualTo("float('nan')");
    }

    @Test
    void stringsAreSingleQuotedAndEscaped() {
        assertThat(PythonRepr.repr("PARTS")).isEqualTo("'PARTS'");
        assertThat(PythonRepr.repr("it's\n\\")).isEqualTo("'it\\'s\\n\\\\'");
        assertThat(PythonRepr.repr("a\u0001b")).isEqualTo("'a\\x01b'");
    }

    @Test
    void collections() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("w", 640);
        m.put("tags", List.of("a", "b"));

        assertThat(PythonRepr.repr(List.of("PARTS", 3))).isEqualTo("['PARTS', 3]");
        assertThat(PythonRepr.repr(m)).isEqualTo("{'w': 640, 'tags': ['a', 'b']}");
        assertThat(PythonRepr.repr(new int[]{1, 2})).isEqualTo("[1, 2]");
    }

    @Test
    void remoteReferencesAreInsertedVerbatim() {
        assertThat(PythonRepr.repr(PythonRepr.expr("ensight.objs.core"))).isEqualTo("ensight.objs.core");
        assertThat(PythonRepr.repr(List.of(PythonRepr.expr("ensight.objs.wrap_id(3)"))))
                .isEqualTo("[ensight.objs.wrap_id(3)]");
    }

    @Test
    void unsupportedTypesAreRejected() {
        assertThatThrownBy(() -> PythonRepr.repr(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
