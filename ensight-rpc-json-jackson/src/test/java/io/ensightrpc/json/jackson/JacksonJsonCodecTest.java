package io.ensightrpc.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ensightrpc.json.spi.JsonCodec;
import io.ensightrpc.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    public static final class Viewport {
        public int width;
        public int height;
    }

    @Test
    void readObjectKeepsFieldOrder() throws Exception {
        Map<String, Object> enums = codec.readObject("{\"PARTTYPE\": 1610612792, \"VISIBLE\": 7, \"__OBJID__\": 3}");

        assertThat(enums).containsExactly(
                Map.entry("PARTTYPE", 1610612792),
                Map.entry("VISIBLE", 7),
                Map.entry("__OBJID__", 3));
    }

    @Test
    void readValueIgnoresUnknownFields() throws Exception {
        Viewport vp = codec.readValue("{\"width\": 800, \"height\": 600, \"originx\": 0}", Viewport.class);

        assertThat(vp.width).isEqualTo(800);
        assertThat(vp.height).isEqualTo(600);
    }

    @Test
    void readListBindsElementType() throws Exception {
        List<Viewport> vps = codec.readList("[{\"width\": 1, \"height\": 2}, {\"width\": 3, \"height\": 4}]", Viewport.class);

        assertThat(vps).hasSize(2);
        assertThat(vps.get(1)).isInstanceOf(Viewport.class);
        assertThat(vps.get(1).width).isEqualTo(3);
    }

    @Test
    void readUntypedReturnsPlainValues() throws Exception {
        Object value = codec.readUntyped("[1, \"two\", null, true]");

        assertThat(value).isInstanceOf(List.class);
        assertThat((List<Object>) value).containsExactly(1, "two", null, true);
    }

    @Test
    void invalidJsonRaisesJsonException() {
        assertThatThrownBy(() -> codec.readObject("[1, 2]"))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> codec.readUntyped("{nope"))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void suppliedMapperSettingsApply() {
        JsonCodec strict = new JacksonJsonCodec(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true));

        assertThatThrownBy(() -> strict.readValue("{\"width\": 800, \"originx\": 0}", Viewport.class))
                .isInstanceOf(JsonException.class);
    }
}
