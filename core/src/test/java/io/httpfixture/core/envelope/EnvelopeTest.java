package io.httpfixture.core.envelope;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvelopeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toBytesIsIndentedJsonWithTrailingNewline() throws Exception {
        byte[] bytes = Envelope.create().put("origin", "10.0.0.1").toBytes();
        String text = new String(bytes, StandardCharsets.UTF_8);

        assertThat(text).startsWith("{\n").endsWith("}\n");
        assertThat(mapper.readTree(bytes).get("origin").asText()).isEqualTo("10.0.0.1");
    }

    @Test
    void objectKeepsMapOrder() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("z", "1");
        values.put("a", "2");

        JsonNode json = Envelope.create().object("cookies", values).toJson().get("cookies");

        assertThat(json.fieldNames()).toIterable().containsExactly("z", "a");
    }

    @Test
    void nullJsonValueIsWrittenAsNull() {
        JsonNode json = Envelope.create().set("json", null).toJson();

        assertThat(json.has("json")).isTrue();
        assertThat(json.get("json").isNull()).isTrue();
    }

    @Test
    void toJsonReturnsCopy() {
        Envelope envelope = Envelope.create().put("a", "1");

        envelope.toJson().put("b", "2");

        assertThat(envelope.toJson().has("b")).isFalse();
    }
}
