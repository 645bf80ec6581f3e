package io.httpfixture.server.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.httpfixture.core.engine.RandomBytes;
import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("/bytes/{n}")
class BytesEndpointTest extends FixtureTestHarness {

    private static final int CHUNK_SIZE = 256;

    @BeforeAll
    static void start() {
        startServer(testConfig().chunkSize(CHUNK_SIZE).build());
    }

    @Test
    void exactLengthAndContentType() throws Exception {
        HttpResponse<byte[]> response = getBytes("/bytes/1000");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).hasSize(1000);
        assertThat(contentType(response)).startsWith("application/octet-stream");
        assertThat(response.headers().firstValueAsLong("Content-Length")).hasValue(1000);
    }

    @Test
    @DisplayName("same seed gives the same bytes")
    void seededIsDeterministic() throws Exception {
        byte[] first = getBytes("/bytes/2048?seed=42").body();
        byte[] second = getBytes("/bytes/2048?seed=42").body();

        assertThat(first).isEqualTo(second);

        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        new RandomBytes(CHUNK_SIZE).writeTo(expected, 2048, 42L);
        assertThat(first).isEqualTo(expected.toByteArray());
    }

    @Test
    @DisplayName("without a seed, two calls give different bytes")
    void unseededCallsDiffer() throws Exception {
        byte[] first = getBytes("/bytes/1024").body();
        byte[] second = getBytes("/bytes/1024").body();

        assertThat(first).hasSize(1024);
        assertThat(second).hasSize(1024);
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void negativeSeedIsAccepted() throws Exception {
        assertThat(getBytes("/bytes/16?seed=-7").body()).hasSize(16);
    }

    @Test
    void zeroBytes() throws Exception {
        HttpResponse<byte[]> response = getBytes("/bytes/0");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEmpty();
    }

    @Test
    @DisplayName("malformed seed answers 500 naming the parameter")
    void malformedSeed() throws Exception {
        HttpResponse<String> response = get("/bytes/10?seed=abc");

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(json(response).at("/error/message").asText()).isEqualTo("failed to parse 'seed'");
    }

    @Test
    void nonNumericLengthIsNotFound() throws Exception {
        assertThat(get("/bytes/ten").statusCode()).isEqualTo(404);
    }
}
