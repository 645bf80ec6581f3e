package io.httpfixture.server.app;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpResponse;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Static content endpoints")
class StaticEndpointsTest extends FixtureTestHarness {

    @BeforeAll
    static void start() {
        startServer();
    }

    @Test
    void home() throws Exception {
        HttpResponse<String> response = get("/");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(contentType(response)).startsWith("text/html");
        assertThat(response.body()).startsWith("<!DOCTYPE html>");
    }

    @Test
    void html() throws Exception {
        HttpResponse<String> response = get("/html");

        assertThat(contentType(response)).startsWith("text/html");
        assertThat(response.body()).contains("Moby-Dick");
    }

    @Test
    void xml() throws Exception {
        HttpResponse<String> response = get("/xml");

        assertThat(contentType(response)).startsWith("text/xml");
        assertThat(response.body()).contains("<slideshow", "title=\"Sample Slide Show\"", "Wake up to WonderWidgets!");
    }

    @Test
    void robotsTxt() throws Exception {
        HttpResponse<String> response = get("/robots.txt");

        assertThat(contentType(response)).startsWith("text/plain");
        assertThat(response.body()).isEqualTo("User-agent: *\nDisallow: /deny\n");
    }

    @Test
    void deny() throws Exception {
        assertThat(get("/deny").body()).contains("YOU SHOULDN'T BE HERE");
    }

    @ParameterizedTest
    @CsvSource({"/image/gif, image/gif, 47", "/image/png, image/png, 89", "/image/jpeg, image/jpeg, ff"})
    void images(String path, String type, String firstByteHex) throws Exception {
        HttpResponse<byte[]> response = getBytes(path);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(contentType(response)).startsWith(type);
        assertThat(response.body()).isNotEmpty();
        assertThat(response.body()[0]).isEqualTo((byte) Integer.parseInt(firstByteHex, 16));
    }
}
