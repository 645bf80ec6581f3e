package io.httpfixture.server.app;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Redirect endpoints")
class RedirectEndpointsTest extends FixtureTestHarness {

    @BeforeAll
    static void start() {
        startServer();
    }

    @ParameterizedTest
    @CsvSource({"3, /redirect/2", "2, /redirect/1", "1, /get", "0, /get"})
    void relativeRedirectCountsDown(int n, String location) throws Exception {
        HttpResponse<String> response = get("/redirect/" + n);

        assertThat(response.statusCode()).isEqualTo(302);
        assertThat(response.headers().firstValue("Location")).hasValue(location);
    }

    @Test
    @DisplayName("an HTTP/1.0 request without Host gets the server's own address")
    void absoluteRedirectWithoutHostHeader() throws Exception {
        String response;
        try (Socket socket = new Socket("127.0.0.1", app.port())) {
            socket.setSoTimeout(5_000);
            OutputStream out = socket.getOutputStream();
            out.write("GET /absolute-redirect/2 HTTP/1.0\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
            InputStream in = socket.getInputStream();
            response = new String(in.readAllBytes(), StandardCharsets.ISO_8859_1);
        }

        assertThat(response).startsWith("HTTP/1.").contains(" 302 ").doesNotContain("http://null");
        assertThat(response).containsPattern("(?i)location: http://[^\\s/]+:" + app.port() + "/absolute-redirect/1");
    }

    @Test
    void absoluteRedirectUsesHostHeader() throws Exception {
        HttpResponse<String> response = get("/absolute-redirect/2");

        assertThat(response.statusCode()).isEqualTo(302);
        assertThat(response.headers().firstValue("Location"))
                .hasValue("http://127.0.0.1:" + app.port() + "/absolute-redirect/1");
    }

    @Test
    void absoluteRedirectEndsAtGet() throws Exception {
        assertThat(get("/absolute-redirect/1").headers().firstValue("Location"))
                .hasValue("http://127.0.0.1:" + app.port() + "/get");
    }

    @Test
    @DisplayName("a following client lands on /get")
    void followedChainEndsAtGet() throws Exception {
        HttpClient following = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(5))
                .build();

        HttpResponse<String> response =
                following.send(request("/redirect/4").GET().build(), HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.uri().getPath()).isEqualTo("/get");
        int hops = 0;
        for (var previous = response.previousResponse(); previous.isPresent(); previous = previous.get().previousResponse()) {
            hops++;
        }
        assertThat(hops).isEqualTo(4);
    }

    @Test
    @DisplayName("non-numeric counter answers 404")
    void nonNumericCounter() throws Exception {
        HttpResponse<String> response = get("/redirect/abc");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(json(response).at("/error/message").asText()).contains("'n'");
    }

    @Test
    void redirectToDecodedUrl() throws Exception {
        HttpResponse<String> response = get("/redirect-to?url=http%3A%2F%2Fexample.com%2Fpath%3Fa%3Db");

        assertThat(response.statusCode()).isEqualTo(302);
        assertThat(response.headers().firstValue("Location")).hasValue("http://example.com/path?a=b");
    }

    @Test
    @DisplayName("/redirect-to without url answers 404")
    void redirectToWithoutUrl() throws Exception {
        assertThat(get("/redirect-to").statusCode()).isEqualTo(404);
    }
}
