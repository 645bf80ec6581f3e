package io.httpfixture.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StatusResponsesTest {

    @ParameterizedTest
    @ValueSource(ints = {301, 302, 303, 305, 307})
    void redirectCodesPointAtRedirectOne(int code) {
        StatusResponse response = StatusResponses.forCode(code);

        assertThat(response.code()).isEqualTo(code);
        assertThat(response.headers()).containsEntry("Location", "/redirect/1");
        assertThat(response.hasBody()).isFalse();
    }

    @Test
    void unauthorizedCarriesBasicChallenge() {
        assertThat(StatusResponses.forCode(401).headers())
                .containsEntry("WWW-Authenticate", "Basic realm=\"Fake Realm\"");
    }

    @Test
    void paymentRequiredHasBodyAndMoreInfo() {
        StatusResponse response = StatusResponses.forCode(402);

        assertThat(response.contentType()).isEqualTo("text/plain");
        assertThat(response.body()).isEqualTo(StatusResponses.PAYMENT_REQUIRED_BODY);
        assertThat(response.headers()).containsEntry("x-more-info", "http://vimeo.com/22053820");
    }

    @Test
    void notAcceptableListsImageTypes() {
        StatusResponse response = StatusResponses.forCode(406);

        assertThat(response.contentType()).isEqualTo("application/json");
        assertThat(response.body()).contains("image/webp", "image/svg+xml", "image/*");
    }

    @Test
    void teapot() {
        StatusResponse response = StatusResponses.forCode(418);

        assertThat(response.body()).contains("-=[ teapot ]=-");
        assertThat(response.headers()).containsEntry("x-more-info", "http://tools.ietf.org/html/rfc2324");
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 204, 500, 777})
    void otherCodesPassThroughWithEmptyBody(int code) {
        StatusResponse response = StatusResponses.forCode(code);

        assertThat(response.code()).isEqualTo(code);
        assertThat(response.headers()).isEmpty();
        assertThat(response.hasBody()).isFalse();
        assertThat(response.bodyBytes()).isEmpty();
    }
}
