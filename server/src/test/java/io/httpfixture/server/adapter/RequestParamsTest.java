package io.httpfixture.server.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.httpfixture.core.error.ParameterParseException;
import io.httpfixture.core.error.RouteConstraintException;
import io.javalin.http.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RequestParams: numeric path and query values")
class RequestParamsTest {

    private Context ctx;

    @BeforeEach
    void setUp() {
        ctx = mock(Context.class);
    }

    @Nested
    @DisplayName("route-constrained values answer 404")
    class RouteValues {

        @Test
        void digitsParse() {
            when(ctx.pathParam("n")).thenReturn("42");
            assertThat(RequestParams.pathInt(ctx, "n")).isEqualTo(42);
        }

        @ParameterizedTest
        @ValueSource(strings = {"-1", "abc", "1.5", "", "99999999999"})
        void nonDigitsOrOverflowAreRouteMismatches(String value) {
            when(ctx.pathParam("n")).thenReturn(value);

            assertThatThrownBy(() -> RequestParams.pathInt(ctx, "n"))
                    .isInstanceOfSatisfying(
                            RouteConstraintException.class, e -> assertThat(e.status()).isEqualTo(404));
        }

        @Test
        void decimalSeconds() {
            when(ctx.pathParam("n")).thenReturn("0.25");
            assertThat(RequestParams.pathSeconds(ctx, "n")).isEqualTo(0.25);
        }

        @ParameterizedTest
        @ValueSource(strings = {".5", "1.", "1e3", "-2"})
        void malformedDecimalsAreRouteMismatches(String value) {
            when(ctx.pathParam("n")).thenReturn(value);

            assertThatThrownBy(() -> RequestParams.pathSeconds(ctx, "n")).isInstanceOf(RouteConstraintException.class);
        }

        @Test
        void missingRequiredQueryIsRouteMismatch() {
            assertThatThrownBy(() -> RequestParams.requiredQueryInt(ctx, "numbytes"))
                    .isInstanceOf(RouteConstraintException.class);
            assertThatThrownBy(() -> RequestParams.requiredQuerySeconds(ctx, "duration"))
                    .isInstanceOf(RouteConstraintException.class);
            assertThatThrownBy(() -> RequestParams.requiredQuery(ctx, "url"))
                    .isInstanceOf(RouteConstraintException.class);
        }

        @Test
        void requiredQueryValues() {
            when(ctx.queryParam("numbytes")).thenReturn("10");
            when(ctx.queryParam("duration")).thenReturn("1.5");
            when(ctx.queryParam("url")).thenReturn("http://example.com/");

            assertThat(RequestParams.requiredQueryInt(ctx, "numbytes")).isEqualTo(10);
            assertThat(RequestParams.requiredQuerySeconds(ctx, "duration")).isEqualTo(1.5);
            assertThat(RequestParams.requiredQuery(ctx, "url")).isEqualTo("http://example.com/");
        }
    }

    @Nested
    @DisplayName("optional values answer 500 when malformed")
    class OptionalValues {

        @Test
        void absentOrEmptyIsEmpty() {
            when(ctx.queryParam("code")).thenReturn("");

            assertThat(RequestParams.optionalQueryInt(ctx, "code")).isEmpty();
            assertThat(RequestParams.optionalQueryLong(ctx, "seed")).isEmpty();
            assertThat(RequestParams.optionalQuerySeconds(ctx, "delay")).isEmpty();
        }

        @Test
        void signedValuesParse() {
            when(ctx.queryParam("seed")).thenReturn("-1234567890123");
            when(ctx.queryParam("code")).thenReturn("201");
            when(ctx.queryParam("delay")).thenReturn("0.5");

            assertThat(RequestParams.optionalQueryLong(ctx, "seed")).hasValue(-1234567890123L);
            assertThat(RequestParams.optionalQueryInt(ctx, "code")).hasValue(201);
            assertThat(RequestParams.optionalQuerySeconds(ctx, "delay")).contains(0.5);
        }

        @Test
        void malformedSeedNamesTheParameter() {
            when(ctx.queryParam("seed")).thenReturn("abc");

            assertThatThrownBy(() -> RequestParams.optionalQueryLong(ctx, "seed"))
                    .isInstanceOf(ParameterParseException.class)
                    .hasMessage("failed to parse 'seed'");
        }

        @ParameterizedTest
        @ValueSource(strings = {"-1", "NaN", "Infinity", "soon"})
        void invalidDelayFails(String value) {
            when(ctx.queryParam("delay")).thenReturn(value);

            assertThatThrownBy(() -> RequestParams.optionalQuerySeconds(ctx, "delay"))
                    .isInstanceOf(ParameterParseException.class)
                    .hasMessage("failed to parse 'delay'");
        }

        @Test
        void malformedCodeFails() {
            when(ctx.queryParam("code")).thenReturn("2xx");

            assertThatThrownBy(() -> RequestParams.optionalQueryInt(ctx, "code"))
                    .isInstanceOf(ParameterParseException.class);
        }
    }
}
