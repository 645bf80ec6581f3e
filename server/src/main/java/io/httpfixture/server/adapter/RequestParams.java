package io.httpfixture.server.adapter;

import io.httpfixture.core.error.ParameterParseException;
import io.httpfixture.core.error.RouteConstraintException;
import io.javalin.http.Context;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Numeric path and query parameter parsing.
 *
 * <p>
 * Route values (path segments and the required {@code /drip} query values)
 * must match {@code \d+} or {@code \d+(\.\d+)?}; anything else raises a
 * {@link RouteConstraintException}, answered like an unmatched route.
 * Optional query values raise a {@link ParameterParseException} instead.
 */
public final class RequestParams {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");

    private RequestParams() {
        // utility class
    }

    /** Path segment matching {@code \d+}. */
    public static int pathInt(Context ctx, String name) {
        return routeInt(name, ctx.pathParam(name));
    }

    /** Path segment matching {@code \d+(\.\d+)?}, as seconds. */
    public static double pathSeconds(Context ctx, String name) {
        return routeDecimal(name, ctx.pathParam(name));
    }

    /** Required query value matching {@code \d+}. */
    public static int requiredQueryInt(Context ctx, String name) {
        return routeInt(name, ctx.queryParam(name));
    }

    /** Required query value matching {@code \d+(\.\d+)?}, as seconds. */
    public static double requiredQuerySeconds(Context ctx, String name) {
        return routeDecimal(name, ctx.queryParam(name));
    }

    /** Required, non-empty query value. */
    public static String requiredQuery(Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null || value.isEmpty()) {
            throw new RouteConstraintException(name, String.valueOf(value));
        }
        return value;
    }

    /** Optional signed integer query value; empty when absent or blank. */
    public static OptionalInt optionalQueryInt(Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null || value.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new ParameterParseException(name, e);
        }
    }

    /** Optional signed long query value; empty when absent or blank. */
    public static OptionalLong optionalQueryLong(Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null || value.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new ParameterParseException(name, e);
        }
    }

    /** Optional non-negative number of seconds; empty when absent or blank. */
    public static Optional<Double> optionalQuerySeconds(Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        double seconds;
        try {
            seconds = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ParameterParseException(name, e);
        }
        if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new ParameterParseException(name, new NumberFormatException("out of range: " + value));
        }
        return Optional.of(seconds);
    }

    private static int routeInt(String name, String value) {
        if (value == null || !DIGITS.matcher(value).matches()) {
            throw new RouteConstraintException(name, String.valueOf(value));
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            // all digits but beyond int range
            throw new RouteConstraintException(name, value);
        }
    }

    private static double routeDecimal(String name, String value) {
        if (value == null || !DECIMAL.matcher(value).matches()) {
            throw new RouteConstraintException(name, String.valueOf(value));
        }
        return Double.parseDouble(value);
    }
}
