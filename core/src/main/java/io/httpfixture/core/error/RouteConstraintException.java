package io.httpfixture.core.error;

/**
 * A path segment or required query parameter does not match the numeric
 * pattern of its route. Answered like an unmatched route: {@code 404}.
 */
public final class RouteConstraintException extends FixtureException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public RouteConstraintException(String parameter, String value) {
        super("'" + parameter + "' does not match the route pattern: " + value);
        this.parameter = parameter;
    }

    /** Name of the offending parameter. */
    public String parameter() {
        return parameter;
    }

    @Override
    public int status() {
        return 404;
    }
}
