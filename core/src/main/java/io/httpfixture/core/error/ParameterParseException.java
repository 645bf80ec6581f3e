package io.httpfixture.core.error;

/**
 * An optional numeric query parameter ({@code seed}, {@code delay},
 * {@code code}) could not be parsed. Answered with {@code 500}.
 */
public final class ParameterParseException extends FixtureException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public ParameterParseException(String parameter, Throwable cause) {
        super("failed to parse '" + parameter + "'", cause);
        this.parameter = parameter;
    }

    /** Name of the offending parameter. */
    public String parameter() {
        return parameter;
    }

    @Override
    public int status() {
        return 500;
    }
}
