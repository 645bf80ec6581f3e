package io.httpfixture.core.error;

/** Request body declared as JSON but not parseable as JSON. */
public final class BodyParseException extends FixtureException {

    private static final long serialVersionUID = 1L;

    public BodyParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int status() {
        return 500;
    }
}
