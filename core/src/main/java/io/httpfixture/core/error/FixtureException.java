package io.httpfixture.core.error;

/**
 * Abstract base for all http-fixture exceptions. Never thrown directly; the
 * server maps each concrete subclass to a status code and an error envelope.
 */
public abstract class FixtureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected FixtureException(String message) {
        super(message);
    }

    protected FixtureException(String message, Throwable cause) {
        super(message, cause);
    }

    /** HTTP status the server answers with when this exception escapes a handler. */
    public abstract int status();
}
