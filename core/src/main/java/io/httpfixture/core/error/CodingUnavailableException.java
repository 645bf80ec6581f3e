package io.httpfixture.core.error;

/** The codec for a content encoding cannot be loaded on this platform. */
public final class CodingUnavailableException extends FixtureException {

    private static final long serialVersionUID = 1L;

    public CodingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int status() {
        return 500;
    }
}
