package io.httpfixture.core.engine;

/**
 * Redirect chain that counts down to {@code /get}.
 *
 * <p>
 * A request for hop {@code n} points at hop {@code n - 1} of the same
 * endpoint, and hops {@code 0} and {@code 1} point at {@code /get}, so a
 * client following the chain makes exactly {@code max(n, 1)} redirects.
 */
public final class RedirectChain {

    /** Terminal location of every chain. */
    public static final String TERMINAL = "/get";

    /** Relative chain rooted at {@code /redirect/{n}}. */
    public static final RedirectChain RELATIVE = new RedirectChain("/redirect/");

    /** Absolute chain rooted at {@code /absolute-redirect/{n}}. */
    public static final RedirectChain ABSOLUTE = new RedirectChain("/absolute-redirect/");

    private final String prefix;

    private RedirectChain(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Path of the next hop after hop {@code n}.
     *
     * @param n the current hop counter, {@code >= 0}
     * @return {@code /get} when {@code n <= 1}, otherwise the same endpoint with {@code n - 1}
     */
    public String next(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("redirect counter must not be negative: " + n);
        }
        return n <= 1 ? TERMINAL : prefix + (n - 1);
    }

    /**
     * Fully-qualified location of the next hop.
     *
     * @param host the request's {@code Host} value, e.g. {@code 127.0.0.1:8080}
     * @param n    the current hop counter
     * @return {@code http://<host>} followed by {@link #next(int)}
     */
    public String nextAbsolute(String host, int n) {
        return "http://" + host + next(n);
    }

    /** Number of redirects a client follows from hop {@code n} to {@code /get}. */
    public static int hops(int n) {
        return Math.max(n, 1);
    }
}
