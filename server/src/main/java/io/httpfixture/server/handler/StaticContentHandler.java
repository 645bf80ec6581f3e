package io.httpfixture.server.handler;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.io.InputStream;

/**
 * Serves one fixed classpath resource with a fixed content type. The bytes
 * are read once, at construction.
 */
public final class StaticContentHandler implements Handler {

    private final String contentType;
    private final byte[] content;

    /**
     * @param resourcePath absolute classpath location, e.g. {@code /static/robots.txt}
     * @param contentType  value of the {@code Content-Type} response header
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public StaticContentHandler(String resourcePath, String contentType) {
        this.contentType = contentType;
        this.content = load(resourcePath);
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType(contentType);
        ctx.result(content);
    }

    private static byte[] load(String resourcePath) {
        try (InputStream in = StaticContentHandler.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Static resource not found on classpath: " + resourcePath);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read static resource " + resourcePath, e);
        }
    }
}
