package io.httpfixture.server.app;

import io.httpfixture.core.coding.ContentCoding;
import io.httpfixture.core.config.FixtureSettings;
import io.httpfixture.core.envelope.Envelopes;
import io.httpfixture.server.adapter.RequestSnapshotAdapter;
import io.httpfixture.server.handler.BasicAuthHandler;
import io.httpfixture.server.handler.BytesHandler;
import io.httpfixture.server.handler.CacheHandler;
import io.httpfixture.server.handler.CookieHandlers;
import io.httpfixture.server.handler.DelayHandler;
import io.httpfixture.server.handler.DripHandler;
import io.httpfixture.server.handler.EchoHandler;
import io.httpfixture.server.handler.EncodedHandler;
import io.httpfixture.server.handler.RedirectHandler;
import io.httpfixture.server.handler.RedirectToHandler;
import io.httpfixture.server.handler.StaticContentHandler;
import io.httpfixture.server.handler.StatusHandler;
import io.httpfixture.server.handler.StreamHandler;
import io.javalin.Javalin;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import java.util.List;

/**
 * The route table. Every endpoint answers GET and HEAD, except
 * {@code /post} (POST only) and {@code /status/{code}} (all of
 * {@link #STATUS_METHODS}).
 */
public final class FixtureRoutes {

    /** Methods accepted by {@code /status/{code}}. */
    static final List<HandlerType> STATUS_METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private FixtureRoutes() {
        // utility class
    }

    /**
     * Registers all fixture endpoints on {@code app}.
     *
     * @param app      the Javalin instance, not yet started
     * @param settings tunables handed to the paced and generated endpoints
     * @return the number of registered paths
     */
    public static int register(Javalin app, FixtureSettings settings) {
        RequestSnapshotAdapter adapter = new RequestSnapshotAdapter();
        int paths = 0;

        // Static content
        paths += readOnly(app, "/", new StaticContentHandler("/static/home.html", "text/html; charset=utf-8"));
        paths += readOnly(app, "/html", new StaticContentHandler("/static/moby-dick.html", "text/html"));
        paths += readOnly(app, "/xml", new StaticContentHandler("/static/slideshow.xml", "text/xml"));
        paths += readOnly(app, "/robots.txt", new StaticContentHandler("/static/robots.txt", "text/plain"));
        paths += readOnly(app, "/deny", new StaticContentHandler("/static/deny.txt", "text/plain"));
        paths += readOnly(app, "/image/gif", new StaticContentHandler("/static/pixel.gif", "image/gif"));
        paths += readOnly(app, "/image/png", new StaticContentHandler("/static/gradient.png", "image/png"));
        paths += readOnly(app, "/image/jpeg", new StaticContentHandler("/static/gray.jpg", "image/jpeg"));

        // Request echo
        paths += readOnly(app, "/ip", new EchoHandler(adapter, Envelopes::ip));
        paths += readOnly(app, "/user-agent", new EchoHandler(adapter, Envelopes::userAgent));
        paths += readOnly(app, "/headers", new EchoHandler(adapter, Envelopes::headers));
        paths += readOnly(app, "/get", new EchoHandler(adapter, Envelopes::get));
        app.addHttpHandler(HandlerType.POST, "/post", new EchoHandler(adapter, Envelopes::post));
        paths++;

        // Redirects and status codes
        paths += readOnly(app, "/redirect/{n}", RedirectHandler.relative());
        paths += readOnly(app, "/absolute-redirect/{n}", RedirectHandler.absolute());
        paths += readOnly(app, "/redirect-to", new RedirectToHandler());
        StatusHandler statusHandler = new StatusHandler();
        for (HandlerType method : STATUS_METHODS) {
            app.addHttpHandler(method, "/status/{code}", statusHandler);
        }
        paths++;

        // Generated and paced bodies
        paths += readOnly(app, "/bytes/{n}", new BytesHandler(settings));
        paths += readOnly(app, "/delay/{n}", new DelayHandler(settings, adapter));
        paths += readOnly(app, "/stream/{n}", new StreamHandler(settings));
        paths += readOnly(app, "/drip", new DripHandler());

        // Cookies
        paths += readOnly(app, "/cookies", new EchoHandler(adapter, Envelopes::cookies));
        paths += readOnly(app, "/cookies/set", CookieHandlers.set());
        paths += readOnly(app, "/cookies/delete", CookieHandlers.delete());

        // Caching
        paths += readOnly(app, "/cache", CacheHandler.conditional(adapter));
        paths += readOnly(app, "/cache/{n}", CacheHandler.maxAge(adapter));

        // Content codings
        paths += readOnly(app, "/gzip", new EncodedHandler(ContentCoding.GZIP, adapter));
        paths += readOnly(app, "/deflate", new EncodedHandler(ContentCoding.DEFLATE, adapter));
        paths += readOnly(app, "/brotli", new EncodedHandler(ContentCoding.BROTLI, adapter));

        // Basic auth
        paths += readOnly(app, "/basic-auth/{user}/{pass}", BasicAuthHandler.challenging());
        paths += readOnly(app, "/hidden-basic-auth/{user}/{pass}", BasicAuthHandler.hidden());

        return paths;
    }

    private static int readOnly(Javalin app, String path, Handler handler) {
        app.addHttpHandler(HandlerType.GET, path, handler);
        app.addHttpHandler(HandlerType.HEAD, path, handler);
        return 1;
    }
}
