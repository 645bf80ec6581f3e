package io.httpfixture.server.handler;

import io.httpfixture.core.engine.DripSchedule;
import io.httpfixture.core.engine.Durations;
import io.httpfixture.server.adapter.RequestParams;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.io.OutputStream;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /drip?numbytes=&duration=[&delay=][&code=]}: drips
 * {@code numbytes} bytes evenly over {@code duration} seconds.
 *
 * <p>
 * Sequence: the optional status code is committed first, then the optional
 * initial delay, then {@code numbytes} rounds of a pause of
 * {@code duration / numbytes} followed by one flushed {@code *}. The body is
 * sent without a {@code Content-Length}, so it completes with the last byte,
 * which arrives once the full duration has passed. {@code numbytes = 0}
 * answers at once with an empty body.
 */
public final class DripHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(DripHandler.class);

    private static final byte[] DRIP = {DripSchedule.DRIP_BYTE};

    @Override
    public void handle(Context ctx) throws IOException, InterruptedException {
        int numBytes = RequestParams.requiredQueryInt(ctx, "numbytes");
        double durationSeconds = RequestParams.requiredQuerySeconds(ctx, "duration");
        OptionalInt code = RequestParams.optionalQueryInt(ctx, "code");
        double delaySeconds = RequestParams.optionalQuerySeconds(ctx, "delay").orElse(0.0);

        DripSchedule schedule = DripSchedule.of(numBytes, Durations.ofSeconds(durationSeconds));
        LOG.debug("drip: {} bytes every {}, code={}, delay={}s", numBytes, schedule.interval(), code, delaySeconds);

        ctx.contentType(BytesHandler.APPLICATION_OCTET_STREAM);
        ctx.status(code.orElse(200));
        if (code.isPresent()) {
            ctx.res().flushBuffer();
        }

        Durations.sleep(Durations.ofSeconds(delaySeconds));

        OutputStream out = ctx.res().getOutputStream();
        for (int i = 0; i < schedule.numBytes(); i++) {
            Durations.sleep(schedule.interval());
            if (!PacedWrites.writeAndFlush(out, DRIP, ctx.path())) {
                return;
            }
        }
    }
}
