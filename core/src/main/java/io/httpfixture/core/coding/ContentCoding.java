package io.httpfixture.core.coding;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.encoder.BrotliOutputStream;
import com.aayushatharva.brotli4j.encoder.Encoder;
import io.httpfixture.core.error.CodingUnavailableException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Content codings the encoding endpoints apply to their JSON payload.
 *
 * <p>
 * Each constant knows its {@code Content-Encoding} token, the boolean field
 * its envelope sets, and how to wrap a response stream in the matching
 * compressor. Callers must close the returned stream before the response
 * completes; closing finishes the compressed frame and closes the
 * underlying stream.
 */
public enum ContentCoding {

    /** gzip member format. */
    GZIP("gzip", "gzipped") {
        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            return new GZIPOutputStream(out);
        }
    },

    /** zlib-wrapped DEFLATE at best compression. */
    DEFLATE("deflate", "deflated") {
        @Override
        public OutputStream wrap(OutputStream out) {
            Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
            return new DeflaterOutputStream(out, deflater) {
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        deflater.end();
                    }
                }
            };
        }
    },

    /** Brotli, through the brotli4j native encoder. */
    BROTLI("br", "compressed") {
        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            if (!Brotli4jLoader.isAvailable()) {
                throw new CodingUnavailableException(
                        "brotli encoder is not available on this platform",
                        Brotli4jLoader.getUnavailabilityCause());
            }
            return new BrotliOutputStream(out, new Encoder.Parameters().setQuality(BROTLI_QUALITY));
        }
    };

    private static final int BROTLI_QUALITY = 11;

    private final String token;
    private final String flagField;

    ContentCoding(String token, String flagField) {
        this.token = token;
        this.flagField = flagField;
    }

    /** Value of the {@code Content-Encoding} response header. */
    public String token() {
        return token;
    }

    /** Name of the boolean envelope field asserting this coding was applied. */
    public String flagField() {
        return flagField;
    }

    /**
     * Wraps {@code out} in this coding's compressor.
     *
     * @param out the raw response stream
     * @return a compressing stream that must be closed to finish the payload
     * @throws IOException                 if the compressor cannot write its header
     * @throws CodingUnavailableException if the codec is missing on this platform
     */
    public abstract OutputStream wrap(OutputStream out) throws IOException;
}
