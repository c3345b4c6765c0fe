package com.hts.telemetry.codec.frame;

import com.hts.telemetry.codec.exception.CompressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Connection-wide zlib stream.
 *
 * The producer flushes at every frame boundary without finishing the stream, so each
 * frame is inflated against the history left by all earlier frames. Only a compressor
 * reset frame starts a new stream.
 */
public final class Decompressor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Decompressor.class);
    private static final int CHUNK_SIZE = 8192;

    private Inflater inflater = new Inflater();
    private long framesInflated;

    public byte[] inflate(byte[] compressed) {
        inflater.setInput(compressed);
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(CHUNK_SIZE, compressed.length * 4));
        byte[] chunk = new byte[CHUNK_SIZE];
        try {
            int n;
            while ((n = inflater.inflate(chunk)) > 0) {
                out.write(chunk, 0, n);
            }
            if (inflater.needsDictionary()) {
                throw new CompressionException("Preset dictionary not supported", null);
            }
        } catch (DataFormatException e) {
            throw new CompressionException("Corrupt zlib stream after " + framesInflated + " frames", e);
        }
        framesInflated++;

        if (log.isDebugEnabled()) {
            log.debug("Inflated frame: in={} out={} totalIn={}", compressed.length, out.size(), inflater.getBytesRead());
        }
        return out.toByteArray();
    }

    public void reset() {
        inflater.end();
        inflater = new Inflater();
        framesInflated = 0;
        log.debug("Compressor reset, new inflate stream");
    }

    public long getFramesInflated() { return framesInflated; }

    @Override
    public void close() {
        inflater.end();
    }
}
