package com.hts.telemetry.codec;

import com.hts.telemetry.codec.protocol.FrameHeader;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.Deflater;

/**
 * Builds wire frames the way a router emits them.
 */
public final class Frames {

    private Frames() {}

    public static byte[] v2(int type, long flags, byte[] payload) {
        ByteBuf buf = Unpooled.buffer(FrameHeader.HEADER_LENGTH_V2 + payload.length);
        buf.writeInt(type);
        buf.writeInt((int) flags);
        buf.writeInt(payload.length);
        buf.writeBytes(payload);
        return toArray(buf);
    }

    public static byte[] v1(int type, byte[] payload) {
        ByteBuf buf = Unpooled.buffer(FrameHeader.HEADER_LENGTH_V1 + FrameHeader.V1_INNER_HEADER_LENGTH + payload.length);
        buf.writeInt(FrameHeader.V1_INNER_HEADER_LENGTH + payload.length);
        buf.writeInt(type);
        buf.writeInt(payload.length);
        buf.writeBytes(payload);
        return toArray(buf);
    }

    public static byte[] v2Reset() {
        return v2(FrameHeader.TYPE_COMPRESSOR_RESET, FrameHeader.FLAG_NONE, new byte[0]);
    }

    public static byte[] v1Reset() {
        return v1(FrameHeader.TYPE_COMPRESSOR_RESET, new byte[0]);
    }

    public static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    private static byte[] toArray(ByteBuf buf) {
        byte[] bytes = new byte[buf.readableBytes()];
        buf.readBytes(bytes);
        buf.release();
        return bytes;
    }

    /**
     * Producer side of the zlib stream: sync-flushes every frame, never finishes.
     */
    public static final class Compressor {
        private Deflater deflater = new Deflater();

        public byte[] compress(byte[] data) {
            deflater.setInput(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[256];
            int n;
            do {
                n = deflater.deflate(buf, 0, buf.length, Deflater.SYNC_FLUSH);
                out.write(buf, 0, n);
            } while (n == buf.length);
            return out.toByteArray();
        }

        public void reset() {
            deflater.end();
            deflater = new Deflater();
        }
    }
}
