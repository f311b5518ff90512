package com.williamcallahan.llmorchestrator.service.cache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP codec for the compressed cache tier.
 */
final class PayloadCompressor {

    private PayloadCompressor() {}

    static byte[] compress(byte[] payload) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, payload.length / 2));
        try (GZIPOutputStream gzipOutputStream = new GZIPOutputStream(buffer)) {
            gzipOutputStream.write(payload);
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to compress cache payload", ioException);
        }
        return buffer.toByteArray();
    }

    static byte[] decompress(byte[] compressed) {
        try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gzipInputStream.readAllBytes();
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to decompress cache payload", ioException);
        }
    }
}
