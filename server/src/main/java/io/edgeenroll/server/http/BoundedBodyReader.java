package io.edgeenroll.server.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a request body without ever buffering more than the configured cap
 * plus one chunk. Safe to abandon mid-read: nothing is retained.
 */
final class BoundedBodyReader {

    private static final int CHUNK_SIZE = 8192;

    private BoundedBodyReader() {}

    /**
     * @param in            the body stream
     * @param declaredLength {@code Content-Length}, or a negative value if
     *                       unknown
     * @param maxBytes      largest accepted body
     * @throws PayloadTooLargeException if the body is, or claims to be, larger
     *                                  than {@code maxBytes}
     * @throws IOException              if the stream fails
     */
    static byte[] read(InputStream in, long declaredLength, int maxBytes) throws IOException {
        if (declaredLength > maxBytes) {
            throw new PayloadTooLargeException(maxBytes);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(declaredLength > 0 ? (int) declaredLength : CHUNK_SIZE);
        byte[] buffer = new byte[CHUNK_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }
}
