package com.shellrelay.mcp.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles newline-delimited frames from arbitrarily chunked stdout bytes.
 * <p>
 * Splitting happens on the raw {@code '\n'} byte before decoding, so a multi-byte
 * UTF-8 character cut across two chunks is decoded intact. A trailing {@code '\r'}
 * is dropped and whitespace-only lines are skipped. Not thread-safe; fed from the
 * single reader thread.
 */
public class FrameReader {

    private final ByteArrayOutputStream residual = new ByteArrayOutputStream();

    /**
     * Appends {@code chunk} and returns every line it completes, in order.
     */
    public List<String> feed(byte[] chunk) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < chunk.length; i++) {
            if (chunk[i] == '\n') {
                residual.write(chunk, start, i - start);
                addLine(lines, residual.toByteArray());
                residual.reset();
                start = i + 1;
            }
        }
        residual.write(chunk, start, chunk.length - start);
        return lines;
    }

    /** Number of buffered bytes not yet terminated by a newline. */
    public int pending() {
        return residual.size();
    }

    public void reset() {
        residual.reset();
    }

    private static void addLine(List<String> lines, byte[] bytes) {
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        String line = new String(bytes, 0, length, StandardCharsets.UTF_8);
        if (!line.isBlank()) {
            lines.add(line);
        }
    }
}
