package net;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * Newline-delimited reader with a hard cap on line length.
 * A trailing {@code \r} before the newline is dropped. A line that grows past the cap
 * is a {@link ProtocolException}; the stream is not usable afterwards.
 */
public final class LineReader implements Closeable {
    public static final int DEFAULT_MAX_CHARS = 64 * 1024;

    private final Reader in;
    private final int    maxChars;
    private final char[] buf = new char[8192];
    private int pos, limit;

    public LineReader(Reader in) {
        this(in, DEFAULT_MAX_CHARS);
    }

    public LineReader(Reader in, int maxChars) {
        this.in = in;
        this.maxChars = maxChars;
    }

    /** @return the next line without its terminator, or null at end of stream */
    public String readLine() throws IOException, ProtocolException {
        StringBuilder line = null;
        while (true) {
            if (pos == limit) {
                limit = in.read(buf, 0, buf.length);
                pos = 0;
                if (limit <= 0) {
                    limit = 0;
                    return line == null ? null : stripCr(line);
                }
            }
            int start = pos;
            while (pos < limit && buf[pos] != '\n') pos++;

            if (line == null) line = new StringBuilder(Math.min(maxChars, Math.max(16, pos - start)));
            if (line.length() + (pos - start) > maxChars) {
                throw new ProtocolException("line longer than " + maxChars + " chars");
            }
            line.append(buf, start, pos - start);

            if (pos < limit) {   // hit '\n'
                pos++;
                return stripCr(line);
            }
        }
    }

    private static String stripCr(StringBuilder line) {
        int n = line.length();
        if (n > 0 && line.charAt(n - 1) == '\r') line.setLength(n - 1);
        return line.toString();
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
