package de.mirkosertic.mcp.codeindex.walker;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Heuristic binary detection on the first 8 KB of a file.
 * <p>
 * A sample is binary if it contains a NUL byte, or if more than 30% of its bytes are
 * control characters other than tab, line feed, vertical tab, form feed and carriage return.
 */
public final class BinaryContentDetector {

    static final int SAMPLE_SIZE = 8192;
    private static final double MAX_CONTROL_RATIO = 0.3;

    private BinaryContentDetector() {
    }

    /**
     * @return {@code true} if the file looks binary; unreadable files are reported as text
     * so that the subsequent read produces the warning
     */
    public static boolean isBinary(final Path file) {
        final byte[] sample;
        try (final InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(SAMPLE_SIZE);
        } catch (final IOException e) {
            return false;
        }
        return isBinary(sample);
    }

    static boolean isBinary(final byte[] sample) {
        if (sample.length == 0) {
            return false;
        }
        int control = 0;
        for (final byte b : sample) {
            final int value = b & 0xff;
            if (value == 0) {
                return true;
            }
            if (value < 9 || (value > 13 && value < 32)) {
                control++;
            }
        }
        return (double) control / sample.length > MAX_CONTROL_RATIO;
    }
}
