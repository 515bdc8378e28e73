package org.astroimage.fits;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The four 2x2 color filter array layouts. The name lists the channels of the
 * tile from top-left to bottom-right.
 */
public enum BayerPattern {

    RGGB(Channel.RED, Channel.GREEN, Channel.GREEN, Channel.BLUE),
    BGGR(Channel.BLUE, Channel.GREEN, Channel.GREEN, Channel.RED),
    GRBG(Channel.GREEN, Channel.RED, Channel.BLUE, Channel.GREEN),
    GBRG(Channel.GREEN, Channel.BLUE, Channel.RED, Channel.GREEN);

    private static final Logger LOG = Logger.getLogger(BayerPattern.class.getName());

    /**
     * Used when a pattern name is not recognized: the upper-left cell is
     * treated as green.
     */
    public static final BayerPattern FALLBACK = GRBG;

    private final Channel[] cells;

    BayerPattern(Channel topLeft, Channel topRight, Channel bottomLeft, Channel bottomRight) {
        this.cells = new Channel[]{topLeft, topRight, bottomLeft, bottomRight};
    }

    /**
     * The channel sensed at the given image position.
     *
     * @param row The row (y) of the pixel
     * @param col The column (x) of the pixel
     * @return The native channel of that pixel
     */
    public Channel channelAt(int row, int col) {
        return cells[((row & 1) << 1) | (col & 1)];
    }

    /**
     * Parse a header value such as {@code 'RGGB    '}. Quotes and blanks are
     * ignored, as is case.
     *
     * @param value The header value, may be null
     * @return The pattern, or null if the value does not name one
     */
    public static BayerPattern parse(String value) {
        if (value == null) {
            return null;
        }
        String name = stripQuotes(value).toUpperCase(Locale.ROOT);
        for (BayerPattern pattern : values()) {
            if (pattern.name().equals(name)) {
                return pattern;
            }
        }
        return null;
    }

    /**
     * Like {@link #parse(String)}, but never fails. Unrecognized names resolve
     * to {@link #FALLBACK}.
     *
     * @param value The pattern name
     * @return The pattern to use
     */
    public static BayerPattern forName(String value) {
        BayerPattern pattern = parse(value);
        if (pattern == null) {
            LOG.log(Level.WARNING, "Unrecognized CFA pattern {0}, using {1}", new Object[]{value, FALLBACK});
            return FALLBACK;
        }
        return pattern;
    }

    static String stripQuotes(String value) {
        String result = value.trim();
        if (result.startsWith("'")) {
            result = result.substring(1);
        }
        if (result.endsWith("'")) {
            result = result.substring(0, result.length() - 1);
        }
        return result.trim();
    }
}
