package org.astroimage.fits.debayer;

import java.nio.DoubleBuffer;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.astroimage.fits.BayerPattern;
import org.astroimage.fits.Channel;
import org.astroimage.fits.Raster;
import org.astroimage.fits.Timed;

/**
 * Bilinear demosaicing of a single channel color filter array capture into
 * interleaved 8 bit BGR (3 bytes per pixel, stride {@code width * 3}).
 * <p>
 * The work is done in four phases, each parallel over rows and each reading
 * only the fully written output of the one before:
 * <ol>
 * <li>scatter every sample into the plane of its native channel, replacing NaN
 * and infinite values by the range minimum;</li>
 * <li>fill the two missing channels of every pixel with the mean of the same
 * channel samples among its 8 neighbors (neighbors off the edge are skipped,
 * no neighbors gives 0);</li>
 * <li>measure the gray-world {@link ChannelBalance} of the normalized
 * planes;</li>
 * <li>normalize, balance, clamp and pack to bytes.</li>
 * </ol>
 * Phase 3 can be disabled, in which case every channel scale is 1.
 */
public class BilinearDebayer {

    private static final Logger LOG = Logger.getLogger(BilinearDebayer.class.getName());
    public static final int BYTES_PER_PIXEL = 3;

    private final boolean grayWorldBalance;

    public BilinearDebayer() {
        this(true);
    }

    public BilinearDebayer(boolean grayWorldBalance) {
        this.grayWorldBalance = grayWorldBalance;
    }

    /**
     * Debayer using a pattern name. Unrecognized names fall back to
     * {@link BayerPattern#FALLBACK} rather than failing.
     *
     * @see #debayer(Raster, BayerPattern, double, double)
     */
    public byte[] debayer(Raster raster, String pattern, double rangeMin, double rangeMax) {
        return debayer(raster, BayerPattern.forName(pattern), rangeMin, rangeMax);
    }

    /**
     * Debayer a raster. Values are normalized with
     * {@code (v - rangeMin) / (rangeMax - rangeMin)}; if {@code rangeMax <= rangeMin}
     * a range of width 1 is used instead.
     *
     * @param raster The CFA capture, not modified
     * @param pattern The color filter layout
     * @param rangeMin The black point
     * @param rangeMax The white point
     * @return A new BGR buffer of length {@code width * height * 3}
     */
    public byte[] debayer(Raster raster, BayerPattern pattern, double rangeMin, double rangeMax) {
        Objects.requireNonNull(raster, "raster");
        Objects.requireNonNull(pattern, "pattern");
        final double range = range(rangeMin, rangeMax);
        return Timed.execute(() -> {
            ColorPlanes planes = reconstruct(raster, pattern, rangeMin);
            ChannelBalance balance = grayWorldBalance ? ChannelBalance.measure(planes, rangeMin, range) : ChannelBalance.NONE;
            LOG.log(Level.FINE, "Debayering {0} as {1} with {2}", new Object[]{raster.getSourcePath(), pattern, balance});
            return pack(planes, balance, rangeMin, range);
        }, "Debayering %s took %dms", raster.getSourcePath());
    }

    /**
     * Compute the gray-world balance that {@link #debayer} would apply, without
     * producing any output.
     *
     * @param raster The CFA capture
     * @param pattern The color filter layout
     * @param rangeMin The black point
     * @param rangeMax The white point
     * @return The per-channel scale factors
     */
    public ChannelBalance measureBalance(Raster raster, BayerPattern pattern, double rangeMin, double rangeMax) {
        ColorPlanes planes = reconstruct(raster, pattern, rangeMin);
        return ChannelBalance.measure(planes, rangeMin, range(rangeMin, rangeMax));
    }

    private static double range(double rangeMin, double rangeMax) {
        if (rangeMax > rangeMin) {
            return rangeMax - rangeMin;
        }
        LOG.log(Level.FINE, "Degenerate range [{0}, {1}], using width 1", new Object[]{rangeMin, rangeMax});
        return 1.0;
    }

    /**
     * Phases 1 and 2: build fully populated color planes.
     */
    static ColorPlanes reconstruct(Raster raster, BayerPattern pattern, double rangeMin) {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final DoubleBuffer data = raster.getBuffer();
        final ColorPlanes planes = new ColorPlanes(width, height);

        IntStream.range(0, height).parallel().forEach(y -> {
            int p = y * width;
            for (int x = 0; x < width; x++) {
                double v = data.get(p);
                if (!Double.isFinite(v)) {
                    v = rangeMin;
                }
                planes.plane(pattern.channelAt(y, x))[p] = v;
                p++;
            }
        });

        IntStream.range(0, height).parallel().forEach(y -> {
            for (int x = 0; x < width; x++) {
                Channel sensed = pattern.channelAt(y, x);
                for (Channel channel : Channel.values()) {
                    if (channel != sensed) {
                        planes.plane(channel)[y * width + x] = interpolate(planes, pattern, channel, x, y);
                    }
                }
            }
        });
        return planes;
    }

    /**
     * Mean of the natively sampled values of a channel among the 8 neighbors
     * of (x,y). Only native samples are read, and phase 2 never writes those,
     * so rows can be filled concurrently.
     */
    private static double interpolate(ColorPlanes planes, BayerPattern pattern, Channel channel, int x, int y) {
        final int width = planes.getWidth();
        final int height = planes.getHeight();
        final double[] plane = planes.plane(channel);
        double sum = 0;
        int count = 0;
        for (int ny = y - 1; ny <= y + 1; ny++) {
            if (ny < 0 || ny >= height) {
                continue;
            }
            for (int nx = x - 1; nx <= x + 1; nx++) {
                if (nx < 0 || nx >= width || (nx == x && ny == y)) {
                    continue;
                }
                if (pattern.channelAt(ny, nx) == channel) {
                    double v = plane[ny * width + nx];
                    if (Double.isFinite(v)) {
                        sum += v;
                        count++;
                    }
                }
            }
        }
        return count > 0 ? sum / count : 0;
    }

    /**
     * Phase 4: normalize, balance and write interleaved (blue, green, red).
     */
    static byte[] pack(ColorPlanes planes, ChannelBalance balance, double rangeMin, double range) {
        final int width = planes.getWidth();
        final int height = planes.getHeight();
        final double[] red = planes.plane(Channel.RED);
        final double[] green = planes.plane(Channel.GREEN);
        final double[] blue = planes.plane(Channel.BLUE);
        final double scaleR = balance.getScale(Channel.RED);
        final double scaleG = balance.getScale(Channel.GREEN);
        final double scaleB = balance.getScale(Channel.BLUE);
        final byte[] bgr = new byte[width * height * BYTES_PER_PIXEL];

        IntStream.range(0, height).parallel().forEach(y -> {
            int p = y * width;
            int idx = y * width * BYTES_PER_PIXEL;
            for (int x = 0; x < width; x++) {
                bgr[idx] = toByte(normalize(blue[p], rangeMin, range) * scaleB);
                bgr[idx + 1] = toByte(normalize(green[p], rangeMin, range) * scaleG);
                bgr[idx + 2] = toByte(normalize(red[p], rangeMin, range) * scaleR);
                idx += BYTES_PER_PIXEL;
                p++;
            }
        });
        return bgr;
    }

    static double normalize(double v, double rangeMin, double range) {
        return clamp((v - rangeMin) / range);
    }

    /**
     * Convert a [0,1] value to an unsigned byte, truncating.
     */
    static byte toByte(double v) {
        return (byte) (int) (clamp(v) * 255);
    }

    private static double clamp(double v) {
        // NaN compares false both ways and ends up as 0
        return v > 1 ? 1 : v > 0 ? v : 0;
    }
}
