package org.astroimage.fits.scale;

import java.nio.DoubleBuffer;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.astroimage.fits.Raster;

/**
 * The [min, max] window used to map pixel values onto display brightness
 * (the screen transfer function range).
 */
public class DisplayRange {

    private static final Logger LOG = Logger.getLogger(DisplayRange.class.getName());

    private final double min;
    private final double max;

    public DisplayRange(double min, double max) {
        if (!(max > min)) {
            throw new IllegalArgumentException("Invalid display range [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * The range of the finite pixel values of a raster. NaN and infinite
     * pixels are skipped.
     *
     * @param raster The raster
     * @return The range, or empty if there are no finite pixels or they all
     * have the same value
     */
    public static Optional<DisplayRange> ofData(Raster raster) {
        DoubleBuffer data = raster.getBuffer();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        while (data.hasRemaining()) {
            double v = data.get();
            if (!Double.isFinite(v)) {
                continue;
            }
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (!(max > min)) {
            LOG.log(Level.FINE, "No usable display range for {0}", raster.getSourcePath());
            return Optional.empty();
        }
        return Optional.of(new DisplayRange(min, max));
    }

    /**
     * Combine the data range with a user chosen clipping window. Each limit
     * the user has not set comes from the data; if the result is empty,
     * inverted or not a number the data range is used as is.
     *
     * @param raster The raster
     * @param lower The user black point, if any
     * @param upper The user white point, if any
     * @return The effective range, or empty if the data has no usable range
     */
    public static Optional<DisplayRange> resolve(Raster raster, OptionalDouble lower, OptionalDouble upper) {
        return ofData(raster).map(data -> {
            double min = lower.orElse(data.min);
            double max = upper.orElse(data.max);
            if (!(min < max)) {
                LOG.log(Level.FINE, "Ignoring inverted clip window [{0}, {1}]", new Object[]{min, max});
                return data;
            }
            return new DisplayRange(min, max);
        });
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * Map a value into [0,1], clamping values outside the range.
     *
     * @param value The pixel value
     * @return The normalized value
     */
    public double normalize(double value) {
        double f = (value - min) / (max - min);
        return f > 1 ? 1 : f > 0 ? f : 0;
    }

    @Override
    public String toString() {
        return "DisplayRange{" + "min=" + min + ", max=" + max + '}';
    }
}
