package org.astroimage.fits.stats;

import java.nio.DoubleBuffer;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.astroimage.fits.BatchIterator;
import org.astroimage.fits.Raster;

/**
 * Computes {@link ImageStatistics} for a raster.
 * <p>
 * NaN and infinite pixels are not filtered out. They take part in the
 * arithmetic following the usual floating point rules, so a single NaN makes
 * the minimum, maximum, sum, mean and variance NaN. Callers that need robust
 * values should clean the raster first.
 */
public class StatisticsCalculator {

    private static final Logger LOG = Logger.getLogger(StatisticsCalculator.class.getName());

    public static final int DEFAULT_BINS = Integer.getInteger("org.astroimage.fits.histogramBins", 256);

    public ImageStatistics analyze(Raster raster) {
        return analyze(raster, DEFAULT_BINS);
    }

    /**
     * Compute statistics with the given number of histogram bins.
     *
     * @param raster The raster to analyze, not modified
     * @param bins The number of equal width bins spanning [minimum, maximum]
     * @return The statistics
     * @throws EmptyImageException If the raster has no pixels
     */
    public ImageStatistics analyze(Raster raster, int bins) {
        Objects.requireNonNull(raster, "raster");
        if (bins < 1) {
            throw new IllegalArgumentException("Number of bins must be at least 1, got " + bins);
        }
        final int n = raster.getPixelCount();
        if (n == 0) {
            throw new EmptyImageException(raster.getSourcePath());
        }
        DoubleBuffer data = raster.getBuffer();
        double[] pixels = new double[n];
        data.get(pixels);

        double min = pixels[0];
        double max = pixels[0];
        double sum = 0;
        for (double v : pixels) {
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
        }
        double mean = sum / n;
        double squares = 0;
        for (double v : pixels) {
            double d = v - mean;
            squares += d * d;
        }
        double variance = squares / n;

        Map<Double, Integer> histogram = histogram(pixels, bins, min, max);

        // Sorting in place is fine now, pixels is our own copy
        Arrays.sort(pixels);
        int mid = n / 2;
        double median = n % 2 == 0 ? (pixels[mid - 1] + pixels[mid]) / 2.0 : pixels[mid];

        LOG.log(Level.FINE, "Statistics for {0}: min={1} max={2} mean={3}", new Object[]{raster.getSourcePath(), min, max, mean});
        return new ImageStatistics(raster.getSourcePath(), min, max, mean, median, variance, sum, n, bins, histogram);
    }

    /**
     * Analyze a sequence of rasters lazily, preserving order. The first
     * failure is thrown from {@code next()} and ends the sequence.
     *
     * @param rasters The rasters
     * @param bins The number of histogram bins for each
     * @return An iterator over the statistics
     */
    public BatchIterator<Raster, ImageStatistics> analyzeAll(Iterable<Raster> rasters, int bins) {
        return new BatchIterator<>(rasters.iterator(), (raster) -> analyze(raster, bins));
    }

    static Map<Double, Integer> histogram(double[] pixels, int bins, double min, double max) {
        Map<Double, Integer> histogram = new LinkedHashMap<>();
        if (max == min) {
            histogram.put(min, pixels.length);
            return histogram;
        }
        double binWidth = (max - min) / bins;
        int[] counts = new int[bins];
        for (double v : pixels) {
            // The value equal to max lands one past the end, clamp it into the last bin
            int bin = (int) Math.floor((v - min) / binWidth);
            counts[Math.max(0, Math.min(bin, bins - 1))]++;
        }
        for (int i = 0; i < bins; i++) {
            histogram.merge(min + (i + 0.5) * binWidth, counts[i], Integer::sum);
        }
        return histogram;
    }
}
