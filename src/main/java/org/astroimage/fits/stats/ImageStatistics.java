package org.astroimage.fits.stats;

import java.util.Collections;
import java.util.Map;

/**
 * Descriptive statistics and histogram for one raster. Variance and standard
 * deviation are population measures (divisor is the pixel count).
 */
public class ImageStatistics {

    private final String sourcePath;
    private final double minimum;
    private final double maximum;
    private final double mean;
    private final double median;
    private final double variance;
    private final double sum;
    private final int pixelCount;
    private final int bins;
    private final Map<Double, Integer> histogram;

    ImageStatistics(String sourcePath, double minimum, double maximum, double mean, double median, double variance, double sum, int pixelCount, int bins, Map<Double, Integer> histogram) {
        this.sourcePath = sourcePath;
        this.minimum = minimum;
        this.maximum = maximum;
        this.mean = mean;
        this.median = median;
        this.variance = variance;
        this.sum = sum;
        this.pixelCount = pixelCount;
        this.bins = bins;
        this.histogram = Collections.unmodifiableMap(histogram);
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public double getMinimum() {
        return minimum;
    }

    public double getMaximum() {
        return maximum;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getVariance() {
        return variance;
    }

    public double getStandardDeviation() {
        return Math.sqrt(variance);
    }

    public double getSum() {
        return sum;
    }

    public int getPixelCount() {
        return pixelCount;
    }

    /**
     * @return The number of bins requested when these statistics were computed
     */
    public int getBins() {
        return bins;
    }

    /**
     * Pixel counts keyed by bin center, in ascending bin order. When every
     * pixel has the same value there is a single entry keyed by that value.
     *
     * @return An unmodifiable map
     */
    public Map<Double, Integer> getHistogram() {
        return histogram;
    }

    @Override
    public String toString() {
        return "ImageStatistics{" + "sourcePath=" + sourcePath + ", minimum=" + minimum + ", maximum=" + maximum + ", mean=" + mean
                + ", median=" + median + ", standardDeviation=" + getStandardDeviation() + ", sum=" + sum + ", pixelCount=" + pixelCount + '}';
    }
}
