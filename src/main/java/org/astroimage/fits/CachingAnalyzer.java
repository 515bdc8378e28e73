package org.astroimage.fits;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.astroimage.fits.stats.ImageStatistics;
import org.astroimage.fits.stats.StatisticsCalculator;

/**
 * Keeps decoded rasters and their statistics in memory, keyed by source path,
 * so that switching between already loaded images is cheap. Statistics are
 * keyed by path and bin count, and are only recomputed when a different bin
 * count is asked for. Debayered previews are never cached.
 * <p>
 * Cache sizes can be set with the system properties
 * {@code org.astroimage.fits.rasterCacheSize} and
 * {@code org.astroimage.fits.statisticsCacheSize}.
 */
public class CachingAnalyzer {

    private static final Logger LOG = Logger.getLogger(CachingAnalyzer.class.getName());

    private final LoadingCache<String, Raster> rasterCache;
    private final LoadingCache<StatisticsKey, ImageStatistics> statisticsCache;

    public CachingAnalyzer() {
        this(new FitsReader(), new StatisticsCalculator());
    }

    public CachingAnalyzer(FitsReader reader, StatisticsCalculator calculator) {
        rasterCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.astroimage.fits.rasterCacheSize", 100))
                .recordStats()
                .build((String path) -> reader.decode(path));

        statisticsCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.astroimage.fits.statisticsCacheSize", 1_000))
                .recordStats()
                .build((StatisticsKey key) -> {
                    Raster raster = rasterCache.get(key.path);
                    return Timed.execute(() -> calculator.analyze(raster, key.bins), "Statistics for %s with %d bins took %dms", key.path, key.bins);
                });
    }

    /**
     * Get the decoded raster for a file, decoding it on first use.
     *
     * @param path The file
     * @return The raster
     * @throws IOException If the file cannot be decoded
     */
    public Raster getRaster(String path) throws IOException {
        try {
            return rasterCache.get(path);
        } catch (CompletionException x) {
            throw unwrap(x);
        }
    }

    public ImageStatistics getStatistics(String path) throws IOException {
        return getStatistics(path, StatisticsCalculator.DEFAULT_BINS);
    }

    /**
     * Get statistics for a file, decoding and analyzing it as needed.
     *
     * @param path The file
     * @param bins The number of histogram bins
     * @return The statistics
     * @throws IOException If the file cannot be decoded
     */
    public ImageStatistics getStatistics(String path, int bins) throws IOException {
        try {
            return statisticsCache.get(new StatisticsKey(path, bins));
        } catch (CompletionException x) {
            throw unwrap(x);
        }
    }

    /**
     * Forget everything cached for a file, e.g. after it changed on disk.
     *
     * @param path The file
     */
    public void invalidate(String path) {
        rasterCache.invalidate(path);
        statisticsCache.asMap().keySet().removeIf(key -> key.path.equals(path));
    }

    public void invalidateAll() {
        rasterCache.invalidateAll();
        statisticsCache.invalidateAll();
    }

    public void report() {
        LOG.log(Level.INFO, "raster Cache size {0} stats {1}", new Object[]{rasterCache.estimatedSize(), rasterCache.stats()});
        LOG.log(Level.INFO, "statistics Cache size {0} stats {1}", new Object[]{statisticsCache.estimatedSize(), statisticsCache.stats()});
    }

    private static IOException unwrap(CompletionException x) {
        Throwable cause = x.getCause();
        if (cause instanceof IOException ioException) {
            return ioException;
        } else {
            return new IOException("Unexpected exception during image analysis", cause);
        }
    }

    private static class StatisticsKey {

        private final String path;
        private final int bins;

        StatisticsKey(String path, int bins) {
            this.path = path;
            this.bins = bins;
        }

        @Override
        public int hashCode() {
            int hash = 7;
            hash = 19 * hash + Objects.hashCode(this.path);
            hash = 19 * hash + this.bins;
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            final StatisticsKey other = (StatisticsKey) obj;
            return this.bins == other.bins && Objects.equals(this.path, other.path);
        }
    }
}
