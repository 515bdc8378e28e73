package org.astroimage.fits.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.astroimage.fits.FitsReader;
import org.astroimage.fits.Raster;
import org.astroimage.fits.stats.ImageStatistics;
import org.astroimage.fits.stats.StatisticsCalculator;

/**
 * Decode and analyze each FITS file given on the command line, logging the
 * statistics of each. A file which fails is reported and skipped.
 */
public class AnalyzeFiles {

    private static final Logger LOG = Logger.getLogger(AnalyzeFiles.class.getName());

    private final FitsReader reader;
    private final StatisticsCalculator calculator;
    private final int bins;

    AnalyzeFiles(FitsReader reader, StatisticsCalculator calculator, int bins) {
        this.reader = reader;
        this.calculator = calculator;
        this.bins = bins;
    }

    /**
     * @return The number of files which could not be analyzed
     */
    int run(String... paths) {
        int loaded = 0;
        int errors = 0;
        for (String path : paths) {
            try {
                Raster raster = reader.decode(path);
                ImageStatistics stats = calculator.analyze(raster, bins);
                LOG.log(Level.INFO, "{0}: {1}x{2} bayer={3} min={4} max={5} mean={6} median={7} stddev={8}",
                        new Object[]{path, raster.getWidth(), raster.getHeight(), raster.getBayerPattern(),
                            stats.getMinimum(), stats.getMaximum(), stats.getMean(), stats.getMedian(), stats.getStandardDeviation()});
                loaded++;
            } catch (IOException | RuntimeException x) {
                LOG.log(Level.WARNING, "Error loading " + path, x);
                errors++;
            }
        }
        LOG.log(Level.INFO, "Loaded {0} file(s), {1} error(s)", new Object[]{loaded, errors});
        return errors;
    }

    public static void main(String[] args) throws IOException {
        try (InputStream config = AnalyzeFiles.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        }
        if (args.length == 0) {
            System.err.println("Usage: AnalyzeFiles file.fits...");
            System.exit(2);
        }
        AnalyzeFiles analyzer = new AnalyzeFiles(new FitsReader(), new StatisticsCalculator(), StatisticsCalculator.DEFAULT_BINS);
        int errors = analyzer.run(args);
        System.exit(errors == 0 ? 0 : 1);
    }
}
