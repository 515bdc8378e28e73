package org.astroimage.fits.scale;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.astroimage.fits.Raster;
import org.astroimage.fits.debayer.BilinearDebayer;

/**
 * Chooses how to preview a raster: debayered color when requested and the
 * raster is a CFA capture, gray otherwise.
 */
public class PreviewRenderer {

    private static final Logger LOG = Logger.getLogger(PreviewRenderer.class.getName());

    private final BilinearDebayer debayer;
    private final GrayscaleRenderer grayscale;

    public PreviewRenderer() {
        this(new BilinearDebayer(), new GrayscaleRenderer());
    }

    public PreviewRenderer(BilinearDebayer debayer, GrayscaleRenderer grayscale) {
        this.debayer = debayer;
        this.grayscale = grayscale;
    }

    /**
     * Render a preview.
     *
     * @param raster The raster
     * @param debayerEnabled Whether CFA captures should be shown in color
     * @param lower The user black point, if any
     * @param upper The user white point, if any
     * @return The preview, or empty if the raster has no usable display range
     */
    public Optional<PreviewImage> render(Raster raster, boolean debayerEnabled, OptionalDouble lower, OptionalDouble upper) {
        Optional<DisplayRange> resolved = DisplayRange.resolve(raster, lower, upper);
        if (!resolved.isPresent()) {
            return Optional.empty();
        }
        DisplayRange range = resolved.get();
        if (debayerEnabled && raster.isColorFilterArray()) {
            byte[] bgr = debayer.debayer(raster, raster.getBayerPattern(), range.getMin(), range.getMax());
            return Optional.of(new PreviewImage(raster.getWidth(), raster.getHeight(), BilinearDebayer.BYTES_PER_PIXEL, bgr, range));
        }
        if (debayerEnabled) {
            LOG.log(Level.FINE, "{0} has no CFA pattern, rendering gray", raster.getSourcePath());
        }
        return Optional.of(new PreviewImage(raster.getWidth(), raster.getHeight(), 1, grayscale.render(raster, range), range));
    }
}
