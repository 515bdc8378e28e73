package org.astroimage.fits.stats;

/**
 * Thrown when statistics are requested for a raster with no pixels.
 */
public class EmptyImageException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EmptyImageException(String sourcePath) {
        super("Image has no pixel data: " + sourcePath);
    }
}
