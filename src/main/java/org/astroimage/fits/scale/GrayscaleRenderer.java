package org.astroimage.fits.scale;

import java.nio.DoubleBuffer;
import org.astroimage.fits.Raster;

/**
 * Renders a raster as 8 bit gray, one byte per pixel, row-major. NaN and
 * infinite pixels render black.
 */
public class GrayscaleRenderer {

    public byte[] render(Raster raster, DisplayRange range) {
        DoubleBuffer data = raster.getBuffer();
        byte[] gray = new byte[raster.getPixelCount()];
        int p = 0;
        while (data.hasRemaining()) {
            double v = data.get();
            gray[p++] = Double.isFinite(v) ? (byte) (int) (range.normalize(v) * 255) : 0;
        }
        return gray;
    }
}
