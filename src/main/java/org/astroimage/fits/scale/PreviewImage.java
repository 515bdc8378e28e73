package org.astroimage.fits.scale;

/**
 * An 8 bit preview of a raster, either gray (1 byte per pixel) or
 * interleaved BGR (3 bytes per pixel).
 */
public class PreviewImage {

    private final int width;
    private final int height;
    private final int bytesPerPixel;
    private final byte[] data;
    private final DisplayRange range;

    PreviewImage(int width, int height, int bytesPerPixel, byte[] data, DisplayRange range) {
        this.width = width;
        this.height = height;
        this.bytesPerPixel = bytesPerPixel;
        this.data = data;
        this.range = range;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getBytesPerPixel() {
        return bytesPerPixel;
    }

    public int getStride() {
        return width * bytesPerPixel;
    }

    public boolean isColor() {
        return bytesPerPixel == 3;
    }

    public byte[] getData() {
        return data;
    }

    /**
     * @return The range the pixel values were normalized with
     */
    public DisplayRange getRange() {
        return range;
    }
}
