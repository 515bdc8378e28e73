package org.astroimage.fits;

import java.nio.DoubleBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded image: scaled pixel values plus the header they came with. Pixels
 * are stored row-major in a single array, so the value at (x,y) is at index
 * {@code y * width + x}. Instances are immutable.
 */
public class Raster {

    private final String sourcePath;
    private final int width;
    private final int height;
    private final double[] pixels;
    private final Map<String, String> header;
    private final BayerPattern bayerPattern;

    public Raster(String sourcePath, int width, int height, double[] pixels) {
        this(pixels.clone(), width, height, sourcePath, Collections.emptyMap(), null);
    }

    public Raster(String sourcePath, int width, int height, double[] pixels, Map<String, String> header, BayerPattern bayerPattern) {
        this(pixels.clone(), width, height, sourcePath, normalizeKeys(header), bayerPattern);
    }

    private Raster(double[] pixels, int width, int height, String sourcePath, Map<String, String> header, BayerPattern bayerPattern) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Invalid raster size " + width + "x" + height);
        }
        if ((long) width * height != pixels.length) {
            throw new IllegalArgumentException("Expected " + (long) width * height + " pixels but got " + pixels.length);
        }
        this.sourcePath = sourcePath;
        this.width = width;
        this.height = height;
        this.pixels = pixels;
        this.header = Collections.unmodifiableMap(header);
        this.bayerPattern = bayerPattern;
    }

    /**
     * Used by the reader, which hands over freshly allocated storage and an
     * already normalized header, so nothing is copied.
     */
    static Raster wrap(String sourcePath, int width, int height, double[] pixels, Map<String, String> header, BayerPattern bayerPattern) {
        return new Raster(pixels, width, height, sourcePath, header, bayerPattern);
    }

    private static Map<String, String> normalizeKeys(Map<String, String> header) {
        Map<String, String> result = new HashMap<>();
        header.forEach((key, value) -> result.put(key.trim().toUpperCase(Locale.ROOT), value));
        return result;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return pixels.length;
    }

    public double getPixel(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + "," + y + ") outside " + width + "x" + height);
        }
        return pixels[y * width + x];
    }

    /**
     * A read-only view of the row-major pixel data. Use absolute gets,
     * {@code buffer.get(y * width + x)}.
     *
     * @return The pixel buffer
     */
    public DoubleBuffer getBuffer() {
        return DoubleBuffer.wrap(pixels).asReadOnlyBuffer();
    }

    /**
     * @return A copy of the row-major pixel data
     */
    public double[] toArray() {
        return pixels.clone();
    }

    /**
     * The header keywords, upper case, mapped to their trimmed values with
     * any comment removed.
     *
     * @return An unmodifiable map
     */
    public Map<String, String> getHeader() {
        return header;
    }

    public String getHeaderValue(String keyword) {
        return header.get(keyword.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Get a header value with FITS string quoting removed, so
     * {@code 'RGGB    '} becomes {@code RGGB}.
     *
     * @param keyword The keyword, in any case
     * @return The unquoted value, or null if the keyword is absent
     */
    public String getHeaderString(String keyword) {
        String value = getHeaderValue(keyword);
        return value == null ? null : BayerPattern.stripQuotes(value);
    }

    /**
     * @return The color filter layout, or null if this is not a CFA capture
     */
    public BayerPattern getBayerPattern() {
        return bayerPattern;
    }

    public boolean isColorFilterArray() {
        return bayerPattern != null;
    }

    @Override
    public String toString() {
        return "Raster{" + "sourcePath=" + sourcePath + ", width=" + width + ", height=" + height + ", bayerPattern=" + bayerPattern + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 59 * hash + Objects.hashCode(this.sourcePath);
        hash = 59 * hash + this.width;
        hash = 59 * hash + this.height;
        hash = 59 * hash + Arrays.hashCode(this.pixels);
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
        final Raster other = (Raster) obj;
        return this.width == other.width
                && this.height == other.height
                && Objects.equals(this.sourcePath, other.sourcePath)
                && this.bayerPattern == other.bayerPattern
                && Objects.equals(this.header, other.header)
                && Arrays.equals(this.pixels, other.pixels);
    }
}
