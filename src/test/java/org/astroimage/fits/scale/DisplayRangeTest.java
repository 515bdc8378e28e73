package org.astroimage.fits.scale;

import java.util.Optional;
import java.util.OptionalDouble;
import org.astroimage.fits.Raster;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import org.junit.Test;

public class DisplayRangeTest {

    private final Raster raster = new Raster("range.fits", 4, 1, new double[]{Double.NaN, 10, 50, Double.NEGATIVE_INFINITY});

    @Test
    public void testDataRangeSkipsNonFinite() {
        DisplayRange range = DisplayRange.ofData(raster).get();
        assertEquals(10, range.getMin(), 0);
        assertEquals(50, range.getMax(), 0);
    }

    @Test
    public void testNoUsableRange() {
        assertFalse(DisplayRange.ofData(new Raster("flat.fits", 2, 1, new double[]{3, 3})).isPresent());
        assertFalse(DisplayRange.ofData(new Raster("nan.fits", 1, 1, new double[]{Double.NaN})).isPresent());
        assertFalse(DisplayRange.resolve(new Raster("empty.fits", 0, 0, new double[0]), OptionalDouble.of(0), OptionalDouble.of(1)).isPresent());
    }

    @Test
    public void testClipWindow() {
        DisplayRange range = DisplayRange.resolve(raster, OptionalDouble.of(20), OptionalDouble.empty()).get();
        assertEquals(20, range.getMin(), 0);
        assertEquals(50, range.getMax(), 0);
        range = DisplayRange.resolve(raster, OptionalDouble.of(0), OptionalDouble.of(100)).get();
        assertEquals(0, range.getMin(), 0);
        assertEquals(100, range.getMax(), 0);
    }

    @Test
    public void testInvertedClipWindowUsesData() {
        Optional<DisplayRange> range = DisplayRange.resolve(raster, OptionalDouble.of(60), OptionalDouble.empty());
        assertEquals(10, range.get().getMin(), 0);
        assertEquals(50, range.get().getMax(), 0);
    }

    @Test
    public void testNaNClipWindowUsesData() {
        Raster pair = new Raster("pair.fits", 2, 1, new double[]{1, 2});
        DisplayRange range = DisplayRange.resolve(pair, OptionalDouble.of(Double.NaN), OptionalDouble.empty()).get();
        assertEquals(1, range.getMin(), 0);
        assertEquals(2, range.getMax(), 0);
        range = DisplayRange.resolve(pair, OptionalDouble.empty(), OptionalDouble.of(Double.NaN)).get();
        assertEquals(1, range.getMin(), 0);
        assertEquals(2, range.getMax(), 0);
    }

    @Test
    public void testNormalize() {
        DisplayRange range = new DisplayRange(100, 200);
        assertEquals(0, range.normalize(50), 0);
        assertEquals(0.25, range.normalize(125), 0);
        assertEquals(1, range.normalize(1000), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyRangeRejected() {
        new DisplayRange(1, 1);
    }
}
