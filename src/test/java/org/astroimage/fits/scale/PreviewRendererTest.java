package org.astroimage.fits.scale;

import java.util.Collections;
import java.util.Optional;
import java.util.OptionalDouble;
import org.astroimage.fits.BayerPattern;
import org.astroimage.fits.Raster;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class PreviewRendererTest {

    private final PreviewRenderer renderer = new PreviewRenderer();

    private static final double[] PIXELS = {0, 0.5, 0.5, 1, 0.25, Double.NaN, 0.75, 0.5};

    @Test
    public void testGrayscale() {
        byte[] gray = new GrayscaleRenderer().render(new Raster("gray.fits", 4, 2, PIXELS), new DisplayRange(0, 1));
        assertArrayEquals(new byte[]{0, 127, 127, (byte) 255, 63, 0, (byte) 191, 127}, gray);
    }

    @Test
    public void testMonochromeRendersGray() {
        Raster raster = new Raster("mono.fits", 4, 2, PIXELS);
        PreviewImage preview = renderer.render(raster, true, OptionalDouble.empty(), OptionalDouble.empty()).get();
        assertFalse(preview.isColor());
        assertEquals(4, preview.getStride());
        assertEquals(8, preview.getData().length);
        assertEquals(1, preview.getRange().getMax(), 0);
    }

    @Test
    public void testColorFilterArrayRendersColor() {
        Raster raster = new Raster("cfa.fits", 4, 2, PIXELS, Collections.emptyMap(), BayerPattern.RGGB);
        PreviewImage preview = renderer.render(raster, true, OptionalDouble.empty(), OptionalDouble.empty()).get();
        assertTrue(preview.isColor());
        assertEquals(4, preview.getWidth());
        assertEquals(2, preview.getHeight());
        assertEquals(12, preview.getStride());
        assertEquals(24, preview.getData().length);
    }

    @Test
    public void testDebayerDisabled() {
        Raster raster = new Raster("cfa.fits", 4, 2, PIXELS, Collections.emptyMap(), BayerPattern.RGGB);
        PreviewImage preview = renderer.render(raster, false, OptionalDouble.of(0.25), OptionalDouble.of(0.75)).get();
        assertFalse(preview.isColor());
        assertEquals(0.25, preview.getRange().getMin(), 0);
        assertEquals(0, preview.getData()[0]);
        assertEquals((byte) 255, preview.getData()[3]);
    }

    @Test
    public void testNaNClipWindowFallsBackToData() {
        Raster raster = new Raster("cfa.fits", 4, 2, PIXELS, Collections.emptyMap(), BayerPattern.RGGB);
        PreviewImage preview = renderer.render(raster, true, OptionalDouble.of(Double.NaN), OptionalDouble.empty()).get();
        assertTrue(preview.isColor());
        assertEquals(0, preview.getRange().getMin(), 0);
        assertEquals(1, preview.getRange().getMax(), 0);
    }

    @Test
    public void testNoUsableRange() {
        Optional<PreviewImage> preview = renderer.render(new Raster("flat.fits", 2, 1, new double[]{1, 1}), true, OptionalDouble.empty(), OptionalDouble.empty());
        assertFalse(preview.isPresent());
    }
}
