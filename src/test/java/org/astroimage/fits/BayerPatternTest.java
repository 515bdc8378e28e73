package org.astroimage.fits;

import static org.astroimage.fits.Channel.BLUE;
import static org.astroimage.fits.Channel.GREEN;
import static org.astroimage.fits.Channel.RED;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import org.junit.Test;

public class BayerPatternTest {

    @Test
    public void testLayouts() {
        assertTile(BayerPattern.RGGB, RED, GREEN, GREEN, BLUE);
        assertTile(BayerPattern.BGGR, BLUE, GREEN, GREEN, RED);
        assertTile(BayerPattern.GRBG, GREEN, RED, BLUE, GREEN);
        assertTile(BayerPattern.GBRG, GREEN, BLUE, RED, GREEN);
    }

    @Test
    public void testTileRepeats() {
        for (BayerPattern pattern : BayerPattern.values()) {
            for (int row = 0; row < 6; row++) {
                for (int col = 0; col < 6; col++) {
                    assertEquals(pattern.channelAt(row % 2, col % 2), pattern.channelAt(row, col));
                }
            }
        }
    }

    @Test
    public void testParse() {
        assertSame(BayerPattern.RGGB, BayerPattern.parse("RGGB"));
        assertSame(BayerPattern.BGGR, BayerPattern.parse("'BGGR    '"));
        assertSame(BayerPattern.GBRG, BayerPattern.parse(" gbrg "));
        assertNull(BayerPattern.parse("RGB"));
        assertNull(BayerPattern.parse(""));
        assertNull(BayerPattern.parse(null));
    }

    @Test
    public void testUnknownNameFallsBackToGreenUpperLeft() {
        BayerPattern pattern = BayerPattern.forName("XTRANS");
        assertSame(BayerPattern.FALLBACK, pattern);
        assertEquals(GREEN, pattern.channelAt(0, 0));
    }

    private static void assertTile(BayerPattern pattern, Channel topLeft, Channel topRight, Channel bottomLeft, Channel bottomRight) {
        assertEquals(topLeft, pattern.channelAt(0, 0));
        assertEquals(topRight, pattern.channelAt(0, 1));
        assertEquals(bottomLeft, pattern.channelAt(1, 0));
        assertEquals(bottomRight, pattern.channelAt(1, 1));
    }
}
