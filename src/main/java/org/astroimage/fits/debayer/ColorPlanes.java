package org.astroimage.fits.debayer;

import org.astroimage.fits.Channel;

/**
 * Three full size row-major planes, one per channel, used as working storage
 * while demosaicing.
 */
class ColorPlanes {

    private final int width;
    private final int height;
    private final double[][] planes;

    ColorPlanes(int width, int height) {
        this.width = width;
        this.height = height;
        this.planes = new double[Channel.values().length][width * height];
    }

    int getWidth() {
        return width;
    }

    int getHeight() {
        return height;
    }

    double[] plane(Channel channel) {
        return planes[channel.ordinal()];
    }

    double get(Channel channel, int x, int y) {
        return planes[channel.ordinal()][y * width + x];
    }
}
