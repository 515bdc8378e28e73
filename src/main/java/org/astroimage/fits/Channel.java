package org.astroimage.fits;

/**
 * The three color channels sensed by a color filter array.
 */
public enum Channel {
    RED, GREEN, BLUE
}
