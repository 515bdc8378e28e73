package org.astroimage.fits.debayer;

import org.astroimage.fits.Channel;

/**
 * Gray-world channel balance. Each channel is scaled so that its mean
 * normalized brightness matches the mean of all three, which removes the
 * green cast caused by a Bayer sensor having twice as many green pixels.
 */
public class ChannelBalance {

    /** Means at or below this are treated as zero */
    static final double EPSILON = 1e-6;

    static final ChannelBalance NONE = new ChannelBalance(1, 1, 1);

    private final double[] scales;

    ChannelBalance(double red, double green, double blue) {
        this.scales = new double[]{red, green, blue};
    }

    /**
     * Measure the balance of fully interpolated planes, after normalizing
     * each value into [0,1] with {@code (v - rangeMin) / range}.
     */
    static ChannelBalance measure(ColorPlanes planes, double rangeMin, double range) {
        double[] means = new double[Channel.values().length];
        for (Channel channel : Channel.values()) {
            double[] plane = planes.plane(channel);
            double sum = 0;
            for (double v : plane) {
                sum += BilinearDebayer.normalize(v, rangeMin, range);
            }
            means[channel.ordinal()] = plane.length == 0 ? 0 : sum / plane.length;
        }
        double target = (means[0] + means[1] + means[2]) / 3.0;
        return new ChannelBalance(scaleFor(target, means[0]), scaleFor(target, means[1]), scaleFor(target, means[2]));
    }

    private static double scaleFor(double target, double mean) {
        return target > EPSILON && mean > EPSILON ? target / mean : 1.0;
    }

    public double getScale(Channel channel) {
        return scales[channel.ordinal()];
    }

    @Override
    public String toString() {
        return "ChannelBalance{" + "red=" + scales[0] + ", green=" + scales[1] + ", blue=" + scales[2] + '}';
    }
}
