package com.questrail.pype.stats;

/**
 * Exponential moving average whose weight adapts to the time since the last
 * sample: {@code w = 1 - e^(-dt)}, with {@code dt} in seconds. A long gap lets a
 * new sample dominate; a burst of closely spaced samples moves the estimate
 * only a little. The first sample seeds the average directly.
 */
public final class AdaptiveAverage
{
    private double value;
    private boolean seeded;

    public static double weight(double elapsedSeconds)
    {
        if (elapsedSeconds <= 0) {
            return 0.0;
        }
        return 1.0 - Math.exp(-elapsedSeconds);
    }

    public void update(double sample, double elapsedSeconds)
    {
        if (!seeded) {
            value = sample;
            seeded = true;
            return;
        }
        double w = weight(elapsedSeconds);
        value = w * sample + (1.0 - w) * value;
    }

    public double value()
    {
        return value;
    }

    public boolean seeded()
    {
        return seeded;
    }
}
