package com.questrail.pype.session;

/**
 * RateController
 * -----------------------------------------------------------------------------
 * Current-limiting-receiver (CLR) rule for the master's outbound video rate.
 *
 * <ul>
 *   <li>No CLR yet: the reporter becomes CLR and its rate is adopted.</li>
 *   <li>Reporter is the CLR: its rate is always adopted.</li>
 *   <li>Another reporter with a strictly lower rate takes over as CLR.</li>
 *   <li>Anything else is ignored.</li>
 * </ul>
 * An adopted rate is blended into the live rate as
 * {@code 0.6 * current + 0.4 * proposed}.
 *
 * <p>Feedback arrives on the event loop while the video sender reads the rate,
 * hence the synchronization.</p>
 */
public final class RateController
{
    static final double KEEP = 0.6;
    static final double ADOPT = 0.4;

    private final double minRate;
    private final double maxRate;

    private String clr;
    private int clrRate;
    private double currentRate;

    public RateController(double initialRate, double minRate, double maxRate)
    {
        if (!(minRate > 0) || maxRate < minRate) {
            throw new IllegalArgumentException("Require 0 < minRate <= maxRate");
        }
        this.minRate = minRate;
        this.maxRate = maxRate;
        this.currentRate = clamp(initialRate);
    }

    /**
     * Applies one feedback report.
     *
     * @return {@code true} if the report was adopted
     */
    public synchronized boolean onFeedback(String source, int rate)
    {
        boolean adopt = clr == null
                || clr.equals(source)
                || rate < clrRate;
        if (!adopt) {
            return false;
        }
        clr = source;
        clrRate = rate;
        currentRate = clamp(KEEP * currentRate + ADOPT * rate);
        return true;
    }

    /**
     * Forget the CLR, e.g. when it leaves the call.
     */
    public synchronized void forget(String participant)
    {
        if (participant.equals(clr)) {
            clr = null;
            clrRate = 0;
        }
    }

    public synchronized double currentRate()
    {
        return currentRate;
    }

    public synchronized String clr()
    {
        return clr;
    }

    private double clamp(double rate)
    {
        return Math.max(minRate, Math.min(maxRate, rate));
    }
}
