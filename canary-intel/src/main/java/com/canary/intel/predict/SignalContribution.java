package com.canary.intel.predict;

/**
 * One learned signal as it entered the combined score.
 *
 * @param fired  whether the signal was confident enough to be used
 * @param weight weight it received (0 when it did not fire)
 * @param detail pattern signature or matched keywords
 */
public record SignalContribution(
    String name,
    boolean fired,
    double value,
    double confidence,
    double weight,
    String detail
) {
    public static SignalContribution absent(String name) {
        return new SignalContribution(name, false, 0.0, 0.0, 0.0, null);
    }
}
