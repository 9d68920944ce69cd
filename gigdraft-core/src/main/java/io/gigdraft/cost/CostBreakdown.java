package io.gigdraft.cost;

/**
 * Derived pay figures for a draft. Recomputed on every cost-relevant change, never stored.
 *
 * baseAmount     : salary per period as entered
 * totalAmount    : pay for the whole duration
 * perPeriodLabel : e.g. "per day"
 * totalPeriods   : number of salary periods the duration covers (e.g. 2.5 days)
 */
public record CostBreakdown(
        double baseAmount,
        double totalAmount,
        String perPeriodLabel,
        double totalPeriods
) {
    public static CostBreakdown zero() {
        return new CostBreakdown(0.0, 0.0, "", 0.0);
    }
}
