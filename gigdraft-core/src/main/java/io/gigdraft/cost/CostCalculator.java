package io.gigdraft.cost;

import io.gigdraft.core.DurationUnit;
import io.gigdraft.core.SalaryUnit;

/**
 * Converts a salary and a work duration into a total cost.
 *
 * <p>Calendar approximations are fixed so advertised pay never drifts:
 * <ul>
 *   <li>1 day = 8 hours</li>
 *   <li>1 week = 40 hours = 5 days</li>
 *   <li>1 month = 160 hours = 22 working days = 4.33 weeks</li>
 * </ul>
 *
 * <p>The arithmetic order of each conversion is part of the contract; results are compared
 * bit-for-bit with previously advertised figures.
 */
public class CostCalculator {

    public static final int HOURS_PER_DAY = 8;
    public static final int HOURS_PER_WEEK = 40;
    public static final int HOURS_PER_MONTH = 160;
    public static final int DAYS_PER_WEEK = 5;
    public static final int DAYS_PER_MONTH = 22;
    public static final double WEEKS_PER_MONTH = 4.33;

    /**
     * Total pay for {@code duration} units of {@code durationUnit} at {@code amount} per
     * {@code amountUnit}. A missing unit yields 0.
     */
    public double totalCost(double amount, SalaryUnit amountUnit, int duration, DurationUnit durationUnit) {
        if (amountUnit == null || durationUnit == null) {
            return 0.0;
        }
        return switch (amountUnit) {
            case HOURLY -> switch (durationUnit) {
                case HOURS -> amount * duration;
                case DAYS -> amount * duration * HOURS_PER_DAY;
                case WEEKS -> amount * duration * HOURS_PER_WEEK;
                case MONTHS -> amount * duration * HOURS_PER_MONTH;
            };
            case DAILY -> switch (durationUnit) {
                case HOURS -> amount * (duration / (double) HOURS_PER_DAY);
                case DAYS -> amount * duration;
                case WEEKS -> amount * duration * DAYS_PER_WEEK;
                case MONTHS -> amount * duration * DAYS_PER_MONTH;
            };
            case WEEKLY -> switch (durationUnit) {
                case HOURS -> amount * (duration / (double) HOURS_PER_WEEK);
                case DAYS -> amount * (duration / (double) DAYS_PER_WEEK);
                case WEEKS -> amount * duration;
                case MONTHS -> amount * duration * WEEKS_PER_MONTH;
            };
            case MONTHLY -> switch (durationUnit) {
                case HOURS -> amount * (duration / (double) HOURS_PER_MONTH);
                case DAYS -> amount * (duration / (double) DAYS_PER_MONTH);
                case WEEKS -> amount * (duration / WEEKS_PER_MONTH);
                case MONTHS -> amount * duration;
            };
        };
    }

    /**
     * Number of {@code amountUnit} periods covered by {@code duration} units of {@code durationUnit}.
     */
    public double periods(SalaryUnit amountUnit, int duration, DurationUnit durationUnit) {
        return totalCost(1.0, amountUnit, duration, durationUnit);
    }

    public CostBreakdown computeCost(double amount, SalaryUnit amountUnit, int duration, DurationUnit durationUnit) {
        if (amountUnit == null || durationUnit == null) {
            return new CostBreakdown(amount, 0.0, "", 0.0);
        }
        return new CostBreakdown(
                amount,
                totalCost(amount, amountUnit, duration, durationUnit),
                "per " + amountUnit.period(),
                periods(amountUnit, duration, durationUnit)
        );
    }
}
