package io.gigdraft.core;

import java.util.Locale;
import java.util.Optional;

public enum SalaryUnit {

    HOURLY("hourly", "hour"),
    DAILY("daily", "day"),
    WEEKLY("weekly", "week"),
    MONTHLY("monthly", "month");

    private final String value;
    private final String period;

    SalaryUnit(String value, String period) {
        this.value = value;
        this.period = period;
    }

    /**
     * Lowercase name used by forms and stored documents (e.g. "hourly").
     */
    public String value() {
        return value;
    }

    /**
     * Singular period the salary is paid for (e.g. "hour").
     */
    public String period() {
        return period;
    }

    public static Optional<SalaryUnit> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        for (SalaryUnit unit : values()) {
            if (unit.value.equals(s) || unit.name().toLowerCase(Locale.ROOT).equals(s)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
