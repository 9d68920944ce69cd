package io.gigdraft.core;

import java.util.Locale;
import java.util.Optional;

public enum DurationUnit {

    HOURS("hours"),
    DAYS("days"),
    WEEKS("weeks"),
    MONTHS("months");

    private final String value;

    DurationUnit(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<DurationUnit> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        for (DurationUnit unit : values()) {
            if (unit.value.equals(s)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
