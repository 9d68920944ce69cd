package io.gigdraft.core;

import java.util.Locale;
import java.util.Optional;

public enum JobStatus {
    OPEN,
    ACTIVE,
    PENDING,
    CLOSED,
    DELETED;

    public static Optional<JobStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
