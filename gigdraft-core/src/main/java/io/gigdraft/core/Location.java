package io.gigdraft.core;

/**
 * Where the work happens. Coordinates are optional.
 */
public record Location(
        String state,
        String district,
        Double latitude,
        Double longitude
) {
    public static Location empty() {
        return new Location("", "", null, null);
    }

    public static Location of(String state, String district) {
        return new Location(state, district, null, null);
    }

    public Location withCoordinates(Double latitude, Double longitude) {
        return new Location(state, district, latitude, longitude);
    }

    /**
     * True when nothing was entered. Not named as a bean property so it never lands in mapped documents.
     */
    public boolean hasNoContent() {
        return (state == null || state.isBlank())
                && (district == null || district.isBlank())
                && latitude == null
                && longitude == null;
    }
}
