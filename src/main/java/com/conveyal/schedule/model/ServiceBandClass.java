package com.conveyal.schedule.model;

/**
 * The five ordered travel-time classes a departure can be assigned to, from the quickest running times to the
 * slowest. Trips store the display name, which leaves room for free-form labels on imported data.
 */
public enum ServiceBandClass {
    FASTEST("Fastest Service", "#2e7d32"),
    FAST("Fast Service", "#388e3c"),
    STANDARD("Standard Service", "#f9a825"),
    SLOW("Slow Service", "#f57c00"),
    SLOWEST("Slowest Service", "#d32f2f");

    /** Color used for labels that are not one of the five classes. */
    public static final String UNKNOWN_COLOR = "#9b9b9b";

    public final String displayName;
    public final String color;

    ServiceBandClass(String displayName, String color) {
        this.displayName = displayName;
        this.color = color;
    }

    /** @return the class with the given display name, or null for legacy and free-form labels. */
    public static ServiceBandClass fromDisplayName (String name) {
        for (ServiceBandClass bandClass : values()) {
            if (bandClass.displayName.equals(name)) return bandClass;
        }
        return null;
    }

    public static String colorFor (String name) {
        ServiceBandClass bandClass = fromDisplayName(name);
        return bandClass == null ? UNKNOWN_COLOR : bandClass.color;
    }
}
