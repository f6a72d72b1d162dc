package at.sv.sunmoon;

import at.sv.sunmoon.sun.SunEventOutcome;

import java.time.format.DateTimeFormatter;

public final class EventFormatter {

    public static final String MIDNIGHT_SUN = "MS";
    public static final String POLAR_NIGHT = "PN";

    private EventFormatter() {
    }

    /**
     * Formats the time of the outcome. Placeholder times get the configured marker appended, so they can be told
     * apart from real events. Polar days and nights without a placeholder are formatted as {@value MIDNIGHT_SUN}
     * and {@value POLAR_NIGHT}.
     */
    public static String format(SunEventOutcome outcome, DateTimeFormatter formatter, EngineConfig config) {
        if (outcome.getTime().isEmpty()) {
            return outcome.getType() == SunEventOutcome.Type.MIDNIGHT_SUN ? MIDNIGHT_SUN : POLAR_NIGHT;
        }
        String formatted = formatter.format(outcome.getTimeOrThrow());
        if (outcome.isPlaceholder()) {
            return formatted + getMarker(outcome.getType(), config);
        }
        return formatted;
    }

    private static String getMarker(SunEventOutcome.Type type, EngineConfig config) {
        return type == SunEventOutcome.Type.MIDNIGHT_SUN ? config.getMidnightSunMarker() : config.getPolarNightMarker();
    }
}
