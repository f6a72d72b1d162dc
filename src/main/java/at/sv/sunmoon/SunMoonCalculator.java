package at.sv.sunmoon;

import at.sv.sunmoon.moon.MoonPhaseKind;
import at.sv.sunmoon.sun.SunEventOutcome;

import java.time.ZonedDateTime;
import java.util.List;

public interface SunMoonCalculator {

    /**
     * @param dateTime  the date to compute the sunrise for; its zone defines the local calendar date and the zone of
     *                  the result
     * @param latitude  the latitude in degrees [-90..90], north positive
     * @param longitude the longitude in degrees [-180..180], east positive
     * @param config    the options for this call
     * @return the sunrise, or {@link SunEventOutcome.Type#MIDNIGHT_SUN} / {@link SunEventOutcome.Type#POLAR_NIGHT}
     */
    SunEventOutcome computeSunrise(ZonedDateTime dateTime, double latitude, double longitude, EngineConfig config);

    SunEventOutcome computeSunset(ZonedDateTime dateTime, double latitude, double longitude, EngineConfig config);

    ZonedDateTime computeSolarNoon(ZonedDateTime dateTime, double longitude, EngineConfig config);

    /**
     * @param timezoneId an IANA zone id, or {@code null} for UTC
     * @return all moons of the given phase within the year, in chronological order
     * @throws java.time.DateTimeException if the zone id is invalid
     */
    List<ZonedDateTime> computeMoonPhasesForYear(int year, MoonPhaseKind kind, String timezoneId, EngineConfig config);

    default String toDebugString(ZonedDateTime dateTime, double latitude, double longitude, EngineConfig config) {
        return null;
    }
}
