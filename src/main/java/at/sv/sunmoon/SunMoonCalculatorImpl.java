package at.sv.sunmoon;

import at.sv.sunmoon.moon.MoonPhaseKind;
import at.sv.sunmoon.moon.MoonPhaseSolver;
import at.sv.sunmoon.sun.SunEventKind;
import at.sv.sunmoon.sun.SunEventOutcome;
import at.sv.sunmoon.sun.SunEventSolver;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

public final class SunMoonCalculatorImpl implements SunMoonCalculator {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    @Override
    public SunEventOutcome computeSunrise(ZonedDateTime dateTime, double latitude, double longitude, EngineConfig config) {
        return SunEventSolver.riseOrSet(dateTime, latitude, longitude, SunEventKind.SUNRISE, config);
    }

    @Override
    public SunEventOutcome computeSunset(ZonedDateTime dateTime, double latitude, double longitude, EngineConfig config) {
        return SunEventSolver.riseOrSet(dateTime, latitude, longitude, SunEventKind.SUNSET, config);
    }

    @Override
    public ZonedDateTime computeSolarNoon(ZonedDateTime dateTime, double longitude, EngineConfig config) {
        return SunEventSolver.transit(dateTime, longitude, config);
    }

    @Override
    public List<ZonedDateTime> computeMoonPhasesForYear(int year, MoonPhaseKind kind, String timezoneId,
                                                        EngineConfig config) {
        return MoonPhaseSolver.phasesInYear(year, kind, parseZone(timezoneId), config);
    }

    private static ZoneId parseZone(String timezoneId) {
        if (timezoneId == null || timezoneId.isBlank()) {
            return ZoneOffset.UTC;
        }
        return ZoneId.of(timezoneId);
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime, double latitude, double longitude, EngineConfig config) {
        return "sunrise: " + EventFormatter.format(computeSunrise(dateTime, latitude, longitude, config), TIME_FORMATTER, config) +
               "\nnoon: " + TIME_FORMATTER.format(computeSolarNoon(dateTime, longitude, config)) +
               "\nsunset: " + EventFormatter.format(computeSunset(dateTime, latitude, longitude, config), TIME_FORMATTER, config);
    }
}
