package at.sv.sunmoon.sun;

import at.sv.sunmoon.EngineConfig;
import at.sv.sunmoon.astro.SolarPosition;
import at.sv.sunmoon.time.DeltaT;
import at.sv.sunmoon.time.TimeScale;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

import static at.sv.sunmoon.astro.AngleMath.acosd;
import static at.sv.sunmoon.astro.AngleMath.asind;
import static at.sv.sunmoon.astro.AngleMath.cosd;
import static at.sv.sunmoon.astro.AngleMath.interpolateFromThree;
import static at.sv.sunmoon.astro.AngleMath.reduceAngle;
import static at.sv.sunmoon.astro.AngleMath.sind;

/**
 * Sunrise, sunset and transit of the sun (Meeus, chapter 15).
 * <p>
 * Longitudes are positive east of Greenwich, the opposite of the convention used by Meeus.
 */
@Slf4j
public final class SunEventSolver {

    /**
     * Altitude of the sun's center at rise and set: refraction plus the sun's semi diameter.
     */
    static final double STANDARD_ALTITUDE = -50.0 / 60.0;
    /**
     * Corrections of at most ~8.64s end the refinement.
     */
    static final double CONVERGENCE_THRESHOLD = 0.0001;
    static final int MAX_ITERATIONS = 3;

    static final LocalTime SUNRISE_PLACEHOLDER = LocalTime.of(6, 0);
    static final LocalTime SUNSET_PLACEHOLDER = LocalTime.of(18, 0);

    private static final double SIDEREAL_DEGREES_PER_DAY = 360.985647;
    private static final double SECONDS_PER_DAY = 86400;
    private static final double ONE_DAY_IN_CENTURIES = 1 / TimeScale.DAYS_PER_CENTURY;

    private SunEventSolver() {
    }

    public static SunEventOutcome compute(ZonedDateTime date, double latitude, double longitude, SunEventKind kind,
                                          EngineConfig config) {
        Objects.requireNonNull(kind, "kind");
        if (kind == SunEventKind.TRANSIT) {
            return SunEventOutcome.event(transit(date, longitude, config));
        }
        return riseOrSet(date, latitude, longitude, kind, config);
    }

    /**
     * Calculates the solar transit (solar noon) on the local calendar date of the given date time.
     */
    public static ZonedDateTime transit(ZonedDateTime date, double longitude, EngineConfig config) {
        Objects.requireNonNull(config, "config");
        DayContext day = DayContext.of(date);
        double alpha = SolarPosition.apparentRightAscension(day.dynamicalT());
        double m = normalizeM((alpha - longitude - day.theta0()) / 360, day.utcOffsetMinutes());
        m += transitCorrection(day, longitude, m);
        return toDateTime(date, day, m, config);
    }

    /**
     * Calculates the sunrise or sunset on the local calendar date of the given date time.
     *
     * @param kind {@link SunEventKind#SUNRISE} or {@link SunEventKind#SUNSET}
     * @return the event time, or the reason there is none on that day
     */
    public static SunEventOutcome riseOrSet(ZonedDateTime date, double latitude, double longitude, SunEventKind kind,
                                            EngineConfig config) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(config, "config");
        if (kind == SunEventKind.TRANSIT) {
            throw new IllegalArgumentException("Expected SUNRISE or SUNSET but got " + kind);
        }
        DayContext day = DayContext.of(date);
        double alpha = SolarPosition.apparentRightAscension(day.dynamicalT());
        double delta = SolarPosition.apparentDeclination(day.dynamicalT());
        double cosH0 = (sind(STANDARD_ALTITUDE) - sind(latitude) * sind(delta)) / (cosd(latitude) * cosd(delta));
        if (cosH0 < -1) {
            log.debug("No {} on {} at lat={}: midnight sun", kind, date.toLocalDate(), latitude);
            return polarOutcome(SunEventOutcome.Type.MIDNIGHT_SUN, date, kind, config);
        }
        if (cosH0 > 1) {
            log.debug("No {} on {} at lat={}: polar night", kind, date.toLocalDate(), latitude);
            return polarOutcome(SunEventOutcome.Type.POLAR_NIGHT, date, kind, config);
        }
        double h0 = acosd(cosH0);
        double m0 = normalizeM((alpha - longitude - day.theta0()) / 360, day.utcOffsetMinutes());
        double m = kind == SunEventKind.SUNRISE ? m0 - h0 / 360 : m0 + h0 / 360;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double deltaM = riseSetCorrection(day, latitude, longitude, m);
            m += deltaM;
            log.trace("{} iteration {}: m={} deltaM={}", kind, i + 1, m, deltaM);
            if (Math.abs(deltaM) <= CONVERGENCE_THRESHOLD) {
                break;
            }
        }
        return SunEventOutcome.event(toDateTime(date, day, m, config));
    }

    /**
     * Shifts m by a day if the event would otherwise fall on the previous or next local calendar date.
     *
     * @param m                 the time of the event as fraction of the UTC day
     * @param utcOffsetMinutes  the local offset to UTC
     */
    static double normalizeM(double m, int utcOffsetMinutes) {
        double localM = m + utcOffsetMinutes / 1440.0;
        if (localM < 0) {
            return m + 1;
        } else if (localM > 1) {
            return m - 1;
        }
        return m;
    }

    private static double transitCorrection(DayContext day, double longitude, double m) {
        double theta0 = day.theta0() + SIDEREAL_DEGREES_PER_DAY * m;
        double n = m + day.deltaT() / SECONDS_PER_DAY;
        double alpha = interpolatedRightAscension(day.t(), n);
        double hourAngle = localHourAngle(theta0, longitude, alpha);
        return -hourAngle / 360;
    }

    private static double riseSetCorrection(DayContext day, double latitude, double longitude, double m) {
        double theta0 = day.theta0() + SIDEREAL_DEGREES_PER_DAY * m;
        double n = m + day.deltaT() / SECONDS_PER_DAY;
        double alpha = interpolatedRightAscension(day.t(), n);
        double delta = interpolatedDeclination(day.t(), n);
        double hourAngle = localHourAngle(theta0, longitude, alpha);
        double altitude = altitude(latitude, delta, hourAngle);
        return (altitude - STANDARD_ALTITUDE) / (360 * cosd(delta) * cosd(latitude) * sind(hourAngle));
    }

    /**
     * @return the local hour angle in (-180, 180]
     */
    private static double localHourAngle(double theta0, double longitude, double alpha) {
        double hourAngle = reduceAngle(theta0 + longitude - alpha);
        if (hourAngle > 180) {
            hourAngle -= 360;
        }
        return hourAngle;
    }

    private static double altitude(double latitude, double delta, double hourAngle) {
        return asind(sind(latitude) * sind(delta) + cosd(latitude) * cosd(delta) * cosd(hourAngle));
    }

    /**
     * Right ascension needs the 360° wrap around, as it may pass 0° between the tabular days.
     */
    private static double interpolatedRightAscension(double t, double n) {
        double alpha1 = SolarPosition.apparentRightAscension(t - ONE_DAY_IN_CENTURIES);
        double alpha2 = SolarPosition.apparentRightAscension(t);
        double alpha3 = SolarPosition.apparentRightAscension(t + ONE_DAY_IN_CENTURIES);
        return reduceAngle(interpolateFromThree(alpha1, alpha2, alpha3, n, true));
    }

    private static double interpolatedDeclination(double t, double n) {
        double delta1 = SolarPosition.apparentDeclination(t - ONE_DAY_IN_CENTURIES);
        double delta2 = SolarPosition.apparentDeclination(t);
        double delta3 = SolarPosition.apparentDeclination(t + ONE_DAY_IN_CENTURIES);
        return reduceAngle(interpolateFromThree(delta1, delta2, delta3, n, false));
    }

    private static ZonedDateTime toDateTime(ZonedDateTime date, DayContext day, double m, EngineConfig config) {
        long seconds;
        if (m >= 0) {
            seconds = (long) Math.floor(m * SECONDS_PER_DAY + 0.5);
        } else {
            seconds = -(long) Math.floor(-m * SECONDS_PER_DAY + 0.5);
        }
        ZonedDateTime time = day.midnightUtc().plusSeconds(seconds);
        if (config.isRoundToNearestMinute()) {
            time = TimeScale.roundToNearestMinute(time);
        }
        return time.withZoneSameInstant(date.getZone());
    }

    private static SunEventOutcome polarOutcome(SunEventOutcome.Type type, ZonedDateTime date, SunEventKind kind,
                                                EngineConfig config) {
        if (!config.isReturnPlaceholderForPolarEvents()) {
            return type == SunEventOutcome.Type.MIDNIGHT_SUN ? SunEventOutcome.midnightSun() : SunEventOutcome.polarNight();
        }
        LocalTime time = kind == SunEventKind.SUNRISE ? SUNRISE_PLACEHOLDER : SUNSET_PLACEHOLDER;
        if (date.getZone().getRules().isDaylightSavings(date.toInstant())) {
            time = time.plusHours(1);
        }
        return SunEventOutcome.placeholder(type, ZonedDateTime.of(date.toLocalDate(), time, date.getZone()));
    }

    /**
     * The quantities at 0h UTC of the local calendar date, shared by all corrections.
     *
     * @param midnightUtc      0h UTC on the local calendar date
     * @param utcOffsetMinutes the offset of the requested date time
     * @param deltaT           ΔT in seconds
     * @param t                Julian centuries of 0h UT
     * @param dynamicalT       Julian centuries of 0h TD
     * @param theta0           apparent sidereal time at Greenwich at 0h UT
     */
    private record DayContext(ZonedDateTime midnightUtc, int utcOffsetMinutes, double deltaT, double t,
                              double dynamicalT, double theta0) {

        static DayContext of(ZonedDateTime date) {
            ZonedDateTime midnightUtc = date.toLocalDate().atStartOfDay(ZoneOffset.UTC);
            int utcOffsetMinutes = date.getOffset().getTotalSeconds() / 60;
            double deltaT = DeltaT.seconds(midnightUtc);
            double t = TimeScale.toJulianCentury(midnightUtc);
            double dynamicalT = t - deltaT / (SECONDS_PER_DAY * TimeScale.DAYS_PER_CENTURY);
            double theta0 = SolarPosition.apparentSiderealTime(t);
            return new DayContext(midnightUtc, utcOffsetMinutes, deltaT, t, dynamicalT, theta0);
        }
    }
}
