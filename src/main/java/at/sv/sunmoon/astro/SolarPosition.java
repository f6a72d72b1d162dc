package at.sv.sunmoon.astro;

import at.sv.sunmoon.time.TimeScale;

import static at.sv.sunmoon.astro.AngleMath.asind;
import static at.sv.sunmoon.astro.AngleMath.atan2d;
import static at.sv.sunmoon.astro.AngleMath.cosd;
import static at.sv.sunmoon.astro.AngleMath.polynomial;
import static at.sv.sunmoon.astro.AngleMath.reduceAngle;
import static at.sv.sunmoon.astro.AngleMath.sind;

/**
 * Low precision position of the sun (Meeus, chapter 25) and the sidereal time at Greenwich (chapter 12).
 * <p>
 * All methods take T, the Julian centuries since J2000.0, and return degrees.
 */
public final class SolarPosition {

    private static final double[] SUN_MEAN_LONGITUDE = {280.46646, 36000.76983, 0.0003032};

    /**
     * Laskar's expression in U = T / 100, coefficients converted from arc seconds.
     */
    private static final double[] MEAN_OBLIQUITY = {
            84381.448 / 3600, -4680.93 / 3600, -1.55 / 3600, 1999.25 / 3600, -51.38 / 3600,
            -249.67 / 3600, -39.05 / 3600, 7.12 / 3600, 27.87 / 3600, 5.79 / 3600, 2.45 / 3600
    };

    private SolarPosition() {
    }

    /**
     * Geometric mean longitude referred to the mean equinox of the date.
     */
    public static double meanLongitude(double t) {
        return reduceAngle(polynomial(t, SUN_MEAN_LONGITUDE));
    }

    public static double meanAnomaly(double t) {
        return NutationSeries.sunMeanAnomaly(t);
    }

    public static double equationOfCenter(double t) {
        double m = meanAnomaly(t);
        return (1.914602 - 0.004817 * t - 0.000014 * t * t) * sind(m)
               + (0.019993 - 0.000101 * t) * sind(2 * m)
               + 0.000290 * sind(3 * m);
    }

    /**
     * Not reduced, may slightly exceed 360°.
     */
    public static double trueLongitude(double t) {
        return meanLongitude(t) + equationOfCenter(t);
    }

    public static double apparentLongitude(double t) {
        double omega = NutationSeries.moonAscendingNodeLongitude(t);
        return trueLongitude(t) - 0.00569 - 0.00478 * sind(omega);
    }

    public static double meanObliquity(double t) {
        return polynomial(t / 100, MEAN_OBLIQUITY);
    }

    public static double trueObliquity(double t) {
        return meanObliquity(t) + NutationSeries.nutationInObliquity(t);
    }

    public static double apparentRightAscension(double t) {
        double lambda = apparentLongitude(t);
        double epsilon = apparentObliquity(t);
        return reduceAngle(atan2d(cosd(epsilon) * sind(lambda), cosd(lambda)));
    }

    public static double apparentDeclination(double t) {
        double lambda = apparentLongitude(t);
        double epsilon = apparentObliquity(t);
        return asind(sind(epsilon) * sind(lambda));
    }

    /**
     * Mean sidereal time at Greenwich, not reduced.
     */
    public static double meanSiderealTime(double t) {
        double daysSinceJ2000 = t * TimeScale.DAYS_PER_CENTURY;
        return 280.46061837 + 360.98564736629 * daysSinceJ2000 + 0.000387933 * t * t - t * t * t / 38710000;
    }

    /**
     * Apparent sidereal time at Greenwich, corrected for the nutation in longitude.
     */
    public static double apparentSiderealTime(double t) {
        Nutation nutation = NutationSeries.compute(t);
        double epsilon = meanObliquity(t) + nutation.obliquity();
        return reduceAngle(meanSiderealTime(t) + nutation.longitude() * cosd(epsilon));
    }

    /**
     * True obliquity corrected for the apparent position of the sun.
     */
    private static double apparentObliquity(double t) {
        return trueObliquity(t) + 0.00256 * cosd(NutationSeries.moonAscendingNodeLongitude(t));
    }
}
