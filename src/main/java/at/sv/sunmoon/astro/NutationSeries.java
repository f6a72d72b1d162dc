package at.sv.sunmoon.astro;

import static at.sv.sunmoon.astro.AngleMath.cosd;
import static at.sv.sunmoon.astro.AngleMath.polynomial;
import static at.sv.sunmoon.astro.AngleMath.reduceAngle;
import static at.sv.sunmoon.astro.AngleMath.sind;

/**
 * Nutation in longitude and obliquity, using the 63 periodic terms of Meeus, table 22.A.
 * <p>
 * All methods take T, the Julian centuries since J2000.0, and return degrees.
 */
public final class NutationSeries {

    private static final double[] MOON_MEAN_ELONGATION = {297.85036, 445267.111480, -0.0019142, 1.0 / 189474};
    private static final double[] SUN_MEAN_ANOMALY = {357.52772, 35999.050340, -0.0001603, -1.0 / 300000};
    private static final double[] MOON_MEAN_ANOMALY = {134.96298, 477198.867398, 0.0086972, 1.0 / 56250};
    private static final double[] MOON_ARGUMENT_OF_LATITUDE = {93.27191, 483202.017538, -0.0036825, 1.0 / 327270};
    private static final double[] MOON_ASCENDING_NODE_LONGITUDE = {125.04452, -1934.136261, 0.0020708, 1.0 / 450000};

    /**
     * The series is given in units of 0.0001".
     */
    private static final double SERIES_UNITS_PER_DEGREE = 36_000_000;

    /**
     * Multipliers of D, M, M', F, Ω followed by the sine coefficients A + B*T (longitude)
     * and the cosine coefficients C + D*T (obliquity).
     */
    private static final double[][] TERMS = {
            { 0,  0,  0,  0, 1, -171996, -174.2, 92025,  8.9},
            {-2,  0,  0,  2, 2,  -13187,   -1.6,  5736, -3.1},
            { 0,  0,  0,  2, 2,   -2274,   -0.2,   977, -0.5},
            { 0,  0,  0,  0, 2,    2062,    0.2,  -895,  0.5},
            { 0,  1,  0,  0, 0,    1426,   -3.4,    54, -0.1},
            { 0,  0,  1,  0, 0,     712,    0.1,    -7,    0},
            {-2,  1,  0,  2, 2,    -517,    1.2,   224, -0.6},
            { 0,  0,  0,  2, 1,    -386,   -0.4,   200,    0},
            { 0,  0,  1,  2, 2,    -301,      0,   129, -0.1},
            {-2, -1,  0,  2, 2,     217,   -0.5,   -95,  0.3},
            {-2,  0,  1,  0, 0,    -158,      0,     0,    0},
            {-2,  0,  0,  2, 1,     129,    0.1,   -70,    0},
            { 0,  0, -1,  2, 2,     123,      0,   -53,    0},
            { 2,  0,  0,  0, 0,      63,      0,     0,    0},
            { 0,  0,  1,  0, 1,      63,    0.1,   -33,    0},
            { 2,  0, -1,  2, 2,     -59,      0,    26,    0},
            { 0,  0, -1,  0, 1,     -58,   -0.1,    32,    0},
            { 0,  0,  1,  2, 1,     -51,      0,    27,    0},
            {-2,  0,  2,  0, 0,      48,      0,     0,    0},
            { 0,  0, -2,  2, 1,      46,      0,   -24,    0},
            { 2,  0,  0,  2, 2,     -38,      0,    16,    0},
            { 0,  0,  2,  2, 2,     -31,      0,    13,    0},
            { 0,  0,  2,  0, 0,      29,      0,     0,    0},
            {-2,  0,  1,  2, 2,      29,      0,   -12,    0},
            { 0,  0,  0,  2, 0,      26,      0,     0,    0},
            {-2,  0,  0,  2, 0,     -22,      0,     0,    0},
            { 0,  0, -1,  2, 1,      21,      0,   -10,    0},
            { 0,  2,  0,  0, 0,      17,   -0.1,     0,    0},
            { 2,  0, -1,  0, 1,      16,      0,    -8,    0},
            {-2,  2,  0,  2, 2,     -16,    0.1,     7,    0},
            { 0,  1,  0,  0, 1,     -15,      0,     9,    0},
            {-2,  0,  1,  0, 1,     -13,      0,     7,    0},
            { 0, -1,  0,  0, 1,     -12,      0,     6,    0},
            { 0,  0,  2, -2, 0,      11,      0,     0,    0},
            { 2,  0, -1,  2, 1,     -10,      0,     5,    0},
            { 2,  0,  1,  2, 2,      -8,      0,     3,    0},
            { 0,  1,  0,  2, 2,       7,      0,    -3,    0},
            {-2,  1,  1,  0, 0,      -7,      0,     0,    0},
            { 0, -1,  0,  2, 2,      -7,      0,     3,    0},
            { 2,  0,  0,  2, 1,      -7,      0,     3,    0},
            { 2,  0,  1,  0, 0,       6,      0,     0,    0},
            {-2,  0,  2,  2, 2,       6,      0,    -3,    0},
            {-2,  0,  1,  2, 1,       6,      0,    -3,    0},
            { 2,  0, -2,  0, 1,      -6,      0,     3,    0},
            { 2,  0,  0,  0, 1,      -6,      0,     3,    0},
            { 0, -1,  1,  0, 0,       5,      0,     0,    0},
            {-2, -1,  0,  2, 1,      -5,      0,     3,    0},
            {-2,  0,  0,  0, 1,      -5,      0,     3,    0},
            { 0,  0,  2,  2, 1,      -5,      0,     3,    0},
            {-2,  0,  2,  0, 1,       4,      0,     0,    0},
            {-2,  1,  0,  2, 1,       4,      0,     0,    0},
            { 0,  0,  1, -2, 0,       4,      0,     0,    0},
            {-1,  0,  1,  0, 0,      -4,      0,     0,    0},
            {-2,  1,  0,  0, 0,      -4,      0,     0,    0},
            { 1,  0,  0,  0, 0,      -4,      0,     0,    0},
            { 0,  0,  1,  2, 0,       3,      0,     0,    0},
            { 0,  0, -2,  2, 2,      -3,      0,     0,    0},
            {-1, -1,  1,  0, 0,      -3,      0,     0,    0},
            { 0,  1,  1,  0, 0,      -3,      0,     0,    0},
            { 0, -1,  1,  2, 2,      -3,      0,     0,    0},
            { 2, -1, -1,  2, 2,      -3,      0,     0,    0},
            { 0,  0,  3,  2, 2,       3,      0,     0,    0},
            { 2, -1,  0,  2, 2,      -3,      0,     0,    0}
    };

    private NutationSeries() {
    }

    static int termCount() {
        return TERMS.length;
    }

    public static Nutation compute(double t) {
        double d = moonMeanElongation(t);
        double m = sunMeanAnomaly(t);
        double mPrime = moonMeanAnomaly(t);
        double f = moonArgumentOfLatitude(t);
        double omega = moonAscendingNodeLongitude(t);
        double deltaPsi = 0;
        double deltaEpsilon = 0;
        for (double[] term : TERMS) {
            double argument = term[0] * d + term[1] * m + term[2] * mPrime + term[3] * f + term[4] * omega;
            deltaPsi += (term[5] + term[6] * t) * sind(argument);
            deltaEpsilon += (term[7] + term[8] * t) * cosd(argument);
        }
        return new Nutation(deltaPsi / SERIES_UNITS_PER_DEGREE, deltaEpsilon / SERIES_UNITS_PER_DEGREE);
    }

    public static double nutationInLongitude(double t) {
        return compute(t).longitude();
    }

    public static double nutationInObliquity(double t) {
        return compute(t).obliquity();
    }

    public static double moonMeanElongation(double t) {
        return reduceAngle(polynomial(t, MOON_MEAN_ELONGATION));
    }

    public static double sunMeanAnomaly(double t) {
        return reduceAngle(polynomial(t, SUN_MEAN_ANOMALY));
    }

    public static double moonMeanAnomaly(double t) {
        return reduceAngle(polynomial(t, MOON_MEAN_ANOMALY));
    }

    public static double moonArgumentOfLatitude(double t) {
        return reduceAngle(polynomial(t, MOON_ARGUMENT_OF_LATITUDE));
    }

    /**
     * Longitude of the ascending node of the moon's mean orbit, measured from the mean equinox of the date.
     */
    public static double moonAscendingNodeLongitude(double t) {
        return reduceAngle(polynomial(t, MOON_ASCENDING_NODE_LONGITUDE));
    }
}
