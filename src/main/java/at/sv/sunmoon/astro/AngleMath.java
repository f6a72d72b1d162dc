package at.sv.sunmoon.astro;

/**
 * Degree based trigonometry and the small numeric helpers shared by the solar and lunar series.
 */
public final class AngleMath {

    private static final double DEG_TO_RAD = Math.PI / 180.0;
    private static final double RAD_TO_DEG = 180.0 / Math.PI;

    private AngleMath() {
    }

    public static double sind(double degrees) {
        return Math.sin(degrees * DEG_TO_RAD);
    }

    public static double cosd(double degrees) {
        return Math.cos(degrees * DEG_TO_RAD);
    }

    public static double asind(double value) {
        return Math.asin(value) * RAD_TO_DEG;
    }

    public static double acosd(double value) {
        return Math.acos(value) * RAD_TO_DEG;
    }

    public static double atan2d(double y, double x) {
        return Math.atan2(y, x) * RAD_TO_DEG;
    }

    /**
     * Reduces the given angle to [0, 360).
     */
    public static double reduceAngle(double degrees) {
        return degrees - 360.0 * Math.floor(degrees / 360.0);
    }

    /**
     * Evaluates {@code c[0] + c[1]*x + c[2]*x^2 + ...}.
     */
    public static double polynomial(double x, double... coefficients) {
        double sum = 0.0;
        double power = 1.0;
        for (double coefficient : coefficients) {
            sum += power * coefficient;
            power *= x;
        }
        return sum;
    }

    /**
     * Interpolates from three equidistant tabular values (Meeus, eq. 3.3).
     *
     * @param y1           value at -1
     * @param y2           value at the center
     * @param y3           value at +1
     * @param n            interpolating factor, relative to the center value
     * @param wrapAround360 if negative differences should be lifted by 360°, needed for angles
     *                     crossing 0°, e.g. right ascension
     * @return the interpolated value
     */
    public static double interpolateFromThree(double y1, double y2, double y3, double n, boolean wrapAround360) {
        double a = y2 - y1;
        double b = y3 - y2;
        if (wrapAround360) {
            if (a < 0) a += 360;
            if (b < 0) b += 360;
        }
        double c = b - a;
        return y2 + (n / 2) * (a + b + n * c);
    }
}
