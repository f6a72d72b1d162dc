package at.sv.sunmoon.astro;

/**
 * Nutation in longitude (Δψ) and in obliquity (Δε), both in degrees.
 */
public record Nutation(double longitude, double obliquity) {
}
