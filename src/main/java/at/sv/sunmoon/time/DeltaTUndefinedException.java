package at.sv.sunmoon.time;

import lombok.Getter;

/**
 * Signals that ΔT was requested for a date the polynomial model does not cover.
 */
@Getter
public final class DeltaTUndefinedException extends RuntimeException {

    private final double year;

    public DeltaTUndefinedException(double year) {
        super("ΔT is undefined before the year " + (int) DeltaT.EARLIEST_DEFINED_YEAR + ": " + year);
        this.year = year;
    }
}
