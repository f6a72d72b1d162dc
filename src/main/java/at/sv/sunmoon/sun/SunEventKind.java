package at.sv.sunmoon.sun;

public enum SunEventKind {
    SUNRISE,
    SUNSET,
    TRANSIT
}
