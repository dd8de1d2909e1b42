package com.skybrief.core.astro;

public final class AngleMath {
    private AngleMath() {
    }

    public static double normalize(double degrees) {
        double result = degrees - 360.0 * Math.floor(degrees / 360.0);
        return result >= 360.0 ? 0.0 : result;
    }

    public static double normalizeSigned(double degrees) {
        double result = normalize(degrees);
        return result > 180.0 ? result - 360.0 : result;
    }

    public static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
