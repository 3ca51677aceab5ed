package com.example.printconnector.application.service.capability;

/**
 * Length conversions into micrometers. Every conversion rounds half up by adding 0.5 before truncating.
 * Results that do not fit an {@code int} raise {@link ArithmeticException}.
 */
public final class Units {

    private static final float MICRONS_PER_INCH = 25400f;
    private static final float POINTS_PER_INCH = 72f;

    private Units() {
    }

    public static int inchesToMicrons(float inches) {
        return toMicrons(inches * MICRONS_PER_INCH + 0.5f);
    }

    public static int millimetersToMicrons(float millimeters) {
        return toMicrons(millimeters * 1000f + 0.5f);
    }

    /**
     * Converts typographic points (1/72 inch) into micrometers; one point is 353 micrometers.
     *
     * @param points length in points
     * @return length in micrometers
     * @throws ArithmeticException when the length does not fit an {@code int}
     */
    public static int pointsToMicrons(int points) {
        return toMicrons((float) (points * 25400L) / POINTS_PER_INCH + 0.5f);
    }

    private static int toMicrons(double microns) {
        if (!Double.isFinite(microns) || microns > Integer.MAX_VALUE || microns < Integer.MIN_VALUE) {
            throw new ArithmeticException("Length of " + microns + " micrometers is out of range");
        }
        return (int) microns;
    }
}
