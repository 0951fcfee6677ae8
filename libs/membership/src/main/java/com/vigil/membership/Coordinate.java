package com.vigil.membership;

/**
 * Network coordinate of a member as estimated by the gossip substrate (Vivaldi-style).
 *
 * @param vector     position in the coordinate space
 * @param error      estimated error of the position
 * @param adjustment distance adjustment term
 * @param height     height above the coordinate plane
 */
public record Coordinate(double[] vector, double error, double adjustment, double height) {

    public Coordinate {
        vector = vector == null ? new double[0] : vector.clone();
    }

    @Override
    public double[] vector() {
        return vector.clone();
    }

    /**
     * Estimates the round trip time in seconds between this coordinate and another.
     */
    public double distanceTo(Coordinate other) {
        if (vector.length != other.vector.length) {
            throw new IllegalArgumentException("coordinate dimensions do not match");
        }
        double sum = 0;
        for (int i = 0; i < vector.length; i++) {
            double diff = vector[i] - other.vector[i];
            sum += diff * diff;
        }
        double rtt = Math.sqrt(sum) + height + other.height;
        double adjusted = rtt + adjustment + other.adjustment;
        return adjusted > 0 ? adjusted : rtt;
    }
}
