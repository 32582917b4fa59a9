package com.measurelog.common.vector;

import com.measurelog.common.exception.EmptyVectorException;

import java.util.Arrays;

/**
 * Forces a variable-length numeric sequence to a fixed dimension.
 *
 * <ul>
 *   <li>same length: returned unchanged</li>
 *   <li>shorter: padded by repeating the <b>last</b> element</li>
 *   <li>longer: truncated to the first {@code targetDimensions} elements (lossy)</li>
 *   <li>empty: {@link EmptyVectorException}</li>
 * </ul>
 *
 * Stateless; each pipeline owns its own instance with its own dimension.
 */
public class VectorNormalizer {

    private final int targetDimensions;

    public VectorNormalizer(int targetDimensions) {
        if (targetDimensions <= 0) {
            throw new IllegalArgumentException("Target dimensions must be positive: " + targetDimensions);
        }
        this.targetDimensions = targetDimensions;
    }

    public int getTargetDimensions() {
        return targetDimensions;
    }

    public double[] normalize(double[] values) {
        if (values == null || values.length == 0) {
            throw new EmptyVectorException(targetDimensions);
        }
        if (values.length == targetDimensions) {
            return values;
        }
        double[] normalized = Arrays.copyOf(values, targetDimensions);
        if (values.length < targetDimensions) {
            Arrays.fill(normalized, values.length, targetDimensions, values[values.length - 1]);
        }
        return normalized;
    }

    public float[] normalize(float[] values) {
        if (values == null || values.length == 0) {
            throw new EmptyVectorException(targetDimensions);
        }
        if (values.length == targetDimensions) {
            return values;
        }
        float[] normalized = Arrays.copyOf(values, targetDimensions);
        if (values.length < targetDimensions) {
            Arrays.fill(normalized, values.length, targetDimensions, values[values.length - 1]);
        }
        return normalized;
    }

    /**
     * Scales to unit L2 length. An all-zero vector is returned as is.
     */
    public static float[] toUnitLength(float[] values) {
        double sumOfSquares = 0;
        for (float value : values) {
            sumOfSquares += (double) value * value;
        }
        if (sumOfSquares == 0) {
            return values;
        }
        double norm = Math.sqrt(sumOfSquares);
        float[] unit = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            unit[i] = (float) (values[i] / norm);
        }
        return unit;
    }
}
