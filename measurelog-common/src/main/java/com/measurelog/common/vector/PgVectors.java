package com.measurelog.common.vector;

import java.util.StringJoiner;

/**
 * Text form of pgvector values: {@code [1.0,2.5,3.0]}.
 */
public final class PgVectors {

    private PgVectors() {
    }

    public static String toLiteral(double[] values) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (double value : values) {
            joiner.add(Double.toString(value));
        }
        return joiner.toString();
    }

    public static String toLiteral(float[] values) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (float value : values) {
            joiner.add(Float.toString(value));
        }
        return joiner.toString();
    }
}
