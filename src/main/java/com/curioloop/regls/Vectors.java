/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * In-place vector algebra on plain arrays.
 * <p>
 * Output arrays may alias an input only where noted.
 * </p>
 */
final class Vectors {

    private Vectors() {}

    static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    /** out = a - b (out may alias a or b) */
    static void subtract(double[] a, double[] b, double[] out) {
        for (int i = 0; i < out.length; i++) {
            out[i] = a[i] - b[i];
        }
    }

    /** out = a + t·b (out may alias a or b) */
    static void addScaled(double[] a, double t, double[] b, double[] out) {
        for (int i = 0; i < out.length; i++) {
            out[i] = a[i] + t * b[i];
        }
    }

    /** out = -a (out may alias a) */
    static void negate(double[] a, double[] out) {
        for (int i = 0; i < out.length; i++) {
            out[i] = -a[i];
        }
    }

    static void copy(double[] src, double[] dst) {
        System.arraycopy(src, 0, dst, 0, dst.length);
    }

    static boolean isFinite(double[] a) {
        for (double v : a) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
