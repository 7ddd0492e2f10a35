/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Affine operator y = A x + b built on a {@link LinearOperator}.
 * <p>
 * The adjoint is that of the linear part, so the gradient of ½‖A x + b‖² is
 * Aᵗ (A x + b).
 * </p>
 */
public final class AffineOperator implements Operator {

    private final LinearOperator linear;
    private final double[] offset;

    /**
     * Creates an affine operator.
     * @param linear Linear part A
     * @param offset Offset b, copied
     */
    public AffineOperator(LinearOperator linear, double[] offset) {
        if (linear == null) {
            throw new IllegalArgumentException("Linear part cannot be null");
        }
        if (offset == null || offset.length != linear.outputDimension()) {
            throw new IllegalArgumentException("Offset must have dimension " + linear.outputDimension());
        }
        this.linear = linear;
        this.offset = offset.clone();
    }

    @Override
    public int inputDimension() {
        return linear.inputDimension();
    }

    @Override
    public int outputDimension() {
        return linear.outputDimension();
    }

    @Override
    public void apply(double[] x, double[] y) {
        linear.apply(x, y);
        for (int i = 0; i < y.length; i++) {
            y[i] += offset[i];
        }
    }

    @Override
    public void applyAdjoint(double[] y, double[] x) {
        linear.applyAdjoint(y, x);
    }

    @Override
    public LinearOperator linearPart() {
        return linear;
    }

    @Override
    public boolean isLinear() {
        return false;
    }

    /**
     * Gets the offset b.
     * @return Copy of the offset
     */
    public double[] getOffset() {
        return offset.clone();
    }
}
