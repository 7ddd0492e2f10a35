/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Linear operator y = A x.
 *
 * @see MatrixOperator
 */
public interface LinearOperator extends Operator {

    @Override
    default LinearOperator linearPart() {
        return this;
    }

    @Override
    default boolean isLinear() {
        return true;
    }

    /**
     * Creates the affine operator A x + b from this operator.
     *
     * @param offset Constant offset b of length {@link #outputDimension()}
     * @return Affine operator
     */
    default AffineOperator plus(double[] offset) {
        return new AffineOperator(this, offset);
    }

    /**
     * Creates the affine operator A x - b, the residual of the system A x = b.
     *
     * @param target Right-hand side b of length {@link #outputDimension()}
     * @return Affine operator
     */
    default AffineOperator minus(double[] target) {
        if (target == null) {
            throw new IllegalArgumentException("Target cannot be null");
        }
        double[] offset = new double[target.length];
        for (int i = 0; i < target.length; i++) {
            offset[i] = -target[i];
        }
        return new AffineOperator(this, offset);
    }
}
