/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Operator defining the smooth term f(x) = ½‖A x‖² of a regularized least squares problem.
 * <p>
 * Two variants exist:
 * </p>
 * <ul>
 *   <li>{@link LinearOperator}: A x</li>
 *   <li>{@link AffineOperator}: A x + b, whose products along a direction go
 *       through {@link #linearPart()}</li>
 * </ul>
 * <p>
 * Implementations are expected to be stateless. The solver never calls them concurrently.
 * </p>
 */
public interface Operator {

    /**
     * Gets the dimension of the variable x.
     * @return Input dimension
     */
    int inputDimension();

    /**
     * Gets the dimension of the residual A x.
     * @return Output dimension
     */
    int outputDimension();

    /**
     * Computes y = A x (plus the offset for affine operators).
     *
     * @param x Input vector (read-only)
     * @param y Output vector, overwritten
     */
    void apply(double[] x, double[] y);

    /**
     * Computes x = Aᵗ y using the adjoint of the linear part.
     *
     * @param y Input vector in the output space (read-only)
     * @param x Output vector in the input space, overwritten
     */
    void applyAdjoint(double[] y, double[] x);

    /**
     * Gets the linear part of this operator.
     * @return Linear part
     */
    LinearOperator linearPart();

    /**
     * Checks whether this operator is purely linear.
     * @return true if {@link #apply} has no offset
     */
    boolean isLinear();
}
