/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the operator variants.
 */
public class OperatorTest {

    @Test
    @DisplayName("Matrix operator applies A and Aᵗ")
    void testMatrixApply() {
        MatrixOperator a = MatrixOperator.of(new double[][]{
                {1, 2, 3},
                {4, 5, 6}
        });
        double[] y = new double[2];
        double[] x = new double[3];

        a.apply(new double[]{1, 0, -1}, y);
        a.applyAdjoint(new double[]{1, 1}, x);

        assertThat(y).containsExactly(-2.0, -2.0);
        assertThat(x).containsExactly(5.0, 7.0, 9.0);
        assertThat(a.inputDimension()).isEqualTo(3);
        assertThat(a.outputDimension()).isEqualTo(2);
        assertThat(a.get(1, 2)).isEqualTo(6.0);
        assertThat(a.isLinear()).isTrue();
        assertThat(a.linearPart()).isSameAs(a);
    }

    @Test
    @DisplayName("Affine operator adds its offset and keeps the linear adjoint")
    void testAffine() {
        MatrixOperator a = MatrixOperator.diagonal(2.0, 3.0);
        AffineOperator affine = a.minus(new double[]{1.0, 1.0});
        double[] y = new double[2];
        double[] x = new double[2];

        affine.apply(new double[]{1.0, 1.0}, y);
        affine.applyAdjoint(new double[]{1.0, 1.0}, x);

        assertThat(y).containsExactly(1.0, 2.0);
        assertThat(x).containsExactly(2.0, 3.0);
        assertThat(affine.isLinear()).isFalse();
        assertThat(affine.linearPart()).isSameAs(a);
        assertThat(affine.getOffset()).containsExactly(-1.0, -1.0);
        assertThat(a.plus(new double[]{1.0, 1.0}).getOffset()).containsExactly(1.0, 1.0);
    }

    @Test
    @DisplayName("Invalid shapes are rejected")
    void testInvalidShapes() {
        assertThatThrownBy(() -> MatrixOperator.of(2, 2, new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatrixOperator.of(new double[][]{{1, 2}, {3}}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatrixOperator.identity(2).minus(new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatrixOperator.zeros(0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Property(tries = 100)
    @Label("Adjoint satisfies ⟨A x, y⟩ = ⟨x, Aᵗ y⟩")
    void adjointIdentity(
            @ForAll @IntRange(min = 1, max = 6) int rows,
            @ForAll @IntRange(min = 1, max = 6) int cols,
            @ForAll long seed
    ) {
        Random random = new Random(seed);
        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextGaussian();
        }
        double[] x = new double[cols];
        double[] y = new double[rows];
        for (int j = 0; j < cols; j++) x[j] = random.nextGaussian();
        for (int i = 0; i < rows; i++) y[i] = random.nextGaussian();

        MatrixOperator a = MatrixOperator.of(rows, cols, data);
        double[] ax = new double[rows];
        double[] aty = new double[cols];
        a.apply(x, ax);
        a.applyAdjoint(y, aty);

        assertThat(Vectors.dot(ax, y)).isCloseTo(Vectors.dot(x, aty), within(1e-10));
    }
}
