/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

import java.util.Arrays;

/**
 * Dense matrix operator stored in row-major order.
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * // Least squares residual A x - b
 * Operator residual = MatrixOperator.of(new double[][]{
 *     {1, 0},
 *     {0, 2},
 *     {1, 1}
 * }).minus(new double[]{1, 2, 3});
 * }</pre>
 */
public final class MatrixOperator implements LinearOperator {

    private final int rows;
    private final int cols;
    private final double[] data;

    private MatrixOperator(int rows, int cols, double[] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * Creates an operator from a row-major array.
     * @param rows Number of rows (must be positive)
     * @param cols Number of columns (must be positive)
     * @param data Entries in row-major order, copied
     * @return Matrix operator
     */
    public static MatrixOperator of(int rows, int cols, double[] data) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Matrix dimensions must be positive");
        }
        if (data == null || data.length != rows * cols) {
            throw new IllegalArgumentException("Matrix data must have length " + rows * cols);
        }
        return new MatrixOperator(rows, cols, data.clone());
    }

    /**
     * Creates an operator from a two-dimensional array.
     * @param matrix Rows of the matrix, all of equal length
     * @return Matrix operator
     */
    public static MatrixOperator of(double[][] matrix) {
        if (matrix == null || matrix.length == 0 || matrix[0] == null || matrix[0].length == 0) {
            throw new IllegalArgumentException("Matrix cannot be null or empty");
        }
        int rows = matrix.length;
        int cols = matrix[0].length;
        double[] data = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            if (matrix[i] == null || matrix[i].length != cols) {
                throw new IllegalArgumentException("Matrix rows must all have length " + cols);
            }
            System.arraycopy(matrix[i], 0, data, i * cols, cols);
        }
        return new MatrixOperator(rows, cols, data);
    }

    /**
     * Creates the n × n identity.
     * @param n Dimension
     * @return Identity operator
     */
    public static MatrixOperator identity(int n) {
        double[] diagonal = new double[n];
        Arrays.fill(diagonal, 1.0);
        return diagonal(diagonal);
    }

    /**
     * Creates a square diagonal matrix.
     * @param diagonal Diagonal entries
     * @return Diagonal operator
     */
    public static MatrixOperator diagonal(double... diagonal) {
        if (diagonal == null || diagonal.length == 0) {
            throw new IllegalArgumentException("Diagonal cannot be null or empty");
        }
        int n = diagonal.length;
        double[] data = new double[n * n];
        for (int i = 0; i < n; i++) {
            data[i * n + i] = diagonal[i];
        }
        return new MatrixOperator(n, n, data);
    }

    /**
     * Creates the m × n zero matrix.
     * @param rows Number of rows
     * @param cols Number of columns
     * @return Zero operator
     */
    public static MatrixOperator zeros(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Matrix dimensions must be positive");
        }
        return new MatrixOperator(rows, cols, new double[rows * cols]);
    }

    @Override
    public int inputDimension() {
        return cols;
    }

    @Override
    public int outputDimension() {
        return rows;
    }

    @Override
    public void apply(double[] x, double[] y) {
        for (int i = 0; i < rows; i++) {
            double sum = 0.0;
            int offset = i * cols;
            for (int j = 0; j < cols; j++) {
                sum += data[offset + j] * x[j];
            }
            y[i] = sum;
        }
    }

    @Override
    public void applyAdjoint(double[] y, double[] x) {
        for (int j = 0; j < cols; j++) {
            double sum = 0.0;
            for (int i = 0; i < rows; i++) {
                sum += data[i * cols + j] * y[i];
            }
            x[j] = sum;
        }
    }

    /**
     * Gets a single entry.
     * @param i Row index
     * @param j Column index
     * @return Entry A[i][j]
     */
    public double get(int i, int j) {
        return data[i * cols + j];
    }

    @Override
    public String toString() {
        return "MatrixOperator{" + rows + "x" + cols + '}';
    }
}
