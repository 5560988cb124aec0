package com.verlumen.maintenance.markov;

import static com.google.common.base.Preconditions.checkArgument;

/** Dense linear algebra used by the chain analysis. Inputs are never modified. */
final class LinearSystems {
  /** Pivots smaller than this are treated as zero. */
  static final double SINGULARITY_TOLERANCE = 1e-12;

  private LinearSystems() {}

  /**
   * Solves {@code a x = b} by Gaussian elimination with partial pivoting.
   *
   * @throws ArithmeticException if {@code a} is singular
   */
  static double[] solve(double[][] a, double[] b) {
    int n = a.length;
    checkArgument(b.length == n, "Right-hand side has %s rows, expected %s", b.length, n);
    double[][] augmented = new double[n][n + 1];
    for (int i = 0; i < n; i++) {
      checkArgument(a[i].length == n, "Matrix must be square");
      System.arraycopy(a[i], 0, augmented[i], 0, n);
      augmented[i][n] = b[i];
    }
    eliminate(augmented, n);
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = augmented[i][n];
    }
    return x;
  }

  /**
   * Inverts {@code a} by Gauss-Jordan elimination with partial pivoting.
   *
   * @throws ArithmeticException if {@code a} is singular
   */
  static double[][] invert(double[][] a) {
    int n = a.length;
    double[][] augmented = new double[n][2 * n];
    for (int i = 0; i < n; i++) {
      checkArgument(a[i].length == n, "Matrix must be square");
      System.arraycopy(a[i], 0, augmented[i], 0, n);
      augmented[i][n + i] = 1.0;
    }
    eliminate(augmented, n);
    double[][] inverse = new double[n][n];
    for (int i = 0; i < n; i++) {
      System.arraycopy(augmented[i], n, inverse[i], 0, n);
    }
    return inverse;
  }

  /** Least-squares solution of an overdetermined system via the normal equations. */
  static double[] leastSquares(double[][] a, double[] b) {
    int rows = a.length;
    checkArgument(rows > 0 && b.length == rows, "System shape mismatch");
    int cols = a[0].length;
    double[][] normal = new double[cols][cols];
    double[] rhs = new double[cols];
    for (int i = 0; i < cols; i++) {
      for (int j = 0; j < cols; j++) {
        double sum = 0;
        for (int k = 0; k < rows; k++) {
          sum += a[k][i] * a[k][j];
        }
        normal[i][j] = sum;
      }
      double sum = 0;
      for (int k = 0; k < rows; k++) {
        sum += a[k][i] * b[k];
      }
      rhs[i] = sum;
    }
    return solve(normal, rhs);
  }

  // Reduces the left n columns of the augmented matrix to the identity.
  private static void eliminate(double[][] m, int n) {
    int width = m[0].length;
    for (int col = 0; col < n; col++) {
      int pivot = col;
      for (int row = col + 1; row < n; row++) {
        if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) {
          pivot = row;
        }
      }
      if (Math.abs(m[pivot][col]) < SINGULARITY_TOLERANCE) {
        throw new ArithmeticException("Matrix is singular at column " + col);
      }
      double[] swap = m[col];
      m[col] = m[pivot];
      m[pivot] = swap;

      double scale = m[col][col];
      for (int j = col; j < width; j++) {
        m[col][j] /= scale;
      }
      for (int row = 0; row < n; row++) {
        if (row == col || m[row][col] == 0.0) {
          continue;
        }
        double factor = m[row][col];
        for (int j = col; j < width; j++) {
          m[row][j] -= factor * m[col][j];
        }
      }
    }
  }
}
