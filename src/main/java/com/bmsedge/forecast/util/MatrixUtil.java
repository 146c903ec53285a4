package com.bmsedge.forecast.util;

/**
 * Dense linear algebra for the small systems (order at most 2) of the ARIMA fitter.
 */
public class MatrixUtil {

    public static final double PIVOT_EPSILON = 1e-10;

    private MatrixUtil() {
    }

    /**
     * Least-squares solution of {@code X b = y} through the normal equations
     * {@code (X'X) b = X'y}. Returns zeros when there are no rows.
     */
    public static double[] solveNormalEquations(double[][] x, double[] y, int columns) {
        int rows = x.length;
        if (rows == 0 || columns == 0) {
            return new double[columns];
        }

        double[][] xtx = new double[columns][columns];
        double[] xty = new double[columns];
        for (int i = 0; i < columns; i++) {
            for (int j = 0; j < columns; j++) {
                double sum = 0;
                for (int k = 0; k < rows; k++) {
                    sum += x[k][i] * x[k][j];
                }
                xtx[i][j] = sum;
            }
            double sum = 0;
            for (int k = 0; k < rows; k++) {
                sum += x[k][i] * y[k];
            }
            xty[i] = sum;
        }

        return gaussianElimination(xtx, xty);
    }

    /**
     * Solves {@code A x = b} by Gaussian elimination with partial pivoting. Columns whose
     * pivot is below {@link #PIVOT_EPSILON} are skipped and their unknown is set to 0.
     * The inputs are not modified.
     */
    public static double[] gaussianElimination(double[][] a, double[] b) {
        int n = b.length;
        double[][] augmented = new double[n][n + 1];
        for (int i = 0; i < n; i++) {
            System.arraycopy(a[i], 0, augmented[i], 0, n);
            augmented[i][n] = b[i];
        }

        forwardElimination(augmented, n);
        return backSubstitution(augmented, n);
    }

    private static void forwardElimination(double[][] augmented, int n) {
        for (int col = 0; col < n; col++) {
            int pivotRow = findPivotRow(augmented, col, n);
            if (pivotRow != col) {
                double[] tmp = augmented[col];
                augmented[col] = augmented[pivotRow];
                augmented[pivotRow] = tmp;
            }

            double pivot = augmented[col][col];
            if (Math.abs(pivot) < PIVOT_EPSILON) {
                continue;
            }

            for (int row = col + 1; row < n; row++) {
                double factor = augmented[row][col] / pivot;
                for (int j = col; j <= n; j++) {
                    augmented[row][j] -= factor * augmented[col][j];
                }
            }
        }
    }

    private static int findPivotRow(double[][] augmented, int col, int n) {
        int maxRow = col;
        double maxVal = Math.abs(augmented[col][col]);
        for (int row = col + 1; row < n; row++) {
            double val = Math.abs(augmented[row][col]);
            if (val > maxVal) {
                maxVal = val;
                maxRow = row;
            }
        }
        return maxRow;
    }

    private static double[] backSubstitution(double[][] augmented, int n) {
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = augmented[i][n];
            for (int j = i + 1; j < n; j++) {
                sum -= augmented[i][j] * x[j];
            }
            double diag = augmented[i][i];
            x[i] = Math.abs(diag) > PIVOT_EPSILON ? sum / diag : 0;
        }
        return x;
    }

    /**
     * Levinson-Durbin recursion for the Yule-Walker equations.
     *
     * @param r autocorrelations at lags 1..p (normalised by the lag-0 autocovariance)
     * @param p AR order
     * @return AR coefficients φ1..φp
     */
    public static double[] levinsonDurbin(double[] r, int p) {
        if (p == 0) {
            return new double[0];
        }

        double[][] phi = new double[p + 1][p + 1];
        phi[1][1] = r.length > 0 ? r[0] : 0;

        for (int k = 2; k <= p; k++) {
            double num = r[k - 1];
            double den = 1;
            for (int j = 1; j < k; j++) {
                num -= phi[k - 1][j] * r[k - 1 - j];
                den -= phi[k - 1][j] * r[j - 1];
            }

            phi[k][k] = den != 0 ? num / den : 0;

            for (int j = 1; j < k; j++) {
                phi[k][j] = phi[k - 1][j] - phi[k][k] * phi[k - 1][k - j];
            }
        }

        double[] result = new double[p];
        System.arraycopy(phi[p], 1, result, 0, p);
        return result;
    }
}
