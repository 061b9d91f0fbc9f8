/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

import java.util.Arrays;

/**
 * Immutable sparse matrix in compressed sparse row (CSR) layout.
 * <p>
 * Row {@code i} owns the entries {@code rowPointers[i] <= p < rowPointers[i + 1]} of the
 * column index and value arrays. Column indices within a row are strictly
 * increasing; every factory sorts entries and sums duplicates.
 * </p>
 *
 * <pre>{@code
 * // [[2, 0],
 * //  [0, 2]]
 * SparseMatrix q = SparseMatrix.fromTriplets(2, 2,
 *     new int[]{0, 1}, new int[]{0, 1}, new double[]{2.0, 2.0});
 * }</pre>
 */
public final class SparseMatrix {

    private final int rows;
    private final int cols;
    private final int[] rowPointers;
    private final int[] columnIndices;
    private final double[] values;

    private SparseMatrix(int rows, int cols, int[] rowPointers, int[] columnIndices, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.rowPointers = rowPointers;
        this.columnIndices = columnIndices;
        this.values = values;
    }

    /**
     * Creates a matrix without nonzeros.
     * @param rows Row count
     * @param cols Column count
     * @return Empty matrix
     */
    public static SparseMatrix empty(int rows, int cols) {
        checkShape(rows, cols);
        return new SparseMatrix(rows, cols, new int[rows + 1], new int[0], new double[0]);
    }

    /**
     * Creates a matrix from a dense row-major array, dropping exact zeros.
     * @param dense Dense rows, all of the same length
     * @param cols Column count (needed when {@code dense} has no rows)
     * @return CSR matrix
     */
    public static SparseMatrix fromDense(double[][] dense, int cols) {
        if (dense == null) {
            throw new IllegalArgumentException("Dense matrix cannot be null");
        }
        checkShape(dense.length, cols);
        int nnz = 0;
        for (int i = 0; i < dense.length; i++) {
            if (dense[i] == null || dense[i].length != cols) {
                throw new IllegalArgumentException("Row " + i + " must have length " + cols);
            }
            for (double v : dense[i]) {
                if (v != 0.0) nnz++;
            }
        }
        int[] ptr = new int[dense.length + 1];
        int[] idx = new int[nnz];
        double[] val = new double[nnz];
        int p = 0;
        for (int i = 0; i < dense.length; i++) {
            for (int j = 0; j < cols; j++) {
                if (dense[i][j] != 0.0) {
                    idx[p] = j;
                    val[p] = dense[i][j];
                    p++;
                }
            }
            ptr[i + 1] = p;
        }
        return new SparseMatrix(dense.length, cols, ptr, idx, val);
    }

    /**
     * Creates a matrix from a dense row-major array with at least one row.
     * @param dense Dense rows
     * @return CSR matrix
     */
    public static SparseMatrix fromDense(double[][] dense) {
        if (dense == null || dense.length == 0) {
            throw new IllegalArgumentException("Dense matrix must have at least one row; use fromDense(dense, cols)");
        }
        return fromDense(dense, dense[0] == null ? 0 : dense[0].length);
    }

    /**
     * Creates a matrix from coordinate (COO) triplets.
     * @param rows Row count
     * @param cols Column count
     * @param rowIndices Row index of each entry
     * @param colIndices Column index of each entry
     * @param entries Value of each entry
     * @return CSR matrix with duplicates summed
     */
    public static SparseMatrix fromTriplets(int rows, int cols, int[] rowIndices, int[] colIndices, double[] entries) {
        checkShape(rows, cols);
        if (rowIndices == null || colIndices == null || entries == null) {
            throw new IllegalArgumentException("Triplet arrays cannot be null");
        }
        if (rowIndices.length != colIndices.length || rowIndices.length != entries.length) {
            throw new IllegalArgumentException("Triplet arrays must have the same length");
        }
        int nnz = entries.length;
        int[] ptr = new int[rows + 1];
        for (int k = 0; k < nnz; k++) {
            checkIndex(rowIndices[k], rows, "Row");
            checkIndex(colIndices[k], cols, "Column");
            ptr[rowIndices[k] + 1]++;
        }
        for (int i = 0; i < rows; i++) {
            ptr[i + 1] += ptr[i];
        }
        int[] next = Arrays.copyOf(ptr, rows);
        int[] idx = new int[nnz];
        double[] val = new double[nnz];
        for (int k = 0; k < nnz; k++) {
            int p = next[rowIndices[k]]++;
            idx[p] = colIndices[k];
            val[p] = entries[k];
        }
        return canonical(rows, cols, ptr, idx, val);
    }

    /**
     * Creates a matrix from compressed sparse column (CSC) arrays.
     * @param rows Row count
     * @param cols Column count
     * @param colPointers Column pointers, length {@code cols + 1}
     * @param rowIndices Row index of each entry
     * @param entries Value of each entry
     * @return CSR matrix
     */
    public static SparseMatrix fromCsc(int rows, int cols, int[] colPointers, int[] rowIndices, double[] entries) {
        checkShape(rows, cols);
        checkPointers(colPointers, cols, rowIndices, entries);
        int[] colOf = new int[entries.length];
        for (int j = 0; j < cols; j++) {
            for (int p = colPointers[j]; p < colPointers[j + 1]; p++) {
                colOf[p] = j;
            }
        }
        return fromTriplets(rows, cols, rowIndices, colOf, entries);
    }

    /**
     * Creates a matrix from CSR arrays. The arrays are copied.
     * @param rows Row count
     * @param cols Column count
     * @param rowPointers Row pointers, length {@code rows + 1}
     * @param colIndices Column index of each entry
     * @param entries Value of each entry
     * @return CSR matrix
     */
    public static SparseMatrix fromCsr(int rows, int cols, int[] rowPointers, int[] colIndices, double[] entries) {
        checkShape(rows, cols);
        checkPointers(rowPointers, rows, colIndices, entries);
        for (int c : colIndices) {
            checkIndex(c, cols, "Column");
        }
        return canonical(rows, cols, rowPointers.clone(), colIndices.clone(), entries.clone());
    }

    /**
     * Stacks two matrices with the same column count, {@code top} rows first.
     * @param top Upper block
     * @param bottom Lower block
     * @return Stacked matrix
     */
    public static SparseMatrix stack(SparseMatrix top, SparseMatrix bottom) {
        if (top.cols != bottom.cols) {
            throw new IllegalArgumentException("Cannot stack " + top.cols + " columns on " + bottom.cols);
        }
        int rows = top.rows + bottom.rows;
        int topNnz = top.getNonZeros();
        int[] ptr = new int[rows + 1];
        System.arraycopy(top.rowPointers, 0, ptr, 0, top.rows + 1);
        for (int i = 1; i <= bottom.rows; i++) {
            ptr[top.rows + i] = topNnz + bottom.rowPointers[i];
        }
        int[] idx = new int[topNnz + bottom.getNonZeros()];
        double[] val = new double[idx.length];
        System.arraycopy(top.columnIndices, 0, idx, 0, topNnz);
        System.arraycopy(bottom.columnIndices, 0, idx, topNnz, bottom.getNonZeros());
        System.arraycopy(top.values, 0, val, 0, topNnz);
        System.arraycopy(bottom.values, 0, val, topNnz, bottom.getNonZeros());
        return new SparseMatrix(rows, top.cols, ptr, idx, val);
    }

    // Sorts each row by column and sums duplicate entries
    private static SparseMatrix canonical(int rows, int cols, int[] ptr, int[] idx, double[] val) {
        int[] outPtr = new int[rows + 1];
        int out = 0;
        for (int i = 0; i < rows; i++) {
            int start = ptr[i];
            int end = ptr[i + 1];
            for (int p = start + 1; p < end; p++) {
                int c = idx[p];
                double v = val[p];
                int q = p - 1;
                while (q >= start && idx[q] > c) {
                    idx[q + 1] = idx[q];
                    val[q + 1] = val[q];
                    q--;
                }
                idx[q + 1] = c;
                val[q + 1] = v;
            }
            for (int p = start; p < end; p++) {
                if (out > outPtr[i] && idx[out - 1] == idx[p]) {
                    val[out - 1] += val[p];
                } else {
                    idx[out] = idx[p];
                    val[out] = val[p];
                    out++;
                }
            }
            outPtr[i + 1] = out;
        }
        return new SparseMatrix(rows, cols, outPtr, Arrays.copyOf(idx, out), Arrays.copyOf(val, out));
    }

    private static void checkShape(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Matrix shape must be non-negative: " + rows + "x" + cols);
        }
    }

    private static void checkIndex(int index, int limit, String what) {
        if (index < 0 || index >= limit) {
            throw new IllegalArgumentException(what + " index " + index + " out of range [0, " + limit + ")");
        }
    }

    private static void checkPointers(int[] pointers, int count, int[] indices, double[] entries) {
        if (pointers == null || indices == null || entries == null) {
            throw new IllegalArgumentException("Compressed arrays cannot be null");
        }
        if (pointers.length != count + 1) {
            throw new IllegalArgumentException("Pointer array must have length " + (count + 1));
        }
        if (indices.length != entries.length) {
            throw new IllegalArgumentException("Index and value arrays must have the same length");
        }
        if (pointers[0] != 0 || pointers[count] != entries.length) {
            throw new IllegalArgumentException("Pointer array must start at 0 and end at " + entries.length);
        }
        for (int k = 0; k < count; k++) {
            if (pointers[k] > pointers[k + 1]) {
                throw new IllegalArgumentException("Pointer array must be non-decreasing at " + k);
            }
        }
    }

    /**
     * Gets the number of rows.
     * @return Row count
     */
    public int getRows() {
        return rows;
    }

    /**
     * Gets the number of columns.
     * @return Column count
     */
    public int getCols() {
        return cols;
    }

    /**
     * Gets the number of stored entries.
     * @return Nonzero count
     */
    public int getNonZeros() {
        return values.length;
    }

    /**
     * Gets the row pointers.
     * @return Copy of row pointers, length {@code rows + 1}
     */
    public int[] getRowPointers() {
        return rowPointers.clone();
    }

    /**
     * Gets the column indices.
     * @return Copy of column indices
     */
    public int[] getColumnIndices() {
        return columnIndices.clone();
    }

    /**
     * Gets the entry values.
     * @return Copy of values
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * Gets a single entry.
     * @param row Row index
     * @param col Column index
     * @return Stored value, or 0 if absent
     */
    public double get(int row, int col) {
        checkIndex(row, rows, "Row");
        checkIndex(col, cols, "Column");
        int p = Arrays.binarySearch(columnIndices, rowPointers[row], rowPointers[row + 1], col);
        return p >= 0 ? values[p] : 0.0;
    }

    /**
     * Checks if this matrix is square.
     * @return true if rows == cols
     */
    public boolean isSquare() {
        return rows == cols;
    }

    @Override
    public String toString() {
        return "SparseMatrix{" + rows + "x" + cols + ", nnz=" + values.length + '}';
    }
}
