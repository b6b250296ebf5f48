package com.github.micycle1.texsynth.grid;

import org.ejml.data.DMatrixRMaj;

/**
 * A clipped neighbourhood of the target around one query cell. Holds the
 * window intensities and fill mask as extracted, plus the filled ("known")
 * cells flattened into offset lists relative to the query centre, which is all
 * the masked distance needs.
 */
public final class TargetWindow {

	private final int centerRow;
	private final int centerCol;
	private final int radius;
	private final int top; // target row of window row 0
	private final int left; // target column of window column 0
	private final DMatrixRMaj values;
	private final boolean[] mask;

	private final int[] knownRowOffsets;
	private final int[] knownColOffsets;
	private final double[] knownValues;

	TargetWindow(int centerRow, int centerCol, int radius, int top, int left, DMatrixRMaj values, boolean[] mask) {
		this.centerRow = centerRow;
		this.centerCol = centerCol;
		this.radius = radius;
		this.top = top;
		this.left = left;
		this.values = values;
		this.mask = mask;

		int known = 0;
		for (boolean b : mask) {
			if (b) {
				known++;
			}
		}
		knownRowOffsets = new int[known];
		knownColOffsets = new int[known];
		knownValues = new double[known];
		int k = 0;
		for (int i = 0; i < values.numRows; i++) {
			for (int j = 0; j < values.numCols; j++) {
				if (mask[i * values.numCols + j]) {
					knownRowOffsets[k] = top + i - centerRow;
					knownColOffsets[k] = left + j - centerCol;
					knownValues[k] = values.unsafe_get(i, j);
					k++;
				}
			}
		}
	}

	public int centerRow() {
		return centerRow;
	}

	public int centerCol() {
		return centerCol;
	}

	public int radius() {
		return radius;
	}

	/** Window rows; at most {@code 2 * radius + 1}, fewer when clipped. */
	public int rows() {
		return values.numRows;
	}

	/** Window columns; at most {@code 2 * radius + 1}, fewer when clipped. */
	public int cols() {
		return values.numCols;
	}

	public int top() {
		return top;
	}

	public int left() {
		return left;
	}

	public double get(int i, int j) {
		return values.get(i, j);
	}

	public boolean isKnown(int i, int j) {
		return mask[i * values.numCols + j];
	}

	public int knownCount() {
		return knownValues.length;
	}

	public int knownRowOffset(int k) {
		return knownRowOffsets[k];
	}

	public int knownColOffset(int k) {
		return knownColOffsets[k];
	}

	public double knownValue(int k) {
		return knownValues[k];
	}
}
