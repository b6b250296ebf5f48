package com.github.micycle1.texsynth.grid;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import com.github.micycle1.texsynth.InvalidParameterException;

/**
 * Immutable grayscale exemplar. The wrapped grid is a private copy of the
 * caller's matrix, so later changes to the caller's matrix do not leak into a
 * running synthesis.
 */
public final class SourceBuffer {

	private final DMatrixRMaj intensities;

	private SourceBuffer(DMatrixRMaj intensities) {
		this.intensities = intensities;
	}

	/**
	 * Wraps a copy of {@code grid}.
	 *
	 * @throws InvalidParameterException if the grid is empty or holds a NaN or
	 *                                   infinite intensity
	 */
	public static SourceBuffer of(DMatrixRMaj grid) {
		Objects.requireNonNull(grid, "grid must not be null");
		if (grid.numRows < 1 || grid.numCols < 1) {
			throw new InvalidParameterException("Source grid must be non-empty, got " + grid.numRows + "x" + grid.numCols);
		}
		final int n = grid.numRows * grid.numCols;
		for (int i = 0; i < n; i++) {
			if (!Double.isFinite(grid.data[i])) {
				throw new InvalidParameterException(
						"Source intensity at (" + (i / grid.numCols) + "," + (i % grid.numCols) + ") is not finite: " + grid.data[i]);
			}
		}
		return new SourceBuffer(grid.copy());
	}

	public int height() {
		return intensities.numRows;
	}

	public int width() {
		return intensities.numCols;
	}

	public double get(int row, int col) {
		return intensities.get(row, col);
	}

	/** Copy of the {@code size x size} block at the top-left corner. */
	public DMatrixRMaj topLeftBlock(int size) {
		return CommonOps_DDRM.extract(intensities, 0, size, 0, size);
	}
}
