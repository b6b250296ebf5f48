package com.github.micycle1.texsynth.grid;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import com.github.micycle1.texsynth.InvalidParameterException;

/**
 * <p>
 * The output grid under construction together with its fill mask. This is the
 * only mutable state of a synthesis run; it is owned by the engine, which hands
 * it to {@link WindowView} for reading only.
 * </p>
 *
 * <p>
 * Whether a cell is filled is read exclusively from the mask: unfilled cells
 * hold zero, which is also a legitimate intensity. A filled cell never changes
 * again, {@link #commit(int, int, double)} refuses to overwrite it.
 * </p>
 */
public final class TargetBuffer {

	private final DMatrixRMaj values;
	private final boolean[] filled;
	private int filledCount;

	private final int seedTop;
	private final int seedLeft;
	private final int seedSize;

	private TargetBuffer(int height, int width, int seedTop, int seedLeft, int seedSize) {
		this.values = new DMatrixRMaj(height, width);
		this.filled = new boolean[height * width];
		this.seedTop = seedTop;
		this.seedLeft = seedLeft;
		this.seedSize = seedSize;
	}

	/**
	 * Allocates an empty {@code height x width} target and plants the
	 * {@code seedSize x seedSize} top-left block of {@code source} at its centre,
	 * starting at {@code (height / 2 - seedSize / 2, width / 2 - seedSize / 2)}.
	 *
	 * @throws InvalidParameterException if the seed is smaller than one cell or
	 *                                   larger than the output or the source
	 */
	public static TargetBuffer initialize(int height, int width, SourceBuffer source, int seedSize) {
		Objects.requireNonNull(source, "source must not be null");
		checkSizes(height, width, seedSize);
		if (seedSize > Math.min(source.height(), source.width())) {
			throw new InvalidParameterException(
					"seedSize " + seedSize + " exceeds source dimensions " + source.height() + "x" + source.width());
		}

		final int top = height / 2 - seedSize / 2;
		final int left = width / 2 - seedSize / 2;
		TargetBuffer target = new TargetBuffer(height, width, top, left, seedSize);
		CommonOps_DDRM.insert(source.topLeftBlock(seedSize), target.values, top, left);
		for (int i = top; i < top + seedSize; i++) {
			for (int j = left; j < left + seedSize; j++) {
				target.filled[i * width + j] = true;
			}
		}
		target.filledCount = seedSize * seedSize;
		return target;
	}

	/** Output and seed size checks that do not depend on the source. */
	public static void checkSizes(int height, int width, int seedSize) {
		if (height < 1 || width < 1) {
			throw new InvalidParameterException("Output size must be positive, got " + height + "x" + width);
		}
		if (seedSize < 1) {
			throw new InvalidParameterException("seedSize must be >= 1, got " + seedSize);
		}
		if (seedSize > Math.min(height, width)) {
			throw new InvalidParameterException("seedSize " + seedSize + " exceeds output dimensions " + height + "x" + width);
		}
	}

	public int height() {
		return values.numRows;
	}

	public int width() {
		return values.numCols;
	}

	public boolean inBounds(int row, int col) {
		return row >= 0 && row < values.numRows && col >= 0 && col < values.numCols;
	}

	public boolean isFilled(int row, int col) {
		return filled[row * values.numCols + col];
	}

	public double get(int row, int col) {
		return values.get(row, col);
	}

	/**
	 * Assigns the final intensity of an unfilled cell and marks it filled.
	 *
	 * @throws IllegalStateException if the cell is already filled
	 */
	public void commit(int row, int col, double intensity) {
		final int idx = row * values.numCols + col;
		if (filled[idx]) {
			throw new IllegalStateException("Cell (" + row + "," + col + ") is already filled");
		}
		values.set(row, col, intensity);
		filled[idx] = true;
		filledCount++;
	}

	public int filledCount() {
		return filledCount;
	}

	public int cellCount() {
		return filled.length;
	}

	public boolean isComplete() {
		return filledCount == filled.length;
	}

	/** First row of the seed block. */
	public int seedTop() {
		return seedTop;
	}

	/** First column of the seed block. */
	public int seedLeft() {
		return seedLeft;
	}

	public int seedSize() {
		return seedSize;
	}

	/** Defensive copy of the current intensities. */
	public DMatrixRMaj toGrid() {
		return values.copy();
	}
}
