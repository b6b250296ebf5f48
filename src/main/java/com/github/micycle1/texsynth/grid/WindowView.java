package com.github.micycle1.texsynth.grid;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

/**
 * Extracts neighbourhood windows of one radius from the target (clipped at its
 * edges, never padded) and from the padded source (always full size).
 */
public final class WindowView {

	private final TargetBuffer target;
	private final PaddedSource source;

	public WindowView(TargetBuffer target, PaddedSource source) {
		this.target = Objects.requireNonNull(target, "target must not be null");
		this.source = Objects.requireNonNull(source, "source must not be null");
	}

	public int radius() {
		return source.radius();
	}

	/**
	 * The target window centred on {@code (row, col)}, clipped to the buffer
	 * bounds, with its fill mask.
	 */
	public TargetWindow extractTarget(int row, int col) {
		if (!target.inBounds(row, col)) {
			throw new IndexOutOfBoundsException("Target cell (" + row + "," + col + ") outside " + target.height() + "x" + target.width());
		}
		final int r = source.radius();
		final int top = Math.max(row - r, 0);
		final int bottom = Math.min(row + r + 1, target.height());
		final int left = Math.max(col - r, 0);
		final int right = Math.min(col + r + 1, target.width());

		final int rows = bottom - top;
		final int cols = right - left;
		DMatrixRMaj values = new DMatrixRMaj(rows, cols);
		boolean[] mask = new boolean[rows * cols];
		for (int i = 0; i < rows; i++) {
			for (int j = 0; j < cols; j++) {
				if (target.isFilled(top + i, left + j)) {
					mask[i * cols + j] = true;
					values.unsafe_set(i, j, target.get(top + i, left + j));
				}
			}
		}
		return new TargetWindow(row, col, r, top, left, values, mask);
	}

	/**
	 * The full {@code patchSize x patchSize} candidate window centred on source
	 * cell {@code (sourceRow, sourceCol)}; its padded top-left is
	 * {@code (sourceRow, sourceCol)}.
	 */
	public DMatrixRMaj extractCandidate(int sourceRow, int sourceCol) {
		final SourceBuffer s = source.source();
		if (sourceRow < 0 || sourceRow >= s.height() || sourceCol < 0 || sourceCol >= s.width()) {
			throw new IndexOutOfBoundsException("Source cell (" + sourceRow + "," + sourceCol + ") outside " + s.height() + "x" + s.width());
		}
		return source.window(sourceRow, sourceCol);
	}
}
