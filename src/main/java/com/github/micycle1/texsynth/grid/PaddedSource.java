package com.github.micycle1.texsynth.grid;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import com.github.micycle1.texsynth.InvalidParameterException;
import com.github.micycle1.texsynth.MathUtil;
import com.github.micycle1.texsynth.NoValidCandidateException;

/**
 * <p>
 * The exemplar extended by {@code radius = patchSize / 2} cells on every side
 * with reflective extension, so that every source pixel is the centre of a full
 * {@code patchSize x patchSize} candidate window.
 * </p>
 *
 * <p>
 * Reflection mirrors across the edge sample without repeating it: the padded
 * cell at offset {@code -k} from the first row equals source row {@code k}.
 * For a 5x5 source padded by one, {@code padded(0,0) == source(1,1)}. The
 * invariant {@code padded(i + radius, j + radius) == source(i, j)} holds for
 * every source cell.
 * </p>
 *
 * <p>
 * Built once per synthesis run and never mutated afterwards, so it is safe to
 * share between the threads of a parallel candidate scan.
 * </p>
 */
public final class PaddedSource {

	private final SourceBuffer source;
	private final int patchSize;
	private final int radius;
	private final DMatrixRMaj padded;

	private PaddedSource(SourceBuffer source, int patchSize, DMatrixRMaj padded) {
		this.source = source;
		this.patchSize = patchSize;
		this.radius = patchSize / 2;
		this.padded = padded;
	}

	/**
	 * Builds the reflected padding of {@code source}.
	 *
	 * @throws InvalidParameterException  if {@code patchSize} is even or smaller
	 *                                    than 3
	 * @throws NoValidCandidateException  if the source is not larger than the
	 *                                    radius in both dimensions, so a single
	 *                                    reflection cannot fill the border
	 */
	public static PaddedSource build(SourceBuffer source, int patchSize) {
		Objects.requireNonNull(source, "source must not be null");
		checkPatchSize(patchSize);
		final int r = patchSize / 2;
		final int h = source.height();
		final int w = source.width();
		if (h <= r || w <= r) {
			throw new NoValidCandidateException("Source " + h + "x" + w + " cannot host a reflected " + patchSize + "x" + patchSize
					+ " window (each side must exceed " + r + ")");
		}

		final int ph = h + 2 * r;
		final int pw = w + 2 * r;
		DMatrixRMaj padded = new DMatrixRMaj(ph, pw);
		for (int i = 0; i < ph; i++) {
			int si = MathUtil.reflect(i - r, h);
			for (int j = 0; j < pw; j++) {
				int sj = MathUtil.reflect(j - r, w);
				padded.unsafe_set(i, j, source.get(si, sj));
			}
		}
		return new PaddedSource(source, patchSize, padded);
	}

	public static void checkPatchSize(int patchSize) {
		if (patchSize < 3 || patchSize % 2 == 0) {
			throw new InvalidParameterException("patchSize must be odd and >= 3, got " + patchSize);
		}
	}

	public SourceBuffer source() {
		return source;
	}

	public int patchSize() {
		return patchSize;
	}

	public int radius() {
		return radius;
	}

	/** Padded height: {@code source.height() + 2 * radius}. */
	public int height() {
		return padded.numRows;
	}

	/** Padded width: {@code source.width() + 2 * radius}. */
	public int width() {
		return padded.numCols;
	}

	/** Padded-space accessor, no bounds checks beyond the array's own. */
	public double get(int row, int col) {
		return padded.unsafe_get(row, col);
	}

	/** Number of candidate windows, one per source pixel. */
	public int candidateCount() {
		return source.height() * source.width();
	}

	// patchSize x patchSize copy with padded top-left (top, left)
	DMatrixRMaj window(int top, int left) {
		return CommonOps_DDRM.extract(padded, top, top + patchSize, left, left + patchSize);
	}
}
