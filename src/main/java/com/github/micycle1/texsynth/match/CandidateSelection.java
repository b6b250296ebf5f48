package com.github.micycle1.texsynth.match;

import java.util.Random;

import com.github.micycle1.texsynth.MathUtil;
import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.SourceBuffer;

// Turns a complete, row-major array of candidate distances into a Match.
final class CandidateSelection {

	private CandidateSelection() {
	}

	static Match select(double[] distances, double minDistance, PaddedSource source, Random rnd) {
		final double bound = MathUtil.tieBound(minDistance);
		int[] tied = new int[8];
		int tieCount = 0;
		for (int idx = 0; idx < distances.length; idx++) {
			if (distances[idx] <= bound) {
				if (tieCount == tied.length) {
					int[] grown = new int[tied.length * 2];
					System.arraycopy(tied, 0, grown, 0, tieCount);
					tied = grown;
				}
				tied[tieCount++] = idx;
			}
		}
		if (tieCount == 0) {
			throw new IllegalStateException("No candidate within the tie band of " + minDistance);
		}

		final int chosen = tieCount == 1 ? tied[0] : tied[rnd.nextInt(tieCount)];
		final SourceBuffer s = source.source();
		final int row = chosen / s.width();
		final int col = chosen % s.width();
		return new Match(row, col, s.get(row, col), distances[chosen], tieCount);
	}
}
