package com.github.micycle1.texsynth.match;

import java.util.Objects;
import java.util.Random;

import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.TargetWindow;

/**
 * Sequential scan over every candidate window. Cost per query is
 * {@code O(sourceHeight * sourceWidth * knownCells)}.
 */
public final class ExhaustiveMatchEngine implements MatchEngine {

	private final Random rnd;

	public ExhaustiveMatchEngine(Random rnd) {
		this.rnd = Objects.requireNonNull(rnd, "rnd must not be null");
	}

	@Override
	public Match findBestMatch(TargetWindow window, PaddedSource source) {
		MaskedDistance.checkWindow(window, source);
		final int h = source.source().height();
		final int w = source.source().width();
		double[] distances = new double[h * w];
		double min = Double.POSITIVE_INFINITY;
		for (int i = 0; i < h; i++) {
			for (int j = 0; j < w; j++) {
				double d = MaskedDistance.compute(window, source, i, j);
				distances[i * w + j] = d;
				if (d < min) {
					min = d;
				}
			}
		}
		return CandidateSelection.select(distances, min, source, rnd);
	}
}
