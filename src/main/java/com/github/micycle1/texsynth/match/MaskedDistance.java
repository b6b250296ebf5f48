package com.github.micycle1.texsynth.match;

import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.TargetWindow;

/**
 * Mean squared difference between the filled cells of a target window and the
 * co-located cells of a candidate window. Only filled cells contribute and the
 * sum is divided by their count, so windows clipped at the target edge or with
 * few filled cells yield distances on the same scale as full windows.
 */
public final class MaskedDistance {

	private MaskedDistance() {
	}

	/**
	 * Distance between {@code window} and the candidate centred on source cell
	 * {@code (sourceRow, sourceCol)}. The candidate cell matched against target
	 * offset {@code (dy, dx)} is padded cell
	 * {@code (sourceRow + radius + dy, sourceCol + radius + dx)}.
	 */
	public static double compute(TargetWindow window, PaddedSource source, int sourceRow, int sourceCol) {
		final int n = window.knownCount();
		final int r = source.radius();
		final int pr = sourceRow + r;
		final int pc = sourceCol + r;
		double sum = 0;
		for (int k = 0; k < n; k++) {
			double d = window.knownValue(k) - source.get(pr + window.knownRowOffset(k), pc + window.knownColOffset(k));
			sum += d * d;
		}
		return sum / n;
	}

	static void checkWindow(TargetWindow window, PaddedSource source) {
		if (window.knownCount() == 0) {
			throw new IllegalArgumentException(
					"Target window at (" + window.centerRow() + "," + window.centerCol() + ") has no filled cell to match against");
		}
		if (window.radius() != source.radius()) {
			throw new IllegalArgumentException("Window radius " + window.radius() + " differs from source radius " + source.radius());
		}
	}
}
