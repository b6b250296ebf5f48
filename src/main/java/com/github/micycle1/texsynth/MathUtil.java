package com.github.micycle1.texsynth;

public final class MathUtil {

	/** Relative width of the band of distances treated as ties. */
	public static final double TIE_RELATIVE_EPSILON = 1e-6;
	/** Absolute floor of the tie band, so exact-zero minima still admit rounding noise. */
	public static final double TIE_ABSOLUTE_EPSILON = 1e-12;

	private MathUtil() {
	}

	// Mirror index i into [0, n) across the edges without repeating the edge
	// sample: -k -> k, (n-1)+k -> (n-1)-k. Valid for -n < i < 2n-1.
	public static int reflect(int i, int n) {
		if (i < 0) {
			return -i;
		}
		if (i >= n) {
			return 2 * (n - 1) - i;
		}
		return i;
	}

	// Upper bound (inclusive) of the tie band around a minimum distance.
	public static double tieBound(double minDistance) {
		return minDistance + TIE_RELATIVE_EPSILON * minDistance + TIE_ABSOLUTE_EPSILON;
	}

	// Chebyshev distance from (row, col) to the rectangle [top, bottom] x [left, right].
	public static int chebyshevToRect(int row, int col, int top, int left, int bottom, int right) {
		int dr = Math.max(Math.max(top - row, row - bottom), 0);
		int dc = Math.max(Math.max(left - col, col - right), 0);
		return Math.max(dr, dc);
	}
}
