package com.github.micycle1.texsynth.match;

/**
 * Result of one candidate scan: the source cell whose window best matches the
 * target window, the intensity at that cell, the achieved masked distance and
 * the size of the tie band the cell was drawn from.
 */
public final class Match {

	private final int sourceRow;
	private final int sourceCol;
	private final double intensity;
	private final double distance;
	private final int tieCount;

	public Match(int sourceRow, int sourceCol, double intensity, double distance, int tieCount) {
		this.sourceRow = sourceRow;
		this.sourceCol = sourceCol;
		this.intensity = intensity;
		this.distance = distance;
		this.tieCount = tieCount;
	}

	public int sourceRow() {
		return sourceRow;
	}

	public int sourceCol() {
		return sourceCol;
	}

	public double intensity() {
		return intensity;
	}

	public double distance() {
		return distance;
	}

	public int tieCount() {
		return tieCount;
	}

	@Override
	public String toString() {
		return "Match{source=(" + sourceRow + "," + sourceCol + "), intensity=" + intensity + ", distance=" + distance + ", ties=" + tieCount
				+ "}";
	}
}
