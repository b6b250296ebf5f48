package com.github.micycle1.texsynth;

/**
 * Order in which unfilled target cells are grown. Output is order-sensitive:
 * the same inputs grown in different orders give different textures.
 */
public enum VisitOrder {

	/**
	 * Repeated row-major sweeps, top-to-bottom then left-to-right. A cell is grown
	 * during a sweep when it is unfilled and its clipped window already contains a
	 * filled cell (cells grown earlier in the same sweep count); other unfilled
	 * cells wait for the next sweep. Sweeps repeat until the target is full.
	 */
	RASTER,

	/**
	 * Layers of growing Chebyshev distance from the seed block, each layer in
	 * row-major order. Every cell borders the previous layer when it is grown, so
	 * one pass fills the target.
	 */
	ONION
}
