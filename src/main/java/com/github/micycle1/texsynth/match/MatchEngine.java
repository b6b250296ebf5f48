package com.github.micycle1.texsynth.match;

import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.TargetWindow;

/**
 * <p>
 * Finds the source pixel whose neighbourhood best matches a partially filled
 * target window under {@link MaskedDistance}. Every source pixel is a
 * candidate: the padded source gives each one a full window.
 * </p>
 *
 * <p>
 * Distances within {@link com.github.micycle1.texsynth.MathUtil#tieBound(double)}
 * of the minimum are ties; implementations order the tied candidates by
 * row-major source index and draw one uniformly from an injected generator, so
 * the choice depends only on the inputs and the generator state.
 * </p>
 */
public interface MatchEngine {

	/**
	 * @param window target neighbourhood with at least one filled cell, extracted
	 *               with the radius of {@code source}
	 * @param source padded exemplar
	 * @throws IllegalArgumentException if the window has no filled cell or its
	 *                                  radius differs from the source radius
	 */
	Match findBestMatch(TargetWindow window, PaddedSource source);
}
