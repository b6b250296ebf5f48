package com.github.micycle1.texsynth;

import org.ejml.data.DMatrixRMaj;

/**
 * Entry point of the library: grows a {@code height x width} texture from a
 * grayscale exemplar.
 * <p>
 * Callers decode the exemplar and reduce it to one channel beforehand (see
 * {@link com.github.micycle1.texsynth.io.GrayscaleImages}) and encode the
 * returned grid themselves. For a fixed random seed the result is a pure
 * function of the inputs.
 */
public final class TextureSynthesizer {

	private TextureSynthesizer() {
	}

	/** Synthesizes with the default patch size, seed size and random seed. */
	public static DMatrixRMaj synthesize(DMatrixRMaj source, int height, int width) {
		return synthesize(source, SynthesisParameters.builder(height, width).build());
	}

	/**
	 * @param source     grayscale exemplar, at least 1x1
	 * @param height     output rows, at least {@code seedSize}
	 * @param width      output columns, at least {@code seedSize}
	 * @param patchSize  odd window side, at least 3
	 * @param seedSize   side of the seed block, at least 1
	 * @param randomSeed seed of the tie-breaking generator
	 * @return fully filled {@code height x width} grid
	 * @throws InvalidParameterException malformed sizes or exemplar
	 * @throws NoValidCandidateException exemplar too small for the patch size
	 */
	public static DMatrixRMaj synthesize(DMatrixRMaj source, int height, int width, int patchSize, int seedSize, long randomSeed) {
		return synthesize(source,
				SynthesisParameters.builder(height, width).patchSize(patchSize).seedSize(seedSize).randomSeed(randomSeed).build());
	}

	public static DMatrixRMaj synthesize(DMatrixRMaj source, SynthesisParameters parameters) {
		try (SynthesisEngine engine = new SynthesisEngine(source, parameters)) {
			return engine.run();
		}
	}
}
