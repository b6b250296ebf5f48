package com.github.micycle1.texsynth;

/**
 * Thrown when the exemplar's height or width is not larger than
 * {@code patchSize / 2}: the border is reflected once, without repeating the
 * edge sample, so each side needs more samples than the border is wide. A
 * source smaller than {@code patchSize} is accepted as long as it passes this
 * rule (a 3x3 source works with patch size 5). Detected while the padded
 * source is built, never per pixel.
 */
public class NoValidCandidateException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public NoValidCandidateException(String message) {
		super(message);
	}
}
