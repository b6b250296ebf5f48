package com.github.micycle1.texsynth;

/**
 * Thrown when a synthesis parameter is malformed: an even or too small patch
 * size, a seed larger than the source or the output, a degenerate output size,
 * or an empty / non-finite exemplar. Raised before any buffer is allocated.
 */
public class InvalidParameterException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidParameterException(String message) {
		super(message);
	}
}
