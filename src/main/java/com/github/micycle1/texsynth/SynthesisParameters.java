package com.github.micycle1.texsynth;

import java.util.Objects;

import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.TargetBuffer;

/**
 * Immutable settings of one synthesis run. Created through {@link #builder(int, int)};
 * every value except the output size has a default. {@link Builder#build()}
 * validates everything that does not depend on the exemplar.
 */
public final class SynthesisParameters {

	public static final int DEFAULT_PATCH_SIZE = 9;
	public static final int DEFAULT_SEED_SIZE = 3;
	public static final long DEFAULT_RANDOM_SEED = 0L;
	public static final int DEFAULT_THREADS = 1;

	private final int height;
	private final int width;
	private final int patchSize;
	private final int seedSize;
	private final long randomSeed;
	private final VisitOrder visitOrder;
	private final int threads;

	private SynthesisParameters(Builder b) {
		this.height = b.height;
		this.width = b.width;
		this.patchSize = b.patchSize;
		this.seedSize = b.seedSize;
		this.randomSeed = b.randomSeed;
		this.visitOrder = b.visitOrder;
		this.threads = b.threads;
	}

	public static Builder builder(int height, int width) {
		return new Builder(height, width);
	}

	public int height() {
		return height;
	}

	public int width() {
		return width;
	}

	/** Odd side length of the matching window. */
	public int patchSize() {
		return patchSize;
	}

	/** Side length of the block copied from the exemplar's top-left corner. */
	public int seedSize() {
		return seedSize;
	}

	/** Seed of the generator that breaks distance ties. */
	public long randomSeed() {
		return randomSeed;
	}

	public VisitOrder visitOrder() {
		return visitOrder;
	}

	/** Worker threads of the candidate scan; 1 scans on the calling thread. */
	public int threads() {
		return threads;
	}

	public Builder toBuilder() {
		return new Builder(height, width).patchSize(patchSize).seedSize(seedSize).randomSeed(randomSeed).visitOrder(visitOrder)
				.threads(threads);
	}

	@Override
	public String toString() {
		return "SynthesisParameters{output=" + height + "x" + width + ", patchSize=" + patchSize + ", seedSize=" + seedSize + ", randomSeed="
				+ randomSeed + ", visitOrder=" + visitOrder + ", threads=" + threads + "}";
	}

	public static final class Builder {

		private final int height;
		private final int width;
		private int patchSize = DEFAULT_PATCH_SIZE;
		private int seedSize = DEFAULT_SEED_SIZE;
		private long randomSeed = DEFAULT_RANDOM_SEED;
		private VisitOrder visitOrder = VisitOrder.RASTER;
		private int threads = DEFAULT_THREADS;

		private Builder(int height, int width) {
			this.height = height;
			this.width = width;
		}

		public Builder patchSize(int patchSize) {
			this.patchSize = patchSize;
			return this;
		}

		public Builder seedSize(int seedSize) {
			this.seedSize = seedSize;
			return this;
		}

		public Builder randomSeed(long randomSeed) {
			this.randomSeed = randomSeed;
			return this;
		}

		public Builder visitOrder(VisitOrder visitOrder) {
			this.visitOrder = Objects.requireNonNull(visitOrder, "visitOrder must not be null");
			return this;
		}

		public Builder threads(int threads) {
			this.threads = threads;
			return this;
		}

		/**
		 * @throws InvalidParameterException on an even or too small patch size, a
		 *                                   non-positive output size, a seed outside
		 *                                   {@code [1, min(height, width)]} or fewer
		 *                                   than one thread
		 */
		public SynthesisParameters build() {
			PaddedSource.checkPatchSize(patchSize);
			TargetBuffer.checkSizes(height, width, seedSize);
			if (threads < 1) {
				throw new InvalidParameterException("threads must be >= 1, got " + threads);
			}
			return new SynthesisParameters(this);
		}
	}
}
