package com.github.micycle1.texsynth.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.TargetWindow;

/**
 * <p>
 * Candidate scan split across a fixed pool of worker threads. Source rows are
 * partitioned into contiguous bands; each worker writes the distances of its
 * band into a shared array (disjoint slices) and returns its partial minimum.
 * The partial minima are reduced on the calling thread and the tie band is
 * collected in row-major order, exactly as {@link ExhaustiveMatchEngine} does,
 * so the chosen match does not depend on the number of threads.
 * </p>
 *
 * <p>
 * The padded source and the target window are only read during a scan. The
 * generator is only touched on the calling thread. Close the engine to release
 * the pool.
 * </p>
 */
public final class ParallelMatchEngine implements MatchEngine, AutoCloseable {

	private static final Logger LOG = LoggerFactory.getLogger(ParallelMatchEngine.class);

	private final Random rnd;
	private final int threads;
	private final ExecutorService exec;

	public ParallelMatchEngine(int threads, Random rnd) {
		if (threads < 1) {
			throw new IllegalArgumentException("threads must be >= 1, got " + threads);
		}
		this.rnd = Objects.requireNonNull(rnd, "rnd must not be null");
		this.threads = threads;
		this.exec = Executors.newFixedThreadPool(threads, r -> {
			Thread t = new Thread(r, "texsynth-match");
			t.setDaemon(true);
			return t;
		});
		LOG.debug("Candidate scan pool started with {} threads", threads);
	}

	public int threads() {
		return threads;
	}

	@Override
	public Match findBestMatch(TargetWindow window, PaddedSource source) {
		MaskedDistance.checkWindow(window, source);
		final int h = source.source().height();
		final int w = source.source().width();
		final double[] distances = new double[h * w];

		final int bands = Math.min(threads, h);
		final List<Future<Double>> tasks = new ArrayList<>(bands);
		for (int b = 0; b < bands; b++) {
			final int rowStart = (int) ((long) h * b / bands);
			final int rowEnd = (int) ((long) h * (b + 1) / bands);
			tasks.add(exec.submit(() -> {
				double min = Double.POSITIVE_INFINITY;
				for (int i = rowStart; i < rowEnd; i++) {
					for (int j = 0; j < w; j++) {
						double d = MaskedDistance.compute(window, source, i, j);
						distances[i * w + j] = d;
						if (d < min) {
							min = d;
						}
					}
				}
				return min;
			}));
		}

		double min = Double.POSITIVE_INFINITY;
		try {
			for (Future<Double> task : tasks) {
				min = Math.min(min, task.get());
			}
		} catch (InterruptedException e) {
			tasks.forEach(t -> t.cancel(true));
			Thread.currentThread().interrupt();
			throw new CancellationException("Candidate scan interrupted");
		} catch (ExecutionException e) {
			tasks.forEach(t -> t.cancel(true));
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw new IllegalStateException("Candidate scan failed", e.getCause());
		}

		// Future.get() happens-before: every band's writes to distances are visible here
		return CandidateSelection.select(distances, min, source, rnd);
	}

	@Override
	public void close() {
		exec.shutdownNow();
		LOG.debug("Candidate scan pool shut down");
	}
}
