package com.github.micycle1.texsynth;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.SourceBuffer;
import com.github.micycle1.texsynth.grid.TargetBuffer;
import com.github.micycle1.texsynth.grid.TargetWindow;
import com.github.micycle1.texsynth.grid.WindowView;
import com.github.micycle1.texsynth.match.ExhaustiveMatchEngine;
import com.github.micycle1.texsynth.match.Match;
import com.github.micycle1.texsynth.match.MatchEngine;
import com.github.micycle1.texsynth.match.ParallelMatchEngine;

/**
 * <p>
 * Drives one Efros–Leung growth run: plants the seed, visits the unfilled
 * target cells in the configured {@link VisitOrder}, matches each cell's filled
 * neighbourhood against the padded exemplar and commits the intensity of the
 * best match.
 * </p>
 *
 * <p>
 * The run is a three-state machine:
 * </p>
 * <ol>
 * <li>{@link State#SEEDING}: after construction. {@link #initialize()} pads the
 * exemplar, allocates the target, plants the seed and moves to GROWING.</li>
 * <li>{@link State#GROWING}: {@link #grow()} grows every remaining cell and
 * moves to DONE. Filled cells are never revisited.</li>
 * <li>{@link State#DONE}: the target is complete and read-only;
 * {@link #getResult()} returns a copy.</li>
 * </ol>
 *
 * <p>
 * The target buffer is owned by the engine and mutated only between match
 * calls, so parallel candidate scans need no locking. Growth itself is
 * sequential: every match depends on the cells committed before it.
 * </p>
 *
 * <p>
 * A cancellation check, when set, is polled before every cell is grown. If it
 * answers {@code true}, {@link #grow()} throws {@link CancellationException}
 * and the engine stays in GROWING at the same position; calling {@link #grow()}
 * again continues the run and yields the same result as an uninterrupted one.
 * </p>
 *
 * <p>
 * The class is not thread-safe.
 * </p>
 */
public final class SynthesisEngine implements AutoCloseable {

	private static final Logger LOG = LoggerFactory.getLogger(SynthesisEngine.class);

	public enum State {
		SEEDING, GROWING, DONE
	}

	private final SourceBuffer source;
	private final SynthesisParameters params;

	private State state = State.SEEDING;
	private MatchEngine matcher;
	private ParallelMatchEngine ownedMatcher; // created here, closed here
	private SynthesisListener listener;
	private BooleanSupplier cancellationCheck;

	private PaddedSource padded;
	private TargetBuffer target;
	private WindowView view;

	// RASTER progress: position within the current sweep
	private int sweep;
	private int sweepCursor;
	private int sweepCommits;

	// ONION progress: visit order and position within it
	private int[] onionOrder;
	private int onionCursor;

	/**
	 * @param sourceGrid grayscale exemplar; copied
	 * @param params     validated run settings
	 * @throws InvalidParameterException if the exemplar is empty or holds a
	 *                                   non-finite intensity
	 */
	public SynthesisEngine(DMatrixRMaj sourceGrid, SynthesisParameters params) {
		this.params = Objects.requireNonNull(params, "params must not be null");
		this.source = SourceBuffer.of(sourceGrid);
	}

	/**
	 * Replaces the default match engine. The default is an
	 * {@link ExhaustiveMatchEngine}, or a {@link ParallelMatchEngine} when more
	 * than one thread is configured, seeded with
	 * {@link SynthesisParameters#randomSeed()}. A supplied engine is not closed by
	 * this engine.
	 */
	public void setMatchEngine(MatchEngine matcher) {
		requireState(State.SEEDING);
		this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
	}

	public void setListener(SynthesisListener listener) {
		this.listener = listener;
	}

	public void setCancellationCheck(BooleanSupplier cancellationCheck) {
		this.cancellationCheck = cancellationCheck;
	}

	/**
	 * Builds the padded exemplar and the seeded target; SEEDING → GROWING.
	 *
	 * @throws NoValidCandidateException if the exemplar cannot host a reflected
	 *                                   candidate window
	 * @throws InvalidParameterException if the seed does not fit the exemplar
	 */
	public void initialize() {
		requireState(State.SEEDING);
		padded = PaddedSource.build(source, params.patchSize());
		target = TargetBuffer.initialize(params.height(), params.width(), source, params.seedSize());
		view = new WindowView(target, padded);

		if (matcher == null) {
			Random rnd = new Random(params.randomSeed());
			if (params.threads() > 1) {
				ownedMatcher = new ParallelMatchEngine(params.threads(), rnd);
				matcher = ownedMatcher;
			} else {
				matcher = new ExhaustiveMatchEngine(rnd);
			}
		}
		if (params.visitOrder() == VisitOrder.ONION) {
			onionOrder = onionOrder(target);
		}

		LOG.info("Synthesizing {}x{} from {}x{} exemplar ({})", params.height(), params.width(), source.height(), source.width(), params);
		state = State.GROWING;
	}

	/**
	 * Grows every unfilled cell; GROWING → DONE.
	 *
	 * @throws CancellationException if the cancellation check fired; the engine
	 *                               can be resumed
	 */
	public void grow() {
		requireState(State.GROWING);
		final long start = System.nanoTime();
		if (params.visitOrder() == VisitOrder.ONION) {
			growOnion();
		} else {
			growRaster();
		}
		state = State.DONE;
		close();
		LOG.info("Synthesis done: {} cells in {} ms", target.cellCount(), (System.nanoTime() - start) / 1_000_000);
	}

	/** Convenience: {@link #initialize()} then {@link #grow()}, returning the result. */
	public DMatrixRMaj run() {
		initialize();
		grow();
		return getResult();
	}

	private void growRaster() {
		final int w = target.width();
		final int n = target.cellCount();
		while (!target.isComplete()) {
			for (; sweepCursor < n; sweepCursor++) {
				final int row = sweepCursor / w;
				final int col = sweepCursor % w;
				if (target.isFilled(row, col)) {
					continue;
				}
				checkCancelled();
				TargetWindow window = view.extractTarget(row, col);
				if (window.knownCount() == 0) {
					continue; // deferred to the next sweep
				}
				growCell(row, col, window);
				sweepCommits++;
			}
			LOG.debug("Sweep {} grew {} cells, {}/{} filled", sweep, sweepCommits, target.filledCount(), n);
			if (sweepCommits == 0 && !target.isComplete()) {
				throw new IllegalStateException("Raster sweep " + sweep + " grew no cell");
			}
			sweep++;
			sweepCursor = 0;
			sweepCommits = 0;
		}
	}

	private void growOnion() {
		final int w = target.width();
		for (; onionCursor < onionOrder.length; onionCursor++) {
			final int row = onionOrder[onionCursor] / w;
			final int col = onionOrder[onionCursor] % w;
			if (target.isFilled(row, col)) {
				continue;
			}
			checkCancelled();
			growCell(row, col, view.extractTarget(row, col));
		}
	}

	private void growCell(int row, int col, TargetWindow window) {
		Match match = matcher.findBestMatch(window, padded);
		if (listener != null) {
			listener.pixelMatched(row, col, window, match);
		}
		target.commit(row, col, match.intensity());
	}

	private void checkCancelled() {
		if (cancellationCheck != null && cancellationCheck.getAsBoolean()) {
			throw new CancellationException("Synthesis cancelled with " + target.filledCount() + "/" + target.cellCount() + " cells filled");
		}
	}

	// Cell indices sorted by Chebyshev distance to the seed block, row-major
	// within a layer (counting sort over the layer number).
	static int[] onionOrder(TargetBuffer target) {
		final int h = target.height();
		final int w = target.width();
		final int top = target.seedTop();
		final int left = target.seedLeft();
		final int bottom = top + target.seedSize() - 1;
		final int right = left + target.seedSize() - 1;

		final int layers = Math.max(h, w) + 1;
		int[] counts = new int[layers + 1];
		for (int i = 0; i < h; i++) {
			for (int j = 0; j < w; j++) {
				counts[MathUtil.chebyshevToRect(i, j, top, left, bottom, right) + 1]++;
			}
		}
		for (int k = 1; k <= layers; k++) {
			counts[k] += counts[k - 1];
		}
		int[] order = new int[h * w];
		for (int i = 0; i < h; i++) {
			for (int j = 0; j < w; j++) {
				order[counts[MathUtil.chebyshevToRect(i, j, top, left, bottom, right)]++] = i * w + j;
			}
		}
		return order;
	}

	/**
	 * Copy of the synthesized texture.
	 *
	 * @throws IllegalStateException unless the engine is DONE
	 */
	public DMatrixRMaj getResult() {
		requireState(State.DONE);
		return target.toGrid();
	}

	public State getState() {
		return state;
	}

	/** Filled cells so far; 0 before initialization. */
	public int getFilledCount() {
		return target == null ? 0 : target.filledCount();
	}

	public boolean isFilled(int row, int col) {
		requireInitialized();
		return target.isFilled(row, col);
	}

	/** Row of the seed block's top-left cell in the output. */
	public int getSeedTop() {
		requireInitialized();
		return target.seedTop();
	}

	/** Column of the seed block's top-left cell in the output. */
	public int getSeedLeft() {
		requireInitialized();
		return target.seedLeft();
	}

	/** Releases the scan pool if this engine created one. */
	@Override
	public void close() {
		if (ownedMatcher != null) {
			ownedMatcher.close();
		}
	}

	private void requireInitialized() {
		if (target == null) {
			throw new IllegalStateException("Engine is not initialized");
		}
	}

	private void requireState(State expected) {
		if (state != expected) {
			throw new IllegalStateException("Expected state " + expected + " but engine is " + state);
		}
	}
}
