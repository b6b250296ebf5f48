package com.github.micycle1.texsynth.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.texsynth.MathUtil;
import com.github.micycle1.texsynth.TestGrids;
import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.SourceBuffer;
import com.github.micycle1.texsynth.grid.TargetBuffer;
import com.github.micycle1.texsynth.grid.TargetWindow;
import com.github.micycle1.texsynth.grid.WindowView;

public class ExhaustiveMatchEngineTest {

	@Test
	void findsExactMatchForClippedWindow() {
		DMatrixRMaj grid = TestGrids.random(6, 6, 21);
		SourceBuffer src = SourceBuffer.of(grid);
		PaddedSource padded = PaddedSource.build(src, 3);
		TargetBuffer target = TargetBuffer.initialize(5, 5, src, 3);
		TargetWindow w = new WindowView(target, padded).extractTarget(2, 4);

		Match m = new ExhaustiveMatchEngine(new Random(1)).findBestMatch(w, padded);

		assertEquals(1, m.sourceRow());
		assertEquals(3, m.sourceCol());
		assertEquals(grid.get(1, 3), m.intensity());
		assertEquals(0.0, m.distance());
		assertEquals(1, m.tieCount());
	}

	@ParameterizedTest
	@ValueSource(longs = { 1L, 42L, 12345L })
	void chosenDistanceIsMinimal(long seed) {
		SourceBuffer src = SourceBuffer.of(TestGrids.random(9, 7, seed));
		PaddedSource padded = PaddedSource.build(src, 5);
		TargetBuffer target = TargetBuffer.initialize(11, 11, src, 3);
		target.commit(3, 5, 0.3);
		target.commit(7, 8, 0.8);
		TargetWindow w = new WindowView(target, padded).extractTarget(5, 7);

		Match m = new ExhaustiveMatchEngine(new Random(seed)).findBestMatch(w, padded);

		double min = Double.POSITIVE_INFINITY;
		for (int i = 0; i < 9; i++) {
			for (int j = 0; j < 7; j++) {
				min = Math.min(min, MaskedDistance.compute(w, padded, i, j));
			}
		}
		assertEquals(MaskedDistance.compute(w, padded, m.sourceRow(), m.sourceCol()), m.distance());
		assertTrue(m.distance() <= MathUtil.tieBound(min));
		assertEquals(src.get(m.sourceRow(), m.sourceCol()), m.intensity());
	}

	@Test
	void tiesAreDrawnFromTheWholeBand() {
		SourceBuffer src = SourceBuffer.of(TestGrids.constant(4, 4, 0.5));
		PaddedSource padded = PaddedSource.build(src, 3);
		TargetWindow w = new WindowView(TargetBuffer.initialize(5, 5, src, 1), padded).extractTarget(2, 3);
		ExhaustiveMatchEngine engine = new ExhaustiveMatchEngine(new Random(42));

		Set<Integer> hit = new HashSet<>();
		for (int k = 0; k < 2000; k++) {
			Match m = engine.findBestMatch(w, padded);
			assertEquals(16, m.tieCount());
			hit.add(m.sourceRow() * 4 + m.sourceCol());
		}
		assertEquals(16, hit.size());
	}

	@Test
	void tieBreakIsReproducibleForSameSeed() {
		SourceBuffer src = SourceBuffer.of(TestGrids.checkerboard());
		PaddedSource padded = PaddedSource.build(src, 3);
		TargetWindow w = new WindowView(TargetBuffer.initialize(6, 6, src, 2), padded).extractTarget(2, 4);

		ExhaustiveMatchEngine a = new ExhaustiveMatchEngine(new Random(7));
		ExhaustiveMatchEngine b = new ExhaustiveMatchEngine(new Random(7));
		for (int k = 0; k < 50; k++) {
			Match ma = a.findBestMatch(w, padded);
			Match mb = b.findBestMatch(w, padded);
			assertEquals(ma.sourceRow(), mb.sourceRow());
			assertEquals(ma.sourceCol(), mb.sourceCol());
			assertTrue(ma.tieCount() > 1);
		}
	}

	@Test
	void emptyWindowIsRejected() {
		SourceBuffer src = SourceBuffer.of(TestGrids.random(6, 6, 2));
		PaddedSource padded = PaddedSource.build(src, 3);
		TargetWindow empty = new WindowView(TargetBuffer.initialize(8, 8, src, 2), padded).extractTarget(0, 0);

		assertThrows(IllegalArgumentException.class, () -> new ExhaustiveMatchEngine(new Random()).findBestMatch(empty, padded));
	}
}
