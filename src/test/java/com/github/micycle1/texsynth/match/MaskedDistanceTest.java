package com.github.micycle1.texsynth.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

import com.github.micycle1.texsynth.TestGrids;
import com.github.micycle1.texsynth.grid.PaddedSource;
import com.github.micycle1.texsynth.grid.SourceBuffer;
import com.github.micycle1.texsynth.grid.TargetBuffer;
import com.github.micycle1.texsynth.grid.TargetWindow;
import com.github.micycle1.texsynth.grid.WindowView;

public class MaskedDistanceTest {

	@Test
	void onlyFilledCellsContribute() {
		DMatrixRMaj grid = TestGrids.random(6, 6, 21);
		SourceBuffer src = SourceBuffer.of(grid);
		PaddedSource padded = PaddedSource.build(src, 3);
		// seed occupies rows/cols 1..3 and holds source (0..2, 0..2)
		TargetBuffer target = TargetBuffer.initialize(5, 5, src, 3);
		TargetWindow w = new WindowView(target, padded).extractTarget(2, 4);

		assertEquals(3, w.knownCount());
		assertEquals(0.0, MaskedDistance.compute(w, padded, 1, 3));

		double e0 = grid.get(0, 2) - grid.get(1, 1);
		double e1 = grid.get(1, 2) - grid.get(0, 1);
		double e2 = grid.get(2, 2) - grid.get(1, 1);
		double expected = (e0 * e0 + e1 * e1 + e2 * e2) / 3;
		assertEquals(expected, MaskedDistance.compute(w, padded, 0, 0), 1e-15);
	}

	@Test
	void distanceIsNormalizedByKnownCount() {
		SourceBuffer src = SourceBuffer.of(TestGrids.constant(4, 4, 0.5));
		PaddedSource padded = PaddedSource.build(src, 3);
		TargetBuffer target = TargetBuffer.initialize(5, 5, src, 1);
		WindowView view = new WindowView(target, padded);

		target.commit(2, 3, 0.9);
		assertEquals(0.16 / 2, MaskedDistance.compute(view.extractTarget(3, 3), padded, 2, 2), 1e-12);

		target.commit(3, 2, 0.9);
		assertEquals(0.32 / 3, MaskedDistance.compute(view.extractTarget(3, 3), padded, 2, 2), 1e-12);

		target.commit(4, 4, 0.5);
		assertEquals(0.32 / 4, MaskedDistance.compute(view.extractTarget(3, 3), padded, 0, 0), 1e-12);
	}

	@Test
	void emptyWindowIsRejected() {
		SourceBuffer src = SourceBuffer.of(TestGrids.random(6, 6, 2));
		PaddedSource padded = PaddedSource.build(src, 3);
		TargetWindow empty = new WindowView(TargetBuffer.initialize(8, 8, src, 2), padded).extractTarget(0, 0);

		assertThrows(IllegalArgumentException.class, () -> MaskedDistance.checkWindow(empty, padded));
	}

	@Test
	void windowRadiusMustMatchSource() {
		SourceBuffer src = SourceBuffer.of(TestGrids.random(6, 6, 2));
		TargetBuffer target = TargetBuffer.initialize(8, 8, src, 3);
		TargetWindow w = new WindowView(target, PaddedSource.build(src, 3)).extractTarget(3, 3);

		assertThrows(IllegalArgumentException.class, () -> MaskedDistance.checkWindow(w, PaddedSource.build(src, 5)));
	}
}
