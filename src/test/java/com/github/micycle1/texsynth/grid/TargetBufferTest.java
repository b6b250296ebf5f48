package com.github.micycle1.texsynth.grid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

import com.github.micycle1.texsynth.InvalidParameterException;
import com.github.micycle1.texsynth.TestGrids;

public class TargetBufferTest {

	@Test
	void seedIsPlantedAtCentre() {
		DMatrixRMaj src = TestGrids.random(6, 6, 9);
		TargetBuffer target = TargetBuffer.initialize(10, 8, SourceBuffer.of(src), 3);

		assertEquals(4, target.seedTop());
		assertEquals(3, target.seedLeft());
		assertEquals(9, target.filledCount());
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				assertTrue(target.isFilled(4 + i, 3 + j));
				assertEquals(src.get(i, j), target.get(4 + i, 3 + j));
			}
		}
		assertFalse(target.isFilled(0, 0));
		assertFalse(target.isFilled(3, 3));
		assertFalse(target.isComplete());
	}

	@Test
	void zeroIntensityIsNotUnfilled() {
		TargetBuffer target = TargetBuffer.initialize(6, 6, SourceBuffer.of(TestGrids.checkerboard()), 2);
		assertEquals(0.0, target.get(2, 2));
		assertTrue(target.isFilled(2, 2));
		assertEquals(0.0, target.get(0, 0));
		assertFalse(target.isFilled(0, 0));
	}

	@Test
	void commitIsMonotone() {
		TargetBuffer target = TargetBuffer.initialize(4, 4, SourceBuffer.of(TestGrids.random(4, 4, 1)), 2);
		target.commit(0, 0, 0.0);
		assertTrue(target.isFilled(0, 0));
		assertEquals(5, target.filledCount());

		assertThrows(IllegalStateException.class, () -> target.commit(0, 0, 0.5));
		assertThrows(IllegalStateException.class, () -> target.commit(1, 1, 0.5));
		assertEquals(0.0, target.get(0, 0));
	}

	@Test
	void completesWhenEveryCellCommitted() {
		TargetBuffer target = TargetBuffer.initialize(3, 3, SourceBuffer.of(TestGrids.random(4, 4, 1)), 1);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				if (!target.isFilled(i, j)) {
					target.commit(i, j, 0.1);
				}
			}
		}
		assertTrue(target.isComplete());
		assertEquals(9, target.filledCount());
	}

	@Test
	void rejectsOversizedSeed() {
		SourceBuffer src = SourceBuffer.of(TestGrids.random(3, 5, 1));
		assertThrows(InvalidParameterException.class, () -> TargetBuffer.initialize(10, 10, src, 4));
		assertThrows(InvalidParameterException.class, () -> TargetBuffer.initialize(2, 10, src, 3));
		assertThrows(InvalidParameterException.class, () -> TargetBuffer.initialize(10, 10, src, 0));
		assertThrows(InvalidParameterException.class, () -> TargetBuffer.initialize(0, 10, src, 1));
	}

	@Test
	void gridIsACopy() {
		TargetBuffer target = TargetBuffer.initialize(4, 4, SourceBuffer.of(TestGrids.constant(3, 3, 0.5)), 2);
		DMatrixRMaj grid = target.toGrid();
		grid.set(1, 1, 0.9);
		assertEquals(0.5, target.get(1, 1));
	}
}
