package com.github.micycle1.texsynth;

import com.github.micycle1.texsynth.grid.TargetWindow;
import com.github.micycle1.texsynth.match.Match;

/**
 * Callback invoked once per grown cell, after the match is found and before
 * its intensity is committed.
 */
@FunctionalInterface
public interface SynthesisListener {

	void pixelMatched(int row, int col, TargetWindow window, Match match);
}
