package org.framekit.collect;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/** Index arithmetic for sequence-style access, where negative indices count back from the end */
final class SequenceIndexes {
	private SequenceIndexes() {
	}

	/**
	 * @param index The index, possibly negative
	 * @param size The size of the sequence
	 * @return The non-negative position of the index in the sequence
	 * @throws OrderedSetIndexException If the index is out of range
	 */
	static int position(int index, int size) {
		int pos = index < 0 ? index + size : index;
		if (pos < 0 || pos >= size)
			throw OrderedSetIndexException.outOfRange(index, size);
		return pos;
	}

	/**
	 * Checks whether a position falls within a search window given as sequence-style bounds
	 *
	 * @param position The position to check
	 * @param start The inclusive start of the window, or null for the beginning
	 * @param stop The exclusive end of the window, or null for the end
	 * @param size The size of the sequence
	 * @return Whether the position is in the window
	 */
	static boolean inWindow(int position, Integer start, Integer stop, int size) {
		int from = start == null ? 0 : (start < 0 ? Math.max(start + size, 0) : start);
		int to = stop == null ? size : (stop < 0 ? stop + size : stop);
		return position >= from && position < to;
	}

	/**
	 * @param start The start of the slice, or null for the default
	 * @param stop The end of the slice, or null for the default
	 * @param step The step of the slice, never zero
	 * @param size The size of the sequence
	 * @return The positions selected by the slice, in slice order
	 */
	static List<Integer> slice(Integer start, Integer stop, int step, int size) {
		Preconditions.checkArgument(step != 0, "Slice step cannot be zero");
		int lower = step > 0 ? 0 : -1;
		int upper = step > 0 ? size : size - 1;
		int from = start == null ? (step > 0 ? lower : upper) : clamp(start, size, lower, upper);
		int to = stop == null ? (step > 0 ? upper : lower) : clamp(stop, size, lower, upper);
		List<Integer> positions = new ArrayList<>();
		// Stepped in long so that a huge step cannot wrap around
		if (step > 0) {
			for (long i = from; i < to; i += step)
				positions.add((int) i);
		} else {
			for (long i = from; i > to; i += step)
				positions.add((int) i);
		}
		return positions;
	}

	private static int clamp(int bound, int size, int lower, int upper) {
		if (bound < 0) {
			bound += size;
			return bound < lower ? lower : bound;
		}
		return bound > upper ? upper : bound;
	}
}
