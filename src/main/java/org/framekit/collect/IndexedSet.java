package org.framekit.collect;

import java.util.Set;

/**
 * <p>
 * A set whose elements have positions. Iteration follows position order, while {@link #equals(Object)} keeps {@link Set} semantics and
 * compares membership only.
 * </p>
 * <p>
 * Methods taking an index accept negative values, which count back from the end of the set (-1 is the last element).
 * </p>
 *
 * @param <E> The type of elements in the set
 */
public interface IndexedSet<E> extends Set<E>, ReversibleCollection<E> {
	/**
	 * @param index The index of the element to get
	 * @return The element at the given index
	 * @throws OrderedSetIndexException If the index is out of range
	 */
	E get(int index) throws OrderedSetIndexException;

	/**
	 * @param value The value to search for
	 * @return The position of the value in this set, or -1 if it is not present
	 */
	int indexOf(Object value);

	/**
	 * @param value The value to search for
	 * @return The position of the value in this set
	 * @throws KeyMissingException If the value is not present
	 */
	default int index(Object value) throws KeyMissingException {
		return index(value, null, null);
	}

	/**
	 * @param value The value to search for
	 * @param start The inclusive start of the window to search in, or null for the beginning
	 * @param stop The exclusive end of the window to search in, or null for the end
	 * @return The position of the value in this set
	 * @throws KeyMissingException If the value is not present within the window
	 */
	default int index(Object value, Integer start, Integer stop) throws KeyMissingException {
		int pos = indexOf(value);
		if (pos < 0 || !SequenceIndexes.inWindow(pos, start, stop, size()))
			throw new KeyMissingException(value, value + " not in set");
		return pos;
	}

	/**
	 * @param value The value to count
	 * @return 1 if the value is in this set, 0 otherwise
	 */
	default int count(Object value) {
		return contains(value) ? 1 : 0;
	}

	/**
	 * Removes the given value if it is present
	 *
	 * @param value The value to remove
	 */
	default void discard(Object value) {
		remove(value);
	}

	/**
	 * @param index The index of the element to remove
	 * @return The removed element
	 * @throws OrderedSetIndexException If the set is empty or the index is out of range
	 */
	E removeAt(int index) throws OrderedSetIndexException;

	/**
	 * @param start The inclusive start index of the slice
	 * @param stop The exclusive end index of the slice
	 * @return A new set containing the elements in the given range, clamped to this set's bounds
	 */
	default IndexedSet<E> slice(int start, int stop) {
		return slice(start, stop, 1);
	}

	/**
	 * @param start The start index of the slice, or null for the default (beginning for a positive step, end for a negative one)
	 * @param stop The end index of the slice (exclusive), or null for the default
	 * @param step The distance between selected positions; negative to traverse backward. Must not be zero.
	 * @return A new set containing the selected elements in slice order
	 */
	IndexedSet<E> slice(Integer start, Integer stop, int step);
}
