package org.framekit.collect;

import java.util.Collection;
import java.util.Iterator;

/**
 * A collection with a defined order that can be traversed in reverse
 *
 * @param <E> The type of elements in the collection
 */
public interface ReversibleCollection<E> extends Collection<E> {
	/** @return An iterator over this collection's elements, last to first */
	Iterator<E> descendingIterator();

	/** @return A live iterable over this collection's elements in reverse order */
	default Iterable<E> reversed() {
		return this::descendingIterator;
	}
}
