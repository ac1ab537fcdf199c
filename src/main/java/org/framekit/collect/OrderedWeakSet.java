package org.framekit.collect;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.framekit.util.ReclaimableReference;
import org.framekit.util.ReclamationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * <p>
 * An {@link IndexedSet} that holds its elements only {@link java.lang.ref.WeakReference weakly}: it never prevents an element from being
 * garbage-collected. Elements that have been reclaimed disappear from the set without notice, and the survivors keep their relative
 * order.
 * </p>
 * <p>
 * Reclaimed elements are pruned eagerly: every operation first removes the elements the collector has reported, and operations that
 * depend on a consistent count or on positions ({@link #size()}, {@link #get(int)}, {@link #indexOf(Object)}, slicing) also sweep out
 * elements the collector has cleared but not yet reported.
 * </p>
 * <p>
 * Iterators traverse a snapshot of the set's handles taken when iteration begins. They skip elements reclaimed since, and hold strong
 * references only to the element they last returned and the one they will return next.
 * </p>
 *
 * @param <E> The type of elements in the set
 */
public class OrderedWeakSet<E> extends AbstractSet<E> implements IndexedSet<E> {
	private static final Logger LOGGER = LoggerFactory.getLogger(OrderedWeakSet.class);

	private final OrderedSet<ReclaimableReference<E>> theRefs;
	private final ReclamationQueue<E> theReclaimed;

	/** Creates an empty set */
	public OrderedWeakSet() {
		theRefs = new OrderedSet<>();
		theReclaimed = new ReclamationQueue<>();
	}

	/** @param values The initial values for the set */
	public OrderedWeakSet(Iterable<? extends E> values) {
		this();
		for (E value : values)
			add(value);
	}

	/** Removes the elements the collector has reported as reclaimed */
	private void expunge() {
		int before = theRefs.size();
		// Some may already have been swept by prune()
		theReclaimed.drain(theRefs::remove);
		int expunged = before - theRefs.size();
		if (expunged > 0)
			LOGGER.debug("Expunged {} reclaimed elements", expunged);
	}

	/** Removes every reclaimed element, reported or not */
	private void prune() {
		expunge();
		int before = theRefs.size();
		if (theRefs.removeIf(ReclaimableReference::isReclaimed))
			LOGGER.debug("Swept {} cleared elements", before - theRefs.size());
	}

	@Override
	public int size() {
		prune();
		return theRefs.size();
	}

	@Override
	public boolean isEmpty() {
		return size() == 0;
	}

	@Override
	public boolean contains(Object o) {
		if (o == null)
			return false;
		expunge();
		return theRefs.contains(new ReclaimableReference<>(o));
	}

	/**
	 * @param value The value to add. Must not be null.
	 * @return Whether the value was added (false if it was already present)
	 */
	@Override
	public boolean add(E value) {
		Preconditions.checkNotNull(value, "A weak set cannot hold null");
		expunge();
		if (theRefs.contains(new ReclaimableReference<>(value)))
			return false;
		return theRefs.add(new ReclaimableReference<>(value, theReclaimed.getQueue()));
	}

	/**
	 * Adds each value not yet present, in iteration order
	 *
	 * @param values The values to add
	 * @return Whether any value was added
	 */
	public boolean update(Iterable<? extends E> values) {
		boolean modified = false;
		for (E value : values)
			modified |= add(value);
		return modified;
	}

	@Override
	public boolean remove(Object o) {
		if (o == null)
			return false;
		expunge();
		return theRefs.remove(new ReclaimableReference<>(o));
	}

	@Override
	public void clear() {
		theRefs.clear();
		theReclaimed.clear();
	}

	@Override
	public E get(int index) {
		while (true) {
			prune();
			E value = theRefs.get(index).get();
			if (value != null)
				return value;
			// Cleared since the sweep
		}
	}

	@Override
	public int indexOf(Object value) {
		if (value == null)
			return -1;
		prune();
		return theRefs.indexOf(new ReclaimableReference<>(value));
	}

	@Override
	public E removeAt(int index) {
		if (isEmpty())
			throw OrderedSetIndexException.empty("remove");
		E value = get(index);
		remove(value);
		return value;
	}

	@Override
	public OrderedWeakSet<E> slice(int start, int stop) {
		return slice(start, stop, 1);
	}

	@Override
	public OrderedWeakSet<E> slice(Integer start, Integer stop, int step) {
		prune();
		OrderedWeakSet<E> result = new OrderedWeakSet<>();
		for (ReclaimableReference<E> ref : theRefs.slice(start, stop, step)) {
			E value = ref.get();
			if (value != null)
				result.add(value);
		}
		return result;
	}

	@Override
	public Iterator<E> iterator() {
		expunge();
		return new SnapshotIterator(new ArrayList<>(theRefs));
	}

	@Override
	public Iterator<E> descendingIterator() {
		expunge();
		return new SnapshotIterator(Lists.reverse(new ArrayList<>(theRefs)));
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder(getClass().getSimpleName()).append('[');
		boolean first = true;
		for (E value : this) {
			if (!first)
				str.append(", ");
			first = false;
			str.append(value);
		}
		return str.append(']').toString();
	}

	private class SnapshotIterator implements Iterator<E> {
		private final Iterator<ReclaimableReference<E>> theSnapshot;
		private E theNext;
		private E theLastReturned;

		SnapshotIterator(List<ReclaimableReference<E>> snapshot) {
			theSnapshot = snapshot.iterator();
		}

		@Override
		public boolean hasNext() {
			while (theNext == null && theSnapshot.hasNext())
				theNext = theSnapshot.next().get();
			return theNext != null;
		}

		@Override
		public E next() {
			if (!hasNext())
				throw new NoSuchElementException();
			theLastReturned = theNext;
			theNext = null;
			return theLastReturned;
		}

		@Override
		public void remove() {
			if (theLastReturned == null)
				throw new IllegalStateException("remove() may only be called once after next()");
			OrderedWeakSet.this.remove(theLastReturned);
			theLastReturned = null;
		}
	}
}
