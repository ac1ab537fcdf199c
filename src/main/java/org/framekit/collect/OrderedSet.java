package org.framekit.collect;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * <p>
 * A set that remembers the order in which its elements were first added, so that every element has a position that can be looked up.
 * Adding an element that is already present neither adds nor moves it.
 * </p>
 * <p>
 * The set algebra methods ({@link #union(Iterable...) union}, {@link #intersection(Iterable...) intersection},
 * {@link #difference(Iterable...) difference}, {@link #symmetricDifference(Iterable) symmetricDifference}) accept any {@link Iterable} and
 * return a new set of the same type as this one (see {@link #createEmpty()}). Elements of the result keep the order of this set, followed
 * by the order of the other operands for elements they introduce.
 * </p>
 * <p>
 * {@link #equals(Object)} and the subset/superset comparisons consider membership only. Use {@link #sequenceEquals(Iterable)} to compare
 * positions.
 * </p>
 *
 * <pre>
 * new OrderedSet&lt;&gt;(Arrays.asList(1, 1, 2, 3, 2)) -&gt; OrderedSet[1, 2, 3]
 * </pre>
 *
 * @param <E> The type of elements in the set
 */
public class OrderedSet<E> extends AbstractSet<E> implements IndexedSet<E> {
	private final ArrayList<E> theItems;
	private final HashMap<E, Integer> theIndexes;
	private int theModCount;

	/** Creates an empty set */
	public OrderedSet() {
		theItems = new ArrayList<>();
		theIndexes = new HashMap<>();
	}

	/** @param values The initial values for the set, duplicates dropped after their first occurrence */
	public OrderedSet(Iterable<? extends E> values) {
		this();
		for (E value : values)
			add(value);
	}

	/**
	 * Creates the empty set into which the results of copies, slices and set algebra are put. Subclasses override this so that those
	 * operations return instances of the subclass.
	 *
	 * @return A new, empty set of this set's type
	 */
	protected OrderedSet<E> createEmpty() {
		return new OrderedSet<>();
	}

	private OrderedSet<E> createFrom(Iterable<? extends E> values) {
		OrderedSet<E> result = createEmpty();
		for (E value : values)
			result.add(value);
		return result;
	}

	@Override
	public int size() {
		return theItems.size();
	}

	@Override
	public boolean isEmpty() {
		return theItems.isEmpty();
	}

	@Override
	public boolean contains(Object o) {
		return theIndexes.containsKey(o);
	}

	@Override
	public Iterator<E> iterator() {
		return new Iterator<E>() {
			private int theCursor;
			private int theLastReturned = -1;
			private int theExpectedModCount = theModCount;

			@Override
			public boolean hasNext() {
				return theCursor < theItems.size();
			}

			@Override
			public E next() {
				checkForComodification();
				if (theCursor >= theItems.size())
					throw new NoSuchElementException();
				theLastReturned = theCursor++;
				return theItems.get(theLastReturned);
			}

			@Override
			public void remove() {
				if (theLastReturned < 0)
					throw new IllegalStateException("remove() may only be called once after next()");
				checkForComodification();
				removePosition(theLastReturned);
				theCursor = theLastReturned;
				theLastReturned = -1;
				theExpectedModCount = theModCount;
			}

			private void checkForComodification() {
				if (theModCount != theExpectedModCount)
					throw new ConcurrentModificationException();
			}
		};
	}

	@Override
	public Iterator<E> descendingIterator() {
		return Iterators.unmodifiableIterator(Lists.reverse(theItems).iterator());
	}

	/**
	 * Appends the value to this set if it is not already present
	 *
	 * @param value The value to add
	 * @return Whether the value was added
	 */
	@Override
	public boolean add(E value) {
		if (theIndexes.containsKey(value))
			return false;
		theIndexes.put(value, theItems.size());
		theItems.add(value);
		theModCount++;
		return true;
	}

	/**
	 * Appends each value not yet present, in iteration order
	 *
	 * @param others The values to add
	 * @return Whether any value was added
	 */
	@SafeVarargs
	public final boolean update(Iterable<? extends E>... others) {
		boolean modified = false;
		for (Iterable<? extends E> other : others) {
			for (E value : other)
				modified |= add(value);
		}
		return modified;
	}

	@Override
	public E get(int index) {
		return theItems.get(SequenceIndexes.position(index, theItems.size()));
	}

	@Override
	public int indexOf(Object value) {
		Integer index = theIndexes.get(value);
		return index == null ? -1 : index;
	}

	/**
	 * Removes the value, failing if it is not present. {@link #remove(Object)} keeps the {@link Set} contract of returning false instead.
	 *
	 * @param value The value to remove
	 * @throws OrderedSetIndexException If the value is not in this set
	 */
	public void removeElement(Object value) throws OrderedSetIndexException {
		Integer index = theIndexes.get(value);
		if (index == null)
			throw OrderedSetIndexException.missing(value);
		removePosition(index);
	}

	@Override
	public boolean remove(Object o) {
		Integer index = theIndexes.get(o);
		if (index == null)
			return false;
		removePosition(index);
		return true;
	}

	/**
	 * Removes and returns the last element
	 *
	 * @return The removed element
	 * @throws OrderedSetIndexException If this set is empty
	 */
	public E pop() throws OrderedSetIndexException {
		return pop(-1);
	}

	/**
	 * @param index The index of the element to remove
	 * @return The removed element
	 * @throws OrderedSetIndexException If this set is empty or the index is out of range
	 */
	public E pop(int index) throws OrderedSetIndexException {
		if (theItems.isEmpty())
			throw OrderedSetIndexException.empty("pop");
		return removePosition(SequenceIndexes.position(index, theItems.size()));
	}

	@Override
	public E removeAt(int index) throws OrderedSetIndexException {
		return pop(index);
	}

	private E removePosition(int position) {
		E item = theItems.remove(position);
		theIndexes.remove(item);
		for (int i = position; i < theItems.size(); i++)
			theIndexes.put(theItems.get(i), i);
		theModCount++;
		return item;
	}

	/** Re-indexes every element, in a single pass */
	@Override
	public boolean removeIf(Predicate<? super E> filter) {
		Objects.requireNonNull(filter);
		if (!theItems.removeIf(filter))
			return false;
		reindex();
		theModCount++;
		return true;
	}

	@Override
	public boolean removeAll(Collection<?> c) {
		Objects.requireNonNull(c);
		return removeIf(c::contains);
	}

	@Override
	public boolean retainAll(Collection<?> c) {
		Objects.requireNonNull(c);
		return removeIf(item -> !c.contains(item));
	}

	@Override
	public void clear() {
		theItems.clear();
		theIndexes.clear();
		theModCount++;
	}

	/** Sorts this set in place by the natural ordering of its elements, which must be {@link Comparable} */
	public void sort() {
		sort(null, false);
	}

	/**
	 * Sorts this set in place. The sort is stable.
	 *
	 * @param sorting The comparator to sort with, or null for natural ordering
	 */
	public void sort(Comparator<? super E> sorting) {
		sort(sorting, false);
	}

	/**
	 * Sorts this set in place. The sort is stable in both directions: equal elements keep their relative order. If the comparison fails,
	 * this set is left unchanged.
	 *
	 * @param sorting The comparator to sort with, or null for natural ordering
	 * @param reverse Whether to sort in descending order
	 * @throws ClassCastException If the elements cannot be compared
	 */
	@SuppressWarnings({ "unchecked", "rawtypes" })
	public void sort(Comparator<? super E> sorting, boolean reverse) {
		Comparator<? super E> compare = sorting != null ? sorting : (Comparator) Comparator.naturalOrder();
		List<E> sorted = new ArrayList<>(theItems);
		sorted.sort(reverse ? Collections.reverseOrder(compare) : compare);
		theItems.clear();
		theItems.addAll(sorted);
		reindex();
		theModCount++;
	}

	/** Reverses the order of this set in place */
	public void reverse() {
		Collections.reverse(theItems);
		reindex();
		theModCount++;
	}

	private void reindex() {
		theIndexes.clear();
		for (int i = 0; i < theItems.size(); i++)
			theIndexes.put(theItems.get(i), i);
	}

	@Override
	public OrderedSet<E> slice(int start, int stop) {
		return slice(start, stop, 1);
	}

	@Override
	public OrderedSet<E> slice(Integer start, Integer stop, int step) {
		OrderedSet<E> result = createEmpty();
		for (int pos : SequenceIndexes.slice(start, stop, step, theItems.size()))
			result.add(theItems.get(pos));
		return result;
	}

	/** @return A shallow copy of this set, of the same type */
	public OrderedSet<E> copy() {
		return createFrom(this);
	}

	/**
	 * @param copier The function to copy each element with
	 * @return A copy of this set, of the same type, containing copies of this set's elements in the same order
	 */
	public OrderedSet<E> deepCopy(Function<? super E, ? extends E> copier) {
		OrderedSet<E> result = createEmpty();
		for (E item : theItems)
			result.add(copier.apply(item));
		return result;
	}

	/**
	 * @param others The other sets or sequences to unite with this set
	 * @return A new set containing every element of this set, then every element of each operand not yet present
	 */
	@SafeVarargs
	public final OrderedSet<E> union(Iterable<? extends E>... others) {
		OrderedSet<E> result = createFrom(this);
		result.update(others);
		return result;
	}

	/**
	 * @param others The other sets or sequences to intersect with this set
	 * @return A new set containing the elements of this set that are in every operand, in this set's order
	 */
	public OrderedSet<E> intersection(Iterable<?>... others) {
		if (others.length == 0)
			return copy();
		Set<?> common = commonTo(others);
		OrderedSet<E> result = createEmpty();
		for (E item : theItems) {
			if (common.contains(item))
				result.add(item);
		}
		return result;
	}

	/**
	 * Removes every element of this set that is not in all of the operands
	 *
	 * @param others The other sets or sequences to intersect with this set
	 * @return Whether this set was modified
	 */
	public boolean intersectionUpdate(Iterable<?>... others) {
		if (others.length == 0)
			return false;
		Set<?> common = commonTo(others);
		return removeIf(item -> !common.contains(item));
	}

	/**
	 * @param others The other sets or sequences whose elements to exclude
	 * @return A new set containing the elements of this set that are in none of the operands, in this set's order
	 */
	public OrderedSet<E> difference(Iterable<?>... others) {
		Set<Object> excluded = anyOf(others);
		OrderedSet<E> result = createEmpty();
		for (E item : theItems) {
			if (!excluded.contains(item))
				result.add(item);
		}
		return result;
	}

	/**
	 * Removes every element of this set that is in any of the operands
	 *
	 * @param others The other sets or sequences whose elements to remove
	 * @return Whether this set was modified
	 */
	public boolean differenceUpdate(Iterable<?>... others) {
		if (others.length == 0)
			return false;
		Set<Object> excluded = anyOf(others);
		return removeIf(excluded::contains);
	}

	/**
	 * @param other The set or sequence to take from
	 * @return A new set (of this set's type) containing the elements of the operand that are not in this set, in the operand's order
	 */
	public OrderedSet<E> reverseDifference(Iterable<? extends E> other) {
		OrderedSet<E> result = createFrom(other);
		result.differenceUpdate(this);
		return result;
	}

	/**
	 * @param other The other set or sequence
	 * @return A new set containing the elements in exactly one of this set and the operand. Elements of this set come first.
	 */
	public OrderedSet<E> symmetricDifference(Iterable<? extends E> other) {
		OrderedSet<E> mine = difference(other);
		OrderedSet<E> theirs = createFrom(other);
		theirs.differenceUpdate(this);
		mine.update(theirs);
		return mine;
	}

	/**
	 * @param other The other set or sequence
	 * @return A new set containing the elements in exactly one of this set and the operand. Elements of the operand come first.
	 */
	public OrderedSet<E> reverseSymmetricDifference(Iterable<? extends E> other) {
		OrderedSet<E> result = createFrom(other);
		result.symmetricDifferenceUpdate(this);
		return result;
	}

	/**
	 * Removes the elements of this set that are in the operand, then appends the elements of the operand that were not in this set
	 *
	 * @param other The other set or sequence
	 * @return Whether this set was modified
	 */
	public boolean symmetricDifferenceUpdate(Iterable<? extends E> other) {
		OrderedSet<E> toAdd = createEmpty();
		for (E value : other) {
			if (!contains(value))
				toAdd.add(value);
		}
		Set<Object> toRemove = lookup(other);
		boolean modified = removeIf(toRemove::contains);
		return update(toAdd) || modified;
	}

	/**
	 * @param other The other set or sequence
	 * @return Whether every element of this set is in the operand
	 */
	public boolean isSubsetOf(Iterable<?> other) {
		Set<Object> others = lookup(other);
		if (size() > others.size())
			return false;
		return others.containsAll(theItems);
	}

	/**
	 * @param other The other set or sequence
	 * @return Whether every element of this set is in the operand, which has other elements as well
	 */
	public boolean isProperSubsetOf(Iterable<?> other) {
		Set<Object> others = lookup(other);
		return size() < others.size() && others.containsAll(theItems);
	}

	/**
	 * @param other The other set or sequence
	 * @return Whether every element of the operand is in this set
	 */
	public boolean isSupersetOf(Iterable<?> other) {
		Set<Object> others = lookup(other);
		if (size() < others.size())
			return false;
		return theIndexes.keySet().containsAll(others);
	}

	/**
	 * @param other The other set or sequence
	 * @return Whether every element of the operand is in this set, which has other elements as well
	 */
	public boolean isProperSupersetOf(Iterable<?> other) {
		Set<Object> others = lookup(other);
		return size() > others.size() && theIndexes.keySet().containsAll(others);
	}

	/**
	 * @param other The other set or sequence
	 * @return Whether this set and the operand have no element in common
	 */
	public boolean isDisjoint(Iterable<?> other) {
		for (Object value : other) {
			if (contains(value))
				return false;
		}
		return true;
	}

	/**
	 * @param other The sequence to compare with
	 * @return Whether the operand contains exactly this set's elements in this set's order
	 */
	public boolean sequenceEquals(Iterable<?> other) {
		return Iterables.elementsEqual(this, other);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + theItems;
	}

	@SuppressWarnings("unchecked")
	private static Set<Object> lookup(Iterable<?> values) {
		if (values instanceof Set)
			return (Set<Object>) values;
		return Sets.<Object> newHashSet(values);
	}

	private static Set<Object> anyOf(Iterable<?>... others) {
		Set<Object> all = Sets.newHashSet();
		for (Iterable<?> other : others)
			Iterables.addAll(all, other);
		return all;
	}

	private static Set<?> commonTo(Iterable<?>... others) {
		Set<Object> common = Sets.<Object> newHashSet(others[0]);
		for (int i = 1; i < others.length; i++)
			common.retainAll(lookup(others[i]));
		return common;
	}
}
