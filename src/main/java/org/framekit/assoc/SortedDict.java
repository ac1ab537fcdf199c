package org.framekit.assoc;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import org.framekit.collect.KeyMissingException;
import org.framekit.collect.ReversibleCollection;

import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

/**
 * <p>
 * A map whose keys are always iterated in ascending order, as defined by a {@link Comparator} or by the keys' natural ordering. The views
 * returned by {@link #keySet()}, {@link #values()} and {@link #entrySet()} are live, iterate in ascending key order, and can be traversed
 * in exactly the reverse order through {@link ReversibleCollection#descendingIterator()}.
 * </p>
 * <p>
 * Values are stored in a hash table and keys in a sorted index. A new key is placed in the index by binary search, so no operation resorts
 * the existing keys. A key that cannot be compared with the keys already present is rejected with an {@link OrderingException} when it is
 * inserted, and the map is left unchanged.
 * </p>
 *
 * @param <K> The key type of the map
 * @param <V> The value type of the map
 */
public class SortedDict<K, V> extends AbstractMap<K, V> implements KeyedLookup<K, V> {
	private final Comparator<? super K> theComparator;
	private final HashMap<K, V> theEntries;
	private final ArrayList<K> theSortedKeys;
	private int theModCount;

	private KeysView theKeys;
	private ValuesView theValues;
	private ItemsView theItems;

	/** Creates an empty map ordered by the natural ordering of its keys */
	public SortedDict() {
		this((Comparator<? super K>) null);
	}

	/** @param comparator The ordering for the keys, or null for their natural ordering */
	public SortedDict(Comparator<? super K> comparator) {
		theComparator = comparator;
		theEntries = new HashMap<>();
		theSortedKeys = new ArrayList<>();
	}

	/**
	 * Creates a map ordered by the natural ordering of its keys
	 *
	 * @param source The initial entries for the map
	 * @throws OrderingException If the keys are not mutually comparable
	 */
	public SortedDict(Map<? extends K, ? extends V> source) {
		this(null, source);
	}

	/**
	 * @param comparator The ordering for the keys, or null for their natural ordering
	 * @param source The initial entries for the map
	 * @throws OrderingException If the keys are not mutually comparable
	 */
	public SortedDict(Comparator<? super K> comparator, Map<? extends K, ? extends V> source) {
		this(comparator);
		putAll(source);
	}

	/**
	 * @param <K> The key type for the map
	 * @param <V> The value type for the map
	 * @param keys The keys for the map
	 * @param value The value to map every key to
	 * @return A new map, ordered by the keys' natural ordering, with each of the given keys mapped to the given value
	 * @throws OrderingException If the keys are not mutually comparable
	 */
	public static <K, V> SortedDict<K, V> fromKeys(Iterable<? extends K> keys, V value) {
		Map<K, V> entries = new LinkedHashMap<>();
		for (K key : keys)
			entries.put(key, value);
		return new SortedDict<>(entries);
	}

	/** @return The ordering of this map's keys, or null if they are ordered naturally */
	public Comparator<? super K> comparator() {
		return theComparator;
	}

	@Override
	public int size() {
		return theEntries.size();
	}

	@Override
	public boolean isEmpty() {
		return theEntries.isEmpty();
	}

	@Override
	public boolean containsKey(Object key) {
		return theEntries.containsKey(key);
	}

	@Override
	public boolean containsValue(Object value) {
		return theEntries.containsValue(value);
	}

	@Override
	public V get(Object key) {
		return theEntries.get(key);
	}

	@Override
	public V require(K key) throws KeyMissingException {
		V value = theEntries.get(key);
		if (value == null && !theEntries.containsKey(key))
			throw new KeyMissingException(key);
		return value;
	}

	@Override
	public V put(K key, V value) {
		if (theEntries.containsKey(key))
			return theEntries.put(key, value);
		int insertAt = insertionPoint(key);
		theSortedKeys.add(insertAt, key);
		theEntries.put(key, value);
		theModCount++;
		return null;
	}

	/**
	 * Adds all the given entries. Every new key is checked against the others before this map is modified, so an
	 * {@link OrderingException} leaves this map unchanged.
	 */
	@Override
	public void putAll(Map<? extends K, ? extends V> m) {
		List<K> newKeys = new ArrayList<>();
		for (K key : m.keySet()) {
			if (!theEntries.containsKey(key)) {
				try {
					compare(key, key);
				} catch (ClassCastException e) {
					throw new OrderingException(key, e);
				}
				newKeys.add(key);
			}
		}
		if (newKeys.isEmpty()) {
			theEntries.putAll(m);
			return;
		}
		List<K> sorted = new ArrayList<>(theSortedKeys.size() + newKeys.size());
		sorted.addAll(theSortedKeys);
		sorted.addAll(newKeys);
		try {
			sorted.sort(this::compare);
		} catch (ClassCastException e) {
			throw new OrderingException(null, e);
		}
		theEntries.putAll(m);
		theSortedKeys.clear();
		theSortedKeys.addAll(sorted);
		theModCount++;
	}

	@Override
	public V remove(Object key) {
		if (!theEntries.containsKey(key))
			return null;
		V value = theEntries.remove(key);
		theSortedKeys.remove(key);
		theModCount++;
		return value;
	}

	/**
	 * @param key The key to remove
	 * @return The value that was mapped to the key
	 * @throws KeyMissingException If the key was not present
	 */
	public V pop(K key) throws KeyMissingException {
		if (!theEntries.containsKey(key))
			throw new KeyMissingException(key);
		return remove(key);
	}

	/**
	 * @param key The key to remove
	 * @param defaultValue The value to return if the key is not present
	 * @return The value that was mapped to the key, or the default value if it was not present
	 */
	public V pop(K key, V defaultValue) {
		if (!theEntries.containsKey(key))
			return defaultValue;
		return remove(key);
	}

	/**
	 * Removes the entry with the greatest key
	 *
	 * @return The removed entry
	 * @throws KeyMissingException If this map is empty
	 */
	public Map.Entry<K, V> popLastEntry() throws KeyMissingException {
		if (theSortedKeys.isEmpty())
			throw new KeyMissingException(null, "popLastEntry(): map is empty");
		K key = theSortedKeys.remove(theSortedKeys.size() - 1);
		V value = theEntries.remove(key);
		theModCount++;
		return Maps.immutableEntry(key, value);
	}

	@Override
	public void clear() {
		theEntries.clear();
		theSortedKeys.clear();
		theModCount++;
	}

	/**
	 * @return The least key in this map
	 * @throws NoSuchElementException If this map is empty
	 */
	public K firstKey() {
		if (theSortedKeys.isEmpty())
			throw new NoSuchElementException();
		return theSortedKeys.get(0);
	}

	/**
	 * @return The greatest key in this map
	 * @throws NoSuchElementException If this map is empty
	 */
	public K lastKey() {
		if (theSortedKeys.isEmpty())
			throw new NoSuchElementException();
		return theSortedKeys.get(theSortedKeys.size() - 1);
	}

	/** @return A live iterable over this map's keys in descending order */
	public Iterable<K> descendingKeys() {
		return keySet().reversed();
	}

	/** @return A copy of this map with the same ordering and entries */
	public SortedDict<K, V> copy() {
		return deepCopy(Function.identity());
	}

	/**
	 * @param valueCopier The function to copy each value with
	 * @return A copy of this map with the same ordering and keys, mapped to copies of this map's values
	 */
	public SortedDict<K, V> deepCopy(Function<? super V, ? extends V> valueCopier) {
		SortedDict<K, V> copy = new SortedDict<>(theComparator);
		for (K key : theSortedKeys) {
			copy.theEntries.put(key, valueCopier.apply(theEntries.get(key)));
			copy.theSortedKeys.add(key);
		}
		return copy;
	}

	@Override
	public KeysView keySet() {
		if (theKeys == null)
			theKeys = new KeysView();
		return theKeys;
	}

	@Override
	public ValuesView values() {
		if (theValues == null)
			theValues = new ValuesView();
		return theValues;
	}

	@Override
	public ItemsView entrySet() {
		if (theItems == null)
			theItems = new ItemsView();
		return theItems;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + super.toString();
	}

	private int insertionPoint(K key) {
		try {
			if (theSortedKeys.isEmpty()) {
				compare(key, key); // Type check
				return 0;
			}
			// Insert after any keys that compare equal
			int low = 0;
			int high = theSortedKeys.size();
			while (low < high) {
				int mid = (low + high) >>> 1;
				if (compare(key, theSortedKeys.get(mid)) < 0)
					high = mid;
				else
					low = mid + 1;
			}
			return low;
		} catch (ClassCastException e) {
			throw new OrderingException(key, e);
		}
	}

	@SuppressWarnings("unchecked")
	private int compare(K key1, K key2) {
		if (theComparator != null)
			return theComparator.compare(key1, key2);
		return ((Comparable<Object>) key1).compareTo(key2);
	}

	private class KeyIterator implements Iterator<K> {
		private final boolean isDescending;
		private int theCursor;
		private K theLastReturned;
		private boolean canRemove;
		private int theExpectedModCount;

		KeyIterator(boolean descending) {
			isDescending = descending;
			theCursor = descending ? theSortedKeys.size() - 1 : 0;
			theExpectedModCount = theModCount;
		}

		@Override
		public boolean hasNext() {
			return isDescending ? theCursor >= 0 : theCursor < theSortedKeys.size();
		}

		@Override
		public K next() {
			if (theModCount != theExpectedModCount)
				throw new ConcurrentModificationException();
			if (!hasNext())
				throw new NoSuchElementException();
			theLastReturned = theSortedKeys.get(theCursor);
			theCursor += isDescending ? -1 : 1;
			canRemove = true;
			return theLastReturned;
		}

		@Override
		public void remove() {
			if (!canRemove)
				throw new IllegalStateException("remove() may only be called once after next()");
			if (theModCount != theExpectedModCount)
				throw new ConcurrentModificationException();
			SortedDict.this.remove(theLastReturned);
			if (!isDescending)
				theCursor--;
			canRemove = false;
			theExpectedModCount = theModCount;
		}
	}

	/** A live view of a {@link SortedDict}'s keys, in ascending order */
	public final class KeysView extends AbstractSet<K> implements ReversibleCollection<K> {
		KeysView() {
		}

		@Override
		public Iterator<K> iterator() {
			return new KeyIterator(false);
		}

		@Override
		public Iterator<K> descendingIterator() {
			return new KeyIterator(true);
		}

		@Override
		public int size() {
			return SortedDict.this.size();
		}

		@Override
		public boolean contains(Object o) {
			return containsKey(o);
		}

		@Override
		public boolean remove(Object o) {
			if (!containsKey(o))
				return false;
			SortedDict.this.remove(o);
			return true;
		}

		@Override
		public void clear() {
			SortedDict.this.clear();
		}
	}

	/** A live view of a {@link SortedDict}'s values, in ascending order of their keys */
	public final class ValuesView extends AbstractCollection<V> implements ReversibleCollection<V> {
		ValuesView() {
		}

		@Override
		public Iterator<V> iterator() {
			return Iterators.transform(new KeyIterator(false), theEntries::get);
		}

		@Override
		public Iterator<V> descendingIterator() {
			return Iterators.transform(new KeyIterator(true), theEntries::get);
		}

		@Override
		public int size() {
			return SortedDict.this.size();
		}

		@Override
		public boolean contains(Object o) {
			return containsValue(o);
		}

		@Override
		public void clear() {
			SortedDict.this.clear();
		}
	}

	/** A live view of a {@link SortedDict}'s entries, in ascending order of their keys */
	public final class ItemsView extends AbstractSet<Map.Entry<K, V>> implements ReversibleCollection<Map.Entry<K, V>> {
		ItemsView() {
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			return Iterators.transform(new KeyIterator(false), LiveEntry::new);
		}

		@Override
		public Iterator<Map.Entry<K, V>> descendingIterator() {
			return Iterators.transform(new KeyIterator(true), LiveEntry::new);
		}

		@Override
		public int size() {
			return SortedDict.this.size();
		}

		@Override
		public boolean contains(Object o) {
			if (!(o instanceof Map.Entry))
				return false;
			Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;
			return containsKey(entry.getKey()) && Objects.equals(get(entry.getKey()), entry.getValue());
		}

		@Override
		public boolean remove(Object o) {
			if (!contains(o))
				return false;
			SortedDict.this.remove(((Map.Entry<?, ?>) o).getKey());
			return true;
		}

		@Override
		public void clear() {
			SortedDict.this.clear();
		}
	}

	private class LiveEntry implements Map.Entry<K, V> {
		private final K theKey;

		LiveEntry(K key) {
			theKey = key;
		}

		@Override
		public K getKey() {
			return theKey;
		}

		@Override
		public V getValue() {
			return theEntries.get(theKey);
		}

		@Override
		public V setValue(V value) {
			if (!theEntries.containsKey(theKey))
				throw new IllegalStateException("Entry has been removed");
			return theEntries.put(theKey, value);
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry))
				return false;
			Map.Entry<?, ?> other = (Map.Entry<?, ?>) obj;
			return Objects.equals(theKey, other.getKey()) && Objects.equals(getValue(), other.getValue());
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(theKey) ^ Objects.hashCode(getValue());
		}

		@Override
		public String toString() {
			return theKey + "=" + getValue();
		}
	}
}
