package org.framekit.assoc;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Supplier;

import org.framekit.util.ReclamationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * <p>
 * A map that holds its values {@link WeakReference weakly}, creating values for missing keys with an optional default factory (see
 * {@link AbstractWeakDefaultDictionary}). An entry disappears once its value has been reclaimed, which makes this map suitable as a cache
 * that never keeps its values alive. Values may not be null.
 * </p>
 * <p>
 * Reclaimed entries are pruned eagerly: every operation first removes the entries the collector has reported, and {@link #size()} also
 * sweeps out entries the collector has cleared but not yet reported. Iterators traverse a snapshot of the entries taken when iteration
 * begins and skip entries reclaimed since.
 * </p>
 *
 * @param <K> The key type of the map
 * @param <V> The value type of the map
 */
public class WeakValueDefaultDictionary<K, V> extends AbstractWeakDefaultDictionary<K, V> {
	private static final Logger LOGGER = LoggerFactory.getLogger(WeakValueDefaultDictionary.class);

	private final HashMap<K, ValueReference<K, V>> theEntries;
	private final ReclamationQueue<V> theReclaimed;
	private EntrySet theEntrySet;

	/** Creates a map with no default factory */
	public WeakValueDefaultDictionary() {
		this(null);
	}

	/** @param defaultFactory The factory to create values for missing keys, or null to fail on missing keys */
	public WeakValueDefaultDictionary(Supplier<? extends V> defaultFactory) {
		super(defaultFactory);
		theEntries = new HashMap<>();
		theReclaimed = new ReclamationQueue<>();
	}

	/**
	 * @param defaultFactory The factory to create values for missing keys, or null to fail on missing keys
	 * @param initial The initial entries for the map
	 */
	public WeakValueDefaultDictionary(Supplier<? extends V> defaultFactory, Map<? extends K, ? extends V> initial) {
		this(defaultFactory);
		putAll(initial);
	}

	/** Removes the entries whose values the collector has reported as reclaimed */
	private void expunge() {
		int expunged = theReclaimed.drain(ref -> {
			ValueReference<?, ?> valueRef = (ValueReference<?, ?>) ref;
			// The key may have been re-mapped since
			theEntries.remove(valueRef.theKey, valueRef);
		});
		if (expunged > 0)
			LOGGER.debug("Expunged {} reclaimed values", expunged);
	}

	@Override
	public int size() {
		expunge();
		int before = theEntries.size();
		if (theEntries.values().removeIf(ref -> ref.get() == null))
			LOGGER.debug("Swept {} cleared values", before - theEntries.size());
		return theEntries.size();
	}

	@Override
	public boolean isEmpty() {
		return size() == 0;
	}

	@Override
	public boolean containsKey(Object key) {
		return get(key) != null;
	}

	@Override
	public V get(Object key) {
		expunge();
		ValueReference<K, V> ref = theEntries.get(key);
		return ref == null ? null : ref.get();
	}

	/**
	 * @param key The key to map the value to
	 * @param value The value to map to the key, held weakly. Must not be null.
	 * @return The value that was previously mapped to the key, or null if there was none or it has been reclaimed
	 */
	@Override
	public V put(K key, V value) {
		Preconditions.checkNotNull(value, "Weak values cannot be null");
		expunge();
		ValueReference<K, V> old = theEntries.put(key, new ValueReference<>(key, value, theReclaimed.getQueue()));
		return old == null ? null : old.get();
	}

	@Override
	public V remove(Object key) {
		expunge();
		ValueReference<K, V> old = theEntries.remove(key);
		return old == null ? null : old.get();
	}

	@Override
	public void clear() {
		theEntries.clear();
		theReclaimed.clear();
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		if (theEntrySet == null)
			theEntrySet = new EntrySet();
		return theEntrySet;
	}

	private static class ValueReference<K, V> extends WeakReference<V> {
		final K theKey;

		ValueReference(K key, V value, ReferenceQueue<? super V> queue) {
			super(value, queue);
			theKey = key;
		}
	}

	private class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			expunge();
			List<ValueReference<K, V>> snapshot = new ArrayList<>(theEntries.values());
			return new Iterator<Map.Entry<K, V>>() {
				private final Iterator<ValueReference<K, V>> theSnapshot = snapshot.iterator();
				private Map.Entry<K, V> theNext;
				private ValueReference<K, V> theNextRef;
				private ValueReference<K, V> theLastReturned;

				@Override
				public boolean hasNext() {
					while (theNext == null && theSnapshot.hasNext()) {
						ValueReference<K, V> ref = theSnapshot.next();
						V value = ref.get();
						if (value != null) {
							theNext = Maps.immutableEntry(ref.theKey, value);
							theNextRef = ref;
						}
					}
					return theNext != null;
				}

				@Override
				public Map.Entry<K, V> next() {
					if (!hasNext())
						throw new NoSuchElementException();
					Map.Entry<K, V> entry = theNext;
					theLastReturned = theNextRef;
					theNext = null;
					theNextRef = null;
					return entry;
				}

				@Override
				public void remove() {
					if (theLastReturned == null)
						throw new IllegalStateException("remove() may only be called once after next()");
					theEntries.remove(theLastReturned.theKey, theLastReturned);
					theLastReturned = null;
				}
			};
		}

		@Override
		public int size() {
			return WeakValueDefaultDictionary.this.size();
		}
	}
}
