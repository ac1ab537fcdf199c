package org.framekit.assoc;

import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

/**
 * <p>
 * A map that holds its keys {@link java.lang.ref.WeakReference weakly}, creating values for missing keys with an optional default factory
 * (see {@link AbstractWeakDefaultDictionary}). An entry disappears once its key has been reclaimed. Keys are matched by
 * {@link Object#equals(Object) equality}, and may not be null.
 * </p>
 * <p>
 * Values are held strongly. A value that refers to its own key keeps the entry alive.
 * </p>
 *
 * <pre>
 * WeakKeyDefaultDictionary&lt;Scene, Set&lt;Runnable&gt;&gt; callbacks = new WeakKeyDefaultDictionary&lt;&gt;(HashSet::new);
 * callbacks.require(scene).add(callback);
 * </pre>
 *
 * @param <K> The key type of the map
 * @param <V> The value type of the map
 */
public class WeakKeyDefaultDictionary<K, V> extends AbstractWeakDefaultDictionary<K, V> {
	private final WeakHashMap<K, V> theEntries;

	/** Creates a map with no default factory */
	public WeakKeyDefaultDictionary() {
		this(null);
	}

	/** @param defaultFactory The factory to create values for missing keys, or null to fail on missing keys */
	public WeakKeyDefaultDictionary(Supplier<? extends V> defaultFactory) {
		super(defaultFactory);
		theEntries = new WeakHashMap<>();
	}

	/**
	 * @param defaultFactory The factory to create values for missing keys, or null to fail on missing keys
	 * @param initial The initial entries for the map
	 */
	public WeakKeyDefaultDictionary(Supplier<? extends V> defaultFactory, Map<? extends K, ? extends V> initial) {
		this(defaultFactory);
		putAll(initial);
	}

	/** Counts live entries only, in linear time */
	@Override
	public int size() {
		return Iterators.size(theEntries.keySet().iterator());
	}

	@Override
	public boolean isEmpty() {
		return !theEntries.keySet().iterator().hasNext();
	}

	@Override
	public boolean containsKey(Object key) {
		return key != null && theEntries.containsKey(key);
	}

	@Override
	public V get(Object key) {
		return key == null ? null : theEntries.get(key);
	}

	@Override
	public V put(K key, V value) {
		Preconditions.checkNotNull(key, "Weak keys cannot be null");
		return theEntries.put(key, value);
	}

	@Override
	public V remove(Object key) {
		return key == null ? null : theEntries.remove(key);
	}

	@Override
	public void clear() {
		theEntries.clear();
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return theEntries.entrySet();
	}
}
