package org.framekit.assoc;

import java.util.AbstractMap;
import java.util.function.Supplier;

import org.framekit.collect.KeyMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Common implementation for maps that hold one side of each entry weakly and may create values for missing keys on demand.
 * </p>
 * <p>
 * {@link #get(Object)} keeps the {@link java.util.Map} contract and never creates a value. {@link #require(Object)} returns the value for
 * a key if it is present; otherwise it calls the default factory once, stores its result under the key and returns it. Without a factory,
 * {@link #require(Object)} throws a {@link KeyMissingException}.
 * </p>
 * <p>
 * An entry whose weakly-held side has been reclaimed is simply absent: it is indistinguishable from an entry that was never added.
 * </p>
 *
 * @param <K> The key type of the map
 * @param <V> The value type of the map
 */
public abstract class AbstractWeakDefaultDictionary<K, V> extends AbstractMap<K, V> implements KeyedLookup<K, V> {
	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractWeakDefaultDictionary.class);

	private final Supplier<? extends V> theDefaultFactory;

	/** @param defaultFactory The factory to create values for missing keys, or null to fail on missing keys */
	protected AbstractWeakDefaultDictionary(Supplier<? extends V> defaultFactory) {
		theDefaultFactory = defaultFactory;
	}

	/** @return The factory creating values for missing keys, or null if this map has none */
	public Supplier<? extends V> getDefaultFactory() {
		return theDefaultFactory;
	}

	@Override
	public V require(K key) throws KeyMissingException {
		V value = get(key);
		if (value != null || containsKey(key))
			return value;
		return missing(key);
	}

	/**
	 * Called by {@link #require(Object)} for a key that is not present
	 *
	 * @param key The missing key
	 * @return The value created for the key by the default factory, now stored in this map
	 * @throws KeyMissingException If this map has no default factory
	 */
	protected V missing(K key) throws KeyMissingException {
		if (theDefaultFactory == null)
			throw new KeyMissingException(key);
		LOGGER.trace("Creating default value for {}", key);
		// Held strongly by this frame until the caller receives it
		V value = theDefaultFactory.get();
		put(key, value);
		return value;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + super.toString();
	}
}
