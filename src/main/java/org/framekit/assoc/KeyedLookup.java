package org.framekit.assoc;

import org.framekit.collect.KeyMissingException;

/**
 * A lookup that fails, rather than returning null, when a key is absent. Implementations may define a fallback (a default factory or a
 * missing-key handler) that is consulted before failing.
 *
 * @param <K> The key type of the lookup
 * @param <V> The value type of the lookup
 */
public interface KeyedLookup<K, V> {
	/**
	 * @param key The key to look up
	 * @return The value for the key
	 * @throws KeyMissingException If the key is absent and no fallback supplies a value
	 */
	V require(K key) throws KeyMissingException;
}
