package org.framekit.assoc;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.framekit.collect.KeyMissingException;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * <p>
 * A read-only view of several maps (layers) as a single map. A key is looked up in each layer in turn and the first layer containing it
 * supplies its value, so earlier layers shadow later ones. Iteration covers every key of every layer once, in the order keys are first
 * encountered scanning the layers in order.
 * </p>
 * <p>
 * The layers are shared, not copied: changes made to a layer by its owner are visible through every proxy that includes it. The proxy
 * itself never modifies a layer, and all of its {@link Map} mutators throw {@link UnsupportedOperationException}.
 * </p>
 * <p>
 * A failed {@link #require(Object) lookup} is routed through {@link #missing(Object)}, whose behavior may be replaced with
 * {@link #withMissingHandler(Function)}.
 * </p>
 *
 * @param <K> The key type of the map
 * @param <V> The value type of the map
 */
public class ChainMapProxy<K, V> extends AbstractMap<K, V> implements KeyedLookup<K, V> {
	private final ImmutableList<Map<? extends K, ? extends V>> theLayers;
	private final Function<? super K, ? extends V> theMissingHandler;
	private EntrySet theEntrySet;

	/** @param layers The layers for the proxy, in priority order. If none are given, a single empty layer is used. */
	@SafeVarargs
	public ChainMapProxy(Map<? extends K, ? extends V>... layers) {
		this(ImmutableList.copyOf(layers), null);
	}

	/** @param layers The layers for the proxy, in priority order. If empty, a single empty layer is used. */
	public ChainMapProxy(List<? extends Map<? extends K, ? extends V>> layers) {
		this(ImmutableList.copyOf(layers), null);
	}

	private ChainMapProxy(ImmutableList<Map<? extends K, ? extends V>> layers, Function<? super K, ? extends V> missingHandler) {
		theLayers = layers.isEmpty() ? ImmutableList.<Map<? extends K, ? extends V>> of(new LinkedHashMap<K, V>()) : layers;
		theMissingHandler = missingHandler;
	}

	/**
	 * @param <K> The key type for the proxy
	 * @param <V> The value type for the proxy
	 * @param keys The keys for the proxy's single layer
	 * @param value The value to map every key to
	 * @return A proxy over a single new map with each of the given keys mapped to the given value
	 */
	public static <K, V> ChainMapProxy<K, V> fromKeys(Iterable<? extends K> keys, V value) {
		Map<K, V> layer = new LinkedHashMap<>();
		for (K key : keys)
			layer.put(key, value);
		return new ChainMapProxy<>(ImmutableList.<Map<? extends K, ? extends V>> of(layer), null);
	}

	/** @return The layers of this proxy, in priority order */
	public List<Map<? extends K, ? extends V>> getLayers() {
		return theLayers;
	}

	/**
	 * @param missingHandler The function to supply values for keys that are not in any layer, or null to fail with a
	 *        {@link KeyMissingException}
	 * @return A proxy over the same layers whose {@link #missing(Object)} uses the given function
	 */
	public ChainMapProxy<K, V> withMissingHandler(Function<? super K, ? extends V> missingHandler) {
		return new ChainMapProxy<>(theLayers, missingHandler);
	}

	@Override
	public V require(K key) throws KeyMissingException {
		for (Map<? extends K, ? extends V> layer : theLayers) {
			if (layer.containsKey(key))
				return layer.get(key);
		}
		return missing(key);
	}

	/**
	 * Called by {@link #require(Object)} when no layer contains a key
	 *
	 * @param key The key that was not found
	 * @return The value supplied by this proxy's missing handler
	 * @throws KeyMissingException If this proxy has no missing handler
	 */
	public V missing(K key) throws KeyMissingException {
		if (theMissingHandler == null)
			throw new KeyMissingException(key);
		return theMissingHandler.apply(key);
	}

	/** @return The value of the first layer containing the key, or null if none does. {@link #missing(Object)} is not consulted. */
	@Override
	public V get(Object key) {
		for (Map<? extends K, ? extends V> layer : theLayers) {
			if (layer.containsKey(key))
				return layer.get(key);
		}
		return null;
	}

	@Override
	public boolean containsKey(Object key) {
		for (Map<? extends K, ? extends V> layer : theLayers) {
			if (layer.containsKey(key))
				return true;
		}
		return false;
	}

	@Override
	public int size() {
		Set<Object> keys = new HashSet<>();
		for (Map<? extends K, ? extends V> layer : theLayers)
			keys.addAll(layer.keySet());
		return keys.size();
	}

	@Override
	public boolean isEmpty() {
		for (Map<? extends K, ? extends V> layer : theLayers) {
			if (!layer.isEmpty())
				return false;
		}
		return true;
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		if (theEntrySet == null)
			theEntrySet = new EntrySet();
		return theEntrySet;
	}

	/** @return A new proxy with a new, empty layer in front of this proxy's layers */
	public ChainMapProxy<K, V> newChild() {
		return newChild(null, Collections.emptyMap());
	}

	/**
	 * @param layer The layer to put in front of this proxy's layers, or null for a new, empty map
	 * @return A new proxy with the given layer in front of this proxy's layers
	 */
	public ChainMapProxy<K, V> newChild(Map<K, V> layer) {
		return newChild(layer, Collections.emptyMap());
	}

	/**
	 * @param layer The layer to put in front of this proxy's layers, or null for a new map
	 * @param overrides Entries to write into the new layer (into the given map itself, if one is given) before it is added
	 * @return A new proxy with the new layer in front of this proxy's layers
	 */
	public ChainMapProxy<K, V> newChild(Map<K, V> layer, Map<? extends K, ? extends V> overrides) {
		Map<K, V> child;
		if (layer == null)
			child = new LinkedHashMap<>(overrides);
		else {
			child = layer;
			if (!overrides.isEmpty())
				child.putAll(overrides);
		}
		return new ChainMapProxy<>(ImmutableList.<Map<? extends K, ? extends V>> builder()//
			.add(child).addAll(theLayers).build(), theMissingHandler);
	}

	/** @return A new proxy over all of this proxy's layers except the first */
	public ChainMapProxy<K, V> parents() {
		return new ChainMapProxy<>(theLayers.subList(1, theLayers.size()), theMissingHandler);
	}

	/** @return A new proxy over the same layers */
	public ChainMapProxy<K, V> copy() {
		return new ChainMapProxy<>(theLayers, theMissingHandler);
	}

	/**
	 * @param other The map to merge with this proxy's content
	 * @return A new map with this proxy's effective entries, then the other map's, which replace this proxy's values for shared keys
	 */
	public Map<K, V> merged(Map<? extends K, ? extends V> other) {
		Preconditions.checkNotNull(other);
		Map<K, V> result = new LinkedHashMap<>(this);
		result.putAll(other);
		return result;
	}

	/**
	 * @param other The map to merge with this proxy's content
	 * @return A new map with the other map's entries, then this proxy's effective entries, which replace the other map's values for shared
	 *         keys
	 */
	public Map<K, V> mergedUnder(Map<? extends K, ? extends V> other) {
		Preconditions.checkNotNull(other);
		Map<K, V> result = new LinkedHashMap<>(other);
		result.putAll(this);
		return result;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + theLayers;
	}

	private class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			Iterator<Map<? extends K, ? extends V>> layers = theLayers.iterator();
			return new AbstractIterator<Map.Entry<K, V>>() {
				private final Set<Object> theSeen = new HashSet<>();
				private Map<? extends K, ? extends V> theLayer;
				private Iterator<? extends Map.Entry<? extends K, ? extends V>> theLayerEntries;

				@Override
				protected Map.Entry<K, V> computeNext() {
					while (true) {
						while (theLayerEntries == null || !theLayerEntries.hasNext()) {
							if (!layers.hasNext())
								return endOfData();
							theLayer = layers.next();
							theLayerEntries = theLayer.entrySet().iterator();
						}
						Map.Entry<? extends K, ? extends V> entry = theLayerEntries.next();
						if (theSeen.add(entry.getKey()))
							return Maps.immutableEntry(entry.getKey(), entry.getValue());
					}
				}
			};
		}

		@Override
		public int size() {
			return ChainMapProxy.this.size();
		}
	}
}
