package org.framekit.assoc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.framekit.collect.KeyMissingException;
import org.framekit.collect.LookupFailure;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

/** Tests {@link SortedDict} */
public class SortedDictTest {
	/** Keys are iterated in ascending order regardless of insertion order */
	@Test
	public void ascendingOrder() {
		SortedDict<Integer, String> dict = new SortedDict<>();
		dict.put(5, "e");
		dict.put(1, "a");
		dict.put(3, "c");
		assertEquals(Arrays.asList(1, 3, 5), Lists.newArrayList(dict.keySet()));
		assertEquals(Arrays.asList("a", "c", "e"), Lists.newArrayList(dict.values()));
		assertEquals(Arrays.asList(5, 3, 1), Lists.newArrayList(dict.descendingKeys()));
		assertEquals(Arrays.asList("e", "c", "a"), Lists.newArrayList(dict.values().reversed()));
		assertEquals(Integer.valueOf(1), dict.firstKey());
		assertEquals(Integer.valueOf(5), dict.lastKey());
		assertEquals("SortedDict{1=a, 3=c, 5=e}", dict.toString());
		assertNull(dict.comparator());

		assertEquals("c", dict.put(3, "C"));
		assertEquals(Arrays.asList(1, 3, 5), Lists.newArrayList(dict.keySet()));
		assertEquals("C", dict.require(3));
	}

	/** Random insertions and removals keep the same key order as a {@link TreeMap} */
	@Test
	public void orderMatchesTreeMap() {
		Random random = new Random(1019);
		SortedDict<Integer, Integer> dict = new SortedDict<>();
		TreeMap<Integer, Integer> expected = new TreeMap<>();
		for (int i = 0; i < 2000; i++) {
			int key = random.nextInt(200);
			if (random.nextInt(3) == 0)
				assertEquals(expected.remove(key), dict.remove(key));
			else
				assertEquals(expected.put(key, i), dict.put(key, i));
		}
		assertEquals(new ArrayList<>(expected.keySet()), Lists.newArrayList(dict.keySet()));
		assertEquals(new ArrayList<>(expected.values()), Lists.newArrayList(dict.values()));
		assertEquals(expected, dict);
	}

	/** Tests a custom comparator, including stable insertion of keys that compare equal */
	@Test
	public void customOrdering() {
		SortedDict<String, Integer> dict = new SortedDict<>(Comparator.comparing(String::length));
		dict.put("ccc", 3);
		dict.put("a", 1);
		dict.put("bb", 2);
		dict.put("b", 1);
		assertEquals(Arrays.asList("a", "b", "bb", "ccc"), Lists.newArrayList(dict.keySet()));

		SortedDict<String, Integer> reverse = new SortedDict<>(Comparator.reverseOrder(), ImmutableMap.of("x", 1, "z", 2, "y", 3));
		assertEquals(Arrays.asList("z", "y", "x"), Lists.newArrayList(reverse.keySet()));
	}

	/** Keys that cannot be compared are rejected without changing the map */
	@Test
	public void incomparableKeys() {
		SortedDict<Object, String> dict = new SortedDict<>();
		dict.put(1, "one");
		try {
			dict.put("two", "two");
			fail("Expected an exception");
		} catch (OrderingException e) {
			assertEquals("two", e.getKey());
			assertTrue(e instanceof ClassCastException);
		}
		assertEquals(1, dict.size());
		assertFalse(dict.containsKey("two"));

		SortedDict<Object, String> empty = new SortedDict<>();
		try {
			empty.put(new Object(), "x");
			fail("Expected an exception");
		} catch (OrderingException e) {
			// Expected
		}
		assertTrue(empty.isEmpty());
	}

	/** putAll validates every new key before modifying the map */
	@Test
	public void putAllIsAtomic() {
		SortedDict<Object, String> dict = new SortedDict<>();
		dict.put(2, "two");
		Map<Object, String> batch = new LinkedHashMap<>();
		batch.put(2, "TWO");
		batch.put(1, "one");
		batch.put("three", "three");
		try {
			dict.putAll(batch);
			fail("Expected an exception");
		} catch (OrderingException e) {
			// Expected
		}
		assertEquals(ImmutableMap.of(2, "two"), dict);

		batch.remove("three");
		dict.putAll(batch);
		assertEquals(Arrays.asList(1, 2), Lists.newArrayList(dict.keySet()));
		assertEquals("TWO", dict.get(2));
	}

	/** Tests require, pop and popLastEntry */
	@Test
	public void lookupsAndRemoval() {
		SortedDict<String, Integer> dict = new SortedDict<>(ImmutableMap.of("b", 2, "a", 1, "c", 3));
		try {
			dict.require("z");
			fail("Expected an exception");
		} catch (KeyMissingException e) {
			assertEquals("z", e.getKey());
			assertFalse(LookupFailure.isIndexFailure(e));
		}
		assertNull(dict.get("z"));

		Map.Entry<String, Integer> last = dict.popLastEntry();
		assertEquals("c", last.getKey());
		assertEquals(Integer.valueOf(3), last.getValue());
		assertEquals(Integer.valueOf(2), dict.pop("b"));
		assertEquals(Integer.valueOf(-1), dict.pop("b", -1));
		try {
			dict.pop("b");
			fail("Expected an exception");
		} catch (KeyMissingException e) {
			assertEquals("b", e.getKey());
		}
		assertEquals(Integer.valueOf(1), dict.popLastEntry().getValue());
		try {
			dict.popLastEntry();
			fail("Expected an exception");
		} catch (KeyMissingException e) {
			assertTrue(LookupFailure.isKeyFailure(e));
		}
	}

	/** Null values are allowed and distinguishable from missing keys */
	@Test
	public void nullValues() {
		SortedDict<String, Integer> dict = new SortedDict<>();
		dict.put("k", null);
		assertTrue(dict.containsKey("k"));
		assertNull(dict.require("k"));
		assertEquals(1, dict.size());
	}

	/** Tests copies and fromKeys */
	@Test
	public void copies() {
		SortedDict<Integer, List<String>> dict = new SortedDict<>();
		dict.put(2, new ArrayList<>(Arrays.asList("b")));
		dict.put(1, new ArrayList<>(Arrays.asList("a")));

		SortedDict<Integer, List<String>> copy = dict.copy();
		assertEquals(dict, copy);
		assertEquals(Arrays.asList(1, 2), Lists.newArrayList(copy.keySet()));
		assertSame(dict.get(1), copy.get(1));
		copy.put(0, new ArrayList<>());
		assertEquals(2, dict.size());

		SortedDict<Integer, List<String>> deep = dict.deepCopy(list -> new ArrayList<>(list));
		assertEquals(dict, deep);
		assertNotSame(dict.get(1), deep.get(1));

		SortedDict<String, Boolean> flags = SortedDict.fromKeys(Arrays.asList("y", "x"), true);
		assertEquals("SortedDict{x=true, y=true}", flags.toString());
	}

	/** The views reflect and write through to the map */
	@Test
	public void liveViews() {
		SortedDict<Integer, String> dict = new SortedDict<>(ImmutableMap.of(1, "a", 2, "b", 3, "c", 4, "d"));
		SortedDict<Integer, String>.KeysView keys = dict.keySet();
		dict.put(0, "z");
		assertEquals(5, keys.size());
		assertEquals(Integer.valueOf(0), keys.iterator().next());

		assertTrue(keys.remove(2));
		assertFalse(dict.containsKey(2));
		assertTrue(dict.entrySet().remove(new AbstractMap.SimpleEntry<>(3, "c")));
		assertFalse(dict.entrySet().remove(new AbstractMap.SimpleEntry<>(4, "x")));
		assertEquals(Arrays.asList(0, 1, 4), Lists.newArrayList(keys));

		for (Map.Entry<Integer, String> entry : dict.entrySet())
			entry.setValue(entry.getValue().toUpperCase());
		assertEquals("SortedDict{0=Z, 1=A, 4=D}", dict.toString());

		Iterator<Integer> descending = keys.descendingIterator();
		while (descending.hasNext()) {
			if (descending.next() > 0)
				descending.remove();
		}
		assertEquals(Arrays.asList(0), Lists.newArrayList(keys));

		dict.values().clear();
		assertTrue(dict.isEmpty());
	}

	/** Iterators fail fast when the map changes structurally */
	@Test
	public void failFastIteration() {
		SortedDict<Integer, String> dict = new SortedDict<>(ImmutableMap.of(1, "a", 2, "b"));
		Iterator<Integer> iter = dict.keySet().iterator();
		iter.next();
		dict.put(3, "c");
		try {
			iter.next();
			fail("Expected an exception");
		} catch (ConcurrentModificationException e) {
			// Expected
		}
	}
}
