package org.framekit.collect;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.lang.ref.WeakReference;
import java.util.Arrays;
import java.util.Iterator;

import org.framekit.util.ReclamationTesting;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.google.common.collect.Lists;

/** Tests {@link OrderedWeakSet} */
public class OrderedWeakSetTest {
	/** Tests ordering and positional access while every element is alive */
	@Test
	public void liveElements() {
		Token a = new Token("a");
		Token b = new Token("b");
		Token c = new Token("c");
		OrderedWeakSet<Token> set = new OrderedWeakSet<>(Arrays.asList(a, b, a, c));
		assertEquals(3, set.size());
		assertFalse(set.add(b));
		assertEquals(Arrays.asList(a, b, c), Lists.newArrayList(set));
		assertEquals(Arrays.asList(c, b, a), Lists.newArrayList(set.reversed()));
		assertSame(b, set.get(1));
		assertSame(c, set.get(-1));
		assertEquals(2, set.index(c));
		assertEquals(-1, set.indexOf(new Token("a")));
		assertEquals("OrderedWeakSet[a, b, c]", set.toString());

		OrderedWeakSet<Token> slice = set.slice(null, null, -1);
		assertEquals(Arrays.asList(c, b, a), Lists.newArrayList(slice));
		assertEquals(Arrays.asList(b, c), Lists.newArrayList(set.slice(1, 5)));

		assertSame(a, set.removeAt(0));
		assertEquals(0, set.index(b));
		set.discard(b);
		assertFalse(set.contains(b));
		assertEquals(Arrays.asList(c), Lists.newArrayList(set));
	}

	/** Nulls are rejected on insertion and never found */
	@Test
	public void nulls() {
		OrderedWeakSet<Token> set = new OrderedWeakSet<>();
		try {
			set.add(null);
			fail("Expected an exception");
		} catch (NullPointerException e) {
			// Expected
		}
		assertFalse(set.contains(null));
		assertFalse(set.remove(null));
		assertEquals(-1, set.indexOf(null));
	}

	/** Tests positional failures */
	@Test
	public void positionalFailures() {
		Token a = new Token("a");
		OrderedWeakSet<Token> set = new OrderedWeakSet<>(Arrays.asList(a));
		try {
			set.get(1);
			fail("Expected an exception");
		} catch (OrderedSetIndexException e) {
			assertTrue(e.isIndexFailure() && e.isKeyFailure());
		}
		set.clear();
		try {
			set.removeAt(0);
			fail("Expected an exception");
		} catch (OrderedSetIndexException e) {
			assertTrue(LookupFailure.isKeyFailure(e));
		}
		try {
			set.index(a);
			fail("Expected an exception");
		} catch (KeyMissingException e) {
			assertSame(a, e.getKey());
		}
	}

	/** A reclaimed element disappears and the survivors keep their order and positions */
	@Test
	public void reclaimedElementDisappears() {
		Token a = new Token("a");
		Token c = new Token("c");
		OrderedWeakSet<Token> set = new OrderedWeakSet<>();
		set.add(a);
		WeakReference<Token> probe = addTransient(set, "b");
		set.add(c);

		ReclamationTesting.assumeReclaimed(probe);
		assertEquals(2, set.size());
		assertEquals(Arrays.asList(a, c), Lists.newArrayList(set));
		assertSame(c, set.get(1));
		assertEquals(1, set.index(c));
		assertEquals("OrderedWeakSet[a, c]", set.toString());
	}

	/** Each reclaimed element is reported as removed exactly once, whether it was swept or taken from the queue */
	@Test
	public void reclamationIsCountedOnce() throws InterruptedException {
		Logger logger = (Logger) LoggerFactory.getLogger(OrderedWeakSet.class);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		try {
			Token kept = new Token("kept");
			OrderedWeakSet<Token> set = new OrderedWeakSet<>();
			set.add(kept);
			WeakReference<Token> reclaimed = addTransient(set, "transient");
			ReclamationTesting.assumeReclaimed(reclaimed);

			// Give the collector time to enqueue the cleared reference after the sweep has removed it
			for (int i = 0; i < 20; i++) {
				assertEquals(1, set.size());
				System.gc();
				Thread.sleep(10);
			}
			assertTrue(set.contains(kept));

			int removed = 0;
			for (ILoggingEvent event : appender.list)
				removed += ((Number) event.getArgumentArray()[0]).intValue();
			assertEquals(1, removed);
		} finally {
			logger.detachAppender(appender);
			appender.stop();
		}
	}

	/** Iteration traverses a snapshot and supports removal */
	@Test
	public void iteration() {
		Token a = new Token("a");
		Token b = new Token("b");
		Token c = new Token("c");
		OrderedWeakSet<Token> set = new OrderedWeakSet<>(Arrays.asList(a, b, c));
		Iterator<Token> iter = set.iterator();
		assertSame(a, iter.next());
		set.add(new Token("d"));
		assertSame(b, iter.next());
		iter.remove();
		assertSame(c, iter.next());
		assertFalse(iter.hasNext());
		assertFalse(set.contains(b));
		assertEquals(1, set.index(c));
	}

	private static WeakReference<Token> addTransient(OrderedWeakSet<Token> set, String name) {
		Token token = new Token(name);
		set.add(token);
		return new WeakReference<>(token);
	}

	static class Token {
		private final String theName;

		Token(String name) {
			theName = name;
		}

		@Override
		public String toString() {
			return theName;
		}
	}
}
