package org.framekit;

import org.framekit.assoc.ChainMapProxyTest;
import org.framekit.assoc.SortedDictTest;
import org.framekit.assoc.WeakKeyDefaultDictionaryTest;
import org.framekit.assoc.WeakValueDefaultDictionaryTest;
import org.framekit.collect.OrderedSetTest;
import org.framekit.collect.OrderedWeakSetTest;
import org.framekit.util.ReclaimableReferenceTest;
import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

/** Runs all unit tests in the FrameKit collections project. */
@RunWith(Suite.class)
@SuiteClasses({ //
	ReclaimableReferenceTest.class, //
	OrderedSetTest.class, //
	OrderedWeakSetTest.class, //
	SortedDictTest.class, //
	ChainMapProxyTest.class, //
	WeakKeyDefaultDictionaryTest.class, //
	WeakValueDefaultDictionaryTest.class
})
public class FrameKitTests {
}
