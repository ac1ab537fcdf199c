package org.framekit.collect;

import java.util.NoSuchElementException;

/**
 * Classifies a failed lookup as a key (element) failure, an index (position) failure, or both. Containers that are both sets and
 * sequences throw exceptions answering true to both, so callers may handle either failure class the same way.
 */
public interface LookupFailure {
	/** @return The key or element whose lookup failed, or null if the failure was positional or the container was empty */
	Object getKey();

	/** @return Whether this failure may be treated as a missing key or element */
	boolean isKeyFailure();

	/** @return Whether this failure may be treated as an out-of-range position */
	boolean isIndexFailure();

	/**
	 * @param ex The exception to classify
	 * @return Whether the exception represents a missing key or element
	 */
	static boolean isKeyFailure(Throwable ex) {
		if (ex instanceof LookupFailure)
			return ((LookupFailure) ex).isKeyFailure();
		return ex instanceof NoSuchElementException;
	}

	/**
	 * @param ex The exception to classify
	 * @return Whether the exception represents an out-of-range position
	 */
	static boolean isIndexFailure(Throwable ex) {
		if (ex instanceof LookupFailure)
			return ((LookupFailure) ex).isIndexFailure();
		return ex instanceof IndexOutOfBoundsException;
	}
}
