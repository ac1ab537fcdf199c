package org.framekit.collect;

import java.util.NoSuchElementException;

/** Thrown when a key or element whose presence was required is absent */
public class KeyMissingException extends NoSuchElementException implements LookupFailure {
	private static final long serialVersionUID = 1L;

	private final transient Object theKey;

	/** @param key The key that was not found */
	public KeyMissingException(Object key) {
		this(key, String.valueOf(key));
	}

	/**
	 * @param key The key that was not found
	 * @param message The exception message
	 */
	public KeyMissingException(Object key, String message) {
		super(message);
		theKey = key;
	}

	@Override
	public Object getKey() {
		return theKey;
	}

	@Override
	public boolean isKeyFailure() {
		return true;
	}

	@Override
	public boolean isIndexFailure() {
		return false;
	}
}
