package org.framekit.assoc;

/** Thrown when a key cannot be ordered against the keys of a sorted container */
public class OrderingException extends ClassCastException {
	private static final long serialVersionUID = 1L;

	private final transient Object theKey;

	/**
	 * @param key The key that could not be ordered, or null if the offending key is not known
	 * @param cause The failure of the comparison
	 */
	public OrderingException(Object key, RuntimeException cause) {
		super(key == null ? "Keys are not mutually comparable" : "Key " + key + " is not comparable with the keys present");
		theKey = key;
		initCause(cause);
	}

	/** @return The key that could not be ordered, or null if the offending key is not known */
	public Object getKey() {
		return theKey;
	}
}
