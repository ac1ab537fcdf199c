package org.framekit.collect;

/**
 * Thrown by {@link IndexedSet} operations whose failure is equally a missing element and an out-of-range position, e.g. popping from an
 * empty set or removing an element that is not present. {@link #isKeyFailure()} and {@link #isIndexFailure()} both return true.
 */
public class OrderedSetIndexException extends IndexOutOfBoundsException implements LookupFailure {
	private static final long serialVersionUID = 1L;

	private final transient Object theKey;

	/**
	 * @param key The element that was not found, or null for a positional failure
	 * @param message The exception message
	 */
	public OrderedSetIndexException(Object key, String message) {
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
		return true;
	}

	/**
	 * @param index The requested index
	 * @param size The size of the set
	 * @return The exception to throw
	 */
	public static OrderedSetIndexException outOfRange(int index, int size) {
		return new OrderedSetIndexException(null, "Index " + index + " out of range for size " + size);
	}

	/**
	 * @param operation The name of the operation attempted
	 * @return The exception to throw
	 */
	public static OrderedSetIndexException empty(String operation) {
		return new OrderedSetIndexException(null, operation + " from an empty set");
	}

	/**
	 * @param element The element that was not found
	 * @return The exception to throw
	 */
	public static OrderedSetIndexException missing(Object element) {
		return new OrderedSetIndexException(element, element + " not in set");
	}
}
