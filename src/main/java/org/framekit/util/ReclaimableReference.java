package org.framekit.util;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;

/**
 * <p>
 * A {@link WeakReference weak reference} that can be stored in hashed collections in place of its referent. While both referents are
 * alive, two references are equal if their referents are {@link Object#equals(Object) equal}. Once a referent has been reclaimed, its
 * reference is only equal to itself.
 * </p>
 * <p>
 * The referent's hash code is captured on creation so that a cleared reference can still be found (by identity) and removed from the
 * collection holding it.
 * </p>
 *
 * @param <T> The type of the referent
 */
public class ReclaimableReference<T> extends WeakReference<T> {
	private final int theHash;

	/**
	 * Creates a reference that is not registered with any queue, e.g. to search a collection for a live value
	 *
	 * @param referent The value to reference
	 */
	public ReclaimableReference(T referent) {
		super(referent);
		theHash = referent.hashCode();
	}

	/**
	 * @param referent The value to reference
	 * @param queue The queue to enqueue this reference into when its referent is reclaimed
	 */
	public ReclaimableReference(T referent, ReferenceQueue<? super T> queue) {
		super(referent, queue);
		theHash = referent.hashCode();
	}

	/** @return Whether this reference's referent has been reclaimed */
	public boolean isReclaimed() {
		return get() == null;
	}

	@Override
	public int hashCode() {
		return theHash;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof ReclaimableReference) || theHash != obj.hashCode())
			return false;
		T value = get();
		Object other = ((ReclaimableReference<?>) obj).get();
		return value != null && other != null && value.equals(other);
	}

	@Override
	public String toString() {
		T value = get();
		return value == null ? "<reclaimed>" : value.toString();
	}
}
