package org.framekit.util;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.util.function.Consumer;

/**
 * Receives the references of a weak container whose referents have been reclaimed. The collector enqueues references at a time of its
 * choosing; nothing is reported until {@link #drain(Consumer)} is called, which the owning container does before each operation.
 *
 * @param <T> The type of the referents
 */
public class ReclamationQueue<T> {
	private final ReferenceQueue<T> theQueue;

	/** Creates the queue */
	public ReclamationQueue() {
		theQueue = new ReferenceQueue<>();
	}

	/** @return The queue to register references with */
	public ReferenceQueue<T> getQueue() {
		return theQueue;
	}

	/**
	 * Removes every reference enqueued so far, passing each to the given action
	 *
	 * @param onReclaimed The action to perform on each reclaimed reference
	 * @return The number of references drained
	 */
	public int drain(Consumer<? super Reference<? extends T>> onReclaimed) {
		int count = 0;
		Reference<? extends T> ref = theQueue.poll();
		while (ref != null) {
			onReclaimed.accept(ref);
			count++;
			ref = theQueue.poll();
		}
		return count;
	}

	/**
	 * Discards every reference enqueued so far
	 *
	 * @return The number of references discarded
	 */
	public int clear() {
		return drain(ref -> {
		});
	}
}
