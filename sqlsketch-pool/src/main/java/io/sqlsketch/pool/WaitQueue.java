/*
 * Copyright (c) 2026 The sqlsketch-pool Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.sqlsketch.pool;

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.jspecify.annotations.Nullable;

/**
 * The queue of parked acquisitions, ordered by {@link Waiter#sequence registration sequence}.
 * <p>
 * Cancelled waiters are never searched for: {@link #cancel(Waiter)} only flips the waiter's own
 * state, and the entry is discarded when it reaches the head of the heap. Each entry is thus
 * popped exactly once over its lifetime, which keeps cancellation O(1) whatever the depth of the queue.
 * <p>
 * Apart from {@link #cancel(Waiter)} and {@link #liveSize()}, methods MUST be called while holding the pool's lock.
 */
final class WaitQueue {

	/**
	 * Below this size, cancelled entries are only ever discarded from the head of the heap.
	 */
	static final int COMPACTION_THRESHOLD = 64;

	static final Comparator<Waiter> BY_SEQUENCE = Comparator.comparingLong(w -> w.sequence);

	final PriorityQueue<Waiter> heap = new PriorityQueue<>(BY_SEQUENCE);

	volatile int liveSize;
	static final AtomicIntegerFieldUpdater<WaitQueue> LIVE_SIZE =
			AtomicIntegerFieldUpdater.newUpdater(WaitQueue.class, "liveSize");

	void offer(Waiter waiter) {
		maybeCompact();
		heap.offer(waiter);
		LIVE_SIZE.incrementAndGet(this);
	}

	/**
	 * Cancel a waiter in O(1), without touching the heap. Can be called without holding the lock.
	 *
	 * @return true if the waiter was cancelled, false if it had already been notified or closed
	 */
	boolean cancel(Waiter waiter) {
		if (waiter.cancel()) {
			LIVE_SIZE.decrementAndGet(this);
			return true;
		}
		return false;
	}

	/**
	 * Pop entries in sequence order, silently discarding cancelled ones, until one can be notified.
	 *
	 * @return the notified waiter, or null if no live waiter remains
	 */
	@Nullable
	Waiter pollLive() {
		Waiter waiter;
		while ((waiter = heap.poll()) != null) {
			if (waiter.notifyAvailable()) {
				LIVE_SIZE.decrementAndGet(this);
				return waiter;
			}
		}
		return null;
	}

	/**
	 * Empty the queue, notifying every live waiter that the pool is closed.
	 *
	 * @return the number of waiters that were notified
	 */
	int drainClosed() {
		int notified = 0;
		Waiter waiter;
		while ((waiter = heap.poll()) != null) {
			if (waiter.notifyClosed()) {
				LIVE_SIZE.decrementAndGet(this);
				notified++;
			}
		}
		return notified;
	}

	/**
	 * @return the number of waiters that are neither cancelled nor notified yet
	 */
	int liveSize() {
		return liveSize;
	}

	/**
	 * @return the physical size of the heap, including cancelled entries not discarded yet
	 */
	int size() {
		return heap.size();
	}

	void maybeCompact() {
		int size = heap.size();
		if (size >= COMPACTION_THRESHOLD && (size - liveSize) * 2 > size) {
			heap.removeIf(Waiter::isCancelled);
		}
	}
}
