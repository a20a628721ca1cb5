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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.locks.LockSupport;

/**
 * A parked acquisition. The same instance is referenced by the {@link WaitQueue} (for ordered
 * wake-up) and by the parked caller (to cancel itself): both sides observe a single {@link #state}.
 * <p>
 * The state only ever leaves {@link #STATE_WAITING} once, through a CAS, which makes the
 * wake-up a single-use notification and cancellation an O(1) operation that never touches the queue.
 */
final class Waiter {

	static final int STATE_WAITING   = 0;
	static final int STATE_NOTIFIED  = 1;
	static final int STATE_CANCELLED = 2;
	static final int STATE_CLOSED    = 3;

	final long   sequence;
	final Thread thread;
	final long   enqueuedAt;

	volatile int state;
	static final AtomicIntegerFieldUpdater<Waiter> STATE =
			AtomicIntegerFieldUpdater.newUpdater(Waiter.class, "state");

	Waiter(long sequence, Thread thread, long enqueuedAt) {
		this.sequence = sequence;
		this.thread = thread;
		this.enqueuedAt = enqueuedAt;
	}

	/**
	 * Wake the parked caller up, if it is still waiting.
	 *
	 * @return true if this call consumed the waiter, false if it had already been cancelled or closed
	 */
	boolean notifyAvailable() {
		if (STATE.compareAndSet(this, STATE_WAITING, STATE_NOTIFIED)) {
			LockSupport.unpark(thread);
			return true;
		}
		return false;
	}

	/**
	 * Wake the parked caller up with the information that the pool has been closed.
	 *
	 * @return true if this call consumed the waiter
	 */
	boolean notifyClosed() {
		if (STATE.compareAndSet(this, STATE_WAITING, STATE_CLOSED)) {
			LockSupport.unpark(thread);
			return true;
		}
		return false;
	}

	/**
	 * Flip the waiter to cancelled, from the caller's own thread (eg. on timeout).
	 *
	 * @return true if cancelled, false if a notification won the race (see {@link #state})
	 */
	boolean cancel() {
		return STATE.compareAndSet(this, STATE_WAITING, STATE_CANCELLED);
	}

	boolean isCancelled() {
		return state == STATE_CANCELLED;
	}

	/**
	 * Park the calling thread until the state leaves {@link #STATE_WAITING} or the deadline passes.
	 * Interrupts are cleared so that parking goes on, and reported to the caller which restores them.
	 *
	 * @param deadlineNanos the {@link System#nanoTime()} deadline, {@link Long#MAX_VALUE} for none
	 * @return true if the thread was interrupted while parked
	 */
	boolean park(long deadlineNanos) {
		boolean interrupted = false;
		for (;;) {
			if (state != STATE_WAITING) {
				return interrupted;
			}
			if (deadlineNanos == Long.MAX_VALUE) {
				LockSupport.park(this);
			}
			else {
				long remaining = deadlineNanos - System.nanoTime();
				if (remaining <= 0L) {
					return interrupted;
				}
				LockSupport.parkNanos(this, remaining);
			}
			if (Thread.interrupted()) {
				interrupted = true;
			}
		}
	}

	@Override
	public String toString() {
		return "Waiter{sequence=" + sequence + ", state=" + state + "}";
	}
}
