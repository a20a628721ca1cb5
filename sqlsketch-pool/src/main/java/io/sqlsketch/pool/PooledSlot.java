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

/**
 * The pool's bookkeeping record around one {@link Connection}.
 * <p>
 * All mutable fields are guarded by the owning pool's lock, except while the slot is
 * {@link #inUse in use}: its holder then has exclusive access to the connection, and the
 * pool only touches the timestamps again once the slot is handed back.
 *
 * @param <C> the type of {@link Connection}
 */
final class PooledSlot<C extends Connection> {

	final C    connection;
	final long createdAt;

	boolean inUse;
	int     acquireCount;
	long    lastValidatedAt;
	long    releasedAt;

	PooledSlot(C connection, long now) {
		this.connection = connection;
		this.createdAt = now;
		this.lastValidatedAt = now;
		this.releasedAt = now;
	}

	void markAcquired() {
		this.inUse = true;
		this.acquireCount++;
	}

	void markReleased(long now) {
		this.inUse = false;
		this.releasedAt = now;
	}

	/**
	 * @return the idle time in milliseconds, measured from the last release or validation (whichever is more recent)
	 */
	long idleTime(long now) {
		return now - Math.max(releasedAt, lastValidatedAt);
	}

	long lifeTime(long now) {
		return now - createdAt;
	}

	@Override
	public String toString() {
		return "PooledSlot{connection=" + connection + ", inUse=" + inUse + ", acquireCount=" + acquireCount + "}";
	}
}
