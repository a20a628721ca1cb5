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

import java.time.Duration;

/**
 * A {@link RuntimeException} that denotes that a {@link ConnectionPool#acquire(Duration)}
 * has timed out. Said {@link Duration} can be obtained via {@link #getAcquireTimeout()}.
 * <p>
 * The timeout is local to the caller: the pool is left untouched and the acquisition can simply be retried.
 */
public class PoolAcquireTimeoutException extends RuntimeException {

	private final Duration acquireTimeout;

	public PoolAcquireTimeoutException(Duration acquireTimeout, int allocated, int maxAllocated) {
		super("ConnectionPool#acquire(Duration) has been pending for more than the configured timeout of "
				+ acquireTimeout.toMillis() + "ms (pool exhausted: " + allocated + "/" + maxAllocated + " connections in use)");
		this.acquireTimeout = acquireTimeout;
	}

	/**
	 * @return the acquire timeout that was just overshot
	 */
	public Duration getAcquireTimeout() {
		return acquireTimeout;
	}
}
