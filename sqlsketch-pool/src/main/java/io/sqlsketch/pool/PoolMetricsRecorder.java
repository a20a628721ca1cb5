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
 * An interface representing ways for {@link ConnectionPool} to collect instrumentation data.
 * <p>
 * Note this doesn't include the concepts of measuring timings, which should be the
 * responsibility of a {@link java.time.Clock}. These callbacks are invoked outside of the pool's
 * critical section, but on the hot path nonetheless: implementations should be cheap.
 */
public interface PoolMetricsRecorder {

	/**
	 * Record a latency for successful connection establishment. Implies incrementing an allocation success counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationSuccessAndLatency(long latencyMs);

	/**
	 * Record a latency for failed connection establishment. Implies incrementing an allocation failure counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationFailureAndLatency(long latencyMs);

	/**
	 * Record a latency for closing a connection. Implies incrementing a counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordDestroyLatency(long latencyMs);

	/**
	 * Record the number of milliseconds a connection has been live (ie time between establishment and destruction).
	 * @param millisecondsSinceAllocation the number of milliseconds since the connection was established, at the time it is destroyed
	 */
	void recordLifetimeDuration(long millisecondsSinceAllocation);

	/**
	 * Record the number of milliseconds a connection had been idle when it gets pulled from the pool and passed to a caller.
	 * @param millisecondsIdle the number of milliseconds a connection that was just acquired had previously been idle
	 */
	void recordIdleTime(long millisecondsIdle);

	/**
	 * Record the fact that an acquisition was served without waiting.
	 */
	void recordFastPath();

	/**
	 * Record the fact that an acquisition was served after spinning or parking.
	 */
	void recordSlowPath();

	/**
	 * Record a latency for an acquisition that had to wait and was eventually served.
	 * @param latencyMs the latency in milliseconds
	 */
	default void recordPendingSuccessAndLatency(long latencyMs) {
		// noop
	}

	/**
	 * Record a latency for an acquisition that had to wait and failed, eg. with a {@link PoolAcquireTimeoutException}.
	 * @param latencyMs the latency in milliseconds
	 */
	default void recordPendingFailureAndLatency(long latencyMs) {
		// noop
	}

	/**
	 * Record the fact that an idle connection failed its health check and was discarded.
	 */
	default void recordValidationFailure() {
		// noop
	}
}
