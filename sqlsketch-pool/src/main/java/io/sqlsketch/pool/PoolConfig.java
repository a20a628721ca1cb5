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

import java.time.Clock;
import java.time.Duration;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * A representation of the configuration options of a {@link ConnectionPool}.
 * For a default implementation that is open for extension, see {@link DefaultPoolConfig}.
 * Configurations are immutable once built.
 *
 * @param <C> the type of {@link Connection} in the pool
 */
public interface PoolConfig<C extends Connection> {

	/**
	 * The {@link Driver} that establishes new connections.
	 */
	Driver<C> driver();

	/**
	 * The driver-specific connection configuration passed to {@link Driver#connect(String)}, eg. a connection URL.
	 */
	String connectionConfig();

	/**
	 * The number of connections eagerly established when the pool is built.
	 */
	int minSize();

	/**
	 * The maximum number of live connections (idle, checked out or being established) the pool allows.
	 */
	int maxSize();

	/**
	 * The idle time past which a connection is {@link Connection#validate() validated} before being handed out.
	 * {@link Duration#ZERO} disables health checking.
	 */
	Duration healthCheckInterval();

	/**
	 * The timeout applied by {@link ConnectionPool#acquire()}. {@link Duration#ZERO} means waiting without deadline.
	 */
	Duration acquireTimeout();

	/**
	 * The number of fast-path retries, separated by a {@link Thread#yield()}, attempted before a caller parks.
	 * {@code 0} parks right after the first miss.
	 */
	int spinLimit();

	/**
	 * The maximum number of parked acquisitions before failing fast with a {@link PoolAcquirePendingLimitException}.
	 * 0 will immediately fail any acquire that would need to park. Use a negative number to deactivate.
	 */
	int maxPending();

	/**
	 * The {@link PoolMetricsRecorder} to use to collect instrumentation data of the {@link ConnectionPool}.
	 */
	PoolMetricsRecorder metricsRecorder();

	/**
	 * The {@link Clock} to use to timestamp connection lifecycle events like establishment and release,
	 * which drive health checking and the idle/lifetime measurements.
	 */
	Clock clock();

	/**
	 * The {@link Scheduler} on which {@link ConnectionPool#acquireAsync(Duration)} runs the blocking acquisition.
	 * Defaults to {@link Schedulers#boundedElastic()}.
	 */
	default Scheduler acquisitionScheduler() {
		return Schedulers.boundedElastic();
	}
}
