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

/**
 * A default {@link PoolConfig} that can be extended to bear more configuration options
 * with access to a copy constructor for the basic options.
 *
 * @param <C> the type of {@link Connection} in the pool
 */
public class DefaultPoolConfig<C extends Connection> implements PoolConfig<C> {

	protected final Driver<C>           driver;
	protected final String              connectionConfig;
	protected final int                 minSize;
	protected final int                 maxSize;
	protected final Duration            healthCheckInterval;
	protected final Duration            acquireTimeout;
	protected final int                 spinLimit;
	protected final int                 maxPending;
	protected final PoolMetricsRecorder metricsRecorder;
	protected final Clock               clock;
	protected final Scheduler           acquisitionScheduler;

	public DefaultPoolConfig(Driver<C> driver,
			String connectionConfig,
			int minSize,
			int maxSize,
			Duration healthCheckInterval,
			Duration acquireTimeout,
			int spinLimit,
			int maxPending,
			PoolMetricsRecorder metricsRecorder,
			Clock clock,
			Scheduler acquisitionScheduler) {
		this.driver = driver;
		this.connectionConfig = connectionConfig;
		this.minSize = minSize;
		this.maxSize = maxSize;
		this.healthCheckInterval = healthCheckInterval;
		this.acquireTimeout = acquireTimeout;
		this.spinLimit = spinLimit;
		this.maxPending = maxPending;
		this.metricsRecorder = metricsRecorder;
		this.clock = clock;
		this.acquisitionScheduler = acquisitionScheduler;
	}

	/**
	 * Copy constructor for the benefit of specializations of {@link PoolConfig}.
	 *
	 * @param toCopy the original {@link PoolConfig} to copy (only standard {@link PoolConfig}
	 * options are copied)
	 */
	protected DefaultPoolConfig(PoolConfig<C> toCopy) {
		this.driver = toCopy.driver();
		this.connectionConfig = toCopy.connectionConfig();
		this.minSize = toCopy.minSize();
		this.maxSize = toCopy.maxSize();
		this.healthCheckInterval = toCopy.healthCheckInterval();
		this.acquireTimeout = toCopy.acquireTimeout();
		this.spinLimit = toCopy.spinLimit();
		this.maxPending = toCopy.maxPending();
		this.metricsRecorder = toCopy.metricsRecorder();
		this.clock = toCopy.clock();
		this.acquisitionScheduler = toCopy.acquisitionScheduler();
	}

	@Override
	public Driver<C> driver() {
		return this.driver;
	}

	@Override
	public String connectionConfig() {
		return this.connectionConfig;
	}

	@Override
	public int minSize() {
		return this.minSize;
	}

	@Override
	public int maxSize() {
		return this.maxSize;
	}

	@Override
	public Duration healthCheckInterval() {
		return this.healthCheckInterval;
	}

	@Override
	public Duration acquireTimeout() {
		return this.acquireTimeout;
	}

	@Override
	public int spinLimit() {
		return this.spinLimit;
	}

	@Override
	public int maxPending() {
		return this.maxPending;
	}

	@Override
	public PoolMetricsRecorder metricsRecorder() {
		return this.metricsRecorder;
	}

	@Override
	public Clock clock() {
		return this.clock;
	}

	@Override
	public Scheduler acquisitionScheduler() {
		return this.acquisitionScheduler;
	}
}
