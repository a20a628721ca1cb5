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
import java.util.Objects;
import java.util.function.Function;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * A builder for {@link ConnectionPool} implementations, which tuning methods map
 * to a {@link PoolConfig}.
 * <p>
 * Parameters are checked all at once when the pool is {@link #buildPool() built}, at which point
 * inconsistent sizes or negative durations are rejected with a {@link PoolConfigurationException}.
 *
 * @param <C> the type of {@link Connection} in the produced {@link ConnectionPool}
 */
public class PoolBuilder<C extends Connection> {

	/**
	 * Start building a {@link ConnectionPool} by describing how new connections are to be established.
	 * The {@link Driver} is invoked each time a new connection is needed, always outside of the pool's
	 * critical section, so it is fine for it to block.
	 *
	 * @param driver the backend capability establishing connections
	 * @param connectionConfig the driver-specific configuration (eg. a connection URL) passed to each {@link Driver#connect(String)}
	 * @param <C> the type of {@link Connection} pooled
	 * @return a builder of {@link ConnectionPool}
	 */
	public static <C extends Connection> PoolBuilder<C> from(Driver<C> driver, String connectionConfig) {
		return new PoolBuilder<>(driver, connectionConfig);
	}

	final Driver<C>     driver;
	final String        connectionConfig;
	int                 minSize              = DEFAULT_MIN_SIZE;
	int                 maxSize              = DEFAULT_MAX_SIZE;
	Duration            healthCheckInterval  = DEFAULT_HEALTH_CHECK_INTERVAL;
	Duration            acquireTimeout       = DEFAULT_ACQUIRE_TIMEOUT;
	int                 spinLimit            = DEFAULT_SPIN_LIMIT;
	int                 maxPending           = -1;
	PoolMetricsRecorder metricsRecorder      = NoOpPoolMetricsRecorder.INSTANCE;
	Clock               clock                = Clock.systemUTC();
	Scheduler           acquisitionScheduler = Schedulers.boundedElastic();

	PoolBuilder(Driver<C> driver, String connectionConfig) {
		this.driver = Objects.requireNonNull(driver, "driver");
		this.connectionConfig = Objects.requireNonNull(connectionConfig, "connectionConfig");
	}

	/**
	 * Let the {@link ConnectionPool} hold between {@code min} and {@code max} connections.
	 * {@code min} connections are established eagerly when the pool is built, further ones are
	 * established lazily, one at a time, when an acquisition finds no idle connection.
	 * The pool MUST NOT establish a connection that would bring the number of live connections over {@code max}.
	 * <p>
	 * Defaults to {@code sizeBetween(1, 10)}.
	 *
	 * @param min the number of connections to establish eagerly, positive or zero
	 * @param max the maximum number of live connections, greater than or equal to {@code min}
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> sizeBetween(int min, int max) {
		this.minSize = min;
		this.maxSize = max;
		return this;
	}

	/**
	 * Validate idle connections before handing them out, once they have been idle for at least
	 * {@code interval}. A connection failing validation is closed and transparently replaced.
	 * Checks are opportunistic: they only happen at acquire time, there is no background sweep.
	 * <p>
	 * {@link Duration#ZERO} disables health checking. Defaults to 60 seconds.
	 *
	 * @param interval the idle time past which a connection is validated (resolution: ms)
	 * @return this {@link ConnectionPool} builder
	 * @see #healthCheckDisabled()
	 */
	public PoolBuilder<C> healthCheckInterval(Duration interval) {
		this.healthCheckInterval = Objects.requireNonNull(interval, "interval");
		return this;
	}

	/**
	 * Disable health checking entirely: idle connections are handed out without validation.
	 *
	 * @return this {@link ConnectionPool} builder
	 * @see #healthCheckInterval(Duration)
	 */
	public PoolBuilder<C> healthCheckDisabled() {
		return healthCheckInterval(Duration.ZERO);
	}

	/**
	 * Set the timeout used by {@link ConnectionPool#acquire()} (ie. when no explicit timeout is given).
	 * {@link Duration#ZERO} lets such acquisitions wait without deadline. Defaults to 30 seconds.
	 *
	 * @param acquireTimeout the default acquisition timeout
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> acquireTimeout(Duration acquireTimeout) {
		this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
		return this;
	}

	/**
	 * Set the number of fast-path retries a contended acquisition performs, yielding between each,
	 * before it parks. Spinning resolves the common case of a connection being released by a racing
	 * caller without paying the park/unpark cost, at the price of letting late arrivals overtake
	 * already parked callers. Defaults to 10.
	 *
	 * @param spinLimit the number of retries, {@code 0} to park right away
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> spinLimit(int spinLimit) {
		this.spinLimit = spinLimit;
		return this;
	}

	/**
	 * Set the maximum number of parked acquisitions (ie. acquisitions that wait for a connection to be
	 * released, as no idle connection was available and the pool already reached its maximum size).
	 * Set to {@code 0} to immediately fail all such acquisition attempts.
	 * Set to {@code -1} to deactivate (or prefer using the more explicit {@link #maxPendingAcquireUnbounded()}).
	 * <p>
	 * Default to -1.
	 *
	 * @param maxPending the maximum number of parked acquisitions
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> maxPendingAcquire(int maxPending) {
		this.maxPending = maxPending;
		return this;
	}

	/**
	 * Uncap the number of parked acquisitions. This is the default.
	 *
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> maxPendingAcquireUnbounded() {
		this.maxPending = -1;
		return this;
	}

	/**
	 * Set up the optional {@link PoolMetricsRecorder} for {@link ConnectionPool} to use for instrumentation purposes.
	 *
	 * @param recorder the {@link PoolMetricsRecorder}
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> metricsRecorder(PoolMetricsRecorder recorder) {
		this.metricsRecorder = Objects.requireNonNull(recorder, "recorder");
		return this;
	}

	/**
	 * Set the {@link Clock} to use for timestamps, notably marking the times at which a connection is
	 * established and released. The {@link Clock#millis()} method is used for this purpose, which
	 * produces the idle times compared against the {@link #healthCheckInterval(Duration) health check interval}.
	 * <p>
	 * Acquisition timeouts are NOT driven by this clock but by {@link System#nanoTime()}.
	 *
	 * @param clock the {@link Clock} to use to measure timestamps and durations
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> clock(Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock");
		return this;
	}

	/**
	 * Provide the {@link Scheduler} on which {@link ConnectionPool#acquireAsync(Duration)} performs the
	 * (blocking) acquisition. Defaults to {@link Schedulers#boundedElastic()}.
	 *
	 * @param acquisitionScheduler the {@link Scheduler} to block on
	 * @return this {@link ConnectionPool} builder
	 */
	public PoolBuilder<C> acquisitionScheduler(Scheduler acquisitionScheduler) {
		this.acquisitionScheduler = Objects.requireNonNull(acquisitionScheduler, "acquisitionScheduler");
		return this;
	}

	/**
	 * Construct a default pool with the builder's configuration, eagerly establishing
	 * the minimum number of connections.
	 *
	 * @return a {@link ConnectionPool}
	 * @throws PoolConfigurationException if the configuration is inconsistent
	 * @throws PoolConnectException if one of the eager connections cannot be established
	 */
	public ConnectionPool<C> buildPool() {
		return new SimpleConnectionPool<>(this.buildConfig());
	}

	/**
	 * Build a custom flavor of {@link ConnectionPool}, given a factory {@link Function} that
	 * is provided with a {@link PoolConfig} copy of this builder's configuration.
	 *
	 * @param poolFactory the factory of pool implementation
	 * @param <P> the type of pool produced
	 * @return the {@link ConnectionPool}
	 */
	public <P extends ConnectionPool<C>> P build(Function<? super PoolConfig<C>, P> poolFactory) {
		return poolFactory.apply(buildConfig());
	}

	//kept package-private for the benefit of tests
	PoolConfig<C> buildConfig() {
		if (minSize < 0) {
			throw new PoolConfigurationException("minSize must be positive or zero, got " + minSize);
		}
		if (maxSize < 1) {
			throw new PoolConfigurationException("maxSize must be strictly positive, got " + maxSize);
		}
		if (maxSize < minSize) {
			throw new PoolConfigurationException("maxSize must be greater than or equal to minSize, got maxSize="
					+ maxSize + ", minSize=" + minSize);
		}
		if (healthCheckInterval.isNegative()) {
			throw new PoolConfigurationException("healthCheckInterval must be positive or zero, got " + healthCheckInterval);
		}
		if (acquireTimeout.isNegative()) {
			throw new PoolConfigurationException("acquireTimeout must be positive or zero, got " + acquireTimeout);
		}
		if (spinLimit < 0) {
			throw new PoolConfigurationException("spinLimit must be positive or zero, got " + spinLimit);
		}
		return new DefaultPoolConfig<>(driver,
				connectionConfig,
				minSize,
				maxSize,
				healthCheckInterval,
				acquireTimeout,
				spinLimit,
				maxPending < 0 ? -1 : maxPending,
				metricsRecorder,
				clock,
				acquisitionScheduler);
	}

	static final int      DEFAULT_MIN_SIZE              = 1;
	static final int      DEFAULT_MAX_SIZE              = 10;
	static final int      DEFAULT_SPIN_LIMIT            = 10;
	static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(60);
	static final Duration DEFAULT_ACQUIRE_TIMEOUT       = Duration.ofSeconds(30);
}
