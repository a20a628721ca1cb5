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
import java.util.function.Function;

import org.reactivestreams.Publisher;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A bounded pool of {@link Connection connections} to a backend data store.
 * <p>
 * Connections are checked out with {@link #acquire()} and MUST be handed back with
 * {@link #release(Connection)}, or used within the scope of {@link #withConnection(Function)}
 * which releases automatically. When no connection is idle and the pool cannot grow, callers briefly
 * spin then park until a connection is released, their timeout elapses or the pool is {@link #close() closed}.
 *
 * @param <C> the type of {@link Connection} in the pool
 */
public interface ConnectionPool<C extends Connection> extends Disposable, AutoCloseable {

	/**
	 * Acquire a connection with the {@link PoolConfig#acquireTimeout() configured default timeout}.
	 *
	 * @return a checked-out connection, which the caller is responsible for {@link #release(Connection) releasing}
	 * @throws PoolAcquireTimeoutException if no connection could be obtained in time
	 * @throws PoolShutdownException if the pool is or gets closed
	 * @throws PoolConnectException if this call had to establish a new connection and that failed
	 * @see #acquire(Duration)
	 */
	C acquire();

	/**
	 * Acquire a connection, waiting at most {@code timeout} if none is immediately available.
	 * <p>
	 * Idle connections are reused first (least recently released first). If there is none and the
	 * pool is under its maximum size, a new connection is established by the calling thread. Otherwise the
	 * caller retries a few times, yielding in between, then parks. A parked caller is woken when a connection
	 * is released, but it still has to compete for it: a caller that is just arriving may get it first.
	 * Parked callers are woken in approximate registration order.
	 * <p>
	 * Interrupting the caller does not abort the wait. The interrupt status is restored once this method
	 * returns or throws.
	 *
	 * @param timeout the maximum time to wait, {@link Duration#ZERO} to wait without deadline
	 * @return a checked-out connection, which the caller is responsible for {@link #release(Connection) releasing}
	 * @throws IllegalArgumentException if the timeout is negative
	 * @throws PoolAcquireTimeoutException if no connection could be obtained in time
	 * @throws PoolShutdownException if the pool is or gets closed
	 * @throws PoolConnectException if this call had to establish a new connection and that failed
	 * @throws PoolAcquirePendingLimitException if parking would exceed the {@link PoolConfig#maxPending() pending limit}
	 */
	C acquire(Duration timeout);

	/**
	 * Hand a previously {@link #acquire() acquired} connection back to the pool, waking at most one parked caller.
	 * <p>
	 * Releasing a connection twice, or a connection that doesn't belong to this pool, is a programming
	 * error that is logged as a warning but otherwise ignored.
	 *
	 * @param connection the connection to release
	 */
	void release(C connection);

	/**
	 * Acquire a connection, apply the {@code scope} function to it and release the connection, whatever
	 * the outcome of the function (including a thrown exception).
	 *
	 * @param scope the function using the connection
	 * @param <R> the type of result
	 * @return the result of the scope function
	 */
	default <R> R withConnection(Function<? super C, ? extends R> scope) {
		return withConnection(config().acquireTimeout(), scope);
	}

	/**
	 * Acquire a connection with the given timeout, apply the {@code scope} function to it and release
	 * the connection, whatever the outcome of the function (including a thrown exception).
	 *
	 * @param timeout the maximum time to wait for a connection, {@link Duration#ZERO} to wait without deadline
	 * @param scope the function using the connection
	 * @param <R> the type of result
	 * @return the result of the scope function
	 */
	default <R> R withConnection(Duration timeout, Function<? super C, ? extends R> scope) {
		C connection = acquire(timeout);
		try {
			return scope.apply(connection);
		}
		finally {
			release(connection);
		}
	}

	/**
	 * Lazily acquire a connection upon subscription, performing the blocking {@link #acquire(Duration)}
	 * on the {@link PoolConfig#acquisitionScheduler() acquisition scheduler}.
	 * <p>
	 * Once the connection is emitted, the subscriber is responsible for its {@link #release(Connection) release}.
	 * A connection obtained after the subscription has been cancelled is released right away.
	 *
	 * @param timeout the maximum time to wait, {@link Duration#ZERO} to wait without deadline
	 * @return a {@link Mono}, each subscription to which represents an individual act of acquiring a connection
	 */
	Mono<C> acquireAsync(Duration timeout);

	/**
	 * Acquire a connection upon subscription and declaratively use it, automatically releasing it once the
	 * derived usage pipeline terminates or is cancelled.
	 *
	 * @param scopeFunction the {@link Function} to apply to the connection to trigger a processing pipeline around it
	 * @param <V> the type of values produced by the pipeline
	 * @return a {@link Flux}, each subscription to which represents an individual act of acquiring a connection,
	 * processing it as declared in {@code scopeFunction} and automatically releasing it
	 */
	default <V> Flux<V> withConnectionAsync(Function<? super C, ? extends Publisher<V>> scopeFunction) {
		return Flux.usingWhen(
				acquireAsync(config().acquireTimeout()),
				scopeFunction,
				c -> Mono.fromRunnable(() -> release(c)),
				(c, error) -> Mono.fromRunnable(() -> release(c)),
				c -> Mono.fromRunnable(() -> release(c)));
	}

	/**
	 * Return the pool's {@link PoolConfig configuration}.
	 *
	 * @return the {@link PoolConfig}
	 */
	PoolConfig<C> config();

	/**
	 * @return a {@link PoolMetrics} object to be used to get live gauges about the pool
	 */
	PoolMetrics metrics();

	/**
	 * Take a point-in-time snapshot of the contention counters of this pool. Taking a snapshot never
	 * blocks, nor is it blocked by, concurrent acquisitions and releases.
	 *
	 * @return an immutable {@link PoolMetricsSnapshot}
	 */
	PoolMetricsSnapshot metricsSnapshot();

	/**
	 * Shutdown the pool by:
	 * <ul>
	 *     <li>failing every parked acquisition with a {@link PoolShutdownException}</li>
	 *     <li>closing each idle connection, best-effort</li>
	 *     <li>detaching each checked-out connection, which is closed once its holder releases it</li>
	 * </ul>
	 * Further acquisitions fail immediately. This method is idempotent.
	 */
	@Override
	void close();

	/**
	 * Same as {@link #close()}.
	 */
	@Override
	default void dispose() {
		close();
	}

	/**
	 * Returns a {@link Mono} that represents a lazy shutdown of this pool.
	 * Shutdown doesn't happen until the {@link Mono} is {@link Mono#subscribe() subscribed}.
	 *
	 * @return a Mono triggering the shutdown of the pool once subscribed.
	 */
	default Mono<Void> disposeLater() {
		return Mono.fromRunnable(this::close);
	}

	/**
	 * An object that can be used to get live information about a {@link ConnectionPool}, suitable
	 * for gauge metrics.
	 * <p>
	 * getXxx methods are configuration accessors, ie values that won't change over time,
	 * whereas other methods can be used as gauges to introspect the current state of the
	 * pool.
	 */
	interface PoolMetrics {

		/**
		 * Measure the current number of connections that have been acquired and are in active use,
		 * outside of the control of the pool until they're released back to it.
		 *
		 * @return the number of acquired connections
		 */
		int acquiredSize();

		/**
		 * Measure the current number of established connections in the pool, acquired or idle.
		 *
		 * @return the total number of connections managed by the pool
		 */
		int allocatedSize();

		/**
		 * Measure the current number of idle connections in the pool.
		 * <p>
		 * Note that some connections might be discarded when they're next considered for an
		 * acquisition, if they fail their health check. Such connections still count towards this method.
		 *
		 * @return the number of idle connections
		 */
		int idleSize();

		/**
		 * Measure the current number of parked acquisitions in the pool.
		 *
		 * @return the number of parked acquisitions
		 */
		int pendingAcquireSize();

		/**
		 * Get the maximum number of live connections this pool will allow.
		 *
		 * @return the maximum number of live connections
		 */
		int getMaxAllocatedSize();

		/**
		 * Get the maximum number of acquisitions this pool can park. An unbounded pending queue
		 * returns {@link Integer#MAX_VALUE}.
		 *
		 * @return the maximum number of parked acquisitions
		 */
		int getMaxPendingAcquireSize();
	}
}
