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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.jspecify.annotations.Nullable;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * The default {@link ConnectionPool} implementation.
 * <p>
 * All bookkeeping (the set of live connections, the LRU deque of idle ones, the number of connections being
 * established and the queue of parked callers) is guarded by a single {@link ReentrantLock} held for a few
 * field updates at a time. Establishing, validating and closing connections always happen outside of it.
 * Growth is done through a reservation taken under the lock, so that the pool never goes over its maximum
 * size even when several callers establish connections concurrently.
 * <p>
 * Callers that find no idle connection and no room to grow first retry a few times, yielding in between, then
 * park on a {@link WaitQueue}. Each release wakes at most one parked caller, which then competes for the
 * connection like any other caller.
 *
 * @param <C> the type of {@link Connection} in the pool
 */
public final class SimpleConnectionPool<C extends Connection> implements ConnectionPool<C>, ConnectionPool.PoolMetrics {

	final PoolConfig<C>       config;
	//A pool should be rare enough that having instance loggers should be ok
	//This helps with testability of some methods that for now mainly log
	final Logger              logger;
	final Clock               clock;
	final PoolMetricsRecorder metricsRecorder;
	final PoolCounters        counters;
	final long                healthCheckIntervalMs;

	final ReentrantLock             lock      = new ReentrantLock();
	final Map<C, PooledSlot<C>>     slots     = new IdentityHashMap<>();
	final ArrayDeque<PooledSlot<C>> idle      = new ArrayDeque<>();
	//slots that were in use when the pool closed, destroyed once released
	final Map<C, PooledSlot<C>>     draining  = new IdentityHashMap<>();
	final WaitQueue                 waitQueue = new WaitQueue();

	//guarded by lock
	int  reserved;
	long nextSequence;

	//written under lock, read freely by gauges
	volatile boolean closed;
	volatile int     allocatedSize;
	volatile int     idleSize;
	volatile int     acquiredSize;

	/**
	 * Create a pool from the given configuration, eagerly establishing {@link PoolConfig#minSize()} connections.
	 *
	 * @param config the pool configuration
	 * @throws PoolConnectException if one of the eager connections cannot be established
	 */
	public SimpleConnectionPool(PoolConfig<C> config) {
		this(config, Loggers.getLogger(SimpleConnectionPool.class));
	}

	SimpleConnectionPool(PoolConfig<C> config, Logger logger) {
		this.config = config;
		this.logger = logger;
		this.clock = config.clock();
		this.metricsRecorder = config.metricsRecorder();
		this.counters = new PoolCounters();
		this.healthCheckIntervalMs = config.healthCheckInterval().toMillis();
		warmup(config.minSize());
	}

	void warmup(int minSize) {
		List<PooledSlot<C>> established = new ArrayList<>(minSize);
		for (int i = 1; i <= minSize; i++) {
			long start = clock.millis();
			C connection;
			try {
				connection = Objects.requireNonNull(config.driver().connect(config.connectionConfig()), "driver returned a null connection");
			}
			catch (Throwable e) {
				Exceptions.throwIfJvmFatal(e);
				metricsRecorder.recordAllocationFailureAndLatency(clock.millis() - start);
				logger.debug("failed to warm up connection {}/{}: {}", i, minSize, e.toString());
				for (PooledSlot<C> slot : established) {
					destroy(slot);
				}
				throw new PoolConnectException("Failed to establish connection " + i + "/" + minSize + " while building the pool", e);
			}
			long now = clock.millis();
			metricsRecorder.recordAllocationSuccessAndLatency(now - start);
			established.add(new PooledSlot<>(connection, now));
			logger.debug("warmed up connection {}/{}", i, minSize);
		}
		lock.lock();
		try {
			for (PooledSlot<C> slot : established) {
				slots.put(slot.connection, slot);
				idle.offerLast(slot);
			}
			updateGauges();
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public C acquire() {
		return acquire(config.acquireTimeout());
	}

	@Override
	public C acquire(Duration timeout) {
		Objects.requireNonNull(timeout, "timeout");
		if (timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must be positive or zero, got " + timeout);
		}
		counters.totalAcquires.increment();
		if (closed) {
			throw new PoolShutdownException();
		}
		C connection = tryAcquireNow();
		if (connection != null) {
			metricsRecorder.recordFastPath();
			return connection;
		}
		return acquireSlow(timeout);
	}

	/**
	 * The spin phase then the park phase of an acquisition that missed its first fast path.
	 */
	C acquireSlow(Duration timeout) {
		final long start = System.nanoTime();
		final long deadline = deadlineOf(start, timeout);
		boolean parked = false;
		boolean interrupted = false;
		boolean success = false;
		try {
			for (int i = 0; i < config.spinLimit(); i++) {
				Thread.yield();
				C connection = tryAcquireNow();
				if (connection != null) {
					success = true;
					return connection;
				}
				if (isExpired(deadline)) {
					throw timeoutError(timeout);
				}
			}

			long sequence = -1L;
			for (;;) {
				Waiter waiter = null;
				lock.lock();
				try {
					if (closed) {
						throw new PoolShutdownException();
					}
					//re-checked under the lock: a release happening after our last miss must not go unnoticed
					if (idle.isEmpty() && slots.size() + reserved >= config.maxSize()) {
						int maxPending = config.maxPending();
						if (maxPending >= 0 && waitQueue.liveSize() >= maxPending) {
							throw new PoolAcquirePendingLimitException(maxPending);
						}
						if (sequence < 0L) {
							sequence = nextSequence++;
						}
						waiter = new Waiter(sequence, Thread.currentThread(), start);
						waitQueue.offer(waiter);
					}
				}
				finally {
					lock.unlock();
				}

				if (waiter != null) {
					parked = true;
					if (waiter.park(deadline)) {
						interrupted = true;
					}
					int state = waiter.state;
					if (state == Waiter.STATE_WAITING) {
						if (waitQueue.cancel(waiter)) {
							throw timeoutError(timeout);
						}
						//a notification raced with the deadline
						state = waiter.state;
						if (state == Waiter.STATE_NOTIFIED) {
							C connection = tryAcquireNow();
							if (connection != null) {
								success = true;
								return connection;
							}
							throw timeoutError(timeout);
						}
					}
					if (state == Waiter.STATE_CLOSED) {
						throw new PoolShutdownException();
					}
				}

				C connection = tryAcquireNow();
				if (connection != null) {
					success = true;
					return connection;
				}
				if (isExpired(deadline)) {
					throw timeoutError(timeout);
				}
			}
		}
		finally {
			long waitNanos = System.nanoTime() - start;
			counters.recordWait(parked, waitNanos);
			if (success) {
				metricsRecorder.recordSlowPath();
				metricsRecorder.recordPendingSuccessAndLatency(Duration.ofNanos(waitNanos).toMillis());
			}
			else {
				metricsRecorder.recordPendingFailureAndLatency(Duration.ofNanos(waitNanos).toMillis());
			}
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	/**
	 * Try to obtain a connection without waiting: reuse the least recently released idle connection,
	 * validating it if it has been idle for too long, or else establish a new one if the pool can grow.
	 *
	 * @return a connection, or null if the pool is exhausted
	 * @throws PoolShutdownException if the pool is closed
	 * @throws PoolConnectException if a new connection had to be established and that failed
	 */
	@Nullable
	C tryAcquireNow() {
		boolean replacing = false;
		for (;;) {
			PooledSlot<C> candidate;
			lock.lock();
			try {
				if (closed) {
					throw new PoolShutdownException();
				}
				candidate = idle.pollFirst();
				if (candidate != null) {
					candidate.markAcquired();
					updateGauges();
				}
				else if (slots.size() + reserved < config.maxSize()) {
					reserved++;
				}
				else {
					return null;
				}
			}
			finally {
				lock.unlock();
			}

			if (candidate == null) {
				return connectReserved(replacing);
			}

			long now = clock.millis();
			long idleTime = candidate.idleTime(now);
			if (healthCheckIntervalMs > 0 && idleTime >= healthCheckIntervalMs) {
				if (!isValid(candidate)) {
					discardInvalid(candidate);
					replacing = true;
					continue;
				}
				candidate.lastValidatedAt = now;
			}
			metricsRecorder.recordIdleTime(idleTime);
			return candidate.connection;
		}
	}

	boolean isValid(PooledSlot<C> slot) {
		try {
			return slot.connection.validate();
		}
		catch (Throwable e) {
			Exceptions.throwIfJvmFatal(e);
			logger.debug("validation of {} threw, considering it invalid: {}", slot.connection, e.toString());
			return false;
		}
	}

	void discardInvalid(PooledSlot<C> slot) {
		lock.lock();
		try {
			if (slots.remove(slot.connection) == null) {
				draining.remove(slot.connection);
			}
			updateGauges();
			//room to grow was just freed
			waitQueue.pollLive();
		}
		finally {
			lock.unlock();
		}
		counters.healthCheckFailures.increment();
		metricsRecorder.recordValidationFailure();
		logger.debug("discarding {} which failed its health check", slot);
		destroy(slot);
	}

	/**
	 * Establish a connection against a reservation previously taken under the lock.
	 */
	C connectReserved(boolean replacing) {
		long start = clock.millis();
		C connection;
		try {
			connection = Objects.requireNonNull(config.driver().connect(config.connectionConfig()), "driver returned a null connection");
		}
		catch (Throwable e) {
			lock.lock();
			try {
				reserved--;
				waitQueue.pollLive();
			}
			finally {
				lock.unlock();
			}
			metricsRecorder.recordAllocationFailureAndLatency(clock.millis() - start);
			Exceptions.throwIfJvmFatal(e);
			throw new PoolConnectException("Failed to establish a new connection", e);
		}

		long now = clock.millis();
		metricsRecorder.recordAllocationSuccessAndLatency(now - start);
		PooledSlot<C> slot = new PooledSlot<>(connection, now);
		slot.markAcquired();
		boolean shutdown;
		int allocated;
		lock.lock();
		try {
			reserved--;
			shutdown = closed;
			if (!shutdown) {
				slots.put(connection, slot);
				updateGauges();
			}
			allocated = slots.size();
		}
		finally {
			lock.unlock();
		}
		if (shutdown) {
			destroy(slot);
			throw new PoolShutdownException("Pool has been shut down while establishing a connection");
		}
		if (replacing) {
			counters.reconnections.increment();
		}
		logger.debug("established connection {}/{}", allocated, config.maxSize());
		return connection;
	}

	@Override
	public void release(C connection) {
		Objects.requireNonNull(connection, "connection");
		counters.totalReleases.increment();
		PooledSlot<C> toDestroy = null;
		boolean unknown = false;
		boolean notInUse = false;
		lock.lock();
		try {
			PooledSlot<C> slot = slots.get(connection);
			if (slot == null) {
				toDestroy = draining.remove(connection);
				unknown = toDestroy == null;
			}
			else if (!slot.inUse) {
				notInUse = true;
			}
			else {
				slot.markReleased(clock.millis());
				idle.offerLast(slot);
				updateGauges();
				waitQueue.pollLive();
			}
		}
		finally {
			lock.unlock();
		}

		if (toDestroy != null) {
			logger.debug("closing {} released after the pool was shut down", toDestroy);
			destroy(toDestroy);
		}
		else if (unknown) {
			if (closed) {
				logger.debug("ignoring release of {} after the pool was shut down", connection);
			}
			else {
				logger.warn("Attempting to release a connection that doesn't belong to this pool: {}", connection);
			}
		}
		else if (notInUse) {
			logger.warn("Releasing a connection that is not marked as in use, ignoring double release of {}", connection);
		}
	}

	@Override
	public Mono<C> acquireAsync(Duration timeout) {
		return Mono.<C>create(sink -> acquireInto(sink, timeout))
		           .subscribeOn(config.acquisitionScheduler())
		           //covers a cancellation racing with sink.success
		           .doOnDiscard(Connection.class, this::releaseDiscarded);
	}

	void acquireInto(MonoSink<C> sink, Duration timeout) {
		AtomicBoolean cancelled = new AtomicBoolean();
		sink.onCancel(() -> cancelled.set(true));
		C connection = acquire(timeout);
		//a blocking acquire doesn't stop on cancellation, so the late connection goes back to the pool
		if (cancelled.get()) {
			logger.debug("releasing {} acquired after its subscriber cancelled", connection);
			release(connection);
		}
		else {
			sink.success(connection);
		}
	}

	@SuppressWarnings("unchecked")
	void releaseDiscarded(Connection connection) {
		release((C) connection);
	}

	@Override
	public void close() {
		List<PooledSlot<C>> toDestroy;
		int detached;
		int failedWaiters;
		lock.lock();
		try {
			if (closed) {
				return;
			}
			closed = true;
			toDestroy = new ArrayList<>(idle);
			idle.clear();
			for (PooledSlot<C> slot : slots.values()) {
				if (slot.inUse) {
					draining.put(slot.connection, slot);
				}
			}
			detached = draining.size();
			slots.clear();
			failedWaiters = waitQueue.drainClosed();
			updateGauges();
		}
		finally {
			lock.unlock();
		}
		logger.debug("pool shut down: {} parked acquisition(s) failed, {} idle connection(s) to close, {} in use",
				failedWaiters, toDestroy.size(), detached);
		for (PooledSlot<C> slot : toDestroy) {
			destroy(slot);
		}
	}

	@Override
	public boolean isDisposed() {
		return closed;
	}

	/**
	 * Close the connection of a slot that is no longer tracked by the pool. Failures are logged, never thrown.
	 */
	void destroy(PooledSlot<C> slot) {
		long start = clock.millis();
		metricsRecorder.recordLifetimeDuration(slot.lifeTime(start));
		try {
			slot.connection.close();
		}
		catch (Throwable e) {
			Exceptions.throwIfJvmFatal(e);
			logger.warn("Failure while closing connection " + slot.connection, e);
		}
		metricsRecorder.recordDestroyLatency(clock.millis() - start);
	}

	//guarded by lock
	void updateGauges() {
		int allocated = slots.size();
		int idleCount = idle.size();
		this.allocatedSize = allocated;
		this.idleSize = idleCount;
		this.acquiredSize = allocated - idleCount;
		counters.updatePeak(allocated - idleCount);
	}

	PoolAcquireTimeoutException timeoutError(Duration timeout) {
		counters.totalTimeouts.increment();
		return new PoolAcquireTimeoutException(timeout, acquiredSize, config.maxSize());
	}

	/**
	 * @return the {@link System#nanoTime()} deadline, {@link Long#MAX_VALUE} meaning no deadline
	 */
	static long deadlineOf(long start, Duration timeout) {
		if (timeout.isZero()) {
			return Long.MAX_VALUE;
		}
		try {
			return Math.addExact(start, timeout.toNanos());
		}
		catch (ArithmeticException tooFar) {
			return Long.MAX_VALUE;
		}
	}

	static boolean isExpired(long deadline) {
		return deadline != Long.MAX_VALUE && System.nanoTime() - deadline >= 0L;
	}

	@Override
	public PoolConfig<C> config() {
		return this.config;
	}

	@Override
	public PoolMetrics metrics() {
		return this;
	}

	@Override
	public PoolMetricsSnapshot metricsSnapshot() {
		return counters.snapshot(acquiredSize, allocatedSize);
	}

	@Override
	public int acquiredSize() {
		return acquiredSize;
	}

	@Override
	public int allocatedSize() {
		return allocatedSize;
	}

	@Override
	public int idleSize() {
		return idleSize;
	}

	@Override
	public int pendingAcquireSize() {
		return waitQueue.liveSize();
	}

	@Override
	public int getMaxAllocatedSize() {
		return config.maxSize();
	}

	@Override
	public int getMaxPendingAcquireSize() {
		return config.maxPending() < 0 ? Integer.MAX_VALUE : config.maxPending();
	}

	@Override
	public String toString() {
		return "SimpleConnectionPool{allocated=" + allocatedSize + "/" + config.maxSize() +
				", idle=" + idleSize + ", pending=" + waitQueue.liveSize() + ", closed=" + closed + "}";
	}
}
