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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.HdrHistogram.Histogram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import reactor.util.Logger;
import reactor.util.Loggers;

import static org.assertj.core.api.Assertions.assertThat;
/**
 * Cancellation cost as the number of parked waiters grows. Timing based, hence excluded from the default run.
 */
@Tag("loops")
class WaitQueueCancellationLoopTest {

	static final Logger LOGGER = Loggers.getLogger(WaitQueueCancellationLoopTest.class);

	static Histogram cancellationLatencies(int waiters, int rounds) {
		Histogram histogram = new Histogram(TimeUnit.SECONDS.toNanos(1), 3);
		for (int round = 0; round < rounds; round++) {
			WaitQueue queue = new WaitQueue();
			List<Waiter> registered = new ArrayList<>(waiters);
			for (int i = 0; i < waiters; i++) {
				Waiter w = new Waiter(i, Thread.currentThread(), System.nanoTime());
				registered.add(w);
				queue.offer(w);
			}
			//cancel from the middle of the heap, where a search would hurt the most
			for (int i = waiters / 2; i < waiters; i++) {
				long start = System.nanoTime();
				queue.cancel(registered.get(i));
				histogram.recordValue(Math.min(System.nanoTime() - start, TimeUnit.SECONDS.toNanos(1)));
			}
		}
		return histogram;
	}

	@Test
	void cancellationCostDoesNotGrowWithQueueDepth() {
		//warm up the JIT
		cancellationLatencies(1000, 50);

		Histogram small = cancellationLatencies(10, 2000);
		Histogram large = cancellationLatencies(1000, 20);

		LOGGER.info("p50 cancel latency: {}ns with 10 waiters, {}ns with 1000 waiters",
				small.getValueAtPercentile(50), large.getValueAtPercentile(50));
		assertThat(large.getValueAtPercentile(50))
				.as("median cost with 100x more waiters")
				.isLessThanOrEqualTo(Math.max(1000L, small.getValueAtPercentile(50) * 10));
	}

	@ParameterizedTest
	@ValueSource(ints = {10, 100, 200})
	void massTimeoutLeavesPoolUsable(int waiters) throws Exception {
		TestUtils.TestDriver driver = new TestUtils.TestDriver();
		ConnectionPool<TestUtils.TestConnection> pool = PoolBuilder.from(driver, "test://loops")
		                                                           .sizeBetween(1, 1)
		                                                           .spinLimit(0)
		                                                           .buildPool();
		ExecutorService executor = Executors.newFixedThreadPool(waiters);
		try {
			TestUtils.TestConnection held = pool.acquire();
			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < waiters; i++) {
				futures.add(executor.submit(() -> {
					try {
						pool.release(pool.acquire(Duration.ofMillis(200)));
					}
					catch (PoolAcquireTimeoutException expected) {
						//the only connection is held throughout
					}
				}));
			}
			for (Future<?> f : futures) {
				f.get(10, TimeUnit.SECONDS);
			}

			PoolMetricsSnapshot snapshot = pool.metricsSnapshot();
			assertThat(snapshot.getTotalTimeouts()).isEqualTo(waiters);
			assertThat(pool.metrics().pendingAcquireSize()).isZero();

			pool.release(held);
			assertThat(pool.acquire(Duration.ofMillis(100))).isSameAs(held);
		}
		finally {
			executor.shutdownNow();
			pool.close();
		}
	}
}
