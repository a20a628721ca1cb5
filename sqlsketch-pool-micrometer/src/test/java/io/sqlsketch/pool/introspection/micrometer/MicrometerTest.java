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

package io.sqlsketch.pool.introspection.micrometer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import io.sqlsketch.pool.Connection;
import io.sqlsketch.pool.ConnectionPool;
import io.sqlsketch.pool.Driver;
import io.sqlsketch.pool.PoolBuilder;
import io.sqlsketch.pool.PoolMetricsRecorder;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerTest {

	static final class StubConnection implements Connection {

		@Override
		public boolean validate() {
			return true;
		}

		@Override
		public void close() {
		}
	}

	static final Driver<StubConnection> DRIVER = config -> new StubConnection();

	@Test
	void metersRegisteredForGauge() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();
		ConnectionPool<StubConnection> pool = PoolBuilder.from(DRIVER, "stub").buildPool();

		Micrometer.gaugesOf(pool.metrics(), "testGauge", r);

		assertThat(r.getMeters().stream()
			.map(m -> {
				String name = m.getId().getName();
				String tags = m.getId().getTags().isEmpty() ? "" : String.valueOf(m.getId().getTags());
				return name + tags;
			}))
			.containsExactlyInAnyOrder(
				"sqlsketch.pool.connections.acquired[tag(pool.name=testGauge)]",
				"sqlsketch.pool.connections.allocated[tag(pool.name=testGauge)]",
				"sqlsketch.pool.connections.idle[tag(pool.name=testGauge)]",
				"sqlsketch.pool.connections.pendingAcquire[tag(pool.name=testGauge)]"
			);
		pool.close();
	}

	@Test
	void metersRegisteredForRecorder() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();

		PoolMetricsRecorder recorder = Micrometer.recorder("testRecorder", r);
		ConnectionPool<StubConnection> pool = PoolBuilder.from(DRIVER, "stub")
			.metricsRecorder(recorder)
			.buildPool();
		assertThat(pool).isNotNull();

		assertThat(r.getMeters().stream()
			.map(m -> {
				String name = m.getId().getName();
				String tags = m.getId().getTags().isEmpty() ? "" : String.valueOf(m.getId().getTags());
				return name + tags;
			}))
			.containsExactlyInAnyOrder(
				"sqlsketch.pool.allocation[tag(pool.allocation.outcome=success), tag(pool.name=testRecorder)]",
				"sqlsketch.pool.allocation[tag(pool.allocation.outcome=failure), tag(pool.name=testRecorder)]",
				"sqlsketch.pool.destroyed[tag(pool.name=testRecorder)]",
				"sqlsketch.pool.acquired.path[tag(pool.acquired.path=fast), tag(pool.name=testRecorder)]",
				"sqlsketch.pool.acquired.path[tag(pool.acquired.path=slow), tag(pool.name=testRecorder)]",
				"sqlsketch.pool.connections.summary.lifetime[tag(pool.name=testRecorder)]",
				"sqlsketch.pool.connections.summary.idleness[tag(pool.name=testRecorder)]",
				"sqlsketch.pool.pending[tag(pool.name=testRecorder), tag(pool.pending.outcome=success)]",
				"sqlsketch.pool.pending[tag(pool.name=testRecorder), tag(pool.pending.outcome=failure)]",
				"sqlsketch.pool.validation.failed[tag(pool.name=testRecorder)]"
			);
		pool.close();
	}

	@Test
	void micrometerInstrumentedPoolRegistersGaugeAndRecorderMetrics() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();

		ConnectionPool<StubConnection> pool = Micrometer.instrumentedPool(PoolBuilder.from(DRIVER, "stub"),
			"testMetrics", r);
		assertThat(pool).isNotNull();

		assertThat(r.getMeters()).hasSize(14);
		assertThat(r.find("sqlsketch.pool.connections.allocated").tag("pool.name", "testMetrics").gauge())
			.isNotNull()
			.satisfies(g -> assertThat(g.value()).isEqualTo(1d));
		pool.close();
	}

	@Test
	void recorderReflectsPoolActivity() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();
		AtomicInteger connects = new AtomicInteger();
		Driver<StubConnection> driver = config -> {
			if (connects.incrementAndGet() == 2) {
				throw new IllegalStateException("second connect fails");
			}
			return new StubConnection();
		};
		ConnectionPool<StubConnection> pool = Micrometer.instrumentedPool(PoolBuilder.from(driver, "stub").sizeBetween(1, 2),
			"activity", r);

		StubConnection c = pool.acquire();
		try {
			pool.acquire(Duration.ofMillis(10));
		}
		catch (RuntimeException expected) {
			assertThat(expected).hasMessage("Failed to establish a new connection");
		}
		pool.release(c);
		pool.close();

		assertThat(r.get("sqlsketch.pool.allocation").tag("pool.allocation.outcome", "success").timer().count()).isEqualTo(1);
		assertThat(r.get("sqlsketch.pool.allocation").tag("pool.allocation.outcome", "failure").timer().count()).isEqualTo(1);
		assertThat(r.get("sqlsketch.pool.acquired.path").tag("pool.acquired.path", "fast").counter().count()).isEqualTo(1d);
		assertThat(r.get("sqlsketch.pool.destroyed").timer().count()).isEqualTo(1);
		assertThat(r.get("sqlsketch.pool.connections.allocated").gauge().value()).isZero();
	}
}
