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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import reactor.core.scheduler.Schedulers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

class PoolBuilderTest {

	@Test
	void defaults() {
		TestUtils.TestDriver driver = new TestUtils.TestDriver();
		PoolConfig<TestUtils.TestConnection> config = PoolBuilder.from(driver, "test://defaults").buildConfig();

		assertThat(config.driver()).isSameAs(driver);
		assertThat(config.connectionConfig()).isEqualTo("test://defaults");
		assertThat(config.minSize()).as("minSize").isEqualTo(1);
		assertThat(config.maxSize()).as("maxSize").isEqualTo(10);
		assertThat(config.healthCheckInterval()).as("healthCheckInterval").isEqualTo(Duration.ofSeconds(60));
		assertThat(config.acquireTimeout()).as("acquireTimeout").isEqualTo(Duration.ofSeconds(30));
		assertThat(config.spinLimit()).as("spinLimit").isEqualTo(10);
		assertThat(config.maxPending()).as("maxPending").isEqualTo(-1);
		assertThat(config.metricsRecorder()).isSameAs(NoOpPoolMetricsRecorder.INSTANCE);
		assertThat(config.acquisitionScheduler()).isSameAs(Schedulers.boundedElastic());
	}

	@Test
	void buildConfigIsACopy() {
		TestUtils.VirtualClock clock = new TestUtils.VirtualClock();
		PoolBuilder<TestUtils.TestConnection> builder = PoolBuilder.from(new TestUtils.TestDriver(), "test://copy")
		                                                           .sizeBetween(2, 4)
		                                                           .clock(clock)
		                                                           .healthCheckDisabled();
		PoolConfig<TestUtils.TestConnection> config = builder.buildConfig();
		builder.sizeBetween(0, 8);

		assertThat(config.minSize()).isEqualTo(2);
		assertThat(config.maxSize()).isEqualTo(4);
		assertThat(config.clock()).isSameAs(clock);
		assertThat(config.healthCheckInterval()).isZero();

		DefaultPoolConfig<TestUtils.TestConnection> copy = new DefaultPoolConfig<>(config);
		assertThat(copy.maxSize()).isEqualTo(4);
		assertThat(copy.clock()).isSameAs(clock);
	}

	@ParameterizedTest
	@CsvSource({
			"-1, 10, minSize must be positive or zero",
			"0, 0, maxSize must be strictly positive",
			"5, 4, maxSize must be greater than or equal to minSize"
	})
	void invalidSizes(int min, int max, String message) {
		PoolBuilder<TestUtils.TestConnection> builder = PoolBuilder.from(new TestUtils.TestDriver(), "test://sizes")
		                                                           .sizeBetween(min, max);

		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(builder::buildPool)
				.withMessageContaining(message);
	}

	@Test
	void configurationExceptionIsAnIllegalArgumentException() {
		assertThat(new PoolConfigurationException("test")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void negativeDurationsRejected() {
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> PoolBuilder.from(new TestUtils.TestDriver(), "test://durations")
				                             .healthCheckInterval(Duration.ofMillis(-1))
				                             .buildConfig())
				.withMessageStartingWith("healthCheckInterval");

		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> PoolBuilder.from(new TestUtils.TestDriver(), "test://durations")
				                             .acquireTimeout(Duration.ofMillis(-1))
				                             .buildConfig())
				.withMessageStartingWith("acquireTimeout");
	}

	@Test
	void negativeSpinLimitRejected() {
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> PoolBuilder.from(new TestUtils.TestDriver(), "test://spin")
				                             .spinLimit(-1)
				                             .buildConfig())
				.withMessage("spinLimit must be positive or zero, got -1");
	}

	@Test
	void invalidConfigurationDoesntConnect() {
		TestUtils.TestDriver driver = new TestUtils.TestDriver();

		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> PoolBuilder.from(driver, "test://noconnect").sizeBetween(3, 2).buildPool());

		assertThat(driver.connects).hasValue(0);
	}

	@Test
	void maxPendingNormalized() {
		PoolBuilder<TestUtils.TestConnection> builder = PoolBuilder.from(new TestUtils.TestDriver(), "test://pending");

		assertThat(builder.maxPendingAcquire(-42).buildConfig().maxPending()).isEqualTo(-1);
		assertThat(builder.maxPendingAcquire(0).buildConfig().maxPending()).isZero();
		assertThat(builder.maxPendingAcquire(3).buildConfig().maxPending()).isEqualTo(3);
		assertThat(builder.maxPendingAcquireUnbounded().buildConfig().maxPending()).isEqualTo(-1);
	}

	@Test
	void nullArgumentsRejectedEagerly() {
		PoolBuilder<TestUtils.TestConnection> builder = PoolBuilder.from(new TestUtils.TestDriver(), "test://nulls");

		assertThatNullPointerException().isThrownBy(() -> PoolBuilder.from(null, "test://nulls")).withMessage("driver");
		assertThatNullPointerException().isThrownBy(() -> builder.healthCheckInterval(null)).withMessage("interval");
		assertThatNullPointerException().isThrownBy(() -> builder.acquireTimeout(null)).withMessage("acquireTimeout");
		assertThatNullPointerException().isThrownBy(() -> builder.metricsRecorder(null)).withMessage("recorder");
		assertThatNullPointerException().isThrownBy(() -> builder.clock(null)).withMessage("clock");
	}

	@Test
	void customPoolFactoryReceivesConfig() {
		TestUtils.TestDriver driver = new TestUtils.TestDriver();
		Clock clock = new TestUtils.VirtualClock();

		SimpleConnectionPool<TestUtils.TestConnection> pool = PoolBuilder.from(driver, "test://factory")
		                                                                 .sizeBetween(0, 3)
		                                                                 .clock(clock)
		                                                                 .build(SimpleConnectionPool::new);

		assertThat(pool.config().maxSize()).isEqualTo(3);
		assertThat(pool.config().clock()).isSameAs(clock);
		assertThat(driver.connects).hasValue(0);
		pool.close();
	}
}
