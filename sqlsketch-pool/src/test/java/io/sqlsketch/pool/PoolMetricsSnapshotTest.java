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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PoolMetricsSnapshotTest {

	@Test
	void derivedRatios() {
		PoolCounters counters = new PoolCounters();
		for (int i = 0; i < 8; i++) {
			counters.totalAcquires.increment();
		}
		counters.recordWait(false, 1_000_000L);
		counters.recordWait(true, 3_000_000L);

		PoolMetricsSnapshot snapshot = counters.snapshot(1, 2);

		assertThat(snapshot.getTotalWaits()).isEqualTo(2);
		assertThat(snapshot.getSpinWaits()).isEqualTo(1);
		assertThat(snapshot.getParkWaits()).isEqualTo(1);
		assertThat(snapshot.getAvgWaitTimeMs()).isCloseTo(2d, within(0.001d));
		assertThat(snapshot.getWaitPercentage()).isCloseTo(25d, within(0.001d));
		assertThat(snapshot.getCurrentUsage()).isEqualTo(1);
		assertThat(snapshot.getPoolSize()).isEqualTo(2);
	}

	@Test
	void emptyCountersDontDivideByZero() {
		PoolMetricsSnapshot snapshot = new PoolCounters().snapshot(0, 0);

		assertThat(snapshot.getAvgWaitTimeMs()).isZero();
		assertThat(snapshot.getWaitPercentage()).isZero();
		assertThat(snapshot.toString()).startsWith("PoolMetricsSnapshot{totalAcquires=0");
	}

	@Test
	void peakOnlyGoesUp() {
		PoolCounters counters = new PoolCounters();

		counters.updatePeak(3);
		counters.updatePeak(1);
		counters.updatePeak(2);

		assertThat(counters.snapshot(0, 3).getPeakUsage()).isEqualTo(3);
	}
}
