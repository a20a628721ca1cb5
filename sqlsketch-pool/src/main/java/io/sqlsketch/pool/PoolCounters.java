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

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Contention counters of a {@link SimpleConnectionPool}, updated without holding the pool's lock.
 */
final class PoolCounters {

	final LongAdder  totalAcquires       = new LongAdder();
	final LongAdder  totalReleases       = new LongAdder();
	final LongAdder  spinWaits           = new LongAdder();
	final LongAdder  parkWaits           = new LongAdder();
	final LongAdder  totalTimeouts       = new LongAdder();
	final LongAdder  totalWaitNanos      = new LongAdder();
	final LongAdder  healthCheckFailures = new LongAdder();
	final LongAdder  reconnections       = new LongAdder();
	final AtomicLong peakUsage           = new AtomicLong();

	/**
	 * Record that a call waited, classifying it by whether it ever had to park.
	 */
	void recordWait(boolean parked, long waitNanos) {
		if (parked) {
			parkWaits.increment();
		}
		else {
			spinWaits.increment();
		}
		totalWaitNanos.add(waitNanos);
	}

	void updatePeak(int inUse) {
		long peak;
		do {
			peak = peakUsage.get();
			if (inUse <= peak) {
				return;
			}
		}
		while (!peakUsage.compareAndSet(peak, inUse));
	}

	PoolMetricsSnapshot snapshot(int currentUsage, int poolSize) {
		//total waits is derived so that a snapshot taken under contention still adds up
		long spin = spinWaits.sum();
		long park = parkWaits.sum();
		return new PoolMetricsSnapshot(totalAcquires.sum(),
				totalReleases.sum(),
				spin + park,
				spin,
				park,
				totalTimeouts.sum(),
				totalWaitNanos.sum(),
				healthCheckFailures.sum(),
				reconnections.sum(),
				peakUsage.get(),
				currentUsage,
				poolSize);
	}
}
