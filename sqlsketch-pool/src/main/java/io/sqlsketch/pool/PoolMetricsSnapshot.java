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

/**
 * An immutable, point-in-time view of the contention counters of a {@link ConnectionPool}.
 * <p>
 * Counters are cumulative since the pool was built. Individual counters are each read atomically but the
 * snapshot as a whole is not: a snapshot taken while acquisitions are in flight can be off by the in-flight ones.
 * The {@link #getTotalWaits() total waits} however always equals the sum of {@link #getSpinWaits() spin waits}
 * and {@link #getParkWaits() park waits}.
 *
 * @see ConnectionPool#metricsSnapshot()
 */
public final class PoolMetricsSnapshot {

	final long totalAcquires;
	final long totalReleases;
	final long totalWaits;
	final long spinWaits;
	final long parkWaits;
	final long totalTimeouts;
	final long totalWaitNanos;
	final long healthCheckFailures;
	final long reconnections;
	final long peakUsage;
	final int  currentUsage;
	final int  poolSize;

	PoolMetricsSnapshot(long totalAcquires, long totalReleases, long totalWaits, long spinWaits, long parkWaits,
			long totalTimeouts, long totalWaitNanos, long healthCheckFailures, long reconnections, long peakUsage,
			int currentUsage, int poolSize) {
		this.totalAcquires = totalAcquires;
		this.totalReleases = totalReleases;
		this.totalWaits = totalWaits;
		this.spinWaits = spinWaits;
		this.parkWaits = parkWaits;
		this.totalTimeouts = totalTimeouts;
		this.totalWaitNanos = totalWaitNanos;
		this.healthCheckFailures = healthCheckFailures;
		this.reconnections = reconnections;
		this.peakUsage = peakUsage;
		this.currentUsage = currentUsage;
		this.poolSize = poolSize;
	}

	/**
	 * @return the number of acquisition attempts, successful or not
	 */
	public long getTotalAcquires() {
		return totalAcquires;
	}

	/**
	 * @return the number of release calls, including ignored ones (double or foreign releases)
	 */
	public long getTotalReleases() {
		return totalReleases;
	}

	/**
	 * @return the number of acquisitions that could not be served immediately and had to spin or park
	 */
	public long getTotalWaits() {
		return totalWaits;
	}

	/**
	 * Acquisitions rejected with a {@link PoolAcquirePendingLimitException} never park, so they are counted here
	 * (and in {@link #getTotalWaits()}) once their spin phase is over.
	 *
	 * @return the number of waiting acquisitions that never had to park
	 */
	public long getSpinWaits() {
		return spinWaits;
	}

	/**
	 * @return the number of waiting acquisitions that parked at least once
	 */
	public long getParkWaits() {
		return parkWaits;
	}

	/**
	 * @return the number of acquisitions that failed with a {@link PoolAcquireTimeoutException}
	 */
	public long getTotalTimeouts() {
		return totalTimeouts;
	}

	/**
	 * @return the average time spent waiting by the acquisitions that waited, in milliseconds
	 */
	public double getAvgWaitTimeMs() {
		return totalWaits == 0 ? 0d : totalWaitNanos / 1_000_000d / totalWaits;
	}

	/**
	 * @return the share of acquisitions that had to wait, between 0 and 100
	 */
	public double getWaitPercentage() {
		return totalAcquires == 0 ? 0d : totalWaits * 100d / totalAcquires;
	}

	/**
	 * @return the number of idle connections that failed validation and were replaced
	 */
	public long getHealthCheckFailures() {
		return healthCheckFailures;
	}

	/**
	 * @return the number of connections established to replace one that failed validation
	 */
	public long getReconnections() {
		return reconnections;
	}

	/**
	 * @return the highest number of connections simultaneously checked out
	 */
	public long getPeakUsage() {
		return peakUsage;
	}

	/**
	 * @return the number of connections checked out when the snapshot was taken
	 */
	public int getCurrentUsage() {
		return currentUsage;
	}

	/**
	 * @return the number of live connections when the snapshot was taken
	 */
	public int getPoolSize() {
		return poolSize;
	}

	@Override
	public String toString() {
		return "PoolMetricsSnapshot{" +
				"totalAcquires=" + totalAcquires +
				", totalReleases=" + totalReleases +
				", totalWaits=" + totalWaits +
				", spinWaits=" + spinWaits +
				", parkWaits=" + parkWaits +
				", totalTimeouts=" + totalTimeouts +
				", avgWaitTimeMs=" + getAvgWaitTimeMs() +
				", healthCheckFailures=" + healthCheckFailures +
				", reconnections=" + reconnections +
				", peakUsage=" + peakUsage +
				", currentUsage=" + currentUsage +
				", poolSize=" + poolSize +
				'}';
	}
}
