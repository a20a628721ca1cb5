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

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import io.sqlsketch.pool.PoolMetricsRecorder;

import static io.sqlsketch.pool.introspection.micrometer.DocumentedPoolMeters.*;
import static io.sqlsketch.pool.introspection.micrometer.DocumentedPoolMeters.AcquiredPathTags.PATH_FAST;
import static io.sqlsketch.pool.introspection.micrometer.DocumentedPoolMeters.AcquiredPathTags.PATH_SLOW;
import static io.sqlsketch.pool.introspection.micrometer.DocumentedPoolMeters.AllocationTags.OUTCOME_FAILURE;
import static io.sqlsketch.pool.introspection.micrometer.DocumentedPoolMeters.AllocationTags.OUTCOME_SUCCESS;
import static io.sqlsketch.pool.introspection.micrometer.DocumentedPoolMeters.CommonTags.POOL_NAME;

final class MicrometerMetricsRecorder implements PoolMetricsRecorder {

	private final Timer   allocationSuccessTimer;
	private final Timer   allocationFailureTimer;
	private final Timer   destroyedMeter;
	private final Timer   connectionSummaryIdleness;
	private final Timer   connectionSummaryLifetime;
	private final Counter fastPathCounter;
	private final Counter slowPathCounter;
	private final Timer   pendingSuccessTimer;
	private final Timer   pendingFailureTimer;
	private final Counter validationFailureCounter;

	MicrometerMetricsRecorder(String poolName, MeterRegistry registry) {
		final Tags nameTag = Tags.of(POOL_NAME.asString(), poolName);

		allocationSuccessTimer = registry.timer(ALLOCATION.getName(), nameTag.and(OUTCOME_SUCCESS));
		allocationFailureTimer = registry.timer(ALLOCATION.getName(), nameTag.and(OUTCOME_FAILURE));

		destroyedMeter = registry.timer(DESTROYED.getName(), nameTag);

		connectionSummaryLifetime = registry.timer(SUMMARY_LIFETIME.getName(), nameTag);
		connectionSummaryIdleness = registry.timer(SUMMARY_IDLENESS.getName(), nameTag);

		fastPathCounter = registry.counter(ACQUIRED_PATH.getName(), nameTag.and(PATH_FAST));
		slowPathCounter = registry.counter(ACQUIRED_PATH.getName(), nameTag.and(PATH_SLOW));

		pendingSuccessTimer = registry.timer(PENDING.getName(), nameTag.and(PendingTags.OUTCOME_SUCCESS));
		pendingFailureTimer = registry.timer(PENDING.getName(), nameTag.and(PendingTags.OUTCOME_FAILURE));

		validationFailureCounter = registry.counter(VALIDATION_FAILED.getName(), nameTag);
	}

	@Override
	public void recordAllocationSuccessAndLatency(long latencyMs) {
		allocationSuccessTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordAllocationFailureAndLatency(long latencyMs) {
		allocationFailureTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordDestroyLatency(long latencyMs) {
		destroyedMeter.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordLifetimeDuration(long millisecondsSinceAllocation) {
		connectionSummaryLifetime.record(millisecondsSinceAllocation, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordIdleTime(long millisecondsIdle) {
		connectionSummaryIdleness.record(millisecondsIdle, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordFastPath() {
		fastPathCounter.increment();
	}

	@Override
	public void recordSlowPath() {
		slowPathCounter.increment();
	}

	@Override
	public void recordPendingSuccessAndLatency(long latencyMs) {
		pendingSuccessTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordPendingFailureAndLatency(long latencyMs) {
		pendingFailureTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordValidationFailure() {
		validationFailureCounter.increment();
	}
}
