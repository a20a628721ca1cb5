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

import io.micrometer.core.instrument.MeterRegistry;

import io.sqlsketch.pool.Connection;
import io.sqlsketch.pool.ConnectionPool;
import io.sqlsketch.pool.PoolBuilder;
import io.sqlsketch.pool.PoolMetricsRecorder;

/**
 * Micrometer supporting utilities for instrumentation of sqlsketch connection pools.
 */
public final class Micrometer {

	/**
	 * Create a {@link ConnectionPool} starting from the provided {@link PoolBuilder}. The pool publishes metrics to
	 * a Micrometer {@link MeterRegistry}. One can differentiate between pools thanks to the provided {@code poolName},
	 * which will be set on all meters as the value for the {@link DocumentedPoolMeters.CommonTags#POOL_NAME} tag.
	 * <p>
	 * The steps involved are as follows:
	 * <ol>
	 *     <li> create a {@link PoolMetricsRecorder} similar to {@link #recorder(String, MeterRegistry)} </li>
	 *     <li> mutate the builder to use that recorder by calling {@link PoolBuilder#metricsRecorder(PoolMetricsRecorder)} </li>
	 *     <li> create a {@link ConnectionPool} via {@link PoolBuilder#buildPool()} </li>
	 *     <li> instrument the {@link ConnectionPool.PoolMetrics} via {@link #gaugesOf(ConnectionPool.PoolMetrics, String, MeterRegistry)} </li>
	 *     <li> return that {@link ConnectionPool} instance </li>
	 * </ol>
	 *
	 * @param poolBuilder a pre-configured {@link PoolBuilder} on which to configure a {@link PoolMetricsRecorder}
	 * @param poolName the tag value to use on the gauges and the recorder's meters to differentiate between pools
	 * @param meterRegistry the registry to use for the gauges and the recorder's meters
	 * @param <C> the type of connections in the pool
	 * @return a new {@link ConnectionPool} with a Micrometer recorder and with gauges attached
	 * @see DocumentedPoolMeters
	 */
	public static <C extends Connection> ConnectionPool<C> instrumentedPool(PoolBuilder<C> poolBuilder, String poolName, MeterRegistry meterRegistry) {
		PoolMetricsRecorder recorder = recorder(poolName, meterRegistry);
		ConnectionPool<C> pool = poolBuilder.metricsRecorder(recorder).buildPool();
		gaugesOf(pool.metrics(), poolName, meterRegistry);
		return pool;
	}

	/**
	 * Register Micrometer gauges around the {@link ConnectionPool}'s {@link ConnectionPool.PoolMetrics},
	 * publishing to the provided {@link MeterRegistry}.
	 *
	 * @param poolMetrics the {@link ConnectionPool.PoolMetrics} to turn into gauges
	 * @param poolName the tag value to use on the gauges to differentiate between pools
	 * @param meterRegistry the registry to use for the gauges
	 * @see PoolGaugesBinder
	 * @see #instrumentedPool(PoolBuilder, String, MeterRegistry)
	 */
	public static void gaugesOf(ConnectionPool.PoolMetrics poolMetrics, String poolName, MeterRegistry meterRegistry) {
		new PoolGaugesBinder(poolMetrics, poolName).bindTo(meterRegistry);
	}

	/**
	 * Create a {@link PoolMetricsRecorder} publishing timers and other meters to a provided {@link MeterRegistry}.
	 * One can differentiate between pools thanks to the provided {@code poolName}, which will be set on all meters
	 * as the value for the {@link DocumentedPoolMeters.CommonTags#POOL_NAME} tag.
	 * <p>
	 * {@link DocumentedPoolMeters} include the recorder-specific meters which are:
	 * <ul>
	 *     <li> {@link DocumentedPoolMeters#ALLOCATION} </li>
	 *     <li> {@link DocumentedPoolMeters#DESTROYED} </li>
	 *     <li> {@link DocumentedPoolMeters#SUMMARY_IDLENESS} </li>
	 *     <li> {@link DocumentedPoolMeters#SUMMARY_LIFETIME} </li>
	 *     <li> {@link DocumentedPoolMeters#ACQUIRED_PATH} </li>
	 *     <li> {@link DocumentedPoolMeters#PENDING} </li>
	 *     <li> {@link DocumentedPoolMeters#VALIDATION_FAILED} </li>
	 * </ul>
	 *
	 * @param poolName the tag value to use on the recorder's meters to differentiate between pools
	 * @param meterRegistry the registry to use for the recorder's meters
	 * @return a Micrometer {@link PoolMetricsRecorder}
	 * @see DocumentedPoolMeters
	 * @see #instrumentedPool(PoolBuilder, String, MeterRegistry)
	 */
	public static PoolMetricsRecorder recorder(String poolName, MeterRegistry meterRegistry) {
		return new MicrometerMetricsRecorder(poolName, meterRegistry);
	}

	private Micrometer() {
	}
}
