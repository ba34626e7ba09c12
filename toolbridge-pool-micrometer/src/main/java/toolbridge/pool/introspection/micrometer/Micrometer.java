/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
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

package toolbridge.pool.introspection.micrometer;

import io.micrometer.core.instrument.MeterRegistry;

import toolbridge.pool.InstrumentedServerPool;
import toolbridge.pool.PoolMetricsRecorder;
import toolbridge.pool.PooledServer;
import toolbridge.pool.ServerPoolBuilder;

/**
 * Micrometer supporting utilities for instrumentation of tool server pools.
 *
 * @author Simon Baslé
 */
public final class Micrometer {

	private Micrometer() {
	}

	/**
	 * Create an {@link InstrumentedServerPool} starting from the provided {@link ServerPoolBuilder}. The pool publishes
	 * metrics to a Micrometer {@link MeterRegistry}. The provided {@code poolName} names the pool and is set on all
	 * meters as the value for the {@link DocumentedPoolMeters.CommonTags#POOL_NAME} tag.
	 * <p>
	 * The steps involved are as follows:
	 * <ol>
	 *     <li> create a {@link PoolMetricsRecorder} similar to {@link #recorder(String, MeterRegistry)} </li>
	 *     <li> mutate the builder to use that recorder and the pool name </li>
	 *     <li> create an {@link InstrumentedServerPool} via {@link ServerPoolBuilder#buildPool()} </li>
	 *     <li> instrument the {@link InstrumentedServerPool.PoolMetrics} via {@link #gaugesOf(InstrumentedServerPool.PoolMetrics, String, MeterRegistry)} </li>
	 *     <li> return that {@link InstrumentedServerPool} instance </li>
	 * </ol>
	 *
	 * @param poolBuilder a pre-configured {@link ServerPoolBuilder} on which to configure a {@link PoolMetricsRecorder}
	 * @param poolName the name of the pool, also used as tag value on the gauges and the recorder's meters
	 * @param meterRegistry the registry to use for the gauges and the recorder's meters
	 * @param <S> the type of servers in the pool
	 * @return a new {@link InstrumentedServerPool} with a Micrometer recorder and with gauges attached
	 * @see DocumentedPoolMeters
	 */
	public static <S extends PooledServer> InstrumentedServerPool<S> instrumentedPool(ServerPoolBuilder<S> poolBuilder,
			String poolName, MeterRegistry meterRegistry) {
		PoolMetricsRecorder recorder = recorder(poolName, meterRegistry);
		InstrumentedServerPool<S> pool = poolBuilder.name(poolName)
		                                            .metricsRecorder(recorder)
		                                            .buildPool();
		gaugesOf(pool.metrics(), poolName, meterRegistry);
		return pool;
	}

	/**
	 * Register Micrometer gauges around the {@link InstrumentedServerPool}'s {@link InstrumentedServerPool.PoolMetrics},
	 * publishing to the provided {@link MeterRegistry}. One can differentiate between pools thanks to the provided
	 * {@code poolName}, which will be set on all meters as the value for the
	 * {@link DocumentedPoolMeters.CommonTags#POOL_NAME} tag.
	 *
	 * @param poolMetrics the {@link InstrumentedServerPool.PoolMetrics} to turn into gauges
	 * @param poolName the tag value to use on the gauges to differentiate between pools
	 * @param meterRegistry the registry to use for the gauges
	 * @see PoolGaugesBinder
	 */
	public static void gaugesOf(InstrumentedServerPool.PoolMetrics poolMetrics, String poolName, MeterRegistry meterRegistry) {
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
	 *     <li> {@link DocumentedPoolMeters#DESTROYED}, {@link DocumentedPoolMeters#DESTROY_FAILURES} </li>
	 *     <li> {@link DocumentedPoolMeters#RECYCLED}, {@link DocumentedPoolMeters#RELEASED_UNHEALTHY},
	 *     {@link DocumentedPoolMeters#RELEASE_ANOMALIES} </li>
	 *     <li> {@link DocumentedPoolMeters#PENDING} </li>
	 *     <li> {@link DocumentedPoolMeters#SUMMARY_IDLENESS} </li>
	 *     <li> {@link DocumentedPoolMeters#SUMMARY_LIFETIME} </li>
	 * </ul>
	 *
	 * @param poolName the tag value to use on the recorder's meters to differentiate between pools
	 * @param meterRegistry the registry to use for the recorder's meters
	 * @return a Micrometer {@link PoolMetricsRecorder}
	 * @see DocumentedPoolMeters
	 */
	public static PoolMetricsRecorder recorder(String poolName, MeterRegistry meterRegistry) {
		return new MicrometerMetricsRecorder(poolName, meterRegistry);
	}
}
