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

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import toolbridge.pool.InstrumentedServerPool;
import toolbridge.pool.ServerPoolBuilder;

import static toolbridge.pool.introspection.micrometer.DocumentedPoolMeters.CommonTags.POOL_NAME;

/**
 * A {@link MeterBinder} that registers Micrometer gauges around a {@link InstrumentedServerPool}'s
 * {@link InstrumentedServerPool.PoolMetrics}, publishing to the provided {@link MeterRegistry}. One can
 * differentiate between pools thanks to the provided {@code poolName}, which will be set on all meters as
 * the value for the {@link DocumentedPoolMeters.CommonTags#POOL_NAME} tag.
 * <p>
 * {@link DocumentedPoolMeters} include the gauges which are:
 * <ul>
 *     <li> {@link DocumentedPoolMeters#AVAILABLE} </li>
 *     <li> {@link DocumentedPoolMeters#TRACKED}, </li>
 *     <li> {@link DocumentedPoolMeters#ACQUIRED} </li>
 *     <li> {@link DocumentedPoolMeters#PENDING_ACQUIRE} </li>
 * </ul>
 * <p>
 * Note that this doesn't cover metrics that show evolution of the pool's state and timings, which are separately
 * measured using a {@link toolbridge.pool.PoolMetricsRecorder} provided when building the pool.
 * See {@link Micrometer#recorder(String, MeterRegistry)}, as well as
 * {@link Micrometer#instrumentedPool(ServerPoolBuilder, String, MeterRegistry)} for a solution that covers both.
 *
 * @author Simon Baslé
 */
public final class PoolGaugesBinder implements MeterBinder {

	private final InstrumentedServerPool.PoolMetrics poolMetrics;
	private final String                             poolName;

	/**
	 * Create a {@link PoolGaugesBinder}.
	 *
	 * @param poolMetrics the {@link InstrumentedServerPool.PoolMetrics} to turn into gauges
	 * @param poolName the tag value to use on the gauges to differentiate between pools
	 * @see DocumentedPoolMeters
	 */
	public PoolGaugesBinder(InstrumentedServerPool.PoolMetrics poolMetrics, String poolName) {
		this.poolMetrics = poolMetrics;
		this.poolName = poolName;
	}

	@Override
	public void bindTo(MeterRegistry meterRegistry) {
		Tags nameTag = Tags.of(POOL_NAME.asString(), poolName);
		Gauge.builder(
				DocumentedPoolMeters.AVAILABLE.meterName(), poolMetrics,
				InstrumentedServerPool.PoolMetrics::availableSize)
			.tags(nameTag)
			.register(meterRegistry);
		Gauge.builder(
				DocumentedPoolMeters.TRACKED.meterName(), poolMetrics,
				InstrumentedServerPool.PoolMetrics::trackedSize)
			.tags(nameTag)
			.register(meterRegistry);
		Gauge.builder(
				DocumentedPoolMeters.ACQUIRED.meterName(), poolMetrics,
				InstrumentedServerPool.PoolMetrics::acquiredSize)
			.tags(nameTag)
			.register(meterRegistry);
		Gauge.builder(
				DocumentedPoolMeters.PENDING_ACQUIRE.meterName(), poolMetrics,
				InstrumentedServerPool.PoolMetrics::pendingAcquireSize)
			.tags(nameTag)
			.register(meterRegistry);
	}
}
