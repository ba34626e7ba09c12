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

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import toolbridge.pool.PoolMetricsRecorder;

import static toolbridge.pool.introspection.micrometer.DocumentedPoolMeters.*;
import static toolbridge.pool.introspection.micrometer.DocumentedPoolMeters.CommonTags.POOL_NAME;
import static toolbridge.pool.introspection.micrometer.DocumentedPoolMeters.OutcomeTags.OUTCOME_FAILURE;
import static toolbridge.pool.introspection.micrometer.DocumentedPoolMeters.OutcomeTags.OUTCOME_SUCCESS;

final class MicrometerMetricsRecorder implements PoolMetricsRecorder {

	private final String        poolName;
	private final MeterRegistry meterRegistry;

	private final Timer   allocationFailureTimer;
	private final Timer   allocationSuccessTimer;
	private final Timer   destroyedMeter;
	private final Counter destroyFailureCounter;
	private final Counter recycledCounter;
	private final Counter unhealthyCounter;
	private final Counter anomalyCounter;
	private final Timer   serverSummaryIdleness;
	private final Timer   serverSummaryLifetime;
	private final Timer   pendingSuccessTimer;
	private final Timer   pendingFailureTimer;

	MicrometerMetricsRecorder(String poolName, MeterRegistry registry) {
		this.poolName = poolName;
		this.meterRegistry = registry;

		final Tags nameTag = Tags.of(POOL_NAME.asString(), this.poolName);

		allocationSuccessTimer = this.meterRegistry.timer(ALLOCATION.meterName(),
			nameTag.and(OUTCOME_SUCCESS));
		allocationFailureTimer = this.meterRegistry.timer(ALLOCATION.meterName(),
			nameTag.and(OUTCOME_FAILURE));

		destroyedMeter = this.meterRegistry.timer(DESTROYED.meterName(), nameTag);
		destroyFailureCounter = this.meterRegistry.counter(DESTROY_FAILURES.meterName(), nameTag);

		recycledCounter = this.meterRegistry.counter(RECYCLED.meterName(), nameTag);
		unhealthyCounter = this.meterRegistry.counter(RELEASED_UNHEALTHY.meterName(), nameTag);
		anomalyCounter = this.meterRegistry.counter(RELEASE_ANOMALIES.meterName(), nameTag);

		serverSummaryLifetime = this.meterRegistry.timer(SUMMARY_LIFETIME.meterName(), nameTag);
		serverSummaryIdleness = this.meterRegistry.timer(SUMMARY_IDLENESS.meterName(), nameTag);

		pendingSuccessTimer = this.meterRegistry.timer(PENDING.meterName(),
				nameTag.and(OUTCOME_SUCCESS));
		pendingFailureTimer = this.meterRegistry.timer(PENDING.meterName(),
				nameTag.and(OUTCOME_FAILURE));
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
	public void recordDestroyFailure() {
		destroyFailureCounter.increment();
	}

	@Override
	public void recordRecycled() {
		recycledCounter.increment();
	}

	@Override
	public void recordUnhealthyRelease() {
		unhealthyCounter.increment();
	}

	@Override
	public void recordReleaseAnomaly() {
		anomalyCounter.increment();
	}

	@Override
	public void recordLifetimeDuration(long millisecondsSinceAllocation) {
		serverSummaryLifetime.record(millisecondsSinceAllocation, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordIdleTime(long millisecondsIdle) {
		serverSummaryIdleness.record(millisecondsIdle, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordPendingSuccessAndLatency(long latencyMs) {
		pendingSuccessTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordPendingFailureAndLatency(long latencyMs) {
		pendingFailureTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}
}
