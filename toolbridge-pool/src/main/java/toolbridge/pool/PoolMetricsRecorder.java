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

package toolbridge.pool;

/**
 * An interface representing ways for {@link ServerPool} to collect instrumentation data.
 *
 * @author Simon Baslé
 */
public interface PoolMetricsRecorder {

	/**
	 * Record a latency for successful server creation. Implies incrementing a creation success counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationSuccessAndLatency(long latencyMs);

	/**
	 * Record a latency for failed server creation. Implies incrementing a creation failure counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationFailureAndLatency(long latencyMs);

	/**
	 * Record a latency for disposing a server. Implies incrementing a counter as well.
	 * @param latencyMs the latency in milliseconds
	 */
	void recordDestroyLatency(long latencyMs);

	/**
	 * Record the fact that disposing a server failed. The failure was logged and absorbed by the pool.
	 */
	void recordDestroyFailure();

	/**
	 * Record the fact that a server was released as healthy and made available again.
	 */
	void recordRecycled();

	/**
	 * Record the fact that a server was released as unhealthy, shrinking the pool's capacity by one.
	 */
	void recordUnhealthyRelease();

	/**
	 * Record an anomalous release (double release, foreign server, full queue) that led to the server
	 * being discarded.
	 */
	void recordReleaseAnomaly();

	/**
	 * Record the number of milliseconds a server has been live (ie time between creation and disposal).
	 * @param millisecondsSinceAllocation the number of milliseconds since the server was created, at the time it is disposed
	 */
	void recordLifetimeDuration(long millisecondsSinceAllocation);

	/**
	 * Record the number of milliseconds a server had been idle when it gets pulled from the pool and passed to a borrower.
	 * @param millisecondsIdle the number of milliseconds a server that was just acquired had previously been idle
	 */
	void recordIdleTime(long millisecondsIdle);

	/**
	 * Record a latency for an acquire that had to wait in the pending queue and eventually got a server.
	 * @param latencyMs the latency in milliseconds
	 */
	default void recordPendingSuccessAndLatency(long latencyMs) {
		// noop
	}

	/**
	 * Record a latency for an acquire that had to wait in the pending queue and failed, eg. with a
	 * {@link PoolAcquireTimeoutException} or because the pool was shut down.
	 * @param latencyMs the latency in milliseconds
	 */
	default void recordPendingFailureAndLatency(long latencyMs) {
		// noop
	}
}
