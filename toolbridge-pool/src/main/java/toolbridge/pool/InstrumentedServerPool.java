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
 * An {@link InstrumentedServerPool} is a {@link ServerPool} that exposes a few additional methods
 * around metrics.
 *
 * @author Simon Baslé
 */
public interface InstrumentedServerPool<S extends PooledServer> extends ServerPool<S> {

	/**
	 * @return a {@link PoolMetrics} object to be used to get live gauges about the {@link ServerPool}
	 */
	PoolMetrics metrics();

	/**
	 * An object that can be used to get live information about a {@link ServerPool}, suitable
	 * for gauge metrics.
	 * <p>
	 * getXxx methods are configuration accessors, ie values that won't change over time,
	 * whereas other methods can be used as gauges to introspect the current state of the
	 * pool.
	 */
	interface PoolMetrics {

		/**
		 * Measure the current number of servers waiting in the pool to be acquired.
		 *
		 * @return the number of available servers
		 */
		int availableSize();

		/**
		 * Measure the current number of servers owned by the {@link ServerPool}, available or
		 * acquired. Starts at {@link #getCapacity()} after initialization and decreases with each
		 * unhealthy release.
		 *
		 * @return the number of tracked servers
		 */
		int trackedSize();

		/**
		 * Measure the current number of servers that have been {@link ServerPool#acquire() acquired}
		 * and not released yet.
		 *
		 * @return the number of acquired servers
		 */
		int acquiredSize();

		/**
		 * Measure the current number of "pending" {@link ServerPool#acquire() acquire Monos} in
		 * the {@link ServerPool}.
		 *
		 * @return the number of pending acquire
		 */
		int pendingAcquireSize();

		/**
		 * @return the configured capacity of the {@link ServerPool}
		 */
		int getCapacity();
	}
}
