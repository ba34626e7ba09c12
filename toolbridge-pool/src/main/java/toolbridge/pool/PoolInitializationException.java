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
 * Signalled by {@link ServerPool#initialize()} when a server could not be created. By the time
 * this is observed, every server created during the attempt has been disposed and the pool is
 * {@link PoolState#SHUTDOWN}: it cannot be used and should be reported to application startup.
 * The {@link #getCause() cause} is the original factory error.
 */
public class PoolInitializationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String poolName;
	private final int    failedIndex;
	private final int    capacity;

	public PoolInitializationException(String poolName, int failedIndex, int capacity, Throwable cause) {
		this(poolName, failedIndex, capacity,
				"Pool '" + poolName + "' failed to create server " + failedIndex + "/" + capacity + ": " + cause, cause);
	}

	public PoolInitializationException(String poolName, int capacity, String message, Throwable cause) {
		this(poolName, 0, capacity, message, cause);
	}

	private PoolInitializationException(String poolName, int failedIndex, int capacity, String message, Throwable cause) {
		super(message, cause);
		this.poolName = poolName;
		this.failedIndex = failedIndex;
		this.capacity = capacity;
	}

	/**
	 * @return the name of the pool that failed to initialize
	 */
	public String getPoolName() {
		return poolName;
	}

	/**
	 * @return the 1-based index of the server creation that failed, {@code 0} if initialization was
	 * aborted for another reason (eg. a concurrent shutdown)
	 */
	public int getFailedIndex() {
		return failedIndex;
	}

	/**
	 * @return the configured capacity of the pool
	 */
	public int getCapacity() {
		return capacity;
	}
}
