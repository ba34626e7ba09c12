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
 * Signalled when an operation is invoked on a {@link ServerPool} whose {@link PoolState} does not
 * allow it, eg. acquiring before {@link ServerPool#initialize()} completed or initializing twice.
 */
public class PoolStateException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final String    poolName;
	private final PoolState state;

	public PoolStateException(String poolName, PoolState state, String message) {
		super(message);
		this.poolName = poolName;
		this.state = state;
	}

	/**
	 * @return the name of the pool that rejected the operation
	 */
	public String getPoolName() {
		return poolName;
	}

	/**
	 * @return the state the pool was observed in when the operation was rejected
	 */
	public PoolState getState() {
		return state;
	}
}
