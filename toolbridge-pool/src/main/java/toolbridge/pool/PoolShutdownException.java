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
 * A {@link PoolStateException} denoting that the pool has been {@link ServerPool#shutdown() shut down},
 * either before an acquire was attempted or while it was pending.
 */
public class PoolShutdownException extends PoolStateException {

	private static final long serialVersionUID = 1L;

	public PoolShutdownException(String poolName) {
		this(poolName, "Pool '" + poolName + "' has been shut down");
	}

	public PoolShutdownException(String poolName, String message) {
		super(poolName, PoolState.SHUTDOWN, message);
	}
}
