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
 * The lifecycle states of a {@link ServerPool}.
 * <p>
 * {@code UNINITIALIZED --initialize(ok)--> READY}, {@code UNINITIALIZED --initialize(fail)--> SHUTDOWN},
 * {@code READY --shutdown--> SHUTDOWN}. {@link #SHUTDOWN} is terminal.
 */
public enum PoolState {

	/**
	 * Constructed, no server created yet.
	 */
	UNINITIALIZED,
	/**
	 * {@link ServerPool#initialize()} is creating servers.
	 */
	INITIALIZING,
	/**
	 * All servers were created. The only state in which acquire and release succeed.
	 */
	READY,
	/**
	 * Terminal. Every server the pool owned has been handed to its disposal.
	 */
	SHUTDOWN
}
