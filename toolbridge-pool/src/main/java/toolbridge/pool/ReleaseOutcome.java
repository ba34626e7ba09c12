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
 * What a {@link ServerPool#release(PooledServer, boolean)} did with the server. Release never
 * fails: callers that care about the severity of an anomaly branch on this instead.
 */
public enum ReleaseOutcome {

	/**
	 * The server was healthy and is available again.
	 */
	RECYCLED,
	/**
	 * The server was reported unhealthy: it was disposed and the pool lost one unit of capacity.
	 */
	DESTROYED,
	/**
	 * The release was anomalous (double release, server not created by this pool, queue already
	 * full): the server was disposed and dropped.
	 */
	DISCARDED,
	/**
	 * Nothing to do: the server was {@code null} or had already been disposed by the pool.
	 */
	IGNORED,
	/**
	 * The pool is not {@link PoolState#READY}. Accounting was left untouched.
	 */
	REJECTED
}
