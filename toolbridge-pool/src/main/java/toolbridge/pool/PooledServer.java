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

import reactor.core.publisher.Mono;

/**
 * A tool server connection as seen by a {@link ServerPool}: an opaque, already connected
 * resource with an identity and an asynchronous disposal operation. The pool never looks
 * at the protocol spoken over the connection.
 */
public interface PooledServer {

	/**
	 * A human readable identifier for this server, used in logs.
	 *
	 * @return the server name
	 */
	String name();

	/**
	 * Return a {@link Mono} that cleans up the connection and any OS resource behind it once
	 * subscribed. The pool subscribes to it at most once per server. Implementations should
	 * tolerate being disposed while in a degraded state; errors are logged by the pool and
	 * never propagated to borrowers.
	 *
	 * @return a cold {@link Mono} completing when the server has been disposed
	 */
	Mono<Void> disposeLater();
}
