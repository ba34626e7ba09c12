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

import java.util.concurrent.Callable;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * The asynchronous constructor of {@link PooledServer servers}, invoked by a
 * {@link ServerPool} once per server during {@link ServerPool#initialize()}.
 * <p>
 * The returned {@link Mono} MUST only emit a fully connected, immediately usable server,
 * or fail. Completing empty is treated as a failure by the pool.
 * <p>
 * Adapting from blocking code is only acceptable if ensuring the work is offset on another
 * {@link Scheduler} (eg. a constructor materialized via {@link Mono#fromCallable(Callable)}
 * should be augmented with {@link Mono#subscribeOn(Scheduler)}).
 *
 * @param <S> the type of server produced
 */
@FunctionalInterface
public interface ServerFactory<S extends PooledServer> {

	/**
	 * @return a cold {@link Mono} that creates and connects one new server per subscription
	 */
	Mono<S> create();
}
