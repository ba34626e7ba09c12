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

package toolbridge.app;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;

import toolbridge.pool.PooledServer;
import toolbridge.pool.ServerPool;

/**
 * The named {@link ServerPool pools} of the application, keyed by {@link ServerPool#name()}. Pools are
 * initialized in registration order and all of them are shut down together.
 *
 * @param <S> the type of servers of the pools
 */
public final class ServerPoolRegistry<S extends PooledServer> {

	static final Logger LOGGER = Loggers.getLogger(ServerPoolRegistry.class);

	final Map<String, ServerPool<S>> pools;

	public ServerPoolRegistry(Collection<? extends ServerPool<S>> pools) {
		Map<String, ServerPool<S>> byName = new LinkedHashMap<>();
		for (ServerPool<S> pool : pools) {
			if (byName.putIfAbsent(pool.name(), pool) != null) {
				throw new IllegalArgumentException("Duplicate pool name '" + pool.name() + "'");
			}
		}
		this.pools = byName;
	}

	/**
	 * Initialize every pool, one after the other. If one fails, every pool of the registry is shut
	 * down and the returned {@link Mono} errors with the failure of that pool.
	 *
	 * @return a {@link Mono} completing once all pools are ready
	 */
	public Mono<Void> initializeAll() {
		return Flux.fromIterable(pools.values())
		           .concatMap(pool -> pool.initialize()
		                                  .doOnSuccess(v -> LOGGER.info("Pool '{}' is ready", pool.name())))
		           .then()
		           .onErrorResume(error -> {
			           LOGGER.error("Pool initialization failed, shutting down all pools", error);
			           return shutdownAll().then(Mono.error(error));
		           });
	}

	/**
	 * @param name the pool key
	 * @return the pool registered under that key, if any
	 */
	public Optional<ServerPool<S>> lookup(String name) {
		return Optional.ofNullable(pools.get(name));
	}

	public Set<String> names() {
		return pools.keySet();
	}

	/**
	 * Shut every pool down, one after the other. A pool failing to shut down does not prevent the
	 * others from being shut down.
	 *
	 * @return a {@link Mono} completing once all pools are shut down
	 */
	public Mono<Void> shutdownAll() {
		return Flux.fromIterable(pools.values())
		           .concatMap(pool -> pool.shutdown()
		                                  .onErrorResume(error -> {
			                                  LOGGER.error("Pool '" + pool.name() + "' failed to shut down", error);
			                                  return Mono.empty();
		                                  }))
		           .then();
	}

	@Override
	public String toString() {
		return "ServerPoolRegistry" + pools.keySet();
	}
}
