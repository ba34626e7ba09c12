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

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;

import toolbridge.pool.PoolAcquireTimeoutException;
import toolbridge.pool.PoolStateException;
import toolbridge.pool.PooledServer;
import toolbridge.pool.ServerPool;

/**
 * The {@link MessageHandler} serving each message with one tool server borrowed from a pool of the
 * {@link ServerPoolRegistry}.
 * <p>
 * The pool is the one named by the message's {@link MessageContext#POOL_ATTRIBUTE} attribute, or the
 * default pool. The agent gets at most the request timeout to answer. The server is released exactly
 * once: healthy when the agent completes, unhealthy when the agent errors, times out or the reply is
 * cancelled, since a server abandoned mid-request may still answer that request later. Every failure
 * is turned into a descriptive reply, the returned {@link Mono} never errors.
 *
 * @param <S> the type of tool servers
 */
public final class AgentManager<S extends PooledServer> implements MessageHandler {

	static final Logger LOGGER = Loggers.getLogger(AgentManager.class);

	static final String NO_REPLY = "The agent finished without a reply.";

	final ServerPoolRegistry<S> registry;
	final AgentRunner<S>        agentRunner;
	final String                defaultPool;
	final Duration              acquireTimeout;
	final Duration              requestTimeout;

	public AgentManager(ServerPoolRegistry<S> registry, AgentRunner<S> agentRunner, String defaultPool,
			Duration acquireTimeout, Duration requestTimeout) {
		this.registry = registry;
		this.agentRunner = agentRunner;
		this.defaultPool = defaultPool;
		this.acquireTimeout = acquireTimeout;
		this.requestTimeout = requestTimeout;
	}

	@Override
	public Mono<String> handle(MessageContext context) {
		String requested = context.attribute(MessageContext.POOL_ATTRIBUTE);
		String poolKey = requested == null ? defaultPool : requested;
		return registry.lookup(poolKey)
		               .map(pool -> serve(pool, context))
		               .orElseGet(() -> {
			               LOGGER.error("No pool '{}' among {}", poolKey, registry.names());
			               return Mono.just("Configuration error: tool server pool '" + poolKey + "' not found.");
		               });
	}

	Mono<String> serve(ServerPool<S> pool, MessageContext context) {
		return Mono.usingWhen(pool.acquire(acquireTimeout),
				           server -> {
					           LOGGER.debug("Serving {} with server {} of pool '{}'", context, server.name(), pool.name());
					           return agentRunner.run(server, context)
					                             .timeout(requestTimeout);
				           },
				           server -> pool.release(server, true),
				           (server, error) -> {
					           LOGGER.warn("Agent failed on server " + server.name() + ", releasing it as unhealthy", error);
					           return pool.release(server, false);
				           },
				           server -> {
					           LOGGER.warn("Reply cancelled while server {} was in use, releasing it as unhealthy", server.name());
					           return pool.release(server, false);
				           })
		           .defaultIfEmpty(NO_REPLY)
		           .onErrorResume(error -> Mono.just(describe(pool, error)));
	}

	String describe(ServerPool<S> pool, Throwable error) {
		if (error instanceof PoolAcquireTimeoutException) {
			LOGGER.warn("No server of pool '{}' became available within {}ms", pool.name(), acquireTimeout.toMillis());
			return "All tool servers of pool '" + pool.name() + "' are busy, no server became available within "
					+ acquireTimeout.toMillis() + "ms. Please retry later.";
		}
		if (error instanceof TimeoutException) {
			return "The tool server of pool '" + pool.name() + "' did not answer within "
					+ requestTimeout.toMillis() + "ms. Please retry later.";
		}
		if (error instanceof PoolStateException) {
			LOGGER.warn("Pool '{}' is not serving: {}", pool.name(), error.getMessage());
			return "Tool server pool '" + pool.name() + "' is not available: " + error.getMessage();
		}
		LOGGER.error("Failed to process message with pool '" + pool.name() + "'", error);
		return "Error while processing the message: " + error.getMessage();
	}
}
