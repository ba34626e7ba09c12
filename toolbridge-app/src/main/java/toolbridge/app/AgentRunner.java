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

import reactor.core.publisher.Mono;

import toolbridge.pool.PooledServer;

/**
 * Runs the agent for one message against one borrowed tool server. The server must not be used
 * once the returned {@link Mono} has terminated.
 *
 * @param <S> the type of tool server the agent calls
 */
@FunctionalInterface
public interface AgentRunner<S extends PooledServer> {

	/**
	 * @param server the tool server borrowed for this message
	 * @param context the message
	 * @return a {@link Mono} of the agent's final answer. An error signals that the server may be
	 * unfit for reuse.
	 */
	Mono<String> run(S server, MessageContext context);
}
