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

import toolbridge.app.process.ProcessToolServer;

/**
 * An {@link AgentRunner} forwarding the message content as is to the tool server and answering with
 * the tool server's response.
 */
public final class ToolCallAgentRunner implements AgentRunner<ProcessToolServer> {

	@Override
	public Mono<String> run(ProcessToolServer server, MessageContext context) {
		return server.call(context.content());
	}
}
