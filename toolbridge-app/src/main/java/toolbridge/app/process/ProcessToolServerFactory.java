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

package toolbridge.app.process;

import java.util.concurrent.atomic.AtomicInteger;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.Logger;
import reactor.util.Loggers;

import toolbridge.app.config.PoolSettings;
import toolbridge.pool.ServerFactory;

/**
 * A {@link ServerFactory} starting one child process per {@link ProcessToolServer}, from the
 * command line of a {@link PoolSettings}. Servers are named after the pool and a 1-based counter.
 */
public final class ProcessToolServerFactory implements ServerFactory<ProcessToolServer> {

	static final Logger LOGGER = Loggers.getLogger(ProcessToolServerFactory.class);

	final PoolSettings  settings;
	final AtomicInteger counter = new AtomicInteger();

	public ProcessToolServerFactory(PoolSettings settings) {
		this.settings = settings;
	}

	@Override
	public Mono<ProcessToolServer> create() {
		return Mono.fromCallable(() -> {
			           String name = settings.name() + "-" + counter.incrementAndGet();
			           Process process = new ProcessBuilder(settings.command())
					           .redirectError(ProcessBuilder.Redirect.INHERIT)
					           .start();
			           LOGGER.debug("Started tool server {} with pid {}: {}", name, process.pid(), settings.command());
			           return new ProcessToolServer(name, process, settings.shutdownGrace());
		           })
		           .subscribeOn(Schedulers.boundedElastic());
	}
}
