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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import reactor.util.Logger;
import reactor.util.Loggers;

import toolbridge.app.config.BridgeConfig;
import toolbridge.app.config.ConfigLoader;
import toolbridge.app.config.PoolSettings;
import toolbridge.app.process.ProcessToolServer;
import toolbridge.app.process.ProcessToolServerFactory;
import toolbridge.pool.InstrumentedServerPool;
import toolbridge.pool.ServerPoolBuilder;
import toolbridge.pool.introspection.micrometer.Micrometer;

/**
 * The bridge between a {@link ChatTransport} and pools of stdio tool servers.
 * <p>
 * {@link #start()} builds one instrumented pool per configured pool, initializes all of them, then
 * starts the transport with an {@link AgentManager}. {@link #stop()} stops the transport first, then
 * shuts every pool down.
 */
public final class BridgeApplication {

	static final Logger LOGGER = Loggers.getLogger(BridgeApplication.class);

	final BridgeConfig                          config;
	final ChatTransport                         transport;
	final AgentRunner<ProcessToolServer>        agentRunner;
	final MeterRegistry                         meterRegistry;
	final ServerPoolRegistry<ProcessToolServer> registry;
	final AtomicBoolean                         stopping = new AtomicBoolean();
	final CountDownLatch                        stopped  = new CountDownLatch(1);

	public BridgeApplication(BridgeConfig config, ChatTransport transport,
			AgentRunner<ProcessToolServer> agentRunner, MeterRegistry meterRegistry) {
		this.config = config;
		this.transport = transport;
		this.agentRunner = agentRunner;
		this.meterRegistry = meterRegistry;
		this.registry = new ServerPoolRegistry<>(buildPools());
	}

	List<InstrumentedServerPool<ProcessToolServer>> buildPools() {
		List<InstrumentedServerPool<ProcessToolServer>> pools = new ArrayList<>();
		for (PoolSettings settings : config.pools().values()) {
			ServerPoolBuilder<ProcessToolServer> builder =
					ServerPoolBuilder.from(new ProcessToolServerFactory(settings))
					                 .capacity(settings.size());
			pools.add(Micrometer.instrumentedPool(builder, settings.name(), meterRegistry));
		}
		return pools;
	}

	/**
	 * Initialize every pool then start the transport. If a pool fails to initialize, the pools are
	 * all shut down and the {@link toolbridge.pool.PoolInitializationException} is thrown.
	 */
	public void start() {
		if (!config.llm().isConfigured()) {
			LOGGER.warn("No LLM endpoint configured, set TOOLBRIDGE_LLM_BASE_URL and TOOLBRIDGE_LLM_API_KEY to enable it");
		}
		LOGGER.info("Initializing pools {}", registry.names());
		registry.initializeAll().block();
		AgentManager<ProcessToolServer> agentManager =
				new AgentManager<>(registry, agentRunner, config.defaultPool(), config.acquireTimeout(),
						config.requestTimeout());
		transport.start(agentManager);
		LOGGER.info("Bridge started, default pool is '{}'", config.defaultPool());
	}

	/**
	 * Stop the transport then shut every pool down. Only the first call has an effect.
	 */
	public void stop() {
		if (!stopping.compareAndSet(false, true)) {
			return;
		}
		LOGGER.info("Bridge shutting down");
		try {
			transport.stop();
		}
		catch (RuntimeException e) {
			LOGGER.error("Failed to stop the chat transport", e);
		}
		registry.shutdownAll().block();
		stopped.countDown();
		LOGGER.info("Bridge shut down");
	}

	/**
	 * Block until {@link #stop()} has completed.
	 */
	public void awaitStop() throws InterruptedException {
		stopped.await();
	}

	public ServerPoolRegistry<ProcessToolServer> registry() {
		return registry;
	}

	public static void main(String[] args) {
		BridgeApplication application;
		try {
			BridgeConfig config = ConfigLoader.load(ConfigLoader.resolveConfigPath(args));
			application = new BridgeApplication(config,
					new ConsoleChatTransport(System.in, System.out, System.getProperty("user.name", "console")),
					new ToolCallAgentRunner(),
					new SimpleMeterRegistry());
			application.start();
		}
		catch (Exception e) {
			LOGGER.error("Startup failed: " + e.getMessage(), e);
			System.exit(1);
			return;
		}
		Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "toolbridge-shutdown"));
		try {
			application.awaitStop();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			application.stop();
		}
	}
}
