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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.BiFunction;

import org.junit.jupiter.api.Test;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Schedulers;
import toolbridge.pool.TestUtils.RecordingFactory;
import toolbridge.pool.TestUtils.TestServer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class ServerPoolBuilderTest {

	@Test
	void buildConfigCarriesEveryOption() {
		RecordingFactory factory = new RecordingFactory();
		Clock clock = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);
		BiFunction<Runnable, Duration, Disposable> timer = (r, d) -> Disposables.single();
		TestUtils.InMemoryPoolMetrics recorder = new TestUtils.InMemoryPoolMetrics();

		PoolConfig<TestServer> config = ServerPoolBuilder.from(factory)
		                                                 .name("code_analysis")
		                                                 .capacity(3)
		                                                 .clock(clock)
		                                                 .pendingAcquireTimer(timer)
		                                                 .acquisitionScheduler(Schedulers.single())
		                                                 .metricsRecorder(recorder)
		                                                 .buildConfig();

		assertThat(config.name()).isEqualTo("code_analysis");
		assertThat(config.capacity()).isEqualTo(3);
		assertThat(config.factory()).isSameAs(factory);
		assertThat(config.clock()).isSameAs(clock);
		assertThat(config.pendingAcquireTimer()).isSameAs(timer);
		assertThat(config.acquisitionScheduler()).isSameAs(Schedulers.single());
		assertThat(config.metricsRecorder()).isSameAs(recorder);
	}

	@Test
	void defaults() {
		PoolConfig<TestServer> config = ServerPoolBuilder.from(new RecordingFactory())
		                                                 .capacity(1)
		                                                 .buildConfig();

		assertThat(config.name()).isEqualTo(ServerPoolBuilder.DEFAULT_NAME);
		assertThat(config.acquisitionScheduler()).isSameAs(Schedulers.immediate());
		assertThat(config.pendingAcquireTimer()).isSameAs(ServerPoolBuilder.DEFAULT_PENDING_ACQUIRE_TIMER);
		assertThat(config.metricsRecorder()).isSameAs(NoOpPoolMetricsRecorder.INSTANCE);
	}

	@Test
	void buildPoolIsUninitialized() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory)
		                                                           .name("stdio")
		                                                           .capacity(2)
		                                                           .buildPool();

		assertThat(pool.state()).isEqualTo(PoolState.UNINITIALIZED);
		assertThat(pool.name()).isEqualTo("stdio");
		assertThat(pool.capacity()).isEqualTo(2);
		assertThat(pool.metrics().getCapacity()).isEqualTo(2);
		assertThat(pool.metrics().trackedSize()).isZero();
		assertThat(factory.invocations()).isZero();
	}

	@Test
	void nullFactoryIsRejected() {
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> ServerPoolBuilder.from(null))
				.withMessage("factory must not be null");
	}

	@Test
	void nonPositiveCapacityIsRejected() {
		ServerPoolBuilder<TestServer> builder = ServerPoolBuilder.from(new RecordingFactory());

		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.capacity(0))
				.withMessage("Pool capacity must be positive, got 0");
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.capacity(-3));
	}

	@Test
	void missingCapacityIsRejectedAtBuildTime() {
		ServerPoolBuilder<TestServer> builder = ServerPoolBuilder.from(new RecordingFactory()).name("stdio");

		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(builder::buildPool)
				.withMessage("Pool 'stdio' needs a positive capacity");
	}

	@Test
	void blankNameIsRejected() {
		ServerPoolBuilder<TestServer> builder = ServerPoolBuilder.from(new RecordingFactory());

		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.name("  "));
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.name(null));
	}

	@Test
	void nullCollaboratorsAreRejected() {
		ServerPoolBuilder<TestServer> builder = ServerPoolBuilder.from(new RecordingFactory());

		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.clock(null))
				.withMessage("clock must not be null");
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.metricsRecorder(null));
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.acquisitionScheduler(null));
		assertThatExceptionOfType(PoolConfigurationException.class)
				.isThrownBy(() -> builder.pendingAcquireTimer(null));
	}

	@Test
	void configurationErrorIsAnIllegalArgument() {
		assertThatExceptionOfType(IllegalArgumentException.class)
				.isThrownBy(() -> ServerPoolBuilder.from(new RecordingFactory()).capacity(0));
	}
}
