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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import reactor.core.publisher.Mono;
import reactor.test.util.TestLogger;
import reactor.util.Loggers;
import toolbridge.pool.TestUtils.InMemoryPoolMetrics;
import toolbridge.pool.TestUtils.RecordingFactory;
import toolbridge.pool.TestUtils.TestServer;

import static org.assertj.core.api.Assertions.assertThat;

class ReleaseLoggingTest {

	TestLogger testLogger;

	@BeforeEach
	void useTestLogger() {
		testLogger = new TestLogger();
		Loggers.useCustomLoggers(it -> testLogger);
	}

	@AfterEach
	void resetLoggers() {
		Loggers.resetLoggerFactory();
	}

	InstrumentedServerPool<TestServer> pool(RecordingFactory factory, InMemoryPoolMetrics recorder) {
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory)
		                                                           .name("logged")
		                                                           .capacity(2)
		                                                           .metricsRecorder(recorder)
		                                                           .buildPool();
		pool.initialize().block();
		return pool;
	}

	@Test
	void doubleReleaseIsWarnedAndRecorded() {
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		InstrumentedServerPool<TestServer> pool = pool(new RecordingFactory(), recorder);
		TestServer server = pool.acquire().block();

		pool.release(server).block();
		pool.release(server).block();

		assertThat(testLogger.getErrContent())
				.contains("Pool 'logged' discarding server test-1 because it is already available (double release)");
		assertThat(recorder.anomalies.sum()).isEqualTo(1);
		assertThat(recorder.recycled.sum()).isEqualTo(1);
	}

	@Test
	void foreignAndNullReleasesAreWarned() {
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		InstrumentedServerPool<TestServer> pool = pool(new RecordingFactory(), recorder);

		pool.release(new TestServer(42)).block();
		pool.release(null).block();

		assertThat(testLogger.getErrContent())
				.contains("Pool 'logged' discarding server test-42 which it did not create")
				.contains("Pool 'logged' ignored the release of a null server");
		assertThat(recorder.anomalies.sum()).isEqualTo(1);
	}

	@Test
	void releaseAfterShutdownIsWarned() {
		InstrumentedServerPool<TestServer> pool = pool(new RecordingFactory(), new InMemoryPoolMetrics());
		TestServer server = pool.acquire().block();
		pool.shutdown().block();

		pool.release(server, false).block();

		assertThat(testLogger.getErrContent())
				.contains("Pool 'logged' rejected the release of server test-1 while SHUTDOWN");
	}

	@Test
	void unhealthyReleaseIsRecorded() {
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		InstrumentedServerPool<TestServer> pool = pool(new RecordingFactory(), recorder);
		TestServer server = pool.acquire().block();

		pool.release(server, false).block();

		assertThat(recorder.unhealthy.sum()).isEqualTo(1);
		assertThat(recorder.lifetimes.sum()).isEqualTo(1);
		assertThat(recorder.destroyed.sum()).isEqualTo(1);
		assertThat(testLogger.getOutContent())
				.contains("Pool 'logged' destroying unhealthy server test-1, 1 servers left");
	}

	@Test
	void disposalFailureIsWarnedNotPropagated() {
		InMemoryPoolMetrics recorder = new InMemoryPoolMetrics();
		RecordingFactory factory = new RecordingFactory(index -> Mono.just(new TestServer(index, true)));
		InstrumentedServerPool<TestServer> pool = pool(factory, recorder);
		TestServer server = pool.acquire().block();

		assertThat(pool.release(server, false).block()).isEqualTo(ReleaseOutcome.DESTROYED);

		assertThat(testLogger.getErrContent())
				.contains("Pool 'logged' failed to dispose server test-1")
				.contains("dispose boom 1");
		assertThat(recorder.destroyFailures.sum()).isEqualTo(1);
	}
}
