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

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import toolbridge.pool.TestUtils.RecordingFactory;
import toolbridge.pool.TestUtils.TestServer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static toolbridge.pool.TestUtils.initializedPool;

class BoundedServerPoolTest {

	@Test
	void initializeCreatesCapacityServersOneAtATime() {
		AtomicInteger inFlight = new AtomicInteger();
		AtomicInteger maxInFlight = new AtomicInteger();
		RecordingFactory factory = new RecordingFactory(index -> Mono.delay(Duration.ofMillis(10))
				.doOnSubscribe(s -> maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
				.map(l -> new TestServer(index))
				.doOnTerminate(inFlight::decrementAndGet));
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory)
		                                                           .name("seq")
		                                                           .capacity(4)
		                                                           .buildPool();

		assertThat(pool.state()).isEqualTo(PoolState.UNINITIALIZED);

		pool.initialize().block(Duration.ofSeconds(5));

		assertThat(pool.state()).isEqualTo(PoolState.READY);
		assertThat(factory.invocations()).as("factory invocations").isEqualTo(4);
		assertThat(maxInFlight).as("concurrent creations").hasValue(1);
		assertThat(pool.metrics().availableSize()).as("available").isEqualTo(4);
		assertThat(pool.metrics().trackedSize()).as("tracked").isEqualTo(4);
		assertThat(pool.metrics().acquiredSize()).as("acquired").isZero();
	}

	@Test
	void initializeIsLazy() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory).capacity(2).buildPool();

		Mono<Void> init = pool.initialize();

		assertThat(factory.invocations()).isZero();
		assertThat(pool.state()).isEqualTo(PoolState.UNINITIALIZED);

		init.block();
		assertThat(factory.invocations()).isEqualTo(2);
	}

	@Test
	void secondInitializeFailsWithoutCreatingServers() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory).capacity(2).buildPool();
		pool.initialize().block();

		StepVerifier.create(pool.initialize())
		            .verifyErrorSatisfies(e -> assertThat(e)
				            .isExactlyInstanceOf(PoolStateException.class)
				            .hasMessageContaining("cannot initialize while READY")
				            .extracting(error -> ((PoolStateException) error).getState())
				            .isEqualTo(PoolState.READY));

		assertThat(factory.invocations()).isEqualTo(2);
		assertThat(pool.metrics().trackedSize()).isEqualTo(2);
	}

	@Test
	void acquireBeforeInitializeFails() {
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(new RecordingFactory())
		                                                           .name("early")
		                                                           .capacity(1)
		                                                           .buildPool();

		StepVerifier.create(pool.acquire())
		            .verifyErrorSatisfies(e -> assertThat(e)
				            .isExactlyInstanceOf(PoolStateException.class)
				            .hasMessage("Pool 'early' cannot acquire while UNINITIALIZED"));
		assertThat(pool.metrics().pendingAcquireSize()).isZero();
	}

	@Test
	void acquireAfterShutdownFails() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);
		pool.shutdown().block();

		StepVerifier.create(pool.acquire())
		            .verifyErrorSatisfies(e -> assertThat(e)
				            .isInstanceOf(PoolStateException.class)
				            .isExactlyInstanceOf(PoolShutdownException.class)
				            .hasMessage("Pool 'test' has been shut down"));
	}

	@Test
	@DisplayName("capacity 2: two acquires, one waiter served by a healthy release, unhealthy release shrinks the pool")
	void capacityTwoScenario() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory)
		                                                           .name("scenario")
		                                                           .capacity(2)
		                                                           .buildPool();
		pool.initialize().block();

		TestServer a = pool.acquire().block();
		TestServer b = pool.acquire().block();
		assertThat(a).isNotNull().isNotSameAs(b);
		assertThat(pool.metrics().availableSize()).isZero();

		AtomicReference<TestServer> third = new AtomicReference<>();
		pool.acquire().subscribe(third::set);
		assertThat(third.get()).as("third acquire waits").isNull();
		assertThat(pool.metrics().pendingAcquireSize()).isEqualTo(1);

		assertThat(pool.release(a, true).block()).isEqualTo(ReleaseOutcome.RECYCLED);
		assertThat(third.get()).as("third acquire resumed").isSameAs(a);
		assertThat(pool.metrics().pendingAcquireSize()).isZero();
		assertThat(pool.metrics().availableSize()).isZero();

		assertThat(pool.release(b, false).block()).isEqualTo(ReleaseOutcome.DESTROYED);
		assertThat(b.disposeCount).as("b disposed").hasValue(1);
		assertThat(pool.metrics().trackedSize()).isEqualTo(1);
		assertThat(pool.metrics().availableSize()).isZero();

		assertThat(pool.release(a, true).block()).isEqualTo(ReleaseOutcome.RECYCLED);
		assertThat(pool.metrics().availableSize()).isEqualTo(1);

		pool.shutdown().block();

		assertThat(a.disposeCount).as("a disposed").hasValue(1);
		assertThat(b.disposeCount).as("b disposed once").hasValue(1);
		assertThat(pool.metrics().trackedSize()).isZero();
		assertThat(pool.metrics().availableSize()).isZero();
		assertThat(pool.state()).isEqualTo(PoolState.SHUTDOWN);
		assertThat(factory.invocations()).as("no replacement").isEqualTo(2);
	}

	@Test
	void availableServersAreReusedLeastRecentlyUsedFirst() {
		InstrumentedServerPool<TestServer> pool = initializedPool(2);

		TestServer first = pool.acquire().block();
		pool.release(first).block();

		TestServer next = pool.acquire().block();
		assertThat(next).isNotSameAs(first);
		TestServer last = pool.acquire().block();
		assertThat(last).isSameAs(first);
	}

	@Test
	void unhealthyReleaseIsNeverReplaced() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory).name("test").capacity(1).buildPool();
		pool.initialize().block();

		TestServer server = pool.acquire().block();
		assertThat(pool.release(server, false).block()).isEqualTo(ReleaseOutcome.DESTROYED);

		assertThat(pool.metrics().trackedSize()).isZero();
		assertThat(pool.metrics().acquiredSize()).isZero();
		assertThat(factory.invocations()).isEqualTo(1);

		StepVerifier.withVirtualTime(() -> pool.acquire(Duration.ofSeconds(1)))
		            .expectSubscription()
		            .expectNoEvent(Duration.ofSeconds(1))
		            .thenAwait(Duration.ofMillis(1))
		            .verifyError(PoolAcquireTimeoutException.class);
	}

	@Test
	void releaseDefaultsToHealthy() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);
		TestServer server = pool.acquire().block();

		StepVerifier.create(pool.release(server))
		            .expectNext(ReleaseOutcome.RECYCLED)
		            .verifyComplete();
		assertThat(server.isDisposed()).isFalse();
	}

	@Test
	void releaseIsLazy() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);
		TestServer server = pool.acquire().block();

		Mono<ReleaseOutcome> release = pool.release(server, false);
		assertThat(pool.metrics().acquiredSize()).isEqualTo(1);
		assertThat(server.isDisposed()).isFalse();

		release.block();
		assertThat(pool.metrics().acquiredSize()).isZero();
		assertThat(server.isDisposed()).isTrue();
	}

	@Test
	void doubleReleaseDisposesAndDropsTheServer() {
		InstrumentedServerPool<TestServer> pool = initializedPool(2);
		TestServer server = pool.acquire().block();

		assertThat(pool.release(server, true).block()).isEqualTo(ReleaseOutcome.RECYCLED);
		assertThat(pool.release(server, true).block()).isEqualTo(ReleaseOutcome.DISCARDED);

		assertThat(server.disposeCount).hasValue(1);
		assertThat(pool.metrics().availableSize()).isEqualTo(1);
		assertThat(pool.metrics().trackedSize()).isEqualTo(1);

		TestServer remaining = pool.acquire().block();
		assertThat(remaining).isNotSameAs(server);
	}

	@Test
	void releaseOfDestroyedServerIsIgnored() {
		InstrumentedServerPool<TestServer> pool = initializedPool(2);
		TestServer server = pool.acquire().block();

		assertThat(pool.release(server, false).block()).isEqualTo(ReleaseOutcome.DESTROYED);
		assertThat(pool.release(server, false).block()).isEqualTo(ReleaseOutcome.IGNORED);
		assertThat(pool.release(server, true).block()).isEqualTo(ReleaseOutcome.IGNORED);

		assertThat(server.disposeCount).hasValue(1);
		assertThat(pool.metrics().trackedSize()).isEqualTo(1);
	}

	@Test
	void releaseOfForeignServerDisposesIt() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);
		TestServer stranger = new TestServer(99);

		assertThat(pool.release(stranger, true).block()).isEqualTo(ReleaseOutcome.DISCARDED);

		assertThat(stranger.disposeCount).hasValue(1);
		assertThat(pool.metrics().trackedSize()).isEqualTo(1);
		assertThat(pool.metrics().availableSize()).isEqualTo(1);
	}

	@Test
	void releaseOfNullIsIgnored() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);

		assertThat(pool.release(null, true).block()).isEqualTo(ReleaseOutcome.IGNORED);
		assertThat(pool.metrics().availableSize()).isEqualTo(1);
	}

	@Test
	void releaseAfterShutdownIsRejectedWithoutDisposingTwice() {
		InstrumentedServerPool<TestServer> pool = initializedPool(2);
		TestServer lent = pool.acquire().block();

		pool.shutdown().block();
		assertThat(lent.disposeCount).as("lent server disposed by shutdown").hasValue(1);

		assertThat(pool.release(lent, true).block()).isEqualTo(ReleaseOutcome.REJECTED);
		assertThat(pool.release(lent, false).block()).isEqualTo(ReleaseOutcome.REJECTED);
		assertThat(lent.disposeCount).hasValue(1);
	}

	@Test
	void shutdownDisposesEveryServerOnceDespiteFailures() {
		RecordingFactory factory = new RecordingFactory(index -> Mono.just(new TestServer(index, index == 1)));
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory).capacity(3).buildPool();
		pool.initialize().block();
		TestServer lent = pool.acquire().block();

		StepVerifier.create(pool.shutdown())
		            .verifyComplete();

		assertThat(factory.created)
				.hasSize(3)
				.allSatisfy(server -> assertThat(server.disposeCount).as("%s", server).hasValue(1));
		assertThat(lent).isNotNull();
		assertThat(pool.metrics().trackedSize()).isZero();
		assertThat(pool.metrics().acquiredSize()).isZero();
		assertThat(pool.metrics().availableSize()).isZero();
	}

	@Test
	void shutdownIsLazyAndIdempotent() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory).capacity(2).buildPool();
		pool.initialize().block();

		Mono<Void> shutdown = pool.shutdown();
		assertThat(pool.state()).isEqualTo(PoolState.READY);

		shutdown.block();
		StepVerifier.create(pool.shutdown()).verifyComplete();

		assertThat(factory.created)
				.allSatisfy(server -> assertThat(server.disposeCount).hasValue(1));
	}

	@Test
	void shutdownFailsPendingAcquires() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);
		TestServer held = pool.acquire().block();
		assertThat(held).isNotNull();

		AtomicReference<Throwable> borrowerError = new AtomicReference<>();
		pool.acquire().subscribe(v -> fail("unexpected value " + v), borrowerError::set);
		assertThat(pool.metrics().pendingAcquireSize()).isEqualTo(1);

		pool.shutdown().block();

		assertThat(borrowerError.get())
				.isExactlyInstanceOf(PoolShutdownException.class)
				.hasMessage("Pool 'test' has been shut down");
		assertThat(pool.metrics().pendingAcquireSize()).isZero();
	}

	@Test
	void shutdownBeforeInitializeCreatesNothing() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory).capacity(2).buildPool();

		pool.shutdown().block();

		assertThat(pool.state()).isEqualTo(PoolState.SHUTDOWN);
		StepVerifier.create(pool.initialize())
		            .verifyError(PoolShutdownException.class);
		assertThat(factory.invocations()).isZero();
	}

	@Test
	void disposeShutsDown() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);
		assertThat(pool.isDisposed()).isFalse();

		pool.dispose();

		assertThat(pool.isDisposed()).isTrue();
		assertThat(pool.state()).isEqualTo(PoolState.SHUTDOWN);
	}

	@Test
	void withServerReleasesHealthyOnCompletion() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);

		StepVerifier.create(pool.withServer(server -> Mono.just(server.name())))
		            .expectNext("test-1")
		            .verifyComplete();

		assertThat(pool.metrics().availableSize()).isEqualTo(1);
		assertThat(pool.metrics().trackedSize()).isEqualTo(1);
	}

	@Test
	void withServerReleasesUnhealthyOnError() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);
		AtomicReference<TestServer> used = new AtomicReference<>();

		StepVerifier.create(pool.withServer(server -> {
			used.set(server);
			return Mono.error(new IllegalStateException("agent failure"));
		}))
		            .verifyErrorMessage("agent failure");

		assertThat(used.get().disposeCount).hasValue(1);
		assertThat(pool.metrics().trackedSize()).isZero();
	}

	@Test
	void withServerReleasesHealthyOnCancel() {
		InstrumentedServerPool<TestServer> pool = initializedPool(1);

		Disposable usage = pool.withServer(server -> Flux.never()).subscribe();
		assertThat(pool.metrics().acquiredSize()).isEqualTo(1);

		usage.dispose();

		assertThat(pool.metrics().acquiredSize()).isZero();
		assertThat(pool.metrics().availableSize()).isEqualTo(1);
	}

	@Test
	void concurrentUsageNeverExceedsCapacity() {
		RecordingFactory factory = new RecordingFactory();
		InstrumentedServerPool<TestServer> pool = ServerPoolBuilder.from(factory).capacity(3).buildPool();
		pool.initialize().block();
		AtomicInteger inUse = new AtomicInteger();
		AtomicInteger maxInUse = new AtomicInteger();

		Long completed = Flux.range(0, 200)
		                     .flatMap(i -> pool.withServer(server -> {
			                     maxInUse.accumulateAndGet(inUse.incrementAndGet(), Math::max);
			                     return Mono.delay(Duration.ofMillis(1))
			                                .doOnTerminate(inUse::decrementAndGet);
		                     }), 16)
		                     .count()
		                     .block(Duration.ofSeconds(30));

		assertThat(completed).as("completed usages").isEqualTo(200L);
		assertThat(maxInUse.get()).as("max in use").isLessThanOrEqualTo(3);
		assertThat(factory.invocations()).isEqualTo(3);
		assertThat(pool.metrics().availableSize()).isEqualTo(3);
		assertThat(pool.metrics().acquiredSize()).isZero();
		assertThat(pool.metrics().pendingAcquireSize()).isZero();
		assertThat(pool.metrics().trackedSize()).isEqualTo(3);
	}
}
