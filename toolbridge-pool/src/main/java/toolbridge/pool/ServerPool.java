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
import java.util.function.Function;

import org.reactivestreams.Publisher;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A reactive, fixed-capacity pool of tool servers. All servers are created eagerly by
 * {@link #initialize()} and the pool never creates more afterwards.
 *
 * @param <S> the type of pooled server
 * @author Simon Baslé
 */
public interface ServerPool<S extends PooledServer> extends Disposable {

	/**
	 * Create exactly {@link #capacity()} servers, one after the other, and make each of them
	 * available as soon as it is created.
	 * <p>
	 * If any creation fails, every server created so far is disposed, the pool moves to the
	 * terminal {@link PoolState#SHUTDOWN} state and the returned {@link Mono} fails with a
	 * {@link PoolInitializationException} wrapping the original error.
	 * Calling this method on a pool that is not {@link PoolState#UNINITIALIZED} fails with a
	 * {@link PoolStateException}.
	 * <p>
	 * Note that no work is performed until the {@link Mono} is subscribed to.
	 *
	 * @return a cold {@link Mono} completing once all servers are created
	 */
	Mono<Void> initialize();

	/**
	 * Acquire a server from the pool upon subscription and become responsible for its
	 * {@link #release(PooledServer, boolean) release}.
	 * <p>
	 * If no server is available the subscriber waits, without blocking any thread, until one
	 * is released. Waiters are served in subscription order. Cancelling the
	 * {@link org.reactivestreams.Subscription} before the server has been emitted either
	 * removes the waiter or puts the server straight back into the pool.
	 * <p>
	 * Subscribing while the pool is not {@link PoolState#READY} fails with a
	 * {@link PoolStateException} ({@link PoolShutdownException} once shut down).
	 *
	 * @return a {@link Mono}, each subscription to which represents an individual act of acquiring a server
	 * @see #withServer(Function)
	 */
	Mono<S> acquire();

	/**
	 * Same as {@link #acquire()}, but the provided {@link Duration} acts as a timeout that only
	 * applies if the acquisition has to wait for a release. The waiter is then failed with a
	 * {@link PoolAcquireTimeoutException}. A {@link Duration#ZERO zero} duration means no timeout.
	 *
	 * @param timeout the maximum time to wait for a server to be released
	 * @return a {@link Mono}, each subscription to which represents an individual act of acquiring a server
	 */
	Mono<S> acquire(Duration timeout);

	/**
	 * Give a previously {@link #acquire() acquired} server back to the pool, along with a verdict
	 * on its health. A healthy server is made available again, an unhealthy one is disposed and
	 * never replaced.
	 * <p>
	 * The returned {@link Mono} never errors: anomalies (double release, foreign server, release
	 * after shutdown) are logged and reported as a {@link ReleaseOutcome}.
	 *
	 * @param server the server to release
	 * @param healthy whether the server can be reused
	 * @return a {@link Mono} that performs the release once subscribed, then emits the outcome
	 */
	Mono<ReleaseOutcome> release(S server, boolean healthy);

	/**
	 * Release a healthy server.
	 *
	 * @param server the server to release
	 * @return a {@link Mono} that performs the release once subscribed, then emits the outcome
	 * @see #release(PooledServer, boolean)
	 */
	default Mono<ReleaseOutcome> release(S server) {
		return release(server, true);
	}

	/**
	 * Acquire a server upon subscription and declaratively use it, automatically releasing
	 * it once the derived pipeline terminates or is cancelled. Completion and cancellation
	 * release the server as healthy, an error releases it as unhealthy.
	 *
	 * @param scopeFunction the {@link Function} to apply to the acquired server
	 * @param <V> the type of values produced by the scope
	 * @return a {@link Flux}, each subscription to which acquires, uses and releases a server
	 */
	default <V> Flux<V> withServer(Function<S, ? extends Publisher<V>> scopeFunction) {
		return Flux.usingWhen(
				acquire(),
				scopeFunction,
				server -> release(server, true),
				(server, error) -> release(server, false),
				server -> release(server, true));
	}

	/**
	 * Shutdown the pool by:
	 * <ul>
	 *     <li>failing every acquire still pending with a {@link PoolShutdownException}</li>
	 *     <li>disposing each server the pool created, available or lent out, exactly once</li>
	 * </ul>
	 * A disposal failure is logged and does not prevent the other disposals. If the pool has
	 * already been shut down, returns {@link Mono#empty()}.
	 *
	 * @return a cold {@link Mono} triggering the shutdown of the pool once subscribed
	 */
	Mono<Void> shutdown();

	/**
	 * @return the name of this pool
	 */
	String name();

	/**
	 * @return the number of servers created by {@link #initialize()}
	 */
	int capacity();

	/**
	 * @return the current {@link PoolState}
	 */
	PoolState state();

	/**
	 * Return the pool's {@link PoolConfig configuration}.
	 *
	 * @return the {@link PoolConfig}
	 */
	PoolConfig<S> config();

	/**
	 * Same as {@link #shutdown()}, without waiting for the disposals to complete.
	 */
	@Override
	default void dispose() {
		shutdown().subscribe();
	}

	@Override
	default boolean isDisposed() {
		return state() == PoolState.SHUTDOWN;
	}
}
