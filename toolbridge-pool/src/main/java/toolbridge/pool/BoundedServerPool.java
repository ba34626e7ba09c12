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
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import reactor.core.CoreSubscriber;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

import static toolbridge.pool.AbstractServerPool.ServerSlot.STATE_ACQUIRED;
import static toolbridge.pool.AbstractServerPool.ServerSlot.STATE_DESTROYED;
import static toolbridge.pool.AbstractServerPool.ServerSlot.STATE_IDLE;

/**
 * The {@link BoundedServerPool} creates all of its servers upfront and keeps the available ones in
 * a FIFO {@link java.util.Deque}, so that servers are reused in least-recently-used order. Pending
 * {@link ServerPool#acquire()} Monos are queued in another FIFO {@link java.util.Deque}.
 * <p>
 * It uses a non-blocking drain loop to deliver servers to borrowers, which means that a server could
 * be handed off on any of the following {@link Thread threads}:
 * <ul>
 *     <li>any thread on which a server was recently released</li>
 *     <li>any thread on which an {@link ServerPool#acquire()} {@link Mono} was subscribed</li>
 * </ul>
 * For a more deterministic approach, the {@link ServerPoolBuilder#acquisitionScheduler(Scheduler)} property
 * of the builder can be used.
 * <p>
 * Servers are never created after {@link #initialize()}: each unhealthy release permanently reduces the
 * number of servers the pool can lend.
 *
 * @author Simon Baslé
 */
public class BoundedServerPool<S extends PooledServer> extends AbstractServerPool<S> {

	final ConcurrentLinkedDeque<ServerSlot<S>> idle;
	final ConcurrentLinkedDeque<Borrower<S>>   pending;

	//every server this pool created, by identity, including the destroyed ones
	final Map<S, ServerSlot<S>> slots;

	volatile PoolState state;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<BoundedServerPool, PoolState> STATE =
			AtomicReferenceFieldUpdater.newUpdater(BoundedServerPool.class, PoolState.class, "state");

	volatile int wip;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<BoundedServerPool> WIP =
			AtomicIntegerFieldUpdater.newUpdater(BoundedServerPool.class, "wip");

	volatile int idleSize;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<BoundedServerPool> IDLE_SIZE =
			AtomicIntegerFieldUpdater.newUpdater(BoundedServerPool.class, "idleSize");

	volatile int pendingSize;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<BoundedServerPool> PENDING_SIZE =
			AtomicIntegerFieldUpdater.newUpdater(BoundedServerPool.class, "pendingSize");

	volatile int acquired;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<BoundedServerPool> ACQUIRED =
			AtomicIntegerFieldUpdater.newUpdater(BoundedServerPool.class, "acquired");

	volatile int tracked;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<BoundedServerPool> TRACKED =
			AtomicIntegerFieldUpdater.newUpdater(BoundedServerPool.class, "tracked");

	BoundedServerPool(PoolConfig<S> poolConfig) {
		super(poolConfig, Loggers.getLogger(BoundedServerPool.class));
		this.idle = new ConcurrentLinkedDeque<>();
		this.pending = new ConcurrentLinkedDeque<>(); //unbounded
		this.slots = Collections.synchronizedMap(new IdentityHashMap<>());
		this.state = PoolState.UNINITIALIZED;
		logger.info("Pool '{}' created with capacity {}", poolConfig.name(), poolConfig.capacity());
	}

	// == lifecycle ==

	@Override
	public Mono<Void> initialize() {
		return Mono.defer(() -> {
			if (!STATE.compareAndSet(this, PoolState.UNINITIALIZED, PoolState.INITIALIZING)) {
				return Mono.error(notReady(state, "initialize"));
			}
			logger.info("Pool '{}' initializing {} servers", name(), capacity());
			return Flux.range(1, capacity())
			           .concatMap(index -> createServer(index).<S>handle((server, sink) -> {
				           if (register(index, server)) {
					           sink.next(server);
				           }
				           else {
					           sink.error(abortedByShutdown());
				           }
			           }))
			           .then(Mono.defer(this::completeInitialization))
			           .onErrorResume(this::rollback);
		});
	}

	Mono<S> createServer(int index) {
		return Mono.defer(() -> {
			long start = clock.millis();
			Mono<S> creation;
			try {
				creation = Objects.requireNonNull(poolConfig.factory().create(), "the factory returned a null Mono");
			}
			catch (Throwable factoryError) {
				creation = Mono.error(factoryError);
			}
			return creation
					.switchIfEmpty(Mono.error(() -> new IllegalStateException("the factory completed without a server")))
					.doOnNext(server -> metricsRecorder.recordAllocationSuccessAndLatency(clock.millis() - start))
					.doOnError(error -> metricsRecorder.recordAllocationFailureAndLatency(clock.millis() - start))
					.onErrorMap(error -> !(error instanceof PoolInitializationException),
							error -> new PoolInitializationException(name(), index, capacity(), error));
		});
	}

	/**
	 * Track a freshly created server and make it available right away.
	 *
	 * @return false if the pool got shut down concurrently, in which case initialization must stop
	 */
	boolean register(int index, S server) {
		ServerSlot<S> slot = new ServerSlot<>(server, metricsRecorder, clock);
		slots.put(server, slot);
		TRACKED.incrementAndGet(this);
		idle.offerLast(slot);
		IDLE_SIZE.incrementAndGet(this);
		logger.debug("Pool '{}' created server {} ({}/{})", name(), server.name(), index, capacity());
		return state == PoolState.INITIALIZING;
	}

	Mono<Void> completeInitialization() {
		if (STATE.compareAndSet(this, PoolState.INITIALIZING, PoolState.READY)) {
			logger.info("Pool '{}' initialized with {} servers", name(), capacity());
			drain();
			return Mono.empty();
		}
		return Mono.error(abortedByShutdown());
	}

	PoolInitializationException abortedByShutdown() {
		return new PoolInitializationException(name(), capacity(),
				"Pool '" + name() + "' was shut down during initialization",
				new PoolShutdownException(name()));
	}

	Mono<Void> rollback(Throwable error) {
		STATE.set(this, PoolState.SHUTDOWN);
		PoolInitializationException failure = error instanceof PoolInitializationException
				? (PoolInitializationException) error
				: new PoolInitializationException(name(), capacity(), "Pool '" + name() + "' failed to initialize: " + error, error);
		List<ServerSlot<S>> created = idleClearedSlots();
		logger.error("Pool '" + name() + "' failed to initialize, disposing " + created.size() + " created servers", failure);
		return Flux.fromIterable(created)
		           .concatMap(this::destroySlot)
		           .then(Mono.error(failure));
	}

	@Override
	public Mono<Void> shutdown() {
		return Mono.defer(() -> {
			PoolState previous = STATE.getAndSet(this, PoolState.SHUTDOWN);
			if (previous == PoolState.SHUTDOWN) {
				return Mono.empty();
			}
			if (previous == PoolState.UNINITIALIZED) {
				logger.info("Pool '{}' shut down before being initialized", name());
				return Mono.empty();
			}

			Borrower<S> p;
			while ((p = pending.pollFirst()) != null) {
				PENDING_SIZE.decrementAndGet(this);
				p.fail(new PoolShutdownException(name()));
			}

			List<ServerSlot<S>> owned = idleClearedSlots();
			List<Mono<Void>> disposals = new ArrayList<>(owned.size());
			for (ServerSlot<S> slot : owned) {
				disposals.add(destroySlot(slot));
			}
			logger.info("Pool '{}' shutting down, disposing {} servers", name(), owned.size());
			return Mono.when(disposals)
			           .doOnSuccess(v -> logger.info("Pool '{}' shut down", name()));
		});
	}

	/**
	 * Empty the idle queue and return every slot the pool ever created. The registry itself is kept,
	 * so that a release racing the shutdown still finds the slot of a lent server.
	 */
	List<ServerSlot<S>> idleClearedSlots() {
		while (idle.pollFirst() != null) {
			IDLE_SIZE.decrementAndGet(this);
		}
		synchronized (slots) {
			return new ArrayList<>(slots.values());
		}
	}

	/**
	 * Mark the slot as destroyed and dispose its server, unless another path already did.
	 */
	Mono<Void> destroySlot(ServerSlot<S> slot) {
		int previous = slot.markDestroy();
		if (previous == STATE_DESTROYED) {
			return Mono.empty();
		}
		if (previous == STATE_ACQUIRED) {
			ACQUIRED.decrementAndGet(this);
		}
		TRACKED.decrementAndGet(this);
		return destroyServer(slot);
	}

	@Override
	public PoolState state() {
		return state;
	}

	// == acquire ==

	@Override
	public Mono<S> acquire() {
		return new BorrowerMono<>(this, Duration.ZERO); //the mono is unknown to the pool until requested
	}

	@Override
	public Mono<S> acquire(Duration timeout) {
		Objects.requireNonNull(timeout, "timeout");
		return new BorrowerMono<>(this, timeout); //the mono is unknown to the pool until requested
	}

	@Override
	void doAcquire(Borrower<S> borrower) {
		PoolState s = state;
		if (s != PoolState.READY) {
			borrower.fail(notReady(s, "acquire"));
			return;
		}

		pendingOffer(borrower);
		if (state == PoolState.SHUTDOWN) {
			//shutdown may have drained the pending queue before the offer
			if (pending.remove(borrower)) {
				PENDING_SIZE.decrementAndGet(this);
			}
			borrower.fail(new PoolShutdownException(name()));
			return;
		}
		drain();
	}

	void pendingOffer(Borrower<S> borrower) {
		int postOffer = pendingSize;
		if (pending.offerLast(borrower)) {
			postOffer = PENDING_SIZE.incrementAndGet(this);
		}

		if (idleSize < postOffer) {
			borrower.pendingAcquireStart = clock.millis();
		}
		//concurrent offers can all see an idle server, the drain loop stops the timer of the one it serves
		if (!borrower.pendingAcquireTimeout.isZero()) {
			Disposable task = poolConfig.pendingAcquireTimer().apply(borrower, borrower.pendingAcquireTimeout);
			if (!borrower.setTimeoutTask(task)) {
				task.dispose();
			}
		}
	}

	@Override
	void cancelAcquire(Borrower<S> borrower) {
		if (pending.remove(borrower)) {
			PENDING_SIZE.decrementAndGet(this);
		}
	}

	@Nullable
	Borrower<S> pendingPoll() {
		Borrower<S> b = pending.pollFirst();
		if (b != null) {
			PENDING_SIZE.decrementAndGet(this);
		}
		return b;
	}

	void drain() {
		if (WIP.getAndIncrement(this) == 0) {
			drainLoop();
		}
	}

	private void drainLoop() {
		int missed = 1;

		for (;;) {
			for (;;) {
				if (state == PoolState.SHUTDOWN) {
					//shutdown takes care of both queues
					return;
				}
				if (pendingSize == 0 || idleSize == 0) {
					break;
				}
				/*===================================================*
				 * MATCH: one PENDING Borrower can get IDLE server   *
				 *===================================================*/
				ServerSlot<S> slot = idle.pollFirst();
				if (slot == null) {
					//a concurrent offer has not been counted yet, its drain() will bring us back
					break;
				}
				IDLE_SIZE.decrementAndGet(this);
				if (!slot.markAcquired()) {
					//destroyed while idle (double release), drop it
					continue;
				}
				ACQUIRED.incrementAndGet(this);

				Borrower<S> borrower = pendingPoll();
				if (borrower == null) {
					if (slot.markIdle()) {
						ACQUIRED.decrementAndGet(this);
						idle.offerFirst(slot);
						IDLE_SIZE.incrementAndGet(this);
					}
					//we expect to detect a shut down pool in the next round
					continue;
				}
				if (state == PoolState.SHUTDOWN) {
					//the slot is disposed by shutdown
					borrower.fail(new PoolShutdownException(name()));
					return;
				}
				borrower.stopPendingCountdown(true);
				logger.debug("Pool '{}' lending server {}", name(), slot.server.name());
				poolConfig.acquisitionScheduler()
				          .schedule(() -> borrower.deliver(slot));
			}

			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	// == release ==

	@Override
	public Mono<ReleaseOutcome> release(@Nullable S server, boolean healthy) {
		return Mono.defer(() -> doRelease(server, healthy));
	}

	Mono<ReleaseOutcome> doRelease(@Nullable S server, boolean healthy) {
		if (server == null) {
			logger.warn("Pool '{}' ignored the release of a null server", name());
			return Mono.just(ReleaseOutcome.IGNORED);
		}
		PoolState s = state;
		if (s != PoolState.READY) {
			logger.warn("Pool '{}' rejected the release of server {} while {}", name(), server.name(), s);
			return Mono.just(ReleaseOutcome.REJECTED);
		}

		ServerSlot<S> slot = slotOf(server);
		if (slot == null) {
			metricsRecorder.recordReleaseAnomaly();
			logger.warn("Pool '{}' discarding server {} which it did not create", name(), server.name());
			ServerSlot<S> orphan = new ServerSlot<>(server, metricsRecorder, clock);
			orphan.markDestroy();
			return destroyServer(orphan).thenReturn(ReleaseOutcome.DISCARDED);
		}

		for (;;) {
			int st = slot.state;
			if (st == STATE_DESTROYED) {
				logger.debug("Pool '{}' ignored the release of already disposed server {}", name(), server.name());
				return Mono.just(ReleaseOutcome.IGNORED);
			}
			if (st == STATE_IDLE) {
				if (slot.markDestroy(STATE_IDLE)) {
					if (idle.remove(slot)) {
						IDLE_SIZE.decrementAndGet(this);
					}
					TRACKED.decrementAndGet(this);
					return discard(slot, "it is already available (double release)");
				}
				continue;
			}

			if (healthy && idleSize < capacity()) {
				if (slot.markIdle()) {
					ACQUIRED.decrementAndGet(this);
					metricsRecorder.recordRecycled();
					offerIdle(slot);
					logger.debug("Pool '{}' recycled server {}", name(), server.name());
					drain();
					return Mono.just(ReleaseOutcome.RECYCLED);
				}
				continue;
			}

			if (slot.markDestroy(STATE_ACQUIRED)) {
				ACQUIRED.decrementAndGet(this);
				TRACKED.decrementAndGet(this);
				if (healthy) {
					return discard(slot, "the available queue is already full");
				}
				metricsRecorder.recordUnhealthyRelease();
				logger.info("Pool '{}' destroying unhealthy server {}, {} servers left", name(), server.name(), tracked);
				return destroyServer(slot).thenReturn(ReleaseOutcome.DESTROYED);
			}
		}
	}

	@Nullable
	ServerSlot<S> slotOf(S server) {
		return slots.get(server);
	}

	Mono<ReleaseOutcome> discard(ServerSlot<S> slot, String reason) {
		metricsRecorder.recordReleaseAnomaly();
		logger.warn("Pool '{}' discarding server {} because {}", name(), slot.server.name(), reason);
		return destroyServer(slot).thenReturn(ReleaseOutcome.DISCARDED);
	}

	void offerIdle(ServerSlot<S> slot) {
		idle.offerLast(slot);
		IDLE_SIZE.incrementAndGet(this);
		//shutdown may have emptied the queue before the offer, its snapshot of slots disposes this one
		if (state == PoolState.SHUTDOWN && idle.remove(slot)) {
			IDLE_SIZE.decrementAndGet(this);
		}
	}

	@Override
	void recycleUndelivered(ServerSlot<S> slot) {
		if (slot.markIdle()) {
			ACQUIRED.decrementAndGet(this);
			offerIdle(slot);
			drain();
		}
	}

	PoolStateException notReady(PoolState s, String operation) {
		if (s == PoolState.SHUTDOWN) {
			return new PoolShutdownException(name());
		}
		return new PoolStateException(name(), s, "Pool '" + name() + "' cannot " + operation + " while " + s);
	}

	// == metrics ==

	@Override
	public int availableSize() {
		return idleSize;
	}

	@Override
	public int trackedSize() {
		return tracked;
	}

	@Override
	public int acquiredSize() {
		return acquired;
	}

	@Override
	public int pendingAcquireSize() {
		return pendingSize;
	}

	@Override
	public String toString() {
		return "BoundedServerPool{" +
				"name=" + name() +
				", state=" + state +
				", capacity=" + capacity() +
				", available=" + idleSize +
				", tracked=" + tracked +
				'}';
	}

	static final class BorrowerMono<S extends PooledServer> extends Mono<S> {

		final BoundedServerPool<S> parent;
		final Duration             acquireTimeout;

		BorrowerMono(BoundedServerPool<S> pool, Duration acquireTimeout) {
			this.parent = pool;
			this.acquireTimeout = acquireTimeout;
		}

		@Override
		public void subscribe(CoreSubscriber<? super S> actual) {
			Objects.requireNonNull(actual, "subscribing with null");
			Borrower<S> borrower = new Borrower<>(actual, parent, acquireTimeout);
			actual.onSubscribe(borrower);
		}
	}
}
