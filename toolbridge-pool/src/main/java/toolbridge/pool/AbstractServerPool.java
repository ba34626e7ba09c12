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
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscription;

import reactor.core.CoreSubscriber;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.Scannable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Operators;
import reactor.util.Logger;
import reactor.util.annotation.Nullable;

/**
 * An abstract base version of a {@link ServerPool}, mutualizing small amounts of code and allowing to build common
 * related classes like {@link ServerSlot} or {@link Borrower}.
 *
 * @author Simon Baslé
 */
abstract class AbstractServerPool<S extends PooledServer> implements InstrumentedServerPool<S>,
                                                                     InstrumentedServerPool.PoolMetrics {

	//A pool should be rare enough that having instance loggers should be ok
	//This helps with testability of some methods that for now mainly log
	final Logger logger;

	final PoolConfig<S> poolConfig;

	final PoolMetricsRecorder metricsRecorder;
	final Clock clock;

	AbstractServerPool(PoolConfig<S> poolConfig, Logger logger) {
		this.poolConfig = poolConfig;
		this.logger = logger;
		this.metricsRecorder = poolConfig.metricsRecorder();
		this.clock = poolConfig.clock();
	}

	// == pool introspection methods ==

	@Override
	public PoolConfig<S> config() {
		return this.poolConfig;
	}

	@Override
	public PoolMetrics metrics() {
		return this;
	}

	@Override
	public String name() {
		return poolConfig.name();
	}

	@Override
	public int capacity() {
		return poolConfig.capacity();
	}

	@Override
	public int getCapacity() {
		return poolConfig.capacity();
	}

	// == common methods to interact with idle/pending queues ==

	/**
	 * Note to implementors: stop the {@link Borrower} countdown by calling
	 * {@link Borrower#stopPendingCountdown(boolean)} as soon as it is known that a server is
	 * available for it.
	 */
	abstract void doAcquire(Borrower<S> borrower);
	abstract void cancelAcquire(Borrower<S> borrower);

	/**
	 * Put back a slot that was marked as acquired for a {@link Borrower} that got cancelled
	 * before the server could be delivered.
	 */
	abstract void recycleUndelivered(ServerSlot<S> slot);

	/**
	 * Dispose the server held by the given slot. The returned {@link Mono} never errors: disposal
	 * failures are logged and recorded.
	 * <p>
	 * Calls to this method MUST be guarded by a successful {@link ServerSlot#markDestroy()}.
	 *
	 * @param slot the {@link ServerSlot} that is not part of the live set anymore
	 * @return the destroy {@link Mono}
	 */
	Mono<Void> destroyServer(ServerSlot<S> slot) {
		if (slot.state != ServerSlot.STATE_DESTROYED) {
			throw new IllegalStateException("destroying a live slot " + slot);
		}
		S server = slot.server;
		metricsRecorder.recordLifetimeDuration(slot.lifeTime());
		return Mono.defer(() -> {
			long start = clock.millis();
			Mono<Void> disposal;
			try {
				disposal = Mono.from(server.disposeLater());
			}
			catch (Throwable disposeError) {
				disposal = Mono.error(disposeError);
			}
			return disposal
					.doFinally(fin -> metricsRecorder.recordDestroyLatency(clock.millis() - start))
					.doOnSuccess(v -> logger.debug("Pool '{}' disposed server {}", name(), server.name()))
					.onErrorResume(error -> {
						metricsRecorder.recordDestroyFailure();
						logger.warn("Pool '" + name() + "' failed to dispose server " + server.name(), error);
						return Mono.empty();
					});
		});
	}

	/**
	 * The pool's bookkeeping around a single server: its lifecycle state and timestamps.
	 *
	 * @author Simon Baslé
	 */
	static final class ServerSlot<S extends PooledServer> {

		final S                   server;
		final long                creationTimestamp;
		final PoolMetricsRecorder metricsRecorder;
		final Clock               clock;

		volatile long releaseTimestamp;

		volatile int state;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<ServerSlot> STATE = AtomicIntegerFieldUpdater.newUpdater(ServerSlot.class, "state");

		ServerSlot(S server, PoolMetricsRecorder metricsRecorder, Clock clock) {
			this.server = server;
			this.metricsRecorder = metricsRecorder;
			this.clock = clock;
			this.creationTimestamp = clock.millis();
			this.releaseTimestamp = -1L;
			this.state = STATE_IDLE;
		}

		/**
		 * @return true if the slot went from idle to acquired
		 */
		boolean markAcquired() {
			if (STATE.compareAndSet(this, STATE_IDLE, STATE_ACQUIRED)) {
				long rt = releaseTimestamp;
				metricsRecorder.recordIdleTime(clock.millis() - (rt > 0 ? rt : creationTimestamp));
				return true;
			}
			return false;
		}

		/**
		 * @return true if the slot went from acquired back to idle
		 */
		boolean markIdle() {
			if (STATE.compareAndSet(this, STATE_ACQUIRED, STATE_IDLE)) {
				this.releaseTimestamp = clock.millis();
				return true;
			}
			return false;
		}

		/**
		 * Mark the slot for destruction, whatever its current state. Only the caller that
		 * observes a previous state other than {@link #STATE_DESTROYED} may dispose the server.
		 *
		 * @return the state the slot was in before this call
		 */
		int markDestroy() {
			return STATE.getAndSet(this, STATE_DESTROYED);
		}

		/**
		 * @return true if the slot went from the expected state to destroyed
		 */
		boolean markDestroy(int expected) {
			return expected != STATE_DESTROYED && STATE.compareAndSet(this, expected, STATE_DESTROYED);
		}

		long lifeTime() {
			return clock.millis() - creationTimestamp;
		}

		@Override
		public String toString() {
			return "ServerSlot{" +
					"server=" + server.name() +
					", state=" + state +
					", lifeTime=" + lifeTime() + "ms" +
					'}';
		}

		static final int STATE_IDLE      = 0;
		static final int STATE_ACQUIRED  = 1;
		//destroyed or in the process of being destroyed
		static final int STATE_DESTROYED = 2;
	}

	/**
	 * Common inner {@link Subscription} to be used to deliver servers from an {@link AbstractServerPool}.
	 * Exactly one of delivery, cancellation, timeout or failure wins the terminal flag.
	 *
	 * @author Simon Baslé
	 */
	static final class Borrower<S extends PooledServer> extends AtomicBoolean implements Scannable, Subscription, Runnable {

		static final Disposable TIMEOUT_DISPOSED = Disposables.disposed();
		static final Disposable TIMEOUT_STOPPED = Disposables.disposed();

		final CoreSubscriber<? super S> actual;
		final AbstractServerPool<S>     pool;
		final Duration                  pendingAcquireTimeout;

		volatile long pendingAcquireStart;
		volatile Disposable timeoutTask;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<Borrower, Disposable> TIMEOUT_TASK =
				AtomicReferenceFieldUpdater.newUpdater(Borrower.class, Disposable.class, "timeoutTask");

		Borrower(CoreSubscriber<? super S> actual,
				AbstractServerPool<S> pool,
				Duration pendingAcquireTimeout) {
			this.actual = actual;
			this.pool = pool;
			this.pendingAcquireTimeout = pendingAcquireTimeout;
			this.timeoutTask = TIMEOUT_DISPOSED;
		}

		@Override
		public void run() {
			if (Borrower.this.compareAndSet(false, true)) {
				// this is failure, a timeout was observed
				stopPendingCountdown(false);
				pool.cancelAcquire(Borrower.this);
				actual.onError(new PoolAcquireTimeoutException(pool.name(), pendingAcquireTimeout));
			}
		}

		@Override
		public void request(long n) {
			if (Operators.validate(n)) {
				pool.doAcquire(this);
			}
		}

		/**
		 * Atomically set the timeout task if not already stopped.
		 *
		 * @return true if the task was set, false if countdown was already stopped
		 * @see #stopPendingCountdown(boolean)
		 */
		boolean setTimeoutTask(Disposable task) {
			return TIMEOUT_TASK.compareAndSet(this, TIMEOUT_DISPOSED, task);
		}

		/**
		 * Stop the countdown started when the borrower was queued as pending.
		 */
		void stopPendingCountdown(boolean success) {
			long start = pendingAcquireStart;
			if (start > 0) {
				if (success) {
					pool.metricsRecorder.recordPendingSuccessAndLatency(pool.clock.millis() - start);
				}
				else {
					pool.metricsRecorder.recordPendingFailureAndLatency(pool.clock.millis() - start);
				}
				pendingAcquireStart = 0;
			}
			Disposable task = TIMEOUT_TASK.getAndSet(this, TIMEOUT_STOPPED);
			task.dispose();
		}

		@Override
		public void cancel() {
			if (compareAndSet(false, true)) {
				pool.cancelAcquire(this);
				stopPendingCountdown(true); // this is not failure, the subscription was canceled
			}
		}

		@Override
		@Nullable
		public Object scanUnsafe(Attr key) {
			if (key == Attr.CANCELLED) return get();
			if (key == Attr.REQUESTED_FROM_DOWNSTREAM) return 1;
			if (key == Attr.ACTUAL) return actual;

			return null;
		}

		void deliver(ServerSlot<S> slot) {
			stopPendingCountdown(true);
			if (compareAndSet(false, true)) {
				actual.onNext(slot.server);
				actual.onComplete();
			}
			else {
				//CANCELLED
				pool.recycleUndelivered(slot);
			}
		}

		void fail(Throwable error) {
			if (compareAndSet(false, true)) {
				stopPendingCountdown(false);
				actual.onError(error);
			}
			//otherwise the borrower already terminated, nobody is left to notify
		}

		@Override
		public String toString() {
			return get() ? "Borrower(terminated)" : "Borrower";
		}
	}
}
