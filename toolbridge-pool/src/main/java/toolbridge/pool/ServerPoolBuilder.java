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
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * A builder for {@link ServerPool} implementations, which tuning methods map to a
 * {@link PoolConfig}.
 * <p>
 * Every invalid parameter is reported synchronously with a {@link PoolConfigurationException},
 * either by the setter that received it or by {@link #buildPool()} for the parameters that have
 * no usable default ({@link #capacity(int)}).
 *
 * @param <S> the type of servers in the produced {@link ServerPool}
 * @author Simon Baslé
 */
public class ServerPoolBuilder<S extends PooledServer> {

	/**
	 * Start building a {@link ServerPool} by describing how new servers are to be asynchronously created.
	 * The factory is invoked exactly {@link #capacity(int) capacity} times, during {@link ServerPool#initialize()}.
	 *
	 * @param factory the asynchronous creator of servers
	 * @param <S> the type of server managed by the {@link ServerPool}
	 * @return a builder of {@link ServerPool}
	 * @throws PoolConfigurationException if the factory is {@code null}
	 */
	public static <S extends PooledServer> ServerPoolBuilder<S> from(ServerFactory<S> factory) {
		return new ServerPoolBuilder<>(require(factory, "factory"));
	}

	final ServerFactory<S>                     factory;
	String                                     name                 = DEFAULT_NAME;
	int                                        capacity             = 0;
	Scheduler                                  acquisitionScheduler = Schedulers.immediate();
	BiFunction<Runnable, Duration, Disposable> pendingAcquireTimer  = DEFAULT_PENDING_ACQUIRE_TIMER;
	PoolMetricsRecorder                        metricsRecorder      = NoOpPoolMetricsRecorder.INSTANCE;
	Clock                                      clock                = Clock.systemUTC();

	ServerPoolBuilder(ServerFactory<S> factory) {
		this.factory = factory;
	}

	/**
	 * Set the diagnostic name of the pool, used in logs, exception messages and metric tags.
	 * Defaults to {@value #DEFAULT_NAME}.
	 *
	 * @param name the name of the pool, not blank
	 * @return this {@link ServerPool} builder
	 */
	public ServerPoolBuilder<S> name(String name) {
		if (name == null || name.trim().isEmpty()) {
			throw new PoolConfigurationException("Pool name must not be blank");
		}
		this.name = name;
		return this;
	}

	/**
	 * Set the number of servers the pool creates on {@link ServerPool#initialize()}. This is also
	 * the maximum number of servers the pool will ever own: servers lost to unhealthy releases are
	 * not replaced. Mandatory.
	 *
	 * @param capacity the strictly positive capacity
	 * @return this {@link ServerPool} builder
	 */
	public ServerPoolBuilder<S> capacity(int capacity) {
		if (capacity <= 0) {
			throw new PoolConfigurationException("Pool capacity must be positive, got " + capacity);
		}
		this.capacity = capacity;
		return this;
	}

	/**
	 * Provide a {@link Scheduler} on which servers are delivered to borrowers that had to wait,
	 * making the delivery thread deterministic.
	 * <p>
	 * Defaults to {@link Schedulers#immediate()}.
	 *
	 * @param acquisitionScheduler the {@link Scheduler} on which to deliver acquired servers
	 * @return this {@link ServerPool} builder
	 */
	public ServerPoolBuilder<S> acquisitionScheduler(Scheduler acquisitionScheduler) {
		this.acquisitionScheduler = require(acquisitionScheduler, "acquisitionScheduler");
		return this;
	}

	/**
	 * Define how timeouts are scheduled when a {@link ServerPool#acquire(Duration)} call is pending.
	 * <p>
	 * By default, the {@link Schedulers#parallel()} scheduler is used.
	 *
	 * @param pendingAcquireTimer the function to apply when scheduling timers for pending acquisitions
	 * @return this {@link ServerPool} builder
	 */
	public ServerPoolBuilder<S> pendingAcquireTimer(BiFunction<Runnable, Duration, Disposable> pendingAcquireTimer) {
		this.pendingAcquireTimer = require(pendingAcquireTimer, "pendingAcquireTimer");
		return this;
	}

	/**
	 * Set up the optional {@link PoolMetricsRecorder} for {@link ServerPool} instrumentation.
	 * <p>
	 * Defaults to a no-op recorder.
	 *
	 * @param recorder the {@link PoolMetricsRecorder}
	 * @return this {@link ServerPool} builder
	 */
	public ServerPoolBuilder<S> metricsRecorder(PoolMetricsRecorder recorder) {
		this.metricsRecorder = require(recorder, "metricsRecorder");
		return this;
	}

	/**
	 * Use an {@link Clock} other than the default {@link Clock#systemUTC()} to timestamp server
	 * creation and release. Mostly useful in tests.
	 *
	 * @param clock the {@link Clock} to use
	 * @return this {@link ServerPool} builder
	 */
	public ServerPoolBuilder<S> clock(Clock clock) {
		this.clock = require(clock, "clock");
		return this;
	}

	/**
	 * Construct a default flavor of {@link InstrumentedServerPool}, in the
	 * {@link PoolState#UNINITIALIZED} state.
	 *
	 * @return an {@link InstrumentedServerPool} that still needs to be {@link ServerPool#initialize() initialized}
	 * @throws PoolConfigurationException if the capacity has not been set
	 */
	public InstrumentedServerPool<S> buildPool() {
		return new BoundedServerPool<>(buildConfig());
	}

	PoolConfig<S> buildConfig() {
		if (capacity <= 0) {
			throw new PoolConfigurationException("Pool '" + name + "' needs a positive capacity");
		}
		return new DefaultPoolConfig<>(name,
				capacity,
				factory,
				acquisitionScheduler,
				pendingAcquireTimer,
				metricsRecorder,
				clock);
	}

	static <T> T require(T value, String what) {
		if (value == null) {
			throw new PoolConfigurationException(what + " must not be null");
		}
		return value;
	}

	static final String DEFAULT_NAME = "toolServers";
	static final BiFunction<Runnable, Duration, Disposable> DEFAULT_PENDING_ACQUIRE_TIMER =
			(r, d) -> Schedulers.parallel().schedule(r, d.toNanos(), TimeUnit.NANOSECONDS);
}
