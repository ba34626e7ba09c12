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
import java.util.function.BiFunction;

import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

/**
 * The default immutable {@link PoolConfig}, as produced by {@link ServerPoolBuilder}.
 *
 * @author Simon Baslé
 */
public class DefaultPoolConfig<S extends PooledServer> implements PoolConfig<S> {

	protected final String                                     name;
	protected final int                                        capacity;
	protected final ServerFactory<S>                           factory;
	protected final Scheduler                                  acquisitionScheduler;
	protected final BiFunction<Runnable, Duration, Disposable> pendingAcquireTimer;
	protected final PoolMetricsRecorder                        metricsRecorder;
	protected final Clock                                      clock;

	public DefaultPoolConfig(String name,
			int capacity,
			ServerFactory<S> factory,
			Scheduler acquisitionScheduler,
			BiFunction<Runnable, Duration, Disposable> pendingAcquireTimer,
			PoolMetricsRecorder metricsRecorder,
			Clock clock) {
		this.name = name;
		this.capacity = capacity;
		this.factory = factory;
		this.acquisitionScheduler = acquisitionScheduler;
		this.pendingAcquireTimer = pendingAcquireTimer;
		this.metricsRecorder = metricsRecorder;
		this.clock = clock;
	}

	@Override
	public String name() {
		return this.name;
	}

	@Override
	public int capacity() {
		return this.capacity;
	}

	@Override
	public ServerFactory<S> factory() {
		return this.factory;
	}

	@Override
	public Scheduler acquisitionScheduler() {
		return this.acquisitionScheduler;
	}

	@Override
	public BiFunction<Runnable, Duration, Disposable> pendingAcquireTimer() {
		return this.pendingAcquireTimer;
	}

	@Override
	public PoolMetricsRecorder metricsRecorder() {
		return this.metricsRecorder;
	}

	@Override
	public Clock clock() {
		return this.clock;
	}

	@Override
	public String toString() {
		return "PoolConfig{name='" + name + "', capacity=" + capacity + "}";
	}
}
