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
import reactor.core.scheduler.Schedulers;

/**
 * A representation of the configuration options of a {@link ServerPool}.
 * For a default implementation that is open for extension, see {@link DefaultPoolConfig}.
 *
 * @param <S> the type of server in the pool
 * @author Simon Baslé
 */
public interface PoolConfig<S extends PooledServer> {

	/**
	 * The diagnostic name of the pool, used in logs, exception messages and metric tags.
	 */
	String name();

	/**
	 * The exact number of servers created by {@link ServerPool#initialize()}, and the upper bound
	 * of servers the pool will ever own.
	 */
	int capacity();

	/**
	 * The asynchronous factory that produces new servers.
	 */
	ServerFactory<S> factory();

	/**
	 * When set to anything other than {@link Schedulers#immediate()}, servers handed to pending
	 * borrowers are published on this {@link Scheduler} rather than on whichever thread released them.
	 */
	Scheduler acquisitionScheduler();

	/**
	 * The function that defines how timeouts are scheduled when a {@link ServerPool#acquire(Duration)} call
	 * has to wait for a release. By default, the {@link Schedulers#parallel()} scheduler is used.
	 */
	BiFunction<Runnable, Duration, Disposable> pendingAcquireTimer();

	/**
	 * The {@link PoolMetricsRecorder} to use to collect instrumentation data.
	 */
	PoolMetricsRecorder metricsRecorder();

	/**
	 * The {@link java.time.Clock} to use to timestamp pool lifecycle events like creation and release.
	 */
	Clock clock();
}
