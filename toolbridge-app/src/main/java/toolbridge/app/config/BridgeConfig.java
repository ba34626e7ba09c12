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

package toolbridge.app.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The validated configuration of the bridge application, as produced by {@link ConfigLoader}.
 * Pools are kept in declaration order, which is also their initialization order.
 */
public final class BridgeConfig {

	public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(2);

	final Map<String, PoolSettings> pools;
	final String                    defaultPool;
	final Duration                  acquireTimeout;
	final Duration                  requestTimeout;
	final LlmSettings               llm;

	public BridgeConfig(Map<String, PoolSettings> pools, String defaultPool, Duration acquireTimeout,
			Duration requestTimeout, LlmSettings llm) {
		if (pools.isEmpty()) {
			throw new ConfigLoadException("At least one pool must be configured under 'pools'");
		}
		if (!pools.containsKey(defaultPool)) {
			throw new ConfigLoadException("The default pool '" + defaultPool + "' is not one of the configured pools " + pools.keySet());
		}
		if (acquireTimeout.isNegative() || acquireTimeout.isZero()) {
			throw new ConfigLoadException("The acquire timeout must be positive, got " + acquireTimeout.toMillis() + "ms");
		}
		if (requestTimeout.isNegative() || requestTimeout.isZero()) {
			throw new ConfigLoadException("The request timeout must be positive, got " + requestTimeout.toMillis() + "ms");
		}
		this.pools = Collections.unmodifiableMap(new LinkedHashMap<>(pools));
		this.defaultPool = defaultPool;
		this.acquireTimeout = acquireTimeout;
		this.requestTimeout = requestTimeout;
		this.llm = llm;
	}

	public Map<String, PoolSettings> pools() {
		return pools;
	}

	/**
	 * @return the key of the pool used for messages that do not name one
	 */
	public String defaultPool() {
		return defaultPool;
	}

	/**
	 * @return how long a message waits for a tool server before it is answered with an error
	 */
	public Duration acquireTimeout() {
		return acquireTimeout;
	}

	/**
	 * @return how long a borrowed tool server may take to serve one message before it is given up on
	 * and destroyed
	 */
	public Duration requestTimeout() {
		return requestTimeout;
	}

	public LlmSettings llm() {
		return llm;
	}

	@Override
	public String toString() {
		return "BridgeConfig{" +
				"pools=" + pools.values() +
				", defaultPool='" + defaultPool + '\'' +
				", acquireTimeout=" + acquireTimeout +
				", requestTimeout=" + requestTimeout +
				", llm=" + llm +
				'}';
	}
}
