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

package toolbridge.pool.introspection.micrometer;

import io.micrometer.common.docs.KeyName;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.docs.MeterDocumentation;

/**
 * Meters used by {@link Micrometer} utility. Names are templates in which {@code %s} is
 * replaced by the {@link #PREFIX}.
 */
enum DocumentedPoolMeters implements MeterDocumentation {

	/**
	 * Servers waiting in the pool to be acquired.
	 */
	AVAILABLE {
		@Override
		public String getName() {
			return "%s.servers.available";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},
	/**
	 * Servers owned by the pool, available or acquired.
	 */
	TRACKED {
		@Override
		public String getName() {
			return "%s.servers.tracked";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},
	/**
	 * Servers currently lent out.
	 */
	ACQUIRED {
		@Override
		public String getName() {
			return "%s.servers.acquired";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},
	/**
	 * Acquisitions waiting for a server to be released.
	 */
	PENDING_ACQUIRE {
		@Override
		public String getName() {
			return "%s.servers.pendingAcquire";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	/**
	 * Time spent creating each server during initialization.
	 */
	ALLOCATION {
		@Override
		public String getName() {
			return "%s.allocation";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), OutcomeTags.values());
		}
	},

	/**
	 * Time spent disposing servers.
	 */
	DESTROYED {
		@Override
		public String getName() {
			return "%s.destroyed";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	/**
	 * Disposals that failed. The server is dropped regardless.
	 */
	DESTROY_FAILURES {
		@Override
		public String getName() {
			return "%s.destroyed.failures";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	/**
	 * Healthy releases that made a server available again.
	 */
	RECYCLED {
		@Override
		public String getName() {
			return "%s.recycled";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	/**
	 * Unhealthy releases, each of which permanently shrinks the pool.
	 */
	RELEASED_UNHEALTHY {
		@Override
		public String getName() {
			return "%s.released.unhealthy";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	/**
	 * Releases the pool had to discard: double releases, foreign servers, full queue.
	 */
	RELEASE_ANOMALIES {
		@Override
		public String getName() {
			return "%s.released.anomalies";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	/**
	 * Time waited by acquisitions that could not be served right away.
	 */
	PENDING {
		@Override
		public String getName() {
			return "%s.pending";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), OutcomeTags.values());
		}
	},

	SUMMARY_IDLENESS {
		@Override
		public String getName() {
			return "%s.servers.summary.idleness";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	SUMMARY_LIFETIME {
		@Override
		public String getName() {
			return "%s.servers.summary.lifetime";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	};

	static final String PREFIX = "toolbridge.pool";

	/**
	 * @return the name of the meter, with the {@link #PREFIX} applied
	 */
	String meterName() {
		return String.format(getName(), PREFIX);
	}

	public enum CommonTags implements KeyName {

		/**
		 * The name of the pool, as given to the {@link Micrometer} utility.
		 */
		POOL_NAME {
			@Override
			public String asString() {
				return "pool.name";
			}
		}
	}

	public enum OutcomeTags implements KeyName {

		/**
		 * Indicates whether the timed operation was a {@code success} or {@code failure}.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "pool.outcome";
			}
		};

		public static final Tag OUTCOME_SUCCESS = Tag.of(OUTCOME.asString(), "success");
		public static final Tag OUTCOME_FAILURE = Tag.of(OUTCOME.asString(), "failure");
	}
}
