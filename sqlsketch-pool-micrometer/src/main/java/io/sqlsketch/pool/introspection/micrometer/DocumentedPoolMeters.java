/*
 * Copyright (c) 2026 The sqlsketch-pool Authors. All Rights Reserved.
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

package io.sqlsketch.pool.introspection.micrometer;

import io.micrometer.common.docs.KeyName;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.docs.MeterDocumentation;

/**
 * Meters used by {@link Micrometer} utility.
 */
public enum DocumentedPoolMeters implements MeterDocumentation {

	/**
	 * Gauge of the number of connections currently checked out of the pool.
	 */
	ACQUIRED {
		@Override
		public String getName() {
			return "sqlsketch.pool.connections.acquired";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Gauge of the number of live connections, acquired or idle.
	 */
	ALLOCATED {
		@Override
		public String getName() {
			return "sqlsketch.pool.connections.allocated";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Gauge of the number of idle connections.
	 */
	IDLE {
		@Override
		public String getName() {
			return "sqlsketch.pool.connections.idle";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Gauge of the number of parked acquisitions.
	 */
	PENDING_ACQUIRE {
		@Override
		public String getName() {
			return "sqlsketch.pool.connections.pendingAcquire";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * Timer measuring the establishment of new connections, tagged with the outcome.
	 */
	ALLOCATION {
		@Override
		public String getName() {
			return "sqlsketch.pool.allocation";
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), AllocationTags.values());
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	/**
	 * Timer measuring the closing of connections.
	 */
	DESTROYED {
		@Override
		public String getName() {
			return "sqlsketch.pool.destroyed";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	/**
	 * Timer recording how long connections had been idle when handed out.
	 */
	SUMMARY_IDLENESS {
		@Override
		public String getName() {
			return "sqlsketch.pool.connections.summary.idleness";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	/**
	 * Timer recording how long connections lived, when they are closed.
	 */
	SUMMARY_LIFETIME {
		@Override
		public String getName() {
			return "sqlsketch.pool.connections.summary.lifetime";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	/**
	 * Counter of acquisitions, tagged with whether they were served right away or after waiting.
	 */
	ACQUIRED_PATH {
		@Override
		public String getName() {
			return "sqlsketch.pool.acquired.path";
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), AcquiredPathTags.values());
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}
	},

	/**
	 * Timer measuring the wait of acquisitions that could not be served right away, tagged with the outcome.
	 */
	PENDING {
		@Override
		public String getName() {
			return "sqlsketch.pool.pending";
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), PendingTags.values());
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}
	},

	/**
	 * Counter of idle connections that failed their health check.
	 */
	VALIDATION_FAILED {
		@Override
		public String getName() {
			return "sqlsketch.pool.validation.failed";
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}
	};

	public enum CommonTags implements KeyName {

		/**
		 * The name of the pool, as provided when instrumenting it.
		 */
		POOL_NAME {
			@Override
			public String asString() {
				return "pool.name";
			}
		}
	}

	public enum AllocationTags implements KeyName {

		/**
		 * Indicates whether the allocation timed was a {@code success} or {@code failure}.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "pool.allocation.outcome";
			}
		};

		public static final Tag OUTCOME_SUCCESS = Tag.of(OUTCOME.asString(), "success");
		public static final Tag OUTCOME_FAILURE = Tag.of(OUTCOME.asString(), "failure");
	}

	public enum AcquiredPathTags implements KeyName {

		/**
		 * Indicates whether the acquisition was served without waiting ({@code fast}) or
		 * after spinning or parking ({@code slow}).
		 */
		PATH {
			@Override
			public String asString() {
				return "pool.acquired.path";
			}
		};

		public static final Tag PATH_FAST = Tag.of(PATH.asString(), "fast");
		public static final Tag PATH_SLOW = Tag.of(PATH.asString(), "slow");
	}

	public enum PendingTags implements KeyName {

		/**
		 * Indicates whether the waiting acquisition was eventually served ({@code success}),
		 * or failed ({@code failure}), eg. timed out.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "pool.pending.outcome";
			}
		};

		public static final Tag OUTCOME_SUCCESS = Tag.of(OUTCOME.asString(), "success");
		public static final Tag OUTCOME_FAILURE = Tag.of(OUTCOME.asString(), "failure");
	}
}
