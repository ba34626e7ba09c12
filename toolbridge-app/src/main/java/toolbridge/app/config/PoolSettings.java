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
import java.util.List;

/**
 * Settings of one named pool of stdio tool servers.
 */
public final class PoolSettings {

	public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(5);

	final String       name;
	final int          size;
	final List<String> command;
	final Duration     shutdownGrace;

	public PoolSettings(String name, int size, List<String> command, Duration shutdownGrace) {
		this.name = name;
		this.size = size;
		this.command = Collections.unmodifiableList(command);
		this.shutdownGrace = shutdownGrace;
	}

	/**
	 * @return the pool name, used as the registry key
	 */
	public String name() {
		return name;
	}

	/**
	 * @return the number of tool servers the pool starts with
	 */
	public int size() {
		return size;
	}

	/**
	 * @return the command line that starts one tool server process
	 */
	public List<String> command() {
		return command;
	}

	/**
	 * @return how long a tool server process is given to exit before it is killed
	 */
	public Duration shutdownGrace() {
		return shutdownGrace;
	}

	PoolSettings withSize(int newSize) {
		return new PoolSettings(name, newSize, command, shutdownGrace);
	}

	@Override
	public String toString() {
		return "PoolSettings{" +
				"name='" + name + '\'' +
				", size=" + size +
				", command=" + command +
				", shutdownGrace=" + shutdownGrace +
				'}';
	}
}
