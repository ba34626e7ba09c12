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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

/**
 * Loads a {@link BridgeConfig} from a YAML file, then overlays environment variables.
 * <p>
 * The file is {@code toolbridge.yaml} in the working directory unless {@code --config <path>}
 * is given. Its layout is:
 * <pre>
 * default-pool: stdio
 * acquire-timeout-ms: 30000
 * request-timeout-ms: 120000
 * llm:
 *   base-url: https://llm.example.com/v1
 *   api-key: secret
 *   model: some-model
 * pools:
 *   stdio:
 *     size: 2
 *     command: [ "node", "employee-server.js" ]
 *     shutdown-grace-ms: 5000
 * </pre>
 * <p>
 * Recognized environment variables, which win over the file when set to a non blank value:
 * {@code TOOLBRIDGE_DEFAULT_POOL}, {@code TOOLBRIDGE_ACQUIRE_TIMEOUT_MS}, {@code TOOLBRIDGE_REQUEST_TIMEOUT_MS},
 * {@code TOOLBRIDGE_LLM_BASE_URL},
 * {@code TOOLBRIDGE_LLM_API_KEY}, {@code TOOLBRIDGE_LLM_MODEL} and {@code TOOLBRIDGE_POOLS_<NAME>_SIZE}
 * where {@code <NAME>} is the pool name upper-cased, dashes and dots replaced by underscores.
 */
public final class ConfigLoader {

	static final Logger LOGGER = Loggers.getLogger(ConfigLoader.class);

	static final ObjectMapper YAML_MAPPER         = new ObjectMapper(new YAMLFactory());
	static final String       DEFAULT_CONFIG_FILE = "toolbridge.yaml";
	static final String       ENV_PREFIX          = "TOOLBRIDGE_";

	private ConfigLoader() {
	}

	/**
	 * Load the configuration at the given path, overlaying {@link System#getenv()}.
	 *
	 * @param configPath the YAML file
	 * @return the validated {@link BridgeConfig}
	 * @throws ConfigLoadException if the file is missing, unparseable or invalid
	 */
	public static BridgeConfig load(Path configPath) {
		return load(configPath, System::getenv);
	}

	/**
	 * Load the configuration at the given path, overlaying the variables returned by
	 * {@code envLookup} (which returns {@code null} for undefined variables).
	 *
	 * @param configPath the YAML file
	 * @param envLookup the environment variable lookup
	 * @return the validated {@link BridgeConfig}
	 * @throws ConfigLoadException if the file is missing, unparseable or invalid
	 */
	public static BridgeConfig load(Path configPath, Function<String, String> envLookup) {
		if (!Files.exists(configPath)) {
			throw new ConfigLoadException("Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
		}
		JsonNode root;
		try (InputStream in = Files.newInputStream(configPath)) {
			root = YAML_MAPPER.readTree(in);
		}
		catch (IOException e) {
			throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
		}
		if (root == null || !root.isObject()) {
			throw new ConfigLoadException("Configuration file is empty or not a mapping: " + configPath);
		}
		BridgeConfig config = mapToConfig(root, envLookup);
		LOGGER.info("Loaded configuration from {}: {}", configPath, config);
		return config;
	}

	/**
	 * Resolve the configuration file from the command line arguments.
	 *
	 * @param args the command line arguments
	 * @return the path following {@code --config}, or {@code toolbridge.yaml}
	 */
	public static Path resolveConfigPath(String[] args) {
		for (int i = 0; i < args.length; i++) {
			if ("--config".equals(args[i])) {
				if (i + 1 >= args.length) {
					throw new ConfigLoadException("--config requires a file path argument");
				}
				return Path.of(args[i + 1]);
			}
		}
		return Path.of(DEFAULT_CONFIG_FILE);
	}

	static BridgeConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
		Map<String, PoolSettings> pools = new LinkedHashMap<>();
		JsonNode poolsNode = root.path("pools");
		if (!poolsNode.isMissingNode() && !poolsNode.isObject()) {
			throw new ConfigLoadException("'pools' must be a mapping of pool name to pool settings");
		}
		Iterator<Map.Entry<String, JsonNode>> fields = poolsNode.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> entry = fields.next();
			PoolSettings settings = mapPool(entry.getKey(), entry.getValue());
			Integer sizeOverride = envInt(envLookup, poolSizeVariable(settings.name()));
			if (sizeOverride != null) {
				settings = settings.withSize(sizeOverride);
			}
			if (settings.size() <= 0) {
				throw new ConfigLoadException("Pool '" + settings.name() + "' needs a positive size, got " + settings.size());
			}
			pools.put(settings.name(), settings);
		}
		if (pools.isEmpty()) {
			throw new ConfigLoadException("At least one pool must be configured under 'pools'");
		}

		String defaultPool = envString(envLookup, "DEFAULT_POOL");
		if (defaultPool == null) {
			defaultPool = textOrNull(root, "default-pool");
		}
		if (defaultPool == null) {
			defaultPool = pools.keySet().iterator().next();
		}

		Duration acquireTimeout = timeout(root, envLookup, "acquire-timeout-ms", "ACQUIRE_TIMEOUT_MS",
				BridgeConfig.DEFAULT_ACQUIRE_TIMEOUT);
		Duration requestTimeout = timeout(root, envLookup, "request-timeout-ms", "REQUEST_TIMEOUT_MS",
				BridgeConfig.DEFAULT_REQUEST_TIMEOUT);

		JsonNode llm = root.path("llm");
		LlmSettings llmSettings = new LlmSettings(
				envStringOrDefault(envLookup, "LLM_BASE_URL", textOrNull(llm, "base-url")),
				envStringOrDefault(envLookup, "LLM_API_KEY", textOrNull(llm, "api-key")),
				envStringOrDefault(envLookup, "LLM_MODEL", textOrNull(llm, "model")));

		return new BridgeConfig(pools, defaultPool, acquireTimeout, requestTimeout, llmSettings);
	}

	static Duration timeout(JsonNode root, Function<String, String> envLookup, String field, String variable,
			Duration defaultValue) {
		Integer fromEnv = envInt(envLookup, variable);
		long millis = fromEnv != null ? fromEnv : longOrDefault(root, field, defaultValue.toMillis());
		if (millis <= 0) {
			//zero would mean waiting forever
			throw new ConfigLoadException("'" + field + "' must be a positive number of milliseconds, got " + millis);
		}
		return Duration.ofMillis(millis);
	}

	static PoolSettings mapPool(String name, JsonNode node) {
		if (!node.isObject()) {
			throw new ConfigLoadException("Pool '" + name + "' must be a mapping");
		}
		JsonNode commandNode = node.path("command");
		List<String> command = new ArrayList<>();
		if (commandNode.isArray()) {
			commandNode.forEach(part -> command.add(part.asText()));
		}
		else if (commandNode.isTextual()) {
			for (String part : commandNode.asText().trim().split("\\s+")) {
				if (!part.isEmpty()) {
					command.add(part);
				}
			}
		}
		if (command.isEmpty()) {
			throw new ConfigLoadException("Pool '" + name + "' needs a non-empty 'command'");
		}
		int size = node.has("size") ? node.get("size").asInt() : 1;
		Duration grace = Duration.ofMillis(longOrDefault(node, "shutdown-grace-ms", PoolSettings.DEFAULT_SHUTDOWN_GRACE.toMillis()));
		return new PoolSettings(name, size, command, grace);
	}

	static String poolSizeVariable(String poolName) {
		return "POOLS_" + poolName.toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_') + "_SIZE";
	}

	// == env helpers, names are relative to the TOOLBRIDGE_ prefix ==

	@Nullable
	static String envString(Function<String, String> envLookup, String name) {
		String value = envLookup.apply(ENV_PREFIX + name);
		if (value == null || value.trim().isEmpty()) {
			return null;
		}
		return value.trim();
	}

	@Nullable
	static String envStringOrDefault(Function<String, String> envLookup, String name, @Nullable String fallback) {
		String value = envString(envLookup, name);
		return value != null ? value : fallback;
	}

	@Nullable
	static Integer envInt(Function<String, String> envLookup, String name) {
		String value = envString(envLookup, name);
		if (value == null) {
			return null;
		}
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new ConfigLoadException("Environment variable " + ENV_PREFIX + name + " must be an integer, got '" + value + "'", e);
		}
	}

	// == yaml helpers ==

	@Nullable
	static String textOrNull(JsonNode node, String field) {
		return node.hasNonNull(field) ? node.get(field).asText() : null;
	}

	static long longOrDefault(JsonNode node, String field, long defaultValue) {
		if (!node.hasNonNull(field)) {
			return defaultValue;
		}
		JsonNode value = node.get(field);
		if (!value.canConvertToLong()) {
			throw new ConfigLoadException("'" + field + "' must be a number, got '" + value.asText() + "'");
		}
		return value.asLong();
	}
}
