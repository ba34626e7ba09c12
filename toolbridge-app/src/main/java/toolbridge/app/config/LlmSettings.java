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

import reactor.util.annotation.Nullable;

/**
 * Connection settings of the LLM endpoint the agent talks to.
 */
public final class LlmSettings {

	@Nullable
	final String baseUrl;
	@Nullable
	final String apiKey;
	@Nullable
	final String model;

	public LlmSettings(@Nullable String baseUrl, @Nullable String apiKey, @Nullable String model) {
		this.baseUrl = baseUrl;
		this.apiKey = apiKey;
		this.model = model;
	}

	@Nullable
	public String baseUrl() {
		return baseUrl;
	}

	@Nullable
	public String apiKey() {
		return apiKey;
	}

	@Nullable
	public String model() {
		return model;
	}

	/**
	 * @return true if both the base url and the api key are set
	 */
	public boolean isConfigured() {
		return baseUrl != null && apiKey != null;
	}

	@Override
	public String toString() {
		//never print the key
		return "LlmSettings{" +
				"baseUrl='" + baseUrl + '\'' +
				", apiKey=" + (apiKey == null ? "null" : "****") +
				", model='" + model + '\'' +
				'}';
	}
}
