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

package toolbridge.app;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * One incoming chat message, with the identity of its conversation and sender and free-form
 * transport attributes.
 */
public final class MessageContext {

	/**
	 * The attribute naming the pool a message should be served by, when not the default one.
	 */
	public static final String POOL_ATTRIBUTE = "pool";

	final String              conversationId;
	final String              senderId;
	final String              content;
	final Map<String, String> attributes;

	public MessageContext(String conversationId, String senderId, String content, Map<String, String> attributes) {
		this.conversationId = conversationId;
		this.senderId = senderId;
		this.content = content;
		this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}

	public static MessageContext of(String conversationId, String senderId, String content) {
		return new MessageContext(conversationId, senderId, content, Collections.emptyMap());
	}

	/**
	 * @return a copy of this context with the given attribute added or replaced
	 */
	public MessageContext withAttribute(String key, String value) {
		Map<String, String> copy = new LinkedHashMap<>(attributes);
		copy.put(key, value);
		return new MessageContext(conversationId, senderId, content, copy);
	}

	public String conversationId() {
		return conversationId;
	}

	public String senderId() {
		return senderId;
	}

	public String content() {
		return content;
	}

	public Map<String, String> attributes() {
		return attributes;
	}

	@Nullable
	public String attribute(String key) {
		return attributes.get(key);
	}

	@Override
	public String toString() {
		return "MessageContext{" +
				"conversationId='" + conversationId + '\'' +
				", senderId='" + senderId + '\'' +
				", attributes=" + attributes +
				'}';
	}
}
