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

/**
 * The chat side of the bridge: delivers incoming messages to a {@link MessageHandler} and sends its
 * replies back to the conversation they came from.
 */
public interface ChatTransport {

	/**
	 * Start receiving messages. Returns once the transport is connected.
	 *
	 * @param handler the handler every incoming message is given to
	 */
	void start(MessageHandler handler);

	/**
	 * Stop receiving messages. Messages being handled may still be answered.
	 */
	void stop();
}
