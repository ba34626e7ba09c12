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

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

/**
 * A {@link ChatTransport} reading one message per line from an input stream and printing each reply
 * to an output stream. Messages of the console are handled one at a time, in order. Blank lines are
 * skipped, and a line of the form {@code @pool message} routes the message to the given pool.
 */
public final class ConsoleChatTransport implements ChatTransport {

	static final Logger LOGGER = Loggers.getLogger(ConsoleChatTransport.class);

	static final String CONVERSATION_ID = "console";

	final InputStream in;
	final PrintStream out;
	final String      senderId;

	@Nullable
	volatile Disposable subscription;

	public ConsoleChatTransport(InputStream in, PrintStream out, String senderId) {
		this.in = in;
		this.out = out;
		this.senderId = senderId;
	}

	@Override
	public void start(MessageHandler handler) {
		if (subscription != null) {
			throw new IllegalStateException("Console transport already started");
		}
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		subscription = Flux.fromStream(reader::lines)
		                   .subscribeOn(Schedulers.boundedElastic())
		                   .filter(line -> !line.trim().isEmpty())
		                   .map(this::toContext)
		                   .concatMap(handler::handle)
		                   .subscribe(out::println,
				                   error -> LOGGER.error("Console transport stopped reading", error),
				                   () -> LOGGER.info("Console input closed"));
		LOGGER.info("Console transport started");
	}

	MessageContext toContext(String line) {
		String trimmed = line.trim();
		if (trimmed.startsWith("@")) {
			int space = trimmed.indexOf(' ');
			if (space > 1) {
				return MessageContext.of(CONVERSATION_ID, senderId, trimmed.substring(space + 1).trim())
				                     .withAttribute(MessageContext.POOL_ATTRIBUTE, trimmed.substring(1, space));
			}
		}
		return MessageContext.of(CONVERSATION_ID, senderId, trimmed);
	}

	@Override
	public void stop() {
		Disposable s = subscription;
		if (s != null) {
			s.dispose();
			LOGGER.info("Console transport stopped");
		}
	}
}
