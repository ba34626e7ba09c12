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

package toolbridge.app.process;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.Logger;
import reactor.util.Loggers;

import toolbridge.pool.PooledServer;

/**
 * A tool server that is a child process spoken to over its standard streams, one request line
 * in, one response line out. The process lives exactly as long as the server.
 * <p>
 * Instances are borrowed exclusively from a pool, so {@link #call(String)} is not meant to be
 * invoked concurrently.
 */
public final class ProcessToolServer implements PooledServer {

	static final Logger LOGGER = Loggers.getLogger(ProcessToolServer.class);

	final String         name;
	final Process        process;
	final Duration       shutdownGrace;
	final BufferedWriter stdin;
	final BufferedReader stdout;

	ProcessToolServer(String name, Process process, Duration shutdownGrace) {
		this.name = name;
		this.process = process;
		this.shutdownGrace = shutdownGrace;
		this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
		this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
	}

	@Override
	public String name() {
		return name;
	}

	/**
	 * @return the pid of the underlying process
	 */
	public long pid() {
		return process.pid();
	}

	public boolean isAlive() {
		return process.isAlive();
	}

	/**
	 * Send one request line to the process and read its one line response. Line breaks inside
	 * the request are flattened to spaces. The blocking I/O happens on
	 * {@link Schedulers#boundedElastic()}.
	 *
	 * @param request the request
	 * @return a {@link Mono} of the response line, erroring if the process closed its output
	 */
	public Mono<String> call(String request) {
		return Mono.fromCallable(() -> {
			           synchronized (this) {
				           stdin.write(request.replace('\r', ' ').replace('\n', ' '));
				           stdin.newLine();
				           stdin.flush();
				           String line = stdout.readLine();
				           if (line == null) {
					           throw new IOException("Tool server " + name + " closed its output (exit " + exitCode() + ")");
				           }
				           return line;
			           }
		           })
		           .subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Close the standard input and ask the process to terminate. A process still running after
	 * the shutdown grace period is killed forcibly. Completes once the process has exited.
	 */
	@Override
	public Mono<Void> disposeLater() {
		return Mono.defer(() -> {
			try {
				stdin.close();
			}
			catch (IOException e) {
				LOGGER.debug("Tool server {} stdin was already closed", name, e);
			}
			process.destroy();
			return Mono.fromFuture(process.onExit())
			           .timeout(shutdownGrace)
			           .onErrorResume(TimeoutException.class, timeout -> {
				           LOGGER.warn("Tool server {} did not exit within {}ms, killing it", name, shutdownGrace.toMillis());
				           return Mono.fromFuture(process.destroyForcibly().onExit());
			           })
			           .doOnNext(p -> LOGGER.debug("Tool server {} exited with code {}", name, p.exitValue()))
			           .then();
		});
	}

	String exitCode() {
		return process.isAlive() ? "pending" : String.valueOf(process.exitValue());
	}

	@Override
	public String toString() {
		return "ProcessToolServer{" +
				"name='" + name + '\'' +
				", pid=" + process.pid() +
				'}';
	}
}
