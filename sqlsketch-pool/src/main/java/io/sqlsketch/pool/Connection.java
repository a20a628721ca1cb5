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

package io.sqlsketch.pool;

/**
 * An opaque handle to an established backend connection, as produced by a {@link Driver}.
 * The pool never looks into the connection's I/O state: it only ever validates it and closes it.
 * <p>
 * A {@link Connection} is NOT expected to be thread-safe. The pool guarantees that at any instant
 * only one party (either the pool itself or the caller that currently holds it) touches it.
 *
 * @see Driver
 */
public interface Connection extends AutoCloseable {

	/**
	 * Check that the connection is still usable, typically with a cheap round-trip to the backend.
	 * Implementations MUST NOT throw: any failure is to be reported as {@code false}.
	 *
	 * @return true if the connection can be handed out, false if it should be discarded
	 */
	boolean validate();

	/**
	 * Close the connection and release its resources. This is best-effort from the pool's perspective:
	 * a failure is logged and the connection is forgotten anyway.
	 *
	 * @throws Exception if the connection could not be cleanly severed
	 */
	@Override
	void close() throws Exception;
}
