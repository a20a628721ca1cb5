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
 * The backend-specific capability that establishes new {@link Connection connections}.
 * A {@link ConnectionPool} is fully generic over this interface: there is one {@link Driver}
 * per kind of backend (see {@link io.sqlsketch.pool.jdbc.JdbcDriver} for any JDBC data store).
 * <p>
 * {@link #connect(String)} is expected to be slow and is never invoked while the pool holds
 * its internal lock.
 *
 * @param <C> the type of {@link Connection} produced
 */
@FunctionalInterface
public interface Driver<C extends Connection> {

	/**
	 * Establish a new connection.
	 *
	 * @param config driver-specific connection configuration, eg. a connection URL
	 * @return a new, connected {@link Connection}
	 * @throws Exception if the connection cannot be established. The pool wraps it in a {@link PoolConnectException}
	 */
	C connect(String config) throws Exception;
}
