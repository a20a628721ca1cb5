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

package io.sqlsketch.pool.jdbc;

import java.sql.SQLException;

import io.sqlsketch.pool.Connection;

/**
 * A poolable {@link Connection} backed by a {@link java.sql.Connection}.
 * <p>
 * Health checks use {@link java.sql.Connection#isValid(int)}. Code borrowing this connection from a pool
 * works with the {@link #unwrap() raw JDBC connection} but MUST NOT close it: the pool does that.
 */
public final class JdbcConnection implements Connection {

	final java.sql.Connection delegate;
	final int                 validationSeconds;

	JdbcConnection(java.sql.Connection delegate, int validationSeconds) {
		this.delegate = delegate;
		this.validationSeconds = validationSeconds;
	}

	/**
	 * @return the underlying JDBC connection
	 */
	public java.sql.Connection unwrap() {
		return delegate;
	}

	@Override
	public boolean validate() {
		try {
			return !delegate.isClosed() && delegate.isValid(validationSeconds);
		}
		catch (SQLException e) {
			return false;
		}
	}

	@Override
	public void close() throws SQLException {
		delegate.close();
	}

	@Override
	public String toString() {
		return "JdbcConnection{" + delegate + "}";
	}
}
