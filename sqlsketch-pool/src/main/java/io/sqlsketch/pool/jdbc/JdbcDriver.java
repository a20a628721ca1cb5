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

import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

import io.sqlsketch.pool.Driver;

/**
 * A {@link Driver} establishing connections through {@link DriverManager}, which makes any JDBC backend
 * available on the classpath poolable. The connection configuration passed to {@link #connect(String)} is
 * the JDBC URL.
 */
public final class JdbcDriver implements Driver<JdbcConnection> {

	/**
	 * The default maximum time a health check is allowed to take.
	 */
	public static final Duration DEFAULT_VALIDATION_TIMEOUT = Duration.ofSeconds(5);

	final Properties properties;
	final Duration   validationTimeout;

	/**
	 * A driver without connection properties and the {@link #DEFAULT_VALIDATION_TIMEOUT default validation timeout}.
	 */
	public JdbcDriver() {
		this(new Properties(), DEFAULT_VALIDATION_TIMEOUT);
	}

	/**
	 * A driver passing {@code properties} (eg. {@code user} and {@code password}) to each connection attempt.
	 *
	 * @param properties the JDBC connection properties, copied
	 * @param validationTimeout the maximum time a health check can take, rounded up to the second
	 */
	public JdbcDriver(Properties properties, Duration validationTimeout) {
		Objects.requireNonNull(properties, "properties");
		Objects.requireNonNull(validationTimeout, "validationTimeout");
		if (validationTimeout.isNegative() || validationTimeout.isZero()) {
			throw new IllegalArgumentException("validationTimeout must be strictly positive, got " + validationTimeout);
		}
		this.properties = new Properties();
		this.properties.putAll(properties);
		this.validationTimeout = validationTimeout;
	}

	/**
	 * A driver authenticating with the given credentials.
	 *
	 * @param user the database user
	 * @param password the database password
	 * @return a new {@link JdbcDriver}
	 */
	public static JdbcDriver withCredentials(String user, String password) {
		Properties properties = new Properties();
		properties.setProperty("user", Objects.requireNonNull(user, "user"));
		properties.setProperty("password", Objects.requireNonNull(password, "password"));
		return new JdbcDriver(properties, DEFAULT_VALIDATION_TIMEOUT);
	}

	@Override
	public JdbcConnection connect(String url) throws SQLException {
		return new JdbcConnection(DriverManager.getConnection(url, properties), validationSeconds());
	}

	//isValid only takes whole seconds, and 0 would mean no timeout at all
	int validationSeconds() {
		long seconds = (validationTimeout.toMillis() + 999L) / 1000L;
		return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, seconds));
	}
}
