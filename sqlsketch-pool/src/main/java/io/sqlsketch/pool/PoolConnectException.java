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
 * A {@link RuntimeException} wrapping a {@link Driver#connect(String)} failure. It is only ever
 * propagated to the caller whose acquisition triggered the growth (or the replacement of an
 * unhealthy connection): the pool itself remains usable.
 */
public class PoolConnectException extends RuntimeException {

	public PoolConnectException(String message, Throwable cause) {
		super(message, cause);
	}
}
