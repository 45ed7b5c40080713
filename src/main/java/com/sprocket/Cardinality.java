/*
 * Copyright 2026 The Sprocket Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.sprocket;

/**
 * How many rows a procedure call is expected to produce.
 * <p>
 * Advisory only: {@link #ONE} limits rows at the driver, and nothing is validated against the actual row count.
 *
 * @since 1.0.0
 */
public enum Cardinality {
	/**
	 * Results, if any, are discarded.
	 */
	NONE,
	/**
	 * Only the first row is mapped.
	 */
	ONE,
	/**
	 * Every row is mapped.
	 */
	MANY
}
