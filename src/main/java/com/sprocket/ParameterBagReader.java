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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;

/**
 * Contract for extracting named parameter values from a caller-supplied parameter object.
 * <p>
 * Supported shapes, in order of precedence:
 * <ol>
 *   <li>a {@link Map} with {@link String} keys: each entry is a parameter</li>
 *   <li>a record: each component is a parameter, in declaration order</li>
 *   <li>any other object: each readable JavaBean property, then each public instance field not already covered</li>
 * </ol>
 * {@code Optional}, {@code OptionalInt}, {@code OptionalLong} and {@code OptionalDouble} values are unwrapped; an empty
 * one becomes {@code null}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface ParameterBagReader {
	/**
	 * Reads every parameter out of {@code parameters}.
	 *
	 * @param parameters the parameter object, or {@code null} for no parameters
	 * @return parameter name to value (values may be {@code null}), in binding order
	 * @throws IllegalArgumentException if {@code parameters} has an unsupported shape
	 */
	@NonNull
	Map<String, @Nullable Object> read(@Nullable Object parameters);

	@NonNull
	static ParameterBagReader withDefaultConfiguration() {
		return new DefaultParameterBagReader();
	}
}
