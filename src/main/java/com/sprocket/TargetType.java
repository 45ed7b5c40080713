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

import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * The declared type of a mapped property, as seen by {@link ValueConverter}.
 * <p>
 * A property may be wrapped to mark "may be absent": {@link Optional}, {@link OptionalInt}, {@link OptionalLong} or
 * {@link OptionalDouble}. {@link #getBaseType()} strips that wrapper so conversion can target the underlying type.
 *
 * @since 1.0.0
 */
public interface TargetType {
	/**
	 * The reflective type as declared on the record component or setter.
	 */
	@NonNull
	Type getType();

	/**
	 * Erased class, e.g. {@code Optional.class} for {@code Optional<UUID>}.
	 */
	@NonNull
	Class<?> getRawClass();

	/**
	 * Type arguments, empty unless the declared type is parameterized.
	 */
	@NonNull
	List<TargetType> getTypeArguments();

	/**
	 * The type conversion should produce: the wrapped type for "may be absent" wrappers, otherwise this type itself.
	 * <p>
	 * A raw {@code Optional} unwraps to {@code Object}.
	 */
	@NonNull
	TargetType getBaseType();

	/**
	 * @return {@code true} if the erased class is exactly {@code rawClass}
	 */
	@NonNull
	default Boolean matchesClass(@NonNull Class<?> rawClass) {
		requireNonNull(rawClass);
		return getRawClass().equals(rawClass);
	}

	@NonNull
	default Boolean isOptional() {
		return getBaseType() != this;
	}

	/**
	 * Can a property of this type hold an absent value? Everything except primitives can.
	 */
	@NonNull
	default Boolean permitsAbsence() {
		return !getRawClass().isPrimitive();
	}

	@NonNull
	static TargetType of(@NonNull Type type) {
		requireNonNull(type);
		return new DefaultTargetType(type);
	}
}
