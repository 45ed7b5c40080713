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
import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private default implementation of {@link TargetType}.
 * <p>
 * Erasure, type arguments and the unwrapped base type are resolved once, up front.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultTargetType implements TargetType {
	@NonNull
	private final Type type;
	@NonNull
	private final Class<?> rawClass;
	@NonNull
	private final List<TargetType> typeArguments;
	@Nullable
	private final TargetType wrappedType;

	DefaultTargetType(@NonNull Type type) {
		requireNonNull(type);

		this.type = type;
		this.rawClass = erase(type);
		this.typeArguments = resolveTypeArguments(type);
		this.wrappedType = resolveWrappedType(this.rawClass, this.typeArguments);
	}

	@NonNull
	private static Class<?> erase(@NonNull Type type) {
		if (type instanceof Class<?> rawClass)
			return rawClass;
		if (type instanceof ParameterizedType parameterizedType)
			return erase(parameterizedType.getRawType());
		if (type instanceof GenericArrayType genericArrayType)
			return Array.newInstance(erase(genericArrayType.getGenericComponentType()), 0).getClass();

		// Type variables and wildcards (Optional<? extends Number>) erase to their first upper bound
		Type[] upperBounds = type instanceof TypeVariable<?> typeVariable ? typeVariable.getBounds()
				: type instanceof WildcardType wildcardType ? wildcardType.getUpperBounds() : new Type[0];

		return upperBounds.length == 0 ? Object.class : erase(upperBounds[0]);
	}

	@NonNull
	private static List<TargetType> resolveTypeArguments(@NonNull Type type) {
		if (!(type instanceof ParameterizedType parameterizedType))
			return List.of();

		List<TargetType> typeArguments = new ArrayList<>();

		for (Type typeArgument : parameterizedType.getActualTypeArguments())
			typeArguments.add(new DefaultTargetType(typeArgument));

		return Collections.unmodifiableList(typeArguments);
	}

	@Nullable
	private static TargetType resolveWrappedType(@NonNull Class<?> rawClass,
																							 @NonNull List<TargetType> typeArguments) {
		if (rawClass.equals(OptionalInt.class))
			return new DefaultTargetType(Integer.class);
		if (rawClass.equals(OptionalLong.class))
			return new DefaultTargetType(Long.class);
		if (rawClass.equals(OptionalDouble.class))
			return new DefaultTargetType(Double.class);
		if (rawClass.equals(Optional.class))
			return typeArguments.isEmpty() ? new DefaultTargetType(Object.class) : typeArguments.get(0);

		return null;
	}

	@Override
	@NonNull
	public TargetType getBaseType() {
		return this.wrappedType == null ? this : this.wrappedType;
	}

	@Override
	@NonNull
	public Type getType() {
		return this.type;
	}

	@Override
	@NonNull
	public Class<?> getRawClass() {
		return this.rawClass;
	}

	@Override
	@NonNull
	public List<TargetType> getTypeArguments() {
		return this.typeArguments;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DefaultTargetType targetType))
			return false;

		return getType().equals(targetType.getType());
	}

	@Override
	public int hashCode() {
		return getType().hashCode();
	}

	@Override
	public String toString() {
		return format("%s{type=%s}", getClass().getSimpleName(), getType().getTypeName());
	}
}
