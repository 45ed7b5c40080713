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
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private standard implementation of {@link ParameterBagReader}.
 * <p>
 * Accessors are discovered reflectively once per parameter class and cached.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultParameterBagReader implements ParameterBagReader {
	@NonNull
	private final ConcurrentMap<Class<?>, List<ParameterAccessor>> parameterAccessorsCache;

	DefaultParameterBagReader() {
		this.parameterAccessorsCache = new ConcurrentHashMap<>();
	}

	@Override
	@NonNull
	public Map<String, @Nullable Object> read(@Nullable Object parameters) {
		if (parameters == null)
			return Map.of();

		Map<String, Object> valuesByName = new LinkedHashMap<>();

		if (parameters instanceof Map<?, ?> map) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (!(entry.getKey() instanceof String name))
					throw new IllegalArgumentException(format("Parameter map keys must be strings, but found %s",
							entry.getKey() == null ? "null" : entry.getKey().getClass().getName()));

				valuesByName.put(name, unwrapOptionalValue(entry.getValue()));
			}

			return Collections.unmodifiableMap(valuesByName);
		}

		if (isScalar(parameters.getClass()))
			throw new IllegalArgumentException(format("Unsupported parameter object of type %s; supply a Map, a record or "
					+ "an object with readable properties", parameters.getClass().getName()));

		for (ParameterAccessor parameterAccessor : determineParameterAccessors(parameters.getClass()))
			valuesByName.put(parameterAccessor.getName(), unwrapOptionalValue(parameterAccessor.read(parameters)));

		return Collections.unmodifiableMap(valuesByName);
	}

	@NonNull
	protected List<ParameterAccessor> determineParameterAccessors(@NonNull Class<?> parametersType) {
		requireNonNull(parametersType);

		return getParameterAccessorsCache().computeIfAbsent(parametersType, (key) -> {
			List<ParameterAccessor> parameterAccessors = new ArrayList<>();

			if (parametersType.isRecord()) {
				for (RecordComponent recordComponent : parametersType.getRecordComponents())
					parameterAccessors.add(new ParameterAccessor(recordComponent.getName(), recordComponent.getAccessor()));

				return Collections.unmodifiableList(parameterAccessors);
			}

			PropertyDescriptor[] propertyDescriptors;

			try {
				// Stopping at Object excludes getClass()
				propertyDescriptors = Introspector.getBeanInfo(parametersType, Object.class).getPropertyDescriptors();
			} catch (IntrospectionException e) {
				throw new DatabaseException(format("Unable to introspect properties for %s", parametersType.getName()), e);
			}

			for (PropertyDescriptor propertyDescriptor : propertyDescriptors)
				if (propertyDescriptor.getReadMethod() != null)
					parameterAccessors.add(new ParameterAccessor(propertyDescriptor.getName(), propertyDescriptor.getReadMethod()));

			for (Field field : parametersType.getFields()) {
				if (Modifier.isStatic(field.getModifiers()))
					continue;

				boolean alreadyCovered = parameterAccessors.stream()
						.anyMatch(parameterAccessor -> parameterAccessor.getName().equals(field.getName()));

				if (!alreadyCovered)
					parameterAccessors.add(new ParameterAccessor(field.getName(), field));
			}

			return Collections.unmodifiableList(parameterAccessors);
		});
	}

	@NonNull
	protected Boolean isScalar(@NonNull Class<?> type) {
		requireNonNull(type);

		return type.isPrimitive() || type.isArray() || type.isEnum()
				|| CharSequence.class.isAssignableFrom(type)
				|| Number.class.isAssignableFrom(type)
				|| Boolean.class.equals(type)
				|| Character.class.equals(type);
	}

	@Nullable
	protected static Object unwrapOptionalValue(@Nullable Object value) {
		if (value == null)
			return null;

		if (value instanceof Optional<?> optional)
			return optional.orElse(null);
		if (value instanceof OptionalInt optionalInt)
			return optionalInt.isPresent() ? optionalInt.getAsInt() : null;
		if (value instanceof OptionalLong optionalLong)
			return optionalLong.isPresent() ? optionalLong.getAsLong() : null;
		if (value instanceof OptionalDouble optionalDouble)
			return optionalDouble.isPresent() ? optionalDouble.getAsDouble() : null;

		return value;
	}

	@NonNull
	protected ConcurrentMap<Class<?>, List<ParameterAccessor>> getParameterAccessorsCache() {
		return this.parameterAccessorsCache;
	}

	/**
	 * Reads one named value from a parameter object, through either a getter or a public field.
	 */
	@ThreadSafe
	protected static final class ParameterAccessor {
		@NonNull
		private final String name;
		@NonNull
		private final Member member;

		ParameterAccessor(@NonNull String name,
											@NonNull Member member) {
			this.name = requireNonNull(name);
			this.member = requireNonNull(member);
		}

		@Nullable
		Object read(@NonNull Object parameters) {
			requireNonNull(parameters);

			try {
				if (this.member instanceof Method method)
					return method.invoke(parameters);

				return ((Field) this.member).get(parameters);
			} catch (InvocationTargetException e) {
				throw new DatabaseException(format("Reading parameter '%s' from %s failed", getName(),
						parameters.getClass().getName()), e.getCause() == null ? e : e.getCause());
			} catch (IllegalAccessException e) {
				throw new DatabaseException(format("Unable to read parameter '%s' from %s. Please verify that %s is public",
						getName(), parameters.getClass().getName(), parameters.getClass().getSimpleName()), e);
			}
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@Override
		public String toString() {
			return format("%s{name=%s, member=%s}", getClass().getSimpleName(), getName(), this.member.getName());
		}
	}
}
