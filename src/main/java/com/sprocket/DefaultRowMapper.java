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
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.lang.invoke.MethodType.methodType;
import static java.util.Objects.requireNonNull;

/**
 * Package-private standard implementation of {@link RowMapper}.
 * <p>
 * Property metadata is computed reflectively once per target class and cached.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultRowMapper implements RowMapper {
	@NonNull
	private static final Map<Class<?>, Object> DEFAULT_VALUES_BY_PRIMITIVE_CLASS;

	@NonNull
	private final ValueConverter valueConverter;
	@NonNull
	private final InstanceProvider instanceProvider;
	@NonNull
	private final Locale normalizationLocale;
	@NonNull
	private final ConcurrentMap<Class<?>, List<TargetProperty>> targetPropertiesCache;

	static {
		DEFAULT_VALUES_BY_PRIMITIVE_CLASS = Map.of(
				boolean.class, false,
				byte.class, (byte) 0,
				short.class, (short) 0,
				int.class, 0,
				long.class, 0L,
				float.class, 0F,
				double.class, 0D,
				char.class, '\0'
		);
	}

	DefaultRowMapper(@NonNull Builder builder) {
		requireNonNull(builder);

		this.valueConverter = requireNonNull(builder.valueConverter);
		this.instanceProvider = requireNonNull(builder.instanceProvider);
		this.normalizationLocale = requireNonNull(builder.normalizationLocale);
		this.targetPropertiesCache = new ConcurrentHashMap<>();
	}

	@Override
	@NonNull
	public <T> Set<String> matchingFieldNames(@NonNull Class<T> targetType,
																						@NonNull RowSet rowSet) {
		requireNonNull(targetType);
		requireNonNull(rowSet);

		Set<String> fieldNames = new LinkedHashSet<>();

		for (TargetProperty targetProperty : determineTargetProperties(targetType))
			for (String columnName : targetProperty.getColumnNames())
				if (rowSet.getColumnNames().contains(columnName))
					fieldNames.add(columnName);

		return Collections.unmodifiableSet(fieldNames);
	}

	@Override
	@NonNull
	public <T> RowMappingResult<T> mapRow(@NonNull RawRow row,
																				@NonNull Class<T> targetType,
																				@NonNull Set<String> fieldNames) {
		requireNonNull(row);
		requireNonNull(targetType);
		requireNonNull(fieldNames);

		if (targetType.isRecord())
			return mapRowToRecord(row, targetType, fieldNames);

		return mapRowToBean(row, targetType, fieldNames);
	}

	@NonNull
	protected <T> RowMappingResult<T> mapRowToRecord(@NonNull RawRow row,
																									 @NonNull Class<T> targetType,
																									 @NonNull Set<String> fieldNames) {
		requireNonNull(row);
		requireNonNull(targetType);
		requireNonNull(fieldNames);

		List<TargetProperty> targetProperties = determineTargetProperties(targetType);
		List<FieldMappingFailure> failures = new ArrayList<>();
		Object[] args = new Object[targetProperties.size()];

		for (int i = 0; i < targetProperties.size(); ++i) {
			TargetProperty targetProperty = targetProperties.get(i);
			args[i] = defaultValueFor(targetProperty.getTargetType());

			String columnName = targetProperty.columnNameIn(fieldNames, row).orElse(null);

			if (columnName == null)
				continue;

			String text = row.getValue(columnName).orElse(null);

			try {
				args[i] = resolveValue(targetType, targetProperty, columnName, text);
			} catch (RuntimeException e) {
				failures.add(fieldMappingFailure(targetType, targetProperty, columnName, text, e));
			}
		}

		@SuppressWarnings("unchecked")
		Class<? extends Record> recordType = (Class<? extends Record>) targetType;
		Record record = getInstanceProvider().provideRecord(recordType, args);

		return new RowMappingResult<>(targetType.cast(record), failures);
	}

	@NonNull
	protected <T> RowMappingResult<T> mapRowToBean(@NonNull RawRow row,
																								 @NonNull Class<T> targetType,
																								 @NonNull Set<String> fieldNames) {
		requireNonNull(row);
		requireNonNull(targetType);
		requireNonNull(fieldNames);

		T object = getInstanceProvider().provide(targetType);
		List<FieldMappingFailure> failures = new ArrayList<>();

		for (TargetProperty targetProperty : determineTargetProperties(targetType)) {
			String columnName = targetProperty.columnNameIn(fieldNames, row).orElse(null);

			if (columnName == null)
				continue;

			String text = row.getValue(columnName).orElse(null);

			try {
				Object value = resolveValue(targetType, targetProperty, columnName, text);
				Method writeMethod = targetProperty.getWriteMethod().get();

				try {
					writeMethod.invoke(object, value);
				} catch (InvocationTargetException e) {
					throw new FieldMappingException(format("Setter for property '%s' of %s threw an exception",
							targetProperty.getName(), targetType.getSimpleName()), e.getCause() == null ? e : e.getCause());
				} catch (IllegalAccessException | IllegalArgumentException e) {
					throw new FieldMappingException(format("Unable to assign value to property '%s' of %s",
							targetProperty.getName(), targetType.getSimpleName()), e);
				}
			} catch (RuntimeException e) {
				failures.add(fieldMappingFailure(targetType, targetProperty, columnName, text, e));
			}
		}

		return new RowMappingResult<>(object, failures);
	}

	/**
	 * Records a failure to populate one property. Anything other than a {@link FieldMappingException}, such as an
	 * exception thrown by a custom {@link ValueConverter}, is wrapped in one.
	 */
	@NonNull
	protected FieldMappingFailure fieldMappingFailure(@NonNull Class<?> targetType,
																										@NonNull TargetProperty targetProperty,
																										@NonNull String columnName,
																										@Nullable String text,
																										@NonNull RuntimeException exception) {
		requireNonNull(targetType);
		requireNonNull(targetProperty);
		requireNonNull(columnName);
		requireNonNull(exception);

		FieldMappingException fieldMappingException = exception instanceof FieldMappingException
				? (FieldMappingException) exception
				: new FieldMappingException(format("Unable to convert column '%s' for property '%s' of %s",
				columnName, targetProperty.getName(), targetType.getSimpleName()), exception);

		return new FieldMappingFailure(targetProperty.getName(), columnName, text, targetProperty.getTargetType(), fieldMappingException);
	}

	/**
	 * Produces the value to assign to a property from its cell text.
	 *
	 * @throws FieldMappingException if the text cannot be coerced, or is {@code NULL} for a primitive property
	 */
	@Nullable
	protected Object resolveValue(@NonNull Class<?> targetType,
																@NonNull TargetProperty targetProperty,
																@NonNull String columnName,
																@Nullable String text) {
		requireNonNull(targetType);
		requireNonNull(targetProperty);
		requireNonNull(columnName);

		TargetType propertyType = targetProperty.getTargetType();

		if (text == null) {
			// It's considered programmer error to have a NULL cell mapped to a primitive (which does not support null)
			if (!propertyType.permitsAbsence())
				throw new FieldMappingException(format("Column '%s' is NULL but property '%s' of %s is primitive (%s). Use a non-primitive type or COALESCE in the procedure.",
						columnName, targetProperty.getName(), targetType.getSimpleName(), propertyType.getRawClass().getSimpleName()));

			return absentValueFor(propertyType);
		}

		Object converted = getValueConverter().convert(text, propertyType.getBaseType());

		if (converted == null && !propertyType.permitsAbsence())
			throw new FieldMappingException(format("Conversion of column '%s' produced null but property '%s' of %s is primitive (%s)",
					columnName, targetProperty.getName(), targetType.getSimpleName(), propertyType.getRawClass().getSimpleName()));

		Class<?> expectedClass = methodType(propertyType.getBaseType().getRawClass()).wrap().returnType();

		if (converted != null && !expectedClass.isInstance(converted))
			throw new FieldMappingException(format("Conversion of column '%s' produced %s but property '%s' of %s expects %s",
					columnName, converted.getClass().getSimpleName(), targetProperty.getName(), targetType.getSimpleName(),
					expectedClass.getSimpleName()));

		return wrapValue(propertyType, converted);
	}

	/**
	 * The value a property holds when its cell is SQL {@code NULL}.
	 */
	@Nullable
	protected Object absentValueFor(@NonNull TargetType targetType) {
		requireNonNull(targetType);

		if (!targetType.isOptional())
			return null;

		Class<?> rawClass = targetType.getRawClass();

		if (rawClass.equals(Optional.class))
			return Optional.empty();
		if (rawClass.equals(OptionalInt.class))
			return OptionalInt.empty();
		if (rawClass.equals(OptionalLong.class))
			return OptionalLong.empty();
		if (rawClass.equals(OptionalDouble.class))
			return OptionalDouble.empty();

		return null;
	}

	/**
	 * The value a record component receives when it is not populated.
	 */
	@Nullable
	protected Object defaultValueFor(@NonNull TargetType targetType) {
		requireNonNull(targetType);

		Class<?> rawClass = targetType.getRawClass();

		if (rawClass.isPrimitive())
			return DEFAULT_VALUES_BY_PRIMITIVE_CLASS.get(rawClass);

		return absentValueFor(targetType);
	}

	@Nullable
	protected Object wrapValue(@NonNull TargetType targetType,
														 @Nullable Object value) {
		requireNonNull(targetType);

		if (value == null)
			return absentValueFor(targetType);

		Class<?> rawClass = targetType.getRawClass();

		if (rawClass.equals(Optional.class))
			return Optional.of(value);
		if (rawClass.equals(OptionalInt.class))
			return OptionalInt.of((Integer) value);
		if (rawClass.equals(OptionalLong.class))
			return OptionalLong.of((Long) value);
		if (rawClass.equals(OptionalDouble.class))
			return OptionalDouble.of((Double) value);

		return value;
	}

	/**
	 * Writable properties of {@code targetType}: record components in declaration order, or JavaBean properties with a
	 * setter.
	 */
	@NonNull
	protected List<TargetProperty> determineTargetProperties(@NonNull Class<?> targetType) {
		requireNonNull(targetType);

		return getTargetPropertiesCache().computeIfAbsent(targetType, (key) -> {
			List<TargetProperty> targetProperties = new ArrayList<>();

			if (targetType.isRecord()) {
				for (RecordComponent recordComponent : targetType.getRecordComponents())
					targetProperties.add(new TargetProperty(recordComponent.getName(),
							columnNamesForProperty(recordComponent.getName(), recordComponent.getAnnotation(DatabaseColumn.class)),
							TargetType.of(recordComponent.getGenericType()), null));
			} else {
				PropertyDescriptor[] propertyDescriptors;

				try {
					propertyDescriptors = Introspector.getBeanInfo(targetType).getPropertyDescriptors();
				} catch (IntrospectionException e) {
					throw new DatabaseException(format("Unable to introspect properties for %s", targetType.getName()), e);
				}

				for (PropertyDescriptor propertyDescriptor : propertyDescriptors) {
					Method writeMethod = propertyDescriptor.getWriteMethod();

					if (writeMethod == null)
						continue;

					Field field = findField(targetType, propertyDescriptor.getName()).orElse(null);
					DatabaseColumn databaseColumn = field == null ? null : field.getAnnotation(DatabaseColumn.class);

					targetProperties.add(new TargetProperty(propertyDescriptor.getName(),
							columnNamesForProperty(propertyDescriptor.getName(), databaseColumn),
							TargetType.of(writeMethod.getGenericParameterTypes()[0]), writeMethod));
				}
			}

			return Collections.unmodifiableList(targetProperties);
		});
	}

	/**
	 * Column names a property matches: its {@link DatabaseColumn} aliases if present, otherwise its own name, all
	 * lower-cased.
	 */
	@NonNull
	protected List<String> columnNamesForProperty(@NonNull String propertyName,
																								@Nullable DatabaseColumn databaseColumn) {
		requireNonNull(propertyName);

		if (databaseColumn == null || databaseColumn.value().length == 0)
			return List.of(normalizePropertyName(propertyName));

		List<String> columnNames = new ArrayList<>(databaseColumn.value().length);

		for (String alias : databaseColumn.value()) {
			String normalizedAlias = normalizePropertyName(alias);

			if (!columnNames.contains(normalizedAlias))
				columnNames.add(normalizedAlias);
		}

		return Collections.unmodifiableList(columnNames);
	}

	@NonNull
	protected String normalizePropertyName(@NonNull String propertyName) {
		requireNonNull(propertyName);
		return propertyName.toLowerCase(getNormalizationLocale());
	}

	@NonNull
	private static Optional<Field> findField(@NonNull Class<?> type,
																					 @NonNull String fieldName) {
		for (Class<?> currentType = type; currentType != null && !currentType.equals(Object.class); currentType = currentType.getSuperclass())
			for (Field field : currentType.getDeclaredFields())
				if (field.getName().equals(fieldName))
					return Optional.of(field);

		return Optional.empty();
	}

	@NonNull
	protected ValueConverter getValueConverter() {
		return this.valueConverter;
	}

	@NonNull
	protected InstanceProvider getInstanceProvider() {
		return this.instanceProvider;
	}

	@NonNull
	protected Locale getNormalizationLocale() {
		return this.normalizationLocale;
	}

	@NonNull
	protected ConcurrentMap<Class<?>, List<TargetProperty>> getTargetPropertiesCache() {
		return this.targetPropertiesCache;
	}

	/**
	 * A record component or writable JavaBean property, with the column names it matches.
	 */
	@ThreadSafe
	protected static final class TargetProperty {
		@NonNull
		private final String name;
		@NonNull
		private final List<String> columnNames;
		@NonNull
		private final TargetType targetType;
		@Nullable
		private final Method writeMethod;

		TargetProperty(@NonNull String name,
									 @NonNull List<String> columnNames,
									 @NonNull TargetType targetType,
									 @Nullable Method writeMethod) {
			this.name = requireNonNull(name);
			this.columnNames = requireNonNull(columnNames);
			this.targetType = requireNonNull(targetType);
			this.writeMethod = writeMethod;
		}

		/**
		 * The first of this property's column names that is both a matched field name and present in the row.
		 */
		@NonNull
		Optional<String> columnNameIn(@NonNull Set<String> fieldNames,
																	@NonNull RawRow row) {
			for (String columnName : getColumnNames())
				if (fieldNames.contains(columnName) && row.hasColumn(columnName))
					return Optional.of(columnName);

			return Optional.empty();
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@NonNull
		public List<String> getColumnNames() {
			return this.columnNames;
		}

		@NonNull
		public TargetType getTargetType() {
			return this.targetType;
		}

		/**
		 * @return the setter, or empty for record components
		 */
		@NonNull
		public Optional<Method> getWriteMethod() {
			return Optional.ofNullable(this.writeMethod);
		}

		@Override
		public String toString() {
			return format("%s{name=%s, columnNames=%s, targetType=%s}", getClass().getSimpleName(),
					getName(), getColumnNames(), getTargetType());
		}
	}
}
