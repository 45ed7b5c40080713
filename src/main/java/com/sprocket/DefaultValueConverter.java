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

import com.sprocket.CustomValueConverter.ConversionResult;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Currency;
import java.util.Date;
import java.util.IllformedLocaleException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private standard implementation of {@link ValueConverter}.
 * <p>
 * Parses the text forms produced by {@link DefaultRowMaterializer}. Zone-less date-times are interpreted in the
 * configured time zone whenever an instant-based type is requested.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultValueConverter implements ValueConverter {
	@NonNull
	private static final Map<Class<?>, Class<?>> WRAPPER_CLASSES_BY_PRIMITIVE_CLASS;

	@NonNull
	private final List<CustomValueConverter> customValueConverters;
	@NonNull
	private final ZoneId timeZone;
	// Remembers which custom converters apply to a target type so appliesTo() runs once per type
	@NonNull
	private final ConcurrentMap<TargetType, List<CustomValueConverter>> customValueConvertersByTargetTypeCache;

	static {
		WRAPPER_CLASSES_BY_PRIMITIVE_CLASS = Map.of(
				boolean.class, Boolean.class,
				byte.class, Byte.class,
				short.class, Short.class,
				int.class, Integer.class,
				long.class, Long.class,
				float.class, Float.class,
				double.class, Double.class,
				char.class, Character.class
		);
	}

	DefaultValueConverter(@NonNull Builder builder) {
		requireNonNull(builder);

		this.customValueConverters = List.copyOf(builder.customValueConverters);
		this.timeZone = requireNonNull(builder.timeZone);
		this.customValueConvertersByTargetTypeCache = new ConcurrentHashMap<>();
	}

	@Override
	@Nullable
	public Object convert(@NonNull String text,
												@NonNull TargetType targetType) {
		requireNonNull(text);
		requireNonNull(targetType);

		Class<?> targetClass = boxedClass(targetType.getRawClass());

		for (CustomValueConverter customValueConverter : customValueConvertersFor(targetType)) {
			ConversionResult conversionResult;

			try {
				conversionResult = customValueConverter.convert(text, targetType);
			} catch (FieldMappingException e) {
				throw e;
			} catch (RuntimeException e) {
				throw new FieldMappingException(format("Custom converter %s failed to convert value '%s' to %s",
						customValueConverter.getClass().getName(), text, targetType), e);
			}

			if (conversionResult instanceof ConversionResult.CustomConversion customConversion) {
				Object value = customConversion.getValue().orElse(null);

				if (value != null && !targetClass.isInstance(value))
					throw new FieldMappingException(format("Custom converter %s produced %s, which is not assignable to %s",
							customValueConverter.getClass().getName(), value.getClass().getName(), targetType));

				return value;
			}
		}

		try {
			return convertBuiltIn(text, targetClass);
		} catch (IllegalArgumentException | ArithmeticException | DateTimeException | IllformedLocaleException e) {
			throw new FieldMappingException(format("Unable to convert value '%s' to %s", text, targetType), e);
		}
	}

	/**
	 * Converts text to one of the built-in supported types.
	 * <p>
	 * Parse failures surface as the standard library's unchecked exceptions; {@link #convert(String, TargetType)} wraps
	 * them.
	 *
	 * @param text        the cell text
	 * @param targetClass the (boxed) class to convert to
	 * @return the converted value
	 */
	@NonNull
	protected Object convertBuiltIn(@NonNull String text,
																	@NonNull Class<?> targetClass) {
		requireNonNull(text);
		requireNonNull(targetClass);

		String trimmed = text.trim();

		if (targetClass.isAssignableFrom(String.class))
			return text;

		// Numbers
		if (targetClass.equals(Integer.class))
			return new BigDecimal(trimmed).intValueExact();
		if (targetClass.equals(Long.class))
			return new BigDecimal(trimmed).longValueExact();
		if (targetClass.equals(Short.class))
			return new BigDecimal(trimmed).shortValueExact();
		if (targetClass.equals(Byte.class))
			return new BigDecimal(trimmed).byteValueExact();
		if (targetClass.equals(Double.class))
			return Double.parseDouble(trimmed);
		if (targetClass.equals(Float.class))
			return Float.parseFloat(trimmed);
		if (targetClass.equals(BigDecimal.class))
			return new BigDecimal(trimmed);
		if (targetClass.equals(BigInteger.class))
			return new BigDecimal(trimmed).toBigIntegerExact();

		if (targetClass.equals(Boolean.class))
			return parseBoolean(trimmed);

		if (targetClass.equals(Character.class)) {
			if (text.length() != 1)
				throw new IllegalArgumentException(format("Expected exactly one character but found %d", text.length()));

			return text.charAt(0);
		}

		// java.time values
		if (targetClass.equals(LocalDate.class))
			return parseLocalDate(trimmed);
		if (targetClass.equals(LocalDateTime.class))
			return parseLocalDateTime(trimmed);
		if (targetClass.equals(LocalTime.class))
			return LocalTime.parse(trimmed);
		if (targetClass.equals(OffsetTime.class))
			return OffsetTime.parse(trimmed);
		if (targetClass.equals(OffsetDateTime.class))
			return parseZonedDateTime(trimmed).toOffsetDateTime();
		if (targetClass.equals(ZonedDateTime.class))
			return parseZonedDateTime(trimmed);
		if (targetClass.equals(Instant.class))
			return parseInstant(trimmed);

		// Legacy java.sql.* and java.util.Date; subclasses first
		if (targetClass.equals(Timestamp.class))
			return Timestamp.from(parseInstant(trimmed));
		if (targetClass.equals(java.sql.Date.class))
			return java.sql.Date.valueOf(parseLocalDate(trimmed));
		if (targetClass.equals(Time.class))
			return Time.valueOf(LocalTime.parse(trimmed));
		if (targetClass.equals(Date.class))
			return Date.from(parseInstant(trimmed));

		if (targetClass.equals(UUID.class))
			return UUID.fromString(trimmed);
		if (targetClass.isEnum())
			return extractEnumValue(targetClass, trimmed);
		if (targetClass.equals(ZoneId.class))
			return ZoneId.of(trimmed);
		if (targetClass.equals(TimeZone.class))
			return timeZoneFromId(trimmed);
		if (targetClass.equals(Locale.class))
			return localeFromLanguageTag(trimmed);
		if (targetClass.equals(Currency.class))
			return Currency.getInstance(trimmed.toUpperCase(Locale.ROOT));
		if (targetClass.equals(byte[].class))
			return Base64.getDecoder().decode(trimmed);

		throw new FieldMappingException(format("Unsupported target type %s", targetClass.getName()));
	}

	/**
	 * Attempts to convert {@code text} to a constant of {@code enumClass}: exact constant name first, then a
	 * case-insensitive match.
	 *
	 * @param enumClass the enum to which we'd like to convert {@code text}
	 * @param text      the text to convert
	 * @return the enum constant
	 * @throws FieldMappingException if {@code text} does not correspond to a constant
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	@NonNull
	protected Enum<?> extractEnumValue(@NonNull Class<?> enumClass,
																		 @NonNull String text) {
		requireNonNull(enumClass);
		requireNonNull(text);

		if (!enumClass.isEnum())
			throw new IllegalArgumentException(format("%s is not an enum type", enumClass));

		for (Object enumConstant : enumClass.getEnumConstants())
			if (((Enum) enumConstant).name().equals(text))
				return (Enum<?>) enumConstant;

		for (Object enumConstant : enumClass.getEnumConstants())
			if (((Enum) enumConstant).name().equalsIgnoreCase(text))
				return (Enum<?>) enumConstant;

		throw new FieldMappingException(format("The value '%s' is not present in enum %s", text, enumClass.getName()));
	}

	@NonNull
	protected Boolean parseBoolean(@NonNull String text) {
		requireNonNull(text);

		switch (text.toLowerCase(Locale.ROOT)) {
			case "true":
			case "1":
			case "yes":
			case "y":
				return true;
			case "false":
			case "0":
			case "no":
			case "n":
				return false;
			default:
				throw new IllegalArgumentException(format("'%s' is not a recognized boolean value", text));
		}
	}

	@NonNull
	protected LocalDate parseLocalDate(@NonNull String text) {
		requireNonNull(text);

		// A full date-time (e.g. from a TIMESTAMP column) keeps its date portion
		if (text.length() > 10)
			return parseLocalDateTime(text).toLocalDate();

		return LocalDate.parse(text);
	}

	@NonNull
	protected LocalDateTime parseLocalDateTime(@NonNull String text) {
		requireNonNull(text);

		if (text.length() == 10)
			return LocalDate.parse(text).atStartOfDay();

		return LocalDateTime.parse(normalizeDateTimeSeparator(text));
	}

	/**
	 * Parses an ISO date-time with an offset or region, or a local date-time placed in the configured time zone.
	 */
	@NonNull
	protected ZonedDateTime parseZonedDateTime(@NonNull String text) {
		requireNonNull(text);

		if (text.length() == 10)
			return LocalDate.parse(text).atStartOfDay(getTimeZone());

		TemporalAccessor temporalAccessor = DateTimeFormatter.ISO_DATE_TIME.parseBest(normalizeDateTimeSeparator(text),
				ZonedDateTime::from, LocalDateTime::from);

		if (temporalAccessor instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime;

		return ((LocalDateTime) temporalAccessor).atZone(getTimeZone());
	}

	@NonNull
	protected Instant parseInstant(@NonNull String text) {
		requireNonNull(text);
		return parseZonedDateTime(text).toInstant();
	}

	@NonNull
	protected List<CustomValueConverter> customValueConvertersFor(@NonNull TargetType targetType) {
		requireNonNull(targetType);

		if (getCustomValueConverters().isEmpty())
			return List.of();

		return getCustomValueConvertersByTargetTypeCache().computeIfAbsent(targetType, applicableTargetType -> {
			List<CustomValueConverter> filtered = new ArrayList<>(getCustomValueConverters().size());

			for (CustomValueConverter customValueConverter : getCustomValueConverters())
				if (customValueConverter.appliesTo(applicableTargetType))
					filtered.add(customValueConverter);

			return Collections.unmodifiableList(filtered);
		});
	}

	@NonNull
	protected static Class<?> boxedClass(@NonNull Class<?> type) {
		requireNonNull(type);
		return type.isPrimitive() ? WRAPPER_CLASSES_BY_PRIMITIVE_CLASS.get(type) : type;
	}

	@NonNull
	private static String normalizeDateTimeSeparator(@NonNull String text) {
		// "2024-01-02 10:15:30" is as common as the ISO "T" form
		if (text.length() > 10 && text.charAt(10) == ' ')
			return text.substring(0, 10) + 'T' + text.substring(11);

		return text;
	}

	@NonNull
	private static TimeZone timeZoneFromId(@NonNull String zoneId) {
		requireNonNull(zoneId);

		TimeZone timeZone = TimeZone.getTimeZone(zoneId);

		// TimeZone silently falls back to GMT for unknown IDs
		if ("GMT".equals(timeZone.getID())) {
			String upper = zoneId.toUpperCase(Locale.ROOT);

			if (!upper.equals("GMT") && !upper.equals("UTC") && !upper.equals("UT")) {
				if (upper.startsWith("GMT") || upper.startsWith("UTC") || upper.startsWith("UT"))
					ZoneId.of(upper);
				else
					throw new FieldMappingException(format("Unable to convert value '%s' to TimeZone", zoneId));
			}
		}

		return timeZone;
	}

	@NonNull
	private static Locale localeFromLanguageTag(@NonNull String languageTag) {
		requireNonNull(languageTag);

		if (languageTag.isEmpty())
			return Locale.ROOT;

		return new Locale.Builder().setLanguageTag(languageTag).build();
	}

	@NonNull
	protected List<CustomValueConverter> getCustomValueConverters() {
		return this.customValueConverters;
	}

	@NonNull
	protected ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	protected ConcurrentMap<TargetType, List<CustomValueConverter>> getCustomValueConvertersByTargetTypeCache() {
		return this.customValueConvertersByTargetTypeCache;
	}
}
