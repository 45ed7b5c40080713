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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Currency;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultValueConverterTests {
	public enum Status {
		ACTIVE,
		SUSPENDED
	}

	public record Money(BigDecimal amount, Currency currency) {}

	@Test
	public void testNumbers() {
		ValueConverter valueConverter = ValueConverter.withDefaultConfiguration();

		Assertions.assertEquals(42, valueConverter.convert("42", TargetType.of(Integer.class)));
		Assertions.assertEquals(42, valueConverter.convert(" 42 ", TargetType.of(int.class)), "Whitespace should be trimmed");
		Assertions.assertEquals(7L, valueConverter.convert("7.00", TargetType.of(Long.class)), "Integral decimal text should convert");
		Assertions.assertEquals(new BigDecimal("12.50"), valueConverter.convert("12.50", TargetType.of(BigDecimal.class)));
		Assertions.assertEquals(new BigInteger("12345678901234567890"),
				valueConverter.convert("12345678901234567890", TargetType.of(BigInteger.class)));
		Assertions.assertEquals(1.5d, valueConverter.convert("1.5", TargetType.of(double.class)));
	}

	@Test
	public void testNumberFailures() {
		ValueConverter valueConverter = ValueConverter.withDefaultConfiguration();

		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("abc", TargetType.of(Integer.class)));
		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("1.5", TargetType.of(Integer.class)),
				"Fractional values must not be silently truncated");
		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("300", TargetType.of(Byte.class)),
				"Out-of-range values must be rejected");
	}

	@Test
	public void testBooleans() {
		ValueConverter valueConverter = ValueConverter.withDefaultConfiguration();

		for (String text : List.of("true", "TRUE", "1", "yes", "Y"))
			Assertions.assertEquals(Boolean.TRUE, valueConverter.convert(text, TargetType.of(Boolean.class)), text);

		for (String text : List.of("false", "0", "No", "n"))
			Assertions.assertEquals(Boolean.FALSE, valueConverter.convert(text, TargetType.of(boolean.class)), text);

		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("maybe", TargetType.of(Boolean.class)));
	}

	@Test
	public void testTemporalValues() {
		ValueConverter valueConverter = ValueConverter.withTimeZone(ZoneId.of("UTC")).build();

		Assertions.assertEquals(LocalDate.of(2024, 3, 5), valueConverter.convert("2024-03-05", TargetType.of(LocalDate.class)));
		Assertions.assertEquals(LocalDate.of(2024, 3, 5), valueConverter.convert("2024-03-05T10:15:30", TargetType.of(LocalDate.class)),
				"A date-time should keep its date");
		Assertions.assertEquals(LocalDateTime.of(2024, 3, 5, 10, 15, 30),
				valueConverter.convert("2024-03-05 10:15:30", TargetType.of(LocalDateTime.class)), "Space separator should be accepted");
		Assertions.assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0),
				valueConverter.convert("2024-03-05", TargetType.of(LocalDateTime.class)));
		Assertions.assertEquals(LocalTime.of(10, 15), valueConverter.convert("10:15", TargetType.of(LocalTime.class)));
		Assertions.assertEquals(OffsetDateTime.of(2024, 3, 5, 10, 15, 30, 0, ZoneOffset.ofHours(2)),
				valueConverter.convert("2024-03-05T10:15:30+02:00", TargetType.of(OffsetDateTime.class)));
		Assertions.assertEquals(Instant.parse("2024-03-05T10:15:30Z"),
				valueConverter.convert("2024-03-05T10:15:30", TargetType.of(Instant.class)), "Local text should use the configured zone");

		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("2024-13-45", TargetType.of(LocalDate.class)));
	}

	@Test
	public void testOtherBuiltIns() {
		ValueConverter valueConverter = ValueConverter.withDefaultConfiguration();
		UUID uuid = UUID.randomUUID();

		Assertions.assertEquals(uuid, valueConverter.convert(uuid.toString(), TargetType.of(UUID.class)));
		Assertions.assertEquals(Status.SUSPENDED, valueConverter.convert("SUSPENDED", TargetType.of(Status.class)));
		Assertions.assertEquals(Status.ACTIVE, valueConverter.convert("active", TargetType.of(Status.class)), "Enums fall back to case-insensitive");
		Assertions.assertEquals(Locale.forLanguageTag("pt-BR"), valueConverter.convert("pt-BR", TargetType.of(Locale.class)));
		Assertions.assertEquals(Currency.getInstance("EUR"), valueConverter.convert("eur", TargetType.of(Currency.class)));
		Assertions.assertEquals(ZoneId.of("America/New_York"), valueConverter.convert("America/New_York", TargetType.of(ZoneId.class)));
		Assertions.assertEquals('x', valueConverter.convert("x", TargetType.of(char.class)));
		Assertions.assertEquals(" padded ", valueConverter.convert(" padded ", TargetType.of(String.class)), "Strings are passed through untouched");

		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("UNKNOWN", TargetType.of(Status.class)));
		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("text", TargetType.of(Money.class)),
				"Unsupported types should fail with a mapping exception");
	}

	@Test
	public void testCustomValueConverters() {
		CustomValueConverter moneyConverter = new CustomValueConverter() {
			@NonNull
			@Override
			public ConversionResult convert(@NonNull String text,
																			@NonNull TargetType targetType) {
				if (text.isBlank())
					return ConversionResult.fallback();

				String[] components = text.trim().split(" ");
				return ConversionResult.of(new Money(new BigDecimal(components[0]), Currency.getInstance(components[1])));
			}

			@NonNull
			@Override
			public Boolean appliesTo(@NonNull TargetType targetType) {
				return targetType.matchesClass(Money.class);
			}
		};

		ValueConverter valueConverter = ValueConverter.withCustomValueConverters(List.of(moneyConverter)).build();

		Assertions.assertEquals(new Money(new BigDecimal("9.99"), Currency.getInstance("USD")),
				valueConverter.convert("9.99 USD", TargetType.of(Money.class)));
		Assertions.assertEquals(5, valueConverter.convert("5", TargetType.of(Integer.class)), "Other types use built-ins");
		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert(" ", TargetType.of(Money.class)),
				"A fallback for an unsupported type should fail");
		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("9.99", TargetType.of(Money.class)),
				"Exceptions thrown by custom converters should be wrapped");
	}

	@Test
	public void testCustomValueConverterWrongType() {
		CustomValueConverter wrongTypeConverter = new CustomValueConverter() {
			@NonNull
			@Override
			public ConversionResult convert(@NonNull String text,
																			@NonNull TargetType targetType) {
				return ConversionResult.of("not a number");
			}

			@NonNull
			@Override
			public Boolean appliesTo(@NonNull TargetType targetType) {
				return true;
			}
		};

		ValueConverter valueConverter = ValueConverter.withCustomValueConverters(List.of(wrongTypeConverter)).build();

		Assertions.assertThrows(FieldMappingException.class, () -> valueConverter.convert("1", TargetType.of(Integer.class)));
		Assertions.assertEquals("not a number", valueConverter.convert("1", TargetType.of(String.class)));
	}
}
