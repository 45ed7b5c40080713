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
import java.util.Optional;

/**
 * Enables per-type text conversion customization via {@link ValueConverter}.
 * <p>
 * Custom converters are consulted, in registration order, before any built-in conversion.
 *
 * @since 1.0.0
 */
public interface CustomValueConverter {
	/**
	 * Perform custom conversion of a column's text: given {@code text}, optionally return an instance of
	 * {@code targetType} instead.
	 * <p>
	 * This method is only invoked when {@code text} is non-null.
	 *
	 * @param text       the cell text, as produced by {@link RowMaterializer}
	 * @param targetType the type to which {@code text} should be converted (already unwrapped from {@code Optional})
	 * @return either {@link ConversionResult#of(Object)} to indicate a successfully-converted value or
	 * {@link ConversionResult#fallback()} to fall back to the built-in conversion behavior
	 * @throws FieldMappingException if {@code text} cannot be converted
	 */
	@NonNull
	ConversionResult convert(@NonNull String text,
													 @NonNull TargetType targetType);

	/**
	 * Specifies which types this converter should handle.
	 * <p>
	 * For example, if this converter should apply when converting to {@code MyCustomType}, this method could return
	 * {@code targetType.matchesClass(MyCustomType.class)}.
	 *
	 * @param targetType the target type to evaluate
	 * @return {@code true} if this converter should handle the type, {@code false} otherwise
	 */
	@NonNull
	Boolean appliesTo(@NonNull TargetType targetType);

	/**
	 * Result of a custom conversion attempt.
	 * <p>
	 * Use {@link #of(Object)} to indicate a successfully converted value or {@link #fallback()} to indicate
	 * "didn't convert; fall back to the built-in behavior".
	 */
	@ThreadSafe
	sealed abstract class ConversionResult permits ConversionResult.CustomConversion, ConversionResult.Fallback {
		private ConversionResult() {}

		/**
		 * Indicates a successfully-converted custom value.
		 *
		 * @param value the custom value, may be {@code null}
		 * @return a result which indicates a successfully-converted custom value
		 */
		@NonNull
		public static ConversionResult of(@Nullable Object value) {
			return new CustomConversion(value);
		}

		/**
		 * Indicates that this converter did not produce a value.
		 *
		 * @return a result which indicates that built-in conversion should be used
		 */
		@NonNull
		public static ConversionResult fallback() {
			return Fallback.INSTANCE;
		}

		@ThreadSafe
		static final class CustomConversion extends ConversionResult {
			@Nullable
			private final Object value;

			private CustomConversion(@Nullable Object value) {
				this.value = value;
			}

			@NonNull
			public Optional<Object> getValue() {
				return Optional.ofNullable(value);
			}
		}

		@ThreadSafe
		static final class Fallback extends ConversionResult {
			static final Fallback INSTANCE = new Fallback();

			private Fallback() {}
		}
	}
}
