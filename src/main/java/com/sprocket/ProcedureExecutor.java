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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;
import static java.util.stream.Collectors.joining;

/**
 * Main class for calling stored procedures and mapping their results.
 * <p>
 * Every call opens its own connection from the supplied {@link ConnectionDescriptor} and closes it before returning,
 * on success and on failure alike. Parameters are read from a parameter object by name, matched against the
 * procedure's declared signature and bound in declaration order. The first result set the procedure produces is
 * mapped to the requested type.
 * <p>
 * For example:
 * <pre>
 * ProcedureExecutor procedureExecutor = ProcedureExecutor.withDefaultConfiguration();
 * ConnectionDescriptor reporting = ConnectionStrings.fromClasspath().get("reporting");
 *
 * List&lt;Customer&gt; customers = procedureExecutor.fetchMany(reporting, Map.of("region", "EU"),
 *     "GetCustomersByRegion", Customer.class);
 * </pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ProcedureExecutor {
	@NonNull
	private final RowMaterializer rowMaterializer;
	@NonNull
	private final RowMapper rowMapper;
	@NonNull
	private final ProcedureParameterBinder procedureParameterBinder;
	@NonNull
	private final ParameterBagReader parameterBagReader;
	@NonNull
	private final ProcedureCallLogger procedureCallLogger;
	@NonNull
	private final Logger rowMappingLogger;

	private ProcedureExecutor(@NonNull Builder builder) {
		requireNonNull(builder);

		this.rowMaterializer = builder.rowMaterializer != null ? builder.rowMaterializer
				: RowMaterializer.withNormalizationLocale(builder.normalizationLocale).build();
		this.rowMapper = builder.rowMapper != null ? builder.rowMapper
				: RowMapper.withInstanceProvider(builder.instanceProvider).normalizationLocale(builder.normalizationLocale).build();
		this.procedureParameterBinder = builder.procedureParameterBinder != null ? builder.procedureParameterBinder
				: ProcedureParameterBinder.withDefaultConfiguration();
		this.parameterBagReader = builder.parameterBagReader != null ? builder.parameterBagReader
				: ParameterBagReader.withDefaultConfiguration();
		this.procedureCallLogger = builder.procedureCallLogger != null ? builder.procedureCallLogger
				: (procedureCallLog) -> {};
		this.rowMappingLogger = Logger.getLogger(RowMapper.class.getName());
	}

	/**
	 * Provides a {@link ProcedureExecutor} builder.
	 *
	 * @return a {@code ProcedureExecutor} builder
	 */
	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Provides a {@link ProcedureExecutor} with out-of-the-box defaults.
	 *
	 * @return a {@code ProcedureExecutor} with default configuration
	 */
	@NonNull
	public static ProcedureExecutor withDefaultConfiguration() {
		return builder().build();
	}

	/**
	 * Calls a procedure with no parameters and maps its first row, if any.
	 *
	 * @see #fetchOne(ConnectionDescriptor, Object, String, Class)
	 */
	@NonNull
	public <T> Optional<T> fetchOne(@NonNull ConnectionDescriptor connectionDescriptor,
																	@NonNull String procedureName,
																	@NonNull Class<T> resultType) {
		return fetchOne(connectionDescriptor, null, procedureName, resultType);
	}

	/**
	 * Calls a procedure and maps its first row, if any.
	 * <p>
	 * The driver is asked for at most one row. Should it return more anyway, the extras are ignored.
	 *
	 * @param connectionDescriptor the database to call
	 * @param parameters           the parameter object, or {@code null} for none
	 * @param procedureName        the procedure to call, optionally schema-qualified
	 * @param resultType           the type to map the row to
	 * @param <T>                  the mapped type
	 * @return the mapped first row, or empty if the procedure produced no rows
	 * @throws IllegalArgumentException if the procedure name is invalid
	 * @throws ConnectionException      if no connection could be opened
	 * @throws ProcedureException       if the call was rejected or the parameters do not fit the procedure
	 */
	@NonNull
	public <T> Optional<T> fetchOne(@NonNull ConnectionDescriptor connectionDescriptor,
																	@Nullable Object parameters,
																	@NonNull String procedureName,
																	@NonNull Class<T> resultType) {
		requireNonNull(resultType);

		List<T> results = invoke(connectionDescriptor, parameters, procedureName, Cardinality.ONE, resultType);
		return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
	}

	/**
	 * Calls a procedure with no parameters and maps every row.
	 *
	 * @see #fetchMany(ConnectionDescriptor, Object, String, Class)
	 */
	@NonNull
	public <T> List<T> fetchMany(@NonNull ConnectionDescriptor connectionDescriptor,
															 @NonNull String procedureName,
															 @NonNull Class<T> resultType) {
		return fetchMany(connectionDescriptor, null, procedureName, resultType);
	}

	/**
	 * Calls a procedure and maps every row, in the order the database returned them.
	 *
	 * @param connectionDescriptor the database to call
	 * @param parameters           the parameter object, or {@code null} for none
	 * @param procedureName        the procedure to call, optionally schema-qualified
	 * @param resultType           the type to map rows to
	 * @param <T>                  the mapped type
	 * @return an unmodifiable list of mapped rows, empty if the procedure produced none
	 * @throws IllegalArgumentException if the procedure name is invalid
	 * @throws ConnectionException      if no connection could be opened
	 * @throws ProcedureException       if the call was rejected or the parameters do not fit the procedure
	 */
	@NonNull
	public <T> List<T> fetchMany(@NonNull ConnectionDescriptor connectionDescriptor,
															 @Nullable Object parameters,
															 @NonNull String procedureName,
															 @NonNull Class<T> resultType) {
		requireNonNull(resultType);
		return invoke(connectionDescriptor, parameters, procedureName, Cardinality.MANY, resultType);
	}

	/**
	 * Calls a procedure with no parameters for its side effects.
	 *
	 * @see #run(ConnectionDescriptor, Object, String)
	 */
	public void run(@NonNull ConnectionDescriptor connectionDescriptor,
									@NonNull String procedureName) {
		run(connectionDescriptor, null, procedureName);
	}

	/**
	 * Calls a procedure for its side effects. Any result set or update count is ignored.
	 *
	 * @param connectionDescriptor the database to call
	 * @param parameters           the parameter object, or {@code null} for none
	 * @param procedureName        the procedure to call, optionally schema-qualified
	 * @throws IllegalArgumentException if the procedure name is invalid
	 * @throws ConnectionException      if no connection could be opened
	 * @throws ProcedureException       if the call was rejected or the parameters do not fit the procedure
	 */
	public void run(@NonNull ConnectionDescriptor connectionDescriptor,
									@Nullable Object parameters,
									@NonNull String procedureName) {
		invoke(connectionDescriptor, parameters, procedureName, Cardinality.NONE, null);
	}

	@NonNull
	protected <T> List<T> invoke(@NonNull ConnectionDescriptor connectionDescriptor,
															 @Nullable Object parameters,
															 @NonNull String procedureName,
															 @NonNull Cardinality cardinality,
															 @Nullable Class<T> resultType) {
		requireNonNull(connectionDescriptor);
		requireNonNull(procedureName);
		requireNonNull(cardinality);

		// Both of these fail before any connection is opened
		String validatedProcedureName = ProcedureSignature.validateProcedureName(procedureName);
		Map<String, Object> parameterBag = getParameterBagReader().read(parameters);

		ProcedureCall.Builder procedureCallBuilder = ProcedureCall.with(validatedProcedureName, connectionDescriptor, cardinality)
				.resultType(resultType);

		long startTime = nanoTime();
		Duration connectionAcquisitionDuration = null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultSetMappingDuration = null;
		Integer rowCount = null;
		int fieldMappingFailureCount = 0;
		Exception exception = null;
		Throwable thrown = null;
		Connection connection = null;
		List<T> results = List.of();

		try {
			connection = acquireConnection(connectionDescriptor);
			connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			ProcedureSignature procedureSignature = ProcedureSignature.read(connection, validatedProcedureName, parameterBag.keySet());
			List<PlannedParameter> plannedParameters = planParameters(procedureSignature, parameterBag);
			String sql = callSql(validatedProcedureName, plannedParameters.size());

			procedureCallBuilder.sql(sql).parameters(boundParameterValues(plannedParameters));

			try (CallableStatement callableStatement = connection.prepareCall(sql)) {
				if (cardinality == Cardinality.ONE)
					callableStatement.setMaxRows(1);

				for (PlannedParameter plannedParameter : plannedParameters) {
					ProcedureParameter declaredParameter = plannedParameter.getDeclaredParameter().orElse(null);

					if (declaredParameter != null && declaredParameter.getMode().isRegistered())
						getProcedureParameterBinder().registerOutParameter(callableStatement, declaredParameter);

					if (plannedParameter.isBound())
						getProcedureParameterBinder().bindParameter(callableStatement, plannedParameter.getIndex(),
								plannedParameter.getValue().orElse(null), declaredParameter);
				}

				preparationDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();

				boolean hasResultSet = callableStatement.execute();

				executionDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();

				if (cardinality != Cardinality.NONE) {
					RowSet rowSet = materializeFirstResultSet(callableStatement, hasResultSet);
					rowCount = rowSet.size();

					List<T> mappedResults = new ArrayList<>(rowSet.size());

					// An empty row set never reaches the mapper
					if (!rowSet.isEmpty()) {
						Set<String> fieldNames = getRowMapper().matchingFieldNames(resultType, rowSet);
						List<RawRow> rows = cardinality == Cardinality.ONE ? rowSet.getRows().subList(0, 1) : rowSet.getRows();

						for (RawRow row : rows) {
							RowMappingResult<T> rowMappingResult = getRowMapper().mapRow(row, resultType, fieldNames);

							for (FieldMappingFailure fieldMappingFailure : rowMappingResult.getFailures())
								logFieldMappingFailure(validatedProcedureName, resultType, fieldMappingFailure);

							fieldMappingFailureCount += rowMappingResult.getFailures().size();
							mappedResults.add(rowMappingResult.getValue());
						}
					}

					results = Collections.unmodifiableList(mappedResults);
					resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
				}
			}
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} catch (Exception e) {
			ProcedureException wrapped = new ProcedureException(validatedProcedureName, e);
			exception = wrapped;
			thrown = wrapped;
			throw wrapped;
		} finally {
			Throwable cleanupFailure = null;

			if (connection != null) {
				try {
					connection.close();
				} catch (Throwable cleanupException) {
					cleanupFailure = cleanupException;
				}
			}

			ProcedureCallLog procedureCallLog = ProcedureCallLog.withProcedureCall(procedureCallBuilder.build())
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.resultSetMappingDuration(resultSetMappingDuration)
					.rowCount(rowCount)
					.fieldMappingFailureCount(fieldMappingFailureCount)
					.exception(exception)
					.build();

			try {
				getProcedureCallLogger().log(procedureCallLog);
			} catch (Throwable cleanupException) {
				if (cleanupFailure == null)
					cleanupFailure = cleanupException;
				else
					cleanupFailure.addSuppressed(cleanupException);
			}

			if (cleanupFailure != null) {
				if (thrown != null)
					thrown.addSuppressed(cleanupFailure);
				else if (cleanupFailure instanceof RuntimeException runtimeException)
					throw runtimeException;
				else if (cleanupFailure instanceof Error error)
					throw error;
				else
					throw new ProcedureException(validatedProcedureName, "Cleanup after procedure call failed", cleanupFailure);
			}
		}

		return results;
	}

	@NonNull
	protected Connection acquireConnection(@NonNull ConnectionDescriptor connectionDescriptor) {
		requireNonNull(connectionDescriptor);

		try {
			return connectionDescriptor.openConnection();
		} catch (SQLException e) {
			throw new ConnectionException(connectionDescriptor, e);
		}
	}

	/**
	 * Walks the statement's results until the first result set, and materializes it.
	 * <p>
	 * Update counts that precede the result set are skipped. Some drivers report the call itself as an update count
	 * and expose the procedure's result sets only through {@link CallableStatement#getMoreResults()}.
	 */
	@NonNull
	protected RowSet materializeFirstResultSet(@NonNull CallableStatement callableStatement,
																						 boolean hasResultSet) throws SQLException {
		requireNonNull(callableStatement);

		while (!hasResultSet) {
			hasResultSet = callableStatement.getMoreResults();

			if (!hasResultSet && callableStatement.getUpdateCount() == -1)
				return RowSet.empty();
		}

		try (ResultSet resultSet = callableStatement.getResultSet()) {
			return resultSet == null ? RowSet.empty() : getRowMaterializer().materialize(resultSet);
		}
	}

	/**
	 * Decides what to bind at each placeholder.
	 * <p>
	 * With a known signature, parameter object fields are matched to declared parameters by name and placed in
	 * declaration order. Without one, fields are bound in the order the parameter object supplies them.
	 *
	 * @throws ProcedureException if a field names no declared parameter, or a declared input has no field
	 */
	@NonNull
	protected List<PlannedParameter> planParameters(@NonNull ProcedureSignature procedureSignature,
																									@NonNull Map<String, Object> parameterBag) {
		requireNonNull(procedureSignature);
		requireNonNull(parameterBag);

		String procedureName = procedureSignature.getProcedureName();
		List<PlannedParameter> plannedParameters = new ArrayList<>();

		if (procedureSignature.isEmpty()) {
			int index = 1;

			for (Map.Entry<String, Object> entry : parameterBag.entrySet())
				plannedParameters.add(new PlannedParameter(index++, entry.getKey(), entry.getValue(), null));

			return plannedParameters;
		}

		Map<ProcedureParameter, String> fieldNamesByDeclaredParameter = new LinkedHashMap<>();

		for (String fieldName : parameterBag.keySet()) {
			ProcedureParameter declaredParameter = procedureSignature.findParameter(fieldName).orElse(null);

			if (declaredParameter == null)
				throw new ProcedureException(procedureName, format("Procedure '%s' has no parameter named '%s'. Declared parameters: %s",
						procedureName, fieldName, procedureSignature.getParameterNames()));

			String previousFieldName = fieldNamesByDeclaredParameter.putIfAbsent(declaredParameter, fieldName);

			if (previousFieldName != null)
				throw new ProcedureException(procedureName, format("Fields '%s' and '%s' both supply parameter '%s' of procedure '%s'",
						previousFieldName, fieldName, declaredParameter.getName(), procedureName));
		}

		List<String> missingParameterNames = new ArrayList<>();

		for (ProcedureParameter declaredParameter : procedureSignature.getParameters()) {
			String fieldName = fieldNamesByDeclaredParameter.get(declaredParameter);

			if (declaredParameter.getMode().isBound() && fieldName == null) {
				missingParameterNames.add(declaredParameter.getName());
				continue;
			}

			plannedParameters.add(new PlannedParameter(declaredParameter.getPosition(),
					fieldName == null ? declaredParameter.getName() : fieldName,
					fieldName == null ? null : parameterBag.get(fieldName), declaredParameter));
		}

		if (!missingParameterNames.isEmpty())
			throw new ProcedureException(procedureName, format("No value supplied for parameter[s] %s of procedure '%s'",
					missingParameterNames, procedureName));

		return plannedParameters;
	}

	@NonNull
	protected String callSql(@NonNull String procedureName,
													 int parameterCount) {
		requireNonNull(procedureName);

		return format("{call %s(%s)}", procedureName,
				Collections.nCopies(parameterCount, "?").stream().collect(joining(", ")));
	}

	protected void logFieldMappingFailure(@NonNull String procedureName,
																				@NonNull Class<?> resultType,
																				@NonNull FieldMappingFailure fieldMappingFailure) {
		requireNonNull(procedureName);
		requireNonNull(resultType);
		requireNonNull(fieldMappingFailure);

		getRowMappingLogger().log(WARNING, format("Unable to map column '%s' to property '%s' of %s for procedure '%s'; leaving it unset",
				fieldMappingFailure.getColumnName(), fieldMappingFailure.getPropertyName(), resultType.getSimpleName(), procedureName),
				fieldMappingFailure.getException());
	}

	@NonNull
	private static Map<String, Object> boundParameterValues(@NonNull List<PlannedParameter> plannedParameters) {
		Map<String, Object> boundParameterValues = new LinkedHashMap<>();

		for (PlannedParameter plannedParameter : plannedParameters)
			if (plannedParameter.isBound())
				boundParameterValues.put(plannedParameter.getName(), plannedParameter.getValue().orElse(null));

		return boundParameterValues;
	}

	@NonNull
	protected RowMaterializer getRowMaterializer() {
		return this.rowMaterializer;
	}

	@NonNull
	protected RowMapper getRowMapper() {
		return this.rowMapper;
	}

	@NonNull
	protected ProcedureParameterBinder getProcedureParameterBinder() {
		return this.procedureParameterBinder;
	}

	@NonNull
	protected ParameterBagReader getParameterBagReader() {
		return this.parameterBagReader;
	}

	@NonNull
	protected ProcedureCallLogger getProcedureCallLogger() {
		return this.procedureCallLogger;
	}

	@NonNull
	protected Logger getRowMappingLogger() {
		return this.rowMappingLogger;
	}

	/**
	 * What goes in one placeholder of the call.
	 */
	@ThreadSafe
	protected static final class PlannedParameter {
		@NonNull
		private final Integer index;
		@NonNull
		private final String name;
		@Nullable
		private final Object value;
		@Nullable
		private final ProcedureParameter declaredParameter;

		PlannedParameter(@NonNull Integer index,
										 @NonNull String name,
										 @Nullable Object value,
										 @Nullable ProcedureParameter declaredParameter) {
			this.index = requireNonNull(index);
			this.name = requireNonNull(name);
			this.value = value;
			this.declaredParameter = declaredParameter;
		}

		/**
		 * Is a value bound here? Everything but a declared {@code OUT} parameter is.
		 */
		@NonNull
		public Boolean isBound() {
			return this.declaredParameter == null || this.declaredParameter.getMode().isBound();
		}

		@NonNull
		public Integer getIndex() {
			return this.index;
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@NonNull
		public Optional<Object> getValue() {
			return Optional.ofNullable(this.value);
		}

		@NonNull
		public Optional<ProcedureParameter> getDeclaredParameter() {
			return Optional.ofNullable(this.declaredParameter);
		}

		@Override
		public String toString() {
			return format("%s{index=%d, name=%s, declaredParameter=%s}", getClass().getSimpleName(),
					getIndex(), getName(), getDeclaredParameter().orElse(null));
		}
	}

	/**
	 * Builder used to construct instances of {@link ProcedureExecutor}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private RowMaterializer rowMaterializer;
		@Nullable
		private RowMapper rowMapper;
		@Nullable
		private ProcedureParameterBinder procedureParameterBinder;
		@Nullable
		private ParameterBagReader parameterBagReader;
		@Nullable
		private ProcedureCallLogger procedureCallLogger;
		@NonNull
		private InstanceProvider instanceProvider;
		@NonNull
		private Locale normalizationLocale;

		private Builder() {
			this.instanceProvider = new InstanceProvider() {};
			this.normalizationLocale = Locale.ROOT;
		}

		@NonNull
		public Builder rowMaterializer(@Nullable RowMaterializer rowMaterializer) {
			this.rowMaterializer = rowMaterializer;
			return this;
		}

		/**
		 * Supplies a row mapper. When set, {@link #instanceProvider(InstanceProvider)} and
		 * {@link #normalizationLocale(Locale)} no longer affect mapping.
		 */
		@NonNull
		public Builder rowMapper(@Nullable RowMapper rowMapper) {
			this.rowMapper = rowMapper;
			return this;
		}

		@NonNull
		public Builder procedureParameterBinder(@Nullable ProcedureParameterBinder procedureParameterBinder) {
			this.procedureParameterBinder = procedureParameterBinder;
			return this;
		}

		@NonNull
		public Builder parameterBagReader(@Nullable ParameterBagReader parameterBagReader) {
			this.parameterBagReader = parameterBagReader;
			return this;
		}

		@NonNull
		public Builder procedureCallLogger(@Nullable ProcedureCallLogger procedureCallLogger) {
			this.procedureCallLogger = procedureCallLogger;
			return this;
		}

		@NonNull
		public Builder instanceProvider(@NonNull InstanceProvider instanceProvider) {
			requireNonNull(instanceProvider);
			this.instanceProvider = instanceProvider;
			return this;
		}

		@NonNull
		public Builder normalizationLocale(@NonNull Locale normalizationLocale) {
			requireNonNull(normalizationLocale);
			this.normalizationLocale = normalizationLocale;
			return this;
		}

		@NonNull
		public ProcedureExecutor build() {
			return new ProcedureExecutor(this);
		}
	}
}
