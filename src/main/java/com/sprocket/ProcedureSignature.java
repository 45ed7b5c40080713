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
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The declared parameter list of a stored procedure, read from JDBC metadata.
 * <p>
 * An empty signature means the driver reported nothing; that is not an error by itself.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ProcedureSignature {
	@NonNull
	private static final String SEGMENT_REGEX = "(?:[\\p{L}\\p{N}_$#@]+|\\[[^\\]]+\\]|\"[^\"]+\")";
	@NonNull
	private static final Pattern PROCEDURE_NAME_PATTERN = Pattern.compile(format("%s(?:\\.%s)*", SEGMENT_REGEX, SEGMENT_REGEX));
	@NonNull
	private static final Pattern SEGMENT_PATTERN = Pattern.compile(SEGMENT_REGEX);

	@NonNull
	private final String procedureName;
	@NonNull
	private final List<ProcedureParameter> parameters;

	public ProcedureSignature(@NonNull String procedureName,
														@NonNull List<ProcedureParameter> parameters) {
		requireNonNull(procedureName);
		requireNonNull(parameters);

		this.procedureName = procedureName;
		this.parameters = List.copyOf(parameters);
	}

	/**
	 * Reads the declared parameters of {@code procedureName}.
	 * <p>
	 * If the procedure is overloaded, no single parameter list applies and the signature is empty.
	 *
	 * @param connection    an open connection
	 * @param procedureName the procedure name
	 * @return the signature, possibly empty
	 * @throws SQLException if reading metadata fails
	 * @see #read(Connection, String, Collection)
	 */
	@NonNull
	public static ProcedureSignature read(@NonNull Connection connection,
																				@NonNull String procedureName) throws SQLException {
		requireNonNull(connection);
		requireNonNull(procedureName);

		List<ProcedureSignature> overloads = readOverloads(connection, procedureName);
		return overloads.size() == 1 ? overloads.get(0) : new ProcedureSignature(procedureName, List.of());
	}

	/**
	 * Reads the declared parameters of the overload of {@code procedureName} that accepts exactly
	 * {@code suppliedNames}.
	 * <p>
	 * A procedure with a single overload yields that overload whatever the supplied names are. With several
	 * overloads, the one whose every input parameter is supplied and whose parameters answer to every supplied name
	 * wins. If no overload or more than one qualifies, the signature is empty.
	 *
	 * @param connection    an open connection
	 * @param procedureName the procedure name
	 * @param suppliedNames names of the values the caller will bind
	 * @return the signature, possibly empty
	 * @throws SQLException if reading metadata fails
	 */
	@NonNull
	public static ProcedureSignature read(@NonNull Connection connection,
																				@NonNull String procedureName,
																				@NonNull Collection<String> suppliedNames) throws SQLException {
		requireNonNull(connection);
		requireNonNull(procedureName);
		requireNonNull(suppliedNames);

		List<ProcedureSignature> overloads = readOverloads(connection, procedureName);

		if (overloads.size() == 1)
			return overloads.get(0);

		List<ProcedureSignature> acceptingOverloads = new ArrayList<>();

		for (ProcedureSignature overload : overloads)
			if (overload.accepts(suppliedNames))
				acceptingOverloads.add(overload);

		return acceptingOverloads.size() == 1 ? acceptingOverloads.get(0) : new ProcedureSignature(procedureName, List.of());
	}

	/**
	 * Reads every overload of {@code procedureName} visible in one schema.
	 * <p>
	 * The (optionally {@code schema.} or {@code catalog.schema.} qualified) name is looked up as given, then
	 * upper-cased, then lower-cased, since drivers differ in how they fold unquoted identifiers. Rows are grouped
	 * into overloads by {@code SPECIFIC_NAME} and ordered by {@code ORDINAL_POSITION}. Result and return value
	 * columns are excluded.
	 *
	 * @param connection    an open connection
	 * @param procedureName the procedure name
	 * @return one signature per overload, empty if the driver reports nothing
	 * @throws SQLException if reading metadata fails
	 */
	@NonNull
	public static List<ProcedureSignature> readOverloads(@NonNull Connection connection,
																											 @NonNull String procedureName) throws SQLException {
		requireNonNull(connection);
		requireNonNull(procedureName);

		List<String> segments = nameSegments(procedureName);
		String name = segments.get(segments.size() - 1);
		String schema = segments.size() >= 2 ? segments.get(segments.size() - 2) : null;
		String catalog = segments.size() >= 3 ? segments.get(segments.size() - 3) : null;

		DatabaseMetaData databaseMetaData = connection.getMetaData();
		String searchStringEscape = databaseMetaData.getSearchStringEscape();

		for (CaseVariant caseVariant : CaseVariant.values()) {
			String variantName = caseVariant.apply(name);
			String variantSchema = schema == null ? null : caseVariant.apply(schema);
			String variantCatalog = catalog == null ? null : caseVariant.apply(catalog);

			if (caseVariant != CaseVariant.AS_GIVEN && variantName.equals(name)
					&& (schema == null || variantSchema.equals(schema))
					&& (catalog == null || variantCatalog.equals(catalog)))
				continue;

			// Schema -> specific name -> declared columns
			Map<String, Map<String, List<DeclaredColumn>>> overloadsBySchema = new LinkedHashMap<>();

			try (ResultSet resultSet = databaseMetaData.getProcedureColumns(variantCatalog,
					variantSchema == null ? null : escapeSearchString(variantSchema, searchStringEscape),
					escapeSearchString(variantName, searchStringEscape), "%")) {
				while (resultSet.next()) {
					// The schema and overload count as found even if they only report result columns
					String procedureSchema = resultSet.getString("PROCEDURE_SCHEM");
					String specificName = specificName(resultSet).orElse("");
					List<DeclaredColumn> declaredColumns = overloadsBySchema
							.computeIfAbsent(procedureSchema == null ? "" : procedureSchema, (key) -> new LinkedHashMap<>())
							.computeIfAbsent(specificName, (key) -> new ArrayList<>());

					ProcedureParameter.Mode mode = modeFor(resultSet.getShort("COLUMN_TYPE")).orElse(null);

					if (mode == null)
						continue;

					String columnName = resultSet.getString("COLUMN_NAME");
					declaredColumns.add(new DeclaredColumn(columnName == null ? "" : columnName, mode,
							resultSet.getInt("DATA_TYPE"), ordinalPosition(resultSet).orElse(declaredColumns.size() + 1)));
				}
			}

			if (!overloadsBySchema.isEmpty()) {
				List<ProcedureSignature> overloads = new ArrayList<>();

				for (List<DeclaredColumn> declaredColumns : pickSchemaOverloads(connection, overloadsBySchema).values())
					overloads.add(new ProcedureSignature(procedureName, toParameters(declaredColumns)));

				return overloads;
			}
		}

		return List.of();
	}

	/**
	 * Can this parameter list be called with exactly {@code suppliedNames}? Every name must answer to a declared
	 * parameter, and every IN/INOUT parameter must be supplied.
	 */
	@NonNull
	Boolean accepts(@NonNull Collection<String> suppliedNames) {
		requireNonNull(suppliedNames);

		for (String suppliedName : suppliedNames)
			if (findParameter(suppliedName).isEmpty())
				return false;

		for (ProcedureParameter parameter : getParameters()) {
			if (!parameter.getMode().isBound())
				continue;

			boolean supplied = false;

			for (String suppliedName : suppliedNames)
				if (parameter.matchesName(suppliedName))
					supplied = true;

			if (!supplied)
				return false;
		}

		return true;
	}

	/**
	 * Verifies that {@code procedureName} is a plain, optionally qualified identifier.
	 *
	 * @param procedureName the name to check
	 * @return {@code procedureName}, trimmed
	 * @throws IllegalArgumentException if the name is blank or contains anything but letters, digits, {@code _ $ # @},
	 *                                  dots between segments, or bracketed/double-quoted segments
	 */
	@NonNull
	public static String validateProcedureName(@NonNull String procedureName) {
		requireNonNull(procedureName);

		String trimmed = procedureName.trim();

		if (trimmed.isEmpty())
			throw new IllegalArgumentException("Procedure name must not be blank");

		if (!PROCEDURE_NAME_PATTERN.matcher(trimmed).matches())
			throw new IllegalArgumentException(format("Invalid procedure name '%s'", procedureName));

		return trimmed;
	}

	/**
	 * Splits a validated procedure name into its segments, with brackets and quotes removed.
	 */
	@NonNull
	static List<String> nameSegments(@NonNull String procedureName) {
		requireNonNull(procedureName);

		List<String> segments = new ArrayList<>();
		Matcher matcher = SEGMENT_PATTERN.matcher(validateProcedureName(procedureName));

		while (matcher.find()) {
			String segment = matcher.group();

			if ((segment.startsWith("[") && segment.endsWith("]")) || (segment.startsWith("\"") && segment.endsWith("\"")))
				segment = segment.substring(1, segment.length() - 1);

			segments.add(segment);
		}

		return segments;
	}

	@NonNull
	private static Map<String, List<DeclaredColumn>> pickSchemaOverloads(@NonNull Connection connection,
																																			 @NonNull Map<String, Map<String, List<DeclaredColumn>>> overloadsBySchema) throws SQLException {
		if (overloadsBySchema.size() > 1) {
			String currentSchema = currentSchema(connection).orElse(null);

			if (currentSchema != null)
				for (Map.Entry<String, Map<String, List<DeclaredColumn>>> entry : overloadsBySchema.entrySet())
					if (entry.getKey().equalsIgnoreCase(currentSchema))
						return entry.getValue();
		}

		return overloadsBySchema.values().iterator().next();
	}

	/**
	 * Orders columns by their reported position and renumbers them from 1, the placeholder positions in the call.
	 */
	@NonNull
	private static List<ProcedureParameter> toParameters(@NonNull List<DeclaredColumn> declaredColumns) {
		List<DeclaredColumn> orderedColumns = new ArrayList<>(declaredColumns);
		orderedColumns.sort(Comparator.comparingInt(DeclaredColumn::ordinalPosition));

		List<ProcedureParameter> parameters = new ArrayList<>(orderedColumns.size());

		for (DeclaredColumn declaredColumn : orderedColumns)
			parameters.add(new ProcedureParameter(declaredColumn.name(), parameters.size() + 1, declaredColumn.mode(), declaredColumn.sqlType()));

		return parameters;
	}

	@NonNull
	private static Optional<String> specificName(@NonNull ResultSet resultSet) {
		try {
			return Optional.ofNullable(resultSet.getString("SPECIFIC_NAME"));
		} catch (SQLException e) {
			// Drivers predating JDBC 4 have no SPECIFIC_NAME column; every row then belongs to one overload
			return Optional.empty();
		}
	}

	@NonNull
	private static Optional<Integer> ordinalPosition(@NonNull ResultSet resultSet) {
		try {
			int ordinalPosition = resultSet.getInt("ORDINAL_POSITION");
			return resultSet.wasNull() ? Optional.empty() : Optional.of(ordinalPosition);
		} catch (SQLException e) {
			return Optional.empty();
		}
	}

	@NonNull
	private static Optional<String> currentSchema(@NonNull Connection connection) throws SQLException {
		try {
			return Optional.ofNullable(connection.getSchema());
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return Optional.empty();
		}
	}

	@NonNull
	private static Optional<ProcedureParameter.Mode> modeFor(short columnType) {
		switch (columnType) {
			case DatabaseMetaData.procedureColumnIn:
			case DatabaseMetaData.procedureColumnUnknown:
				return Optional.of(ProcedureParameter.Mode.IN);
			case DatabaseMetaData.procedureColumnInOut:
				return Optional.of(ProcedureParameter.Mode.INOUT);
			case DatabaseMetaData.procedureColumnOut:
				return Optional.of(ProcedureParameter.Mode.OUT);
			default:
				// Result set columns and return values are not call arguments
				return Optional.empty();
		}
	}

	@NonNull
	private static String escapeSearchString(@NonNull String value,
																					 @Nullable String searchStringEscape) {
		if (searchStringEscape == null || searchStringEscape.isEmpty())
			return value;

		return value.replace(searchStringEscape, searchStringEscape + searchStringEscape)
				.replace("_", searchStringEscape + "_")
				.replace("%", searchStringEscape + "%");
	}

	/**
	 * Finds the declared parameter answering to {@code name}, ignoring case and a leading {@code @}.
	 *
	 * @param name the name to look up
	 * @return the matching parameter, if any
	 */
	@NonNull
	public Optional<ProcedureParameter> findParameter(@NonNull String name) {
		requireNonNull(name);

		for (ProcedureParameter parameter : getParameters())
			if (parameter.matchesName(name))
				return Optional.of(parameter);

		return Optional.empty();
	}

	/**
	 * @return names of every parameter as the driver reports them
	 */
	@NonNull
	public Set<String> getParameterNames() {
		Set<String> parameterNames = new LinkedHashSet<>();

		for (ProcedureParameter parameter : getParameters())
			parameterNames.add(parameter.getName());

		return parameterNames;
	}

	@NonNull
	public Boolean isEmpty() {
		return this.parameters.isEmpty();
	}

	@NonNull
	public String getProcedureName() {
		return this.procedureName;
	}

	@NonNull
	public List<ProcedureParameter> getParameters() {
		return this.parameters;
	}

	@Override
	public String toString() {
		return format("%s{procedureName=%s, parameters=%s}", getClass().getSimpleName(), getProcedureName(), getParameters());
	}

	private record DeclaredColumn(@NonNull String name,
																ProcedureParameter.@NonNull Mode mode,
																int sqlType,
																int ordinalPosition) {}

	private enum CaseVariant {
		AS_GIVEN,
		UPPER,
		LOWER;

		@NonNull
		String apply(@NonNull String value) {
			switch (this) {
				case UPPER:
					return value.toUpperCase(Locale.ROOT);
				case LOWER:
					return value.toLowerCase(Locale.ROOT);
				default:
					return value;
			}
		}
	}
}
