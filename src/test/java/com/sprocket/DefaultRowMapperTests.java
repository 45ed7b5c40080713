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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import static java.lang.String.format;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultRowMapperTests {
	public record Product(Integer productId, String name, BigDecimal price, LocalDate releasedOn) {}

	public record AliasedProduct(@DatabaseColumn({"product_id", "id"}) Integer productId,
															 @DatabaseColumn("product_name") String name) {}

	public record Measurement(Integer reading, Integer calibration) {}

	public record Inventory(int quantity, OptionalInt reorderLevel, Optional<String> warehouse) {}

	public static class ProductBean {
		private Integer productId;
		@DatabaseColumn("product_name")
		private String name;
		private boolean discontinued;

		public Integer getProductId() {
			return this.productId;
		}

		public void setProductId(Integer productId) {
			this.productId = productId;
		}

		public String getName() {
			return this.name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public boolean isDiscontinued() {
			return this.discontinued;
		}

		public void setDiscontinued(boolean discontinued) {
			this.discontinued = discontinued;
		}
	}

	public static class SpecialProductBean extends ProductBean {
		private String category;

		public String getCategory() {
			return this.category;
		}

		public void setCategory(String category) {
			this.category = category;
		}
	}

	@Test
	public void testRecordMapping() {
		RawRow row = RawRow.builder()
				.column("productid", "7")
				.column("name", "Widget")
				.column("price", "19.99")
				.column("releasedon", "2024-03-05")
				.column("unused", "ignored")
				.build();

		Product product = mapSingleRow(row, Product.class);

		Assertions.assertEquals(new Product(7, "Widget", new BigDecimal("19.99"), LocalDate.of(2024, 3, 5)), product);
	}

	@Test
	public void testMatchingFieldNames() {
		RowMapper rowMapper = RowMapper.withDefaultConfiguration();
		RowSet rowSet = RowSet.of(List.of(RawRow.builder()
				.column("price", "1.00")
				.column("productid", "1")
				.column("unused", "x")
				.build()));

		Assertions.assertEquals(List.of("productid", "price"), List.copyOf(rowMapper.matchingFieldNames(Product.class, rowSet)),
				"Field names should follow property order and exclude unmatched columns");
	}

	@Test
	public void testMissingColumnsLeaveDefaults() {
		RawRow row = RawRow.builder()
				.column("name", "Widget")
				.build();

		Product product = mapSingleRow(row, Product.class);

		Assertions.assertEquals("Widget", product.name());
		Assertions.assertNull(product.productId());
		Assertions.assertNull(product.price());
	}

	@Test
	public void testDatabaseColumnAliases() {
		AliasedProduct first = mapSingleRow(RawRow.builder().column("product_id", "1").column("product_name", "One").build(), AliasedProduct.class);
		AliasedProduct second = mapSingleRow(RawRow.builder().column("id", "2").build(), AliasedProduct.class);
		AliasedProduct third = mapSingleRow(RawRow.builder().column("productid", "3").column("name", "Three").build(), AliasedProduct.class);

		Assertions.assertEquals(new AliasedProduct(1, "One"), first);
		Assertions.assertEquals(new AliasedProduct(2, null), second, "Second alias should be honored");
		Assertions.assertEquals(new AliasedProduct(null, null), third, "Aliases replace the property name");
	}

	@Test
	public void testOptionalsAndPrimitives() {
		Inventory populated = mapSingleRow(RawRow.builder()
				.column("quantity", "5")
				.column("reorderlevel", "2")
				.column("warehouse", "North")
				.build(), Inventory.class);

		Assertions.assertEquals(5, populated.quantity());
		Assertions.assertEquals(OptionalInt.of(2), populated.reorderLevel());
		Assertions.assertEquals(Optional.of("North"), populated.warehouse());

		Inventory absent = mapSingleRow(RawRow.builder()
				.column("quantity", "0")
				.column("reorderlevel", null)
				.column("warehouse", null)
				.build(), Inventory.class);

		Assertions.assertEquals(OptionalInt.empty(), absent.reorderLevel());
		Assertions.assertEquals(Optional.empty(), absent.warehouse());
	}

	@Test
	public void testFieldFailuresDoNotAbortRow() {
		RowMapper rowMapper = RowMapper.withDefaultConfiguration();
		RawRow row = RawRow.builder()
				.column("productid", "not-a-number")
				.column("name", "Widget")
				.column("price", "19.99")
				.column("releasedon", "yesterday")
				.build();
		RowSet rowSet = RowSet.of(List.of(row));

		RowMappingResult<Product> result = rowMapper.mapRow(row, Product.class, rowMapper.matchingFieldNames(Product.class, rowSet));

		Assertions.assertTrue(result.hasFailures());
		Assertions.assertEquals(2, result.getFailures().size());
		Assertions.assertEquals(new Product(null, "Widget", new BigDecimal("19.99"), null), result.getValue(),
				"Failed fields should stay unset and the rest should be populated");

		FieldMappingFailure failure = result.getFailures().get(0);
		Assertions.assertEquals("productId", failure.getPropertyName());
		Assertions.assertEquals("productid", failure.getColumnName());
		Assertions.assertEquals(Optional.of("not-a-number"), failure.getText());
	}

	@Test
	public void testCustomConverterFailuresDoNotAbortRow() {
		RowMapper rowMapper = RowMapper.withValueConverter((text, targetType) -> Integer.valueOf(text)).build();
		RawRow row = RawRow.builder()
				.column("reading", "1")
				.column("calibration", "off-scale")
				.build();

		RowMappingResult<Measurement> result = rowMapper.mapRow(row, Measurement.class, Set.of("reading", "calibration"));

		Assertions.assertEquals(new Measurement(1, null), result.getValue());
		Assertions.assertEquals(1, result.getFailures().size());

		FieldMappingFailure failure = result.getFailures().get(0);
		Assertions.assertEquals("calibration", failure.getPropertyName());
		Assertions.assertTrue(failure.getException().getCause() instanceof NumberFormatException,
				"Converter exception should be kept as the cause");
	}

	@Test
	public void testWrongConvertedTypeIsFieldFailure() {
		RowMapper rowMapper = RowMapper.withValueConverter((text, targetType) -> text).build();
		RawRow row = RawRow.builder()
				.column("quantity", "5")
				.column("reorderlevel", "2")
				.build();

		RowMappingResult<Inventory> result = rowMapper.mapRow(row, Inventory.class, Set.of("quantity", "reorderlevel"));

		Assertions.assertEquals(2, result.getFailures().size(), "Text is neither an int nor an OptionalInt value");
		Assertions.assertEquals(0, result.getValue().quantity());
		Assertions.assertEquals(OptionalInt.empty(), result.getValue().reorderLevel());
	}

	@Test
	public void testNullIntoPrimitiveIsFieldFailure() {
		RowMapper rowMapper = RowMapper.withDefaultConfiguration();
		RawRow row = RawRow.builder()
				.column("quantity", null)
				.build();

		RowMappingResult<Inventory> result = rowMapper.mapRow(row, Inventory.class, Set.of("quantity"));

		Assertions.assertEquals(1, result.getFailures().size());
		Assertions.assertEquals(0, result.getValue().quantity(), "Primitive should keep its default");
	}

	@Test
	public void testBeanMapping() {
		ProductBean productBean = mapSingleRow(RawRow.builder()
				.column("productid", "11")
				.column("product_name", "Gadget")
				.column("discontinued", "Y")
				.build(), ProductBean.class);

		Assertions.assertEquals(11, productBean.getProductId());
		Assertions.assertEquals("Gadget", productBean.getName());
		Assertions.assertTrue(productBean.isDiscontinued());
	}

	@Test
	public void testBeanMappingWithInheritedAnnotation() {
		SpecialProductBean specialProductBean = mapSingleRow(RawRow.builder()
				.column("product_name", "Gizmo")
				.column("category", "Tools")
				.build(), SpecialProductBean.class);

		Assertions.assertEquals("Gizmo", specialProductBean.getName(), "Superclass field annotation should be honored");
		Assertions.assertEquals("Tools", specialProductBean.getCategory());
	}

	@Test
	public void testCustomInstanceProvider() {
		ProductBean preconfigured = new ProductBean();
		preconfigured.setName("Default name");

		RowMapper rowMapper = RowMapper.withInstanceProvider(new InstanceProvider() {
			@Override
			@SuppressWarnings("unchecked")
			public <T> T provide(Class<T> instanceType) {
				return (T) preconfigured;
			}
		}).build();

		RawRow row = RawRow.builder().column("productid", "3").build();
		ProductBean productBean = rowMapper.mapRow(row, ProductBean.class, Set.of("productid")).getValue();

		Assertions.assertSame(preconfigured, productBean);
		Assertions.assertEquals(3, productBean.getProductId());
		Assertions.assertEquals("Default name", productBean.getName());
	}

	private <T> T mapSingleRow(RawRow row, Class<T> targetType) {
		RowMapper rowMapper = RowMapper.withDefaultConfiguration();
		RowMappingResult<T> result = rowMapper.mapRow(row, targetType, rowMapper.matchingFieldNames(targetType, RowSet.of(List.of(row))));

		Assertions.assertFalse(result.hasFailures(), () -> format("Unexpected failures: %s", result.getFailures()));
		return result.getValue();
	}
}
