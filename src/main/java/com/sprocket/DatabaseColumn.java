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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Allows specification of alternate column names for row mapping.
 * <p>
 * Useful when a procedure's result columns do not match property names. Matching stays case-insensitive.
 * When present, the annotated names replace the property name for matching purposes.
 * <p>
 * For example:
 *
 * <pre>
 * class Customer {
 *   &#064;DatabaseColumn({ &quot;cust_nm&quot;, &quot;customer_name&quot; })
 *   String name;
 *
 *   String getName() {
 *     return name;
 *   }
 *
 *   void setName(String name) {
 *     this.name = name;
 *   }
 * }
 *
 * procedureExecutor.fetchMany(connectionDescriptor, &quot;GetCustomers&quot;, Customer.class);
 * </pre>
 *
 * @since 1.0.0
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface DatabaseColumn {
	String[] value();
}
