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
import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class TargetTypeTests {
	public record Holder(Optional<UUID> id, OptionalLong count, List<String> tags, int[] scores, Optional<?> anything) {}

	@Test
	public void testBaseTypes() throws NoSuchMethodException {
		TargetType id = TargetType.of(componentType("id"));
		Assertions.assertTrue(id.isOptional());
		Assertions.assertTrue(id.matchesClass(Optional.class));
		Assertions.assertEquals(UUID.class, id.getBaseType().getRawClass());

		TargetType count = TargetType.of(componentType("count"));
		Assertions.assertTrue(count.isOptional());
		Assertions.assertEquals(Long.class, count.getBaseType().getRawClass());

		TargetType tags = TargetType.of(componentType("tags"));
		Assertions.assertFalse(tags.isOptional());
		Assertions.assertSame(tags, tags.getBaseType());
		Assertions.assertEquals(List.of(TargetType.of(String.class)), tags.getTypeArguments());

		Assertions.assertEquals(int[].class, TargetType.of(componentType("scores")).getRawClass());
		Assertions.assertEquals(Object.class, TargetType.of(componentType("anything")).getBaseType().getRawClass(),
				"Unbounded wildcards should erase to Object");
	}

	@Test
	public void testPermitsAbsence() {
		Assertions.assertFalse(TargetType.of(int.class).permitsAbsence());
		Assertions.assertTrue(TargetType.of(Integer.class).permitsAbsence());
	}

	protected Type componentType(String name) throws NoSuchMethodException {
		return Holder.class.getMethod(name).getGenericReturnType();
	}
}
