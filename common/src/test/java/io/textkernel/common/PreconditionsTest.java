/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
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

package io.textkernel.common;

import org.junit.Test;

import static io.textkernel.common.Preconditions.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public final class PreconditionsTest {

	@Test
	public void testCheckArgumentFormatsMessage() {
		try {
			checkArgument(false, "Cannot retain %d characters", -1);
			fail();
		} catch (IllegalArgumentException e) {
			assertEquals("Cannot retain -1 characters", e.getMessage());
		}
		checkArgument(true, () -> {
			throw new AssertionError("message must not be computed");
		});
	}

	@Test
	public void testCheckNotNull() {
		assertEquals("x", checkNotNull("x", "unused"));
		try {
			checkNotNull(null, "text");
			fail();
		} catch (NullPointerException e) {
			assertEquals("text", e.getMessage());
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testCheckState() {
		checkState(false, "exhausted");
	}
}
