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

package io.textkernel.ot.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.textkernel.ot.TextOperation;
import org.junit.Test;

import static io.textkernel.ot.TextOp.*;
import static io.textkernel.ot.json.TextOperationJson.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public final class TextOperationJsonTest {

	@Test
	public void testToJson() {
		TextOperation operation = TextOperation.of(retain(5), insert("abc"), delete(2));
		assertEquals("[5,\"abc\",-2]", toJson(operation));
		assertEquals("[]", toJson(TextOperation.empty()));
	}

	@Test
	public void testFromJson() throws Exception {
		assertEquals(TextOperation.of(retain(5), insert("a\"b"), delete(2)), fromJson("[5, \"a\\\"b\", -2]"));
		assertEquals(TextOperation.empty(), fromJson("[]"));
	}

	@Test
	public void testFromJsonNormalizes() throws Exception {
		assertEquals(TextOperation.of(retain(3), insert("ab")), fromJson("[1, 2, \"a\", \"\", \"b\"]"));
	}

	@Test
	public void testWithGson() {
		Gson gson = new GsonBuilder()
				.registerTypeAdapter(TextOperation.class, TEXT_OPERATION_JSON)
				.create();

		TextOperation operation = TextOperation.of(delete(1), insert("J"), retain(4));
		String json = gson.toJson(operation);
		assertEquals("[-1,\"J\",4]", json);
		assertEquals(operation, gson.fromJson(json, TextOperation.class));
	}

	@Test
	public void testMalformed() {
		assertMalformed("");
		assertMalformed("{}");
		assertMalformed("5");
		assertMalformed("[0]");
		assertMalformed("[1.5]");
		assertMalformed("[null]");
		assertMalformed("[{\"retain\": 1}]");
		assertMalformed("[1, \"a\"");
		assertMalformed("[1] [2]");
		assertMalformed("[2147483647, 1]");
		assertMalformed("[-2147483647, -1]");
	}

	private static void assertMalformed(String json) {
		try {
			fromJson(json);
			fail("Expected parse failure for " + json);
		} catch (ParseException ignored) {
		}
	}
}
