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

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.google.gson.stream.MalformedJsonException;
import io.textkernel.ot.TextOp;
import io.textkernel.ot.TextOperation;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Compact JSON form of text operations: {@code [5, "abc", -2]} retains 5 characters,
 * inserts "abc" and deletes 2 characters.
 */
public final class TextOperationJson {
	private TextOperationJson() {
	}

	public static final TypeAdapter<TextOp> TEXT_OP_JSON = new TypeAdapter<TextOp>() {
		@Override
		public void write(JsonWriter out, TextOp op) throws IOException {
			switch (op.getType()) {
				case RETAIN:
					out.value(op.length());
					break;
				case INSERT:
					out.value(op.getText());
					break;
				case DELETE:
					out.value(-op.length());
					break;
				default:
					throw new AssertionError(op);
			}
		}

		@Override
		public TextOp read(JsonReader in) throws IOException {
			JsonToken token = in.peek();
			if (token == JsonToken.STRING) {
				return TextOp.insert(in.nextString());
			}
			if (token != JsonToken.NUMBER) {
				throw new MalformedJsonException("Expected number or string but was " + token + " at " + in.getPath());
			}
			String path = in.getPath();
			int count;
			try {
				count = in.nextInt();
			} catch (NumberFormatException e) {
				throw new MalformedJsonException("Expected integer at " + path, e);
			}
			if (count == 0 || count == Integer.MIN_VALUE) {
				throw new MalformedJsonException("Unsupported op length " + count + " at " + path);
			}
			return count > 0 ? TextOp.retain(count) : TextOp.delete(-count);
		}
	};

	public static final TypeAdapter<TextOperation> TEXT_OPERATION_JSON = new TypeAdapter<TextOperation>() {
		@Override
		public void write(JsonWriter out, TextOperation operation) throws IOException {
			out.beginArray();
			for (TextOp op : operation.getOps()) {
				TEXT_OP_JSON.write(out, op);
			}
			out.endArray();
		}

		@Override
		public TextOperation read(JsonReader in) throws IOException {
			if (in.peek() != JsonToken.BEGIN_ARRAY) {
				throw new MalformedJsonException("Expected array but was " + in.peek() + " at " + in.getPath());
			}
			TextOperation.Builder builder = TextOperation.builder();
			in.beginArray();
			while (in.hasNext()) {
				TextOp op = TEXT_OP_JSON.read(in);
				try {
					builder.append(op);
				} catch (IllegalArgumentException e) {
					throw new MalformedJsonException("Unsupported op " + op + " at " + in.getPath(), e);
				}
			}
			in.endArray();
			return builder.build();
		}
	};

	public static String toJson(TextOperation operation) {
		StringWriter writer = new StringWriter();
		try {
			TEXT_OPERATION_JSON.write(new JsonWriter(writer), operation);
		} catch (IOException e) {
			throw new AssertionError(e); // no I/O with StringWriter
		}
		return writer.toString();
	}

	public static TextOperation fromJson(String json) throws ParseException {
		JsonReader reader = new JsonReader(new StringReader(json));
		try {
			TextOperation operation = TEXT_OPERATION_JSON.read(reader);
			if (reader.peek() != JsonToken.END_DOCUMENT) {
				throw new ParseException("Unexpected trailing data after text operation: " + json);
			}
			return operation;
		} catch (IOException e) {
			throw new ParseException("Failed to read text operation from JSON: " + json, e);
		}
	}
}
