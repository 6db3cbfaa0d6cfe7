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

package io.textkernel.ot;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static io.textkernel.common.Preconditions.*;

/**
 * One atomic edit applied at the current cursor position:
 * keep characters, insert text, or remove characters.
 */
public final class TextOp {
	public enum Type {
		RETAIN, INSERT, DELETE
	}

	private final Type type;
	private final int count;
	@Nullable
	private final String text;

	private TextOp(Type type, int count, @Nullable String text) {
		this.type = type;
		this.count = count;
		this.text = text;
	}

	@NotNull
	public static TextOp retain(int count) {
		checkArgument(count >= 0, "Cannot retain negative number of characters: %d", count);
		return new TextOp(Type.RETAIN, count, null);
	}

	@NotNull
	public static TextOp insert(String text) {
		checkNotNull(text, "Cannot insert null text");
		return new TextOp(Type.INSERT, text.length(), text);
	}

	@NotNull
	public static TextOp delete(int count) {
		checkArgument(count >= 0, "Cannot delete negative number of characters: %d", count);
		return new TextOp(Type.DELETE, count, null);
	}

	public Type getType() {
		return type;
	}

	public boolean isRetain() {
		return type == Type.RETAIN;
	}

	public boolean isInsert() {
		return type == Type.INSERT;
	}

	public boolean isDelete() {
		return type == Type.DELETE;
	}

	public String getText() {
		checkState(text != null, "Only insert carries text");
		return text;
	}

	public int length() {
		return count;
	}

	/**
	 * Change of the document length caused by this op.
	 */
	public int lengthDelta() {
		switch (type) {
			case RETAIN:
				return 0;
			case INSERT:
				return count;
			case DELETE:
				return -count;
			default:
				throw new AssertionError(type);
		}
	}

	/**
	 * Returns this op without its first {@code n} units.
	 */
	public TextOp shorten(int n) {
		checkArgument(n >= 0 && n <= count, "Cannot shorten %s by %d", this, n);
		switch (type) {
			case RETAIN:
				return retain(count - n);
			case INSERT:
				return insert(text.substring(n));
			case DELETE:
				return delete(count - n);
			default:
				throw new AssertionError(type);
		}
	}

	/**
	 * First {@code n} characters of an insert.
	 */
	public TextOp prefix(int n) {
		checkState(type == Type.INSERT, "Only insert has a text prefix");
		checkArgument(n >= 0 && n <= count, "Cannot take prefix of %d from %s", n, this);
		return insert(text.substring(0, n));
	}

	public TextOp merge(TextOp other) {
		checkArgument(type == other.type, "Cannot merge %s with %s", this, other);
		checkArgument(type == Type.INSERT || count <= Integer.MAX_VALUE - other.count,
				"Cannot merge %s with %s: length overflow", this, other);
		switch (type) {
			case RETAIN:
				return retain(count + other.count);
			case INSERT:
				return insert(text + other.text);
			case DELETE:
				return delete(count + other.count);
			default:
				throw new AssertionError(type);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		TextOp that = (TextOp) o;

		if (type != that.type) return false;
		if (count != that.count) return false;
		return text != null ? text.equals(that.text) : that.text == null;
	}

	@Override
	public int hashCode() {
		int result = type.hashCode();
		result = 31 * result + count;
		result = 31 * result + (text != null ? text.hashCode() : 0);
		return result;
	}

	@Override
	public String toString() {
		switch (type) {
			case RETAIN:
				return "retain(" + count + ')';
			case INSERT:
				return "insert(\"" + text + "\")";
			case DELETE:
				return "delete(" + count + ')';
			default:
				throw new AssertionError(type);
		}
	}
}
