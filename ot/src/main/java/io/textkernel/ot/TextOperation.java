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

import java.util.ArrayList;
import java.util.List;

import static io.textkernel.common.Preconditions.checkNotNull;
import static java.lang.Math.min;
import static java.lang.String.format;
import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * An edit turning one revision of a plain-text document into the next.
 * <p>
 * Ops are read left to right over the document. The list is always in normal form:
 * no zero-length ops and no two adjacent ops of the same type.
 * Instances are immutable, use {@link Builder} to create them.
 */
public final class TextOperation {
	private static final TextOperation EMPTY = new TextOperation(emptyList());

	private final List<TextOp> ops;
	private final long baseLength;
	private final long targetLength;

	private TextOperation(List<TextOp> ops) {
		this.ops = ops;
		long base = 0;
		long target = 0;
		for (TextOp op : ops) {
			if (!op.isInsert()) base += op.length();
			if (!op.isDelete()) target += op.length();
		}
		this.baseLength = base;
		this.targetLength = target;
	}

	@NotNull
	public static TextOperation empty() {
		return EMPTY;
	}

	@NotNull
	public static TextOperation of(TextOp... ops) {
		return of(asList(ops));
	}

	@NotNull
	public static TextOperation of(List<TextOp> ops) {
		Builder builder = builder();
		for (TextOp op : ops) {
			builder.append(op);
		}
		return builder.build();
	}

	@NotNull
	public static Builder builder() {
		return new Builder();
	}

	public List<TextOp> getOps() {
		return ops;
	}

	public boolean isEmpty() {
		return ops.isEmpty();
	}

	/**
	 * Whether applying this operation leaves any document unchanged.
	 */
	public boolean isNoop() {
		return ops.isEmpty() || (ops.size() == 1 && ops.get(0).isRetain());
	}

	/**
	 * Length of the only document this operation can be applied to.
	 */
	public long getBaseLength() {
		return baseLength;
	}

	public long getTargetLength() {
		return targetLength;
	}

	public long getLengthDelta() {
		return targetLength - baseLength;
	}

	public String apply(String document) throws IncompatibleOperationException {
		checkBaseLength(document, "apply");
		StringBuilder result = new StringBuilder();
		int cursor = 0;
		for (TextOp op : ops) {
			switch (op.getType()) {
				case RETAIN:
					result.append(document, cursor, cursor + op.length());
					cursor += op.length();
					break;
				case INSERT:
					result.append(op.getText());
					break;
				case DELETE:
					cursor += op.length();
					break;
				default:
					throw new AssertionError(op);
			}
		}
		return result.toString();
	}

	/**
	 * Creates the operation that undoes this one.
	 * It is applicable to {@code apply(document)} and restores {@code document}.
	 *
	 * @param document the text this operation is applied to
	 */
	public TextOperation invert(String document) throws IncompatibleOperationException {
		checkBaseLength(document, "invert");
		Builder inverse = builder();
		int cursor = 0;
		for (TextOp op : ops) {
			switch (op.getType()) {
				case RETAIN:
					inverse.append(op);
					cursor += op.length();
					break;
				case INSERT:
					inverse.delete(op.length());
					break;
				case DELETE:
					inverse.insert(document.substring(cursor, cursor + op.length()));
					cursor += op.length();
					break;
				default:
					throw new AssertionError(op);
			}
		}
		return inverse.build();
	}

	/**
	 * Combines this operation with {@code next}, which is applied to the result of this one,
	 * into a single operation with the same effect.
	 */
	public TextOperation compose(TextOperation next) throws IncompatibleOperationException {
		OpCursor a = new OpCursor(this);
		OpCursor b = new OpCursor(next);
		Builder result = builder();

		while (!a.isExhausted() || !b.isExhausted()) {
			// text deleted by the first operation is never seen by the second
			if (a.isAt(TextOp.Type.DELETE)) {
				result.append(a.current());
				a.skip();
				continue;
			}
			// text inserted by the second operation did not exist for the first
			if (b.isAt(TextOp.Type.INSERT)) {
				result.append(b.current());
				b.skip();
				continue;
			}

			if (a.isExhausted()) {
				throw new IncompatibleOperationException("Cannot compose operations: first operation is too short");
			}
			if (b.isExhausted()) {
				throw new IncompatibleOperationException("Cannot compose operations: first operation is too long");
			}

			TextOp opA = a.current();
			TextOp opB = b.current();
			int n = min(opA.length(), opB.length());
			switch (opA.getType()) {
				case RETAIN:
					result.append(opB.isRetain() ? TextOp.retain(n) : TextOp.delete(n));
					break;
				case INSERT:
					// a delete of freshly inserted text cancels out
					if (opB.isRetain()) {
						result.append(opA.prefix(n));
					}
					break;
				default:
					throw new AssertionError(opA);
			}
			a.consume(n);
			b.consume(n);
		}

		return result.build();
	}

	/**
	 * Transforms two concurrent operations made against the same document.
	 * <p>
	 * {@code transformed.left} is applied after {@code right} and {@code transformed.right}
	 * is applied after {@code left}, both orders producing the same document.
	 * When both operations insert at the same position, text of {@code left} goes first.
	 */
	public static Transformed transform(TextOperation left, TextOperation right) throws IncompatibleOperationException {
		if (left.baseLength != right.baseLength) {
			throw new IncompatibleOperationException(format("Cannot transform operations: base lengths differ, %d != %d",
					left.baseLength, right.baseLength));
		}

		OpCursor a = new OpCursor(left);
		OpCursor b = new OpCursor(right);
		Builder leftPrime = builder();
		Builder rightPrime = builder();

		while (!a.isExhausted() || !b.isExhausted()) {
			if (a.isAt(TextOp.Type.INSERT)) {
				leftPrime.append(a.current());
				rightPrime.retain(a.remaining());
				a.skip();
				continue;
			}
			if (b.isAt(TextOp.Type.INSERT)) {
				leftPrime.retain(b.remaining());
				rightPrime.append(b.current());
				b.skip();
				continue;
			}

			if (a.isExhausted() || b.isExhausted()) {
				throw new IncompatibleOperationException("Cannot transform operations: operations have different lengths");
			}

			TextOp opA = a.current();
			TextOp opB = b.current();
			int n = min(opA.length(), opB.length());
			if (opA.isRetain() && opB.isRetain()) {
				leftPrime.retain(n);
				rightPrime.retain(n);
			} else if (opA.isDelete() && opB.isRetain()) {
				leftPrime.delete(n);
			} else if (opA.isRetain() && opB.isDelete()) {
				rightPrime.delete(n);
			}
			// both deleted the same span, nothing left to do on either side
			a.consume(n);
			b.consume(n);
		}

		return new Transformed(leftPrime.build(), rightPrime.build());
	}

	private void checkBaseLength(String document, String action) throws IncompatibleOperationException {
		if (baseLength > document.length()) {
			throw new IncompatibleOperationException(format("Cannot %s operation: operation is too long " +
					"(base length %d, document length %d)", action, baseLength, document.length()));
		}
		if (baseLength < document.length()) {
			throw new IncompatibleOperationException(format("Cannot %s operation: operation is too short " +
					"(base length %d, document length %d)", action, baseLength, document.length()));
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		TextOperation that = (TextOperation) o;
		return ops.equals(that.ops);
	}

	@Override
	public int hashCode() {
		return ops.hashCode();
	}

	@Override
	public String toString() {
		return ops.toString();
	}

	public static final class Transformed {
		public final TextOperation left;
		public final TextOperation right;

		private Transformed(TextOperation left, TextOperation right) {
			this.left = left;
			this.right = right;
		}

		@Override
		public String toString() {
			return "{" +
					"left=" + left +
					", right=" + right +
					'}';
		}
	}

	/**
	 * Collects ops, merging each one into the previous op of the same type.
	 * Not thread-safe. May be reused after {@link #build()}.
	 */
	public static final class Builder {
		private final List<TextOp> ops = new ArrayList<>();

		private Builder() {
		}

		public Builder append(TextOp op) {
			checkNotNull(op, "Cannot append null op");
			if (op.length() == 0) {
				return this;
			}
			int last = ops.size() - 1;
			if (last >= 0 && ops.get(last).getType() == op.getType()) {
				ops.set(last, ops.get(last).merge(op));
			} else {
				ops.add(op);
			}
			return this;
		}

		public Builder retain(int count) {
			return append(TextOp.retain(count));
		}

		public Builder insert(String text) {
			return append(TextOp.insert(text));
		}

		public Builder delete(int count) {
			return append(TextOp.delete(count));
		}

		public TextOperation build() {
			return ops.isEmpty() ? EMPTY : new TextOperation(unmodifiableList(new ArrayList<>(ops)));
		}
	}
}
