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

import org.jetbrains.annotations.Nullable;

import java.util.Iterator;

import static io.textkernel.common.Preconditions.checkState;

/**
 * Walks the ops of one operation, keeping the remainder of a partially
 * consumed op as the current element.
 */
final class OpCursor {
	private final Iterator<TextOp> ops;
	@Nullable
	private TextOp current;

	OpCursor(TextOperation operation) {
		this.ops = operation.getOps().iterator();
		this.current = ops.hasNext() ? ops.next() : null;
	}

	boolean isExhausted() {
		return current == null;
	}

	@Nullable
	TextOp current() {
		return current;
	}

	boolean isAt(TextOp.Type type) {
		return current != null && current.getType() == type;
	}

	int remaining() {
		checkState(current != null, "Cursor is exhausted");
		return current.length();
	}

	void skip() {
		checkState(current != null, "Cursor is exhausted");
		current = ops.hasNext() ? ops.next() : null;
	}

	void consume(int n) {
		checkState(current != null, "Cursor is exhausted");
		if (n == current.length()) {
			skip();
		} else {
			current = current.shorten(n);
		}
	}

	@Override
	public String toString() {
		return "OpCursor{current=" + current + '}';
	}
}
