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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

import static io.textkernel.common.Preconditions.checkArgument;
import static io.textkernel.common.Preconditions.checkNotNull;

/**
 * Plain-text document with undo and redo history.
 * Each applied operation stores its inverse, so undo needs no snapshots.
 * Not thread-safe.
 */
public final class TextOTState implements OTState<TextOperation> {
	private static final Logger logger = LoggerFactory.getLogger(TextOTState.class);

	public static final int DEFAULT_UNDO_LIMIT = 100;

	private String initialText = "";
	private int undoLimit = DEFAULT_UNDO_LIMIT;

	private String text = "";
	private final Deque<TextOperation> undoStack = new ArrayDeque<>();
	private final Deque<TextOperation> redoStack = new ArrayDeque<>();

	private TextOTState() {
	}

	@NotNull
	public static TextOTState create() {
		return new TextOTState();
	}

	@NotNull
	public TextOTState withText(String initialText) {
		this.initialText = checkNotNull(initialText, "Initial text must not be null");
		this.text = initialText;
		return this;
	}

	@NotNull
	public TextOTState withUndoLimit(int undoLimit) {
		checkArgument(undoLimit >= 0, "Undo limit must not be negative: %d", undoLimit);
		this.undoLimit = undoLimit;
		trim(undoStack);
		return this;
	}

	@Override
	public void init() {
		text = initialText;
		undoStack.clear();
		redoStack.clear();
	}

	@Override
	public void apply(TextOperation op) throws IncompatibleOperationException {
		TextOperation inverse = op.invert(text);
		text = op.apply(text);
		logger.trace("Applied {}, document length {}", op, text.length());
		push(undoStack, inverse);
		redoStack.clear();
	}

	public boolean undo() throws IncompatibleOperationException {
		if (undoStack.isEmpty()) {
			return false;
		}
		TextOperation inverse = undoStack.peek();
		TextOperation redo = inverse.invert(text);
		text = inverse.apply(text);
		undoStack.pop();
		push(redoStack, redo);
		logger.debug("Undo {}, {} more to undo", inverse, undoStack.size());
		return true;
	}

	public boolean redo() throws IncompatibleOperationException {
		if (redoStack.isEmpty()) {
			return false;
		}
		TextOperation op = redoStack.peek();
		TextOperation inverse = op.invert(text);
		text = op.apply(text);
		redoStack.pop();
		push(undoStack, inverse);
		logger.debug("Redo {}, {} more to redo", op, redoStack.size());
		return true;
	}

	public boolean canUndo() {
		return !undoStack.isEmpty();
	}

	public boolean canRedo() {
		return !redoStack.isEmpty();
	}

	public String getText() {
		return text;
	}

	private void push(Deque<TextOperation> stack, TextOperation op) {
		stack.push(op);
		trim(stack);
	}

	private void trim(Deque<TextOperation> stack) {
		while (stack.size() > undoLimit) {
			TextOperation dropped = stack.removeLast();
			logger.debug("History limit {} reached, dropping {}", undoLimit, dropped);
		}
	}

	@Override
	public String toString() {
		return "TextOTState{" +
				"length=" + text.length() +
				", undo=" + undoStack.size() +
				", redo=" + redoStack.size() +
				'}';
	}
}
