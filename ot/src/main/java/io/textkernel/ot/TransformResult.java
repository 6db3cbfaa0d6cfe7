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

import java.util.List;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

/**
 * Outcome of transforming two concurrent branches.
 * {@code left} holds the diffs to apply on top of the left branch,
 * {@code right} the diffs to apply on top of the right branch.
 */
public final class TransformResult<D> {
	public final List<D> left;
	public final List<D> right;

	private TransformResult(List<D> left, List<D> right) {
		this.left = left;
		this.right = right;
	}

	public static <D> TransformResult<D> empty() {
		return new TransformResult<>(emptyList(), emptyList());
	}

	@SuppressWarnings("unchecked")
	public static <D> TransformResult<D> of(List<? extends D> left, List<? extends D> right) {
		return new TransformResult<>((List<D>) left, (List<D>) right);
	}

	public static <D> TransformResult<D> of(D left, D right) {
		return new TransformResult<>(singletonList(left), singletonList(right));
	}

	@SuppressWarnings("unchecked")
	public static <D> TransformResult<D> left(List<? extends D> left) {
		return new TransformResult<>((List<D>) left, emptyList());
	}

	@SuppressWarnings("unchecked")
	public static <D> TransformResult<D> right(List<? extends D> right) {
		return new TransformResult<>(emptyList(), (List<D>) right);
	}

	@Override
	public String toString() {
		return "{" +
				"left=" + left +
				", right=" + right +
				'}';
	}
}
