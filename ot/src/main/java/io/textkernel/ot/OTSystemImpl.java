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

import java.util.*;

/**
 * {@link OTSystem} assembled from per-type functions.
 * Lists of diffs are transformed pairwise, one head at a time.
 */
public final class OTSystemImpl<OP> implements OTSystem<OP> {
	public interface TransformFunction<OP, L extends OP, R extends OP> {
		TransformResult<? extends OP> transform(L left, R right) throws OTException;
	}

	public interface SquashFunction<OP, OP1 extends OP, OP2 extends OP> {
		@Nullable
		OP trySquash(OP1 op1, OP2 op2);
	}

	public interface EmptyPredicate<OP> {
		boolean isEmpty(OP op);
	}

	private static final class KeyPair {
		final Class<?> left;
		final Class<?> right;

		KeyPair(Class<?> left, Class<?> right) {
			this.left = left;
			this.right = right;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			KeyPair key = (KeyPair) o;
			return left.equals(key.left) && right.equals(key.right);
		}

		@Override
		public int hashCode() {
			return 31 * left.hashCode() + right.hashCode();
		}

		@Override
		public String toString() {
			return "[" + left.getSimpleName() + ", " + right.getSimpleName() + ']';
		}
	}

	private final Map<KeyPair, TransformFunction<OP, ?, ?>> transformers = new HashMap<>();
	private final Map<KeyPair, SquashFunction<OP, ?, ?>> squashers = new HashMap<>();
	private final Map<Class<?>, EmptyPredicate<OP>> emptyPredicates = new HashMap<>();

	private OTSystemImpl() {
	}

	@NotNull
	public static <O> OTSystemImpl<O> create() {
		return new OTSystemImpl<>();
	}

	public <L extends OP, R extends OP> OTSystemImpl<OP> withTransformFunction(Class<? super L> leftType, Class<? super R> rightType,
			TransformFunction<OP, L, R> transformer) {
		transformers.put(new KeyPair(leftType, rightType), transformer);
		if (leftType != rightType) {
			TransformFunction<OP, R, L> mirrored = (left, right) -> {
				TransformResult<? extends OP> transformed = transformer.transform(right, left);
				return TransformResult.of(transformed.right, transformed.left);
			};
			transformers.put(new KeyPair(rightType, leftType), mirrored);
		}
		return this;
	}

	public <O1 extends OP, O2 extends OP> OTSystemImpl<OP> withSquashFunction(Class<? super O1> opType1, Class<? super O2> opType2,
			SquashFunction<OP, O1, O2> squashFunction) {
		squashers.put(new KeyPair(opType1, opType2), squashFunction);
		return this;
	}

	@SuppressWarnings("unchecked")
	public <O extends OP> OTSystemImpl<OP> withEmptyPredicate(Class<? super O> opType, EmptyPredicate<O> emptyPredicate) {
		emptyPredicates.put(opType, (EmptyPredicate<OP>) emptyPredicate);
		return this;
	}

	@Override
	public boolean isEmpty(OP op) {
		EmptyPredicate<OP> emptyPredicate = emptyPredicates.get(op.getClass());
		return emptyPredicate != null && emptyPredicate.isEmpty(op);
	}

	@SuppressWarnings("unchecked")
	@Override
	public TransformResult<OP> transform(List<? extends OP> leftDiffs, List<? extends OP> rightDiffs) throws OTException {
		if (leftDiffs.isEmpty() && rightDiffs.isEmpty()) {
			return TransformResult.empty();
		}
		if (leftDiffs.isEmpty()) {
			return TransformResult.left(rightDiffs);
		}
		if (rightDiffs.isEmpty()) {
			return TransformResult.right(leftDiffs);
		}

		if (leftDiffs.size() == 1) {
			OP left = leftDiffs.get(0);
			OP right = rightDiffs.get(0);
			KeyPair key = new KeyPair(left.getClass(), right.getClass());
			TransformFunction<OP, OP, OP> transformer = (TransformFunction<OP, OP, OP>) transformers.get(key);
			if (transformer == null) {
				throw new OTException("No transform function for " + key);
			}
			TransformResult<OP> transformed1 = (TransformResult<OP>) transformer.transform(left, right);
			TransformResult<OP> transformed2 = transform(transformed1.right, rightDiffs.subList(1, rightDiffs.size()));
			List<OP> transformedLeft = new ArrayList<>(transformed1.left.size() + transformed2.left.size());
			transformedLeft.addAll(transformed1.left);
			transformedLeft.addAll(transformed2.left);
			return TransformResult.of(transformedLeft, transformed2.right);
		}

		TransformResult<OP> transform1 = transform(leftDiffs.subList(0, 1), rightDiffs);
		TransformResult<OP> transform2 = transform(leftDiffs.subList(1, leftDiffs.size()), transform1.left);
		List<OP> transformedRight = new ArrayList<>(transform1.right.size() + transform2.right.size());
		transformedRight.addAll(transform1.right);
		transformedRight.addAll(transform2.right);
		return TransformResult.of(transform2.left, transformedRight);
	}

	@SuppressWarnings("unchecked")
	@Override
	public List<OP> squash(List<? extends OP> ops) {
		if (ops.isEmpty()) {
			return Collections.emptyList();
		}
		List<OP> result = new ArrayList<>();
		Iterator<? extends OP> it = ops.iterator();
		OP cur = it.next();
		while (it.hasNext()) {
			OP next = it.next();
			SquashFunction<OP, OP, OP> squashFunction = (SquashFunction<OP, OP, OP>) squashers.get(new KeyPair(cur.getClass(), next.getClass()));
			OP squashed = squashFunction == null ? null : squashFunction.trySquash(cur, next);
			if (squashed != null) {
				cur = squashed;
			} else {
				if (!isEmpty(cur)) {
					result.add(cur);
				}
				cur = next;
			}
		}
		if (!isEmpty(cur)) {
			result.add(cur);
		}
		return result;
	}
}
