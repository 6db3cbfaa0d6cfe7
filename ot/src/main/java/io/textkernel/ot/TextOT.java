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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TextOT {
	private static final Logger logger = LoggerFactory.getLogger(TextOT.class);

	private TextOT() {
	}

	public static OTSystem<TextOperation> createTextOT() {
		return OTSystemImpl.<TextOperation>create()
				.withTransformFunction(TextOperation.class, TextOperation.class, (left, right) -> {
					TextOperation.Transformed transformed = TextOperation.transform(left, right);
					return TransformResult.of(transformed.right, transformed.left);
				})
				.withSquashFunction(TextOperation.class, TextOperation.class, (first, second) -> {
					try {
						return first.compose(second);
					} catch (IncompatibleOperationException e) {
						logger.warn("Operations {} and {} are not sequential, keeping both", first, second, e);
						return null;
					}
				})
				.withEmptyPredicate(TextOperation.class, TextOperation::isNoop);
	}
}
