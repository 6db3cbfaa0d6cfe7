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

import java.util.Random;

import static java.lang.Math.min;

final class RandomTextOperations {
	private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz ABC\n";

	private RandomTextOperations() {
	}

	static String randomString(Random random, int length) {
		StringBuilder sb = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
		}
		return sb.toString();
	}

	static String randomDocument(Random random) {
		return randomString(random, random.nextInt(50));
	}

	static TextOperation randomOperation(Random random, String document) {
		TextOperation.Builder builder = TextOperation.builder();
		int left = document.length();
		while (left > 0) {
			int n = 1 + random.nextInt(min(left, 20));
			switch (random.nextInt(3)) {
				case 0:
					builder.insert(randomString(random, 1 + random.nextInt(10)));
					break;
				case 1:
					builder.retain(n);
					left -= n;
					break;
				default:
					builder.delete(n);
					left -= n;
					break;
			}
		}
		if (random.nextInt(3) == 0) {
			builder.insert(randomString(random, 1 + random.nextInt(10)));
		}
		return builder.build();
	}
}
