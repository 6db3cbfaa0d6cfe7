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

import org.junit.Test;

import static io.textkernel.ot.TextOp.*;
import static org.junit.Assert.*;

public final class TextOpTest {

	@Test
	public void testLengths() {
		assertEquals(5, retain(5).length());
		assertEquals(0, retain(5).lengthDelta());

		assertEquals(3, insert("abc").length());
		assertEquals(3, insert("abc").lengthDelta());

		assertEquals(4, delete(4).length());
		assertEquals(-4, delete(4).lengthDelta());
	}

	@Test
	public void testShorten() {
		assertEquals(retain(3), retain(5).shorten(2));
		assertEquals(insert("llo"), insert("hello").shorten(2));
		assertEquals(delete(1), delete(4).shorten(3));
		assertEquals(0, retain(2).shorten(2).length());
	}

	@Test
	public void testMerge() {
		assertEquals(retain(7), retain(5).merge(retain(2)));
		assertEquals(insert("hello world"), insert("hello").merge(insert(" world")));
		assertEquals(delete(3), delete(1).merge(delete(2)));
	}

	@Test
	public void testPrefix() {
		assertEquals(insert("he"), insert("hello").prefix(2));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMergeDifferentTypes() {
		retain(1).merge(delete(1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMergeOverflow() {
		retain(Integer.MAX_VALUE).merge(retain(1));
	}

	@Test
	public void testMergeUpToMaxLength() {
		assertEquals(delete(Integer.MAX_VALUE), delete(Integer.MAX_VALUE - 1).merge(delete(1)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeRetain() {
		retain(-1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeDelete() {
		delete(-3);
	}

	@Test(expected = NullPointerException.class)
	public void testNullInsert() {
		insert(null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testShortenTooMuch() {
		delete(2).shorten(3);
	}

	@Test(expected = IllegalStateException.class)
	public void testTextOfRetain() {
		retain(2).getText();
	}

	@Test
	public void testEqualsAndToString() {
		assertEquals(insert("a"), insert("a"));
		assertNotEquals(retain(1), delete(1));
		assertNotEquals(insert("a"), insert("b"));
		assertEquals(retain(2).hashCode(), retain(2).hashCode());

		assertEquals("retain(5)", retain(5).toString());
		assertEquals("insert(\"ab\")", insert("ab").toString());
		assertEquals("delete(3)", delete(3).toString());
	}
}
