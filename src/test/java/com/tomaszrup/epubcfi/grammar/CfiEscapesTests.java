////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.epubcfi.grammar;

import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CfiEscapesTests {

	@Test
	void testEscapeSpecialCharacters() {
		Assertions.assertEquals("a^[b^]c^,d", CfiEscapes.escape("a[b]c,d"));
		Assertions.assertEquals("x^^y", CfiEscapes.escape("x^y"));
		Assertions.assertEquals("plain", CfiEscapes.escape("plain"));
	}

	@Test
	void testEscapeTextAssertionKeepsSeparators() {
		Assertions.assertEquals("prev,next;s=b", CfiEscapes.escapeTextAssertion("prev,next;s=b"));
		Assertions.assertEquals("a^(b^)^^", CfiEscapes.escapeTextAssertion("a(b)^"));
	}

	@Test
	void testUnescapeReversesEscape() {
		String raw = "odd(id);with=all^[kinds]";
		Assertions.assertEquals(raw, CfiEscapes.unescape(CfiEscapes.escape(raw)));
	}

	@Test
	void testSplitIgnoresSeparatorsInsideBrackets() {
		Assertions.assertEquals(Arrays.asList("/4[a,b]", "/1:2", "/3"),
				CfiEscapes.split("/4[a,b],/1:2,/3", ','));
	}

	@Test
	void testSplitIgnoresEscapedSeparators() {
		Assertions.assertEquals(Arrays.asList("a^!b", "c"), CfiEscapes.split("a^!b!c", '!'));
	}

	@Test
	void testSplitWithoutSeparator() {
		Assertions.assertEquals(Arrays.asList("/6/4"), CfiEscapes.split("/6/4", '!'));
	}

	@Test
	void testIndexOfTopLevelOnly() {
		Assertions.assertEquals(9, CfiEscapes.indexOf("/4[x:y]/1:3", ':'));
		Assertions.assertEquals(-1, CfiEscapes.indexOf("/4[x:y]/1", ':'));
	}

	@Test
	void testBracketContent() {
		Assertions.assertEquals("para05", CfiEscapes.bracketContent("10[para05]"));
		Assertions.assertEquals("a]b", CfiEscapes.bracketContent("4[a^]b]"));
		Assertions.assertNull(CfiEscapes.bracketContent("4"));
		Assertions.assertNull(CfiEscapes.bracketContent("4[unclosed"));
	}
}
