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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.StepKind;

/**
 * Unit tests for {@link StepCodec}: even/odd step integers and leading
 * number extraction.
 */
class StepCodecTests {

	// ------------------------------------------------------------------
	// encode()
	// ------------------------------------------------------------------

	@Test
	void testEncodeElementSteps() {
		Assertions.assertEquals(2, StepCodec.encode(StepKind.ELEMENT, 0));
		Assertions.assertEquals(4, StepCodec.encode(StepKind.ELEMENT, 1));
		Assertions.assertEquals(10, StepCodec.encode(StepKind.ELEMENT, 4));
	}

	@Test
	void testEncodeTextSteps() {
		Assertions.assertEquals(1, StepCodec.encode(StepKind.TEXT, 0));
		Assertions.assertEquals(3, StepCodec.encode(StepKind.TEXT, 1));
		Assertions.assertEquals(13, StepCodec.encode(StepKind.TEXT, 6));
	}

	@Test
	void testEncodeNegativeIndexThrows() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> StepCodec.encode(StepKind.ELEMENT, -1));
	}

	// ------------------------------------------------------------------
	// decode()
	// ------------------------------------------------------------------

	@Test
	void testDecodeEvenIsElement() {
		Step step = StepCodec.decode(10, "para05");
		Assertions.assertEquals(StepKind.ELEMENT, step.getKind());
		Assertions.assertEquals(4, step.getSiblingIndex());
		Assertions.assertEquals("para05", step.getId());
	}

	@Test
	void testDecodeOddIsText() {
		Step step = StepCodec.decode(3);
		Assertions.assertTrue(step.isText());
		Assertions.assertEquals(1, step.getSiblingIndex());
		Assertions.assertNull(step.getId());
	}

	@Test
	void testDecodeZeroThrows() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> StepCodec.decode(0));
	}

	@Test
	void testDecodeInvertsEncode() {
		for (StepKind kind : StepKind.values()) {
			for (int i = 0; i < 500; i++) {
				Step decoded = StepCodec.decode(StepCodec.encode(kind, i));
				Assertions.assertEquals(kind, decoded.getKind());
				Assertions.assertEquals(i, decoded.getSiblingIndex());
			}
		}
	}

	@Test
	void testEncodedParityMatchesKind() {
		for (int i = 0; i < 100; i++) {
			Assertions.assertEquals(0, StepCodec.encode(StepKind.ELEMENT, i) % 2);
			Assertions.assertEquals(1, StepCodec.encode(StepKind.TEXT, i) % 2);
		}
	}

	// ------------------------------------------------------------------
	// leadingNumber()
	// ------------------------------------------------------------------

	@Test
	void testLeadingNumberStopsAtBracket() {
		Assertions.assertEquals(10, StepCodec.leadingNumber("10[para05]"));
	}

	@Test
	void testLeadingNumberWithoutDigits() {
		Assertions.assertEquals(-1, StepCodec.leadingNumber("abc"));
		Assertions.assertEquals(-1, StepCodec.leadingNumber(""));
		Assertions.assertEquals(-1, StepCodec.leadingNumber(null));
	}

	@Test
	void testLeadingNumberOverflow() {
		Assertions.assertEquals(-1, StepCodec.leadingNumber("99999999999"));
	}
}
