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
package com.tomaszrup.epubcfi;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.w3c.dom.Node;
import org.w3c.dom.Text;

import com.tomaszrup.epubcfi.dom.DomDocumentTree;
import com.tomaszrup.epubcfi.dom.DomDocuments;
import com.tomaszrup.epubcfi.grammar.CfiSerializer;
import com.tomaszrup.epubcfi.locations.LocationGenerator;
import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.tree.Boundary;
import com.tomaszrup.epubcfi.tree.BoundaryPair;
import com.tomaszrup.epubcfi.util.MdcCfiContext;

/**
 * Tests for {@link CfiEngine}: option defaults flowing into the tree
 * operations, and the logging context around resolution.
 */
class CfiEngineTests {

	private DomDocumentTree highlights;
	private CfiEngine engine;
	private CfiEngine ignoringEngine;

	@BeforeEach
	void setup() {
		highlights = Fixtures.load(Fixtures.CHAPTER1_HIGHLIGHTS);
		engine = new CfiEngine();
		ignoringEngine = new CfiEngine(CfiOptions.defaults().withIgnoreClass(Fixtures.IGNORE_CLASS));
	}

	@AfterEach
	void tearDown() {
		MDC.clear();
	}

	// ------------------------------------------------------------------
	// Text form
	// ------------------------------------------------------------------

	@Test
	void testParseAndSerialize() {
		Cfi cfi = engine.parse("epubcfi(/6/4[chap01ref]!/4[body01]/10[para05]/3:10)");
		Assertions.assertTrue(engine.isValid(cfi));
		Assertions.assertEquals("epubcfi(/6/4[chap01ref]!/4[body01]/10[para05]/3:10)", engine.serialize(cfi));
		Assertions.assertEquals(1, engine.containerOrdinal(cfi));
	}

	@Test
	void testInvalidTextGivesSentinel() {
		Cfi cfi = engine.parse("not a cfi");
		Assertions.assertFalse(engine.isValid(cfi));
		Assertions.assertEquals(-1, engine.containerOrdinal("not a cfi"));
		Assertions.assertFalse(engine.isCfiString("not a cfi"));
		Assertions.assertTrue(engine.isCfiString("epubcfi(/6/4!/4)"));
	}

	@Test
	void testBaseFor() {
		Assertions.assertEquals("/6/4[chap01ref]", CfiSerializer.segmentString(engine.baseFor(2, 1, "chap01ref")));
	}

	@Test
	void testCompareStrings() {
		Assertions.assertEquals(-1, engine.compare("epubcfi(/6/2!/4/2/1:0)", "epubcfi(/6/4!/4/2/1:0)"));
		Assertions.assertEquals(1, engine.compare("epubcfi(/6/4!/4/2/1:5)", "epubcfi(/6/4!/4/2/1:0)"));
		Assertions.assertEquals(0, engine.compare("epubcfi(/6/4!/4/2/1:5)", "epubcfi(/6/4!/4/2/1:5)"));
	}

	@Test
	void testCollapse() {
		Cfi range = engine.parse("epubcfi(/6/4!/4/2,/2/1:3,/4/1:7)");
		Assertions.assertEquals("epubcfi(/6/4!/4/2/2/1:3)", engine.collapse(range, true).toString());
		Assertions.assertEquals("epubcfi(/6/4!/4/2/4/1:7)", engine.collapse(range, false).toString());
	}

	// ------------------------------------------------------------------
	// Tree operations
	// ------------------------------------------------------------------

	@Test
	void testConfiguredIgnoreClassApplies() {
		Node text = Fixtures.child(Fixtures.byId(highlights, "highlight-1"), 0);
		Cfi plain = engine.fromNode(highlights, text, Fixtures.BASE, null);
		Cfi ignoring = ignoringEngine.fromNode(highlights, text, Fixtures.BASE, null);
		Assertions.assertNotEquals(plain.toString(), ignoring.toString());
		Assertions.assertEquals(ignoring.toString(),
				engine.fromNode(highlights, text, Fixtures.BASE, Fixtures.IGNORE_CLASS).toString());
	}

	@Test
	void testRangeFromSkipsHighlights() {
		Node text = Fixtures.child(Fixtures.byId(highlights, "highlight-1"), 0);
		Cfi cfi = ignoringEngine.rangeFrom(highlights, text, 6, text, 6, Fixtures.BASE, null);
		Assertions.assertEquals("epubcfi(/6/4[chap01ref]!/4/2/32/2[c001p0017]/1:43)", cfi.toString());
	}

	@Test
	void testResolveRoundTrip() {
		Node text = Fixtures.child(Fixtures.byId(highlights, "c001p0004"), 0);
		Cfi cfi = ignoringEngine.rangeFrom(highlights, text, 4, text, 12, Fixtures.BASE, null);
		BoundaryPair<Node> pair = ignoringEngine.resolveRange(highlights, cfi.toString(), null);
		Assertions.assertEquals(new Boundary<>(text, 4), pair.getStart());
		Assertions.assertEquals(new Boundary<>(text, 12), pair.getEnd());
	}

	@Test
	void testResolveSplitTextWithDefaultOptions() {
		DomDocumentTree tree = DomDocuments.tree("<html><head/><body><p>abcd<b>x</b>efgh</p></body></html>");
		Text first = (Text) tree.getBody().getFirstChild().getFirstChild();
		Text second = first.splitText(2);

		Cfi cfi = engine.rangeFrom(tree, second, 1, second, 1, Fixtures.BASE, null);
		Assertions.assertEquals(new Boundary<Node>(second, 1), engine.resolve(tree, engine.parse(cfi.toString()), null));
	}

	@Test
	void testResolveWithoutXPath() {
		CfiEngine walking = new CfiEngine(ignoringEngine.getOptions().withUseXPath(false));
		Node text = Fixtures.child(Fixtures.byId(highlights, "highlight-1"), 0);
		Boundary<Node> boundary = walking.resolve(highlights,
				walking.parse("epubcfi(/6/4[chap01ref]!/4/2/32/2[c001p0017]/1:43)"), null);
		Assertions.assertEquals(new Boundary<>(text, 6), boundary);
	}

	@Test
	void testResolveInvalidIsNull() {
		Assertions.assertNull(engine.resolve(highlights, Cfi.invalid(), null));
		Assertions.assertNull(engine.resolveRange(highlights, "garbage", null));
	}

	@Test
	void testResolveRestoresLoggingContext() {
		MdcCfiContext.setCfi("outer");
		engine.resolve(highlights, engine.parse("epubcfi(/6/4!/4/2/10/2[c001p0004]/1:3)"), null);
		Assertions.assertEquals("outer", MDC.get(MdcCfiContext.MDC_KEY));
	}

	@Test
	void testGenerateLocations() {
		List<String> locations = engine.generateLocations(highlights, highlights.getBody(), Fixtures.BASE, 10_000);
		Assertions.assertEquals(1, locations.size());
		Assertions.assertTrue(engine.isValid(engine.parse(locations.get(0))));
	}

	@Test
	void testGenerateWordLocations() {
		DomDocumentTree clean = Fixtures.load(Fixtures.CHAPTER1);
		List<LocationGenerator.WordLocation> locations = engine.generateWordLocations(clean, clean.getBody(),
				Fixtures.BASE, 50, null, 2);
		Assertions.assertEquals(2, locations.size());
		Assertions.assertEquals("epubcfi(/6/4[chap01ref]!/4/2/8/1)", locations.get(0).getCfi());
	}
}
