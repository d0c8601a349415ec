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
package com.tomaszrup.epubcfi.dom;

import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Node;

import com.tomaszrup.epubcfi.Fixtures;
import com.tomaszrup.epubcfi.model.Step;

class XPathQueryTests {

	@Test
	void testToXPathPlainSteps() {
		Assertions.assertEquals("/*/*[2]/*[1]/text()[1]",
				XPathQuery.toXPath(Arrays.asList(Step.element(1), Step.element(0), Step.text(0))));
	}

	@Test
	void testToXPathIdRestartsExpression() {
		Assertions.assertEquals("(//*[@id='c001p0004'])[1]/text()[2]",
				XPathQuery.toXPath(Arrays.asList(Step.element(1), Step.element(4, "c001p0004"), Step.text(1))));
	}

	@Test
	void testToXPathEmptyIsRoot() {
		Assertions.assertEquals("/*", XPathQuery.toXPath(Arrays.<Step>asList()));
	}

	@Test
	void testToXPathRejectsQuoteInId() {
		Assertions.assertNull(XPathQuery.toXPath(Arrays.asList(Step.element(0, "it's"))));
	}

	@Test
	void testSelectFindsTextNode() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1);
		XPathQuery query = new XPathQuery(tree.getDocument());
		Node text = query.select(Arrays.asList(Step.element(1), Step.element(0),
				Step.element(4), Step.element(0, "c001p0004"), Step.text(0)));
		Assertions.assertEquals(Fixtures.child(Fixtures.byId(tree, "c001p0004"), 0), text);
	}

	@Test
	void testSelectMissingIsNull() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1);
		XPathQuery query = new XPathQuery(tree.getDocument());
		Assertions.assertNull(query.select(Arrays.asList(Step.element(1), Step.element(99))));
	}

	@Test
	void testOneQueryServesManySelects() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1);
		XPathQuery query = new XPathQuery(tree.getDocument());
		for (String id : new String[] { "c001s0001", "c001p0004", "c001p0007", "c001p0017" }) {
			Node text = query.select(Arrays.asList(Step.element(0, id), Step.text(0)));
			Assertions.assertEquals(Fixtures.child(Fixtures.byId(tree, id), 0), text, id);
		}
	}
}
