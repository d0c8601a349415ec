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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import com.tomaszrup.epubcfi.Fixtures;
import com.tomaszrup.epubcfi.tree.NodeKind;

/**
 * Tests for {@link DomDocumentTree} and {@link DomDocuments}.
 */
class DomDocumentTreeTests {

	// ------------------------------------------------------------------
	// Navigation
	// ------------------------------------------------------------------

	@Test
	void testRootIsDocumentElement() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1);
		Node root = tree.getRoot();
		Assertions.assertEquals("html", root.getLocalName());
		Assertions.assertNull(tree.getParent(root));
	}

	@Test
	void testBody() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1);
		Assertions.assertEquals("body", tree.getBody().getLocalName());
	}

	@Test
	void testBodyFallsBackToRoot() {
		DomDocumentTree tree = DomDocuments.tree("<doc><a/></doc>");
		Assertions.assertEquals(tree.getRoot(), tree.getBody());
	}

	@Test
	void testKinds() {
		DomDocumentTree tree = DomDocuments.tree("<p>text<!--note--><![CDATA[raw]]><?pi x?><b/></p>");
		List<Node> children = tree.getChildren(tree.getRoot());
		Assertions.assertEquals(NodeKind.TEXT, tree.getKind(children.get(0)));
		Assertions.assertEquals(NodeKind.OTHER, tree.getKind(children.get(1)));
		Assertions.assertEquals(NodeKind.ELEMENT, tree.getKind(children.get(children.size() - 1)));
	}

	@Test
	void testCdataCoalescedIntoText() {
		DomDocumentTree tree = DomDocuments.tree("<p>a<![CDATA[<b>]]>c</p>");
		List<Node> children = tree.getChildren(tree.getRoot());
		Assertions.assertEquals(1, children.size());
		Assertions.assertEquals("a<b>c", tree.getTextContent(children.get(0)));
	}

	// ------------------------------------------------------------------
	// Attributes
	// ------------------------------------------------------------------

	@Test
	void testIdAndClasses() {
		DomDocumentTree tree = DomDocuments.tree("<p><span id=\"s1\" class=\" x  annotator-hl\">a</span><i id=\"\">b</i></p>");
		List<Node> children = tree.getChildren(tree.getRoot());
		Node span = children.get(0);
		Assertions.assertEquals("s1", tree.getId(span));
		Assertions.assertTrue(tree.hasClass(span, "annotator-hl"));
		Assertions.assertTrue(tree.hasClass(span, "x"));
		Assertions.assertFalse(tree.hasClass(span, "annotator"));
		Assertions.assertNull(tree.getId(children.get(1)));
		Assertions.assertNull(tree.getId(span.getFirstChild()));
	}

	@Test
	void testElementByIdWithoutDtd() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1_HIGHLIGHTS);
		Node highlight = tree.getElementById("highlight-1");
		Assertions.assertNotNull(highlight);
		Assertions.assertEquals("annotator-hl", ((Element) highlight).getAttribute("class"));
		Assertions.assertNull(tree.getElementById("missing"));
		Assertions.assertNull(tree.getElementById(""));
	}

	@Test
	void testElementByIdFirstInDocumentOrder() {
		DomDocumentTree tree = DomDocuments.tree("<r><a><b id=\"dup\">1</b></a><c id=\"dup\">2</c></r>");
		Assertions.assertEquals("b", tree.getElementById("dup").getLocalName());
	}

	@Test
	void testTextLength() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1_HIGHLIGHTS);
		Assertions.assertEquals(16, tree.getTextLength(tree.getElementById("highlight-2")));
	}

	@Test
	void testPathQueryOffered() {
		DomDocumentTree tree = Fixtures.load(Fixtures.CHAPTER1);
		Assertions.assertTrue(tree.getPathQuery().isPresent());
	}

	// ------------------------------------------------------------------
	// Parsing
	// ------------------------------------------------------------------

	@Test
	void testMalformedXmlRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> DomDocuments.parse("<html><body></html>"));
	}

	@Test
	void testExternalEntitiesNotResolved() {
		String xml = "<?xml version=\"1.0\"?>"
				+ "<!DOCTYPE r [<!ENTITY ext SYSTEM \"file:///etc/hostname\">]>"
				+ "<r>&ext;</r>";
		try {
			DomDocumentTree tree = DomDocuments.tree(xml);
			Assertions.assertEquals("", tree.getTextContent(tree.getRoot()).trim());
		} catch (IllegalArgumentException e) {
			// rejecting the document outright is fine too
			Assertions.assertNotNull(e.getCause());
		}
	}
}
