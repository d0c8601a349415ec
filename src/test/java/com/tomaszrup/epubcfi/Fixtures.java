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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import org.w3c.dom.Node;

import com.tomaszrup.epubcfi.dom.DomDocumentTree;
import com.tomaszrup.epubcfi.dom.DomDocuments;
import com.tomaszrup.epubcfi.grammar.CfiBases;
import com.tomaszrup.epubcfi.model.Segment;

/**
 * Loads the XHTML fixtures under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

	public static final String CHAPTER1 = "chapter1.xhtml";
	public static final String CHAPTER1_HIGHLIGHTS = "chapter1-highlights.xhtml";
	public static final String HIGHLIGHT = "highlight.xhtml";

	public static final String IGNORE_CLASS = "annotator-hl";

	/** {@code /6/4[chap01ref]} */
	public static final Segment BASE = CfiBases.baseFor(2, 1, "chap01ref");

	private Fixtures() {
	}

	public static DomDocumentTree load(String name) {
		try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
			if (in == null) {
				throw new IllegalStateException("Missing fixture " + name);
			}
			return DomDocuments.tree(in);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static Node byId(DomDocumentTree tree, String id) {
		Node node = tree.getElementById(id);
		if (node == null) {
			throw new IllegalStateException("No element with id " + id);
		}
		return node;
	}

	public static Node child(Node node, int index) {
		return node.getChildNodes().item(index);
	}
}
