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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.epubcfi.dom;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import com.tomaszrup.epubcfi.tree.DocumentTree;
import com.tomaszrup.epubcfi.tree.NodeKind;
import com.tomaszrup.epubcfi.tree.PathQuery;

/**
 * {@link DocumentTree} over a W3C DOM {@link Document}. Paths start at the
 * document element; the {@link Document} node itself is never addressed.
 *
 * <p>Text and CDATA nodes count as text. Ids are read from the plain
 * {@code id} attribute, so lookups work without a DTD declaring ID types.</p>
 */
public class DomDocumentTree implements DocumentTree<Node> {

	private final Document document;
	private final XPathQuery pathQuery;

	public DomDocumentTree(Document document) {
		this.document = Objects.requireNonNull(document, "document");
		this.pathQuery = new XPathQuery(document);
	}

	public Document getDocument() {
		return document;
	}

	@Override
	public Node getRoot() {
		return document.getDocumentElement();
	}

	/**
	 * The first {@code body} element in any namespace, falling back to the
	 * document element.
	 */
	public Node getBody() {
		NodeList bodies = document.getElementsByTagNameNS("*", "body");
		if (bodies.getLength() > 0) {
			return bodies.item(0);
		}
		return document.getDocumentElement();
	}

	@Override
	public Node getParent(Node node) {
		Node parent = node.getParentNode();
		if (parent == null || parent.getNodeType() == Node.DOCUMENT_NODE) {
			return null;
		}
		return parent;
	}

	@Override
	public List<Node> getChildren(Node node) {
		NodeList children = node.getChildNodes();
		int length = children.getLength();
		if (length == 0) {
			return Collections.emptyList();
		}
		List<Node> result = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			result.add(children.item(i));
		}
		return result;
	}

	@Override
	public NodeKind getKind(Node node) {
		switch (node.getNodeType()) {
			case Node.ELEMENT_NODE:
				return NodeKind.ELEMENT;
			case Node.TEXT_NODE:
			case Node.CDATA_SECTION_NODE:
				return NodeKind.TEXT;
			default:
				return NodeKind.OTHER;
		}
	}

	@Override
	public String getId(Node node) {
		if (!(node instanceof Element)) {
			return null;
		}
		String id = ((Element) node).getAttribute("id");
		return id.isEmpty() ? null : id;
	}

	@Override
	public boolean hasClass(Node node, String className) {
		if (!(node instanceof Element) || className == null) {
			return false;
		}
		String classes = ((Element) node).getAttribute("class");
		if (classes.isEmpty()) {
			return false;
		}
		for (String token : classes.trim().split("\\s+")) {
			if (token.equals(className)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String getTextContent(Node node) {
		return node.getTextContent();
	}

	@Override
	public Node getElementById(String id) {
		if (id == null || id.isEmpty()) {
			return null;
		}
		Element declared = document.getElementById(id);
		if (declared != null) {
			return declared;
		}
		Element root = document.getDocumentElement();
		if (root == null) {
			return null;
		}
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			Node node = stack.pop();
			if (node.getNodeType() != Node.ELEMENT_NODE) {
				continue;
			}
			if (id.equals(((Element) node).getAttribute("id"))) {
				return node;
			}
			NodeList children = node.getChildNodes();
			for (int i = children.getLength() - 1; i >= 0; i--) {
				stack.push(children.item(i));
			}
		}
		return null;
	}

	@Override
	public Optional<PathQuery<Node>> getPathQuery() {
		return Optional.of(pathQuery);
	}
}
