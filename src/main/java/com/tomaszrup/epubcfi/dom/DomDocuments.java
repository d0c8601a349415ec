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

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Parses XHTML content documents into W3C DOM trees suitable for CFI work.
 *
 * <p>External entities and DTDs are never fetched. CDATA sections are
 * coalesced into text so that text-node counting matches what an XPath
 * engine sees.</p>
 */
public final class DomDocuments {
	private static final Logger logger = LoggerFactory.getLogger(DomDocuments.class);

	private DomDocuments() {
		// utility class
	}

	public static Document parse(String xml) {
		return parse(new InputSource(new StringReader(xml)));
	}

	public static Document parse(InputStream in) {
		return parse(new InputSource(in));
	}

	/** Parses and wraps the result in a {@link DomDocumentTree}. */
	public static DomDocumentTree tree(String xml) {
		return new DomDocumentTree(parse(xml));
	}

	public static DomDocumentTree tree(InputStream in) {
		return new DomDocumentTree(parse(in));
	}

	private static Document parse(InputSource source) {
		try {
			DocumentBuilder db = newFactory().newDocumentBuilder();
			return db.parse(source);
		} catch (ParserConfigurationException | SAXException | IOException e) {
			logger.debug("Could not parse document: {}", e.getMessage());
			throw new IllegalArgumentException("Could not parse document: " + e.getMessage(), e);
		}
	}

	private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
		DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
		dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
		dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
		dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		dbf.setExpandEntityReferences(false);
		dbf.setXIncludeAware(false);
		dbf.setNamespaceAware(true);
		dbf.setCoalescing(true);
		return dbf;
	}
}
