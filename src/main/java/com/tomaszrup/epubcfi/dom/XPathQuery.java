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

import java.util.List;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Node;

import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.StepKind;
import com.tomaszrup.epubcfi.tree.PathQuery;

/**
 * Resolves unfiltered steps with a single XPath expression.
 *
 * <p>The expression starts at the document element ({@code /*}); an element
 * step becomes {@code *[n]}, a text step {@code text()[n]}. An element step
 * with an id restarts from the first element carrying that id,
 * {@code (//*[@id='x'])[1]}, the same jump the manual walk takes.</p>
 *
 * <p>XPath sees adjacent text nodes as a single node, so after a split a
 * text step can select a later node than the walk would.
 * {@link com.tomaszrup.epubcfi.tree.Resolver} checks text results and walks
 * when they disagree.</p>
 */
class XPathQuery implements PathQuery<Node> {

	private final Document document;
	private final XPathFactory factory = XPathFactory.newInstance();

	XPathQuery(Document document) {
		this.document = document;
	}

	@Override
	public Node select(List<Step> steps) {
		String expression = toXPath(steps);
		if (expression == null) {
			return null;
		}
		// neither the factory nor XPath objects are thread-safe
		XPath xpath;
		synchronized (factory) {
			xpath = factory.newXPath();
		}
		try {
			return (Node) xpath.evaluate(expression, document, XPathConstants.NODE);
		} catch (XPathExpressionException e) {
			throw new IllegalStateException("Cannot evaluate " + expression, e);
		}
	}

	/**
	 * @return the expression, or {@code null} when an id cannot be written as
	 *         an XPath string literal
	 */
	static String toXPath(List<Step> steps) {
		StringBuilder sb = new StringBuilder("/*");
		for (Step step : steps) {
			int position = step.getSiblingIndex() + 1;
			if (step.getKind() == StepKind.ELEMENT && step.hasId()) {
				if (step.getId().indexOf('\'') >= 0) {
					return null;
				}
				sb.setLength(0);
				sb.append("(//*[@id='").append(step.getId()).append("'])[1]");
			} else if (step.getKind() == StepKind.TEXT) {
				sb.append("/text()[").append(position).append(']');
			} else {
				sb.append("/*[").append(position).append(']');
			}
		}
		return sb.toString();
	}
}
