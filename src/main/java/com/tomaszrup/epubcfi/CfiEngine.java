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
package com.tomaszrup.epubcfi;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.epubcfi.grammar.CfiBases;
import com.tomaszrup.epubcfi.grammar.CfiParser;
import com.tomaszrup.epubcfi.grammar.CfiSerializer;
import com.tomaszrup.epubcfi.locations.LocationGenerator;
import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.model.Segment;
import com.tomaszrup.epubcfi.tree.Boundary;
import com.tomaszrup.epubcfi.tree.BoundaryPair;
import com.tomaszrup.epubcfi.tree.DocumentTree;
import com.tomaszrup.epubcfi.tree.PathBuilder;
import com.tomaszrup.epubcfi.tree.Resolver;
import com.tomaszrup.epubcfi.util.MdcCfiContext;
import com.tomaszrup.epubcfi.utils.CfiPositions;

/**
 * Entry point bundling the CFI operations behind one set of options.
 *
 * <p>Tree-bound calls take the host tree as an argument, so one engine
 * serves any number of documents. Wherever an {@code ignoreClass} argument
 * is {@code null}, the configured {@link CfiOptions#getIgnoreClass()} is
 * used instead.</p>
 */
public class CfiEngine {

    private static final Logger logger = LoggerFactory.getLogger(CfiEngine.class);

    private final CfiOptions options;

    public CfiEngine() {
        this(CfiOptions.defaults());
    }

    public CfiEngine(CfiOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public CfiOptions getOptions() {
        return options;
    }

    // ------ text form ------

    public Cfi parse(String text) {
        return CfiParser.parse(text);
    }

    public String serialize(Cfi cfi) {
        return CfiSerializer.serialize(cfi);
    }

    public boolean isCfiString(String text) {
        return CfiParser.isCfiString(text);
    }

    public Segment baseFor(int spineNodeIndex, int position, String idref) {
        return CfiBases.baseFor(spineNodeIndex, position, idref);
    }

    // ------ value operations ------

    public int compare(Cfi a, Cfi b) {
        return CfiPositions.COMPARATOR.compare(a, b);
    }

    public int compare(String a, String b) {
        return CfiPositions.compare(a, b);
    }

    public Cfi collapse(Cfi cfi, boolean toStart) {
        return cfi.collapse(toStart);
    }

    public int containerOrdinal(Cfi cfi) {
        return cfi.getContainerOrdinal();
    }

    public int containerOrdinal(String text) {
        return CfiParser.parse(text).getContainerOrdinal();
    }

    public boolean isValid(Cfi cfi) {
        return CfiPositions.valid(cfi);
    }

    // ------ tree operations ------

    public <N> Segment pathTo(DocumentTree<N> tree, N node, Integer offset, String ignoreClass) {
        return new PathBuilder<>(tree).pathTo(node, offset, ignoreClassOrDefault(ignoreClass));
    }

    public <N> Cfi fromNode(DocumentTree<N> tree, N node, Segment base, String ignoreClass) {
        return new PathBuilder<>(tree).fromNode(node, base, ignoreClassOrDefault(ignoreClass));
    }

    public <N> Cfi rangeFrom(DocumentTree<N> tree, N startNode, int startOffset, N endNode, int endOffset,
            Segment base, String ignoreClass) {
        return new PathBuilder<>(tree).rangeFrom(startNode, startOffset, endNode, endOffset,
                base, ignoreClassOrDefault(ignoreClass));
    }

    public <N> Cfi rangeFrom(DocumentTree<N> tree, BoundaryPair<N> boundaries, Segment base, String ignoreClass) {
        return new PathBuilder<>(tree).rangeFrom(boundaries, base, ignoreClassOrDefault(ignoreClass));
    }

    /**
     * Resolves the start of a CFI (the CFI itself when positional).
     *
     * @return the boundary, or {@code null} when it cannot be found
     */
    public <N> Boundary<N> resolve(DocumentTree<N> tree, Cfi cfi, String ignoreClass) {
        if (!cfi.isValid()) {
            logger.warn("Cannot resolve an invalid CFI");
            return null;
        }
        Resolver<N> resolver = new Resolver<>(tree, options.isUseXPath());
        String effective = ignoreClassOrDefault(ignoreClass);
        return MdcCfiContext.wrap(cfi, () -> resolver.resolve(cfi.startSegment(), effective));
    }

    /**
     * @return the boundary pair, or {@code null} when the start cannot be found
     */
    public <N> BoundaryPair<N> resolveRange(DocumentTree<N> tree, Cfi cfi, String ignoreClass) {
        Resolver<N> resolver = new Resolver<>(tree, options.isUseXPath());
        String effective = ignoreClassOrDefault(ignoreClass);
        return MdcCfiContext.wrap(cfi, () -> resolver.resolveRange(cfi, effective));
    }

    public <N> BoundaryPair<N> resolveRange(DocumentTree<N> tree, String cfi, String ignoreClass) {
        return resolveRange(tree, CfiParser.parse(cfi), ignoreClass);
    }

    /**
     * Splits the text under {@code container} into location CFIs.
     */
    public <N> List<String> generateLocations(DocumentTree<N> tree, N container, Segment base, int chars) {
        return new LocationGenerator<>(tree, options.getIgnoreClass()).generate(container, base, chars);
    }

    /**
     * Word-count locations under {@code container}, optionally starting at
     * the node {@code start} points at.
     */
    public <N> List<LocationGenerator.WordLocation> generateWordLocations(DocumentTree<N> tree, N container,
            Segment base, int wordCount, Cfi start, int maxCount) {
        return new LocationGenerator<>(tree, options.getIgnoreClass())
                .generateFromWords(container, base, wordCount, start, maxCount);
    }

    private String ignoreClassOrDefault(String ignoreClass) {
        return ignoreClass != null ? ignoreClass : options.getIgnoreClass();
    }
}
