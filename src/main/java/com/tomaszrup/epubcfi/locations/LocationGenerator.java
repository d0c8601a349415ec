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
package com.tomaszrup.epubcfi.locations;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.model.Segment;
import com.tomaszrup.epubcfi.tree.DocumentTree;
import com.tomaszrup.epubcfi.tree.IgnoreFilter;
import com.tomaszrup.epubcfi.tree.NodeKind;
import com.tomaszrup.epubcfi.tree.PathBuilder;
import com.tomaszrup.epubcfi.tree.Resolver;

/**
 * Splits the text of one content document into range CFIs of about
 * {@code chars} characters each, or into word-count locations.
 *
 * <p>Whitespace-only text nodes are skipped. A chunk that starts inside a
 * node already visited by the previous chunk begins one character after
 * that chunk's end. The last, usually shorter, chunk ends at the end of the
 * last text node.</p>
 *
 * <p>Word-count locations point at the text node in which every
 * {@code wordCount}-th word falls. Each carries the number of words that
 * were counted toward it in earlier text nodes.</p>
 *
 * @param <N> the host's node type
 */
public class LocationGenerator<N> {

    private static final Logger logger = LoggerFactory.getLogger(LocationGenerator.class);

    public static final int DEFAULT_CHARS = 150;

    /** A location produced by {@link #generateFromWords}. */
    public static final class WordLocation {
        private final String cfi;
        private final int wordCount;

        public WordLocation(String cfi, int wordCount) {
            this.cfi = Objects.requireNonNull(cfi, "cfi");
            this.wordCount = wordCount;
        }

        public String getCfi() {
            return cfi;
        }

        public int getWordCount() {
            return wordCount;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof WordLocation)) {
                return false;
            }
            WordLocation that = (WordLocation) o;
            return wordCount == that.wordCount && cfi.equals(that.cfi);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cfi, wordCount);
        }

        @Override
        public String toString() {
            return "WordLocation{" + cfi + ", " + wordCount + "}";
        }
    }

    private final DocumentTree<N> tree;
    private final PathBuilder<N> pathBuilder;
    private final String ignoreClass;

    public LocationGenerator(DocumentTree<N> tree) {
        this(tree, null);
    }

    public LocationGenerator(DocumentTree<N> tree, String ignoreClass) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.pathBuilder = new PathBuilder<>(tree);
        this.ignoreClass = ignoreClass;
    }

    public List<String> generate(N container, Segment base) {
        return generate(container, base, DEFAULT_CHARS);
    }

    /**
     * @param container element whose text is split, usually {@code <body>}
     * @param base      base segment of the content document
     * @param chars     chunk length, must be positive
     */
    public List<String> generate(N container, Segment base, int chars) {
        if (chars <= 0) {
            throw new IllegalArgumentException("chars must be positive: " + chars);
        }
        IgnoreFilter<N> filter = IgnoreFilter.of(tree, ignoreClass);
        List<String> locations = new ArrayList<>();
        int counter = 0;
        N startNode = null;
        int startOffset = 0;
        N prev = null;

        for (N node : textNodes(container)) {
            String text = tree.getTextContent(node);
            if (text == null || text.trim().isEmpty()) {
                continue;
            }
            int len = text.length();
            int pos = 0;
            if (counter == 0) {
                startNode = node;
                startOffset = 0;
            }
            int dist = chars - counter;
            if (dist > len) {
                counter += len;
                pos = len;
            }
            while (pos < len) {
                dist = chars - counter;
                if (counter == 0) {
                    pos += 1;
                    startNode = node;
                    startOffset = pos;
                }
                if (pos + dist >= len) {
                    counter += len - pos;
                    pos = len;
                } else {
                    pos += dist;
                    locations.add(pathBuilder.rangeFromFiltered(startNode, startOffset, node, pos, base, filter)
                            .toString());
                    counter = 0;
                }
            }
            prev = node;
        }

        if (startNode != null && prev != null) {
            locations.add(pathBuilder.rangeFromFiltered(startNode, startOffset, prev, tree.getTextLength(prev),
                    base, filter).toString());
        }
        logger.debug("Generated {} locations of {} chars", locations.size(), chars);
        return locations;
    }

    public List<WordLocation> generateFromWords(N container, Segment base, int wordCount) {
        return generateFromWords(container, base, wordCount, null, 0);
    }

    /**
     * Emits a location for every {@code wordCount} words under
     * {@code container}.
     *
     * @param start     when it addresses this document (same container
     *                  ordinal as {@code base}), text before the node it
     *                  points at is skipped; may be {@code null}
     * @param maxCount  stop after this many locations, {@code 0} or less for
     *                  no limit
     */
    public List<WordLocation> generateFromWords(N container, Segment base, int wordCount, Cfi start,
            int maxCount) {
        if (wordCount <= 0) {
            throw new IllegalArgumentException("wordCount must be positive: " + wordCount);
        }
        N startNode = null;
        if (start != null && start.isValid() && start.getContainerOrdinal() == containerOrdinal(base)) {
            startNode = new Resolver<>(tree).findNode(start.startSegment().getSteps(), ignoreClass);
            if (startNode == null) {
                logger.warn("Start of word locations not found: {}", start);
                return new ArrayList<>();
            }
        }

        IgnoreFilter<N> filter = IgnoreFilter.of(tree, ignoreClass);
        List<WordLocation> locations = new ArrayList<>();
        boolean started = startNode == null;
        int counter = 0;

        for (N node : textNodes(container)) {
            if (maxCount > 0 && locations.size() >= maxCount) {
                break;
            }
            if (!started) {
                if (!isSameOrInside(node, startNode)) {
                    continue;
                }
                started = true;
            }
            String text = tree.getTextContent(node);
            if (text == null || text.trim().isEmpty()) {
                continue;
            }
            int len = countWords(text);
            int pos = 0;
            int dist = wordCount - counter;
            if (dist > len) {
                counter += len;
                pos = len;
            }
            while (pos < len) {
                dist = wordCount - counter;
                if (pos + dist >= len) {
                    counter += len - pos;
                    pos = len;
                } else {
                    pos += dist;
                    Cfi cfi = Cfi.positional(base, pathBuilder.pathToFiltered(node, null, filter));
                    locations.add(new WordLocation(cfi.toString(), counter));
                    counter = 0;
                }
            }
        }
        if (maxCount > 0 && locations.size() > maxCount) {
            locations = new ArrayList<>(locations.subList(0, maxCount));
        }
        logger.debug("Generated {} word locations of {} words", locations.size(), wordCount);
        return locations;
    }

    /**
     * Words in a text node: runs of spaces collapse to one, and only spaces
     * separate words.
     */
    static int countWords(String text) {
        String s = text.trim();
        s = s.replaceAll(" {2,}", " ");
        s = s.replaceFirst("\n ", "\n");
        return s.split(" ", -1).length;
    }

    private static int containerOrdinal(Segment base) {
        return base.size() >= 2 ? base.getSteps().get(1).getSiblingIndex() : -1;
    }

    private boolean isSameOrInside(N node, N ancestor) {
        N current = node;
        while (current != null) {
            if (current.equals(ancestor)) {
                return true;
            }
            current = tree.getParent(current);
        }
        return false;
    }

    private List<N> textNodes(N container) {
        List<N> result = new ArrayList<>();
        Deque<N> stack = new ArrayDeque<>();
        stack.push(container);
        while (!stack.isEmpty()) {
            N node = stack.pop();
            NodeKind kind = tree.getKind(node);
            if (kind == NodeKind.TEXT) {
                result.add(node);
            } else if (kind == NodeKind.ELEMENT) {
                List<N> children = tree.getChildren(node);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return result;
    }
}
