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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.epubcfi.grammar.CfiParser;
import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.utils.CfiPositions;
import com.tomaszrup.epubcfi.utils.SortedCfis;

/**
 * Print page numbers mapped to CFIs, in document order.
 */
public class PageList {

    private static final Logger logger = LoggerFactory.getLogger(PageList.class);

    /** One page-list target. */
    public static final class Entry {
        private final int page;
        private final String cfi;

        public Entry(int page, String cfi) {
            this.page = page;
            this.cfi = Objects.requireNonNull(cfi, "cfi");
        }

        public int getPage() {
            return page;
        }

        public String getCfi() {
            return cfi;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Entry)) {
                return false;
            }
            Entry entry = (Entry) o;
            return page == entry.page && cfi.equals(entry.cfi);
        }

        @Override
        public int hashCode() {
            return Objects.hash(page, cfi);
        }

        @Override
        public String toString() {
            return page + " -> " + cfi;
        }
    }

    private final List<Integer> pages = new ArrayList<>();
    private final List<String> locations = new ArrayList<>();
    private final List<Cfi> parsed = new ArrayList<>();
    private final int firstPage;
    private final int lastPage;
    private final int totalPages;

    public PageList(List<Entry> entries) {
        for (Entry entry : entries) {
            Cfi cfi = CfiParser.parse(entry.getCfi());
            if (!cfi.isValid()) {
                logger.warn("Skipping page {} with invalid CFI {}", entry.getPage(), entry.getCfi());
                continue;
            }
            pages.add(entry.getPage());
            locations.add(entry.getCfi());
            parsed.add(cfi);
        }
        this.firstPage = pages.isEmpty() ? 0 : pages.get(0);
        this.lastPage = pages.isEmpty() ? 0 : pages.get(pages.size() - 1);
        this.totalPages = lastPage - firstPage;
    }

    public List<Integer> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public List<String> getLocations() {
        return Collections.unmodifiableList(locations);
    }

    public int getFirstPage() {
        return firstPage;
    }

    public int getLastPage() {
        return lastPage;
    }

    public int getTotalPages() {
        return totalPages;
    }

    /**
     * Page containing the CFI: the page of an identical entry, otherwise the
     * page of the entry just before it (the first page when it precedes
     * every entry).
     *
     * @return the page, or {@code -1} when the list is empty
     */
    public int pageFromCfi(String cfi) {
        if (parsed.isEmpty()) {
            return -1;
        }
        Cfi target = CfiParser.parse(cfi);
        int index = SortedCfis.indexOfSorted(target, parsed, CfiPositions.COMPARATOR);
        if (index != -1) {
            return pages.get(index);
        }
        int loc = SortedCfis.locationOf(target, parsed, CfiPositions.COMPARATOR);
        return loc - 1 >= 0 ? pages.get(loc - 1) : pages.get(0);
    }

    /**
     * @return the CFI of the page, or an empty string when the page is unknown
     */
    public String cfiFromPage(int page) {
        int index = pages.indexOf(page);
        return index != -1 ? locations.get(index) : "";
    }

    public int pageFromPercentage(double percent) {
        return (int) Math.round(totalPages * percent);
    }

    /**
     * Position of a page between 0 and 1, rounded to three decimals.
     */
    public double percentageFromPage(int page) {
        if (totalPages == 0) {
            return 0;
        }
        double percentage = (double) (page - firstPage) / totalPages;
        return Math.round(percentage * 1000) / 1000.0;
    }

    public double percentageFromCfi(String cfi) {
        return percentageFromPage(pageFromCfi(cfi));
    }
}
