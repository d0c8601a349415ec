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

import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.epubcfi.grammar.CfiParser;
import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.utils.CfiPositions;
import com.tomaszrup.epubcfi.utils.SortedCfis;

/**
 * Ordered list of range CFIs that split a book into chunks of roughly equal
 * length. Maps between CFIs, location numbers and reading percentages.
 *
 * <p>Locations are persisted as a JSON array of CFI strings. The index also
 * remembers the reader's current location, set either as a location number
 * or as a CFI.</p>
 */
public class LocationIndex {

    private static final Logger logger = LoggerFactory.getLogger(LocationIndex.class);

    private static final Gson GSON = new Gson();
    private static final Type LIST_TYPE = new TypeToken<List<String>>() {
    }.getType();

    private final List<String> locations;
    private final List<Cfi> parsed;

    private int current;
    private String currentCfi = "";

    public LocationIndex(List<String> locations) {
        this.locations = Collections.unmodifiableList(new ArrayList<>(locations));
        List<Cfi> cfis = new ArrayList<>(locations.size());
        for (String location : locations) {
            cfis.add(CfiParser.parse(location));
        }
        this.parsed = cfis;
    }

    public static LocationIndex empty() {
        return new LocationIndex(Collections.emptyList());
    }

    /**
     * Reads locations previously written by {@link #save()}.
     *
     * @throws IllegalArgumentException if the text is not a JSON array of strings
     */
    public static LocationIndex load(String json) {
        try {
            return fromList(GSON.fromJson(json, LIST_TYPE));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed locations JSON: " + e.getMessage(), e);
        }
    }

    public static LocationIndex load(Reader reader) {
        try {
            return fromList(GSON.fromJson(reader, LIST_TYPE));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed locations JSON: " + e.getMessage(), e);
        }
    }

    private static LocationIndex fromList(List<String> list) {
        if (list == null) {
            return empty();
        }
        List<String> cleaned = new ArrayList<>(list.size());
        for (String location : list) {
            if (location != null) {
                cleaned.add(location);
            }
        }
        logger.debug("Loaded {} locations", cleaned.size());
        return new LocationIndex(cleaned);
    }

    public String save() {
        return GSON.toJson(locations, LIST_TYPE);
    }

    public void save(Writer writer) {
        try {
            GSON.toJson(locations, LIST_TYPE, writer);
        } catch (JsonIOException e) {
            throw new IllegalStateException("Failed to write locations: " + e.getMessage(), e);
        }
    }

    public List<String> getLocations() {
        return locations;
    }

    public int size() {
        return locations.size();
    }

    public boolean isEmpty() {
        return locations.isEmpty();
    }

    /** Index of the last location, {@code -1} when empty. */
    public int total() {
        return locations.size() - 1;
    }

    public int locationFromCfi(String cfi) {
        return locationFromCfi(CfiParser.parse(cfi));
    }

    /**
     * @return the location the CFI falls into, capped at {@link #total()};
     *         {@code -1} for an empty index or an invalid CFI
     */
    public int locationFromCfi(Cfi cfi) {
        if (locations.isEmpty()) {
            return -1;
        }
        if (!cfi.isValid()) {
            logger.warn("Cannot locate invalid CFI");
            return -1;
        }
        int loc = SortedCfis.locationOf(cfi, parsed, CfiPositions.COMPARATOR);
        return Math.min(loc, total());
    }

    public double percentageFromCfi(String cfi) {
        return percentageFromCfi(CfiParser.parse(cfi));
    }

    public double percentageFromCfi(Cfi cfi) {
        if (locations.isEmpty()) {
            return 0;
        }
        return percentageFromLocation(locationFromCfi(cfi));
    }

    public double percentageFromLocation(int loc) {
        int total = total();
        if (loc <= 0 || total <= 0) {
            return 0;
        }
        return (double) loc / total;
    }

    /**
     * @return the stored CFI, or an empty string when {@code loc} is out of range
     */
    public String cfiFromLocation(int loc) {
        if (loc >= 0 && loc < locations.size()) {
            return locations.get(loc);
        }
        return "";
    }

    /**
     * CFI at a reading percentage between 0 and 1. Anything at or past the
     * end gives the end of the last location.
     */
    public String cfiFromPercentage(double percentage) {
        if (percentage > 1) {
            logger.warn("Percentage {} is above 1, using the end of the book", percentage);
        }
        if (percentage >= 1) {
            if (locations.isEmpty()) {
                return "";
            }
            return parsed.get(total()).collapse(false).toString();
        }
        int loc = (int) Math.ceil(total() * percentage);
        return cfiFromLocation(loc);
    }

    public int getCurrent() {
        return current;
    }

    /**
     * @return the CFI last passed to {@link #setCurrent(String)}, or an
     *         empty string
     */
    public String getCurrentCfi() {
        return currentCfi;
    }

    /**
     * Moves the current location to the one containing {@code cfi}. On an
     * empty index only the CFI is remembered.
     */
    public void setCurrent(String cfi) {
        if (cfi == null) {
            return;
        }
        currentCfi = cfi;
        if (locations.isEmpty()) {
            return;
        }
        current = locationFromCfi(cfi);
        logger.debug("Current location {} ({})", current, percentageFromLocation(current));
    }

    public void setCurrent(int loc) {
        current = loc;
        logger.debug("Current location {} ({})", current, percentageFromLocation(current));
    }

    public double getCurrentPercentage() {
        return percentageFromLocation(current);
    }
}
