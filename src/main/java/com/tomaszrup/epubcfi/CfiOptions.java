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

import java.util.Objects;

/**
 * Immutable engine settings.
 */
public final class CfiOptions {

    private static final CfiOptions DEFAULTS = new CfiOptions(null, true, null);

    private final String ignoreClass;
    private final boolean useXPath;
    private final String logLevel;

    /**
     * @param ignoreClass class of decoration elements to address through, or
     *                    {@code null} for none
     * @param useXPath    whether resolution may use the host's path query
     * @param logLevel    requested root log level, or {@code null} to keep
     *                    the configured one
     */
    public CfiOptions(String ignoreClass, boolean useXPath, String logLevel) {
        this.ignoreClass = ignoreClass == null || ignoreClass.trim().isEmpty() ? null : ignoreClass.trim();
        this.useXPath = useXPath;
        this.logLevel = logLevel;
    }

    public static CfiOptions defaults() {
        return DEFAULTS;
    }

    public String getIgnoreClass() {
        return ignoreClass;
    }

    public boolean isUseXPath() {
        return useXPath;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public CfiOptions withIgnoreClass(String newIgnoreClass) {
        return new CfiOptions(newIgnoreClass, useXPath, logLevel);
    }

    public CfiOptions withUseXPath(boolean newUseXPath) {
        return new CfiOptions(ignoreClass, newUseXPath, logLevel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CfiOptions)) {
            return false;
        }
        CfiOptions that = (CfiOptions) o;
        return useXPath == that.useXPath
                && Objects.equals(ignoreClass, that.ignoreClass)
                && Objects.equals(logLevel, that.logLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ignoreClass, useXPath, logLevel);
    }

    @Override
    public String toString() {
        return "CfiOptions{ignoreClass=" + ignoreClass + ", useXPath=" + useXPath + ", logLevel=" + logLevel + "}";
    }
}
