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
package com.tomaszrup.epubcfi.util;

import java.util.function.Supplier;

import org.slf4j.MDC;

/**
 * Manages the SLF4J MDC key {@code "cfi"} so that log lines written while a
 * CFI is being resolved carry that CFI.
 *
 * <pre>{@code
 * MdcCfiContext.setCfi(cfi);
 * try {
 *     // ... all log calls inside here include the CFI
 * } finally {
 *     MdcCfiContext.clear();
 * }
 * }</pre>
 *
 * <p>{@link #wrap(Object, Supplier)} does the same around a single call.
 * Other MDC keys of the thread are left alone.</p>
 */
public final class MdcCfiContext {

    /** MDC key used in the logback pattern via {@code %X{cfi}}. */
    public static final String MDC_KEY = "cfi";

    private MdcCfiContext() {
        // utility class
    }

    /**
     * Sets the MDC {@code "cfi"} key. A {@code null} value stores
     * {@code "none"}.
     */
    public static void setCfi(Object cfi) {
        MDC.put(MDC_KEY, cfi != null ? cfi.toString() : "none");
    }

    /**
     * Removes the MDC {@code "cfi"} key from the current thread.
     */
    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Runs {@code work} with the MDC {@code "cfi"} key set, then puts back
     * whatever value the key had before, so nested calls keep the outer CFI.
     */
    public static <T> T wrap(Object cfi, Supplier<T> work) {
        String previous = MDC.get(MDC_KEY);
        setCfi(cfi);
        try {
            return work.get();
        } finally {
            if (previous != null) {
                MDC.put(MDC_KEY, previous);
            } else {
                clear();
            }
        }
    }
}
