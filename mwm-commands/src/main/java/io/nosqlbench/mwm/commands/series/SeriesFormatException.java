/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.mwm.commands.series;

import java.io.IOException;

/**
 * Thrown when a series file contains something other than numbers, separators and comments.
 */
public class SeriesFormatException extends IOException {

    private final int lineNumber;

    /**
     * Creates an exception for a malformed line.
     *
     * @param lineNumber the 1-based line number
     * @param message the detail message
     */
    public SeriesFormatException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based number of the offending line.
     *
     * @return the line number
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
