/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * The kinds of scalar values a {@link PivotField field} may hold.
 */
public enum DataType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    OBJECT;
    
    /**
     * Returns the data type of the given value, or {@code null} if the value is {@code null}.
     *
     * @param value the value
     * @return the data type of the value, or {@code null}
     */
    public static DataType of(Object value) {
        if (value == null)
            return null;
        if (value instanceof CharSequence || value instanceof Character)
            return STRING;
        if (value instanceof Number)
            return NUMBER;
        if (value instanceof Boolean)
            return BOOLEAN;
        if (value instanceof Date || value instanceof TemporalAccessor)
            return DATE;
        return OBJECT;
    }
}
