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

/**
 * Which total rows (or columns) to include in the output view.
 */
public enum ShowTotals {
    /** Do not show any totals. */
    NONE,
    /** Show grand totals only. */
    GRAND_TOTALS,
    /** Show subtotals and grand totals. */
    SUBTOTALS;
    
    /**
     * Returns the first key depth to materialize for a field list of the given length.
     */
    int firstDepth(int fieldCount) {
        return this == NONE ? fieldCount : 0;
    }
    
    /**
     * Returns the step between materialized key depths for a field list of the given length.
     */
    int depthStep(int fieldCount) {
        return this == GRAND_TOTALS ? Math.max(1, fieldCount) : 1;
    }
}
