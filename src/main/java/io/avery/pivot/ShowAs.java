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
 * Calculations applied to the cells of a value field after aggregation.
 */
public enum ShowAs {
    /** Show plain aggregated values. */
    NO_CALCULATION,
    /** Show the difference between each cell and the cell in the previous row at the same level. */
    DIFF_ROW,
    /** Show the difference between each cell and the cell in the previous row, as a fraction of the previous cell. */
    DIFF_ROW_PCT,
    /** Show the difference between each cell and the cell in the previous column at the same level. */
    DIFF_COL,
    /** Show the difference between each cell and the cell in the previous column, as a fraction of the previous cell. */
    DIFF_COL_PCT;
    
    boolean isRowDifference() {
        return this == DIFF_ROW || this == DIFF_ROW_PCT;
    }
    
    boolean isColumnDifference() {
        return this == DIFF_COL || this == DIFF_COL_PCT;
    }
    
    boolean isPercentage() {
        return this == DIFF_ROW_PCT || this == DIFF_COL_PCT;
    }
}
