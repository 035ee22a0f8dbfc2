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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of one scan: a {@link Tally} per observed (row key, column key) pair, along with the record counts and
 * the shape of the field lists at the time of the scan. The engine keeps the last completed table, so the view can be
 * regenerated without rescanning when only the aggregate or show-as setting of a value field changes.
 */
final class TallyTable {
    static final TallyTable EMPTY = new TallyTable(0, 0);
    
    final Map<PivotKey, Map<PivotKey, Tally>> tallies = new LinkedHashMap<>();
    final int rowFieldCount;
    final int columnFieldCount;
    long totalCount;
    long filteredCount;
    
    TallyTable(int rowFieldCount, int columnFieldCount) {
        this.rowFieldCount = rowFieldCount;
        this.columnFieldCount = columnFieldCount;
    }
    
    /**
     * Returns the tallies of the given row, creating an empty row if needed.
     */
    Map<PivotKey, Tally> row(PivotKey rowKey) {
        return tallies.computeIfAbsent(rowKey, k -> new LinkedHashMap<>());
    }
}
