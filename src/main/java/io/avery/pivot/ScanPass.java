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

import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * The state of one scan over the source records: snapshots of the field lists and totals settings, the row key trie,
 * the table being filled, and a cursor. A pass is created when a scan starts and dropped when it completes or is
 * superseded, so no state leaks between passes.
 *
 * <p>A pass may run in slices. Each slice resumes at the cursor and, when allowed to yield, stops once it has scanned
 * at least a batch of records and the slice has run for at least the batch delay.
 */
final class ScanPass {
    private final List<? extends Map<String, ?>> items;
    private final PivotFieldList rowList;
    private final PivotFieldList columnList;
    private final PivotField[] rowFields;
    private final PivotField[] columnFields;
    private final PivotField[] valueFields;
    private final PivotFilter[] filters;
    private final int rowStart;
    private final int rowStep;
    private final int columnStart;
    private final int columnStep;
    private final KeyNode rowNodes;
    private final TallyTable table;
    private int index;
    
    ScanPass(PivotEngine engine, List<? extends Map<String, ?>> items, List<PivotField> activeFilterFields) {
        this.items = items;
        this.rowList = engine.rowFields();
        this.columnList = engine.columnFields();
        this.rowFields = rowList.toArray();
        this.columnFields = columnList.toArray();
        this.valueFields = engine.valueFields().toArray();
        this.filters = new PivotFilter[activeFilterFields.size()];
        for (int i = 0; i < filters.length; i++)
            filters[i] = activeFilterFields.get(i).filter();
        this.rowStart = engine.getShowRowTotals().firstDepth(rowFields.length);
        this.rowStep = engine.getShowRowTotals().depthStep(rowFields.length);
        this.columnStart = engine.getShowColumnTotals().firstDepth(columnFields.length);
        this.columnStep = engine.getShowColumnTotals().depthStep(columnFields.length);
        this.rowNodes = new KeyNode(new PivotKey(rowList, rowFields, 0, null, -1, null));
        this.table = new TallyTable(rowFields.length, columnFields.length);
    }
    
    TallyTable table() {
        return table;
    }
    
    int index() {
        return index;
    }
    
    int size() {
        return items.size();
    }
    
    /**
     * Returns the share of records scanned so far, as a percentage.
     */
    int progress() {
        return items.isEmpty() ? 100 : (int) Math.round(index * 100.0 / items.size());
    }
    
    /**
     * Scans records from the cursor on.
     *
     * @param mayYield whether the slice may stop before the end of the records
     * @param batchSize the minimum number of records per slice
     * @param batchDelay the minimum time per slice, in milliseconds
     * @param clock the clock measuring the slice
     * @return {@code true} if every record has been scanned
     */
    boolean scanSlice(boolean mayYield, int batchSize, long batchDelay, LongSupplier clock) {
        int first = index;
        long sliceStart = clock.getAsLong();
        for (int len = items.size(); index < len; index++) {
            if (mayYield && index - first >= batchSize && clock.getAsLong() - sliceStart >= batchDelay)
                return false;
            table.totalCount++;
            Map<String, ?> item = items.get(index);
            if (accepts(item)) {
                table.filteredCount++;
                tally(item);
            }
        }
        return true;
    }
    
    private boolean accepts(Map<String, ?> item) {
        for (PivotFilter filter : filters)
            if (!filter.apply(item))
                return false;
        return true;
    }
    
    private void tally(Map<String, ?> item) {
        for (int i = rowStart; i <= rowFields.length; i += rowStep) {
            KeyNode node = rowNodes.getNode(rowList, rowFields, i, null, -1, item);
            Map<PivotKey, Tally> row = table.row(node.key());
            for (int j = columnStart; j <= columnFields.length; j += columnStep) {
                for (int k = 0; k < valueFields.length; k++) {
                    PivotKey columnKey = node.tree().getNode(columnList, columnFields, j, valueFields, k, item).key();
                    Tally tally = row.computeIfAbsent(columnKey, key -> new Tally());
                    PivotField vf = valueFields[k];
                    tally.add(vf.getValue(item, false), vf.getWeightField() != null ? vf.weight(item) : null);
                }
            }
        }
    }
}
