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
import java.util.Objects;
import java.util.TreeMap;

/**
 * Rewrites the cells of value fields whose {@link ShowAs show-as} setting is a difference, replacing each cell value
 * with its difference from the value of the previous peer row or column.
 *
 * <p>A peer is the nearest earlier row (or column of the same value field) at the same subtotal level. The search
 * stops at a total of a higher level, so differences never cross a group boundary. When the totals of the next-outer
 * group are not shown, a change in that group's value stops the search too. Grand totals and cells without a peer get
 * {@code null}, as do cells where either value is not a number, and percentages over a zero value.
 *
 * <p>Rows are rewritten bottom-up and columns right-to-left, so each difference is taken against the peer's original
 * value.
 */
final class ShowAsCalculator {
    private final List<PivotKey> rowKeys;
    private final List<PivotKey> columnKeys;
    private final Object[][] cells;
    private final int rowFieldCount;
    private final int columnFieldCount;
    private final ShowTotals showRowTotals;
    private final ShowTotals showColumnTotals;
    
    /**
     * @param cells one array per row key, holding the row key at index 0 followed by one value per column key
     */
    ShowAsCalculator(List<PivotKey> rowKeys, List<PivotKey> columnKeys, Object[][] cells, int rowFieldCount,
                     int columnFieldCount, ShowTotals showRowTotals, ShowTotals showColumnTotals) {
        this.rowKeys = rowKeys;
        this.columnKeys = columnKeys;
        this.cells = cells;
        this.rowFieldCount = rowFieldCount;
        this.columnFieldCount = columnFieldCount;
        this.showRowTotals = showRowTotals;
        this.showColumnTotals = showColumnTotals;
    }
    
    void apply() {
        Map<Integer, PivotField> valueFields = new TreeMap<>();
        for (PivotKey key : columnKeys)
            valueFields.putIfAbsent(key.valueFieldIndex(), key.valueField());
        for (Map.Entry<Integer, PivotField> entry : valueFields.entrySet()) {
            int vf = entry.getKey();
            ShowAs showAs = entry.getValue().getShowAs();
            if (showAs.isRowDifference()) {
                for (int col = 0; col < columnKeys.size(); col++) {
                    if (columnKeys.get(col).valueFieldIndex() != vf)
                        continue;
                    for (int row = rowKeys.size() - 1; row >= 0; row--)
                        cells[row][col + 1] = rowDifference(row, col, showAs.isPercentage());
                }
            } else if (showAs.isColumnDifference()) {
                for (int row = 0; row < rowKeys.size(); row++) {
                    for (int col = columnKeys.size() - 1; col >= 0; col--) {
                        if (columnKeys.get(col).valueFieldIndex() == vf)
                            cells[row][col + 1] = columnDifference(row, col, showAs.isPercentage());
                    }
                }
            }
        }
    }
    
    private Object rowDifference(int row, int col, boolean percentage) {
        int level = PivotView.level(rowKeys.get(row), rowFieldCount);
        if (level == 0)
            return null;
        int groupField = rowFieldCount - 2;
        for (int p = row - 1; p >= 0; p--) {
            int peerLevel = PivotView.level(rowKeys.get(p), rowFieldCount);
            if (peerLevel == level) {
                if (groupField > -1 && level < 0 && showRowTotals != ShowTotals.SUBTOTALS
                    && !sameGroup(rowKeys.get(row), rowKeys.get(p), groupField))
                    return null;
                return difference(cells[row][col + 1], cells[p][col + 1], percentage);
            }
            if (peerLevel > level)
                break;
        }
        return null;
    }
    
    private Object columnDifference(int row, int col, boolean percentage) {
        PivotKey key = columnKeys.get(col);
        int level = PivotView.level(key, columnFieldCount);
        if (level == 0)
            return null;
        int groupField = columnFieldCount - 2;
        for (int p = col - 1; p >= 0; p--) {
            PivotKey peer = columnKeys.get(p);
            if (peer.valueFieldIndex() != key.valueFieldIndex())
                continue;
            int peerLevel = PivotView.level(peer, columnFieldCount);
            if (peerLevel == level) {
                if (groupField > -1 && level < 0 && showColumnTotals != ShowTotals.SUBTOTALS
                    && !sameGroup(key, peer, groupField))
                    return null;
                return difference(cells[row][col + 1], cells[row][p + 1], percentage);
            }
            if (peerLevel > level)
                break;
        }
        return null;
    }
    
    private static boolean sameGroup(PivotKey a, PivotKey b, int groupField) {
        return Objects.equals(a.getValue(groupField, true), b.getValue(groupField, true));
    }
    
    private static Double difference(Object value, Object previous, boolean percentage) {
        if (!Utils.isNumber(value) || !Utils.isNumber(previous))
            return null;
        double v = ((Number) value).doubleValue();
        double p = ((Number) previous).doubleValue();
        if (!percentage)
            return v - p;
        return p == 0 ? null : (v - p) / p;
    }
}
