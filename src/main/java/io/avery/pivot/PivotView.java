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

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * The output of a {@link PivotEngine engine}: an ordered collection of {@link Record records} with a common
 * {@link Header header}, one record per row key and one column per column key.
 *
 * <p>The engine replaces the contents of a view as a whole, after each tabulation. Between replacements the view is
 * immutable, except for its {@link #sort sort order}. Listeners are notified once per replacement, and once per
 * refresh that does not change the contents.
 */
public final class PivotView implements Iterable<Record> {
    /**
     * The kinds of change reported to view listeners.
     */
    public enum Change {
        /** The contents of the view were replaced. */
        RESET,
        /** The contents are unchanged, but their presentation (order, formatting, or layout) may have changed. */
        REFRESH
    }
    
    /**
     * Receives notifications of changes to a view.
     */
    @FunctionalInterface
    public interface Listener {
        /**
         * Invoked after the given view changed.
         *
         * @param view the view
         * @param change the kind of change
         */
        void viewChanged(PivotView view, Change change);
    }
    
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private Header header = new Header(List.of(Column.ROW_KEY));
    private List<Record> keyOrder = List.of();
    private List<Record> records = List.of();
    private List<PivotKey> columnKeys = List.of();
    private Map<String, PivotKey> keyByBinding = Map.of();
    private int rowFieldCount;
    private int columnFieldCount;
    private Column<?> sortColumn;
    private boolean sortDescending;
    
    PivotView() {}
    
    /**
     * Returns the header shared by all records in this view.
     *
     * @return the header shared by all records in this view
     */
    public Header header() {
        return header;
    }
    
    /**
     * Returns an unmodifiable list of the records in this view, in their current order.
     *
     * @return the records in this view
     */
    public List<Record> records() {
        return records;
    }
    
    public Record get(int index) {
        return records.get(index);
    }
    
    public int size() {
        return records.size();
    }
    
    public boolean isEmpty() {
        return records.isEmpty();
    }
    
    @Override
    public Iterator<Record> iterator() {
        return records.iterator();
    }
    
    public Stream<Record> stream() {
        return records.stream();
    }
    
    /**
     * Returns an unmodifiable list of the column keys, in column order. The key at index {@code i} identifies the
     * header column at index {@code i + 1}.
     *
     * @return the column keys
     */
    public List<PivotKey> columnKeys() {
        return columnKeys;
    }
    
    /**
     * Returns the key of the row at the given index.
     *
     * @param row the row index
     * @return the row key
     */
    public PivotKey rowKey(int row) {
        return records.get(row).rowKey();
    }
    
    /**
     * Returns the key of the column with the given binding, or {@code null} if this view has no such column.
     *
     * @param binding the column binding (name)
     * @return the column key, or {@code null}
     */
    public PivotKey columnKey(String binding) {
        return keyByBinding.get(binding);
    }
    
    /**
     * Returns the subtotal level of the row at the given index: {@code 0} for the grand total, the number of fields
     * taken into account for subtotals, or {@code -1} for data rows.
     *
     * @param row the row index
     * @return the subtotal level of the row
     */
    public int rowLevel(int row) {
        return row < 0 || row >= records.size() ? -1 : level(records.get(row).rowKey(), rowFieldCount);
    }
    
    /**
     * Returns the subtotal level of the column key at the given index in {@link #columnKeys()}: {@code 0} for grand
     * totals, the number of fields taken into account for subtotals, or {@code -1} for data columns.
     *
     * @param column the column key index
     * @return the subtotal level of the column
     */
    public int columnLevel(int column) {
        return column < 0 || column >= columnKeys.size() ? -1 : level(columnKeys.get(column), columnFieldCount);
    }
    
    /**
     * Returns the subtotal level of the column with the given binding, or {@code -1} if it is a data column or this
     * view has no such column.
     *
     * @param binding the column binding (name)
     * @return the subtotal level of the column
     */
    public int columnLevel(String binding) {
        return level(keyByBinding.get(binding), columnFieldCount);
    }
    
    static int level(PivotKey key, int fullCount) {
        return key == null || key.fieldCount() == fullCount ? -1 : key.fieldCount();
    }
    
    // --- sorting ---
    
    /**
     * Sorts the data rows of this view by the values of the given column. Total rows keep their positions; only runs of
     * consecutive data rows between totals are reordered. Nulls sort last.
     *
     * @param column the column to sort by
     * @param descending whether to sort in descending order
     * @throws NoSuchElementException if the header does not contain the column
     */
    public void sort(Column<?> column, boolean descending) {
        int index = header.indexOf(column);
        if (index == -1)
            throw new NoSuchElementException("Invalid column: " + column);
        sortColumn = column;
        sortDescending = descending;
        records = Collections.unmodifiableList(sorted(index, descending));
        notifyListeners(Change.REFRESH);
    }
    
    /**
     * Restores the key order of the rows.
     */
    public void clearSort() {
        if (sortColumn != null) {
            sortColumn = null;
            records = keyOrder;
            notifyListeners(Change.REFRESH);
        }
    }
    
    /**
     * Returns the column this view is sorted by, or {@code null} if the rows are in key order.
     *
     * @return the sort column, or {@code null}
     */
    public Column<?> getSortColumn() {
        return sortColumn;
    }
    
    public boolean isSortDescending() {
        return sortDescending;
    }
    
    private List<Record> sorted(int index, boolean descending) {
        Comparator<Object> values = descending ? Utils.VALUE_COMPARATOR.reversed() : Utils.VALUE_COMPARATOR;
        Comparator<Record> comparator = (a, b) -> {
            Object va = a.values[index];
            Object vb = b.values[index];
            if (va == null || vb == null)
                return va == vb ? 0 : va == null ? 1 : -1;
            return values.compare(va, vb);
        };
        List<Record> arr = new ArrayList<>(keyOrder);
        for (int start = 0; start < arr.size(); start++) {
            if (level(arr.get(start).rowKey(), rowFieldCount) > -1)
                continue;
            int end = start;
            while (end < arr.size() - 1 && level(arr.get(end + 1).rowKey(), rowFieldCount) == -1)
                end++;
            if (end > start)
                arr.subList(start, end + 1).sort(comparator);
            start = end;
        }
        return arr;
    }
    
    // --- publication ---
    
    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }
    
    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }
    
    /**
     * Replaces the contents of this view, clears the sort order, and notifies listeners once.
     */
    void publish(Header header, List<Record> rows, List<PivotKey> columnKeys, int rowFieldCount,
                 int columnFieldCount) {
        Map<String, PivotKey> bindings = new HashMap<>(columnKeys.size() * 2);
        for (PivotKey key : columnKeys)
            bindings.put(key.toString(), key);
        this.header = header;
        this.keyOrder = Collections.unmodifiableList(new ArrayList<>(rows));
        this.records = keyOrder;
        this.columnKeys = Collections.unmodifiableList(new ArrayList<>(columnKeys));
        this.keyByBinding = bindings;
        this.rowFieldCount = rowFieldCount;
        this.columnFieldCount = columnFieldCount;
        this.sortColumn = null;
        this.sortDescending = false;
        notifyListeners(Change.RESET);
    }
    
    /**
     * Notifies listeners that the presentation of this view should be refreshed, re-applying the sort order if any.
     */
    void refresh() {
        if (sortColumn != null)
            records = Collections.unmodifiableList(sorted(header.indexOf(sortColumn), sortDescending));
        notifyListeners(Change.REFRESH);
    }
    
    private void notifyListeners(Change change) {
        for (Listener listener : listeners)
            listener.viewChanged(this, change);
    }
    
    /**
     * Returns {@code true} if and only if the given object is a view with a header equal to this view's header, and
     * the object contains records equal to this view's records, in the same order as this view.
     *
     * @param o the object to be compared for equality with this view
     * @return {@code true} if the given object is equal to this view
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PivotView))
            return false;
        PivotView other = (PivotView) o;
        return header.equals(other.header) && records.equals(other.records);
    }
    
    @Override
    public int hashCode() {
        return 31 * header.hashCode() + records.hashCode();
    }
    
    /**
     * Returns a string representation of this view. The string representation consists of the characters
     * {@code "PivotView"}, followed by the string representation of the view {@link #records() records}.
     *
     * @return a string representation of this view
     */
    @Override
    public String toString() {
        return "PivotView" + records;
    }
}
