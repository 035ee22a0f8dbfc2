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

/**
 * One row of a {@link PivotView view}: a shallowly immutable carrier for the row's {@link PivotKey key} and the
 * aggregated value of each column. Values are stored in ordered correspondence with the {@link Header header} columns,
 * and are accessed via a type-safe accessor that accepts a {@link Column column}, or by column name.
 *
 * <p>Records have a natural definition of {@code equals()}, {@code hashCode()}, and {@code toString()}, based on the
 * record header and values.
 */
public final class Record {
    final Header header;
    final Object[] values;
    
    Record(Header header, Object[] values) {
        this.header = header;
        this.values = values;
    }
    
    /**
     * Returns the record {@link Header header}. The header {@link Header#columns() columns} are in ordered
     * correspondence with the record {@link #values() values}.
     *
     * @return the record header
     */
    public Header header() {
        return header;
    }
    
    /**
     * Returns an unmodifiable view of the record values. The values are in ordered correspondence with the record
     * {@link #header() header} columns.
     *
     * @return the record values
     */
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }
    
    /**
     * Returns the key of this row.
     *
     * @return the key of this row
     */
    public PivotKey rowKey() {
        return get(Column.ROW_KEY);
    }
    
    /**
     * Returns the value associated with the given column in this record, or throws {@link NoSuchElementException} if
     * this record's header does not contain the column.
     *
     * @param column the column whose associated value is to be returned
     * @return the value associated with the given column
     * @throws NoSuchElementException if this record's header does not contain the column
     * @param <T> the type of the value
     */
    @SuppressWarnings("unchecked")
    public <T> T get(Column<T> column) {
        int index = header.indexOf(column);
        if (index == -1)
            throw new NoSuchElementException("Invalid column: " + column);
        return (T) values[index];
    }
    
    /**
     * Returns the value associated with the column of the given name (binding) in this record, or throws
     * {@link NoSuchElementException} if this record's header does not contain such a column.
     *
     * @param binding the name of the column whose associated value is to be returned
     * @return the value associated with the named column
     * @throws NoSuchElementException if this record's header does not contain the column
     */
    public Object get(String binding) {
        return get(new Column<>(binding));
    }
    
    /**
     * Returns {@code true} if and only if the given object is a record with a header and values equal to this record's
     * header and values, respectively.
     *
     * @param o the object to be compared for equality with this record
     * @return {@code true} if the given object is equal to this record
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Record))
            return false;
        Record other = (Record) o;
        if (!header.equals(other.header))
            return false;
        return Arrays.equals(values, other.values);
    }
    
    /**
     * Returns the hash code value for this record. The hash code of a record is derived from the hash code of each of
     * its values.
     *
     * @return the hash code value for this record
     */
    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
    
    /**
     * Returns a string representation of this record. The string representation consists of a list of column-value
     * associations, in the same order as the header columns, enclosed in the braces of {@code "Record{}"}. Adjacent
     * associations are separated by the characters {@code ", "} (comma and space). Each column-value association is
     * rendered as the column followed by an equals sign ({@code "="}) followed by the associated value.
     *
     * @return a string representation of this record
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Record{");
        String delimiter = "";
        for (int i = 0; i < values.length; i++) {
            sb.append(delimiter).append(header.columns[i]).append('=').append(values[i]);
            delimiter = ", ";
        }
        return sb.append('}').toString();
    }
}
