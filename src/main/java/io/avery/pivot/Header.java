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
 * An ordered, immutable collection of {@link Column columns} shared by the {@link Record records} of a
 * {@link PivotView view}. Header columns are distinct from each other.
 */
public final class Header {
    final Map<Column<?>, Integer> indexByColumn;
    final Column<?>[] columns;
    
    Header(List<Column<?>> columns) {
        this.columns = columns.toArray(new Column<?>[0]);
        this.indexByColumn = new HashMap<>(columns.size() * 2);
        for (int i = 0; i < this.columns.length; i++)
            if (indexByColumn.putIfAbsent(this.columns[i], i) != null)
                throw new IllegalArgumentException("Duplicate column: " + this.columns[i]);
    }
    
    /**
     * Returns the index of the given column in this header, or {@code -1} if this header does not contain the column.
     *
     * @param column the column to search for
     * @return the index of the given column in this header, or {@code -1} if this header does not contain the column
     */
    public int indexOf(Column<?> column) {
        Objects.requireNonNull(column);
        Integer index = indexByColumn.get(column);
        return index != null ? index : -1;
    }
    
    /**
     * Returns the column with the given name, or throws {@link NoSuchElementException} if this header does not
     * contain such a column.
     *
     * @param name the column name
     * @return the column with the given name
     * @throws NoSuchElementException if this header does not contain a column with the given name
     */
    public Column<Object> column(String name) {
        Integer index = indexByColumn.get(new Column<>(name));
        if (index == null)
            throw new NoSuchElementException("Invalid column: " + name);
        return Utils.cast(columns[index]);
    }
    
    /**
     * Returns an unmodifiable view of the header columns.
     *
     * @return the header columns
     */
    public List<Column<?>> columns() {
        return Collections.unmodifiableList(Arrays.asList(columns));
    }
    
    /**
     * Returns the number of columns in this header.
     *
     * @return the number of columns in this header
     */
    public int size() {
        return columns.length;
    }
    
    /**
     * Returns {@code true} if and only if the given object is a header containing the same columns in the same order as
     * this header.
     *
     * @param o the object to be compared for equality with this header
     * @return {@code true} if the given object is equal to this header
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Header))
            return false;
        return Arrays.equals(columns, ((Header) o).columns);
    }
    
    /**
     * Returns the hash code value for this header. The hash code of a header is derived from the hash codes of each of
     * its columns.
     *
     * @return the hash code value for this header
     */
    @Override
    public int hashCode() {
        return Arrays.hashCode(columns);
    }
    
    /**
     * Returns a string representation of this header. The string representation consists of the characters
     * {@code "Header"}, followed by the string representation of the header {@link #columns()}.
     *
     * @return a string representation of this header
     */
    @Override
    public String toString() {
        return "Header" + Arrays.toString(columns);
    }
}
