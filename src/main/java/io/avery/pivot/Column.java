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

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An identifier used to access a typed value in an output {@link Record record}. Columns are organized into record
 * {@link Header headers}, shared by all records of a {@link PivotView view}.
 *
 * <p>The first column of every view is {@link #ROW_KEY}, holding the row's {@link PivotKey}. Each further column is
 * named by the canonical string of its column key, its <em>binding</em>, and holds the aggregated value of one value
 * field.
 *
 * <p>Columns are equal if they have the same name, so views produced by separate tabulations of the same data compare
 * equal.
 *
 * @param <T> the value type of the column
 */
public final class Column<T> {
    /** The reserved column holding each row's key. */
    public static final Column<PivotKey> ROW_KEY = new Column<>("$rowKey");
    
    private final String name;
    
    /**
     * Creates a new column with the given name.
     *
     * @param name the column name
     */
    public Column(String name) {
        this.name = Objects.requireNonNull(name);
    }
    
    /**
     * Returns the column name. For value columns, this is the canonical string of the column key.
     *
     * @return the column name
     */
    public String name() {
        return name;
    }
    
    /**
     * Returns the value associated with this column in the given record, or throws {@link NoSuchElementException} if
     * the record's header does not contain this column.
     *
     * <p>This method is equivalent to {@code record.get(this)}, and is provided mainly to enable more concise method
     * references ({@code column::get}) in certain situations.
     *
     * @param record the record whose associated value for this column is to be returned
     * @return the value associated with this column
     * @throws NoSuchElementException if the record's header does not contain this column
     * @see Record#get(Column)
     */
    public T get(Record record) {
        return record.get(this);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Column))
            return false;
        return name.equals(((Column<?>) o).name);
    }
    
    @Override
    public int hashCode() {
        return name.hashCode();
    }
    
    /**
     * Returns the column name
     *
     * @return the column name
     */
    @Override
    public String toString() {
        return name;
    }
}
