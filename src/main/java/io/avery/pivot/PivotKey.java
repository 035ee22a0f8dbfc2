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
 * Identifies one row or one column of the output view: a combination of {@link PivotField field} values, plus (for
 * columns) the value field summarized in that column.
 *
 * <p>A key takes the first {@link #fieldCount()} fields of its field list into account. A key that takes fewer fields
 * than the list holds represents a subtotal; a key that takes no fields represents the grand total. For example, with
 * row fields {@code [Country, City]}, the key {@code Country:UK;City:London} identifies a data row, the key
 * {@code Country:UK} the subtotal row for the UK, and the empty key the grand total row.
 *
 * <p>Two keys are equal if they belong to the same field list, take the same number of fields, represent the same value
 * field, and have the same <em>formatted</em> values. Distinct raw values that format identically fall into the same
 * key. Keys are ordered by their values (see {@link #compareTo}).
 */
public final class PivotKey implements Comparable<PivotKey> {
    /** Value returned by {@link #getValue} for the fields of a grand total key. */
    public static final String GRAND_TOTAL = "Grand Total";
    /** Value returned by {@link #getValue} for the fields a subtotal key does not take into account. */
    public static final String SUBTOTAL = "Subtotal";
    
    private final PivotFieldList owner;
    private final PivotField[] fields;
    private final int fieldCount;
    private final PivotField valueField;
    private final int valueFieldIndex;
    private final Map<String, ?> item;
    private final String[] formatted;
    private final int hash;
    private List<Object> values;
    private String key;
    
    /**
     * @param owner the field list the key belongs to
     * @param fields a snapshot of the fields in the owner list
     * @param fieldCount the number of fields taken into account
     * @param valueFields a snapshot of the value fields, or {@code null} for row keys
     * @param valueFieldIndex the index of the value field represented by the key, or {@code -1}
     * @param item the first source record represented by the key
     */
    PivotKey(PivotFieldList owner, PivotField[] fields, int fieldCount, PivotField[] valueFields, int valueFieldIndex,
             Map<String, ?> item) {
        this.owner = owner;
        this.fields = fields;
        this.fieldCount = fieldCount;
        this.valueField = valueFields != null && valueFieldIndex > -1 ? valueFields[valueFieldIndex] : null;
        this.valueFieldIndex = valueField != null ? valueFieldIndex : -1;
        this.item = item;
        this.formatted = new String[fieldCount];
        for (int i = 0; i < fieldCount; i++)
            formatted[i] = fields[i].formattedValue(item);
        this.hash = 31 * Arrays.hashCode(formatted) + 17 * fieldCount + this.valueFieldIndex;
    }
    
    /**
     * Returns the field list this key belongs to.
     *
     * @return the field list this key belongs to
     */
    public PivotFieldList owner() {
        return owner;
    }
    
    /**
     * Returns the number of fields this key takes into account.
     *
     * @return the number of fields this key takes into account
     */
    public int fieldCount() {
        return fieldCount;
    }
    
    /**
     * Returns the value field this key represents, or {@code null} for row keys.
     *
     * @return the value field, or {@code null}
     */
    public PivotField valueField() {
        return valueField;
    }
    
    /**
     * Returns the position of this key's value field in the value list, or {@code -1} for row keys.
     *
     * @return the value field index, or {@code -1}
     */
    public int valueFieldIndex() {
        return valueFieldIndex;
    }
    
    /**
     * Returns the aggregate of this key's value field.
     *
     * @return the aggregate of this key's value field
     * @throws IllegalStateException if this key does not represent a value field
     */
    public Aggregate aggregate() {
        if (valueField == null)
            throw new IllegalStateException("Aggregate not available for key: " + this);
        return valueField.getAggregate();
    }
    
    /**
     * Returns an unmodifiable list of the raw values that define this key, one per field taken into account. The
     * values are taken from the first source record that produced this key.
     *
     * @return the raw values of this key
     */
    public List<Object> values() {
        if (values == null) {
            Object[] arr = new Object[fieldCount];
            for (int i = 0; i < fieldCount; i++)
                arr[i] = fields[i].getValue(item, false);
            values = Collections.unmodifiableList(Arrays.asList(arr));
        }
        return values;
    }
    
    /**
     * Returns the value of this key for the field at the given index, raw or formatted. Grand total keys return
     * {@link #GRAND_TOTAL}; fields past the end of a subtotal key return {@link #SUBTOTAL}.
     *
     * @param index the index of the field
     * @param formatted whether to format the value using the field's format
     * @return the value for the field at the given index
     */
    public Object getValue(int index, boolean formatted) {
        if (fieldCount == 0)
            return GRAND_TOTAL;
        if (index > fieldCount - 1)
            return SUBTOTAL;
        Object value = values().get(index);
        return formatted && !(value instanceof String) ? Formats.format(value, fields[index].getFormat()) : value;
    }
    
    /**
     * Returns {@code true} if the formatted values of the given source record match the formatted values of this key,
     * for every field this key takes into account. Raw values that differ, but format identically, match.
     *
     * @param item the source record
     * @return {@code true} if the record belongs to this key
     */
    public boolean matchesItem(Map<String, ?> item) {
        for (int i = 0; i < fieldCount; i++)
            if (!formatted[i].equals(fields[i].formattedValue(item)))
                return false;
        return true;
    }
    
    /**
     * Compares this key to another key of the same field list.
     *
     * <p>Keys are compared by their values at each depth in turn, in descending order for fields that sort descending.
     * Nulls sort after all other values, in either direction. Dates formatted with a custom format are compared only
     * on the calendar fields the format displays. Keys with equal values and the same length are ordered by the
     * position of their value fields. Finally, a shorter key (a total) sorts after a longer key with the same prefix,
     * or before it if the engine shows {@link PivotEngine#isTotalsBeforeData() totals before data}.
     *
     * @param other the key to compare to
     * @return a negative integer, zero, or a positive integer as this key sorts before, with, or after the other key
     * @throws IllegalArgumentException if the keys belong to different field lists
     */
    @Override
    public int compareTo(PivotKey other) {
        Objects.requireNonNull(other);
        if (other.owner != owner)
            throw new IllegalArgumentException("Cannot compare keys of different field lists: " + this + ", " + other);
        List<Object> vals = values();
        List<Object> otherVals = other.values();
        int count = Math.min(vals.size(), otherVals.size());
        for (int i = 0; i < count; i++) {
            Object a = vals.get(i);
            Object b = otherVals.get(i);
            if (a == null || b == null) {
                if (a == b)
                    continue;
                return a == null ? 1 : -1; // nulls at the bottom
            }
            PivotField field = fields[i];
            int cmp;
            if (Utils.isDate(a) && Utils.isDate(b) && !Formats.isChronologicalDateFormat(field.getFormat()))
                cmp = Formats.compareDates(a, b, field.getFormat());
            else
                cmp = Utils.valuesEqual(a, b) ? 0 : Utils.VALUE_COMPARATOR.compare(a, b);
            if (cmp != 0)
                return field.isDescending() ? -cmp : cmp;
        }
        if (vals.size() == otherVals.size()) {
            int cmp = Integer.compare(valueFieldIndex, other.valueFieldIndex);
            if (cmp != 0)
                return cmp;
        }
        int cmp = Integer.compare(otherVals.size(), vals.size());
        return owner.engine().isTotalsBeforeData() ? -cmp : cmp;
    }
    
    /**
     * Returns {@code true} if and only if the given object is a key of the same field list, taking the same number of
     * fields into account, representing the same value field, with the same formatted values as this key.
     *
     * @param o the object to be compared for equality with this key
     * @return {@code true} if the given object is equal to this key
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PivotKey))
            return false;
        PivotKey other = (PivotKey) o;
        return owner == other.owner
            && fieldCount == other.fieldCount
            && valueFieldIndex == other.valueFieldIndex
            && hash == other.hash
            && Arrays.equals(formatted, other.formatted);
    }
    
    @Override
    public int hashCode() {
        return hash;
    }
    
    /**
     * Returns the canonical string of this key, used as the binding of output columns. The string consists of a
     * {@code name:value;} pair for each field taken into account, followed by {@code name:0;} for the value field,
     * or by {@code {total}} for row keys.
     *
     * @return the canonical string of this key
     */
    @Override
    public String toString() {
        if (key == null) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < fieldCount; i++)
                sb.append(fields[i].name()).append(':').append(formatted[i]).append(';');
            if (valueField != null)
                sb.append(valueField.name()).append(":0;");
            else
                sb.append("{total}");
            key = sb.toString();
        }
        return key;
    }
}
