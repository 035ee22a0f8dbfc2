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
import java.util.function.Predicate;

/**
 * An ordered list of {@link PivotField fields} owned by a {@link PivotEngine engine}. An engine owns one catalog of all
 * its fields, and four role lists that define the pivot view: rows, columns, values and filters.
 *
 * <p>Headers are unique within a list. The role lists follow further rules, applied whenever a field is added:
 * <ul>
 *     <li>a field must be in the engine's catalog before it can be added to a role list;</li>
 *     <li>a field appears in at most one role list - adding it to one list removes it from the others;</li>
 *     <li>if the list has a {@link #setMaxItems maximum size}, fields are evicted from the end of the list to honor
 *     it, keeping the field just added.</li>
 * </ul>
 * Additions that break these rules are rejected, leaving the list unchanged. Every change to a list is reported to
 * the engine, which re-tabulates the view.
 */
public final class PivotFieldList implements Iterable<PivotField> {
    private final PivotEngine engine;
    private final String name;
    private final List<PivotField> fields = new ArrayList<>();
    private Integer maxItems;
    
    PivotFieldList(PivotEngine engine, String name) {
        this.engine = engine;
        this.name = name;
    }
    
    public PivotEngine engine() {
        return engine;
    }
    
    /**
     * Returns the field with the given header, or {@code null} if this list contains no such field.
     *
     * @param header the header to search for
     * @return the field with the given header, or {@code null}
     */
    public PivotField getField(String header) {
        for (PivotField field : fields)
            if (field.getHeader().equals(header))
                return field;
        return null;
    }
    
    public PivotField get(int index) {
        return fields.get(index);
    }
    
    public int size() {
        return fields.size();
    }
    
    public boolean isEmpty() {
        return fields.isEmpty();
    }
    
    public int indexOf(PivotField field) {
        return fields.indexOf(field);
    }
    
    public boolean contains(PivotField field) {
        return fields.contains(field);
    }
    
    /**
     * Returns an unmodifiable view of the fields in this list.
     *
     * @return the fields in this list
     */
    public List<PivotField> fields() {
        return Collections.unmodifiableList(fields);
    }
    
    @Override
    public Iterator<PivotField> iterator() {
        return fields().iterator();
    }
    
    /**
     * Returns the maximum number of fields this list may hold, or {@code null} if the list is unbounded.
     *
     * @return the maximum size, or {@code null}
     */
    public Integer getMaxItems() {
        return maxItems;
    }
    
    /**
     * Sets the maximum number of fields this list may hold, evicting fields from the end of the list if it is already
     * longer. {@code null} removes the bound.
     *
     * @param maxItems the maximum size, or {@code null}
     * @return this list
     */
    public PivotFieldList setMaxItems(Integer maxItems) {
        if (maxItems != null && maxItems < 0)
            throw new IllegalArgumentException("maxItems must be non-negative; was: " + maxItems);
        this.maxItems = maxItems;
        if (maxItems != null && fields.size() > maxItems) {
            while (fields.size() > maxItems)
                fields.remove(fields.size() - 1);
            engine.onFieldListChanged(this, null);
        }
        return this;
    }
    
    /**
     * Appends a field to this list.
     *
     * @param field the field to add
     * @return {@code true} if the field is in this list after the call
     * @throws IllegalArgumentException if this is the engine's catalog and the field belongs to another engine, or has
     * the same header as a field already in the catalog
     */
    public boolean add(PivotField field) {
        return insert(fields.size(), field);
    }
    
    /**
     * Appends a field to this list, by header. For the engine's catalog, a new field bound to the given string is
     * created. For a role list, the field with the given header is looked up in the catalog.
     *
     * @param header the header (or binding, for the catalog) of the field to add
     * @return {@code true} if the field is in this list after the call
     */
    public boolean add(String header) {
        Objects.requireNonNull(header);
        if (this == engine.fields())
            return add(new PivotField(engine, header));
        PivotField field = engine.fields().getField(header);
        if (field == null) {
            engine.rejected(this, header, "not in the field list");
            return false;
        }
        return add(field);
    }
    
    /**
     * Appends each of the given fields to this list, by header.
     *
     * @param headers the headers of the fields to add
     * @return this list
     * @see #add(String)
     */
    public PivotFieldList addAll(String... headers) {
        for (String header : headers)
            add(header);
        return this;
    }
    
    /**
     * Inserts a field into this list at the given position.
     *
     * @param index the position at which to insert the field
     * @param field the field to insert
     * @return {@code true} if the field is in this list after the call
     * @throws IndexOutOfBoundsException if the index is out of range
     * @throws IllegalArgumentException if this is the engine's catalog and the field belongs to another engine, or has
     * the same header as a field already in the catalog
     */
    public boolean insert(int index, PivotField field) {
        Objects.requireNonNull(field);
        if (index < 0 || index > fields.size())
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + fields.size());
        if (field.engine() != engine)
            throw new IllegalArgumentException("Field belongs to another engine: " + field);
        if (getField(field.getHeader()) != null) {
            if (this == engine.fields())
                throw new IllegalArgumentException("Field headers must be unique: " + field.getHeader());
            engine.rejected(this, field.getHeader(), "duplicate header");
            return false;
        }
        fields.add(index, field);
        engine.onFieldListChanged(this, field);
        return fields.contains(field);
    }
    
    /**
     * Moves a field of this list to the given position.
     *
     * @param field the field to move
     * @param index the new position of the field
     * @return {@code true} if the field was moved
     */
    public boolean move(PivotField field, int index) {
        int from = fields.indexOf(field);
        if (from < 0 || index < 0 || index >= fields.size())
            return false;
        if (from != index) {
            fields.add(index, fields.remove(from));
            engine.onFieldListChanged(this, null);
        }
        return true;
    }
    
    /**
     * Removes a field from this list. Removing a field from the engine's catalog also removes it from the role lists.
     *
     * @param field the field to remove
     * @return {@code true} if the field was in this list
     */
    public boolean remove(PivotField field) {
        int index = fields.indexOf(field);
        if (index < 0)
            return false;
        removeAt(index);
        return true;
    }
    
    public PivotField removeAt(int index) {
        PivotField field = fields.remove(index);
        if (this == engine.fields())
            for (PivotFieldList list : engine.viewLists())
                list.removeSilently(field);
        engine.onFieldListChanged(this, null);
        return field;
    }
    
    /**
     * Removes all fields from this list. Clearing the engine's catalog also clears the role lists.
     */
    public void clear() {
        if (fields.isEmpty())
            return;
        fields.clear();
        if (this == engine.fields())
            for (PivotFieldList list : engine.viewLists())
                list.fields.clear();
        engine.onFieldListChanged(this, null);
    }
    
    // Used while enforcing list rules; the caller reports the change
    boolean removeSilently(PivotField field) {
        return fields.remove(field);
    }
    
    void removeSilentlyIf(Predicate<PivotField> predicate) {
        fields.removeIf(predicate);
    }
    
    void evictToMaxItems(PivotField keep) {
        if (maxItems == null)
            return;
        while (fields.size() > maxItems) {
            int index = fields.size() - 1;
            if (fields.get(index) == keep && index > 0)
                index--;
            fields.remove(index);
        }
    }
    
    PivotField[] toArray() {
        return fields.toArray(new PivotField[0]);
    }
    
    /**
     * Returns a string representation of this list: its name followed by the headers of its fields.
     *
     * @return a string representation of this list
     */
    @Override
    public String toString() {
        return name + fields;
    }
}
