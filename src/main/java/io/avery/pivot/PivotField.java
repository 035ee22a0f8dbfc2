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
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A property of the source records, used to group records into rows and columns, to summarize values, or to filter
 * records. A field is bound to a property path of the source records, and carries the settings that describe how its
 * values are formatted, sorted and aggregated.
 *
 * <p>Every field belongs to a {@link PivotEngine engine}. Fields are made part of a pivot view by adding them to one of
 * the engine's role lists: {@link PivotEngine#rowFields() rows}, {@link PivotEngine#columnFields() columns},
 * {@link PivotEngine#valueFields() values} or {@link PivotEngine#filterFields() filters}. Changing a property of a
 * field notifies its {@link Listener listeners} and the engine, which updates the output view as needed.
 *
 * <p>Fields use default object {@code equals()} and {@code hashCode()}. That is, two fields are only equal if they are
 * the same object.
 */
public final class PivotField {
    /**
     * Receives notifications of changes to field properties.
     */
    @FunctionalInterface
    public interface Listener {
        /**
         * Invoked after a property of the given field changed.
         *
         * @param field the field
         * @param property the property that changed
         */
        void propertyChanged(PivotField field, FieldProperty property);
    }
    
    private final PivotEngine engine;
    private final PivotFilter filter;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private Binding binding;
    private String header;
    private DataType dataType;
    private Aggregate aggregate = Aggregate.SUM;
    private ShowAs showAs = ShowAs.NO_CALCULATION;
    private PivotField weightField;
    private String format = "";
    private Integer width;
    private boolean wordWrap;
    private boolean descending;
    private boolean contentHtml;
    private PivotField parentField;
    boolean autoGenerated;
    
    /**
     * Creates a new field bound to the given property path, with a header derived from the binding (for example,
     * {@code "unitPrice"} yields {@code "Unit Price"}). The field is not added to the engine's field list.
     *
     * @param engine the engine that owns the field
     * @param binding the property path the field is bound to
     */
    public PivotField(PivotEngine engine, String binding) {
        this(engine, binding, null);
    }
    
    /**
     * Creates a new field bound to the given property path, with the given header. The field is not added to the
     * engine's field list.
     *
     * @param engine the engine that owns the field
     * @param binding the property path the field is bound to
     * @param header the header, or {@code null} to derive the header from the binding
     */
    public PivotField(PivotEngine engine, String binding, String header) {
        this.engine = Objects.requireNonNull(engine);
        this.binding = new Binding(Objects.requireNonNull(binding));
        this.header = header != null && !header.isEmpty() ? header : Utils.toHeaderCase(binding);
        this.filter = new PivotFilter(this);
        Map<String, ?> first = engine.firstItem();
        if (first != null)
            this.dataType = DataType.of(this.binding.getValue(first));
    }
    
    // --- properties ---
    
    public PivotEngine engine() {
        return engine;
    }
    
    public String getBinding() {
        return binding.path();
    }
    
    /**
     * Sets the property path this field is bound to. If the field has no data type yet, the type is inferred from the
     * first source record.
     *
     * @param binding the property path
     * @return this field
     */
    public PivotField setBinding(String binding) {
        Objects.requireNonNull(binding);
        if (!binding.equals(this.binding.path())) {
            this.binding = new Binding(binding);
            if (dataType == null) {
                Map<String, ?> first = engine.firstItem();
                if (first != null)
                    dataType = DataType.of(this.binding.getValue(first));
            }
            propertyChanged(FieldProperty.BINDING);
        }
        return this;
    }
    
    public String getHeader() {
        return header;
    }
    
    /**
     * Sets the header that identifies this field. Headers must be non-empty and unique among the engine's fields.
     *
     * @param header the header
     * @return this field
     * @throws IllegalArgumentException if the header is empty or already used by another field of the engine
     */
    public PivotField setHeader(String header) {
        if (header == null || header.isEmpty())
            throw new IllegalArgumentException("Field headers must be non-empty");
        PivotField other = engine.fields().getField(header);
        if (other != null && other != this)
            throw new IllegalArgumentException("Field headers must be unique: " + header);
        if (!header.equals(this.header)) {
            this.header = header;
            propertyChanged(FieldProperty.HEADER);
        }
        return this;
    }
    
    public DataType getDataType() {
        return dataType;
    }
    
    public PivotField setDataType(DataType dataType) {
        if (dataType != this.dataType) {
            this.dataType = dataType;
            propertyChanged(FieldProperty.DATA_TYPE);
        }
        return this;
    }
    
    public Aggregate getAggregate() {
        return aggregate;
    }
    
    public PivotField setAggregate(Aggregate aggregate) {
        Objects.requireNonNull(aggregate);
        if (aggregate != this.aggregate) {
            this.aggregate = aggregate;
            propertyChanged(FieldProperty.AGGREGATE);
        }
        return this;
    }
    
    public ShowAs getShowAs() {
        return showAs;
    }
    
    public PivotField setShowAs(ShowAs showAs) {
        Objects.requireNonNull(showAs);
        if (showAs != this.showAs) {
            this.showAs = showAs;
            propertyChanged(FieldProperty.SHOW_AS);
        }
        return this;
    }
    
    public PivotField getWeightField() {
        return weightField;
    }
    
    /**
     * Sets the field used to weigh the values of this field when computing sums, averages, and other statistics over
     * the numeric values. Weights never affect counts or extremes. {@code null} gives every value a weight of one.
     * Records whose weight is not numeric are given a weight of one.
     *
     * @param weightField the weight field, or {@code null}
     * @return this field
     * @throws IllegalArgumentException if the weight field belongs to another engine, or has a non-numeric data type
     */
    public PivotField setWeightField(PivotField weightField) {
        if (weightField != null) {
            if (weightField.engine != engine)
                throw new IllegalArgumentException("Weight field belongs to another engine: " + weightField);
            if (weightField.dataType != null && weightField.dataType != DataType.NUMBER)
                throw new IllegalArgumentException("Weight field must be numeric: " + weightField);
        }
        if (weightField != this.weightField) {
            this.weightField = weightField;
            propertyChanged(FieldProperty.WEIGHT_FIELD);
        }
        return this;
    }
    
    public String getFormat() {
        return format;
    }
    
    public PivotField setFormat(String format) {
        String next = format == null ? "" : format;
        if (!next.equals(this.format)) {
            this.format = next;
            propertyChanged(FieldProperty.FORMAT);
        }
        return this;
    }
    
    /**
     * Returns the preferred display width of this field, or {@code null} if there is none.
     *
     * @return the preferred width, or {@code null}
     */
    public Integer getWidth() {
        return width;
    }
    
    public PivotField setWidth(Integer width) {
        if (width != null && width < 0)
            throw new IllegalArgumentException("Width must be non-negative; was: " + width);
        if (!Objects.equals(width, this.width)) {
            this.width = width;
            propertyChanged(FieldProperty.WIDTH);
        }
        return this;
    }
    
    public boolean isWordWrap() {
        return wordWrap;
    }
    
    public PivotField setWordWrap(boolean wordWrap) {
        if (wordWrap != this.wordWrap) {
            this.wordWrap = wordWrap;
            propertyChanged(FieldProperty.WORD_WRAP);
        }
        return this;
    }
    
    /**
     * Returns {@code true} if keys are sorted in descending order of this field's values.
     *
     * @return {@code true} if this field sorts descending
     */
    public boolean isDescending() {
        return descending;
    }
    
    public PivotField setDescending(boolean descending) {
        if (descending != this.descending) {
            this.descending = descending;
            propertyChanged(FieldProperty.DESCENDING);
        }
        return this;
    }
    
    public boolean isContentHtml() {
        return contentHtml;
    }
    
    public PivotField setContentHtml(boolean contentHtml) {
        if (contentHtml != this.contentHtml) {
            this.contentHtml = contentHtml;
            propertyChanged(FieldProperty.CONTENT_HTML);
        }
        return this;
    }
    
    public PivotFilter filter() {
        return filter;
    }
    
    /**
     * Returns the field this field was copied from, or {@code null} if it is not a copy. Copies let the same binding
     * be summarized several ways in the value list.
     *
     * @return the parent field, or {@code null}
     * @see PivotEngine#addValueFieldCopy(PivotField)
     */
    public PivotField getParentField() {
        return parentField;
    }
    
    /**
     * Returns {@code true} if this field was generated from the source records, or loaded from a view definition.
     * Such fields are replaced when fields are generated again.
     *
     * @return {@code true} if this field was generated
     */
    public boolean isAutoGenerated() {
        return autoGenerated;
    }
    
    /**
     * Returns {@code true} if a field with this field's binding is in one of the engine's role lists.
     *
     * @return {@code true} if this field is used by the current view
     */
    public boolean isActive() {
        return engine.isActive(this);
    }
    
    /**
     * Adds this field to the view, or removes it (and any copies of it) from the view. Numeric fields are added to the
     * value list, other fields to the row list.
     *
     * @param active whether the field should be part of the view
     * @return this field
     */
    public PivotField setActive(boolean active) {
        engine.setActive(this, active);
        return this;
    }
    
    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }
    
    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }
    
    // --- values ---
    
    /**
     * Returns the value of this field in the given source record, raw or formatted.
     *
     * @param item the source record
     * @param formatted whether to format the value using this field's format
     * @return the raw value, or its formatted string
     */
    public Object getValue(Map<String, ?> item, boolean formatted) {
        Object value = binding.getValue(item);
        return !formatted || value instanceof String ? value : Formats.format(value, format);
    }
    
    /**
     * Returns the formatted value of this field in the given source record. Missing values format as the empty string.
     *
     * @param item the source record
     * @return the formatted value
     */
    public String formattedValue(Map<String, ?> item) {
        return Formats.format(binding.getValue(item), format);
    }
    
    Number weight(Map<String, ?> item) {
        if (weightField == null)
            return null;
        Object value = weightField.getValue(item, false);
        return Utils.isNumber(value) ? (Number) value : null;
    }
    
    String name() {
        return header != null && !header.isEmpty() ? header : binding.path();
    }
    
    /**
     * Creates a copy of this field with the same binding and settings, a unique header, and this field as its parent.
     */
    PivotField copy() {
        PivotField copy = new PivotField(engine, binding.path(), header);
        copy.dataType = dataType;
        copy.format = format;
        copy.width = width;
        copy.wordWrap = wordWrap;
        copy.aggregate = aggregate;
        copy.showAs = showAs;
        copy.descending = descending;
        copy.contentHtml = contentHtml;
        copy.autoGenerated = true;
        copy.parentField = this;
        String base = header.replaceAll("\\d+$", "");
        for (int i = 2; ; i++) {
            String candidate = base + i;
            if (engine.fields().getField(candidate) == null) {
                copy.header = candidate;
                break;
            }
        }
        return copy;
    }
    
    void propertyChanged(FieldProperty property) {
        for (Listener listener : listeners)
            listener.propertyChanged(this, property);
        engine.onFieldPropertyChanged(this, property);
    }
    
    /**
     * Returns the field header.
     *
     * @return the field header
     */
    @Override
    public String toString() {
        return name();
    }
}
