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

import java.util.Map;

/**
 * Selects the source records that take part in a pivot view, by the values of one {@link PivotField field}. A filter
 * combines a {@link ConditionFilter condition filter} and a {@link ValueFilter value filter}; its
 * {@link FilterType filter type} decides which of the two apply. Any change to the filter is reported as a
 * {@link FieldProperty#FILTER} change on its field.
 */
public final class PivotFilter {
    private final PivotField field;
    private final ConditionFilter conditionFilter;
    private final ValueFilter valueFilter;
    private FilterType filterType;
    
    PivotFilter(PivotField field) {
        this.field = field;
        this.conditionFilter = new ConditionFilter(this);
        this.valueFilter = new ValueFilter(this);
    }
    
    public PivotField field() {
        return field;
    }
    
    public ConditionFilter conditionFilter() {
        return conditionFilter;
    }
    
    public ValueFilter valueFilter() {
        return valueFilter;
    }
    
    /**
     * Returns the filter type of this filter, or the engine's default filter type if none was set.
     *
     * @return the effective filter type
     */
    public FilterType getFilterType() {
        return filterType != null ? filterType : field.engine().getDefaultFilterType();
    }
    
    /**
     * Sets the filter type of this filter, clearing the filter if the type changes. {@code null} selects the engine's
     * default filter type.
     *
     * @param filterType the filter type, or {@code null}
     * @return this filter
     */
    public PivotFilter setFilterType(FilterType filterType) {
        if (filterType != this.filterType) {
            this.filterType = filterType;
            clear();
        }
        return this;
    }
    
    /**
     * Returns {@code true} if this filter excludes any values.
     *
     * @return {@code true} if this filter is active
     */
    public boolean isActive() {
        FilterType type = getFilterType();
        return (type.usesConditions() && conditionFilter.isActive()) || (type.usesValues() && valueFilter.isActive());
    }
    
    /**
     * Returns {@code true} if the given source record passes this filter.
     *
     * @param item the source record
     * @return {@code true} if the record passes this filter
     */
    public boolean apply(Map<String, ?> item) {
        FilterType type = getFilterType();
        Object raw = field.getValue(item, false);
        String formatted = field.formattedValue(item);
        if (type.usesConditions() && conditionFilter.isActive() && !conditionFilter.apply(raw, formatted))
            return false;
        return !type.usesValues() || !valueFilter.isActive() || valueFilter.apply(formatted);
    }
    
    /**
     * Clears the conditions and values of this filter.
     */
    public void clear() {
        boolean conditionCleared = conditionFilter.reset();
        boolean valuesCleared = valueFilter.reset();
        if (conditionCleared || valuesCleared)
            changed();
    }
    
    void changed() {
        field.propertyChanged(FieldProperty.FILTER);
    }
}
