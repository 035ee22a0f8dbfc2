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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * A filter that admits values whose formatted representation is in a set of values to show, and optionally contains a
 * filter text (ignoring case).
 */
public final class ValueFilter {
    private final PivotFilter owner;
    private Set<String> showValues;
    private String filterText;
    
    ValueFilter(PivotFilter owner) {
        this.owner = owner;
    }
    
    /**
     * Returns the formatted values this filter shows, or {@code null} if it shows all values.
     *
     * @return an unmodifiable view of the values to show, or {@code null}
     */
    public Set<String> getShowValues() {
        return showValues == null ? null : Collections.unmodifiableSet(showValues);
    }
    
    /**
     * Sets the formatted values this filter shows. {@code null} shows all values.
     *
     * @param values the values to show, or {@code null}
     * @return this filter
     */
    public ValueFilter setShowValues(Collection<String> values) {
        Set<String> next = values == null ? null : new LinkedHashSet<>(values);
        if (next == null ? showValues != null : !next.equals(showValues)) {
            showValues = next;
            owner.changed();
        }
        return this;
    }
    
    public String getFilterText() {
        return filterText;
    }
    
    public ValueFilter setFilterText(String filterText) {
        String next = filterText == null || filterText.isEmpty() ? null : filterText;
        if (next == null ? this.filterText != null : !next.equals(this.filterText)) {
            this.filterText = next;
            owner.changed();
        }
        return this;
    }
    
    /**
     * Returns {@code true} if this filter restricts the values to show, or has a filter text.
     *
     * @return {@code true} if this filter is active
     */
    public boolean isActive() {
        return showValues != null || filterText != null;
    }
    
    boolean apply(String formatted) {
        if (showValues != null && !showValues.contains(formatted))
            return false;
        return filterText == null
            || formatted.toLowerCase(Locale.ROOT).contains(filterText.toLowerCase(Locale.ROOT));
    }
    
    boolean reset() {
        boolean active = isActive();
        showValues = null;
        filterText = null;
        return active;
    }
}
