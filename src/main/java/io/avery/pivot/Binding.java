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
import java.util.Objects;

/**
 * A property path into a source record, such as {@code "amount"} or {@code "customer.address.city"}. Records are maps
 * from property names to values. Each path segment but the last must resolve to a nested map; a path that cannot be
 * resolved yields {@code null}.
 */
final class Binding {
    private final String path;
    private final String[] segments;
    
    Binding(String path) {
        this.path = Objects.requireNonNull(path);
        this.segments = path.split("\\.", -1);
    }
    
    String path() {
        return path;
    }
    
    Object getValue(Map<String, ?> item) {
        if (item == null)
            return null;
        if (segments.length == 1)
            return item.get(path);
        Object value = item;
        for (String segment : segments) {
            if (!(value instanceof Map))
                return null;
            value = ((Map<?, ?>) value).get(segment);
        }
        return value;
    }
    
    @Override
    public String toString() {
        return path;
    }
}
