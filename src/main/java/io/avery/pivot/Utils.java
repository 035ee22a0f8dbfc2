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

import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Comparator;
import java.util.Date;
import java.util.Map;

/**
 * Common utils
 */
class Utils {
    private Utils() {} // Prevent instantiation
    
    /**
     * Totally unchecked cast, for when a normal cast is illegal, but we know the cast is safe.
     */
    @SuppressWarnings("unchecked")
    static <T> T cast(Object o) {
        return (T) o;
    }
    
    /**
     * Total order across the scalar types found in source records. Nulls sort first, followed by numbers, dates,
     * booleans, strings and then any other values, in that order. Within a kind, numbers compare by value regardless
     * of boxed type, strings compare lexicographically, and other values use their natural order when both share a
     * class, else class name and then string representation.
     */
    static final Comparator<Object> VALUE_COMPARATOR = (a, b) -> {
        if (a == b)
            return 0;
        if (a == null)
            return -1;
        if (b == null)
            return 1;
        int rankA = typeRank(a);
        int rankB = typeRank(b);
        if (rankA != rankB)
            return Integer.compare(rankA, rankB);
        switch (rankA) {
            case 0:
                return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            case 2:
                return Boolean.compare((Boolean) a, (Boolean) b);
            case 3:
                return a.toString().compareTo(b.toString());
            default:
                if (a.getClass() == b.getClass() && a instanceof Comparable)
                    return Utils.<Comparable<Object>>cast(a).compareTo(b);
                int cmp = a.getClass().getName().compareTo(b.getClass().getName());
                return cmp != 0 ? cmp : String.valueOf(a).compareTo(String.valueOf(b));
        }
    };

    private static int typeRank(Object value) {
        if (value instanceof Number)
            return 0;
        if (value instanceof Date || value instanceof TemporalAccessor)
            return 1;
        if (value instanceof Boolean)
            return 2;
        if (value instanceof CharSequence || value instanceof Character)
            return 3;
        return 4;
    }
    
    /**
     * Value equality that treats numerically equal numbers of different boxed types as equal.
     */
    static boolean valuesEqual(Object a, Object b) {
        if (a == b)
            return true;
        if (a == null || b == null)
            return false;
        if (a instanceof Number && b instanceof Number)
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        return a.equals(b);
    }
    
    static boolean isNumber(Object value) {
        return value instanceof Number && !Double.isNaN(((Number) value).doubleValue());
    }
    
    static boolean isDate(Object value) {
        return value instanceof Date || value instanceof TemporalAccessor;
    }
    
    /**
     * Returns {@code true} if the value is a scalar that can be used to define a field: strings, numbers, booleans and
     * dates. Nulls, collections, maps, and arrays are not scalars.
     */
    static boolean isScalar(Object value) {
        if (value == null || value instanceof Collection || value instanceof Map || value.getClass().isArray())
            return false;
        return value instanceof CharSequence || value instanceof Number || value instanceof Boolean
            || value instanceof Character || isDate(value);
    }
    
    /**
     * Converts a binding such as {@code "unitPrice"} or {@code "order.ship_date"} into a header such as
     * {@code "Unit Price"} or {@code "Order Ship Date"}.
     */
    static String toHeaderCase(String binding) {
        StringBuilder sb = new StringBuilder(binding.length() + 4);
        boolean upperNext = true;
        char prev = 0;
        for (int i = 0; i < binding.length(); i++) {
            char c = binding.charAt(i);
            if (c == '_' || c == '.' || c == ' ') {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ' ')
                    sb.append(' ');
                upperNext = true;
            }
            else {
                if (Character.isUpperCase(c) && Character.isLowerCase(prev))
                    sb.append(' ');
                sb.append(upperNext ? Character.toUpperCase(c) : c);
                upperNext = false;
            }
            prev = c;
        }
        return sb.toString();
    }
}
