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

import java.util.Locale;

/**
 * A filter that admits values satisfying one or two {@link Condition conditions}, combined with AND or OR. A condition
 * without an operator is inactive and does not take part in the filter.
 */
public final class ConditionFilter {
    /**
     * Comparison operators available to a {@link Condition}. The text operators compare formatted values, ignoring
     * case.
     */
    public enum Operator {
        EQ, NE, GT, GE, LT, LE, BEGINS_WITH, ENDS_WITH, CONTAINS, NOT_CONTAINS
    }
    
    /**
     * An operator and the value to compare against.
     */
    public final class Condition {
        private Operator operator;
        private Object value;
        
        Condition() {}
        
        public Operator getOperator() {
            return operator;
        }
        
        public Condition setOperator(Operator operator) {
            if (this.operator != operator) {
                this.operator = operator;
                owner.changed();
            }
            return this;
        }
        
        public Object getValue() {
            return value;
        }
        
        public Condition setValue(Object value) {
            if (!Utils.valuesEqual(this.value, value)) {
                this.value = value;
                owner.changed();
            }
            return this;
        }
        
        /**
         * Returns {@code true} if this condition has an operator.
         *
         * @return {@code true} if this condition is active
         */
        public boolean isActive() {
            return operator != null;
        }
        
        boolean apply(Object raw, String formatted) {
            switch (operator) {
                case BEGINS_WITH: return lower(formatted).startsWith(lower(text(value)));
                case ENDS_WITH: return lower(formatted).endsWith(lower(text(value)));
                case CONTAINS: return lower(formatted).contains(lower(text(value)));
                case NOT_CONTAINS: return !lower(formatted).contains(lower(text(value)));
                case EQ: return matches(raw, formatted);
                case NE: return !matches(raw, formatted);
                default: break;
            }
            if (raw == null || value == null)
                return false;
            Integer cmp = compare(raw, value);
            if (cmp == null)
                return false;
            switch (operator) {
                case GT: return cmp > 0;
                case GE: return cmp >= 0;
                case LT: return cmp < 0;
                case LE: return cmp <= 0;
                default: throw new AssertionError(operator);
            }
        }
        
        private boolean matches(Object raw, String formatted) {
            if (raw == null || value == null)
                return raw == value;
            if (raw instanceof String || value instanceof String)
                return formatted.equalsIgnoreCase(text(value));
            Integer cmp = compare(raw, value);
            return cmp != null ? cmp == 0 : raw.equals(value);
        }
        
        private Integer compare(Object raw, Object target) {
            if (raw instanceof String && target instanceof String)
                return ((String) raw).compareToIgnoreCase((String) target);
            if (raw instanceof Number && target instanceof String) {
                try {
                    target = Double.valueOf(((String) target).trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            if (raw instanceof Number && target instanceof Number)
                return Double.compare(((Number) raw).doubleValue(), ((Number) target).doubleValue());
            if (raw.getClass() == target.getClass() && raw instanceof Comparable)
                return Utils.VALUE_COMPARATOR.compare(raw, target);
            return null;
        }
        
        @Override
        public String toString() {
            return operator + " " + value;
        }
    }
    
    private final PivotFilter owner;
    private final Condition condition1 = new Condition();
    private final Condition condition2 = new Condition();
    private boolean and = true;
    
    ConditionFilter(PivotFilter owner) {
        this.owner = owner;
    }
    
    public Condition condition1() {
        return condition1;
    }
    
    public Condition condition2() {
        return condition2;
    }
    
    /**
     * Returns {@code true} if both conditions must hold, {@code false} if either suffices.
     *
     * @return {@code true} if the conditions are combined with AND
     */
    public boolean isAnd() {
        return and;
    }
    
    public ConditionFilter setAnd(boolean and) {
        if (this.and != and) {
            this.and = and;
            owner.changed();
        }
        return this;
    }
    
    /**
     * Returns {@code true} if either condition is active.
     *
     * @return {@code true} if this filter is active
     */
    public boolean isActive() {
        return condition1.isActive() || condition2.isActive();
    }
    
    boolean apply(Object raw, String formatted) {
        boolean a1 = condition1.isActive();
        boolean a2 = condition2.isActive();
        if (a1 && a2)
            return and
                ? condition1.apply(raw, formatted) && condition2.apply(raw, formatted)
                : condition1.apply(raw, formatted) || condition2.apply(raw, formatted);
        if (a1)
            return condition1.apply(raw, formatted);
        if (a2)
            return condition2.apply(raw, formatted);
        return true;
    }
    
    /**
     * Clears both conditions, without notifying the owning field.
     *
     * @return {@code true} if anything was cleared
     */
    boolean reset() {
        boolean active = isActive();
        condition1.operator = null;
        condition1.value = null;
        condition2.operator = null;
        condition2.value = null;
        and = true;
        return active;
    }
    
    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
    
    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
