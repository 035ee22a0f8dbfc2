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

/**
 * Accumulates observations and returns aggregate statistics over them.
 *
 * <p>A tally keeps the count of non-null observations, the count of numeric (or boolean) observations, the running sum
 * and sum of squares of the numeric observations, and the smallest and largest observations. Numeric observations may
 * carry a weight, which scales the value before it enters the sum and sum of squares, but never affects the counts or
 * the extremes. Booleans contribute {@code 1} (true) or {@code 0} (false) to the sums. Other non-null values are
 * counted and take part in the extremes, but do not contribute to the sums.
 *
 * <p>Tallies can be {@link #add(Tally) merged}. Merging tallies built over partitions of a dataset yields the same
 * aggregates as tallying the whole dataset, in any order.
 */
public final class Tally {
    private long count;
    private long numericCount;
    private double sum;
    private double sumOfSquares;
    private Object min;
    private Object max;
    
    /**
     * Adds an unweighted observation to this tally. {@code null} values are ignored.
     *
     * @param value the observed value
     * @return this tally
     */
    public Tally add(Object value) {
        return add(value, null);
    }
    
    /**
     * Adds an observation to this tally. {@code null} values are ignored. If the value is numeric and the weight is
     * not {@code null}, the value is multiplied by the weight before it is added to the sums.
     *
     * @param value the observed value
     * @param weight the weight of the observation, or {@code null} for a weight of one
     * @return this tally
     */
    public Tally add(Object value, Number weight) {
        if (value == null)
            return this;
        if (value instanceof Number && Double.isNaN(((Number) value).doubleValue())) {
            count++;
            return this;
        }
        count++;
        if (min == null || Utils.VALUE_COMPARATOR.compare(value, min) < 0)
            min = value;
        if (max == null || Utils.VALUE_COMPARATOR.compare(value, max) > 0)
            max = value;
        if (value instanceof Number) {
            double v = ((Number) value).doubleValue();
            if (weight != null && !Double.isNaN(weight.doubleValue()))
                v *= weight.doubleValue();
            numericCount++;
            sum += v;
            sumOfSquares += v * v;
        }
        else if (value instanceof Boolean) {
            numericCount++;
            if ((Boolean) value) {
                sum++;
                sumOfSquares++;
            }
        }
        return this;
    }
    
    /**
     * Merges the observations of the given tally into this tally.
     *
     * @param other the tally to merge
     * @return this tally
     */
    public Tally add(Tally other) {
        count += other.count;
        numericCount += other.numericCount;
        sum += other.sum;
        sumOfSquares += other.sumOfSquares;
        if (other.min != null && (min == null || Utils.VALUE_COMPARATOR.compare(other.min, min) < 0))
            min = other.min;
        if (other.max != null && (max == null || Utils.VALUE_COMPARATOR.compare(other.max, max) > 0))
            max = other.max;
        return this;
    }
    
    /**
     * Returns the number of non-null observations in this tally.
     *
     * @return the number of non-null observations
     */
    public long count() {
        return count;
    }
    
    /**
     * Returns the given aggregate statistic over the observations in this tally, or {@code null} if there are no
     * observations.
     *
     * <p>Counts, sums, averages, ranges, variances and standard deviations are returned as {@code Double}. The
     * extremes are returned as {@code Double} when numeric, otherwise as the observed value. The range of non-numeric
     * extremes is {@code null}. Variances and standard deviations are {@code 0} when there are fewer than two numeric
     * observations.
     *
     * @param aggregate the statistic to compute
     * @return the statistic, or {@code null} if there are no observations
     */
    public Object getAggregate(Aggregate aggregate) {
        if (count == 0)
            return null;
        double avg = numericCount == 0 ? 0 : sum / numericCount;
        double varPop = numericCount <= 1 ? 0 : sumOfSquares / numericCount - avg * avg;
        double varSample = numericCount <= 1 ? 0 : varPop * numericCount / (numericCount - 1);
        return switch (aggregate) {
            case SUM -> (Object) sum;
            case COUNT -> (double) count;
            case AVG -> avg;
            case MAX -> extreme(max);
            case MIN -> extreme(min);
            case RANGE -> max instanceof Number && min instanceof Number
                ? (Object) (((Number) max).doubleValue() - ((Number) min).doubleValue())
                : null;
            case VAR_POP -> varPop;
            case STD_POP -> Math.sqrt(varPop);
            case VAR -> varSample;
            case STD -> Math.sqrt(varSample);
        };
    }
    
    private static Object extreme(Object value) {
        return value instanceof Number ? (Object) ((Number) value).doubleValue() : value;
    }
    
    @Override
    public String toString() {
        return "Tally{count=" + count + ", numericCount=" + numericCount + ", sum=" + sum + ", min=" + min + ", max="
            + max + '}';
    }
}
