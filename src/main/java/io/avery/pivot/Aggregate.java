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
 * Statistics that a value {@link PivotField field} can summarize into each output cell.
 *
 * @see Tally#getAggregate(Aggregate)
 */
public enum Aggregate {
    /** Sum of the (weighted) numeric values. */
    SUM,
    /** Count of the non-null values. */
    COUNT,
    /** Average of the (weighted) numeric values. */
    AVG,
    /** Largest value. */
    MAX,
    /** Smallest value. */
    MIN,
    /** Difference between the largest and smallest values. */
    RANGE,
    /** Sample standard deviation. */
    STD,
    /** Sample variance. */
    VAR,
    /** Population standard deviation. */
    STD_POP,
    /** Population variance. */
    VAR_POP
}
