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

/**
 * Classes to summarize lists of records into pivot tables: records are grouped by the values of some fields into rows
 * and columns, and the values of other fields are aggregated into the cells. For example:
 *
 * <pre>{@code
 *     PivotEngine engine = new PivotEngine(new ExecutorEventLoop());
 *     engine.setItemsSource(sales);   // List<Map<String, Object>> with region, city, product, amount
 *     engine.deferUpdate(e -> {
 *         e.rowFields().addAll("Region", "City");
 *         e.columnFields().add("Product");
 *         e.valueFields().add("Amount");
 *     });
 *     PivotView view = engine.pivotView();
 * }</pre>
 *
 * <h2><a id="Fields">Fields and Field Lists</a></h2>
 *
 * <p>A {@code PivotField} is bound to a property path of the source records, and describes how the values of that
 * property are formatted, sorted, filtered and aggregated. Every engine owns a catalog of fields, usually generated from
 * the first source record, and four role lists: row fields, column fields, value fields and filter fields. A field takes
 * part in the view by being added to a role list. A field is in at most one role list at a time; to summarize a
 * property several ways, add copies of its field to the value list.
 *
 * <h2><a id="Keys">Keys and Tallies</a></h2>
 *
 * <p>Each output row and column is identified by a {@code PivotKey}: the formatted values of the first few row (or
 * column) fields, plus, for columns, the value field the column summarizes. Keys that take fewer than all fields into
 * account represent subtotals, and the key that takes no fields represents the grand total. Records are grouped by
 * formatted values, so values that display identically fall into the same row or column.
 *
 * <p>Each cell is computed from a {@code Tally}, a mergeable accumulator of counts, sums, sums of squares and extremes,
 * from which every {@code Aggregate} is derived.
 *
 * <h2><a id="Views">Views, Headers, and Records</a></h2>
 *
 * <p>The output {@code PivotView} is an ordered list of {@code Record}s sharing a {@code Header}. The first column of
 * the header, {@code Column.ROW_KEY}, holds each row's key; each further column is named by the canonical string of its
 * column key. The engine replaces the contents of the view as a whole after each tabulation, and never exposes a
 * partially tabulated view.
 *
 * <h2><a id="Scheduling">Scheduling</a></h2>
 *
 * <p>Engines are single-threaded, and run their deferred work on an {@code EventLoop}. Field and list changes are
 * debounced into one tabulation; long scans yield to the loop between slices. {@code ManualEventLoop} runs deferred
 * work on demand, against a virtual clock, and {@code ExecutorEventLoop} runs it on a dedicated thread.
 */
package io.avery.pivot;
