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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Summarizes a list of source records into a {@link PivotView pivot view}.
 *
 * <p>An engine owns a catalog of {@link #fields() fields}, usually generated from the first source record, and four
 * role lists that define the view: {@link #rowFields() row fields} and {@link #columnFields() column fields} group the
 * records into row and column {@link PivotKey keys}, {@link #valueFields() value fields} are aggregated into the cells,
 * and {@link #filterFields() filter fields} only select records. The view is defined once there is at least one value
 * field and at least one row or column field.
 *
 * <p>Tabulation runs in two phases. A scan walks the source records, skipping records rejected by an active
 * {@link PivotFilter filter}, and accumulates a {@link Tally tally} per row key, column key and value field, including
 * the keys of subtotals and grand totals as selected by {@link #setShowRowTotals} and {@link #setShowColumnTotals}. The
 * view is then materialized from the tallies: keys are sorted, each cell takes the value field's aggregate, and
 * {@link ShowAs show-as} differences are applied. The view is replaced as a whole, and only once the scan completes.
 *
 * <p>An engine is single-threaded and runs on an {@link EventLoop event loop}. Changes to fields and lists invalidate
 * the view, and a re-tabulation is scheduled on the loop after a short debounce delay, so that several changes made in
 * a row are tabulated once. Changes bracketed by {@link #beginUpdate()} and {@link #endUpdate()} (or made inside
 * {@link #deferUpdate(Consumer)}) are tabulated once, when the bracket closes. When {@link #setAsync(boolean) async} is
 * enabled, a long scan yields to the loop between slices and reports its progress to {@link Listener listeners}; a new
 * tabulation supersedes a scan in progress.
 *
 * <p>Example:
 * <pre>{@code
 * ManualEventLoop loop = new ManualEventLoop();
 * PivotEngine engine = new PivotEngine(loop);
 * engine.setItemsSource(sales);              // generates fields: Region, City, Amount
 * engine.deferUpdate(e -> {
 *     e.rowFields().add("Region");
 *     e.valueFields().add("Amount");
 * });
 * for (Record row : engine.pivotView())
 *     System.out.println(row);
 * }</pre>
 *
 * <p>Some changes do not require a new scan: changing the width or the value-field format only refreshes the view, and
 * changing the aggregate or show-as setting of a value field regenerates the view from the tallies of the last scan.
 */
public final class PivotEngine {
    private static final Logger log = LoggerFactory.getLogger(PivotEngine.class);
    
    static final int DEFAULT_BATCH_SIZE = 10_000;
    static final long DEFAULT_BATCH_DELAY = 100;
    static final long CONTINUATION_DELAY = 0;
    static final long DEFAULT_INVALIDATE_DELAY = 10;
    
    /**
     * Receives notifications of engine activity. All methods have empty default implementations.
     */
    public interface Listener {
        /**
         * Invoked after the items source of the engine was replaced.
         *
         * @param engine the engine
         */
        default void itemsSourceChanged(PivotEngine engine) {}
        
        /**
         * Invoked after the view definition changed: an option, a field property, or the contents of a field list.
         * Not invoked while the engine is {@link #isUpdating() updating}; closing the update bracket invokes it once.
         *
         * @param engine the engine
         */
        default void viewDefinitionChanged(PivotEngine engine) {}
        
        /**
         * Invoked while the engine updates its view. A scan that yields reports the share of records scanned when it
         * resumes; materializing the view reports {@code 100}.
         *
         * @param engine the engine
         * @param progress the progress, from 0 to 100
         */
        default void updatingView(PivotEngine engine, int progress) {}
        
        /**
         * Invoked after the engine published a new view.
         *
         * @param engine the engine
         */
        default void updatedView(PivotEngine engine) {}
    }
    
    private enum Reaction { NONE, REFRESH_VIEW, REGENERATE_VIEW, INVALIDATE }
    
    private final EventLoop loop;
    private final PivotFieldList fields = new PivotFieldList(this, "fields");
    private final PivotFieldList rowFields = new PivotFieldList(this, "rowFields");
    private final PivotFieldList columnFields = new PivotFieldList(this, "columnFields");
    private final PivotFieldList valueFields = new PivotFieldList(this, "valueFields");
    private final PivotFieldList filterFields = new PivotFieldList(this, "filterFields");
    private final List<PivotFieldList> viewLists = List.of(rowFields, columnFields, valueFields, filterFields);
    private final PivotView view = new PivotView();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Runnable itemsListener = this::invalidate;
    
    private List<? extends Map<String, ?>> items;
    private ShowTotals showRowTotals = ShowTotals.GRAND_TOTALS;
    private ShowTotals showColumnTotals = ShowTotals.GRAND_TOTALS;
    private boolean totalsBeforeData;
    private boolean showZeros;
    private FilterType defaultFilterType = FilterType.BOTH;
    private boolean autoGenerateFields = true;
    private boolean async = true;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private long batchDelay = DEFAULT_BATCH_DELAY;
    private long invalidateDelay = DEFAULT_INVALIDATE_DELAY;
    
    private int updating;
    private EventLoop.Task pendingInvalidate;
    private EventLoop.Task pendingScan;
    private ScanPass pass;
    private long scanStart;
    private TallyTable table = TallyTable.EMPTY;
    private List<PivotField> activeFilterFields = List.of();
    
    /**
     * Creates an engine that runs its deferred work on a new {@link ManualEventLoop}, available from
     * {@link #eventLoop()}. Deferred work (debounced invalidation and scan continuations) only runs when the caller
     * drives that loop; {@link #refresh()} always works synchronously.
     */
    public PivotEngine() {
        this(new ManualEventLoop());
    }
    
    /**
     * Creates an engine that runs its deferred work on the given event loop.
     *
     * @param loop the event loop
     */
    public PivotEngine(EventLoop loop) {
        this.loop = Objects.requireNonNull(loop);
    }
    
    public EventLoop eventLoop() {
        return loop;
    }
    
    // --- source ---
    
    /**
     * Returns the source records, or {@code null} if none were set.
     *
     * @return the source records, or {@code null}
     */
    public List<? extends Map<String, ?>> getItemsSource() {
        return items;
    }
    
    /**
     * Sets the source records. If {@link #setAutoGenerateFields auto-generation} is enabled, the fields previously
     * generated are replaced by fields generated from the first record, and the role lists are cleared. The view is
     * then re-tabulated.
     *
     * <p>If the list is an {@link ObservableItems}, the engine invalidates its view whenever the list changes.
     *
     * @param items the source records, or {@code null}
     * @return this engine
     */
    public PivotEngine setItemsSource(List<? extends Map<String, ?>> items) {
        if (this.items != items) {
            if (this.items instanceof ObservableItems)
                ((ObservableItems) this.items).removeListener(itemsListener);
            this.items = items;
            if (items instanceof ObservableItems)
                ((ObservableItems) items).addListener(itemsListener);
            deferUpdate(engine -> {
                if (autoGenerateFields)
                    generateFields();
            });
            for (Listener listener : listeners)
                listener.itemsSourceChanged(this);
        }
        return this;
    }
    
    Map<String, ?> firstItem() {
        return items != null && !items.isEmpty() ? items.get(0) : null;
    }
    
    // --- fields ---
    
    /**
     * Returns the catalog of all fields of this engine.
     *
     * @return the field catalog
     */
    public PivotFieldList fields() {
        return fields;
    }
    
    /**
     * Returns the list of fields that group records into rows.
     *
     * @return the row field list
     */
    public PivotFieldList rowFields() {
        return rowFields;
    }
    
    /**
     * Returns the list of fields that group records into columns.
     *
     * @return the column field list
     */
    public PivotFieldList columnFields() {
        return columnFields;
    }
    
    /**
     * Returns the list of fields aggregated into the cells of the view.
     *
     * @return the value field list
     */
    public PivotFieldList valueFields() {
        return valueFields;
    }
    
    /**
     * Returns the list of fields that only filter records.
     *
     * @return the filter field list
     */
    public PivotFieldList filterFields() {
        return filterFields;
    }
    
    List<PivotFieldList> viewLists() {
        return viewLists;
    }
    
    /**
     * Returns {@code true} if the view is defined: there is at least one value field, and at least one row or column
     * field.
     *
     * @return {@code true} if the view is defined
     */
    public boolean isViewDefined() {
        return !valueFields.isEmpty() && (!rowFields.isEmpty() || !columnFields.isEmpty());
    }
    
    /**
     * Removes the given field from whichever role list holds it.
     *
     * @param field the field to remove
     * @return {@code true} if a role list held the field
     */
    public boolean removeField(PivotField field) {
        for (PivotFieldList list : viewLists)
            if (list.remove(field))
                return true;
        return false;
    }
    
    /**
     * Adds a copy of the given field to the catalog and to the value list. The copy has the same binding and settings,
     * a unique header ({@code "Sales2"}, {@code "Sales3"}, and so on), and the given field as its
     * {@link PivotField#getParentField() parent}. Copies let one property be summarized several ways.
     *
     * @param field the field to copy
     * @return the copy
     * @throws IllegalArgumentException if the field belongs to another engine
     */
    public PivotField addValueFieldCopy(PivotField field) {
        Objects.requireNonNull(field);
        if (field.engine() != this)
            throw new IllegalArgumentException("Field belongs to another engine: " + field);
        PivotField copy = field.copy();
        fields.add(copy);
        valueFields.add(copy);
        return copy;
    }
    
    boolean isActive(PivotField field) {
        for (PivotFieldList list : viewLists)
            for (PivotField f : list)
                if (f.getBinding().equals(field.getBinding()))
                    return true;
        return false;
    }
    
    void setActive(PivotField field, boolean active) {
        if (active == isActive(field))
            return;
        if (active) {
            (field.getDataType() == DataType.NUMBER ? valueFields : rowFields).add(field);
            return;
        }
        for (PivotFieldList list : viewLists)
            list.removeSilentlyIf(f -> f == field || f.getParentField() == field);
        fields.removeSilentlyIf(f -> f.getParentField() == field);
        fireViewDefinitionChanged();
        invalidate();
    }
    
    /**
     * Replaces the generated fields of the catalog with fields generated from the first source record, one per
     * property holding a scalar value, and clears the role lists. Numbers are summed and formatted {@code "n0"},
     * dates are counted and formatted {@code "d"}, other values are counted. Fields without a data type get one from
     * the first record.
     */
    private void generateFields() {
        for (PivotFieldList list : viewLists)
            list.removeSilentlyIf(f -> true);
        fields.removeSilentlyIf(f -> f.autoGenerated);
        Map<String, ?> item = firstItem();
        if (item == null)
            return;
        for (Map.Entry<String, ?> entry : item.entrySet()) {
            Object value = entry.getValue();
            if (!Utils.isScalar(value))
                continue;
            PivotField field = new PivotField(this, entry.getKey());
            if (fields.getField(field.getHeader()) != null)
                continue;
            field.autoGenerated = true;
            DataType dataType = DataType.of(value);
            field.setDataType(dataType);
            if (dataType == DataType.NUMBER) {
                field.setAggregate(Aggregate.SUM);
                field.setFormat("n0");
            } else if (dataType == DataType.DATE) {
                field.setAggregate(Aggregate.COUNT);
                field.setFormat("d");
            } else {
                field.setAggregate(Aggregate.COUNT);
            }
            fields.add(field);
        }
        for (PivotField field : fields)
            if (field.getDataType() == null)
                field.setDataType(DataType.of(field.getValue(item, false)));
        log.debug("Generated fields: {}", fields);
    }
    
    // --- options ---
    
    public ShowTotals getShowRowTotals() {
        return showRowTotals;
    }
    
    /**
     * Sets which total rows the view includes. Defaults to {@link ShowTotals#GRAND_TOTALS}.
     *
     * @param showRowTotals which total rows to include
     * @return this engine
     */
    public PivotEngine setShowRowTotals(ShowTotals showRowTotals) {
        Objects.requireNonNull(showRowTotals);
        if (this.showRowTotals != showRowTotals) {
            this.showRowTotals = showRowTotals;
            optionChanged();
        }
        return this;
    }
    
    public ShowTotals getShowColumnTotals() {
        return showColumnTotals;
    }
    
    /**
     * Sets which total columns the view includes. Defaults to {@link ShowTotals#GRAND_TOTALS}.
     *
     * @param showColumnTotals which total columns to include
     * @return this engine
     */
    public PivotEngine setShowColumnTotals(ShowTotals showColumnTotals) {
        Objects.requireNonNull(showColumnTotals);
        if (this.showColumnTotals != showColumnTotals) {
            this.showColumnTotals = showColumnTotals;
            optionChanged();
        }
        return this;
    }
    
    public boolean isTotalsBeforeData() {
        return totalsBeforeData;
    }
    
    /**
     * Sets whether totals sort before the data they summarize: above data rows, and left of data columns. Defaults to
     * {@code false}.
     *
     * @param totalsBeforeData whether totals sort before data
     * @return this engine
     */
    public PivotEngine setTotalsBeforeData(boolean totalsBeforeData) {
        if (this.totalsBeforeData != totalsBeforeData) {
            this.totalsBeforeData = totalsBeforeData;
            optionChanged();
        }
        return this;
    }
    
    public boolean isShowZeros() {
        return showZeros;
    }
    
    /**
     * Sets whether cells aggregating to zero show zero. Otherwise they are {@code null}, like cells with no records.
     * Defaults to {@code false}.
     *
     * @param showZeros whether to show zeros
     * @return this engine
     */
    public PivotEngine setShowZeros(boolean showZeros) {
        if (this.showZeros != showZeros) {
            this.showZeros = showZeros;
            optionChanged();
        }
        return this;
    }
    
    public FilterType getDefaultFilterType() {
        return defaultFilterType;
    }
    
    /**
     * Sets the filter type of filters that do not set their own. Defaults to {@link FilterType#BOTH}.
     *
     * @param defaultFilterType the default filter type
     * @return this engine
     */
    public PivotEngine setDefaultFilterType(FilterType defaultFilterType) {
        Objects.requireNonNull(defaultFilterType);
        if (this.defaultFilterType != defaultFilterType) {
            this.defaultFilterType = defaultFilterType;
            optionChanged();
        }
        return this;
    }
    
    public boolean isAutoGenerateFields() {
        return autoGenerateFields;
    }
    
    /**
     * Sets whether fields are generated from the first record when the items source is set. Defaults to {@code true}.
     *
     * @param autoGenerateFields whether to generate fields
     * @return this engine
     */
    public PivotEngine setAutoGenerateFields(boolean autoGenerateFields) {
        this.autoGenerateFields = autoGenerateFields;
        return this;
    }
    
    public boolean isAsync() {
        return async;
    }
    
    /**
     * Sets whether long scans yield to the event loop between slices. Changing this setting cancels a scan in
     * progress; the next refresh scans from the start. Defaults to {@code true}.
     *
     * @param async whether scans may yield
     * @return this engine
     */
    public PivotEngine setAsync(boolean async) {
        if (this.async != async) {
            cancelPendingUpdates();
            this.async = async;
        }
        return this;
    }
    
    public int getBatchSize() {
        return batchSize;
    }
    
    /**
     * Sets the minimum number of records a scan slice processes before it may yield. Defaults to 10,000.
     *
     * @param batchSize the batch size
     * @return this engine
     * @throws IllegalArgumentException if the batch size is less than 1
     */
    public PivotEngine setBatchSize(int batchSize) {
        if (batchSize < 1)
            throw new IllegalArgumentException("batchSize must be positive; was: " + batchSize);
        this.batchSize = batchSize;
        return this;
    }
    
    public long getBatchDelay() {
        return batchDelay;
    }
    
    /**
     * Sets the minimum time, in milliseconds, a scan slice runs before it may yield. Defaults to 100.
     *
     * @param batchDelay the batch delay
     * @return this engine
     * @throws IllegalArgumentException if the delay is negative
     */
    public PivotEngine setBatchDelay(long batchDelay) {
        if (batchDelay < 0)
            throw new IllegalArgumentException("batchDelay must be non-negative; was: " + batchDelay);
        this.batchDelay = batchDelay;
        return this;
    }
    
    public long getInvalidateDelay() {
        return invalidateDelay;
    }
    
    /**
     * Sets the debounce delay, in milliseconds, between an invalidation and the re-tabulation it schedules. Defaults
     * to 10.
     *
     * @param invalidateDelay the debounce delay
     * @return this engine
     * @throws IllegalArgumentException if the delay is negative
     */
    public PivotEngine setInvalidateDelay(long invalidateDelay) {
        if (invalidateDelay < 0)
            throw new IllegalArgumentException("invalidateDelay must be non-negative; was: " + invalidateDelay);
        this.invalidateDelay = invalidateDelay;
        return this;
    }
    
    private void optionChanged() {
        fireViewDefinitionChanged();
        invalidate();
    }
    
    // --- view definition ---
    
    /**
     * Returns the view definition as a JSON document: the options, the catalog with each field's settings and active
     * filter, and the headers of the fields in each role list.
     *
     * @return the view definition
     * @throws java.io.UncheckedIOException if the definition cannot be written
     */
    public String getViewDefinition() {
        return ViewDefinition.write(this);
    }
    
    /**
     * Replaces the options, the catalog and the role lists with those of the given view definition, as returned by
     * {@link #getViewDefinition()}, and re-tabulates the view once. The whole definition is checked before anything
     * is replaced; a rejected definition leaves the engine unchanged.
     *
     * @param json the view definition
     * @return this engine
     * @throws IllegalArgumentException if the definition is malformed
     */
    public PivotEngine setViewDefinition(String json) {
        Objects.requireNonNull(json);
        ViewDefinition.Document doc = ViewDefinition.parse(json);
        ViewDefinition.validate(this, doc);
        return deferUpdate(engine -> ViewDefinition.load(engine, doc));
    }
    
    // --- updates ---
    
    /**
     * Suspends tabulation until the matching call to {@link #endUpdate()}. Cancels a scan in progress. Brackets nest.
     */
    public void beginUpdate() {
        cancelPendingUpdates();
        updating++;
    }
    
    /**
     * Closes a bracket opened by {@link #beginUpdate()}. Closing the outermost bracket notifies listeners that the view
     * definition changed, and re-tabulates the view.
     *
     * @throws IllegalStateException if no bracket is open
     */
    public void endUpdate() {
        if (updating == 0)
            throw new IllegalStateException("endUpdate without beginUpdate");
        if (--updating == 0) {
            fireViewDefinitionChanged();
            refresh();
        }
    }
    
    /**
     * Returns {@code true} if an update bracket is open.
     *
     * @return {@code true} if an update bracket is open
     */
    public boolean isUpdating() {
        return updating > 0;
    }
    
    /**
     * Runs the given action inside an update bracket. The bracket is closed even if the action throws.
     *
     * @param action the action to run, receiving this engine
     * @return this engine
     */
    public PivotEngine deferUpdate(Consumer<PivotEngine> action) {
        Objects.requireNonNull(action);
        beginUpdate();
        try {
            action.accept(this);
        } finally {
            endUpdate();
        }
        return this;
    }
    
    /**
     * Re-tabulates the view now, unless an update bracket is open.
     */
    public void refresh() {
        refresh(false);
    }
    
    /**
     * Re-tabulates the view now.
     *
     * @param force whether to re-tabulate even while an update bracket is open
     */
    public void refresh(boolean force) {
        if (!isUpdating() || force)
            updateView();
    }
    
    /**
     * Schedules a re-tabulation after the {@link #setInvalidateDelay invalidation delay}, replacing any invalidation
     * already scheduled. Does nothing while an update bracket is open.
     */
    public void invalidate() {
        if (pendingInvalidate != null) {
            pendingInvalidate.cancel();
            pendingInvalidate = null;
        }
        if (!isUpdating()) {
            pendingInvalidate = loop.schedule(() -> {
                pendingInvalidate = null;
                refresh();
            }, invalidateDelay);
        }
    }
    
    /**
     * Cancels the continuation of a scan in progress. The current view stays in place.
     */
    public void cancelPendingUpdates() {
        if (pendingScan != null) {
            pendingScan.cancel();
            pendingScan = null;
        }
        if (pass != null) {
            log.debug("Cancelled scan at record {} of {}", pass.index(), pass.size());
            pass = null;
        }
    }
    
    /**
     * Returns {@code true} if a scan is in progress, or a re-tabulation is scheduled.
     *
     * @return {@code true} if the view is about to change
     */
    public boolean isUpdatePending() {
        return pass != null || pendingInvalidate != null;
    }
    
    // --- output ---
    
    /**
     * Returns the output view. The same view object is updated by every tabulation.
     *
     * @return the output view
     */
    public PivotView pivotView() {
        return view;
    }
    
    /**
     * Returns the number of source records scanned by the last completed scan.
     *
     * @return the number of records scanned
     */
    public long totalItemCount() {
        return table.totalCount;
    }
    
    /**
     * Returns the number of source records that passed the filters in the last completed scan.
     *
     * @return the number of records that passed the filters
     */
    public long filteredItemCount() {
        return table.filteredCount;
    }
    
    /**
     * Returns the source records summarized by a cell of the view: the records that pass the filters and belong to
     * both the row key of the given row and the column key of the given column. Records are matched on formatted
     * values.
     *
     * @param row a row of the view, or {@code null} to match all rows
     * @param binding the binding of a column of the view, or {@code null} to match all columns
     * @return the source records summarized by the cell
     */
    public List<Map<String, ?>> getDetail(Record row, String binding) {
        PivotKey rowKey = row != null ? row.rowKey() : null;
        PivotKey columnKey = binding != null ? view.columnKey(binding) : null;
        List<Map<String, ?>> detail = new ArrayList<>();
        if (items == null)
            return detail;
        for (Map<String, ?> item : items) {
            if (passesFilters(item)
                && (rowKey == null || rowKey.matchesItem(item))
                && (columnKey == null || columnKey.matchesItem(item)))
                detail.add(item);
        }
        return detail;
    }
    
    private boolean passesFilters(Map<String, ?> item) {
        for (PivotField field : activeFilterFields)
            if (!field.filter().apply(item))
                return false;
        return true;
    }
    
    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }
    
    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }
    
    // --- change handling ---
    
    /**
     * Enforces the list rules after a change to the given list, then invalidates the view.
     *
     * @param added the field just added, or {@code null} for other changes
     */
    void onFieldListChanged(PivotFieldList list, PivotField added) {
        if (added != null) {
            if (list != fields) {
                if (!fields.contains(added)) {
                    list.removeSilently(added);
                    rejected(list, added.getHeader(), "not in the field list");
                } else {
                    for (PivotFieldList other : viewLists)
                        if (other != list)
                            other.removeSilently(added);
                }
            }
            list.evictToMaxItems(added);
        }
        fireViewDefinitionChanged();
        invalidate();
    }
    
    void onFieldPropertyChanged(PivotField field, FieldProperty property) {
        fireViewDefinitionChanged();
        if (!field.isActive())
            return;
        Reaction reaction = switch (property) {
            case WIDTH, WORD_WRAP -> Reaction.REFRESH_VIEW;
            case FORMAT -> valueFields.contains(field) ? Reaction.REFRESH_VIEW : Reaction.INVALIDATE;
            case AGGREGATE, SHOW_AS -> valueFields.contains(field) && !isUpdating() && !isUpdatePending()
                ? Reaction.REGENERATE_VIEW : Reaction.NONE;
            case BINDING, HEADER, DATA_TYPE, WEIGHT_FIELD, DESCENDING, CONTENT_HTML, FILTER -> Reaction.INVALIDATE;
        };
        log.trace("{} of {} changed: {}", property, field, reaction);
        switch (reaction) {
            case REFRESH_VIEW -> view.refresh();
            case REGENERATE_VIEW -> updatePivotView();
            case INVALIDATE -> invalidate();
            case NONE -> { }
        }
    }
    
    void rejected(PivotFieldList list, String header, String reason) {
        log.debug("Rejected {} in {}: {}", header, list, reason);
    }
    
    private void fireViewDefinitionChanged() {
        if (!isUpdating())
            for (Listener listener : listeners)
                listener.viewDefinitionChanged(this);
    }
    
    // --- tabulation ---
    
    private void updateView() {
        cancelPendingUpdates();
        List<PivotField> active = new ArrayList<>();
        for (PivotFieldList list : viewLists)
            for (PivotField field : list)
                if (field.filter().isActive())
                    active.add(field);
        activeFilterFields = active;
        if (isViewDefined() && items != null) {
            ScanPass next = new ScanPass(this, items, active);
            pass = next;
            scanStart = loop.currentTimeMillis();
            log.debug("Scanning {} records: {} rows, {} columns, {} values, {} filters",
                      next.size(), rowFields.size(), columnFields.size(), valueFields.size(), active.size());
            runSlice(next);
        } else {
            table = new TallyTable(rowFields.size(), columnFields.size());
            updatePivotView();
        }
    }
    
    private void runSlice(ScanPass current) {
        if (!current.scanSlice(async, batchSize, batchDelay, loop::currentTimeMillis)) {
            log.debug("Yielding scan at record {} of {} ({}%)", current.index(), current.size(), current.progress());
            pendingScan = loop.schedule(() -> {
                pendingScan = null;
                if (pass != current)
                    return;
                fireUpdatingView(current.progress());
                runSlice(current);
            }, CONTINUATION_DELAY);
            return;
        }
        pass = null;
        table = current.table();
        log.debug("Scanned {} records ({} passed filters) into {} row keys in {} ms",
                  table.totalCount, table.filteredCount, table.tallies.size(), loop.currentTimeMillis() - scanStart);
        updatePivotView();
    }
    
    /**
     * Materializes the view from the last tally table, and publishes it.
     */
    private void updatePivotView() {
        fireUpdatingView(100);
        TallyTable t = table;
        List<PivotKey> rowKeys = new ArrayList<>(t.tallies.keySet());
        Set<PivotKey> columnSet = new LinkedHashSet<>();
        for (Map<PivotKey, Tally> row : t.tallies.values())
            columnSet.addAll(row.keySet());
        List<PivotKey> columnKeys = new ArrayList<>(columnSet);
        Collections.sort(rowKeys);
        Collections.sort(columnKeys);
        
        Object[][] cells = new Object[rowKeys.size()][columnKeys.size() + 1];
        for (int r = 0; r < rowKeys.size(); r++) {
            PivotKey rowKey = rowKeys.get(r);
            Map<PivotKey, Tally> row = t.tallies.get(rowKey);
            cells[r][0] = rowKey;
            for (int c = 0; c < columnKeys.size(); c++) {
                PivotKey columnKey = columnKeys.get(c);
                Tally tally = row.get(columnKey);
                Object value = tally != null ? tally.getAggregate(columnKey.aggregate()) : null;
                if (!showZeros && Utils.isNumber(value) && ((Number) value).doubleValue() == 0)
                    value = null;
                cells[r][c + 1] = value;
            }
        }
        new ShowAsCalculator(rowKeys, columnKeys, cells, t.rowFieldCount, t.columnFieldCount, showRowTotals,
                             showColumnTotals).apply();
        
        List<Column<?>> columns = new ArrayList<>(columnKeys.size() + 1);
        columns.add(Column.ROW_KEY);
        for (PivotKey columnKey : columnKeys)
            columns.add(new Column<>(columnKey.toString()));
        Header header = new Header(columns);
        List<Record> records = new ArrayList<>(rowKeys.size());
        for (Object[] values : cells)
            records.add(new Record(header, values));
        view.publish(header, records, columnKeys, t.rowFieldCount, t.columnFieldCount);
        
        for (Listener listener : listeners)
            listener.updatedView(this);
    }
    
    private void fireUpdatingView(int progress) {
        for (Listener listener : listeners)
            listener.updatingView(this, progress);
    }
}
