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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON view definition of an {@link PivotEngine engine}: the global options, the field catalog
 * with each field's settings and active filter, and the membership of the role lists (by header).
 */
final class ViewDefinition {
    private ViewDefinition() {} // Prevent instantiation
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String CONDITION = "condition";
    static final String VALUE = "value";
    
    // ISO date, optionally followed by a time and an offset
    private static final DateTimeFormatter ISO_DATE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .optionalEnd()
        .toFormatter();
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Document {
        public Boolean showZeros;
        public ShowTotals showRowTotals;
        public ShowTotals showColumnTotals;
        public Boolean totalsBeforeData;
        public FilterType defaultFilterType;
        public List<FieldDef> fields;
        public ListDef rowFields;
        public ListDef columnFields;
        public ListDef filterFields;
        public ListDef valueFields;
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class FieldDef {
        public String binding;
        public String header;
        public DataType dataType;
        public Aggregate aggregate;
        public ShowAs showAs;
        public Boolean descending;
        public String format;
        public Integer width;
        public Boolean wordWrap;
        public Boolean isContentHtml;
        public String weightField;
        public FilterDef filter;
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class FilterDef {
        public String type;
        public ConditionDef condition1;
        public Boolean and;
        public ConditionDef condition2;
        public String filterText;
        public List<String> showValues;
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ConditionDef {
        public ConditionFilter.Operator operator;
        public Object value;
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ListDef {
        public List<String> items = new ArrayList<>();
        public Integer maxItems;
    }
    
    // --- export ---
    
    static String write(PivotEngine engine) {
        Document doc = new Document();
        doc.showZeros = engine.isShowZeros();
        doc.showColumnTotals = engine.getShowColumnTotals();
        doc.showRowTotals = engine.getShowRowTotals();
        doc.defaultFilterType = engine.getDefaultFilterType();
        doc.totalsBeforeData = engine.isTotalsBeforeData();
        doc.fields = new ArrayList<>();
        for (PivotField field : engine.fields())
            doc.fields.add(fieldDef(field));
        doc.rowFields = listDef(engine.rowFields());
        doc.columnFields = listDef(engine.columnFields());
        doc.filterFields = listDef(engine.filterFields());
        doc.valueFields = listDef(engine.valueFields());
        try {
            return MAPPER.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    private static FieldDef fieldDef(PivotField field) {
        FieldDef def = new FieldDef();
        def.binding = field.getBinding();
        def.header = field.getHeader();
        def.dataType = field.getDataType();
        def.aggregate = field.getAggregate();
        def.showAs = field.getShowAs();
        def.descending = field.isDescending();
        def.format = field.getFormat();
        def.width = field.getWidth();
        def.wordWrap = field.isWordWrap();
        def.isContentHtml = field.isContentHtml();
        if (field.getWeightField() != null)
            def.weightField = field.getWeightField().name();
        if (field.filter().isActive())
            def.filter = filterDef(field.filter());
        return def;
    }
    
    private static FilterDef filterDef(PivotFilter filter) {
        FilterDef def = new FilterDef();
        ConditionFilter cf = filter.conditionFilter();
        if (cf.isActive()) {
            def.type = CONDITION;
            def.condition1 = conditionDef(cf.condition1());
            def.and = cf.isAnd();
            def.condition2 = conditionDef(cf.condition2());
        } else {
            ValueFilter vf = filter.valueFilter();
            def.type = VALUE;
            def.filterText = vf.getFilterText();
            def.showValues = vf.getShowValues() == null ? null : new ArrayList<>(vf.getShowValues());
        }
        return def;
    }
    
    private static ConditionDef conditionDef(ConditionFilter.Condition condition) {
        ConditionDef def = new ConditionDef();
        def.operator = condition.getOperator();
        Object value = condition.getValue();
        if (value instanceof Date)
            def.value = ((Date) value).toInstant().toString();
        else if (value instanceof TemporalAccessor)
            def.value = value.toString();
        else
            def.value = value;
        return def;
    }
    
    private static ListDef listDef(PivotFieldList list) {
        ListDef def = new ListDef();
        def.maxItems = list.getMaxItems();
        for (PivotField field : list)
            def.items.add(field.getHeader());
        return def;
    }
    
    // --- import ---
    
    static Document parse(String json) {
        try {
            Document doc = MAPPER.readValue(json, Document.class);
            if (doc == null)
                throw new IllegalArgumentException("Empty view definition");
            return doc;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed view definition: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Checks that the given document loads into the engine without failing partway, so that a rejected definition
     * leaves the engine unchanged.
     *
     * @throws IllegalArgumentException if a field has no binding, an empty or duplicate header, a negative width or an
     * unknown filter type, if a weight field is unknown or not numeric, or if a list names a {@code null} header
     */
    static void validate(PivotEngine engine, Document doc) {
        List<FieldDef> defs = doc.fields != null ? doc.fields : List.of();
        Map<String, FieldDef> byHeader = new HashMap<>();
        for (FieldDef def : defs) {
            if (def == null || def.binding == null)
                throw new IllegalArgumentException("Field definition without binding");
            String header = header(def);
            if (header.isEmpty())
                throw new IllegalArgumentException("Field headers must be non-empty: " + def.binding);
            if (byHeader.putIfAbsent(header, def) != null)
                throw new IllegalArgumentException("Field headers must be unique: " + header);
            if (def.width != null && def.width < 0)
                throw new IllegalArgumentException("Width must be non-negative; was: " + def.width);
            if (def.filter != null && !CONDITION.equals(def.filter.type) && !VALUE.equals(def.filter.type))
                throw new IllegalArgumentException("Unknown filter type: " + def.filter.type);
        }
        for (FieldDef def : defs) {
            if (def.weightField == null)
                continue;
            FieldDef weight = byHeader.get(def.weightField);
            if (weight == null)
                throw new IllegalArgumentException("Unknown weight field: " + def.weightField);
            DataType dataType = dataType(engine, weight);
            if (dataType != null && dataType != DataType.NUMBER)
                throw new IllegalArgumentException("Weight field must be numeric: " + def.weightField);
        }
        for (ListDef list : Arrays.asList(doc.rowFields, doc.columnFields, doc.filterFields, doc.valueFields))
            if (list != null && list.items != null && list.items.contains(null))
                throw new IllegalArgumentException("Field list with a null header");
    }
    
    private static String header(FieldDef def) {
        return def.header != null && !def.header.isEmpty() ? def.header : Utils.toHeaderCase(def.binding);
    }
    
    // The data type the loaded field ends up with
    private static DataType dataType(PivotEngine engine, FieldDef def) {
        if (def.dataType != null)
            return def.dataType;
        Map<String, ?> first = engine.firstItem();
        return first != null ? DataType.of(new Binding(def.binding).getValue(first)) : null;
    }
    
    /**
     * Replaces the options, catalog and role lists of the engine with those of the given document, which must have
     * been {@link #validate validated}. Must be called inside an update bracket.
     */
    static void load(PivotEngine engine, Document doc) {
        if (doc.showZeros != null)
            engine.setShowZeros(doc.showZeros);
        if (doc.showRowTotals != null)
            engine.setShowRowTotals(doc.showRowTotals);
        if (doc.showColumnTotals != null)
            engine.setShowColumnTotals(doc.showColumnTotals);
        if (doc.totalsBeforeData != null)
            engine.setTotalsBeforeData(doc.totalsBeforeData);
        if (doc.defaultFilterType != null)
            engine.setDefaultFilterType(doc.defaultFilterType);
        
        engine.fields().clear();
        List<FieldDef> defs = doc.fields != null ? doc.fields : List.of();
        for (FieldDef def : defs) {
            PivotField field = new PivotField(engine, def.binding, def.header);
            field.autoGenerated = true;
            if (def.dataType != null)
                field.setDataType(def.dataType);
            if (def.aggregate != null)
                field.setAggregate(def.aggregate);
            if (def.showAs != null)
                field.setShowAs(def.showAs);
            if (def.descending != null)
                field.setDescending(def.descending);
            if (def.format != null)
                field.setFormat(def.format);
            if (def.width != null)
                field.setWidth(def.width);
            if (def.wordWrap != null)
                field.setWordWrap(def.wordWrap);
            if (def.isContentHtml != null)
                field.setContentHtml(def.isContentHtml);
            if (def.filter != null)
                loadFilter(field, def.filter);
            engine.fields().add(field);
        }
        for (int i = 0; i < defs.size(); i++) {
            String weight = defs.get(i).weightField;
            if (weight != null)
                engine.fields().get(i).setWeightField(engine.fields().getField(weight));
        }
        
        loadList(engine.rowFields(), doc.rowFields);
        loadList(engine.columnFields(), doc.columnFields);
        loadList(engine.filterFields(), doc.filterFields);
        loadList(engine.valueFields(), doc.valueFields);
    }
    
    private static void loadFilter(PivotField field, FilterDef def) {
        PivotFilter filter = field.filter();
        filter.clear();
        if (CONDITION.equals(def.type)) {
            ConditionFilter cf = filter.conditionFilter();
            loadCondition(field, cf.condition1(), def.condition1);
            cf.setAnd(def.and == null || def.and);
            loadCondition(field, cf.condition2(), def.condition2);
        } else {
            ValueFilter vf = filter.valueFilter();
            vf.setFilterText(def.filterText);
            vf.setShowValues(def.showValues);
        }
    }
    
    private static void loadCondition(PivotField field, ConditionFilter.Condition condition, ConditionDef def) {
        if (def == null)
            return;
        condition.setValue(coerce(def.value, field.getDataType()));
        condition.setOperator(def.operator);
    }
    
    /**
     * Converts a condition value read from JSON to the data type of its field, keeping the value as read if it does
     * not convert.
     */
    static Object coerce(Object value, DataType dataType) {
        if (!(value instanceof String) || dataType == null)
            return value;
        String s = ((String) value).trim();
        switch (dataType) {
            case NUMBER:
                try {
                    return Double.valueOf(s);
                } catch (NumberFormatException e) {
                    return value;
                }
            case BOOLEAN:
                if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))
                    return Boolean.valueOf(s);
                return value;
            case DATE:
                return parseDate(s, value);
            default:
                return value;
        }
    }
    
    private static Object parseDate(String s, Object fallback) {
        try {
            TemporalAccessor parsed = ISO_DATE.parseBest(s, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            return parsed instanceof OffsetDateTime ? Date.from(((OffsetDateTime) parsed).toInstant()) : parsed;
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
    
    private static void loadList(PivotFieldList list, ListDef def) {
        list.clear();
        if (def == null)
            return;
        list.setMaxItems(def.maxItems != null && def.maxItems > -1 ? def.maxItems : null);
        if (def.items != null)
            for (String header : def.items)
                list.add(header);
    }
}
