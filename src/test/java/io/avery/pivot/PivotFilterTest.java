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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.avery.pivot.TestData.item;
import static org.junit.jupiter.api.Assertions.*;

public class PivotFilterTest {
    private PivotEngine engine;
    private PivotField amt;
    private PivotField city;
    
    @BeforeEach
    void setUp() {
        engine = new PivotEngine();
        engine.setItemsSource(TestData.cities());
        amt = engine.fields().getField("Amt");
        city = engine.fields().getField("City");
    }
    
    @Test
    void testNumericConditions() {
        ConditionFilter cf = amt.filter().conditionFilter();
        cf.condition1().setOperator(ConditionFilter.Operator.GT).setValue(4);
        cf.condition2().setOperator(ConditionFilter.Operator.LE).setValue("7");
        
        assertTrue(amt.filter().isActive());
        assertTrue(amt.filter().apply(item("amt", 5)));
        assertTrue(amt.filter().apply(item("amt", 7)));
        assertFalse(amt.filter().apply(item("amt", 10)));
        assertFalse(amt.filter().apply(item("amt", 3)));
        assertFalse(amt.filter().apply(item("amt", null)));
        
        cf.setAnd(false);
        assertTrue(amt.filter().apply(item("amt", 10)));
        assertTrue(amt.filter().apply(item("amt", 3)));
    }
    
    @Test
    void testTextConditions() {
        ConditionFilter.Condition condition = city.filter().conditionFilter().condition1();
        
        condition.setOperator(ConditionFilter.Operator.BEGINS_WITH).setValue("C");
        assertTrue(city.filter().apply(item("city", "c1")));
        condition.setOperator(ConditionFilter.Operator.ENDS_WITH).setValue("2");
        assertFalse(city.filter().apply(item("city", "c1")));
        condition.setOperator(ConditionFilter.Operator.NOT_CONTAINS);
        assertTrue(city.filter().apply(item("city", "c1")));
        condition.setOperator(ConditionFilter.Operator.EQ).setValue("C1");
        assertTrue(city.filter().apply(item("city", "c1")));
        condition.setOperator(ConditionFilter.Operator.NE);
        assertFalse(city.filter().apply(item("city", "c1")));
    }
    
    @Test
    void testValueFilter() {
        ValueFilter vf = city.filter().valueFilter();
        vf.setShowValues(List.of("c1", "c3"));
        
        assertEquals(Set.of("c1", "c3"), vf.getShowValues());
        assertTrue(city.filter().apply(item("city", "c3")));
        assertFalse(city.filter().apply(item("city", "c2")));
        
        vf.setShowValues(null);
        vf.setFilterText("2");
        assertTrue(city.filter().apply(item("city", "C2")));
        assertFalse(city.filter().apply(item("city", "c1")));
    }
    
    @Test
    void testFilterType() {
        PivotFilter filter = city.filter();
        filter.valueFilter().setShowValues(List.of("c1"));
        assertEquals(FilterType.BOTH, filter.getFilterType());
        
        filter.setFilterType(FilterType.CONDITION);
        assertFalse(filter.isActive());
        assertNull(filter.valueFilter().getShowValues());
        
        filter.setFilterType(null);
        engine.setDefaultFilterType(FilterType.VALUE);
        filter.conditionFilter().condition1().setOperator(ConditionFilter.Operator.EQ).setValue("c1");
        assertFalse(filter.isActive());
        assertTrue(filter.apply(item("city", "c2")));
    }
    
    @Test
    void testChangesNotifyField() {
        List<FieldProperty> changes = new ArrayList<>();
        city.addListener((field, property) -> changes.add(property));
        
        city.filter().valueFilter().setFilterText("c");
        city.filter().clear();
        city.filter().clear();
        
        assertEquals(List.of(FieldProperty.FILTER, FieldProperty.FILTER), changes);
    }
}
