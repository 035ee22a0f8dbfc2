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

import static io.avery.pivot.TestData.item;
import static org.junit.jupiter.api.Assertions.*;

public class PivotFieldListTest {
    private PivotEngine engine;
    
    @BeforeEach
    void setUp() {
        engine = new PivotEngine();
        engine.setItemsSource(List.of(item("region", "E", "city", "c1", "amt", 10, "qty", 2)));
    }
    
    private List<String> headers(PivotFieldList list) {
        List<String> headers = new ArrayList<>();
        for (PivotField field : list)
            headers.add(field.getHeader());
        return headers;
    }
    
    @Test
    void testGeneratedFields() {
        assertEquals(List.of("Region", "City", "Amt", "Qty"), headers(engine.fields()));
        PivotField amt = engine.fields().getField("Amt");
        assertEquals(DataType.NUMBER, amt.getDataType());
        assertEquals(Aggregate.SUM, amt.getAggregate());
        assertEquals("n0", amt.getFormat());
        assertEquals(Aggregate.COUNT, engine.fields().getField("Region").getAggregate());
        assertTrue(amt.isAutoGenerated());
    }
    
    @Test
    void testAddToRoleListRequiresCatalog() {
        PivotField stranger = new PivotField(engine, "other");
        
        assertFalse(engine.rowFields().add("Nope"));
        assertFalse(engine.rowFields().add(stranger));
        assertTrue(engine.rowFields().isEmpty());
    }
    
    @Test
    void testDuplicateHeaders() {
        assertTrue(engine.rowFields().add("Region"));
        assertFalse(engine.rowFields().add("Region"));
        assertEquals(List.of("Region"), headers(engine.rowFields()));
        
        assertThrows(IllegalArgumentException.class, () -> engine.fields().add("region"));
        assertThrows(IllegalArgumentException.class, () -> engine.fields().getField("City").setHeader("Region"));
        assertThrows(IllegalArgumentException.class, () -> engine.fields().getField("City").setHeader(""));
    }
    
    @Test
    void testSingleRole() {
        engine.rowFields().add("Region");
        engine.columnFields().add("Region");
        
        assertTrue(engine.rowFields().isEmpty());
        assertEquals(List.of("Region"), headers(engine.columnFields()));
        assertTrue(engine.fields().getField("Region").isActive());
    }
    
    @Test
    void testMaxItemsKeepsAddedField() {
        PivotFieldList values = engine.valueFields();
        values.setMaxItems(1);
        values.add("Amt");
        values.add("Qty");
        
        assertEquals(List.of("Qty"), headers(values));
        
        engine.rowFields().addAll("Region", "City");
        engine.rowFields().setMaxItems(1);
        assertEquals(List.of("Region"), headers(engine.rowFields()));
    }
    
    @Test
    void testMoveAndRemove() {
        PivotFieldList rows = engine.rowFields();
        rows.addAll("Region", "City");
        PivotField city = engine.fields().getField("City");
        
        assertTrue(rows.move(city, 0));
        assertEquals(List.of("City", "Region"), headers(rows));
        assertTrue(engine.removeField(city));
        assertEquals(List.of("Region"), headers(rows));
        assertFalse(engine.removeField(city));
    }
    
    @Test
    void testRemoveFromCatalogRemovesFromRoleLists() {
        engine.rowFields().add("Region");
        PivotField region = engine.fields().getField("Region");
        
        engine.fields().remove(region);
        
        assertTrue(engine.rowFields().isEmpty());
        assertNull(engine.fields().getField("Region"));
    }
    
    @Test
    void testSetActive() {
        PivotField amt = engine.fields().getField("Amt");
        PivotField region = engine.fields().getField("Region");
        
        amt.setActive(true);
        region.setActive(true);
        
        assertEquals(List.of("Amt"), headers(engine.valueFields()));
        assertEquals(List.of("Region"), headers(engine.rowFields()));
        
        PivotField copy = engine.addValueFieldCopy(amt);
        assertEquals("Amt2", copy.getHeader());
        assertSame(amt, copy.getParentField());
        assertEquals(List.of("Amt", "Amt2"), headers(engine.valueFields()));
        assertEquals("Amt3", engine.addValueFieldCopy(copy).getHeader());
        
        amt.setActive(false);
        
        assertEquals(List.of("Amt3"), headers(engine.valueFields()));
        assertNull(engine.fields().getField("Amt2"));
        assertEquals(List.of("Region"), headers(engine.rowFields()));
    }
}
