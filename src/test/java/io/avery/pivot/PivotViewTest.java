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
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PivotViewTest {
    private static final String AMT = "Amt:0;";
    
    private ManualEventLoop loop;
    private PivotEngine engine;
    private List<PivotView.Change> changes;
    
    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        engine = TestData.engine(loop, TestData.cities(), "Region", "City");
        changes = new ArrayList<>();
        engine.pivotView().addListener((view, change) -> changes.add(change));
    }
    
    private List<Object> amounts() {
        return engine.pivotView().stream().map(r -> r.get(AMT)).collect(Collectors.toList());
    }
    
    @Test
    void testSortKeepsTotalsInPlace() {
        PivotView view = engine.pivotView();
        Column<Object> amt = view.header().column(AMT);
        
        view.sort(amt, false);
        assertEquals(List.of(5.0, 7.0, 13.0, 25.0), amounts());
        assertSame(amt, view.getSortColumn());
        assertFalse(view.isSortDescending());
        
        view.sort(amt, true);
        assertEquals(List.of(13.0, 7.0, 5.0, 25.0), amounts());
        
        view.clearSort();
        assertNull(view.getSortColumn());
        assertEquals(List.of(13.0, 5.0, 7.0, 25.0), amounts());
        assertEquals(List.of(PivotView.Change.REFRESH, PivotView.Change.REFRESH, PivotView.Change.REFRESH), changes);
    }
    
    @Test
    void testSortWithinSubtotalGroups() {
        engine.setShowRowTotals(ShowTotals.SUBTOTALS);
        loop.runUntilIdle();
        PivotView view = engine.pivotView();
        
        view.sort(Column.ROW_KEY, true);
        assertEquals(List.of(5.0, 13.0, 18.0, 7.0, 7.0, 25.0), amounts());
        
        view.sort(view.header().column(AMT), true);
        assertEquals(List.of(13.0, 5.0, 18.0, 7.0, 7.0, 25.0), amounts());
        assertEquals(1, view.rowLevel(2));
        assertEquals(0, view.rowLevel(5));
    }
    
    @Test
    void testNullsSortLast() {
        engine.columnFields().add("City");
        loop.runUntilIdle();
        PivotView view = engine.pivotView();
        Column<Object> c3 = view.header().column("City:c3;Amt:0;");
        
        view.sort(c3, false);
        assertEquals(Arrays.asList(7.0, null, 7.0), view.stream().map(c3::get).collect(Collectors.toList()));
        view.sort(c3, true);
        assertEquals(Arrays.asList(7.0, null, 7.0), view.stream().map(c3::get).collect(Collectors.toList()));
    }
    
    @Test
    void testSortSurvivesViewOnlyChanges() {
        PivotView view = engine.pivotView();
        view.sort(view.header().column(AMT), false);
        
        engine.fields().getField("Amt").setWidth(50);
        assertEquals(List.of(5.0, 7.0, 13.0, 25.0), amounts());
        
        engine.refresh();
        assertNull(view.getSortColumn());
        assertEquals(List.of(13.0, 5.0, 7.0, 25.0), amounts());
        assertEquals(List.of(PivotView.Change.REFRESH, PivotView.Change.REFRESH, PivotView.Change.RESET), changes);
    }
    
    @Test
    void testUnknownColumn() {
        PivotView view = engine.pivotView();
        assertThrows(NoSuchElementException.class, () -> view.sort(new Column<>("City:c9;Amt:0;"), false));
        assertNull(view.getSortColumn());
        assertNull(view.columnKey("City:c9;Amt:0;"));
        assertEquals(-1, view.columnLevel("City:c9;Amt:0;"));
    }
    
    @Test
    void testRecords() {
        PivotView view = engine.pivotView();
        Record first = view.get(0);
        
        assertSame(view.header(), first.header());
        assertSame(first.rowKey(), first.get(Column.ROW_KEY));
        assertEquals("Region:E;City:c1;{total}", first.rowKey().toString());
        assertThrows(UnsupportedOperationException.class, () -> view.records().remove(0));
        assertEquals(view.records(), view.stream().collect(Collectors.toList()));
        assertTrue(view.toString().startsWith("PivotView["));
    }
}
