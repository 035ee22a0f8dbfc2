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
import java.util.Map;

import static io.avery.pivot.TestData.item;
import static org.junit.jupiter.api.Assertions.*;

public class PivotEngineTest {
    private static final String AMT = "Amt:0;";
    
    private ManualEventLoop loop;
    private List<String> events;
    
    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        events = new ArrayList<>();
    }
    
    private void record(PivotEngine engine) {
        engine.addListener(new PivotEngine.Listener() {
            @Override
            public void viewDefinitionChanged(PivotEngine engine) {
                events.add("definition");
            }
            
            @Override
            public void updatingView(PivotEngine engine, int progress) {
                events.add("updating " + progress);
            }
            
            @Override
            public void updatedView(PivotEngine engine) {
                events.add("updated");
            }
        });
    }
    
    @Test
    void testBasicTabulation() {
        PivotEngine engine = TestData.engine(loop, TestData.regions(), "Region");
        PivotView view = engine.pivotView();
        
        assertEquals(3, view.size());
        assertEquals("E", view.rowKey(0).getValue(0, true));
        assertEquals(15.0, view.get(0).get(AMT));
        assertEquals("W", view.rowKey(1).getValue(0, true));
        assertEquals(7.0, view.get(1).get(AMT));
        assertEquals(PivotKey.GRAND_TOTAL, view.rowKey(2).getValue(0, true));
        assertEquals(22.0, view.get(2).get(AMT));
        
        assertEquals(-1, view.rowLevel(0));
        assertEquals(0, view.rowLevel(2));
        assertEquals(List.of(Column.ROW_KEY, new Column<>(AMT)), view.header().columns());
        assertEquals(3, engine.totalItemCount());
        assertEquals(3, engine.filteredItemCount());
    }
    
    @Test
    void testColumnFields() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region");
        engine.columnFields().add("City");
        loop.runUntilIdle();
        PivotView view = engine.pivotView();
        
        assertEquals(List.of("City:c1;Amt:0;", "City:c2;Amt:0;", "City:c3;Amt:0;", AMT),
                     view.columnKeys().stream().map(PivotKey::toString).toList());
        assertEquals(-1, view.columnLevel("City:c1;Amt:0;"));
        assertEquals(0, view.columnLevel(AMT));
        assertEquals(0, view.columnLevel(3));
        assertSame(view.columnKeys().get(0), view.columnKey("City:c1;Amt:0;"));
        
        Record east = view.get(0);
        assertEquals(13.0, east.get("City:c1;Amt:0;"));
        assertEquals(5.0, east.get("City:c2;Amt:0;"));
        assertNull(east.get("City:c3;Amt:0;"));
        assertEquals(18.0, east.get(AMT));
    }
    
    @Test
    void testShowZeros() {
        List<Map<String, Object>> items = List.of(item("region", "E", "amt", 0), item("region", "W", "amt", 1));
        PivotEngine engine = TestData.engine(loop, items, "Region");
        assertNull(engine.pivotView().get(0).get(AMT));
        
        engine.setShowZeros(true);
        loop.runUntilIdle();
        assertEquals(0.0, engine.pivotView().get(0).get(AMT));
    }
    
    @Test
    void testShowTotals() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region", "City");
        assertEquals(4, engine.pivotView().size());
        
        engine.setShowRowTotals(ShowTotals.SUBTOTALS);
        loop.runUntilIdle();
        assertEquals(6, engine.pivotView().size());
        assertEquals(1, engine.pivotView().rowLevel(2));
        assertEquals(PivotKey.SUBTOTAL, engine.pivotView().rowKey(2).getValue(1, true));
        
        engine.setShowRowTotals(ShowTotals.NONE);
        loop.runUntilIdle();
        assertEquals(3, engine.pivotView().size());
    }
    
    @Test
    void testFilter() {
        PivotEngine engine = TestData.engine(loop, TestData.regions(), "Region");
        engine.fields().getField("Region").filter().conditionFilter().condition1()
            .setOperator(ConditionFilter.Operator.EQ)
            .setValue("E");
        loop.runUntilIdle();
        PivotView view = engine.pivotView();
        
        assertEquals(3, engine.totalItemCount());
        assertEquals(2, engine.filteredItemCount());
        assertEquals(2, view.size());
        assertEquals("E", view.rowKey(0).getValue(0, true));
        assertEquals(15.0, view.get(1).get(AMT));
    }
    
    @Test
    void testFilterFieldsOnlyFilter() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region");
        engine.filterFields().add("City");
        engine.fields().getField("City").filter().valueFilter().setShowValues(List.of("c1"));
        loop.runUntilIdle();
        
        assertEquals(2, engine.pivotView().size());
        assertEquals(13.0, engine.pivotView().get(0).get(AMT));
    }
    
    @Test
    void testEmptySource() {
        PivotEngine engine = new PivotEngine(loop);
        engine.setItemsSource(List.of());
        engine.deferUpdate(e -> {
            e.fields().addAll("region", "amt");
            e.rowFields().add("Region");
            e.valueFields().add("Amt");
        });
        
        assertTrue(engine.isViewDefined());
        assertTrue(engine.pivotView().isEmpty());
        assertEquals(0, engine.totalItemCount());
    }
    
    @Test
    void testUndefinedView() {
        PivotEngine engine = new PivotEngine(loop);
        record(engine);
        engine.setItemsSource(TestData.regions());
        engine.rowFields().add("Region");
        loop.runUntilIdle();
        
        assertFalse(engine.isViewDefined());
        assertTrue(engine.pivotView().isEmpty());
        assertEquals(0, engine.totalItemCount());
        assertFalse(events.contains("updating 0"));
    }
    
    @Test
    void testRefreshIsIdempotent() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region", "City");
        List<Record> before = new ArrayList<>(engine.pivotView().records());
        
        engine.refresh();
        
        assertEquals(before, engine.pivotView().records());
        assertNotSame(before.get(0), engine.pivotView().get(0));
    }
    
    @Test
    void testInvalidationIsDebounced() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region");
        record(engine);
        
        engine.columnFields().add("City");
        engine.setShowZeros(true);
        engine.fields().getField("Region").setDescending(true);
        
        assertEquals(1, loop.pendingCount());
        loop.advance(9);
        assertFalse(events.contains("updated"));
        loop.advance(1);
        assertEquals(1, events.stream().filter("updated"::equals).count());
        assertEquals("W", engine.pivotView().rowKey(0).getValue(0, true));
    }
    
    @Test
    void testUpdateBracketCoalesces() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region");
        record(engine);
        
        engine.beginUpdate();
        engine.columnFields().add("City");
        engine.setShowZeros(true);
        assertTrue(engine.isUpdating());
        assertEquals(0, loop.pendingCount());
        engine.endUpdate();
        
        assertEquals(List.of("definition", "updating 100", "updated"), events);
        assertThrows(IllegalStateException.class, engine::endUpdate);
    }
    
    @Test
    void testViewOnlyChanges() {
        PivotEngine engine = TestData.engine(loop, TestData.regions(), "Region");
        List<PivotView.Change> changes = new ArrayList<>();
        engine.pivotView().addListener((view, change) -> changes.add(change));
        PivotField amt = engine.fields().getField("Amt");
        
        amt.setWidth(120);
        amt.setWordWrap(true);
        amt.setFormat("n2");
        
        assertEquals(0, loop.pendingCount());
        assertEquals(List.of(PivotView.Change.REFRESH, PivotView.Change.REFRESH, PivotView.Change.REFRESH), changes);
    }
    
    @Test
    void testAggregateChangeRegeneratesWithoutScan() {
        PivotEngine engine = TestData.engine(loop, TestData.regions(), "Region");
        record(engine);
        
        engine.fields().getField("Amt").setAggregate(Aggregate.COUNT);
        
        assertEquals(0, loop.pendingCount());
        assertEquals(List.of("definition", "updating 100", "updated"), events);
        assertEquals(2.0, engine.pivotView().get(0).get(AMT));
        assertEquals(3.0, engine.pivotView().get(2).get(AMT));
    }
    
    @Test
    void testInactiveFieldChangesOnlyNotify() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region");
        record(engine);
        
        engine.fields().getField("City").setDescending(true);
        
        assertEquals(0, loop.pendingCount());
        assertEquals(List.of("definition"), events);
    }
    
    @Test
    void testObservableItems() {
        ObservableItems items = new ObservableItems(TestData.regions());
        PivotEngine engine = new PivotEngine(loop);
        engine.setItemsSource(items);
        engine.deferUpdate(e -> {
            e.rowFields().add("Region");
            e.valueFields().add("Amt");
        });
        
        items.add(item("region", "W", "amt", 3));
        items.add(item("region", "N", "amt", 1));
        assertEquals(1, loop.pendingCount());
        loop.runUntilIdle();
        
        assertEquals(4, engine.pivotView().size());
        assertEquals(10.0, engine.pivotView().get(2).get(AMT));
        
        items.get(0).put("amt", 20);
        items.touch();
        loop.runUntilIdle();
        assertEquals(25.0, engine.pivotView().get(0).get(AMT));
        
        engine.setItemsSource(null);
        items.clear();
        assertEquals(0, loop.pendingCount());
    }
    
    @Test
    void testGetDetail() {
        PivotEngine engine = TestData.engine(loop, TestData.cities(), "Region");
        engine.columnFields().add("City");
        loop.runUntilIdle();
        PivotView view = engine.pivotView();
        
        assertEquals(2, engine.getDetail(view.get(0), "City:c1;Amt:0;").size());
        assertEquals(3, engine.getDetail(view.get(0), AMT).size());
        assertEquals(1, engine.getDetail(null, "City:c3;Amt:0;").size());
        assertEquals(4, engine.getDetail(null, null).size());
    }
    
    @Test
    void testOptionChangesNotify() {
        PivotEngine engine = TestData.engine(loop, TestData.regions(), "Region");
        record(engine);
        
        engine.setShowColumnTotals(ShowTotals.NONE)
            .setTotalsBeforeData(true)
            .setDefaultFilterType(FilterType.VALUE);
        engine.setTotalsBeforeData(true);
        
        assertEquals(List.of("definition", "definition", "definition"), events);
        assertTrue(engine.isUpdatePending());
        loop.runUntilIdle();
        assertEquals(PivotKey.GRAND_TOTAL, engine.pivotView().rowKey(0).getValue(0, true));
        assertEquals(FilterType.VALUE, engine.fields().getField("Region").filter().getFilterType());
    }
}
