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

import static org.junit.jupiter.api.Assertions.*;

public class AsyncTabulationTest {
    private ManualEventLoop loop;
    private PivotEngine engine;
    private List<Integer> progress;
    private int updates;
    
    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        progress = new ArrayList<>();
        engine = new PivotEngine(loop).setBatchSize(1).setBatchDelay(0);
        engine.addListener(new PivotEngine.Listener() {
            @Override
            public void updatingView(PivotEngine engine, int percent) {
                progress.add(percent);
            }
            
            @Override
            public void updatedView(PivotEngine engine) {
                updates++;
            }
        });
        engine.setItemsSource(TestData.regions());
        progress.clear();
        updates = 0;
    }
    
    private void defineView() {
        engine.deferUpdate(e -> {
            e.rowFields().add("Region");
            e.valueFields().add("Amt");
        });
    }
    
    @Test
    void testScanYieldsBetweenSlices() {
        defineView();
        assertTrue(engine.isUpdatePending());
        assertTrue(engine.pivotView().isEmpty());
        assertEquals(0, updates);
        
        loop.runUntilIdle();
        
        assertEquals(List.of(33, 67, 100), progress);
        assertEquals(1, updates);
        assertFalse(engine.isUpdatePending());
        
        PivotEngine sync = TestData.engine(new ManualEventLoop(), TestData.regions(), "Region");
        assertEquals(sync.pivotView().size(), engine.pivotView().size());
        for (int i = 0; i < sync.pivotView().size(); i++)
            assertEquals(sync.pivotView().get(i).values().subList(1, 2), engine.pivotView().get(i).values().subList(1, 2));
        assertEquals(3, engine.totalItemCount());
    }
    
    @Test
    void testPreviousViewStaysUntilScanCompletes() {
        engine.setAsync(false);
        defineView();
        assertEquals(3, engine.pivotView().size());
        engine.setAsync(true);
        
        engine.fields().getField("Region").setDescending(true);
        engine.refresh();
        
        assertTrue(engine.isUpdatePending());
        assertEquals("E", engine.pivotView().rowKey(0).getValue(0, true));
        loop.runUntilIdle();
        assertEquals("W", engine.pivotView().rowKey(0).getValue(0, true));
    }
    
    @Test
    void testRefreshSupersedesScan() {
        defineView();
        assertEquals(1, loop.pendingCount());
        
        engine.refresh();
        assertEquals(1, loop.pendingCount());
        loop.runUntilIdle();
        
        assertEquals(List.of(33, 67, 100), progress);
        assertEquals(1, updates);
        assertEquals(3, engine.totalItemCount());
    }
    
    @Test
    void testBeginUpdateCancelsScan() {
        defineView();
        engine.beginUpdate();
        assertFalse(engine.isUpdatePending());
        loop.runUntilIdle();
        assertEquals(0, updates);
        
        engine.endUpdate();
        loop.runUntilIdle();
        assertEquals(1, updates);
    }
    
    @Test
    void testDisablingAsyncCancelsScan() {
        defineView();
        engine.setAsync(false);
        
        assertFalse(engine.isUpdatePending());
        assertEquals(0, loop.pendingCount());
        assertTrue(engine.pivotView().isEmpty());
        
        engine.refresh();
        assertEquals(List.of(100), progress);
        assertEquals(3, engine.pivotView().size());
    }
    
    @Test
    void testSliceHonorsBatchDelay() {
        engine.setBatchDelay(5);
        defineView();
        
        assertEquals(1, updates);
        assertEquals(List.of(100), progress);
    }
    
    @Test
    void testInvalidBatchSettings() {
        assertThrows(IllegalArgumentException.class, () -> engine.setBatchSize(0));
        assertThrows(IllegalArgumentException.class, () -> engine.setBatchDelay(-1));
        assertThrows(IllegalArgumentException.class, () -> engine.setInvalidateDelay(-1));
    }
}
