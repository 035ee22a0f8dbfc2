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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class TallyTest {
    @Test
    void testBasicAggregates() {
        Tally tally = new Tally().add(1).add(2).add(3);
        
        assertEquals(6.0, tally.getAggregate(Aggregate.SUM));
        assertEquals(3.0, tally.getAggregate(Aggregate.COUNT));
        assertEquals(2.0, tally.getAggregate(Aggregate.AVG));
        assertEquals(1.0, tally.getAggregate(Aggregate.MIN));
        assertEquals(3.0, tally.getAggregate(Aggregate.MAX));
        assertEquals(2.0, tally.getAggregate(Aggregate.RANGE));
    }
    
    @Test
    void testEmptyTallyHasNoAggregates() {
        Tally tally = new Tally().add((Object) null);
        
        for (Aggregate aggregate : Aggregate.values())
            assertNull(tally.getAggregate(aggregate), aggregate.name());
        assertEquals(0, tally.count());
    }
    
    @Test
    void testNaNOnlyCounts() {
        Tally tally = new Tally().add(Double.NaN).add(4);
        
        assertEquals(2.0, tally.getAggregate(Aggregate.COUNT));
        assertEquals(4.0, tally.getAggregate(Aggregate.SUM));
        assertEquals(4.0, tally.getAggregate(Aggregate.AVG));
    }
    
    @Test
    void testVariance() {
        Tally tally = new Tally();
        for (int v : new int[]{ 2, 4, 4, 4, 5, 5, 7, 9 })
            tally.add(v);
        
        assertEquals(4.0, (Double) tally.getAggregate(Aggregate.VAR_POP), 1e-9);
        assertEquals(2.0, (Double) tally.getAggregate(Aggregate.STD_POP), 1e-9);
        assertEquals(32.0 / 7, (Double) tally.getAggregate(Aggregate.VAR), 1e-9);
        assertEquals(Math.sqrt(32.0 / 7), (Double) tally.getAggregate(Aggregate.STD), 1e-9);
    }
    
    @Test
    void testVarianceOfSingleObservationIsZero() {
        Tally tally = new Tally().add(42);
        
        assertEquals(0.0, tally.getAggregate(Aggregate.VAR));
        assertEquals(0.0, tally.getAggregate(Aggregate.STD_POP));
    }
    
    @Test
    void testWeightsOnlyAffectSums() {
        Tally tally = new Tally().add(10, 2).add(5, null).add(1, 0.5);
        
        assertEquals(25.5, tally.getAggregate(Aggregate.SUM));
        assertEquals(3.0, tally.getAggregate(Aggregate.COUNT));
        assertEquals(1.0, tally.getAggregate(Aggregate.MIN));
        assertEquals(10.0, tally.getAggregate(Aggregate.MAX));
    }
    
    @Test
    void testBooleansAndStrings() {
        Tally bools = new Tally().add(true).add(false).add(true);
        assertEquals(2.0, bools.getAggregate(Aggregate.SUM));
        assertEquals(3.0, bools.getAggregate(Aggregate.COUNT));
        
        Tally strings = new Tally().add("pear").add("apple").add("fig");
        assertEquals(3.0, strings.getAggregate(Aggregate.COUNT));
        assertEquals("apple", strings.getAggregate(Aggregate.MIN));
        assertEquals("pear", strings.getAggregate(Aggregate.MAX));
        assertNull(strings.getAggregate(Aggregate.RANGE));
    }
    
    @Test
    void testMergeMatchesSinglePass() {
        List<Integer> values = IntStream.rangeClosed(1, 20).boxed().toList();
        Tally whole = new Tally();
        values.forEach(whole::add);
        
        Tally left = new Tally();
        Tally middle = new Tally();
        Tally right = new Tally();
        values.subList(0, 3).forEach(left::add);
        values.subList(3, 11).forEach(middle::add);
        values.subList(11, 20).forEach(right::add);
        Tally merged = new Tally().add(right).add(left).add(middle);
        
        for (Aggregate aggregate : Aggregate.values())
            assertEquals((Double) whole.getAggregate(aggregate), (Double) merged.getAggregate(aggregate), 1e-9,
                         aggregate.name());
    }
}
