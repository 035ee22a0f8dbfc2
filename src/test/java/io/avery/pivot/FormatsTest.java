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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.*;

public class FormatsTest {
    @Test
    void testNumberFormats() {
        assertEquals("1,234.56", Formats.format(1234.56, "n2"));
        assertEquals("1,235", Formats.format(1234.5, "n0"));
        assertEquals("1234.6", Formats.format(1234.56, "f1"));
        assertEquals("$1,234.56", Formats.format(1234.56, "c2"));
        assertEquals("25%", Formats.format(0.25, "p0"));
        assertEquals("00042", Formats.format(42, "d5"));
        assertEquals("ff", Formats.format(255, "x"));
        assertEquals("1,235", Formats.format(1234567, "n0,"));
    }
    
    @Test
    void testGeneralFormat() {
        assertEquals("5", Formats.format(5.0, ""));
        assertEquals("0.25", Formats.format(0.25, ""));
        assertEquals("42", Formats.format(42L, null));
        assertEquals("123", Formats.format(123.456, "g3"));
    }
    
    @Test
    void testScalarsAndNull() {
        assertEquals("", Formats.format(null, "n2"));
        assertEquals("abc", Formats.format("abc", "n2"));
        assertEquals("true", Formats.format(true, ""));
    }
    
    @Test
    void testDateFormats() {
        LocalDate date = LocalDate.of(2024, 3, 5);
        LocalDateTime dateTime = LocalDateTime.of(2024, 3, 5, 14, 7);
        
        assertEquals("3/5/2024", Formats.format(date, "d"));
        assertEquals("3/5/2024", Formats.format(date, ""));
        assertEquals("Tuesday, March 5, 2024", Formats.format(date, "D"));
        assertEquals("March 2024", Formats.format(date, "y"));
        assertEquals("2024-03", Formats.format(date, "yyyy-MM"));
        assertEquals("Q1 2024", Formats.format(date, "\"Q\"Q yyyy"));
        assertEquals("Tue", Formats.format(date, "ddd"));
        assertEquals("2:07 PM", Formats.format(dateTime, "t"));
    }
    
    @Test
    void testUnsupportedDateFieldFallsBack() {
        LocalDate date = LocalDate.of(2024, 3, 5);
        
        assertEquals(date.toString(), Formats.format(date, "HH:mm"));
    }
    
    @Test
    void testCompareDatesByDisplayedFields() {
        LocalDate jan2023 = LocalDate.of(2023, 1, 20);
        LocalDate jan2024 = LocalDate.of(2024, 1, 2);
        LocalDate feb2023 = LocalDate.of(2023, 2, 1);
        
        assertEquals(0, Formats.compareDates(jan2023, jan2024, "MMMM"));
        assertTrue(Formats.compareDates(jan2024, feb2023, "MMMM") < 0);
        assertTrue(Formats.compareDates(jan2024, feb2023, "d") > 0);
        assertTrue(Formats.isChronologicalDateFormat("D"));
        assertFalse(Formats.isChronologicalDateFormat("MMMM"));
    }
    
    @Test
    void testDatesIndependentOfDefaultTimeZone() {
        Date lateEvening = Date.from(Instant.parse("2024-03-05T23:30:00Z"));
        TimeZone original = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("Pacific/Kiritimati"));
            assertEquals("3/5/2024", Formats.format(lateEvening, "d"));
            assertEquals("3/5/2024 11:30 PM", Formats.format(lateEvening, "g"));
            TimeZone.setDefault(TimeZone.getTimeZone("America/Los_Angeles"));
            assertEquals("3/5/2024", Formats.format(lateEvening, "d"));
        } finally {
            TimeZone.setDefault(original);
        }
    }
}
