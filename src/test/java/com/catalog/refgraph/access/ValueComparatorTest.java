package com.catalog.refgraph.access;

import java.time.LocalDate;

import org.junit.Test;

import com.catalog.refgraph.api.FieldValue;
import com.catalog.refgraph.api.ValueKind;
import com.catalog.refgraph.api.Vector2;
import com.catalog.refgraph.fixtures.Rarity;

import static org.junit.Assert.*;

public class ValueComparatorTest {

    @Test
    public void testNullOrdering() {
        assertEquals(0, ValueComparator.compare((Object) null, null));
        assertEquals(-1, ValueComparator.compare(null, 5));
        assertEquals(1, ValueComparator.compare(5, null));
        assertEquals(0, ValueComparator.compare(FieldValue.NULL, null));
    }

    @Test
    public void testSameKindNative() {
        assertEquals(-1, ValueComparator.compare(3, 10));
        assertEquals(1, ValueComparator.compare(2.5, 1.0));
        assertEquals(0, ValueComparator.compare(true, true));
        assertEquals(-1, ValueComparator.compare(false, true));
        assertEquals(-1, ValueComparator.compare(Rarity.COMMON, Rarity.EPIC));
    }

    @Test
    public void testStringEqualityIsCaseSensitive() {
        assertNotEquals(0, ValueComparator.compare("Goblin", "goblin"));
        assertEquals(0, ValueComparator.compare("Goblin", "Goblin"));
    }

    @Test
    public void testRightOperandCoercedToLeftKind() {
        assertEquals(0, ValueComparator.compare(50, "50"));
        assertEquals(1, ValueComparator.compare(51, "50"));
        assertEquals(0, ValueComparator.compare(1.5f, "1.5"));
        assertEquals(0, ValueComparator.compare(0.1f, 0.1));
        assertEquals(0, ValueComparator.compare(3L, 3.0));
        assertEquals(0, ValueComparator.compare(true, "TRUE"));
        assertEquals(0, ValueComparator.compare(Rarity.RARE, "rare"));
        assertEquals(0, ValueComparator.compare(Rarity.RARE, 1));
        assertEquals(0, ValueComparator.compare("5", 5));
    }

    @Test
    public void testFloatToIntegerRoundsHalfEven() {
        assertEquals(0, ValueComparator.compare(2, 2.5));
        assertEquals(0, ValueComparator.compare(4, 3.5));
    }

    @Test
    public void testUncoercibleFallsBackToText() {
        // not a number: case-insensitive text comparison of "30" and "abc"
        assertEquals(-1, ValueComparator.compare(30, "abc"));
        // unknown enum name
        assertEquals(-1, ValueComparator.compare(Rarity.COMMON, "legendary"));
    }

    @Test
    public void testTextFallbackIsNotNumeric() {
        // string field "10" against integer 9: both become text, "10" < "9"
        assertEquals(-1, ValueComparator.compare("10", 9));
    }

    @Test
    public void testVectorsOnlyCompareForEquality() {
        assertEquals(0, ValueComparator.compare(new Vector2(1, 2), new Vector2(1, 2)));
        assertNotEquals(0, ValueComparator.compare(new Vector2(1, 2), new Vector2(2, 1)));
    }

    @Test
    public void testComparableObjectsUseNaturalOrder() {
        LocalDate spring = LocalDate.of(2024, 3, 1);
        LocalDate summer = LocalDate.of(2024, 7, 1);
        assertEquals(ValueKind.OBJECT, FieldValue.of(spring).kind());
        assertEquals(-1, ValueComparator.compare(spring, summer));
        assertEquals(1, ValueComparator.compare(summer, spring));
        assertEquals(0, ValueComparator.compare(spring, LocalDate.of(2024, 3, 1)));
    }

    @Test
    public void testMatchesText() {
        FieldValue v = FieldValue.of("Goblin Chief");
        assertTrue(ValueComparator.matchesText(v, "chief", TextMatch.CONTAINS));
        assertFalse(ValueComparator.matchesText(v, "orc", TextMatch.CONTAINS));
        assertTrue(ValueComparator.matchesText(v, "orc", TextMatch.NOT_CONTAINS));
        assertTrue(ValueComparator.matchesText(v, "GOB", TextMatch.STARTS_WITH));
        assertTrue(ValueComparator.matchesText(v, "IEF", TextMatch.ENDS_WITH));
        assertFalse(ValueComparator.matchesText(v, "Goblin Chief and more", TextMatch.ENDS_WITH));
    }

    @Test
    public void testMatchesTextOnNonStrings() {
        assertTrue(ValueComparator.matchesText(FieldValue.of(1250), "25", TextMatch.CONTAINS));
        assertTrue(ValueComparator.matchesText(FieldValue.of(2.0f), "2", TextMatch.ENDS_WITH));
        assertTrue(ValueComparator.matchesText(FieldValue.of(Rarity.EPIC), "ep", TextMatch.STARTS_WITH));
    }

    @Test
    public void testNullNeverMatchesText() {
        assertFalse(ValueComparator.matchesText(FieldValue.NULL, "x", TextMatch.CONTAINS));
        assertFalse(ValueComparator.matchesText(FieldValue.NULL, "x", TextMatch.NOT_CONTAINS));
        assertFalse(ValueComparator.matchesText(FieldValue.of("x"), null, TextMatch.CONTAINS));
    }

    @Test
    public void testCoerce() {
        FieldValue like = FieldValue.of(1);
        assertEquals(ValueKind.INTEGER, ValueComparator.coerce(FieldValue.of("42"), like).kind());
        assertNull(ValueComparator.coerce(FieldValue.of("forty"), like));
        assertNull(ValueComparator.coerce(FieldValue.of(Double.NaN), like));
        assertEquals("True", ValueComparator.coerce(FieldValue.of(true), FieldValue.of("s")).text());
        assertNull(ValueComparator.coerce(FieldValue.of(7), FieldValue.of(Rarity.COMMON)));
    }

    @Test
    public void testIndexOfIgnoreCase() {
        assertEquals(2, ValueComparator.indexOfIgnoreCase("abCDe", "cd"));
        assertEquals(-1, ValueComparator.indexOfIgnoreCase("ab", "abc"));
        assertEquals(0, ValueComparator.indexOfIgnoreCase("ab", ""));
    }
}
