package com.catalog.refgraph.query;

import org.junit.Before;
import org.junit.Test;

import com.catalog.refgraph.fixtures.Monster;
import com.catalog.refgraph.fixtures.Rarity;
import com.catalog.refgraph.fixtures.Stats;

import static org.junit.Assert.*;

public class ConditionTest {
    private Monster goblin;

    @Before
    public void setUp() {
        goblin = new Monster("m1", "Goblin Scout", 10);
        goblin.rarity = Rarity.RARE;
        goblin.stats = new Stats(4, 2);
    }

    @Test
    public void testComparisonOperators() {
        assertTrue(Condition.of("hp", QueryOperator.EQUAL, 10).evaluate(goblin));
        assertTrue(Condition.of("hp", QueryOperator.NOT_EQUAL, 11).evaluate(goblin));
        assertTrue(Condition.of("hp", QueryOperator.GREATER, 5).evaluate(goblin));
        assertTrue(Condition.of("hp", QueryOperator.GREATER_OR_EQUAL, 10).evaluate(goblin));
        assertTrue(Condition.of("hp", QueryOperator.LESS, "50").evaluate(goblin));
        assertFalse(Condition.of("hp", QueryOperator.LESS_OR_EQUAL, 9).evaluate(goblin));
    }

    @Test
    public void testTextOperators() {
        assertTrue(Condition.of("name", QueryOperator.CONTAINS, "SCOUT").evaluate(goblin));
        assertTrue(Condition.of("name", QueryOperator.NOT_CONTAINS, "dragon").evaluate(goblin));
        assertTrue(Condition.of("name", QueryOperator.STARTS_WITH, "gob").evaluate(goblin));
        assertTrue(Condition.of("name", QueryOperator.ENDS_WITH, "out").evaluate(goblin));
    }

    @Test
    public void testNullOperators() {
        assertTrue(Condition.of("description", QueryOperator.IS_NULL, "ignored").evaluate(goblin));
        assertFalse(Condition.of("description", QueryOperator.IS_NOT_NULL, null).evaluate(goblin));
        goblin.description = "sneaky";
        assertTrue(Condition.of("description", QueryOperator.IS_NOT_NULL, null).evaluate(goblin));
    }

    @Test
    public void testNotContainsOnNullFieldIsFalse() {
        assertFalse(Condition.of("description", QueryOperator.NOT_CONTAINS, "x").evaluate(goblin));
    }

    @Test
    public void testEnumAndNestedFields() {
        assertTrue(Condition.of("rarity", QueryOperator.EQUAL, "rare").evaluate(goblin));
        assertTrue(Condition.of("rarity", QueryOperator.GREATER, Rarity.COMMON).evaluate(goblin));
        assertTrue(Condition.of("stats.attack", QueryOperator.EQUAL, 4).evaluate(goblin));
    }

    @Test
    public void testMissingFieldIsFalse() {
        assertFalse(Condition.of("mana", QueryOperator.IS_NULL, null).evaluate(goblin));
        assertFalse(Condition.of("mana", QueryOperator.NOT_EQUAL, 1).evaluate(goblin));
    }

    @Test
    public void testDisabledConditionIsFalse() {
        Condition c = Condition.of("hp", QueryOperator.EQUAL, 10);
        c.setEnabled(false);
        assertFalse(c.evaluate(goblin));
    }

    @Test
    public void testRegex() {
        assertTrue(Condition.of("name", QueryOperator.REGEX, "^Gob.*t$").evaluate(goblin));
        assertTrue(Condition.of("name", QueryOperator.REGEX, "Scout").evaluate(goblin));
        assertFalse("case-sensitive", Condition.of("name", QueryOperator.REGEX, "scout").evaluate(goblin));
        // regex only applies to textual fields
        assertFalse(Condition.of("hp", QueryOperator.REGEX, "1.*").evaluate(goblin));
        assertFalse(Condition.of("name", QueryOperator.REGEX, 10).evaluate(goblin));
    }

    @Test
    public void testInvalidRegexIsFalse() {
        Condition c = Condition.of("name", QueryOperator.REGEX, "([unclosed");
        assertFalse(c.evaluate(goblin));
        assertFalse(c.evaluate(goblin));

        c.setValue("Gob");
        assertTrue(c.evaluate(goblin));
    }

    @Test
    public void testNullRecordOrOperator() {
        assertFalse(Condition.of("hp", QueryOperator.EQUAL, 10).evaluate(null));
        Condition c = Condition.of("hp", null, 10);
        assertFalse(c.evaluate(goblin));
    }

    @Test
    public void testDefaults() {
        Condition c = new Condition();
        assertEquals("name", c.getFieldName());
        assertEquals(QueryOperator.EQUAL, c.getOperator());
        assertNull(c.getValue());
        assertTrue(c.isEnabled());
    }

    @Test
    public void testDisplayText() {
        assertEquals("hp > 50", Condition.of("hp", QueryOperator.GREATER, 50).displayText());
        assertEquals("name contains \"go\"", Condition.of("name", QueryOperator.CONTAINS, "go").displayText());
        assertEquals("description is null", Condition.of("description", QueryOperator.IS_NULL, 1).displayText());
        assertEquals("drop == null", Condition.of("drop", QueryOperator.EQUAL, null).displayText());
    }
}
