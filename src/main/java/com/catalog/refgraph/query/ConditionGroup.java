package com.catalog.refgraph.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.catalog.refgraph.access.FieldAccessor;
import com.catalog.refgraph.api.DataRecord;

/**
 * An ordered list of {@link Condition}s combined with AND or OR.
 *
 * <p>
 * Only enabled conditions take part. A group with no enabled conditions is a
 * pass-through and matches every record. Evaluation short-circuits: AND stops
 * at the first failing condition, OR at the first passing one.
 */
public final class ConditionGroup {
    private final List<Condition> conditions = new ArrayList<>();
    private LogicalOperator combinator;

    public ConditionGroup() {
        this(LogicalOperator.AND);
    }

    public ConditionGroup(LogicalOperator combinator) {
        this.combinator = combinator;
    }

    public static ConditionGroup and(Condition... conditions) {
        return of(LogicalOperator.AND, conditions);
    }

    public static ConditionGroup or(Condition... conditions) {
        return of(LogicalOperator.OR, conditions);
    }

    private static ConditionGroup of(LogicalOperator op, Condition... conditions) {
        ConditionGroup group = new ConditionGroup(op);
        for (Condition c : conditions)
            group.add(c);
        return group;
    }

    public boolean evaluate(DataRecord record) {
        return evaluate(record, FieldAccessor.shared());
    }

    public boolean evaluate(DataRecord record, FieldAccessor accessor) {
        boolean any = false;
        for (Condition c : conditions) {
            if (!c.isEnabled())
                continue;
            any = true;
            boolean result = c.evaluate(record, accessor);
            if (combinator == LogicalOperator.AND && !result)
                return false;
            if (combinator == LogicalOperator.OR && result)
                return true;
        }
        // AND: all passed (or none enabled). OR: none passed, unless none were enabled.
        return combinator == LogicalOperator.AND || !any;
    }

    /**
     * Appends a condition. A null field name defaults to {@code name}, a null
     * operator to {@link QueryOperator#EQUAL}.
     */
    public Condition add(String fieldName, QueryOperator operator, Object value) {
        Condition c = new Condition(fieldName == null ? "name" : fieldName,
                operator == null ? QueryOperator.EQUAL : operator, value);
        conditions.add(c);
        return c;
    }

    /**
     * @throws NullPointerException if {@code condition} is null.
     */
    public ConditionGroup add(Condition condition) {
        conditions.add(Objects.requireNonNull(condition, "condition"));
        return this;
    }

    public boolean remove(Condition condition) {
        return conditions.remove(condition);
    }

    public void clear() {
        conditions.clear();
    }

    public int size() {
        return conditions.size();
    }

    public int enabledCount() {
        int n = 0;
        for (Condition c : conditions)
            if (c.isEnabled())
                n++;
        return n;
    }

    public List<Condition> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public LogicalOperator combinator() {
        return combinator;
    }

    public void setCombinator(LogicalOperator combinator) {
        this.combinator = combinator;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Condition c : conditions) {
            if (!c.isEnabled())
                continue;
            if (sb.length() > 0)
                sb.append(' ').append(combinator).append(' ');
            sb.append(c.displayText());
        }
        return sb.length() == 0 ? "<all>" : sb.toString();
    }
}
