package com.catalog.refgraph.query;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.catalog.refgraph.access.FieldAccessor;
import com.catalog.refgraph.access.TextMatch;
import com.catalog.refgraph.access.ValueComparator;
import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.FieldValue;
import com.catalog.refgraph.api.ValueKind;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * A single field / operator / value predicate.
 *
 * <p>
 * Evaluation never throws. A disabled condition, a missing field, an operator
 * that does not apply to the value kind, or any internal failure (for example a
 * malformed regular expression) evaluates to false.
 */
@Log4j2
@Getter
public final class Condition {
    @Setter
    private String fieldName;
    @Setter
    private QueryOperator operator;
    private Object value;
    @Setter
    private boolean enabled = true;

    // Derived from value; rebuilt by setValue
    @Getter(AccessLevel.NONE)
    private FieldValue comparand;
    @Getter(AccessLevel.NONE)
    private Pattern pattern;
    @Getter(AccessLevel.NONE)
    private boolean patternInvalid;

    public Condition() {
        this("name", QueryOperator.EQUAL, null);
    }

    public Condition(String fieldName, QueryOperator operator, Object value) {
        this.fieldName = fieldName;
        this.operator = operator;
        setValue(value);
    }

    public static Condition of(String fieldName, QueryOperator operator, Object value) {
        return new Condition(fieldName, operator, value);
    }

    public void setValue(Object value) {
        this.value = value;
        this.comparand = FieldValue.of(value);
        this.pattern = null;
        this.patternInvalid = false;
    }

    /** Evaluates against the process-wide {@link FieldAccessor}. */
    public boolean evaluate(DataRecord record) {
        return evaluate(record, FieldAccessor.shared());
    }

    public boolean evaluate(DataRecord record, FieldAccessor accessor) {
        if (!enabled || record == null || operator == null)
            return false;
        try {
            FieldValue fieldValue = accessor.read(record, fieldName);
            if (fieldValue == null)
                return false;
            return apply(fieldValue);
        } catch (RuntimeException e) {
            log.debug("Condition '{}' failed on {}: {}", displayText(), record.identity(), e.toString());
            return false;
        }
    }

    private boolean apply(FieldValue fieldValue) {
        switch (operator) {
            case IS_NULL:
                return fieldValue.isNull();
            case IS_NOT_NULL:
                return !fieldValue.isNull();
            case EQUAL:
                return ValueComparator.compare(fieldValue, comparand) == 0;
            case NOT_EQUAL:
                return ValueComparator.compare(fieldValue, comparand) != 0;
            case GREATER:
                return ValueComparator.compare(fieldValue, comparand) > 0;
            case GREATER_OR_EQUAL:
                return ValueComparator.compare(fieldValue, comparand) >= 0;
            case LESS:
                return ValueComparator.compare(fieldValue, comparand) < 0;
            case LESS_OR_EQUAL:
                return ValueComparator.compare(fieldValue, comparand) <= 0;
            case CONTAINS:
                return ValueComparator.matchesText(fieldValue, comparand.text(), TextMatch.CONTAINS);
            case NOT_CONTAINS:
                return ValueComparator.matchesText(fieldValue, comparand.text(), TextMatch.NOT_CONTAINS);
            case STARTS_WITH:
                return ValueComparator.matchesText(fieldValue, comparand.text(), TextMatch.STARTS_WITH);
            case ENDS_WITH:
                return ValueComparator.matchesText(fieldValue, comparand.text(), TextMatch.ENDS_WITH);
            case REGEX:
                return matchesRegex(fieldValue);
            default:
                return false;
        }
    }

    private boolean matchesRegex(FieldValue fieldValue) {
        if (fieldValue.kind() != ValueKind.STRING || comparand.kind() != ValueKind.STRING)
            return false;
        Pattern p = compiledPattern();
        return p != null && p.matcher(fieldValue.text()).find();
    }

    private Pattern compiledPattern() {
        if (pattern == null && !patternInvalid) {
            try {
                pattern = Pattern.compile(comparand.text());
            } catch (PatternSyntaxException e) {
                log.debug("Invalid pattern '{}': {}", comparand.text(), e.getDescription());
                patternInvalid = true;
            }
        }
        return pattern;
    }

    /** Short human-readable form, e.g. {@code hp > 50} or {@code name contains "go"}. */
    public String displayText() {
        String op = operator == null ? "?" : operator.symbol();
        if (operator != null && operator.isUnary())
            return fieldName + " " + op;
        String valueText = value instanceof String s ? "\"" + s + "\"" : comparand.isNull() ? "null" : comparand.text();
        return fieldName + " " + op + " " + valueText;
    }

    @Override
    public String toString() {
        return (enabled ? "" : "[disabled] ") + displayText();
    }
}
