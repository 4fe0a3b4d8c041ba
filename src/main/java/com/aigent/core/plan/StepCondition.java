package com.aigent.core.plan;

import com.aigent.core.model.ActionResult;

import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Parsed step condition: a field of a prior step's result compared against a boolean literal.
 * <p>
 * Grammar: {@code <stepName>.<Field> (== | !=) (true | false)}, where the only field is
 * {@code Success}. Field and literal are case-insensitive; surrounding whitespace is ignored.
 *
 * @param stepName step whose result is inspected
 * @param field    result field compared
 * @param operator comparison operator
 * @param expected literal operand
 */
public record StepCondition(String stepName, Field field, Operator operator, boolean expected) {

    private static final Pattern SYNTAX =
            Pattern.compile("^\\s*(.+)\\.(\\w+)\\s*(==|!=)\\s*(\\w+)\\s*$");

    public enum Field {
        SUCCESS(ActionResult::success);

        private final Predicate<ActionResult> extractor;

        Field(Predicate<ActionResult> extractor) {
            this.extractor = extractor;
        }

        boolean read(ActionResult result) {
            return extractor.test(result);
        }
    }

    public enum Operator {
        EQUALS("=="),
        NOT_EQUALS("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        static Operator fromSymbol(String symbol) {
            return "==".equals(symbol) ? EQUALS : NOT_EQUALS;
        }
    }

    /**
     * Parses a condition expression.
     *
     * @throws WorkflowConfigurationException if the expression does not follow the grammar
     */
    public static StepCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new WorkflowConfigurationException("Condition expression must not be blank");
        }
        var matcher = SYNTAX.matcher(expression);
        if (!matcher.matches()) {
            throw new WorkflowConfigurationException(
                    "Malformed condition '" + expression + "', expected '<step>.Success == <true|false>'");
        }
        String stepName = matcher.group(1).trim();
        Field field;
        try {
            field = Field.valueOf(matcher.group(2).toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new WorkflowConfigurationException(
                    "Unsupported condition field '" + matcher.group(2) + "' in '" + expression + "'");
        }
        String literal = matcher.group(4).toLowerCase();
        if (!literal.equals("true") && !literal.equals("false")) {
            throw new WorkflowConfigurationException(
                    "Condition literal must be true or false in '" + expression + "'");
        }
        return new StepCondition(stepName, field, Operator.fromSymbol(matcher.group(3)),
                Boolean.parseBoolean(literal));
    }

    /**
     * Evaluates the condition against the results gathered so far.
     *
     * @return empty when the referenced step has no result yet, otherwise the comparison outcome
     */
    public Optional<Boolean> evaluate(Map<String, ActionResult> context) {
        ActionResult result = context.get(stepName);
        if (result == null) {
            return Optional.empty();
        }
        boolean equal = field.read(result) == expected;
        return Optional.of(operator == Operator.EQUALS ? equal : !equal);
    }

    @Override
    public String toString() {
        return stepName + "." + field.name().charAt(0) + field.name().substring(1).toLowerCase()
                + " " + operator.symbol() + " " + expected;
    }
}
