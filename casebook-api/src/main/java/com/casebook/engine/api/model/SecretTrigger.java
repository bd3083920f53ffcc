/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Parsed secret-reveal condition: a disjunction of conjunction groups.
 *
 * <p>{@code trust>70 AND evidence:e3 OR evidence_count>=5} becomes two groups, the first with
 * two conditions. The source expression is kept for diagnostics and snapshots.
 */
public record SecretTrigger(String expression, List<List<Condition>> groups) {

    public SecretTrigger {
        Objects.requireNonNull(expression, "expression must not be null");
        groups = groups.stream().map(List::copyOf).toList();
    }

    public enum ConditionType { TRUST, EVIDENCE, EVIDENCE_COUNT }

    public enum Comparison {
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        EQUAL("=="),
        NOT_EQUAL("!=");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(int left, int right) {
            return switch (this) {
                case GREATER -> left > right;
                case GREATER_OR_EQUAL -> left >= right;
                case LESS -> left < right;
                case LESS_OR_EQUAL -> left <= right;
                case EQUAL -> left == right;
                case NOT_EQUAL -> left != right;
            };
        }

        /**
         * @return the comparison for the symbol, or {@code null} when unsupported
         */
        public static Comparison fromSymbol(String symbol) {
            for (Comparison c : values()) {
                if (c.symbol.equals(symbol)) {
                    return c;
                }
            }
            return null;
        }
    }

    /**
     * One atomic test. {@code evidenceId} is set only for {@link ConditionType#EVIDENCE}.
     */
    public record Condition(ConditionType type, Comparison comparison, int value, String evidenceId) {
        public static Condition evidence(String evidenceId) {
            return new Condition(ConditionType.EVIDENCE, null, 0, evidenceId);
        }
    }
}
