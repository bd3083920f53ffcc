/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.compiler;

import com.casebook.engine.api.exceptions.CaseValidationException;
import com.casebook.engine.api.model.SecretTrigger;
import com.casebook.engine.api.model.SecretTrigger.Comparison;
import com.casebook.engine.api.model.SecretTrigger.Condition;
import com.casebook.engine.api.model.SecretTrigger.ConditionType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses witness secret triggers such as {@code "evidence:frost_pattern OR trust>70 AND evidence_count>=3"}.
 *
 * <p>AND binds tighter than OR. Supported atoms: {@code trust>N}, {@code trust<N},
 * {@code evidence:<id>} and {@code evidence_count<op>N} with {@code > >= == < <= !=}.
 */
public class SecretTriggerParser {

    private static final Pattern OR_SPLIT = Pattern.compile("\\s+OR\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND_SPLIT = Pattern.compile("\\s+AND\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVIDENCE_COUNT = Pattern.compile("evidence_count\\s*(>=|<=|==|!=|>|<)\\s*(\\d{1,9})", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRUST = Pattern.compile("trust\\s*([<>])\\s*(\\d{1,9})", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVIDENCE = Pattern.compile("evidence:([A-Za-z0-9_-]+)", Pattern.CASE_INSENSITIVE);

    public SecretTrigger parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new CaseValidationException("Secret trigger must not be empty");
        }
        List<List<Condition>> groups = new ArrayList<>();
        for (String orPart : OR_SPLIT.split(expression.trim())) {
            List<Condition> group = new ArrayList<>();
            for (String atom : AND_SPLIT.split(orPart.trim())) {
                group.add(parseAtom(atom.trim(), expression));
            }
            groups.add(group);
        }
        return new SecretTrigger(expression.trim(), groups);
    }

    private Condition parseAtom(String atom, String expression) {
        // evidence_count first, so "evidence" does not swallow it
        Matcher m = EVIDENCE_COUNT.matcher(atom);
        if (m.matches()) {
            return new Condition(ConditionType.EVIDENCE_COUNT, Comparison.fromSymbol(m.group(1)),
                    Integer.parseInt(m.group(2)), null);
        }
        m = TRUST.matcher(atom);
        if (m.matches()) {
            return new Condition(ConditionType.TRUST, Comparison.fromSymbol(m.group(1)),
                    Integer.parseInt(m.group(2)), null);
        }
        m = EVIDENCE.matcher(atom);
        if (m.matches()) {
            return Condition.evidence(m.group(1));
        }
        throw new CaseValidationException("Cannot parse secret trigger condition '" + atom + "' in: " + expression);
    }
}
