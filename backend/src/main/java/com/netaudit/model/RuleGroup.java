package com.netaudit.model;

import java.util.List;
import java.util.Objects;

/**
 * 模板中的一组规则，保持声明顺序
 */
public record RuleGroup(String key, ComplianceRule.Scope scope, List<ComplianceRule> rules) {

    public RuleGroup {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(scope, "scope");
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static RuleGroup empty(String key, ComplianceRule.Scope scope) {
        return new RuleGroup(key, scope, List.of());
    }

    public int size() {
        return rules.size();
    }
}
