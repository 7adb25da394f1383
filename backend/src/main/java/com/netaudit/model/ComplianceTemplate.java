package com.netaudit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 已校验的黄金配置模板。
 * <p>
 * 加载后不可变，可在多个设备审计线程之间共享只读引用。
 */
public final class ComplianceTemplate {

    private final String name;
    private final String version;
    private final String description;
    private final List<RuleGroup> groups;
    private final RuleGroup forbiddenGroup;
    private final List<ComplianceRule> allRules;

    public ComplianceTemplate(String name, String version, String description,
                              List<RuleGroup> groups, RuleGroup forbiddenGroup) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = Objects.requireNonNull(version, "version");
        this.description = description == null ? "" : description;
        this.groups = List.copyOf(groups);
        this.forbiddenGroup = Objects.requireNonNull(forbiddenGroup, "forbiddenGroup");

        List<ComplianceRule> rules = new ArrayList<>();
        this.groups.forEach(g -> rules.addAll(g.rules()));
        rules.addAll(forbiddenGroup.rules());
        this.allRules = Collections.unmodifiableList(rules);
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public String description() {
        return description;
    }

    /** 非禁止类分组，按声明顺序 */
    public List<RuleGroup> groups() {
        return groups;
    }

    public RuleGroup forbiddenGroup() {
        return forbiddenGroup;
    }

    /** 按评估顺序返回全部规则：先普通分组，最后禁止分组 */
    public List<ComplianceRule> allRules() {
        return allRules;
    }

    public int ruleCount() {
        return allRules.size();
    }

    public Optional<ComplianceRule> findRule(String ruleName) {
        return allRules.stream().filter(r -> r.getName().equals(ruleName)).findFirst();
    }

    @Override
    public String toString() {
        return "ComplianceTemplate[" + name + " v" + version + ", " + ruleCount() + " rules]";
    }
}
