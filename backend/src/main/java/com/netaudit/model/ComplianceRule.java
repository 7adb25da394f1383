package com.netaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 单条合规规则。只能由模板解析器构建，加载后不可变。
 */
@Value
@Builder
public class ComplianceRule {

    /** 模板内唯一的规则名 */
    String name;

    /** 规则描述 */
    String description;

    /** 正则表达式原文 */
    String pattern;

    /** 加载时编译好的正则，供所有设备复用 */
    @JsonIgnore
    Pattern compiledPattern;

    RuleKind kind;

    Severity severity;

    Scope scope;

    /** 规则所属分组（模板中的键名） */
    String group;

    public boolean isRequired() {
        return kind == RuleKind.REQUIRED;
    }

    public boolean isForbidden() {
        return kind == RuleKind.FORBIDDEN;
    }

    public enum Severity {
        HIGH(3), MEDIUM(2), LOW(1);

        private final int rank;

        Severity(int rank) {
            this.rank = rank;
        }

        public int rank() {
            return rank;
        }

        /**
         * 忽略大小写解析严重等级，无法识别时返回 empty
         */
        public static Optional<Severity> parse(String value) {
            if (value == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(Severity.valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    public enum RuleKind {
        /** 配置中必须至少出现一次 */
        REQUIRED,
        /** 仅记录是否出现，不产生违规 */
        OPTIONAL,
        /** 配置中不允许出现 */
        FORBIDDEN
    }

    public enum Scope {
        GLOBAL, INTERFACE, LINE, SECURITY, ROUTING, FORBIDDEN;

        /**
         * 根据模板分组键名（如 {@code line_config}）推断作用域，未知键名归为 GLOBAL
         */
        public static Scope fromGroupKey(String groupKey) {
            if (groupKey == null) {
                return GLOBAL;
            }
            String key = groupKey.toLowerCase(Locale.ROOT);
            for (Scope scope : values()) {
                if (key.startsWith(scope.name().toLowerCase(Locale.ROOT))) {
                    return scope;
                }
            }
            return GLOBAL;
        }
    }
}
