package com.netaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.netaudit.model.ComplianceRule.Scope;
import com.netaudit.model.ComplianceRule.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单条违规记录：某条规则在某台设备上未通过
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Violation {

    /** 违反的规则名 */
    String ruleName;

    /** 规则描述 */
    String description;

    Severity severity;

    Scope scope;

    Type type;

    /** 期望出现（或禁止出现）的正则 */
    String pattern;

    /** 命中的配置文本，仅 FORBIDDEN_PRESENT 时有值 */
    String matchedText;

    public enum Type {
        MISSING_REQUIRED, FORBIDDEN_PRESENT
    }
}
