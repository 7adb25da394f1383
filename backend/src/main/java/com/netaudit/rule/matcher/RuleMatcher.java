package com.netaudit.rule.matcher;

import com.netaudit.model.ComplianceRule;

/**
 * 规则匹配器接口
 */
public interface RuleMatcher {

    /**
     * 在整段设备配置中查找规则的模式，不做逐行锚定
     *
     * @param rule       已编译好正则的规则
     * @param configText 完整配置文本，null 按空文本处理
     */
    MatchOutcome evaluate(ComplianceRule rule, String configText);

    record MatchOutcome(boolean found, String matchedText) {
        public static MatchOutcome found(String matchedText) {
            return new MatchOutcome(true, matchedText);
        }

        public static MatchOutcome notFound() {
            return new MatchOutcome(false, null);
        }
    }
}
