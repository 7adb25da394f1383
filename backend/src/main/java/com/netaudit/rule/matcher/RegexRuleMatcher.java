package com.netaudit.rule.matcher;

import com.netaudit.model.ComplianceRule;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.regex.Matcher;

/**
 * 基于正则 find() 的匹配器。区分大小写，规则的正则在模板加载时已编译，这里不再编译。
 */
@Component
public class RegexRuleMatcher implements RuleMatcher {

    @Override
    public MatchOutcome evaluate(ComplianceRule rule, String configText) {
        Objects.requireNonNull(rule.getCompiledPattern(), "compiledPattern");
        Matcher matcher = rule.getCompiledPattern().matcher(configText == null ? "" : configText);
        if (matcher.find()) {
            return MatchOutcome.found(matcher.group());
        }
        return MatchOutcome.notFound();
    }
}
