package com.netaudit.service;

import com.netaudit.model.ComplianceRule;
import com.netaudit.model.ComplianceTemplate;
import com.netaudit.model.DeviceAuditResult;
import com.netaudit.model.OptionalFinding;
import com.netaudit.model.RuleGroup;
import com.netaudit.model.Violation;
import com.netaudit.rule.matcher.RuleMatcher;
import com.netaudit.rule.matcher.RuleMatcher.MatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 合规检查引擎：对一台设备的配置逐条评估模板中的规则。
 * <p>
 * 引擎无状态，可被多个线程同时调用并共享同一个模板。
 */
@Service
public class ComplianceEngine {

    private static final Logger log = LoggerFactory.getLogger(ComplianceEngine.class);

    private final RuleMatcher matcher;

    public ComplianceEngine(RuleMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * 审计一台设备
     * <p>
     * 空配置不是错误：所有必需规则都会记为缺失，禁止规则全部通过。
     *
     * @param template   已校验的模板
     * @param deviceId   设备标识
     * @param configText 设备完整配置文本
     * @return 审计结果，违规按规则定义顺序排列
     */
    public DeviceAuditResult audit(ComplianceTemplate template, String deviceId, String configText) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(deviceId, "deviceId");
        String text = configText == null ? "" : configText;
        log.debug("开始检查设备 {} ({} 字符, 模板 {})", deviceId, text.length(), template.name());

        List<Violation> violations = new ArrayList<>();
        List<OptionalFinding> findings = new ArrayList<>();

        // 1. 普通分组
        for (RuleGroup group : template.groups()) {
            for (ComplianceRule rule : group.rules()) {
                MatchOutcome outcome = matcher.evaluate(rule, text);
                if (rule.isRequired()) {
                    if (!outcome.found()) {
                        violations.add(toViolation(rule, Violation.Type.MISSING_REQUIRED, null));
                    }
                } else {
                    findings.add(new OptionalFinding(rule.getName(), rule.getDescription(), outcome.found()));
                }
            }
        }

        // 2. 禁止分组放在最后
        for (ComplianceRule rule : template.forbiddenGroup().rules()) {
            MatchOutcome outcome = matcher.evaluate(rule, text);
            if (outcome.found()) {
                violations.add(toViolation(rule, Violation.Type.FORBIDDEN_PRESENT, outcome.matchedText()));
            }
        }

        DeviceAuditResult result = DeviceAuditResult.of(deviceId, violations, findings);
        log.info("设备 {} 检查完成: {}, {} 条违规 (HIGH {}, MEDIUM {}, LOW {})",
                deviceId, result.getStatus(), result.getTotalViolations(),
                result.getHighCount(), result.getMediumCount(), result.getLowCount());
        return result;
    }

    private Violation toViolation(ComplianceRule rule, Violation.Type type, String matchedText) {
        return Violation.builder()
                .ruleName(rule.getName())
                .description(rule.getDescription())
                .severity(rule.getSeverity())
                .scope(rule.getScope())
                .type(type)
                .pattern(rule.getPattern())
                .matchedText(matchedText)
                .build();
    }
}
