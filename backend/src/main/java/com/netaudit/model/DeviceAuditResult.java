package com.netaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.netaudit.model.ComplianceRule.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 单台设备的审计结果
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceAuditResult {

    /** 设备标识（主机名或 IP） */
    String deviceId;

    /** 按规则定义顺序排列的违规记录 */
    List<Violation> violations;

    /** 可选规则的检查结果 */
    List<OptionalFinding> optionalFindings;

    Status status;

    /** 获取配置失败的原因，仅 UNREACHABLE 时有值 */
    String error;

    /**
     * 根据违规列表构建结果，PASS 当且仅当没有违规
     */
    public static DeviceAuditResult of(String deviceId, List<Violation> violations,
                                       List<OptionalFinding> optionalFindings) {
        return DeviceAuditResult.builder()
                .deviceId(deviceId)
                .violations(List.copyOf(violations))
                .optionalFindings(List.copyOf(optionalFindings))
                .status(violations.isEmpty() ? Status.PASS : Status.FAIL)
                .build();
    }

    public static DeviceAuditResult unreachable(String deviceId, String error) {
        return DeviceAuditResult.builder()
                .deviceId(deviceId)
                .violations(List.of())
                .optionalFindings(List.of())
                .status(Status.UNREACHABLE)
                .error(error)
                .build();
    }

    public int count(Severity severity) {
        if (violations == null) {
            return 0;
        }
        return (int) violations.stream().filter(v -> v.getSeverity() == severity).count();
    }

    public int getHighCount() {
        return count(Severity.HIGH);
    }

    public int getMediumCount() {
        return count(Severity.MEDIUM);
    }

    public int getLowCount() {
        return count(Severity.LOW);
    }

    public int getTotalViolations() {
        return violations == null ? 0 : violations.size();
    }

    public boolean isCompliant() {
        return status == Status.PASS;
    }

    public enum Status {
        PASS, FAIL,
        /** 配置无法获取，未参与规则评估 */
        UNREACHABLE
    }
}
