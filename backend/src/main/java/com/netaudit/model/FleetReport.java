package com.netaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.netaudit.model.ComplianceRule.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 整个设备群的合规审计报告
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FleetReport {

    /** 使用的模板名称 */
    String templateName;

    /** 使用的模板版本 */
    String templateVersion;

    /** 报告生成时间 */
    LocalDateTime generatedAt;

    /** 设备标识 -> 审计结果，按提交顺序 */
    Map<String, DeviceAuditResult> devices;

    /** HIGH 级别违规总数 */
    int highCount;

    /** MEDIUM 级别违规总数 */
    int mediumCount;

    /** LOW 级别违规总数 */
    int lowCount;

    /** 违规总数 */
    int totalViolations;

    int totalDevices;

    /** 状态为 PASS 的设备数 */
    int compliantDevices;

    /** 状态为 FAIL 的设备数 */
    int nonCompliantDevices;

    /** 配置无法获取的设备数 */
    int unreachableDevices;

    /** 合规率（百分比），没有设备时为 0 */
    double compliancePercentage;

    /** 审计过程中的提示信息（如上传文件的编码转换） */
    List<String> notices;

    public int count(Severity severity) {
        return switch (severity) {
            case HIGH -> highCount;
            case MEDIUM -> mediumCount;
            case LOW -> lowCount;
        };
    }

    public boolean isAllCompliant() {
        return totalDevices > 0 && compliantDevices == totalDevices;
    }
}
