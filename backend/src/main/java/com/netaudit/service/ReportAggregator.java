package com.netaudit.service;

import com.netaudit.model.ComplianceRule.Severity;
import com.netaudit.model.ComplianceTemplate;
import com.netaudit.model.DeviceAuditResult;
import com.netaudit.model.FleetReport;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 汇总多台设备的审计结果。设备按提交顺序出现在报告中，不修改输入。
 */
@Service
public class ReportAggregator {

    private final Clock clock;

    public ReportAggregator() {
        this(Clock.systemDefaultZone());
    }

    /** 固定时钟时，相同输入得到完全相同的报告 */
    public ReportAggregator(Clock clock) {
        this.clock = clock;
    }

    public FleetReport aggregate(List<DeviceAuditResult> results) {
        return aggregate(null, results);
    }

    public FleetReport aggregate(ComplianceTemplate template, List<DeviceAuditResult> results) {
        return aggregate(template, results, List.of());
    }

    public FleetReport aggregate(ComplianceTemplate template, List<DeviceAuditResult> results, List<String> notices) {
        Map<String, DeviceAuditResult> devices = new LinkedHashMap<>();
        int high = 0;
        int medium = 0;
        int low = 0;
        int compliant = 0;
        int failed = 0;
        int unreachable = 0;

        for (DeviceAuditResult result : results) {
            if (devices.putIfAbsent(result.getDeviceId(), result) != null) {
                throw new IllegalArgumentException("设备重复出现在同一次审计中: " + result.getDeviceId());
            }
            high += result.count(Severity.HIGH);
            medium += result.count(Severity.MEDIUM);
            low += result.count(Severity.LOW);
            switch (result.getStatus()) {
                case PASS -> compliant++;
                case FAIL -> failed++;
                case UNREACHABLE -> unreachable++;
            }
        }

        int total = devices.size();
        return FleetReport.builder()
                .templateName(template != null ? template.name() : null)
                .templateVersion(template != null ? template.version() : null)
                .generatedAt(LocalDateTime.now(clock))
                .devices(Collections.unmodifiableMap(devices))
                .highCount(high)
                .mediumCount(medium)
                .lowCount(low)
                .totalViolations(high + medium + low)
                .totalDevices(total)
                .compliantDevices(compliant)
                .nonCompliantDevices(failed)
                .unreachableDevices(unreachable)
                .compliancePercentage(total > 0 ? compliant * 100.0 / total : 0)
                .notices(List.copyOf(notices))
                .build();
    }
}
