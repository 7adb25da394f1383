package com.netaudit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.netaudit.model.ComplianceRule.Severity;
import com.netaudit.model.DeviceAuditResult;
import com.netaudit.model.FleetReport;
import com.netaudit.model.Violation;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 审计报告导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final String FILE_PREFIX = "compliance-report-";

    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportJson(FleetReport report) {
        validate(report);
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            return new ExportPayload(fileName(report, "json"), "application/json;charset=UTF-8", content);
        } catch (Exception e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    public ExportPayload exportYaml(FleetReport report) {
        validate(report);
        try {
            byte[] content = yamlMapper.writeValueAsBytes(buildYamlTree(report));
            return new ExportPayload(fileName(report, "yaml"), "application/yaml;charset=UTF-8", content);
        } catch (Exception e) {
            throw new IllegalStateException("YAML 导出失败: " + e.getMessage(), e);
        }
    }

    public ExportPayload exportMarkdown(FleetReport report) {
        validate(report);
        byte[] content = buildMarkdown(report).getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(fileName(report, "md"), "text/markdown;charset=UTF-8", content);
    }

    /**
     * 报告可能来自客户端请求体，导出前检查每台设备的状态及每条违规的类型和严重等级
     *
     * @throws IllegalArgumentException 报告缺少导出所需的字段
     */
    void validate(FleetReport report) {
        if (report == null) {
            throw new IllegalArgumentException("报告不能为空");
        }
        devices(report).forEach((deviceId, result) -> {
            if (result == null || result.getStatus() == null) {
                throw new IllegalArgumentException("设备 " + deviceId + " 缺少 status");
            }
            for (Violation v : violationsOf(result)) {
                if (v == null || v.getType() == null || v.getSeverity() == null) {
                    throw new IllegalArgumentException("设备 " + deviceId + " 的违规记录缺少 type 或 severity");
                }
            }
        });
    }

    /**
     * compliance_report: timestamp / template / summary / devices
     */
    Map<String, Object> buildYamlTree(FleetReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_devices", report.getTotalDevices());
        summary.put("compliant_devices", report.getCompliantDevices());
        summary.put("non_compliant_devices", report.getNonCompliantDevices());
        summary.put("unreachable_devices", report.getUnreachableDevices());
        summary.put("total_violations", report.getTotalViolations());
        Map<String, Object> breakdown = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            breakdown.put(severity.name(), report.count(severity));
        }
        summary.put("severity_breakdown", breakdown);
        summary.put("compliance_percentage", round(report.getCompliancePercentage()));

        Map<String, Object> devices = new LinkedHashMap<>();
        for (Map.Entry<String, DeviceAuditResult> entry : devices(report).entrySet()) {
            DeviceAuditResult result = entry.getValue();
            Map<String, Object> device = new LinkedHashMap<>();
            device.put("status", result.getStatus().name());
            if (result.getError() != null) {
                device.put("error", result.getError());
            }
            device.put("total_violations", result.getTotalViolations());
            List<Map<String, Object>> violations = new ArrayList<>();
            for (Violation v : violationsOf(result)) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("rule", v.getRuleName());
                item.put("type", v.getType().name());
                item.put("severity", v.getSeverity().name());
                item.put("description", v.getDescription());
                item.put("expected", v.getType() == Violation.Type.MISSING_REQUIRED
                        ? v.getPattern() : "SHOULD NOT BE PRESENT");
                item.put("found", v.getMatchedText() != null ? v.getMatchedText() : "NOT FOUND");
                violations.add(item);
            }
            device.put("violations", violations);
            devices.put(entry.getKey(), device);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", String.valueOf(effectiveTime(report)));
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("name", report.getTemplateName());
        template.put("version", report.getTemplateVersion());
        body.put("template", template);
        body.put("summary", summary);
        if (report.getNotices() != null && !report.getNotices().isEmpty()) {
            body.put("notices", report.getNotices());
        }
        body.put("devices", devices);
        return Map.of("compliance_report", body);
    }

    private String buildMarkdown(FleetReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# 网络设备合规审计报告\n\n");
        md.append("**生成时间:** ").append(effectiveTime(report)).append("\n");
        if (report.getTemplateName() != null) {
            md.append("**模板:** ").append(report.getTemplateName())
                    .append(" v").append(orEmpty(report.getTemplateVersion())).append("\n");
        }
        if (report.getNotices() != null) {
            for (String notice : report.getNotices()) {
                md.append("\n> ").append(notice).append("\n");
            }
        }
        md.append("\n## 统计摘要\n");
        md.append("- **设备总数:** ").append(report.getTotalDevices()).append("\n");
        md.append("- **合规设备:** ").append(report.getCompliantDevices()).append("\n");
        md.append("- **不合规设备:** ").append(report.getNonCompliantDevices()).append("\n");
        if (report.getUnreachableDevices() > 0) {
            md.append("- **不可达设备:** ").append(report.getUnreachableDevices()).append("\n");
        }
        md.append("- **合规率:** ").append(String.format(Locale.ROOT, "%.1f%%", report.getCompliancePercentage())).append("\n");
        md.append("- **违规总数:** ").append(report.getTotalViolations())
                .append(" (HIGH: ").append(report.getHighCount())
                .append(", MEDIUM: ").append(report.getMediumCount())
                .append(", LOW: ").append(report.getLowCount())
                .append(")\n\n");

        md.append("| 设备 | 违规数 | HIGH | MEDIUM | LOW | 状态 |\n");
        md.append("|---|---|---|---|---|---|\n");
        for (Map.Entry<String, DeviceAuditResult> entry : devices(report).entrySet()) {
            DeviceAuditResult result = entry.getValue();
            md.append("| ").append(escapeCell(entry.getKey()))
                    .append(" | ").append(result.getTotalViolations())
                    .append(" | ").append(result.getHighCount())
                    .append(" | ").append(result.getMediumCount())
                    .append(" | ").append(result.getLowCount())
                    .append(" | ").append(result.getStatus())
                    .append(" |\n");
        }
        md.append("\n");

        for (Map.Entry<String, DeviceAuditResult> entry : devices(report).entrySet()) {
            DeviceAuditResult result = entry.getValue();
            md.append("## ").append(entry.getKey()).append("\n\n");
            switch (result.getStatus()) {
                case PASS -> md.append("所有合规检查均已通过\n\n");
                case UNREACHABLE -> md.append("无法获取配置: ").append(orEmpty(result.getError())).append("\n\n");
                case FAIL -> {
                    List<Violation> sorted = new ArrayList<>(violationsOf(result));
                    // 展示时按严重等级排序，稳定排序保留同级的定义顺序
                    sorted.sort(Comparator.comparingInt((Violation v) -> v.getSeverity().rank()).reversed());
                    for (Violation v : sorted) {
                        md.append("- **[").append(v.getSeverity()).append("]** `")
                                .append(escapeInlineCode(v.getRuleName())).append("` ")
                                .append(v.getType() == Violation.Type.MISSING_REQUIRED ? "缺少: " : "禁止出现: ")
                                .append(orEmpty(v.getDescription()));
                        if (v.getMatchedText() != null) {
                            md.append(" (匹配内容: `").append(escapeInlineCode(v.getMatchedText().replace("\n", " "))).append("`)");
                        }
                        md.append("\n");
                    }
                    md.append("\n");
                }
            }
        }
        return md.toString();
    }

    private Map<String, DeviceAuditResult> devices(FleetReport report) {
        return report.getDevices() != null ? report.getDevices() : Map.of();
    }

    private List<Violation> violationsOf(DeviceAuditResult result) {
        return result.getViolations() != null ? result.getViolations() : List.of();
    }

    private String escapeInlineCode(String text) {
        return orEmpty(text).replace("`", "\\`");
    }

    private String escapeCell(String text) {
        return orEmpty(text).replace("|", "\\|");
    }

    private String orEmpty(String text) {
        return text == null ? "" : text;
    }

    private double round(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private LocalDateTime effectiveTime(FleetReport report) {
        return report.getGeneratedAt() != null ? report.getGeneratedAt() : LocalDateTime.now();
    }

    private String fileName(FleetReport report, String extension) {
        return FILE_PREFIX + effectiveTime(report).format(FILE_TS) + "." + extension;
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
