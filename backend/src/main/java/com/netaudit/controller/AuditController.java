package com.netaudit.controller;

import com.netaudit.model.ComplianceRule;
import com.netaudit.model.ComplianceTemplate;
import com.netaudit.model.FleetReport;
import com.netaudit.parser.TemplateException;
import com.netaudit.service.FleetAuditService;
import com.netaudit.service.ReportExportService;
import com.netaudit.service.TemplateService;
import com.netaudit.source.InlineConfigSource;
import com.netaudit.source.SimulatedConfigSource;
import com.netaudit.util.ConfigTextDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 合规审计 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class AuditController {

    private static final Logger log = LoggerFactory.getLogger(AuditController.class);

    private final FleetAuditService fleetAuditService;
    private final TemplateService templateService;
    private final ReportExportService reportExportService;
    private final SimulatedConfigSource simulatedConfigSource;

    public AuditController(FleetAuditService fleetAuditService, TemplateService templateService,
                           ReportExportService reportExportService, SimulatedConfigSource simulatedConfigSource) {
        this.fleetAuditService = fleetAuditService;
        this.templateService = templateService;
        this.reportExportService = reportExportService;
        this.simulatedConfigSource = simulatedConfigSource;
    }

    /**
     * 审计请求体中给出的设备配置: {"devices": {"R1": "hostname R1\n..."}}
     */
    @PostMapping("/audit")
    public ResponseEntity<?> audit(@RequestBody(required = false) AuditRequest request) {
        if (request == null || request.devices() == null || request.devices().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供设备配置 (devices)"));
        }
        try {
            log.info("收到审计请求: {} 台设备", request.devices().size());
            InlineConfigSource source = new InlineConfigSource(request.devices());
            return ResponseEntity.ok(fleetAuditService.runAudit(source));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("审计失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "审计过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 对内置的模拟设备群执行审计
     */
    @PostMapping("/audit/simulation")
    public ResponseEntity<?> auditSimulation() {
        try {
            return ResponseEntity.ok(fleetAuditService.runAudit(simulatedConfigSource));
        } catch (Exception e) {
            log.error("模拟审计失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "审计过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 上传单台设备的配置文件进行审计，未指定 deviceId 时使用文件名（去掉扩展名）
     */
    @PostMapping("/audit/upload")
    public ResponseEntity<?> auditUpload(@RequestParam("file") MultipartFile file,
                                         @RequestParam(value = "deviceId", required = false) String deviceId) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传配置文件"));
        }
        String id = deviceId != null && !deviceId.isBlank() ? deviceId.trim() : baseName(file.getOriginalFilename());
        try {
            byte[] bytes = file.getBytes();
            ConfigTextDecoder.DecodedConfig decoded = ConfigTextDecoder.decode(bytes);
            log.info("收到配置文件审计请求: {} (设备 {}), 大小: {} bytes, 编码: {}",
                    file.getOriginalFilename(), id, bytes.length, decoded.charset().name());
            List<String> notices = new ArrayList<>();
            String notice = decoded.notice(String.valueOf(file.getOriginalFilename()));
            if (notice != null) {
                notices.add(notice);
            }
            InlineConfigSource source = new InlineConfigSource(Map.of(id, decoded.text()));
            return ResponseEntity.ok(fleetAuditService.runAudit(source, List.of(id), notices));
        } catch (Exception e) {
            log.error("配置文件审计失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "审计过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 获取当前模板的全部规则
     */
    @GetMapping("/rules")
    public ResponseEntity<List<ComplianceRule>> getRules() {
        return ResponseEntity.ok(templateService.listRules());
    }

    /**
     * 获取当前模板信息
     */
    @GetMapping("/template")
    public ResponseEntity<Map<String, Object>> getTemplate() {
        return ResponseEntity.ok(describe(templateService.getActiveTemplate()));
    }

    /**
     * 上传 YAML 模板替换当前模板
     */
    @PostMapping("/template")
    public ResponseEntity<?> uploadTemplate(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传文件"));
        }
        String filename = file.getOriginalFilename();
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(".yaml") && !lower.endsWith(".yml")) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传 .yaml 或 .yml 格式的模板文件"));
        }
        try {
            String yaml = ConfigTextDecoder.decode(file.getBytes()).text();
            ComplianceTemplate template = templateService.replaceTemplate(yaml);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "成功加载 " + template.ruleCount() + " 条合规规则");
            body.put("template", describe(template));
            return ResponseEntity.ok(body);
        } catch (TemplateException e) {
            log.warn("上传的模板不合法: {}", e.getMessage());
            Map<String, Object> body = new HashMap<>();
            body.put("error", e.getMessage());
            body.put("reason", e.getReason().name());
            body.put("group", e.getGroup());
            body.put("rule", e.getRuleRef());
            return ResponseEntity.badRequest().body(body);
        } catch (Exception e) {
            log.error("上传模板失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "读取模板失败: " + e.getMessage()));
        }
    }

    /**
     * 导出报告（优先使用请求体中的报告；未传时回退到最近一次审计结果）
     */
    @PostMapping("/report/export/{format}")
    public ResponseEntity<?> exportReport(@PathVariable("format") String format,
                                          @RequestBody(required = false) FleetReport report) {
        return export(format, report);
    }

    /**
     * 直接下载最近一次审计报告
     */
    @GetMapping("/report/export/{format}")
    public ResponseEntity<?> exportLatest(@PathVariable("format") String format) {
        return export(format, null);
    }

    private ResponseEntity<?> export(String format, FleetReport requestReport) {
        try {
            FleetReport report = requestReport != null
                    ? requestReport
                    : fleetAuditService.getLastReport().orElse(null);
            if (report == null) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(Map.of("error", "暂无可导出的审计报告，请先执行一次审计"));
            }

            ReportExportService.ExportPayload payload;
            switch (format.toLowerCase(Locale.ROOT)) {
                case "json" -> payload = reportExportService.exportJson(report);
                case "yaml", "yml" -> payload = reportExportService.exportYaml(report);
                case "markdown", "md" -> payload = reportExportService.exportMarkdown(report);
                default -> {
                    return ResponseEntity.badRequest().body(Map.of("error", "不支持的导出格式: " + format));
                }
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentLength(payload.content().length);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (IllegalArgumentException e) {
            log.warn("报告内容不完整, format={}: {}", format, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", "报告内容不完整: " + e.getMessage()));
        } catch (Exception e) {
            log.error("导出报告失败, format={}", format, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "导出失败: " + e.getMessage()));
        }
    }

    private Map<String, Object> describe(ComplianceTemplate template) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", template.name());
        info.put("version", template.version());
        info.put("description", template.description());
        info.put("groups", template.groups().stream().map(g -> g.key()).toList());
        info.put("ruleCount", template.ruleCount());
        info.put("forbiddenRuleCount", template.forbiddenGroup().size());
        return info;
    }

    private String baseName(String filename) {
        if (filename == null || filename.isBlank()) {
            return "device";
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public record AuditRequest(Map<String, String> devices) {
    }
}
