package com.netaudit.service;

import com.netaudit.config.AuditorProperties;
import com.netaudit.model.ComplianceTemplate;
import com.netaudit.model.DeviceAuditResult;
import com.netaudit.model.FleetReport;
import com.netaudit.source.DeviceConfigSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 设备群审计服务
 * <p>
 * 每台设备独立获取配置并检查，某台设备获取失败只会把该设备记为 UNREACHABLE，不影响其他设备。
 * 一次审计开始时固定使用当时的模板，审计过程中替换模板不影响本次结果。
 * <p>
 * 获取配置的超时从该设备真正开始获取时计时，排队等待空闲 worker 的时间不计入；超时的获取任务会被中断。
 */
@Service
public class FleetAuditService {

    private static final Logger log = LoggerFactory.getLogger(FleetAuditService.class);

    private final ComplianceEngine engine;
    private final ReportAggregator aggregator;
    private final TemplateService templateService;
    private final long retrievalTimeoutSeconds;
    private final ExecutorService executor;
    private final ExecutorService retrievalExecutor;
    private final AtomicReference<FleetReport> lastReport = new AtomicReference<>();

    public FleetAuditService(ComplianceEngine engine, ReportAggregator aggregator,
                             TemplateService templateService, AuditorProperties properties) {
        this.engine = engine;
        this.aggregator = aggregator;
        this.templateService = templateService;
        this.retrievalTimeoutSeconds = properties.getRetrievalTimeoutSeconds();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
                daemonThreads("audit-worker-"));
        this.retrievalExecutor = Executors.newCachedThreadPool(daemonThreads("config-fetch-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * 审计配置来源已知的全部设备
     */
    public FleetReport runAudit(DeviceConfigSource source) {
        return runAudit(source, source.deviceIds());
    }

    /**
     * 按给定顺序审计指定设备，报告中的设备顺序与之一致
     */
    public FleetReport runAudit(DeviceConfigSource source, List<String> deviceIds) {
        return runAudit(source, deviceIds, List.of());
    }

    /**
     * 同上，附带的提示信息会原样写入报告
     */
    public FleetReport runAudit(DeviceConfigSource source, List<String> deviceIds, List<String> notices) {
        Set<String> seen = new HashSet<>();
        for (String id : deviceIds) {
            if (!seen.add(id)) {
                throw new IllegalArgumentException("设备重复出现在同一次审计中: " + id);
            }
        }

        ComplianceTemplate template = templateService.getActiveTemplate();
        log.info("开始审计 {} 台设备 (来源: {}, 模板: {})", deviceIds.size(), source.name(), template);

        List<CompletableFuture<DeviceAuditResult>> futures = new ArrayList<>();
        for (String deviceId : deviceIds) {
            futures.add(CompletableFuture.supplyAsync(() -> auditDevice(source, template, deviceId), executor));
        }

        List<DeviceAuditResult> results = new ArrayList<>();
        for (CompletableFuture<DeviceAuditResult> future : futures) {
            results.add(future.join());
        }

        FleetReport report = aggregator.aggregate(template, results, notices);
        lastReport.set(report);
        log.info("审计完成: {} 台设备, {} 台合规, {} 台不合规, {} 台不可达, 共 {} 条违规",
                report.getTotalDevices(), report.getCompliantDevices(), report.getNonCompliantDevices(),
                report.getUnreachableDevices(), report.getTotalViolations());
        return report;
    }

    public Optional<FleetReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    /**
     * 在 worker 线程中执行：获取配置（限时）后检查
     */
    private DeviceAuditResult auditDevice(DeviceConfigSource source, ComplianceTemplate template, String deviceId) {
        Future<String> fetch = retrievalExecutor.submit(() -> source.fetchConfig(deviceId));
        String config;
        try {
            config = fetch.get(retrievalTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            fetch.cancel(true);
            return unreachable(deviceId, "获取配置超时 (" + retrievalTimeoutSeconds + "s)");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return unreachable(deviceId, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            fetch.cancel(true);
            Thread.currentThread().interrupt();
            return unreachable(deviceId, "审计被中断");
        }
        return engine.audit(template, deviceId, config);
    }

    private DeviceAuditResult unreachable(String deviceId, String message) {
        log.warn("无法获取设备 {} 的配置，记为不可达: {}", deviceId, message);
        return DeviceAuditResult.unreachable(deviceId, message);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        retrievalExecutor.shutdownNow();
    }
}
