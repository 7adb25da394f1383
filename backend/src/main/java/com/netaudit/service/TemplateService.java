package com.netaudit.service;

import com.netaudit.config.AuditorProperties;
import com.netaudit.model.ComplianceRule;
import com.netaudit.model.ComplianceTemplate;
import com.netaudit.parser.GoldenTemplateParser;
import com.netaudit.parser.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 模板管理服务：启动时加载配置的黄金模板，支持整体替换
 */
@Service
public class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final GoldenTemplateParser parser;
    private final AtomicReference<ComplianceTemplate> active = new AtomicReference<>();

    public TemplateService(GoldenTemplateParser parser, ResourceLoader resourceLoader, AuditorProperties properties) {
        this.parser = parser;
        String location = properties.getTemplateLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("找不到黄金配置模板: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            active.set(parser.parse(in));
        } catch (IOException e) {
            throw new IllegalStateException("读取黄金配置模板失败: " + location, e);
        } catch (TemplateException e) {
            log.error("黄金配置模板 {} 不合法: {}", location, e.getMessage());
            throw e;
        }
        log.info("已从 {} 加载模板 {}", location, active.get());
    }

    public ComplianceTemplate getActiveTemplate() {
        return active.get();
    }

    public List<ComplianceRule> listRules() {
        return active.get().allRules();
    }

    /**
     * 用新的 YAML 模板替换当前模板。先完整校验，校验失败时保留原模板。
     */
    public ComplianceTemplate replaceTemplate(String yaml) {
        ComplianceTemplate parsed = parser.parse(yaml);
        ComplianceTemplate previous = active.getAndSet(parsed);
        log.info("模板已替换: {} -> {}", previous, parsed);
        return parsed;
    }
}
