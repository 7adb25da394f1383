package com.netaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 审计服务配置，对应 application.yml 中的 auditor.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "auditor")
public class AuditorProperties {

    /**
     * 黄金配置模板位置，支持 classpath: 和 file: 前缀
     */
    private String templateLocation = "classpath:templates/cisco_ios_golden_config.yaml";

    /**
     * 并发审计的工作线程数
     */
    private int workerThreads = 4;

    /**
     * 单台设备获取配置的超时时间（秒）
     */
    private long retrievalTimeoutSeconds = 30;
}
