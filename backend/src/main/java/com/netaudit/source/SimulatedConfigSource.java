package com.netaudit.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 模拟设备群：Router1 和 Switch1，配置来自 classpath:simulation/&lt;设备&gt;.cfg。
 * <p>
 * 两台设备都故意带有若干违规，便于演示。
 */
@Component
public class SimulatedConfigSource implements DeviceConfigSource {

    private static final Logger log = LoggerFactory.getLogger(SimulatedConfigSource.class);

    static final List<String> DEVICES = List.of("Router1", "Switch1");

    private final ResourceLoader resourceLoader;

    public SimulatedConfigSource(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    @Override
    public String name() {
        return "simulation";
    }

    @Override
    public List<String> deviceIds() {
        return DEVICES;
    }

    @Override
    public String fetchConfig(String deviceId) throws ConfigRetrievalException {
        if (!DEVICES.contains(deviceId)) {
            throw new ConfigRetrievalException(deviceId, "模拟环境中不存在设备 " + deviceId);
        }
        Resource resource = resourceLoader.getResource("classpath:simulation/" + deviceId + ".cfg");
        try {
            String config = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("模拟获取 {} 的配置 ({} 字符)", deviceId, config.length());
            return config;
        } catch (IOException e) {
            throw new ConfigRetrievalException(deviceId, "读取模拟配置失败: " + e.getMessage(), e);
        }
    }
}
