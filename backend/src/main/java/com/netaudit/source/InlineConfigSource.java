package com.netaudit.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 由调用方直接提供配置文本的来源（例如 REST 请求体或上传文件）
 */
public class InlineConfigSource implements DeviceConfigSource {

    private final Map<String, String> configs;

    public InlineConfigSource(Map<String, String> configs) {
        this.configs = Collections.unmodifiableMap(new LinkedHashMap<>(configs));
    }

    @Override
    public String name() {
        return "inline";
    }

    @Override
    public List<String> deviceIds() {
        return List.copyOf(configs.keySet());
    }

    @Override
    public String fetchConfig(String deviceId) throws ConfigRetrievalException {
        String config = configs.get(deviceId);
        if (config == null) {
            throw new ConfigRetrievalException(deviceId, "请求中没有设备 " + deviceId + " 的配置");
        }
        return config;
    }
}
