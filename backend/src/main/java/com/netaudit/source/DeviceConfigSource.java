package com.netaudit.source;

import java.util.List;

/**
 * 设备配置来源
 */
public interface DeviceConfigSource {

    /**
     * 来源名称，用于日志
     */
    String name();

    /**
     * 该来源已知的设备列表，按固定顺序返回
     */
    List<String> deviceIds();

    /**
     * 获取设备的完整运行配置
     *
     * @throws ConfigRetrievalException 设备不可达或配置无法获取
     */
    String fetchConfig(String deviceId) throws ConfigRetrievalException;
}
