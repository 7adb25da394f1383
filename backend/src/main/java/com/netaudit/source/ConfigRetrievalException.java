package com.netaudit.source;

/**
 * 获取设备配置失败（网络、认证、超时等），由配置来源抛出
 */
public class ConfigRetrievalException extends Exception {

    private final String deviceId;

    public ConfigRetrievalException(String deviceId, String message) {
        super(message);
        this.deviceId = deviceId;
    }

    public ConfigRetrievalException(String deviceId, String message, Throwable cause) {
        super(message, cause);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
