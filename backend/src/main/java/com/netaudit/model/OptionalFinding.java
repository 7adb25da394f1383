package com.netaudit.model;

/**
 * 可选规则的检查结果，仅供参考，不影响设备状态
 */
public record OptionalFinding(String ruleName, String description, boolean found) {
}
