package com.worldhub.tradeservice.trade.domain.enums;

/**
 * 文本提示的级别（客户端据此选择颜色）。
 */
public enum Severity {
    INFO,
    WARN,
    ERROR
}
