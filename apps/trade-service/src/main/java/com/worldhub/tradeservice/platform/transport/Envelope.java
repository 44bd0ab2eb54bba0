package com.worldhub.tradeservice.platform.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳
 * - kind：STATE=完整快照，EVENT=事件，ERROR=错误通知
 * - type：事件名（OPENED / CLOSED / TEXT / SNAPSHOT / 错误码）
 *
 * 用法示例：
 *   Envelope.event("CLOSED", Map.of("reason", "交易已取消"));
 *   Envelope.state("SNAPSHOT", snapshot);
 */
public record Envelope<T>(Kind kind, String type, T payload, long ts) {

    public enum Kind { STATE, EVENT, ERROR }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "type");
    }

    public static <T> Envelope<T> of(Kind kind, String type, T payload) {
        return new Envelope<>(kind, type, payload, Instant.now().toEpochMilli());
    }

    public static <T> Envelope<T> state(String type, T payload) {
        return of(Kind.STATE, type, payload);
    }

    public static <T> Envelope<T> event(String type, T payload) {
        return of(Kind.EVENT, type, payload);
    }

    public static <T> Envelope<T> error(String type, T payload) {
        return of(Kind.ERROR, type, payload);
    }
}
