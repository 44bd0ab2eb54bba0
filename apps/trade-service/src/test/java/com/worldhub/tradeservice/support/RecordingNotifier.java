package com.worldhub.tradeservice.support;

import com.worldhub.tradeservice.trade.domain.enums.Severity;
import com.worldhub.tradeservice.trade.domain.notify.TradeNotifier;

import java.util.ArrayList;
import java.util.List;

/**
 * 记录所有通知，便于断言"谁收到了什么"。
 */
public class RecordingNotifier implements TradeNotifier {

    public record Notice(String userId, String type, String text, Severity severity) {
    }

    private final List<Notice> notices = new ArrayList<>();

    @Override
    public void sendTradeOpened(String userId, String partnerName) {
        notices.add(new Notice(userId, "OPENED", partnerName, Severity.INFO));
    }

    @Override
    public void sendTradeClosed(String userId, String reason) {
        notices.add(new Notice(userId, "CLOSED", reason, Severity.INFO));
    }

    @Override
    public void sendText(String userId, String message, Severity severity) {
        notices.add(new Notice(userId, "TEXT", message, severity));
    }

    public List<Notice> all() {
        return notices;
    }

    public List<Notice> to(String userId) {
        return notices.stream().filter(n -> n.userId().equals(userId)).toList();
    }

    public boolean received(String userId, String type, String text) {
        return notices.stream().anyMatch(n -> n.userId().equals(userId) && n.type().equals(type) && n.text().equals(text));
    }

    public boolean receivedTextContaining(String userId, String fragment) {
        return notices.stream().anyMatch(n -> n.userId().equals(userId) && n.type().equals("TEXT") && n.text().contains(fragment));
    }

    public void clear() {
        notices.clear();
    }
}
