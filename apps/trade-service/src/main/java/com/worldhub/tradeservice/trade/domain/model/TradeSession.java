package com.worldhub.tradeservice.trade.domain.model;

import com.worldhub.tradeservice.trade.domain.enums.TradeState;
import lombok.Getter;

import java.util.Objects;
import java.util.UUID;

/**
 * 交易会话实体（两名玩家之间的协商状态）
 * ----------------------------------------
 * - 只存在于内存，不跨进程重启；
 * - 任何一方报价变动都会清空双方的确认标记；
 * - 并发：由 TradeServiceImpl 在 synchronized(session) 内修改。
 */
@Getter
public class TradeSession {

    private final String tradeId;
    private final String initiatorId;
    private final String initiatorName;
    private final String targetId;
    private final String targetName;
    private final long createdAt;

    private final TradeOffer initiatorOffer = new TradeOffer();
    private final TradeOffer targetOffer = new TradeOffer();

    private volatile TradeState state = TradeState.PENDING;
    private volatile long lastUpdate;
    private boolean initiatorConfirmed;
    private boolean targetConfirmed;

    public TradeSession(String initiatorId, String initiatorName,
                        String targetId, String targetName, long now) {
        this(UUID.randomUUID().toString(), initiatorId, initiatorName, targetId, targetName, now);
    }

    public TradeSession(String tradeId, String initiatorId, String initiatorName,
                        String targetId, String targetName, long now) {
        if (Objects.equals(initiatorId, targetId)) {
            throw new IllegalArgumentException("participants must differ: " + initiatorId);
        }
        this.tradeId = Objects.requireNonNull(tradeId, "tradeId");
        this.initiatorId = Objects.requireNonNull(initiatorId, "initiatorId");
        this.initiatorName = initiatorName;
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.targetName = targetName;
        this.createdAt = now;
        this.lastUpdate = now;
    }

    // ---- 参与方 ----

    public boolean isParticipant(String userId) {
        return initiatorId.equals(userId) || targetId.equals(userId);
    }

    public boolean isInitiator(String userId) {
        return initiatorId.equals(userId);
    }

    public String partnerOf(String userId) {
        requireParticipant(userId);
        return isInitiator(userId) ? targetId : initiatorId;
    }

    public String nameOf(String userId) {
        requireParticipant(userId);
        return isInitiator(userId) ? initiatorName : targetName;
    }

    public TradeOffer offerOf(String userId) {
        requireParticipant(userId);
        return isInitiator(userId) ? initiatorOffer : targetOffer;
    }

    // ---- 确认标记 ----

    public boolean isConfirmed(String userId) {
        requireParticipant(userId);
        return isInitiator(userId) ? initiatorConfirmed : targetConfirmed;
    }

    /**
     * 标记某方已确认；首次确认时 PENDING -> ACTIVE。
     * @return false 表示该方之前已经确认过（幂等，不做任何改动）
     */
    public boolean confirm(String userId) {
        requireNotTerminal();
        if (isConfirmed(userId)) {
            return false;
        }
        if (isInitiator(userId)) {
            initiatorConfirmed = true;
        } else {
            targetConfirmed = true;
        }
        if (state == TradeState.PENDING) {
            state = TradeState.ACTIVE;
        }
        return true;
    }

    public boolean bothConfirmed() {
        return initiatorConfirmed && targetConfirmed;
    }

    /** 提交失败：清空确认，状态保持不变，允许调整后重试 */
    public void resetConfirmations() {
        initiatorConfirmed = false;
        targetConfirmed = false;
    }

    /** 报价变动：清空确认并回到 PENDING */
    public void reopenNegotiation() {
        requireNotTerminal();
        resetConfirmations();
        state = TradeState.PENDING;
    }

    // ---- 生命周期 ----

    public void complete() {
        if (!bothConfirmed()) {
            throw new IllegalStateException("trade " + tradeId + " completed without both confirmations");
        }
        requireNotTerminal();
        state = TradeState.COMPLETED;
    }

    public void cancel() {
        if (!state.isTerminal()) {
            state = TradeState.CANCELLED;
        }
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public void touch(long now) {
        this.lastUpdate = now;
    }

    private void requireParticipant(String userId) {
        if (!isParticipant(userId)) {
            throw new IllegalArgumentException("user " + userId + " is not part of trade " + tradeId);
        }
    }

    private void requireNotTerminal() {
        if (state.isTerminal()) {
            throw new IllegalStateException("trade " + tradeId + " already " + state);
        }
    }

    @Override
    public String toString() {
        return "TradeSession{" +
                "tradeId='" + tradeId + '\'' +
                ", initiator=" + initiatorId +
                ", target=" + targetId +
                ", state=" + state +
                '}';
    }
}
