package com.worldhub.tradeservice.trade.application;

import com.worldhub.tradeservice.config.TradeProperties;
import com.worldhub.tradeservice.trade.domain.TradeException;
import com.worldhub.tradeservice.trade.domain.constants.TradeMessages;
import com.worldhub.tradeservice.trade.domain.enums.TradeError;
import com.worldhub.tradeservice.trade.domain.model.OfferedItem;
import com.worldhub.tradeservice.trade.domain.model.SlotContent;
import com.worldhub.tradeservice.trade.domain.model.TradeOffer;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import com.worldhub.tradeservice.trade.domain.repository.CurrencyStore;
import com.worldhub.tradeservice.trade.domain.repository.InventoryStore;
import com.worldhub.tradeservice.trade.domain.repository.PlayerDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 报价校验器：所有判断都基于存储中的实时数据，而不是报价时缓存的数值。
 * 校验失败抛出 {@link TradeException}，由服务层转换为结果。
 */
@Component
@RequiredArgsConstructor
public class OfferValidator {

    private final InventoryStore inventoryStore;
    private final CurrencyStore currencyStore;
    private final PlayerDirectory playerDirectory;
    private final TradeProperties properties;

    /**
     * 校验一次物品报价，返回应写入报价的条目（itemId 以实时格子为准）。
     *
     * @param userId   报价方
     * @param offer    报价方当前的报价
     * @param slot     格子号
     * @param quantity 报价数量（> 0）
     */
    public OfferedItem checkItem(String userId, TradeOffer offer, int slot, long quantity) {
        checkSlotRange(slot);
        if (quantity <= 0 || quantity > Integer.MAX_VALUE) {
            throw new TradeException(TradeError.INVALID_OFFER, TradeMessages.NOT_ENOUGH_IN_SLOT);
        }
        SlotContent content = inventoryStore.getSlot(userId, slot)
                .orElseThrow(() -> new TradeException(TradeError.INVALID_OFFER, TradeMessages.SLOT_EMPTY));
        if (quantity > content.quantity()) {
            throw new TradeException(TradeError.INVALID_OFFER, TradeMessages.NOT_ENOUGH_IN_SLOT);
        }
        OfferedItem existing = offer.item(slot);
        if (existing != null && existing.itemId() != content.itemId()) {
            throw new TradeException(TradeError.INVALID_OFFER, TradeMessages.SLOT_OFFER_CONFLICT);
        }
        return new OfferedItem(slot, content.itemId(), (int) quantity);
    }

    /** 校验金币报价不超过实时余额 */
    public void checkGold(String userId, long amount) {
        if (amount > currencyStore.getGold(userId)) {
            throw new TradeException(TradeError.INSUFFICIENT_GOLD, TradeMessages.NOT_ENOUGH_GOLD);
        }
    }

    public void checkSlotRange(int slot) {
        int maxSlots = properties.getInventory().getMaxSlots();
        if (slot < 1 || slot > maxSlots) {
            throw new TradeException(TradeError.INVALID_OFFER, TradeMessages.formatInvalidSlot(slot));
        }
    }

    /**
     * 提交前复核双方全部报价。任何一条不满足即抛出 VALIDATION_STALE，并点名违规方。
     */
    public void revalidate(TradeSession session) {
        revalidateOffer(session.getInitiatorId(), session.getInitiatorOffer());
        revalidateOffer(session.getTargetId(), session.getTargetOffer());
    }

    private void revalidateOffer(String userId, TradeOffer offer) {
        for (OfferedItem item : offer.items()) {
            SlotContent live = inventoryStore.getSlot(userId, item.slot()).orElse(null);
            if (live == null) {
                throw stale(TradeMessages.formatStaleSlotEmpty(playerDirectory.getDisplayName(userId), item.slot()));
            }
            if (live.itemId() != item.itemId() || live.quantity() < item.quantity()) {
                throw stale(TradeMessages.formatStaleSlotChanged(playerDirectory.getDisplayName(userId), item.slot()));
            }
        }
        if (offer.gold() > currencyStore.getGold(userId)) {
            throw stale(TradeMessages.formatStaleGold(playerDirectory.getDisplayName(userId)));
        }
    }

    private static TradeException stale(String message) {
        return new TradeException(TradeError.VALIDATION_STALE, message);
    }
}
