package com.worldhub.tradeservice.trade.domain.model;

/**
 * 报价修改的目标：某个背包格子，或金币。
 * 旧客户端协议用 slot=0 表示金币，在接入层通过 {@link #fromLegacySlot(int)} 转换。
 */
public sealed interface OfferTarget permits OfferTarget.Slot, OfferTarget.Gold {

    /** 旧协议中表示金币的格子号 */
    int LEGACY_GOLD_SLOT = 0;

    record Slot(int slot) implements OfferTarget {
    }

    enum Gold implements OfferTarget {
        INSTANCE
    }

    static OfferTarget slot(int slot) {
        return new Slot(slot);
    }

    static OfferTarget gold() {
        return Gold.INSTANCE;
    }

    static OfferTarget fromLegacySlot(int slot) {
        return slot == LEGACY_GOLD_SLOT ? Gold.INSTANCE : new Slot(slot);
    }
}
