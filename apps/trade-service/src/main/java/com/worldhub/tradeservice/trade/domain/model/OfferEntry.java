package com.worldhub.tradeservice.trade.domain.model;

/**
 * 报价条目（带标签的联合类型）：要么是某个背包格子里的物品，要么是一笔金币。
 */
public sealed interface OfferEntry permits OfferedItem, OfferedGold {
}
