package com.worldhub.tradeservice.trade.domain.model;

/**
 * 加入物品后被修改的格子。
 *
 * @param slot        格子号
 * @param newQuantity 加入后的数量
 * @param added       本次加入到该格子的数量
 */
public record SlotChange(int slot, int newQuantity, int added) {
}
