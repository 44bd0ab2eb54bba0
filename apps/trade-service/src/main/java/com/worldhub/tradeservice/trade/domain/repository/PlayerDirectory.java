package com.worldhub.tradeservice.trade.domain.repository;

import java.util.Optional;

/**
 * 在线玩家目录：名字 <-> 用户ID。
 * 连接建立时登记，断开时注销；名字查找不区分大小写。
 */
public interface PlayerDirectory {

    /**
     * 按名字查找在线玩家
     * @return 用户ID；不在线返回 empty
     */
    Optional<String> findUserByName(String name);

    /**
     * 获取展示名；未知用户返回 "Player{userId}"
     */
    String getDisplayName(String userId);

    /** 登记在线玩家 */
    void register(String userId, String displayName);

    /** 注销在线玩家 */
    void unregister(String userId);
}
