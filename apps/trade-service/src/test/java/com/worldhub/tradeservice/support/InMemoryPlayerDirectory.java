package com.worldhub.tradeservice.support;

import com.worldhub.tradeservice.trade.domain.repository.PlayerDirectory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class InMemoryPlayerDirectory implements PlayerDirectory {

    private final Map<String, String> idsByName = new HashMap<>();
    private final Map<String, String> namesById = new HashMap<>();

    @Override
    public Optional<String> findUserByName(String name) {
        return Optional.ofNullable(idsByName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public String getDisplayName(String userId) {
        return namesById.getOrDefault(userId, "Player" + userId);
    }

    @Override
    public void register(String userId, String displayName) {
        namesById.put(userId, displayName);
        idsByName.put(displayName.toLowerCase(Locale.ROOT), userId);
    }

    @Override
    public void unregister(String userId) {
        String name = namesById.remove(userId);
        if (name != null) idsByName.remove(name.toLowerCase(Locale.ROOT));
    }
}
