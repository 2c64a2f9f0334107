package com.camwatch.dao;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Store with the same conflict rules as the Postgres schema: subscriptions need a
 * registered user, and a rejected bind leaves nothing behind.
 */
public final class InMemoryRegistryStore implements RegistryStore {
    private final Map<Long, UserRow> users = new LinkedHashMap<>();
    private final Map<String, DeviceRow> devices = new LinkedHashMap<>();
    private final Set<Subscription> subscriptions = new LinkedHashSet<>();
    private boolean unavailable;

    private record Subscription(long chatId, String deviceId) {
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public int userCount() {
        return users.size();
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    @Override
    public synchronized void upsertUser(long chatId, String username, String firstName, String lastName) {
        checkAvailable();
        Instant registeredAt = users.containsKey(chatId) ? users.get(chatId).registeredAt() : Instant.now();
        users.put(chatId, new UserRow(chatId, username, firstName, lastName, registeredAt));
    }

    @Override
    public synchronized void upsertDevice(String deviceId, String nickname) {
        checkAvailable();
        DeviceRow current = devices.get(deviceId);
        if (current == null) {
            devices.put(deviceId, new DeviceRow(deviceId, nickname, Instant.now()));
        } else if (nickname != null) {
            devices.put(deviceId, new DeviceRow(deviceId, nickname, current.registeredAt()));
        }
    }

    @Override
    public synchronized void bind(long chatId, String deviceId) {
        checkAvailable();
        if (!users.containsKey(chatId)) {
            throw new ReferentialIntegrityException("Referenced row does not exist", null);
        }
        devices.putIfAbsent(deviceId, new DeviceRow(deviceId, null, Instant.now()));
        subscriptions.add(new Subscription(chatId, deviceId));
    }

    @Override
    public synchronized boolean unbind(long chatId, String deviceId) {
        checkAvailable();
        return subscriptions.remove(new Subscription(chatId, deviceId));
    }

    @Override
    public synchronized List<Long> listSubscribers(String deviceId) {
        checkAvailable();
        List<Long> rows = new ArrayList<>();
        for (Subscription s : subscriptions) {
            if (s.deviceId().equals(deviceId)) {
                rows.add(s.chatId());
            }
        }
        return rows;
    }

    @Override
    public synchronized List<String> listDevicesOfUser(long chatId) {
        checkAvailable();
        return subscriptions.stream()
            .filter(s -> s.chatId() == chatId)
            .map(Subscription::deviceId)
            .sorted()
            .toList();
    }

    @Override
    public synchronized Optional<UserRow> findUser(long chatId) {
        checkAvailable();
        return Optional.ofNullable(users.get(chatId));
    }

    @Override
    public synchronized Optional<DeviceRow> findDevice(String deviceId) {
        checkAvailable();
        return Optional.ofNullable(devices.get(deviceId));
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StorageUnavailableException("Storage unavailable", null);
        }
    }
}
