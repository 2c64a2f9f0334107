package com.camwatch.dao;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RegistryStore {

    record UserRow(long chatId,
                   String username,
                   String firstName,
                   String lastName,
                   Instant registeredAt) {}

    record DeviceRow(String deviceId,
                     String nickname,
                     Instant registeredAt) {}

    void upsertUser(long chatId, String username, String firstName, String lastName);

    // null nickname keeps the stored one
    void upsertDevice(String deviceId, String nickname);

    void bind(long chatId, String deviceId);

    boolean unbind(long chatId, String deviceId);

    List<Long> listSubscribers(String deviceId);

    List<String> listDevicesOfUser(long chatId);

    Optional<UserRow> findUser(long chatId);

    Optional<DeviceRow> findDevice(String deviceId);
}
