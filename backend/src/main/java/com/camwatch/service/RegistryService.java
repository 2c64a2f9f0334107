package com.camwatch.service;

import com.camwatch.config.AppConfig;
import com.camwatch.dao.ReferentialIntegrityException;
import com.camwatch.dao.RegistryStore;
import com.camwatch.domain.RegistryApi;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class RegistryService {
    private static final Logger logger = LoggerFactory.getLogger(RegistryService.class);

    private final RegistryStore store;
    private final AppConfig appConfig;

    public RegistryService(RegistryStore store, AppConfig appConfig) {
        this.store = store;
        this.appConfig = appConfig;
    }

    public void registerUser(Long chatId, String username, String firstName, String lastName) {
        long id = requireChatId(chatId);
        store.upsertUser(id, username, firstName, lastName);
        logger.info("User registered: {}", id);
    }

    public void registerDevice(String deviceId, String nickname) {
        String id = normalizeDeviceId(deviceId);
        String normalizedNickname = normalizeNickname(nickname);
        store.upsertDevice(id, normalizedNickname);
        logger.info("Device registered: {} nickname={}", id, normalizedNickname);
    }

    public void bind(String chatId, String deviceId) {
        long id = parseChatId(chatId);
        String device = normalizeDeviceId(deviceId);
        try {
            store.bind(id, device);
        } catch (ReferentialIntegrityException e) {
            logger.warn("Bind rejected, user {} is not registered (device {})", id, device);
            throw ApiException.conflict("user_not_registered");
        }
        logger.info("Bound user {} to device {}", id, device);
    }

    public void unbind(String chatId, String deviceId) {
        long id = parseChatId(chatId);
        String device = normalizeDeviceId(deviceId);
        boolean removed = store.unbind(id, device);
        logger.info("Unbound user {} from device {} (removed: {})", id, device, removed);
    }

    public List<Long> listSubscribers(String deviceId) {
        String device = normalizeDeviceId(deviceId);
        List<Long> subscribers = store.listSubscribers(device);
        logger.debug("Device {} has {} subscribers", device, subscribers.size());
        return subscribers;
    }

    public List<String> listDevicesOfUser(String chatId) {
        return store.listDevicesOfUser(parseChatId(chatId));
    }

    public RegistryApi.UserRecord getUser(String chatId) {
        var row = store.findUser(parseChatId(chatId))
            .orElseThrow(() -> ApiException.notFound("user_not_found"));
        return new RegistryApi.UserRecord(
            row.chatId(),
            row.username(),
            row.firstName(),
            row.lastName(),
            row.registeredAt()
        );
    }

    public RegistryApi.DeviceRecord getDevice(String deviceId) {
        var row = store.findDevice(normalizeDeviceId(deviceId))
            .orElseThrow(() -> ApiException.notFound("device_not_found"));
        return new RegistryApi.DeviceRecord(row.deviceId(), row.nickname(), row.registeredAt());
    }

    static long requireChatId(Long value) {
        if (value == null) {
            throw ApiException.badRequest("chat_id_required");
        }
        return value;
    }

    static long parseChatId(String value) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest("chat_id_required");
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw ApiException.badRequest("chat_id_invalid");
        }
    }

    private String normalizeDeviceId(String value) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest("device_id_required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > appConfig.registry().deviceIdMaxLength()) {
            throw ApiException.badRequest("device_id_too_long");
        }
        return trimmed;
    }

    private String normalizeNickname(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > appConfig.registry().nicknameMaxLength()) {
            throw ApiException.badRequest("nickname_too_long");
        }
        return trimmed;
    }
}
