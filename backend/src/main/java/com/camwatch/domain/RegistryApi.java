package com.camwatch.domain;

import jakarta.annotation.Nullable;
import java.time.Instant;
import ru.tinkoff.kora.json.common.annotation.Json;
import ru.tinkoff.kora.json.common.annotation.JsonField;

public final class RegistryApi {
    private RegistryApi() {
    }

    @Json
    public record RegisterUserRequest(@Nullable @JsonField("chat_id") Long chatId,
                                      @Nullable String username,
                                      @Nullable @JsonField("first_name") String firstName,
                                      @Nullable @JsonField("last_name") String lastName) {
    }

    @Json
    public record RegisterDeviceRequest(@Nullable @JsonField("device_id") String deviceId,
                                        @Nullable String nickname) {
    }

    public record StatusResponse(String status) {
    }

    public record UserRecord(long chatId,
                             String username,
                             String firstName,
                             String lastName,
                             Instant registeredAt) {
    }

    public record DeviceRecord(String deviceId,
                               String nickname,
                               Instant registeredAt) {
    }
}
