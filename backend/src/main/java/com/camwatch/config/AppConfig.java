package com.camwatch.config;

import ru.tinkoff.kora.config.common.annotation.ConfigSource;
import ru.tinkoff.kora.config.common.annotation.ConfigValueExtractor;

@ConfigSource("app")
@ConfigValueExtractor
public interface AppConfig {
    RegistryConfig registry();

    @ConfigValueExtractor
    interface RegistryConfig {
        int deviceIdMaxLength();
        int nicknameMaxLength();
    }
}
