package com.camwatch.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.camwatch.dao.StorageUnavailableException;
import com.camwatch.service.ApiException;
import org.junit.jupiter.api.Test;

class HttpResponseFactoryTest {

    private final HttpResponseFactory responses = new HttpResponseFactory();

    @Test
    void mapsStatusCodes() {
        assertThat(responses.ok(201).code()).isEqualTo(201);
        assertThat(responses.ok(200).code()).isEqualTo(200);
        assertThat(responses.fromException(ApiException.badRequest("chat_id_required")).code()).isEqualTo(400);
        assertThat(responses.fromException(ApiException.conflict("user_not_registered")).code()).isEqualTo(409);
        assertThat(responses.storageUnavailable(new StorageUnavailableException("down", null)).code()).isEqualTo(503);
        assertThat(responses.internalError(new IllegalStateException("Database error")).code()).isEqualTo(500);
    }
}
