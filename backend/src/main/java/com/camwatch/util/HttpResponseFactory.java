package com.camwatch.util;

import com.camwatch.dao.StorageUnavailableException;
import com.camwatch.domain.RegistryApi;
import com.camwatch.service.ApiException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.body.HttpBody;
import ru.tinkoff.kora.http.common.header.HttpHeaders;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.SimpleHttpServerResponse;

@Component
public class HttpResponseFactory {
    private static final Logger logger = LoggerFactory.getLogger(HttpResponseFactory.class);

    public HttpServerResponse json(int statusCode, Object value) {
        return new SimpleHttpServerResponse(
            statusCode,
            HttpHeaders.of("Content-Type", "application/json; charset=utf-8"),
            HttpBody.plaintext(Jsons.stringify(value))
        );
    }

    public HttpServerResponse ok(int statusCode) {
        return json(statusCode, new RegistryApi.StatusResponse("ok"));
    }

    public HttpServerResponse fromException(ApiException e) {
        return json(e.status(), Map.of("error", e.publicMessage()));
    }

    public HttpServerResponse storageUnavailable(StorageUnavailableException e) {
        return fromException(ApiException.serviceUnavailable("storage_unavailable"));
    }

    public HttpServerResponse internalError(Exception e) {
        logger.error("Unhandled server error", e);
        return json(500, Map.of("error", "internal_error"));
    }
}
