package com.camwatch.controller;

import com.camwatch.domain.RegistryApi;
import com.camwatch.util.HttpResponseFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;

@Component
@HttpController
public final class HealthController {
    private final HttpResponseFactory responses;

    public HealthController(HttpResponseFactory responses) {
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.GET, path = "/health")
    public HttpServerResponse health() {
        return responses.json(200, new RegistryApi.StatusResponse("up"));
    }
}
