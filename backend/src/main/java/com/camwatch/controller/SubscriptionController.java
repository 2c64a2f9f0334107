package com.camwatch.controller;

import com.camwatch.dao.StorageUnavailableException;
import com.camwatch.service.ApiException;
import com.camwatch.service.RegistryService;
import com.camwatch.util.HttpResponseFactory;
import com.camwatch.util.RequestParams;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.common.annotation.Path;
import ru.tinkoff.kora.http.server.common.HttpServerRequest;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;

@Component
@HttpController
public final class SubscriptionController {
    private final RegistryService registryService;
    private final HttpResponseFactory responses;

    public SubscriptionController(RegistryService registryService, HttpResponseFactory responses) {
        this.registryService = registryService;
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.POST, path = "/bind")
    public HttpServerResponse bind(HttpServerRequest request) {
        try {
            return bindWith(RequestParams.from(request));
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    HttpServerResponse bindWith(RequestParams params) {
        try {
            registryService.bind(params.get("chat_id"), params.get("device_id"));
            return responses.ok(201);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.DELETE, path = "/bind")
    public HttpServerResponse unbind(HttpServerRequest request) {
        try {
            return unbindWith(RequestParams.from(request));
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    HttpServerResponse unbindWith(RequestParams params) {
        try {
            registryService.unbind(params.get("chat_id"), params.get("device_id"));
            return responses.ok(200);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/subscribers/{deviceId}")
    public HttpServerResponse listSubscribers(@Path("deviceId") String deviceId) {
        try {
            return responses.json(200, registryService.listSubscribers(deviceId));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/users/{chatId}/devices")
    public HttpServerResponse listDevicesOfUser(@Path("chatId") String chatId) {
        try {
            return responses.json(200, registryService.listDevicesOfUser(chatId));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}
