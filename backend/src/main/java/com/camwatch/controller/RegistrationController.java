package com.camwatch.controller;

import com.camwatch.dao.StorageUnavailableException;
import com.camwatch.domain.RegistryApi;
import com.camwatch.service.ApiException;
import com.camwatch.service.RegistryService;
import com.camwatch.util.HttpResponseFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.common.annotation.Path;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;
import ru.tinkoff.kora.json.common.annotation.Json;

@Component
@HttpController
public final class RegistrationController {
    private final RegistryService registryService;
    private final HttpResponseFactory responses;

    public RegistrationController(RegistryService registryService, HttpResponseFactory responses) {
        this.registryService = registryService;
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.POST, path = "/register")
    public HttpServerResponse registerUser(@Json RegistryApi.RegisterUserRequest request) {
        try {
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            registryService.registerUser(request.chatId(), request.username(), request.firstName(), request.lastName());
            return responses.ok(201);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/users/{chatId}")
    public HttpServerResponse getUser(@Path("chatId") String chatId) {
        try {
            return responses.json(200, registryService.getUser(chatId));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.POST, path = "/devices")
    public HttpServerResponse registerDevice(@Json RegistryApi.RegisterDeviceRequest request) {
        try {
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            registryService.registerDevice(request.deviceId(), request.nickname());
            return responses.ok(201);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/devices/{deviceId}")
    public HttpServerResponse getDevice(@Path("deviceId") String deviceId) {
        try {
            return responses.json(200, registryService.getDevice(deviceId));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (StorageUnavailableException e) {
            return responses.storageUnavailable(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}
