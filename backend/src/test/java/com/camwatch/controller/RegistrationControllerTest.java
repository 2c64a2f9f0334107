package com.camwatch.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.camwatch.TestAppConfig;
import com.camwatch.dao.InMemoryRegistryStore;
import com.camwatch.domain.RegistryApi;
import com.camwatch.service.RegistryService;
import com.camwatch.util.HttpResponseFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegistrationControllerTest {

    private InMemoryRegistryStore store;
    private RegistrationController controller;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
        controller = new RegistrationController(new RegistryService(store, new TestAppConfig()), new HttpResponseFactory());
    }

    @Test
    void registrationsAnswerCreated() {
        var user = controller.registerUser(new RegistryApi.RegisterUserRequest(100L, "alice", null, null));
        var device = controller.registerDevice(new RegistryApi.RegisterDeviceRequest("cam1", "kitchen"));

        assertThat(user.code()).isEqualTo(201);
        assertThat(device.code()).isEqualTo(201);
        assertThat(controller.getUser("100").code()).isEqualTo(200);
        assertThat(controller.getDevice("cam1").code()).isEqualTo(200);
    }

    @Test
    void missingBodyOrIdentifierIsClientError() {
        assertThat(controller.registerUser(null).code()).isEqualTo(400);
        assertThat(controller.registerUser(new RegistryApi.RegisterUserRequest(null, "alice", null, null)).code())
            .isEqualTo(400);
        assertThat(controller.registerDevice(new RegistryApi.RegisterDeviceRequest(" ", null)).code())
            .isEqualTo(400);
        assertThat(controller.getUser("not-a-number").code()).isEqualTo(400);
    }

    @Test
    void unknownRecordsAreNotFound() {
        assertThat(controller.getUser("42").code()).isEqualTo(404);
        assertThat(controller.getDevice("nope").code()).isEqualTo(404);
    }

    @Test
    void storageOutageIsServiceUnavailable() {
        store.setUnavailable(true);

        assertThat(controller.registerUser(new RegistryApi.RegisterUserRequest(1L, null, null, null)).code())
            .isEqualTo(503);
        assertThat(controller.getDevice("cam1").code()).isEqualTo(503);
    }
}
