package com.eden.gateway.controller;

import com.eden.gateway.discovery.ServiceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class InstanceAdminControllerTest {

    private static final String INSTANCE_JSON = "{\"id\":\"sync-a\",\"address\":\"10.0.0.5\",\"port\":9000,\"health\":\"HEALTHY\",\"metadata\":{\"zone\":\"eu-1\"}}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ServiceRegistry serviceRegistry;

    @AfterEach
    void tearDown() {
        serviceRegistry.deregisterInstance("sync-a");
    }

    @Test
    void registerInstance_ShouldReturnCreatedAndBeListed() throws Exception {
        mockMvc.perform(post("/services/{service}/instances", "sync")
                        .contentType(MediaType.APPLICATION_JSON).content(INSTANCE_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("sync-a"))
                .andExpect(jsonPath("$.serviceName").value("sync"))
                .andExpect(jsonPath("$.health").value("HEALTHY"))
                .andExpect(jsonPath("$.metadata.zone").value("eu-1"));

        mockMvc.perform(get("/services/{service}/instances", "sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("sync"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.instances[0].id").value("sync-a"));
    }

    @Test
    void registerInstance_WithDuplicateId_ShouldReturnConflict() throws Exception {
        mockMvc.perform(post("/services/{service}/instances", "sync")
                        .contentType(MediaType.APPLICATION_JSON).content(INSTANCE_JSON))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/services/{service}/instances", "flow")
                        .contentType(MediaType.APPLICATION_JSON).content(INSTANCE_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("instance 'sync-a' already registered"));
    }

    @Test
    void registerInstance_WithInvalidPort_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/services/{service}/instances", "sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"sync-a\",\"address\":\"10.0.0.5\",\"port\":70000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("port must be between 1 and 65535"));
    }

    @Test
    void updateHealth_ShouldChangeInstanceHealth() throws Exception {
        mockMvc.perform(post("/services/{service}/instances", "sync")
                        .contentType(MediaType.APPLICATION_JSON).content(INSTANCE_JSON))
                .andExpect(status().isCreated());

        mockMvc.perform(put("/instances/{id}/health", "sync-a")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"health\":\"UNHEALTHY\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health").value("UNHEALTHY"));
    }

    @Test
    void updateHealth_WithoutHealth_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(put("/instances/{id}/health", "sync-a")
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("health is required"));
    }

    @Test
    void updateHealth_ForUnknownInstance_ShouldReturnNotFound() throws Exception {
        mockMvc.perform(put("/instances/{id}/health", "nope")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"health\":\"HEALTHY\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("instance 'nope' not found"));
    }

    @Test
    void deregisterInstance_ShouldBeIdempotent() throws Exception {
        mockMvc.perform(post("/services/{service}/instances", "sync")
                        .contentType(MediaType.APPLICATION_JSON).content(INSTANCE_JSON))
                .andExpect(status().isCreated());

        mockMvc.perform(delete("/instances/{id}", "sync-a")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/instances/{id}", "sync-a")).andExpect(status().isNoContent());
        mockMvc.perform(get("/services/{service}/instances", "sync"))
                .andExpect(jsonPath("$.total").value(0));
    }
}
