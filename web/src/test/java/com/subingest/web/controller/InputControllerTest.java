/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.web.controller;

import com.subingest.common.exception.ConfigurationException;
import com.subingest.common.model.WorkerState;
import com.subingest.server.input.Input;
import com.subingest.server.input.InputService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = InputController.class)
class InputControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private InputService inputService;

    private static Input.InputStats stats(String id) {
        return new Input.InputStats(id, "gcp-pubsub", WorkerState.RUNNING, "", "acme/orders/orders-ingest",
                5, 1, 2, 640, 3, Instant.parse("2025-06-01T12:00:00Z"), Instant.parse("2025-06-01T12:00:01Z"));
    }

    @Test
    void listsInputs() throws Exception {
        when(inputService.getAllStats()).thenReturn(List.of(stats("orders")));
        when(inputService.listInputIds()).thenReturn(List.of("orders", "billing"));
        when(inputService.getActiveCount()).thenReturn(1);

        mvc.perform(get("/api/v1/inputs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", is(2)))
                .andExpect(jsonPath("$.active", is(1)))
                .andExpect(jsonPath("$.inputs[0].id", is("orders")))
                .andExpect(jsonPath("$.inputs[0].state", is("RUNNING")))
                .andExpect(jsonPath("$.inputs[0].acked", is(5)));
    }

    @Test
    void unknownInputIs404() throws Exception {
        mvc.perform(get("/api/v1/inputs/nope")).andExpect(status().isNotFound());
        mvc.perform(get("/api/v1/inputs/nope/config")).andExpect(status().isNotFound());
    }

    @Test
    void showsStatsAndConfig() throws Exception {
        when(inputService.getStats("orders")).thenReturn(stats("orders"));
        when(inputService.getConfig("orders")).thenReturn(Map.of("topic", "${ORDERS_TOPIC}"));

        mvc.perform(get("/api/v1/inputs/orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source", is("acme/orders/orders-ingest")))
                .andExpect(jsonPath("$.nacked", is(2)));
        mvc.perform(get("/api/v1/inputs/orders/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topic", is("${ORDERS_TOPIC}")));
    }

    @Test
    void startAndStop() throws Exception {
        when(inputService.startInput("orders")).thenReturn(null);
        when(inputService.stopInput("orders")).thenReturn(null);

        mvc.perform(post("/api/v1/inputs/orders/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.input", is("orders")));
        mvc.perform(post("/api/v1/inputs/orders/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)));
        verify(inputService).startInput("orders");
        verify(inputService).stopInput("orders");
    }

    @Test
    void startErrorIsBadRequest() throws Exception {
        when(inputService.startInput("orders")).thenReturn("Input 'orders' is already running");

        mvc.perform(post("/api/v1/inputs/orders/start"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.error", is("Input 'orders' is already running")));
    }

    @Test
    void configurationErrorsRenderAsJson() throws Exception {
        when(inputService.getStats("orders")).thenThrow(new ConfigurationException("bad retry_interval"));

        mvc.perform(get("/api/v1/inputs/orders"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode", is("SI_CONFIG_INVALID")))
                .andExpect(jsonPath("$.message", is("bad retry_interval")))
                .andExpect(jsonPath("$.path", is("/api/v1/inputs/orders")));
    }

    @Test
    void unexpectedErrorsAre500() throws Exception {
        when(inputService.getAllStats()).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/v1/inputs"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.exceptionType", is("IllegalStateException")));
    }
}
