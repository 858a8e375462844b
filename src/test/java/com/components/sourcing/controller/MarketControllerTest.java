package com.components.sourcing.controller;

import com.components.sourcing.model.MarketStatus;
import com.components.sourcing.service.MarketStatsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MarketController.class)
class MarketControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MarketStatsService statsService;

    @Test
    void shouldExposeMarketSnapshot() throws Exception {
        // Given
        when(statsService.snapshot()).thenReturn(new MarketStatus("VOLATILE", 250_000, 60, 3.25,
                Instant.parse("2026-03-01T12:00:00Z"),
                List.of("[FETCHED] mouser for LM358: 2 offers in 120ms", "[CONNECTING] Mouser Electronics for MARKET_SCAN")));

        // When & Then
        mockMvc.perform(get("/market/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.market_temperature", is("VOLATILE")))
                .andExpect(jsonPath("$.global_stock_index", is(250000)))
                .andExpect(jsonPath("$.active_brokers", is(60)))
                .andExpect(jsonPath("$.price_drift", is(3.25)))
                .andExpect(jsonPath("$.recent_logs", hasSize(2)));
    }
}
