package com.components.sourcing.controller;

import com.components.sourcing.model.Offer;
import com.components.sourcing.model.RiskLevel;
import com.components.sourcing.model.SourceTypes;
import com.components.sourcing.service.PartSearchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PartSearchController.class)
class PartSearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PartSearchService searchService;

    @Test
    void shouldReturnOffersAsSnakeCaseJson() throws Exception {
        // Given
        Offer offer = new Offer("3f9a0c11b2d4", "LM358DR", "Texas Instruments", "Mouser Electronics (API)",
                SourceTypes.OFFICIAL_API, 12000, 731.0, List.of(700.0, 760.0), "KRW", "In Stock", "New",
                "2024+", false, RiskLevel.LOW, Instant.parse("2026-03-01T10:00:00Z"), "", "Dual op-amp");
        when(searchService.search("LM358")).thenReturn(Mono.just(List.of(offer)));

        // When
        MvcResult pending = mockMvc.perform(get("/search").param("q", "LM358"))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Then
        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].source_type", is("Official API")))
                .andExpect(jsonPath("$[0].price", is(731.0)))
                .andExpect(jsonPath("$[0].price_history", hasSize(2)))
                .andExpect(jsonPath("$[0].is_eol", is(false)))
                .andExpect(jsonPath("$[0].risk_level", is("Low")))
                .andExpect(jsonPath("$[0].date_code", is("2024+")))
                .andExpect(jsonPath("$[0].updated_at", is("2026-03-01T10:00:00Z")));
    }

    @Test
    void shouldRejectBlankQuery() throws Exception {
        // Given
        when(searchService.search("  ")).thenThrow(new IllegalArgumentException("Search query must not be blank"));

        // When & Then
        mockMvc.perform(get("/search").param("q", "  "))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.detail", is("Search query must not be blank")));
    }

    @Test
    void shouldRejectMissingQuery() throws Exception {
        // Given
        when(searchService.search(isNull())).thenThrow(new IllegalArgumentException("Search query must not be blank"));

        // When & Then
        mockMvc.perform(get("/search"))
                .andExpect(status().isBadRequest());
    }
}
