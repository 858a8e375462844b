package com.components.sourcing.controller;

import com.components.sourcing.model.MarketStatus;
import com.components.sourcing.service.MarketStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MarketController {

    private final MarketStatsService statsService;

    @GetMapping(path = "/market/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public MarketStatus stats() {
        return statsService.snapshot();
    }
}
