package com.components.sourcing.controller;

import com.components.sourcing.model.Offer;
import com.components.sourcing.service.PartSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller exposing the aggregated part search.
 * <p>
 * Endpoint: <code>GET /search?q={partNumber}</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * [
 *   {
 *     "id": "3f9a0c11b2d4",
 *     "mpn": "LM358DR",
 *     "distributor": "Mouser Electronics (API)",
 *     "source_type": "API",
 *     "stock": 12000,
 *     "price": 731.0,
 *     "price_history": [712.0, 745.0, ...],
 *     "currency": "KRW",
 *     "risk_level": "Low",
 *     ...
 *   },
 *   ...
 * ]
 * }</pre>
 * A blank or missing {@code q} is rejected with 400.
 */
@RestController
@RequiredArgsConstructor
public class PartSearchController {

    private final PartSearchService searchService;

    /**
     * @param query the part number or free text to search for
     * @return offers sorted ascending by price, never empty
     */
    @GetMapping(path = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<Offer>> search(@RequestParam(name = "q", required = false) final String query) {
        return searchService.search(query);
    }
}
