package com.components.sourcing.controller;

import com.components.sourcing.dto.ProcurementLockRequest;
import com.components.sourcing.model.LockConfirmation;
import com.components.sourcing.service.ProcurementService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoint: <code>POST /procurement/lock</code>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * { "part_id": "3f9a0c11b2d4", "quantity": 250 }
 * }</pre>
 */
@RestController
@RequiredArgsConstructor
public class ProcurementController {

    private final ProcurementService procurementService;

    @PostMapping(path = "/procurement/lock",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public LockConfirmation lock(@RequestBody @Validated final ProcurementLockRequest request) {
        return procurementService.lock(request.partId(), request.quantity());
    }
}
