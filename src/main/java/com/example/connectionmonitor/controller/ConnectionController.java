package com.example.connectionmonitor.controller;

import com.example.connectionmonitor.dto.ApiResponse;
import com.example.connectionmonitor.dto.ConnectionResponse;
import com.example.connectionmonitor.dto.ConnectionStringValidationRequest;
import com.example.connectionmonitor.dto.ConnectionStringValidationResponse;
import com.example.connectionmonitor.dto.ConnectionTestResponse;
import com.example.connectionmonitor.dto.CreateConnectionRequest;
import com.example.connectionmonitor.dto.UpdateConnectionRequest;
import com.example.connectionmonitor.service.ConnectionManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for external connections.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/connections")
@Tag(name = "Connections", description = "APIs for managing and testing external connections")
public class ConnectionController {

    private final ConnectionManagementService connectionManagementService;

    @PostMapping
    @Operation(summary = "Create a connection", description = "Secrets are encrypted at rest and never returned")
    public ResponseEntity<ApiResponse<ConnectionResponse>> createConnection(@Valid @RequestBody CreateConnectionRequest request) {
        log.info("API: Create {} connection '{}'", request.getType(), request.getName());

        var response = connectionManagementService.createConnection(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Connection created successfully"));
    }

    @GetMapping
    @Operation(summary = "List connections", description = "Optionally filtered by application")
    public ResponseEntity<ApiResponse<List<ConnectionResponse>>> listConnections(
            @Parameter(description = "Application UUID filter") @RequestParam(required = false) UUID applicationId) {
        return ResponseEntity.ok(ApiResponse.success(connectionManagementService.listConnections(applicationId)));
    }

    @GetMapping("/{connectionId}")
    @Operation(summary = "Get connection by ID")
    public ResponseEntity<ApiResponse<ConnectionResponse>> getConnection(@Parameter(description = "Connection UUID") @PathVariable UUID connectionId) {
        return ResponseEntity.ok(ApiResponse.success(connectionManagementService.getConnection(connectionId)));
    }

    @PutMapping("/{connectionId}")
    @Operation(summary = "Update a connection", description = "Null fields are unchanged; an empty secret clears it")
    public ResponseEntity<ApiResponse<ConnectionResponse>> updateConnection(
            @Parameter(description = "Connection UUID") @PathVariable UUID connectionId,
            @Valid @RequestBody UpdateConnectionRequest request) {
        log.info("API: Update connection {}", connectionId);

        var response = connectionManagementService.updateConnection(connectionId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Connection updated successfully"));
    }

    @PostMapping("/{connectionId}/toggle")
    @Operation(summary = "Activate or deactivate a connection")
    public ResponseEntity<ApiResponse<ConnectionResponse>> toggleConnection(@Parameter(description = "Connection UUID") @PathVariable UUID connectionId) {
        log.info("API: Toggle connection {}", connectionId);

        var response = connectionManagementService.toggleConnection(connectionId);
        var message = Boolean.TRUE.equals(response.getActive()) ? "Connection activated" : "Connection deactivated";
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    @DeleteMapping("/{connectionId}")
    @Operation(summary = "Delete a connection")
    public ResponseEntity<ApiResponse<Void>> deleteConnection(@Parameter(description = "Connection UUID") @PathVariable UUID connectionId) {
        log.info("API: Delete connection {}", connectionId);

        connectionManagementService.deleteConnection(connectionId);
        return ResponseEntity.ok(ApiResponse.success(null, "Connection deleted successfully"));
    }

    @PostMapping("/{connectionId}/test")
    @Operation(summary = "Test a connection now", description = "Probes the connection and records the result on it")
    public ResponseEntity<ApiResponse<ConnectionTestResponse>> testConnection(@Parameter(description = "Connection UUID") @PathVariable UUID connectionId) {
        log.info("API: Test connection {}", connectionId);

        var response = connectionManagementService.testConnection(connectionId);
        return ResponseEntity.ok(ApiResponse.success(response, response.getMessage()));
    }

    @PostMapping("/validate-connection-string")
    @Operation(summary = "Validate a connection string format", description = "Format check only, nothing is contacted")
    public ResponseEntity<ApiResponse<ConnectionStringValidationResponse>> validateConnectionString(
            @Valid @RequestBody ConnectionStringValidationRequest request) {
        return ResponseEntity.ok(ApiResponse.success(connectionManagementService.validateConnectionString(request)));
    }
}
