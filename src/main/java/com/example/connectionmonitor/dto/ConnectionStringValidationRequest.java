package com.example.connectionmonitor.dto;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStringValidationRequest {

    @NotNull(message = "Connection type is required")
    private ConnectionType type;

    @ToString.Exclude
    private String connectionString;
}
