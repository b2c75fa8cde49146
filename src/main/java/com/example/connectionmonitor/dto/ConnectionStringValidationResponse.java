package com.example.connectionmonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStringValidationResponse {

    private boolean valid;

    /**
     * Why the string was rejected, null when valid
     */
    private String errorMessage;

    public static ConnectionStringValidationResponse valid() {
        return ConnectionStringValidationResponse.builder().valid(true).build();
    }

    public static ConnectionStringValidationResponse invalid(String errorMessage) {
        return ConnectionStringValidationResponse.builder().valid(false).errorMessage(errorMessage).build();
    }
}
