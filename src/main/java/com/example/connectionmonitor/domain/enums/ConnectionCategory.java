package com.example.connectionmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ConnectionCategory {

    RELATIONAL_DATABASE("Relational Database"),
    NOSQL_DATABASE("NoSQL Database"),
    API("API Connection"),
    CLOUD_SERVICE("Cloud Service"),
    DATA_WAREHOUSE("Data Warehouse"),
    SAAS_API("SaaS API"),
    OTHER("Other");

    private final String displayName;
}
