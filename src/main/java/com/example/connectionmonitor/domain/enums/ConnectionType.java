package com.example.connectionmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of external resource a connection can point at.
 * <p>
 * Numeric codes are stable and grouped by family (1x relational, 1x NoSQL,
 * 2x API, 3x AWS, 4x Azure, 5x Google, 6x warehouses, 7x SaaS APIs).
 * Which types are actually probeable is decided by the registered probes,
 * not by this enum.
 */
@Getter
@RequiredArgsConstructor
public enum ConnectionType {

    SQL_SERVER(1, "Microsoft SQL Server", ConnectionCategory.RELATIONAL_DATABASE),
    MYSQL(2, "MySQL", ConnectionCategory.RELATIONAL_DATABASE),
    POSTGRESQL(3, "PostgreSQL", ConnectionCategory.RELATIONAL_DATABASE),
    ORACLE(4, "Oracle Database", ConnectionCategory.RELATIONAL_DATABASE),
    SQLITE(5, "SQLite", ConnectionCategory.RELATIONAL_DATABASE),

    MONGODB(11, "MongoDB", ConnectionCategory.NOSQL_DATABASE),
    REDIS(12, "Redis", ConnectionCategory.NOSQL_DATABASE),

    REST_API(21, "REST API", ConnectionCategory.API),
    GRAPHQL(22, "GraphQL API", ConnectionCategory.API),
    WEBSOCKET(23, "WebSocket", ConnectionCategory.API),

    AWS_RDS(31, "AWS RDS", ConnectionCategory.CLOUD_SERVICE),
    AWS_DYNAMODB(32, "AWS DynamoDB", ConnectionCategory.CLOUD_SERVICE),
    AWS_S3(33, "AWS S3", ConnectionCategory.CLOUD_SERVICE),

    AZURE_SQL(41, "Azure SQL Database", ConnectionCategory.RELATIONAL_DATABASE),
    AZURE_COSMOSDB(42, "Azure Cosmos DB", ConnectionCategory.CLOUD_SERVICE),
    AZURE_STORAGE(43, "Azure Storage", ConnectionCategory.CLOUD_SERVICE),

    GOOGLE_CLOUDSQL(51, "Google Cloud SQL", ConnectionCategory.CLOUD_SERVICE),
    GOOGLE_FIRESTORE(52, "Google Firestore", ConnectionCategory.CLOUD_SERVICE),
    GOOGLE_BIGQUERY(53, "Google BigQuery", ConnectionCategory.DATA_WAREHOUSE),

    SNOWFLAKE(61, "Snowflake", ConnectionCategory.DATA_WAREHOUSE),
    DATABRICKS(62, "Databricks", ConnectionCategory.DATA_WAREHOUSE),

    SALESFORCE_API(71, "Salesforce API", ConnectionCategory.SAAS_API),
    SERVICENOW_API(72, "ServiceNow API", ConnectionCategory.SAAS_API),
    GITHUB_API(73, "GitHub API", ConnectionCategory.SAAS_API),

    CUSTOM(99, "Custom Connection", ConnectionCategory.OTHER);

    private final int code;
    private final String displayName;
    private final ConnectionCategory category;

    /**
     * Database-like targets get the shorter database probe timeout
     */
    public boolean isDatabase() {
        return category == ConnectionCategory.RELATIONAL_DATABASE
                || category == ConnectionCategory.NOSQL_DATABASE
                || category == ConnectionCategory.DATA_WAREHOUSE;
    }
}
