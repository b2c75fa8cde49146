package com.example.connectionmonitor.mapper;

import com.example.connectionmonitor.domain.entity.ExternalConnection;
import com.example.connectionmonitor.dto.ConnectionResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for connections. Encrypted columns are reduced to "is set" flags.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ConnectionMapper {

    @Mapping(target = "typeCode", expression = "java(connection.getType() != null ? connection.getType().getCode() : null)")
    @Mapping(target = "typeDisplayName", expression = "java(connection.getType() != null ? connection.getType().getDisplayName() : null)")
    @Mapping(target = "hasPassword", expression = "java(isSet(connection.getPasswordEncrypted()))")
    @Mapping(target = "hasConnectionString", expression = "java(isSet(connection.getConnectionStringEncrypted()))")
    @Mapping(target = "hasApiKey", expression = "java(isSet(connection.getApiKeyEncrypted()))")
    @Mapping(target = "hasGitHubToken", expression = "java(isSet(connection.getGitHubTokenEncrypted()))")
    ConnectionResponse toResponse(ExternalConnection connection);

    List<ConnectionResponse> toResponseList(List<ExternalConnection> connections);

    default boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
