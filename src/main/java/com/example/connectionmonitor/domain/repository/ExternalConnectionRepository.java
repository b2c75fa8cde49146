package com.example.connectionmonitor.domain.repository;

import com.example.connectionmonitor.domain.entity.ExternalConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for ExternalConnection entity
 */
@Repository
public interface ExternalConnectionRepository extends JpaRepository<ExternalConnection, UUID> {

    List<ExternalConnection> findByApplicationIdAndActiveTrueOrderByNameAsc(UUID applicationId);

    List<ExternalConnection> findByApplicationIdOrderByNameAsc(UUID applicationId);
}
