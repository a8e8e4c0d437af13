package com.hrflow.hrflow_backend.repository;

import com.hrflow.hrflow_backend.model.domain.AllowedDomain;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AllowedDomainRepository extends JpaRepository<AllowedDomain, Long> {
    List<AllowedDomain> findAllByOrderByCreatedAtDesc();

    boolean existsByDomain(String domain);
}
