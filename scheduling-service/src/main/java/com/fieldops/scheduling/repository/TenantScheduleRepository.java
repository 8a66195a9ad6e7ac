package com.fieldops.scheduling.repository;

import com.fieldops.scheduling.entity.TenantScheduleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TenantScheduleRepository extends JpaRepository<TenantScheduleEntity, String> {
}
