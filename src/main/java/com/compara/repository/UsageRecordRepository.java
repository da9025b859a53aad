package com.compara.repository;

import com.compara.entity.UsageRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for per-comparison usage records.
 */
@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecordEntity, Long> {
}
