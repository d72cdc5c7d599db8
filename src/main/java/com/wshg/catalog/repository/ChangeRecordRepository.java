package com.wshg.catalog.repository;

import com.wshg.catalog.entity.ChangeRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface ChangeRecordRepository extends JpaRepository<ChangeRecordEntity, String> {

    List<ChangeRecordEntity> findByResourceIdOrderBySequenceAsc(String resourceId);

    Optional<ChangeRecordEntity> findFirstByResourceIdOrderBySequenceDesc(String resourceId);

    long countByResourceId(String resourceId);

    @Query("select distinct c.resourceId from ChangeRecordEntity c order by c.resourceId")
    List<String> findChainIds();
}
