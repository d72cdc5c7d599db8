package com.wshg.catalog.repository;

import com.wshg.catalog.entity.ResourceEntity;
import com.wshg.catalog.model.VectorState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ResourceRepository extends JpaRepository<ResourceEntity, String>, JpaSpecificationExecutor<ResourceEntity> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from ResourceEntity r where r.id = :id")
    Optional<ResourceEntity> findByIdForUpdate(@Param("id") String id);

    List<ResourceEntity> findByParentIdOrderByCreatedAtDescIdAsc(String parentId);

    List<ResourceEntity> findByVectorState(VectorState vectorState);
}
