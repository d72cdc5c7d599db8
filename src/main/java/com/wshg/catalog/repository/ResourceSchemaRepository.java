package com.wshg.catalog.repository;

import com.wshg.catalog.entity.ResourceSchemaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ResourceSchemaRepository extends JpaRepository<ResourceSchemaEntity, Long> {

    Optional<ResourceSchemaEntity> findByProviderAndType(String provider, String type);

    List<ResourceSchemaEntity> findByProviderOrderByTypeAsc(String provider);

    List<ResourceSchemaEntity> findAllByOrderByProviderAscTypeAsc();
}
