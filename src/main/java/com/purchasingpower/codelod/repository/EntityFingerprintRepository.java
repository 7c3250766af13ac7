package com.purchasingpower.codelod.repository;

import com.purchasingpower.codelod.model.EntityFingerprintEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EntityFingerprintRepository extends JpaRepository<EntityFingerprintEntity, String> {

    List<EntityFingerprintEntity> findByFilePath(String filePath);
}
