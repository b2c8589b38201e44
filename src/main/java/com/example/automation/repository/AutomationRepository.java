package com.example.automation.repository;

import com.example.automation.entity.AutomationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 自动化任务数据访问层
 *
 * <p>继承Spring Data JPA的JpaRepository，自动提供基本的CRUD方法。
 * </p>
 */
@Repository
public interface AutomationRepository extends JpaRepository<AutomationEntity, Long> {

    /**
     * 查询最近创建的任务
     */
    List<AutomationEntity> findTop50ByOrderByCreatedAtDesc();
}
