package com.example.automation.repository;

import com.example.automation.entity.AutomationStepEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AutomationStepRepository extends JpaRepository<AutomationStepEntity, Long> {

    /**
     * 按写入顺序返回任务的步骤日志
     */
    List<AutomationStepEntity> findByAutomationIdOrderByIdAsc(Long automationId);
}
