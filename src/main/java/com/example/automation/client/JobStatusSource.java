package com.example.automation.client;

import java.util.Optional;

/**
 * 任务状态的拉取来源
 */
public interface JobStatusSource {

    /**
     * 查询任务当前状态
     *
     * @return 任务不存在时返回empty
     * @throws StatusUnavailableException 如果状态暂时无法获取
     */
    Optional<JobSnapshot> fetch(long jobId);
}
