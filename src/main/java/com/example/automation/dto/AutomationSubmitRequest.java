package com.example.automation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 提交自动化任务的请求DTO
 *
 * @param prompt 自动化目标描述，不能为空
 * @param urls 依次访问的页面，每个URL对应一个步骤
 * @param selector 从每个页面提取内容的CSS选择器（可选，默认提取title）
 * @param sessionId 推送进度使用的会话ID（可选，默认等于任务ID）
 */
public record AutomationSubmitRequest(
        @NotBlank(message = "prompt不能为空")
        String prompt,

        @NotEmpty(message = "URL列表不能为空")
        List<@NotBlank String> urls,

        String selector,

        @Size(max = 100, message = "sessionId长度不能超过100")
        String sessionId
) {
}
