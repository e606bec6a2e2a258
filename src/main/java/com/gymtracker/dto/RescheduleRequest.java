package com.gymtracker.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RescheduleRequest {

    // 客户端看到的原日期，可为空
    private String fromDate;

    @NotBlank(message = "目标日期不能为空")
    private String toDate;

    @Size(max = 500, message = "原因不能超过500字符")
    private String reason;
}
