package com.gymtracker.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class CreatePlanRequest {

    @NotBlank(message = "模板名称不能为空")
    @Size(max = 200, message = "模板名称不能超过200字符")
    private String templateName;

    // 范围由 SchedulePlanner 校验，以便返回统一的错误
    @NotNull(message = "每周训练次数不能为空")
    private Integer frequency;

    @NotEmpty(message = "训练位不能为空")
    @Valid
    private List<PlanSlotRequest> slots;

    // 可选，为空时按 HorizonPolicy 计算
    private String horizonStart;
}
