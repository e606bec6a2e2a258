package com.gymtracker.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 周模板中的一个训练位（如 "Upper A"）及其动作
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanSlotRequest {

    @NotBlank(message = "训练位名称不能为空")
    @Size(max = 200, message = "训练位名称不能超过200字符")
    private String name;

    @Valid
    private List<ExerciseRequest> exercises = new ArrayList<>();
}
