package com.gymtracker.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseRequest {

    @NotBlank(message = "动作标识不能为空")
    @Size(max = 100, message = "动作标识不能超过100字符")
    private String slug;

    @NotBlank(message = "动作名称不能为空")
    @Size(max = 200, message = "动作名称不能超过200字符")
    private String name;

    @Min(value = 1, message = "组数不能小于1")
    private Integer targetSets = 3;

    @Min(value = 1, message = "次数不能小于1")
    private Integer targetReps = 10;
}
