package com.gymtracker.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CreateWorkoutRequest {

    @NotBlank(message = "训练日期不能为空")
    private String date;

    @NotBlank(message = "训练标题不能为空")
    @Size(max = 200, message = "训练标题不能超过200字符")
    private String title;

    @Valid
    private List<ExerciseRequest> exercises = new ArrayList<>();
}
