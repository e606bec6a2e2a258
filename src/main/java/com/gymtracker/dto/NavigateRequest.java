package com.gymtracker.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class NavigateRequest {

    @NotBlank(message = "当前日期不能为空")
    private String referenceDate;

    @NotNull(message = "视图模式不能为空")
    private ViewMode viewMode;

    @NotNull(message = "导航动作不能为空")
    private NavigationAction action;

    // GO_TO_DATE 时使用
    private String targetDate;

    // SET_VIEW_MODE 时使用
    private ViewMode targetMode;
}
