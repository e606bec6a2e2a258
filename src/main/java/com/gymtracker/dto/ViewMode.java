package com.gymtracker.dto;

public enum ViewMode {
    WEEK,
    MONTH
}
