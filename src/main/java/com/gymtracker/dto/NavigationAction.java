package com.gymtracker.dto;

public enum NavigationAction {
    TODAY,
    PREVIOUS,
    NEXT,
    GO_TO_DATE,
    SET_VIEW_MODE
}
