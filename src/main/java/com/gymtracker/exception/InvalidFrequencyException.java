package com.gymtracker.exception;

/**
 * 每周训练次数超出 1-7
 */
public class InvalidFrequencyException extends BusinessException {

    public InvalidFrequencyException(int frequency) {
        super(400, "每周训练次数必须在1-7之间: " + frequency);
    }
}
