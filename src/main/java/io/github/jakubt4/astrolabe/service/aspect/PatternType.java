package io.github.jakubt4.astrolabe.service.aspect;

public enum PatternType {
    GRAND_TRINE, T_SQUARE, STELLIUM, GRAND_CROSS, YOD
}
