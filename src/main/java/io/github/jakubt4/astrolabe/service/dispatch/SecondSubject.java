package io.github.jakubt4.astrolabe.service.dispatch;

public enum SecondSubject {
    NONE, OPTIONAL, REQUIRED
}
