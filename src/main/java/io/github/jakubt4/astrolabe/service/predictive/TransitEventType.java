package io.github.jakubt4.astrolabe.service.predictive;

public enum TransitEventType {
    INGRESS, ASPECT, STATION_RETROGRADE, STATION_DIRECT
}
