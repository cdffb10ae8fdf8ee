package com.example.pulsemonitor.domain;

public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL
}
