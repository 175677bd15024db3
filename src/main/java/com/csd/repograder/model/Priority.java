package com.csd.repograder.model;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
