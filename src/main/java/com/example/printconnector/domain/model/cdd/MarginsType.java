package com.example.printconnector.domain.model.cdd;

public enum MarginsType {
    BORDERLESS,
    STANDARD,
    CUSTOM
}
