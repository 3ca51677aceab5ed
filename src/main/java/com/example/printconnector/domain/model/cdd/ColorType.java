package com.example.printconnector.domain.model.cdd;

public enum ColorType {
    STANDARD_COLOR,
    STANDARD_MONOCHROME,
    CUSTOM_COLOR,
    CUSTOM_MONOCHROME,
    AUTO
}
