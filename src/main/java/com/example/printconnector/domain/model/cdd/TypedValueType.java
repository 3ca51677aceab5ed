package com.example.printconnector.domain.model.cdd;

public enum TypedValueType {
    BOOLEAN,
    FLOAT,
    INTEGER,
    STRING
}
