package com.example.printconnector.domain.model.cdd;

public enum VendorCapabilityType {
    RANGE,
    SELECT,
    TYPED_VALUE
}
