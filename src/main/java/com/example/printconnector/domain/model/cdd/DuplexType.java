package com.example.printconnector.domain.model.cdd;

public enum DuplexType {
    NO_DUPLEX,
    LONG_EDGE,
    SHORT_EDGE
}
