package com.example.printconnector.domain.model.ppd;

/**
 * UI control kinds that the translation understands.
 */
public enum PpdEntryKind {
    PICK_ONE,
    BOOLEAN
}
