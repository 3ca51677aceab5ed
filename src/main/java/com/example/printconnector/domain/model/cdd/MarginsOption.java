package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MarginsOption(
        MarginsType type,
        int topMicrons,
        int rightMicrons,
        int bottomMicrons,
        int leftMicrons,
        @JsonProperty("is_default") boolean isDefault
) {
}
