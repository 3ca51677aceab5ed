package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param speedPpm  pages per minute
 * @param colorType color modes the speed applies to, or {@code null} when the printer declares no color capability
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrintingSpeedOption(float speedPpm, List<ColorType> colorType) {

    public PrintingSpeedOption {
        colorType = colorType == null ? null : List.copyOf(colorType);
    }
}
