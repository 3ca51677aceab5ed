package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ColorOption(
        String vendorId,
        ColorType type,
        @JsonProperty("is_default") boolean isDefault,
        List<LocalizedString> customDisplayNameLocalized
) {

    public ColorOption withDefault(boolean newDefault) {
        return new ColorOption(vendorId, type, newDefault, customDisplayNameLocalized);
    }
}
