package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DpiOption(
        int horizontalDpi,
        int verticalDpi,
        @JsonProperty("is_default") boolean isDefault,
        String vendorId,
        List<LocalizedString> customDisplayNameLocalized
) {

    public DpiOption withDefault(boolean newDefault) {
        return new DpiOption(horizontalDpi, verticalDpi, newDefault, vendorId, customDisplayNameLocalized);
    }
}
