package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One selectable paper size; dimensions are in micrometers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MediaSizeOption(
        MediaSizeName name,
        int widthMicrons,
        int heightMicrons,
        @JsonProperty("is_continuous_feed") boolean isContinuousFeed,
        @JsonProperty("is_default") boolean isDefault,
        String vendorId,
        List<LocalizedString> customDisplayNameLocalized
) {

    public MediaSizeOption withDefault(boolean newDefault) {
        return new MediaSizeOption(name, widthMicrons, heightMicrons, isContinuousFeed, newDefault, vendorId,
                customDisplayNameLocalized);
    }
}
