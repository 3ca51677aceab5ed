package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param valueType    type of the free-form value
 * @param defaultValue default value in its string form, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TypedValueCapability(
        @JsonProperty("value_type") TypedValueType valueType,
        @JsonProperty("default") String defaultValue
) {
}
