package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Printer specific capability that has no dedicated section in the schema.
 * Exactly one of {@code selectCap} and {@code typedValueCap} is set, matching {@code type}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VendorCapability(
        String id,
        List<LocalizedString> displayNameLocalized,
        VendorCapabilityType type,
        SelectCapability selectCap,
        TypedValueCapability typedValueCap
) {

    /**
     * Builds a select-from-list capability.
     *
     * @param id          capability identifier
     * @param displayName English display name
     * @param select      choices
     * @return select capability
     */
    public static VendorCapability select(String id, String displayName, SelectCapability select) {
        return new VendorCapability(id, LocalizedString.english(displayName), VendorCapabilityType.SELECT, select, null);
    }

    /**
     * Builds a free-form typed value capability.
     *
     * @param id          capability identifier
     * @param displayName English display name
     * @param typedValue  value type and default
     * @return typed value capability
     */
    public static VendorCapability typedValue(String id, String displayName, TypedValueCapability typedValue) {
        return new VendorCapability(id, LocalizedString.english(displayName), VendorCapabilityType.TYPED_VALUE, null,
                typedValue);
    }
}
