package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param type      duplex mode
 * @param isDefault whether this mode is the default
 * @param vendorId  PPD option keyword; not serialized
 */
public record DuplexOption(
        DuplexType type,
        @JsonProperty("is_default") boolean isDefault,
        @JsonIgnore String vendorId
) {

    public DuplexOption withDefault(boolean newDefault) {
        return new DuplexOption(type, newDefault, vendorId);
    }
}
