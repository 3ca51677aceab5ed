package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Color capability.
 *
 * @param option    color modes, exactly one of them default
 * @param vendorKey PPD keyword that selects the mode when a job is printed; not serialized
 */
public record Color(List<ColorOption> option, @JsonIgnore String vendorKey) {

    public Color {
        option = SingleDefault.require("color", option, ColorOption::isDefault);
    }
}
