package com.example.printconnector.domain.model.cdd;

import java.util.List;

/**
 * Print resolution capability.
 *
 * @param option supported resolutions, exactly one of them default
 */
public record Dpi(List<DpiOption> option) {

    public Dpi {
        option = SingleDefault.require("dpi", option, DpiOption::isDefault);
    }
}
