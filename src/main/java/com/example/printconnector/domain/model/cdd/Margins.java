package com.example.printconnector.domain.model.cdd;

import java.util.List;

/**
 * Hardware margins capability.
 */
public record Margins(List<MarginsOption> option) {

    public Margins {
        option = SingleDefault.require("margins", option, MarginsOption::isDefault);
    }
}
