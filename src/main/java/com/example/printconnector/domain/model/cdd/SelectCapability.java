package com.example.printconnector.domain.model.cdd;

import java.util.List;

public record SelectCapability(List<SelectCapabilityOption> option) {

    public SelectCapability {
        option = SingleDefault.require("select_cap", option, SelectCapabilityOption::isDefault);
    }
}
