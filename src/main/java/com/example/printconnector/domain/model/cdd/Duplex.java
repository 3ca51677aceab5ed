package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record Duplex(List<DuplexOption> option, @JsonIgnore String vendorKey) {

    public Duplex {
        option = SingleDefault.require("duplex", option, DuplexOption::isDefault);
    }
}
