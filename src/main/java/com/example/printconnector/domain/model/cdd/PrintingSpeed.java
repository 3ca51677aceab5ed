package com.example.printconnector.domain.model.cdd;

import java.util.List;

public record PrintingSpeed(List<PrintingSpeedOption> option) {

    public PrintingSpeed {
        option = List.copyOf(option);
    }
}
