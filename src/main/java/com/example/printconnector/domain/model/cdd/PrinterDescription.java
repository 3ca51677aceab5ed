package com.example.printconnector.domain.model.cdd;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Printer section of the cloud capability document. A {@code null} section means the PPD yields no data for it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrinterDescription(
        List<VendorCapability> vendorCapability,
        Color color,
        Duplex duplex,
        Margins margins,
        Dpi dpi,
        MediaSize mediaSize,
        PrintingSpeed printingSpeed
) {

    public PrinterDescription {
        vendorCapability = vendorCapability == null || vendorCapability.isEmpty() ? null : List.copyOf(vendorCapability);
    }
}
