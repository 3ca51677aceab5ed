package com.example.printconnector.domain.model;

import com.example.printconnector.domain.model.cdd.PrinterDescription;

/**
 * Output of the PPD translation.
 *
 * @param description  capability sections derived from the PPD
 * @param manufacturer normalized manufacturer name, empty when the PPD declares none
 * @param model        cleaned model name, empty when the PPD declares none
 */
public record TranslatedPpd(PrinterDescription description, String manufacturer, String model) {
}
