package com.example.printconnector.interfaces.api;

import com.example.printconnector.application.service.PrinterCapabilityService;
import com.example.printconnector.domain.model.PrinterCapabilities;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Interfaces-layer REST controller exposing printers and their capability descriptions.
 */
@RestController
@RequestMapping(value = "/api/printers", produces = MediaType.APPLICATION_JSON_VALUE)
public class PrinterCapabilityController {

    private final PrinterCapabilityService capabilityService;

    /**
     * @param capabilityService service translating PPDs into capabilities
     */
    public PrinterCapabilityController(PrinterCapabilityService capabilityService) {
        this.capabilityService = capabilityService;
    }

    /**
     * Lists the printer queues of the print server.
     *
     * @return printer names
     */
    @GetMapping
    public List<String> listPrinters() {
        return capabilityService.listPrinters();
    }

    /**
     * Returns the capability description of one printer.
     *
     * @param printerName printer queue name
     * @return capabilities translated from the printer's current PPD
     */
    @GetMapping("/{printerName}/capabilities")
    public PrinterCapabilities getCapabilities(@PathVariable String printerName) {
        return capabilityService.getCapabilities(printerName);
    }

    /**
     * Drops the cached PPD of one printer so the next request fetches it again.
     *
     * @param printerName printer queue name
     * @return empty 204 response
     */
    @DeleteMapping("/{printerName}/cache")
    public ResponseEntity<Void> invalidate(@PathVariable String printerName) {
        capabilityService.invalidate(printerName);
        return ResponseEntity.noContent().build();
    }
}
