package com.example.printconnector.interfaces.api;

import com.example.printconnector.application.service.PrinterCapabilityService;
import com.example.printconnector.domain.exception.UnsupportedPpdFormatException;
import com.example.printconnector.domain.model.PrinterCapabilities;
import com.example.printconnector.domain.model.cdd.Duplex;
import com.example.printconnector.domain.model.cdd.DuplexOption;
import com.example.printconnector.domain.model.cdd.DuplexType;
import com.example.printconnector.domain.model.cdd.PrinterDescription;
import com.example.printconnector.infrastructure.exception.PpdCacheException;
import com.example.printconnector.infrastructure.exception.PrintServerException;
import com.example.printconnector.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = PrinterCapabilityController.class)
@Import(GlobalExceptionHandler.class)
class PrinterCapabilityControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PrinterCapabilityService capabilityService;

    /**
     * Verifies the capability payload, including the snake-case description.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void capabilitiesReturned() throws Exception {
        PrinterDescription description = new PrinterDescription(null, null,
                new Duplex(List.of(new DuplexOption(DuplexType.LONG_EDGE, true, "DuplexNoTumble")), "Duplex"),
                null, null, null, null);
        BDDMockito.given(capabilityService.getCapabilities("office"))
                .willReturn(new PrinterCapabilities("office", "HP", "LaserJet 4250", "abc", description));

        mockMvc.perform(get("/api/printers/office/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.printerName").value("office"))
                .andExpect(jsonPath("$.contentHash").value("abc"))
                .andExpect(jsonPath("$.description.duplex.option[0].type").value("LONG_EDGE"))
                .andExpect(jsonPath("$.description.duplex.option[0].is_default").value(true))
                .andExpect(jsonPath("$.description.duplex.vendor_key").doesNotExist())
                .andExpect(jsonPath("$.description.color").doesNotExist());
    }

    /**
     * Verifies printer listing.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void printersListed() throws Exception {
        BDDMockito.given(capabilityService.listPrinters()).willReturn(List.of("office", "lab"));

        mockMvc.perform(get("/api/printers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]").value("lab"));
    }

    /**
     * Verifies that cache invalidation answers 204.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void cacheInvalidated() throws Exception {
        mockMvc.perform(delete("/api/printers/office/cache"))
                .andExpect(status().isNoContent());

        verify(capabilityService).invalidate("office");
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        BDDMockito.given(capabilityService.getCapabilities("office"))
                .willThrow(new UnsupportedPpdFormatException("office"));

        mockMvc.perform(get("/api/printers/office/capabilities"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that print server rejections translate to HTTP 502 responses carrying the server status.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void printServerExceptionMappedToBadGateway() throws Exception {
        BDDMockito.given(capabilityService.getCapabilities("missing"))
                .willThrow(new PrintServerException("Fetching PPD of printer missing failed", 404));

        mockMvc.perform(get("/api/printers/missing/capabilities"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("PRINT_SERVER_ERROR"))
                .andExpect(jsonPath("$.details.printServerStatus").value(404));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(capabilityService.getCapabilities("office"))
                .willThrow(new PpdCacheException("Cannot store PPD of printer office", new RuntimeException("disk")));

        mockMvc.perform(get("/api/printers/office/capabilities"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }
}
