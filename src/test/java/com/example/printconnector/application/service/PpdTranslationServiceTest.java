package com.example.printconnector.application.service;

import com.example.printconnector.application.service.capability.CapabilityMapper;
import com.example.printconnector.application.service.ppd.PpdEntryConverter;
import com.example.printconnector.application.service.ppd.PpdStatementGrouper;
import com.example.printconnector.application.service.ppd.PpdStatementParser;
import com.example.printconnector.domain.exception.UnsupportedPpdFormatException;
import com.example.printconnector.domain.model.TranslatedPpd;
import com.example.printconnector.domain.model.cdd.ColorOption;
import com.example.printconnector.domain.model.cdd.ColorType;
import com.example.printconnector.domain.model.cdd.DpiOption;
import com.example.printconnector.domain.model.cdd.DuplexOption;
import com.example.printconnector.domain.model.cdd.DuplexType;
import com.example.printconnector.domain.model.cdd.LocalizedString;
import com.example.printconnector.domain.model.cdd.MediaSizeName;
import com.example.printconnector.domain.model.cdd.MediaSizeOption;
import com.example.printconnector.domain.model.cdd.PrinterDescription;
import com.example.printconnector.domain.model.cdd.SelectCapabilityOption;
import com.example.printconnector.domain.model.cdd.TypedValueType;
import com.example.printconnector.domain.model.cdd.VendorCapability;
import com.example.printconnector.domain.model.cdd.VendorCapabilityType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * End-to-end tests of the PPD translation pipeline on small documents.
 */
class PpdTranslationServiceTest {

    private final PpdTranslationService service = new PpdTranslationService(
            new PpdStatementParser(), new PpdStatementGrouper(), new PpdEntryConverter(), new CapabilityMapper());

    /**
     * Verifies that a throughput statement becomes a printing speed without color types.
     */
    @Test
    void translatePrintingSpeed() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *Throughput: "30"
                """);

        assertThat(description.printingSpeed().option()).hasSize(1);
        assertThat(description.printingSpeed().option().get(0).speedPpm()).isEqualTo(30f);
        assertThat(description.printingSpeed().option().get(0).colorType()).isNull();
        assertThat(description.mediaSize()).isNull();
        assertThat(description.vendorCapability()).isNull();
    }

    /**
     * Verifies table lookups, the custom size fallback and the declared default.
     */
    @Test
    void translateMediaSize() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *PageSize: PickOne
                *DefaultPageSize: Letter
                *PageSize A3/A3: ""
                *PageSize ISOB5/B5 - ISO: ""
                *PageSize B5/B5 - JIS: ""
                *PageSize Letter/Letter: ""
                *PageSize HalfLetter/5.5x8.5: ""
                *CloseUI: *PageSize
                """);

        assertThat(description.mediaSize().option()).containsExactly(
                new MediaSizeOption(MediaSizeName.ISO_A3, 297000, 420000, false, false, "A3",
                        LocalizedString.english("A3")),
                new MediaSizeOption(MediaSizeName.ISO_B5, 176000, 250000, false, false, "ISOB5",
                        LocalizedString.english("B5 (ISO)")),
                new MediaSizeOption(MediaSizeName.JIS_B5, 182000, 257000, false, false, "B5",
                        LocalizedString.english("B5 (JIS)")),
                new MediaSizeOption(MediaSizeName.NA_LETTER, 215900, 279400, false, true, "Letter",
                        LocalizedString.english("Letter")),
                new MediaSizeOption(MediaSizeName.CUSTOM, 139700, 215900, false, false, "HalfLetter",
                        LocalizedString.english("5.5x8.5")));
    }

    /**
     * Verifies a color model with one color and one gray mode.
     */
    @Test
    void translateColorModel() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *ColorModel/Color Mode: PickOne
                *DefaultColorModel: Gray
                *ColorModel CMYK/Color: "(cmyk) RCsetdevicecolor"
                *ColorModel Gray/Black and White: "(gray) RCsetdevicecolor"
                *CloseUI: *ColorModel
                """);

        assertThat(description.color().vendorKey()).isEqualTo("ColorModel");
        assertThat(description.color().option()).containsExactly(
                new ColorOption("CMYK", ColorType.STANDARD_COLOR, false, LocalizedString.english("Color")),
                new ColorOption("Gray", ColorType.STANDARD_MONOCHROME, true, LocalizedString.english("Black and White")));
    }

    /**
     * Verifies that On/Off translations of a combined color and resolution control are rewritten.
     */
    @Test
    void translateColorAndResolutionOnOff() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *CMAndResolution/Print Color as Gray: PickOne
                *OrderDependency: 20 AnySetup *CMAndResolution
                *DefaultCMAndResolution: CMYKImageRET3600
                *CMAndResolution CMYKImageRET3600/Off: "
                  <</ProcessColorModel /DeviceCMYK /HWResolution [600 600] /PreRenderingEnhance false >> setpagedevice"
                *End
                *CMAndResolution Gray600x600dpi/On: "
                  <</ProcessColorModel /DeviceGray /HWResolution [600 600] >> setpagedevice"
                *End
                *CloseUI: *CMAndResolution
                """);

        assertThat(description.color().vendorKey()).isEqualTo("CMAndResolution");
        assertThat(description.color().option()).containsExactly(
                new ColorOption("CMYKImageRET3600", ColorType.STANDARD_COLOR, true, LocalizedString.english("Color")),
                new ColorOption("Gray600x600dpi", ColorType.STANDARD_MONOCHROME, false, LocalizedString.english("Gray")));
    }

    /**
     * Verifies that several gray modes become custom monochrome options with descriptive names.
     */
    @Test
    void translateColorAndResolutionVariants() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *CMAndResolution/Print Color as Gray: PickOne
                *DefaultCMAndResolution: CMYKImageRET2400
                *CMAndResolution CMYKImageRET2400/Off - ImageRET 2400: "<< /ProcessColorModel /DeviceCMYK >> setpagedevice"
                *CMAndResolution Gray1200x1200dpi/On - ProRes 1200: "<</ProcessColorModel /DeviceGray>> setpagedevice"
                *CMAndResolution Gray600x600dpi/On - 600 dpi: "<</ProcessColorModel /DeviceGray>> setpagedevice"
                *CloseUI: *CMAndResolution
                """);

        assertThat(description.color().option()).containsExactly(
                new ColorOption("CMYKImageRET2400", ColorType.STANDARD_COLOR, true,
                        LocalizedString.english("Color, ImageRET 2400")),
                new ColorOption("Gray1200x1200dpi", ColorType.CUSTOM_MONOCHROME, false,
                        LocalizedString.english("Gray, ProRes 1200")),
                new ColorOption("Gray600x600dpi", ColorType.CUSTOM_MONOCHROME, false,
                        LocalizedString.english("Gray, 600 dpi")));
    }

    /**
     * Verifies the {@code SelectColor} fallback control.
     */
    @Test
    void translateSelectColor() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI  *SelectColor/Select Color: PickOne
                *DefaultSelectColor: Color
                *SelectColor Color/Color:  "<</ProcessColorModel /DeviceCMYK>> setpagedevice"
                *SelectColor Grayscale/Grayscale:  "<</ProcessColorModel /DeviceGray>> setpagedevice"
                *CloseUI: *SelectColor
                """);

        assertThat(description.color().vendorKey()).isEqualTo("SelectColor");
        assertThat(description.color().option()).containsExactly(
                new ColorOption("Color", ColorType.STANDARD_COLOR, true, LocalizedString.english("Color")),
                new ColorOption("Grayscale", ColorType.STANDARD_MONOCHROME, false, LocalizedString.english("Grayscale")));
    }

    /**
     * Verifies the standard duplex control.
     */
    @Test
    void translateDuplex() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *Duplex/Duplex: PickOne
                *DefaultDuplex: None
                *Duplex None/Off: ""
                *Duplex DuplexNoTumble/Long Edge: ""
                *CloseUI: *Duplex
                """);

        assertThat(description.duplex().vendorKey()).isEqualTo("Duplex");
        assertThat(description.duplex().option()).containsExactly(
                new DuplexOption(DuplexType.NO_DUPLEX, true, "None"),
                new DuplexOption(DuplexType.LONG_EDGE, false, "DuplexNoTumble"));
    }

    /**
     * Verifies both forms of the Konica Minolta duplex control.
     */
    @Test
    void translateKonicaMinoltaDuplex() {
        PrinterDescription pickOne = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI  *KMDuplex/Print Type: PickOne
                *DefaultKMDuplex: Double
                *KMDuplex Single/1-Sided:  "<< /Duplex false >> setpagedevice
                 << /Layout 0 >> /KMOptions /ProcSet findresource /setKMoptions get exec"
                *End
                *KMDuplex Double/2-Sided:  "<< /Duplex true >> setpagedevice
                 << /Layout 0 >> /KMOptions /ProcSet findresource /setKMoptions get exec"
                *End
                *KMDuplex Booklet/Booklet:  "<< /Duplex true >> setpagedevice
                 << /Layout 1 >> /KMOptions /ProcSet findresource /setKMoptions get exec"
                *End
                *CloseUI: *KMDuplex
                """);
        PrinterDescription bool = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI  *KMDuplex/Duplex: Boolean
                *DefaultKMDuplex: False
                *KMDuplex False/Off:  "<< /Duplex false >> setpagedevice"
                *KMDuplex True/On:  "<< /Duplex true >> setpagedevice"
                *CloseUI: *KMDuplex
                """);

        assertThat(pickOne.duplex().option()).containsExactly(
                new DuplexOption(DuplexType.NO_DUPLEX, false, "Single"),
                new DuplexOption(DuplexType.LONG_EDGE, true, "Double"),
                new DuplexOption(DuplexType.SHORT_EDGE, false, "Booklet"));
        assertThat(bool.duplex().vendorKey()).isEqualTo("KMDuplex");
        assertThat(bool.duplex().option()).containsExactly(
                new DuplexOption(DuplexType.NO_DUPLEX, true, "False"),
                new DuplexOption(DuplexType.LONG_EDGE, false, "True"));
    }

    /**
     * Verifies resolutions with one and two axes.
     */
    @Test
    void translateResolution() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *Resolution/Resolution: PickOne
                *DefaultResolution: 600dpi
                *Resolution 600dpi/600 dpi: ""
                *Resolution 1200x600dpi/1200x600 dpi: ""
                *Resolution 1200x1200dpi/1200 dpi: ""
                *CloseUI: *Resolution
                """);

        assertThat(description.dpi().option()).containsExactly(
                new DpiOption(600, 600, true, "600dpi", LocalizedString.english("600 dpi")),
                new DpiOption(1200, 600, false, "1200x600dpi", LocalizedString.english("1200x600 dpi")),
                new DpiOption(1200, 1200, false, "1200x1200dpi", LocalizedString.english("1200 dpi")));
    }

    /**
     * Verifies that an output bin whose default is not offered defaults to its first bin.
     */
    @Test
    void translateOutputBin() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *OutputBin/Destination: PickOne
                *OrderDependency: 210 AnySetup *OutputBin
                *DefaultOutputBin: FinProof
                *OutputBin Standard/Internal Tray 1: ""
                *OutputBin Bin1/Internal Tray 2: ""
                *OutputBin External/External Tray: ""
                *CloseUI: *OutputBin
                """);

        assertThat(description.vendorCapability()).hasSize(1);
        VendorCapability bin = description.vendorCapability().get(0);
        assertThat(bin.id()).isEqualTo("OutputBin");
        assertThat(bin.type()).isEqualTo(VendorCapabilityType.SELECT);
        assertThat(bin.displayNameLocalized()).isEqualTo(LocalizedString.english("Destination"));
        assertThat(bin.selectCap().option()).containsExactly(
                new SelectCapabilityOption("Standard", true, LocalizedString.english("Internal Tray 1")),
                new SelectCapabilityOption("Bin1", false, LocalizedString.english("Internal Tray 2")),
                new SelectCapabilityOption("External", false, LocalizedString.english("External Tray")));
    }

    /**
     * Verifies that a control translated as print quality becomes a select capability.
     */
    @Test
    void translatePrintQuality() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *HPPrintQuality/Print Quality: PickOne
                *DefaultHPPrintQuality: FastRes1200
                *HPPrintQuality FastRes1200/FastRes 1200: ""
                *HPPrintQuality 600dpi/600 dpi: ""
                *HPPrintQuality ProRes1200/ProRes 1200: ""
                *CloseUI: *HPPrintQuality
                """);

        VendorCapability quality = description.vendorCapability().get(0);
        assertThat(quality.id()).isEqualTo("HPPrintQuality");
        assertThat(quality.displayNameLocalized()).isEqualTo(LocalizedString.english("Print Quality"));
        assertThat(quality.selectCap().option()).extracting(SelectCapabilityOption::value)
                .containsExactly("FastRes1200", "600dpi", "ProRes1200");
        assertThat(quality.selectCap().option().get(0).isDefault()).isTrue();
    }

    /**
     * Verifies that Ricoh locked print collapses into one password capability.
     */
    @Test
    void translateLockedPrint() {
        PrinterDescription description = translate("""
                *PPD-Adobe: "4.3"
                *OpenUI *JobType/JobType: PickOne
                *FoomaticRIPOption JobType: enum CmdLine B
                *OrderDependency: 255 AnySetup *JobType
                *DefaultJobType: Normal
                *JobType Normal/Normal: "%% FoomaticRIPOptionSetting: JobType=Normal"
                *JobType SamplePrint/Sample Print: "%% FoomaticRIPOptionSetting: JobType=SamplePrint"
                *JobType LockedPrint/Locked Print: ""
                *JobType DocServer/Document Server: ""
                *CloseUI: *JobType

                *OpenUI *LockedPrintPassword/Locked Print Password (4-8 digits): PickOne
                *FoomaticRIPOption LockedPrintPassword: password CmdLine C
                *FoomaticRIPOptionMaxLength LockedPrintPassword:8
                *FoomaticRIPOptionAllowedChars LockedPrintPassword: "0-9"
                *OrderDependency: 255 AnySetup *LockedPrintPassword
                *DefaultLockedPrintPassword: None
                *LockedPrintPassword None/None: ""
                *LockedPrintPassword 4001/4001: "%% FoomaticRIPOptionSetting: LockedPrintPassword=4001"
                *LockedPrintPassword 4002/4002: "%% FoomaticRIPOptionSetting: LockedPrintPassword=4002"
                *CloseUI: *LockedPrintPassword

                *CustomLockedPrintPassword True/Custom Password: ""
                *ParamCustomLockedPrintPassword Password: 1 passcode 4 8
                """);

        assertThat(description.vendorCapability()).hasSize(1);
        VendorCapability password = description.vendorCapability().get(0);
        assertThat(password.id()).isEqualTo("JobType:LockedPrint/LockedPrintPassword");
        assertThat(password.type()).isEqualTo(VendorCapabilityType.TYPED_VALUE);
        assertThat(password.displayNameLocalized()).isEqualTo(LocalizedString.english("Password (4 numbers)"));
        assertThat(password.typedValueCap().valueType()).isEqualTo(TypedValueType.STRING);
        assertThat(password.typedValueCap().defaultValue()).isNull();
    }

    /**
     * Verifies manufacturer normalization and model cleanup from the header statements.
     */
    @Test
    void translateManufacturerAndModel() {
        TranslatedPpd translated = service.translate("office", """
                *PPD-Adobe: "4.3"
                *Manufacturer: "HEWLETT-PACKARD"
                *ModelName: "HP LaserJet 4250"
                *NickName: "HEWLETT-PACKARD LaserJet 4250 PS v3010.107 cups-team Letter+Duplex"
                """);

        assertThat(translated.manufacturer()).isEqualTo("HP");
        assertThat(translated.model()).isEqualTo("LaserJet 4250");
    }

    /**
     * Ensures text without any PPD statement is rejected.
     */
    @Test
    void translateRejectsNonPpdText() {
        assertThrows(UnsupportedPpdFormatException.class, () -> service.translate("office", ""));
    }

    private PrinterDescription translate(String ppd) {
        return service.translate("test", ppd).description();
    }
}
