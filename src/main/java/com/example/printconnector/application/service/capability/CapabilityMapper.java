package com.example.printconnector.application.service.capability;

import com.example.printconnector.application.service.ppd.PpdKeywords;
import com.example.printconnector.domain.model.TranslatedPpd;
import com.example.printconnector.domain.model.cdd.Color;
import com.example.printconnector.domain.model.cdd.ColorOption;
import com.example.printconnector.domain.model.cdd.ColorType;
import com.example.printconnector.domain.model.cdd.Dpi;
import com.example.printconnector.domain.model.cdd.DpiOption;
import com.example.printconnector.domain.model.cdd.Duplex;
import com.example.printconnector.domain.model.cdd.DuplexOption;
import com.example.printconnector.domain.model.cdd.DuplexType;
import com.example.printconnector.domain.model.cdd.LocalizedString;
import com.example.printconnector.domain.model.cdd.Margins;
import com.example.printconnector.domain.model.cdd.MarginsOption;
import com.example.printconnector.domain.model.cdd.MarginsType;
import com.example.printconnector.domain.model.cdd.MediaSize;
import com.example.printconnector.domain.model.cdd.MediaSizeName;
import com.example.printconnector.domain.model.cdd.MediaSizeOption;
import com.example.printconnector.domain.model.cdd.PrinterDescription;
import com.example.printconnector.domain.model.cdd.PrintingSpeed;
import com.example.printconnector.domain.model.cdd.PrintingSpeedOption;
import com.example.printconnector.domain.model.cdd.SelectCapability;
import com.example.printconnector.domain.model.cdd.SelectCapabilityOption;
import com.example.printconnector.domain.model.cdd.TypedValueCapability;
import com.example.printconnector.domain.model.cdd.TypedValueType;
import com.example.printconnector.domain.model.cdd.VendorCapability;
import com.example.printconnector.domain.model.ppd.PpdEntries;
import com.example.printconnector.domain.model.ppd.PpdEntry;
import com.example.printconnector.domain.model.ppd.PpdEntryKind;
import com.example.printconnector.domain.model.ppd.PpdStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Maps PPD entries and standalone statements onto the cloud capability schema.
 * <p>
 * Every section is derived independently: a section without usable data is left out and never aborts the
 * translation of the others.
 */
@Service
public class CapabilityMapper {

    private static final Logger log = LoggerFactory.getLogger(CapabilityMapper.class);

    static final String LOCKED_PRINT_PASSWORD_ID =
            PpdKeywords.JOB_TYPE + ":" + PpdKeywords.LOCKED_PRINT + "/" + PpdKeywords.LOCKED_PRINT_PASSWORD;
    static final String LOCKED_PRINT_PASSWORD_NAME = "Password (4 numbers)";

    private static final String FULL_BLEED_SUFFIX = ".FullBleed";

    private static final Pattern CUSTOM_PAGE_SIZE = Pattern.compile("([\\d.]+)(?:mm|in)?x([\\d.]+)(mm|in)?");
    private static final Pattern COLOR = Pattern.compile("^(?:cmy|rgb|color)", Pattern.CASE_INSENSITIVE);
    private static final Pattern GRAY = Pattern.compile("^(?:gray|black|mono)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ON_OFF_PREFIX = Pattern.compile("^(?:on|off)\\s*-?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern RESOLUTION = Pattern.compile("(\\d+)(?:x(\\d+))?dpi");
    private static final Pattern HW_MARGINS = Pattern.compile("(\\d+)\\s+(\\d+)\\s+(\\d+)\\s+(\\d+)");

    private static final Set<String> NO_DUPLEX_KEYWORDS = Set.of("None", "False", "Single");
    private static final Set<String> LONG_EDGE_KEYWORDS = Set.of("DuplexNoTumble", "True", "Double");
    private static final Set<String> SHORT_EDGE_KEYWORDS = Set.of("DuplexTumble", "Booklet");

    /**
     * Builds the printer description plus manufacturer and model.
     *
     * @param entries     UI controls of the document
     * @param standalones statements outside any UI block
     * @return translation result
     */
    public TranslatedPpd map(PpdEntries entries, List<PpdStatement> standalones) {
        MediaSize mediaSize = entries.byKeyword(PpdKeywords.PAGE_SIZE).map(this::toMediaSize).orElse(null);
        Color color = firstPresent(entries, PpdKeywords.COLOR_MODEL, PpdKeywords.CM_AND_RESOLUTION,
                PpdKeywords.SELECT_COLOR).map(this::toColor).orElse(null);
        Duplex duplex = firstPresent(entries, PpdKeywords.DUPLEX, PpdKeywords.KM_DUPLEX)
                .map(this::toDuplex).orElse(null);
        Dpi dpi = entries.byKeyword(PpdKeywords.RESOLUTION).map(this::toDpi).orElse(null);

        List<VendorCapability> vendorCapabilities = new ArrayList<>();
        entries.byKeyword(PpdKeywords.OUTPUT_BIN).map(this::toVendorCapability).ifPresent(vendorCapabilities::add);
        entries.byKeyword(PpdKeywords.JOB_TYPE)
                .flatMap(jobType -> entries.byKeyword(PpdKeywords.LOCKED_PRINT_PASSWORD)
                        .flatMap(password -> toLockedPrintPassword(jobType, password)))
                .ifPresent(vendorCapabilities::add);
        entries.byTranslation(PpdKeywords.PRINT_QUALITY_TRANSLATION)
                .map(this::toVendorCapability).ifPresent(vendorCapabilities::add);

        String manufacturer = "";
        String nickName = "";
        String modelName = "";
        Margins margins = null;
        PrintingSpeed printingSpeed = null;
        for (PpdStatement statement : standalones) {
            switch (statement.mainKeyword()) {
                case PpdKeywords.MANUFACTURER -> manufacturer = statement.value();
                case PpdKeywords.NICK_NAME -> nickName = statement.value();
                case PpdKeywords.MODEL_NAME -> modelName = statement.value();
                case PpdKeywords.HW_MARGINS -> margins = toMargins(statement.value());
                case PpdKeywords.THROUGHPUT -> printingSpeed = toPrintingSpeed(statement.value(), color);
                default -> {
                }
            }
        }
        String model = ModelNames.cleanupModel(nickName.isEmpty() ? modelName : nickName);
        model = ModelNames.stripManufacturer(model, manufacturer);

        PrinterDescription description = new PrinterDescription(
                vendorCapabilities, color, duplex, margins, dpi, mediaSize, printingSpeed);
        return new TranslatedPpd(description, ModelNames.normalizeManufacturer(manufacturer), model);
    }

    /**
     * Media sizes from table lookups, falling back to a {@code WIDTHxHEIGHT[mm|in]} pattern in the keyword or
     * its translation. Full-bleed duplicates are skipped.
     *
     * @param entry {@code PageSize} control
     * @return media size section, or {@code null} when no option could be mapped
     */
    MediaSize toMediaSize(PpdEntry entry) {
        List<MediaSizeOption> options = new ArrayList<>();
        for (PpdStatement choice : entry.options()) {
            String keyword = choice.optionKeyword();
            if (keyword.endsWith(FULL_BLEED_SUFFIX)) {
                continue;
            }
            Optional<MediaSizeOption> size = MediaSizeTable.lookup(keyword)
                    .or(() -> customMediaSize(keyword, choice.translation()));
            if (size.isEmpty()) {
                log.warn("Dropping page size {}: not a known size and no usable dimensions", keyword);
                continue;
            }
            options.add(size.get().withDefault(keyword.equals(entry.defaultValue())));
        }
        if (options.isEmpty()) {
            log.warn("Dropping media size capability: none of {} page sizes could be mapped", entry.options().size());
            return null;
        }
        return new MediaSize(singleDefault(options, MediaSizeOption::isDefault, MediaSizeOption::withDefault));
    }

    private Optional<MediaSizeOption> customMediaSize(String keyword, String translation) {
        Matcher matcher = CUSTOM_PAGE_SIZE.matcher(keyword);
        if (!matcher.find()) {
            matcher = CUSTOM_PAGE_SIZE.matcher(translation);
            if (!matcher.find()) {
                return Optional.empty();
            }
        }
        float width;
        float height;
        try {
            width = Float.parseFloat(matcher.group(1));
            height = Float.parseFloat(matcher.group(2));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        if (!(width > 0f) || !(height > 0f)) {
            log.warn("Page size {} has non-positive dimensions", keyword);
            return Optional.empty();
        }
        boolean millimeters = "mm".equals(matcher.group(3));
        int widthMicrons;
        int heightMicrons;
        try {
            widthMicrons = millimeters ? Units.millimetersToMicrons(width) : Units.inchesToMicrons(width);
            heightMicrons = millimeters ? Units.millimetersToMicrons(height) : Units.inchesToMicrons(height);
        } catch (ArithmeticException ex) {
            log.warn("Page size {} is out of range: {}", keyword, ex.getMessage());
            return Optional.empty();
        }
        String displayName = translation.isEmpty() ? keyword : translation;
        return Optional.of(new MediaSizeOption(MediaSizeName.CUSTOM, widthMicrons, heightMicrons, false, false,
                keyword, LocalizedString.english(displayName)));
    }

    /**
     * Color modes bucketed by keyword: a lone color or gray mode is standard, several are custom variants.
     * Modes that look neither gray nor color are listed last as custom monochrome.
     *
     * @param entry color control
     * @return color section, or {@code null} when the control has no options
     */
    Color toColor(PpdEntry entry) {
        List<PpdStatement> colorChoices = new ArrayList<>();
        List<PpdStatement> grayChoices = new ArrayList<>();
        List<PpdStatement> otherChoices = new ArrayList<>();
        for (PpdStatement choice : entry.options()) {
            if (GRAY.matcher(choice.optionKeyword()).find()) {
                grayChoices.add(choice);
            } else if (COLOR.matcher(choice.optionKeyword()).find()) {
                colorChoices.add(choice);
            } else {
                otherChoices.add(choice);
            }
        }

        List<ColorOption> options = new ArrayList<>();
        ColorType colorType = colorChoices.size() == 1 ? ColorType.STANDARD_COLOR : ColorType.CUSTOM_COLOR;
        colorChoices.forEach(choice -> options.add(colorOption(choice, colorType, entry)));
        ColorType grayType = grayChoices.size() == 1 ? ColorType.STANDARD_MONOCHROME : ColorType.CUSTOM_MONOCHROME;
        grayChoices.forEach(choice -> options.add(colorOption(choice, grayType, entry)));
        otherChoices.forEach(choice -> options.add(colorOption(choice, ColorType.CUSTOM_MONOCHROME, entry)));

        if (options.isEmpty()) {
            return null;
        }
        return new Color(singleDefault(options, ColorOption::isDefault, ColorOption::withDefault), entry.mainKeyword());
    }

    private static ColorOption colorOption(PpdStatement choice, ColorType type, PpdEntry entry) {
        String displayName = cleanupColorName(choice.optionKeyword(), choice.translation());
        return new ColorOption(choice.optionKeyword(), type, choice.optionKeyword().equals(entry.defaultValue()),
                LocalizedString.english(displayName));
    }

    /**
     * Rewrites {@code On}/{@code Off} style translations, as used by {@code CMAndResolution}, into a name that
     * says which color mode the choice selects.
     *
     * @param keyword     option keyword
     * @param translation option translation
     * @return display name
     */
    static String cleanupColorName(String keyword, String translation) {
        String cleaned = ON_OFF_PREFIX.matcher(translation).replaceFirst("");
        if (cleaned.equals(translation)) {
            return translation;
        }
        if (GRAY.matcher(keyword).find() || GRAY.matcher(cleaned).find()) {
            return cleaned.isEmpty() ? "Gray" : "Gray, " + cleaned;
        }
        if (COLOR.matcher(keyword).find() || COLOR.matcher(cleaned).find()) {
            return cleaned.isEmpty() ? "Color" : "Color, " + cleaned;
        }
        return cleaned;
    }

    /**
     * @param entry {@code Duplex} or {@code KMDuplex} control
     * @return duplex section, or {@code null} when no option is recognized
     */
    Duplex toDuplex(PpdEntry entry) {
        List<DuplexOption> options = new ArrayList<>();
        for (PpdStatement choice : entry.options()) {
            String keyword = choice.optionKeyword();
            duplexType(keyword).ifPresentOrElse(
                    type -> options.add(new DuplexOption(type, keyword.equals(entry.defaultValue()), keyword)),
                    () -> log.warn("Ignoring unrecognized duplex option {}", keyword));
        }
        if (options.isEmpty()) {
            return null;
        }
        return new Duplex(singleDefault(options, DuplexOption::isDefault, DuplexOption::withDefault),
                entry.mainKeyword());
    }

    private static Optional<DuplexType> duplexType(String keyword) {
        if (NO_DUPLEX_KEYWORDS.contains(keyword)) {
            return Optional.of(DuplexType.NO_DUPLEX);
        }
        if (LONG_EDGE_KEYWORDS.contains(keyword)) {
            return Optional.of(DuplexType.LONG_EDGE);
        }
        if (SHORT_EDGE_KEYWORDS.contains(keyword)) {
            return Optional.of(DuplexType.SHORT_EDGE);
        }
        if (keyword.startsWith("1")) {
            return Optional.of(DuplexType.NO_DUPLEX);
        }
        if (keyword.startsWith("2")) {
            return Optional.of(DuplexType.LONG_EDGE);
        }
        return Optional.empty();
    }

    /**
     * @param entry {@code Resolution} control
     * @return resolution section, or {@code null} when no option matches {@code NNN[xMMM]dpi}
     */
    Dpi toDpi(PpdEntry entry) {
        List<DpiOption> options = new ArrayList<>();
        for (PpdStatement choice : entry.options()) {
            Matcher matcher = RESOLUTION.matcher(choice.optionKeyword());
            if (!matcher.matches()) {
                continue;
            }
            int horizontal;
            int vertical;
            try {
                horizontal = Integer.parseInt(matcher.group(1));
                vertical = matcher.group(2) == null ? horizontal : Integer.parseInt(matcher.group(2));
            } catch (NumberFormatException ex) {
                log.warn("Dropping resolution {}: value out of range", choice.optionKeyword());
                continue;
            }
            options.add(new DpiOption(horizontal, vertical, choice.optionKeyword().equals(entry.defaultValue()),
                    choice.optionKeyword(), LocalizedString.english(choice.translation())));
        }
        if (options.isEmpty()) {
            log.warn("Dropping resolution capability: no option of {} is a dpi value", entry.mainKeyword());
            return null;
        }
        return new Dpi(singleDefault(options, DpiOption::isDefault, DpiOption::withDefault));
    }

    /**
     * Generic capability for controls without a dedicated section.
     *
     * @param entry pick-one or boolean control
     * @return select capability for pick-one controls, boolean typed value otherwise
     */
    VendorCapability toVendorCapability(PpdEntry entry) {
        if (entry.kind() == PpdEntryKind.BOOLEAN) {
            String defaultValue = entry.defaultValue().toLowerCase(Locale.ROOT);
            return VendorCapability.typedValue(entry.mainKeyword(), entry.translation(),
                    new TypedValueCapability(TypedValueType.BOOLEAN, defaultValue));
        }
        List<SelectCapabilityOption> options = entry.options().stream()
                .map(choice -> new SelectCapabilityOption(choice.optionKeyword(),
                        choice.optionKeyword().equals(entry.defaultValue()),
                        LocalizedString.english(choice.translation())))
                .toList();
        SelectCapability select = new SelectCapability(singleDefault(options, SelectCapabilityOption::isDefault,
                (option, isDefault) -> new SelectCapabilityOption(option.value(), isDefault,
                        option.displayNameLocalized())));
        return VendorCapability.select(entry.mainKeyword(), entry.translation(), select);
    }

    /**
     * Collapses a {@code JobType} control offering {@code LockedPrint} and its password control into one free-form
     * password capability. The preset password choices are not carried over.
     *
     * @param jobType  {@code JobType} control
     * @param password {@code LockedPrintPassword} control
     * @return password capability, or empty when locked print is not offered
     */
    Optional<VendorCapability> toLockedPrintPassword(PpdEntry jobType, PpdEntry password) {
        if (!jobType.hasOption(PpdKeywords.LOCKED_PRINT)) {
            return Optional.empty();
        }
        log.debug("Collapsing {} with {} password presets into one password capability",
                password.mainKeyword(), password.options().size());
        return Optional.of(VendorCapability.typedValue(LOCKED_PRINT_PASSWORD_ID, LOCKED_PRINT_PASSWORD_NAME,
                new TypedValueCapability(TypedValueType.STRING, null)));
    }

    /**
     * Parses {@code *HWMargins: left bottom right top}, given in points.
     *
     * @param value statement value
     * @return margins section, or {@code null} when the value is malformed
     */
    Margins toMargins(String value) {
        Matcher matcher = HW_MARGINS.matcher(value);
        if (!matcher.matches()) {
            log.warn("Dropping margins capability: malformed HWMargins value {}", value);
            return null;
        }
        int[] microns = new int[4];
        MarginsType type = MarginsType.BORDERLESS;
        for (int i = 0; i < 4; i++) {
            int points;
            try {
                points = Integer.parseInt(matcher.group(i + 1));
                microns[i] = Units.pointsToMicrons(points);
            } catch (NumberFormatException | ArithmeticException ex) {
                log.warn("Dropping margins capability: HWMargins value out of range {}", value);
                return null;
            }
            if (points > 0) {
                type = MarginsType.STANDARD;
            }
        }
        return new Margins(List.of(new MarginsOption(type, microns[3], microns[2], microns[1], microns[0], true)));
    }

    /**
     * @param value statement value, pages per minute
     * @param color color section, whose option types the speed applies to
     * @return printing speed section, or {@code null} when the value is not a positive integer
     */
    PrintingSpeed toPrintingSpeed(String value, Color color) {
        int speed;
        try {
            speed = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            log.warn("Dropping printing speed capability: Throughput value {} is not a number", value);
            return null;
        }
        if (speed <= 0) {
            return null;
        }
        List<ColorType> colorTypes = null;
        if (color != null) {
            Set<ColorType> types = new LinkedHashSet<>();
            color.option().forEach(option -> types.add(option.type()));
            colorTypes = List.copyOf(types);
        }
        return new PrintingSpeed(List.of(new PrintingSpeedOption(speed, colorTypes)));
    }

    private static Optional<PpdEntry> firstPresent(PpdEntries entries, String... mainKeywords) {
        return Stream.of(mainKeywords)
                .map(entries::byKeyword)
                .flatMap(Optional::stream)
                .findFirst();
    }

    /**
     * Keeps the first option flagged as default, or the first option when none is, and clears every other flag.
     */
    private static <T> List<T> singleDefault(List<T> options, Predicate<T> isDefault,
                                             BiFunction<T, Boolean, T> withDefault) {
        int chosen = IntStream.range(0, options.size())
                .filter(i -> isDefault.test(options.get(i)))
                .findFirst()
                .orElse(0);
        return IntStream.range(0, options.size())
                .mapToObj(i -> withDefault.apply(options.get(i), i == chosen))
                .toList();
    }
}
