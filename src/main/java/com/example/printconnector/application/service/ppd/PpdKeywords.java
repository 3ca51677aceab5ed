package com.example.printconnector.application.service.ppd;

/**
 * PPD main keywords and values the translation reacts to. Keywords are case-sensitive.
 */
public final class PpdKeywords {

    public static final String OPEN_UI = "OpenUI";
    public static final String CLOSE_UI = "CloseUI";
    public static final String JCL_OPEN_UI = "JCLOpenUI";
    public static final String JCL_CLOSE_UI = "JCLCloseUI";
    public static final String OPEN_GROUP = "OpenGroup";
    public static final String CLOSE_GROUP = "CloseGroup";
    public static final String OPEN_SUB_GROUP = "OpenSubGroup";
    public static final String CLOSE_SUB_GROUP = "CloseSubGroup";
    public static final String UI_CONSTRAINTS = "UIConstraints";
    public static final String INSTALLABLE_OPTIONS = "InstallableOptions";
    public static final String DEFAULT = "Default";
    public static final String END = "End";

    public static final String PICK_ONE = "PickOne";
    public static final String PICK_MANY = "PickMany";
    public static final String BOOLEAN = "Boolean";

    public static final String PAGE_SIZE = "PageSize";
    public static final String COLOR_MODEL = "ColorModel";
    public static final String CM_AND_RESOLUTION = "CMAndResolution";
    public static final String SELECT_COLOR = "SelectColor";
    public static final String DUPLEX = "Duplex";
    public static final String KM_DUPLEX = "KMDuplex";
    public static final String RESOLUTION = "Resolution";
    public static final String OUTPUT_BIN = "OutputBin";
    public static final String JOB_TYPE = "JobType";
    public static final String LOCKED_PRINT = "LockedPrint";
    public static final String LOCKED_PRINT_PASSWORD = "LockedPrintPassword";
    public static final String PRINT_QUALITY_TRANSLATION = "Print Quality";

    public static final String MANUFACTURER = "Manufacturer";
    public static final String NICK_NAME = "NickName";
    public static final String MODEL_NAME = "ModelName";
    public static final String HW_MARGINS = "HWMargins";
    public static final String THROUGHPUT = "Throughput";

    private PpdKeywords() {
    }
}
