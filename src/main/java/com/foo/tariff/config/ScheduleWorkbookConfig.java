package com.foo.tariff.config;

public interface ScheduleWorkbookConfig {

    /**
     * Row number where column headers are located (1-indexed).
     */
    default int getHeaderRow() { return 1; }

    /**
     * Row number where data starts (1-indexed).
     */
    default int getDataStartRow() { return 2; }

    default String getRateTierSheet() { return "RateTiers"; }

    default String getFeeRuleSheet() { return "FeeRules"; }

    default String getExemptionSheet() { return "Exemptions"; }

    default String getSurchargeSheet() { return "Surcharges"; }

    /**
     * Marker string that indicates start of footer/notes section.
     * When found in any cell of a row, stop reading data.
     */
    default String getFooterMarker() { return "※"; }

    /**
     * Upper bound on data rows per sheet.
     */
    default int getMaxRowsPerSheet() { return 5000; }
}
