package com.statlens.tables.table;

import com.statlens.tables.data.ObservationRow;
import com.statlens.tables.hierarchy.IndicatorNode;
import com.statlens.tables.text.TitleText;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Titles for matched observations and synthesized headers.
 */
final class TitleComposer {

    static final Map<String, String> ENTRY_LABELS = Map.of(
            "CD_T", "Credit",
            "DB_T", "Debit",
            "NETCD_T", "Net",
            "A_T", "Assets",
            "L_T", "Liabilities",
            "A_P", "Assets",
            "L_P", "Liabilities",
            "A_NFA_T", "Assets (excl. reserves)",
            "L_NIL_T", "Liabilities (incl. net incurrence)",
            "NNAFANIL_T", "Net (Assets excl. reserves less Liabilities)");

    static final Set<String> GFS_DATAFLOWS = Set.of("GFS", "QGFS", "GFSR", "GFSY");

    private static final Set<String> AGGREGATE_CURRENCIES = Set.of("_T", "W0", "W1", "W2", "ALL");
    private static final Set<String> AGGREGATE_UNIT_CODES = Set.of("ALL", "W0", "W1", "W2");

    private final String dataflowId;
    private final String indicatorDimension;
    private final String indicatorCodelistId;
    private final Map<String, String> indicatorLabels;
    private final Map<String, String> sectorLabels;
    private final Map<String, String> unitLabels;

    TitleComposer(String dataflowId,
                  String indicatorDimension,
                  String indicatorCodelistId,
                  Map<String, String> indicatorLabels,
                  Map<String, String> sectorLabels,
                  Map<String, String> unitLabels) {
        this.dataflowId = dataflowId;
        this.indicatorDimension = indicatorDimension;
        this.indicatorCodelistId = indicatorCodelistId;
        this.indicatorLabels = indicatorLabels;
        this.sectorLabels = sectorLabels;
        this.unitLabels = unitLabels;
    }

    String title(ObservationRow row, IndicatorNode node) {
        String code = indicatorDimension == null ? null : row.code(indicatorDimension);
        String name = code == null ? null : TitleText.cleanCodelistLabel(indicatorLabels.get(code));

        String title = null;
        if (usesPathLabels() && isSet(node.label())) {
            title = node.label();
        } else if (isSet(name)) {
            String sector = sectorName(row, code);
            title = sector != null ? sector + ", " + name : name;
        }
        if (!isSet(title) && isSet(node.label())) title = node.label();
        if (!isSet(title) && code != null) title = code.replace('_', ' ');
        if (!isSet(title)) return title;

        String entry = row.code("BOP_ACCOUNTING_ENTRY");
        if (entry != null) {
            String entryLabel = ENTRY_LABELS.get(entry);
            if (entryLabel != null) title = title + ", " + entryLabel;
        } else {
            title = withPositionMarker(title, node.seriesId());
        }

        String currency = row.code("CURRENCY");
        String currencyLabel = row.label("CURRENCY");
        String unitCode = row.code("UNIT_MEASURE") != null ? row.code("UNIT_MEASURE") : row.code("UNIT");
        if (currency != null && isSet(currencyLabel) && !AGGREGATE_CURRENCIES.contains(currency)
                && !currency.equals(unitCode)) {
            title = title + " (" + currencyLabel + ")";
        }

        String indexType = row.code("INDEX_TYPE");
        if ("CPI".equals(dataflowId) && indexType != null && !"CPI".equals(indexType)) {
            title = title + " (" + indexType + ")";
        }
        return title;
    }

    /**
     * Unit for a row that came without one: the transformation label, then for GFS dataflows the unit code that
     * ends the indicator code.
     */
    String unit(ObservationRow row, String indicatorCode) {
        if (isSet(row.unit())) return row.unit();
        String transformation = row.label("TYPE_OF_TRANSFORMATION");
        if (!isSet(transformation)) transformation = row.label("TRANSFORMATION");
        if (isSet(transformation)) return transformation;
        return unitFromCode(indicatorCode);
    }

    String unitFromCode(String code) {
        if (!GFS_DATAFLOWS.contains(dataflowId) || code == null) return null;
        int idx = code.lastIndexOf('_');
        if (idx < 0) return null;
        String suffix = code.substring(idx + 1);
        if (AGGREGATE_UNIT_CODES.contains(suffix)) return null;
        return unitLabels.get(suffix);
    }

    /**
     * Label for a header node. A label that is only the node code is looked up in the indicator codelist,
     * also under unit-suffixed variants of the code.
     */
    String headerLabel(IndicatorNode node) {
        String label = node.label();
        String code = node.code();
        if (code != null && code.equals(label)) {
            String name = indicatorLabels.get(code);
            if (name == null) {
                for (Map.Entry<String, String> entry : indicatorLabels.entrySet()) {
                    if (entry.getKey().startsWith(code + "_")) {
                        name = entry.getValue();
                        break;
                    }
                }
            }
            if (name != null) label = name;
        }
        return TitleText.cleanCodelistLabel(label);
    }

    String headerSectorName(String code) {
        if (code == null || !code.contains("_")) return null;
        return sectorLabels.get(code.substring(0, code.indexOf('_')));
    }

    private String sectorName(ObservationRow row, String code) {
        if (indicatorCodelistId != null && indicatorCodelistId.startsWith("CL_GFS")) {
            String sector = row.code("SECTOR");
            return sector == null ? null : sectorLabels.get(sector);
        }
        return headerSectorName(code);
    }

    private boolean usesPathLabels() {
        return indicatorCodelistId != null && (indicatorCodelistId.endsWith("_INDICATOR_PUB")
                || indicatorCodelistId.endsWith("_INDICATOR_DEFAULT_PUB")
                || indicatorCodelistId.equals("CL_DIP_INDICATOR"));
    }

    /**
     * IIP rows without an accounting entry take their assets or liabilities side from the node series id.
     */
    private static String withPositionMarker(String title, String nodeSeriesId) {
        if (nodeSeriesId == null) return title;
        String lower = title.toLowerCase(Locale.ROOT);
        if (lower.contains("asset") || lower.contains("liabilit")) return title;
        if (nodeSeriesId.contains("_IIP_A_P")) return title + " (Assets)";
        if (nodeSeriesId.contains("_IIP_L_P")) return title + " (Liabilities)";
        return title;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
