package com.statlens.tables.presentation;

import com.statlens.tables.table.MatchedRow;
import com.statlens.tables.text.TitleText;
import com.statlens.tables.text.UnitScale;
import com.statlens.tables.text.UnitText;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Lays table-mode rows out in hierarchy order: headers that lead to data, simplified data titles,
 * Net rows heading their Credit and Debit rows, and breakdown rows for dimensions with several values.
 */
final class TableLayout {

    static final List<String> GROUPING_DIMENSIONS = List.of(
            "SECTOR", "TYPE_OF_TRANSFORMATION", "COUNTERPART_COUNTRY", "CURRENCY", "INDEX_TYPE",
            "BOP_ACCOUNTING_ENTRY", "ACCOUNTING_ENTRY", "ACCOUNT", "PRICE_TYPE", "S_ADJUSTMENT");

    private static final String COUNTERPART = "COUNTERPART_COUNTRY";
    private static final String WORLD = "G001";
    private static final Pattern COUNTERPART_GROUP = Pattern.compile("^[A-Z]+\\d+$");
    private static final List<String> HEADER_PREFIXES = List.of("Financial corporations, ", "Depository corporations, ");
    private static final String INDENT = "   ";
    private static final String HEADER_MARK = "▸ ";
    private static final String DATA_MARK = "  ";

    /**
     * One series of one country at one order, with its values inside the date window.
     */
    private static final class Line {
        final double order;
        final String country;
        final String title;
        String unit;
        String scale;
        final Map<String, String> dimCodes = new LinkedHashMap<>();
        final Map<String, String> dimLabels = new LinkedHashMap<>();
        final Map<LocalDate, Double> values = new HashMap<>();
        List<String> groupDims = List.of();
        List<String> groupKey = List.of();

        Line(double order, String country, String title) {
            this.order = order;
            this.country = country;
            this.title = title;
        }

        boolean hasData() {
            return values.values().stream().anyMatch(Objects::nonNull);
        }

        boolean allZero() {
            return values.values().stream().allMatch(v -> v == null || v == 0.0);
        }

        double latestMagnitude(List<LocalDate> dates) {
            for (LocalDate date : dates) {
                Double v = values.get(date);
                if (v != null) return Math.abs(v);
            }
            return 0.0;
        }
    }

    /**
     * Rows rendered for one order. A Net block is keyed so its Credit and Debit blocks can pull it forward.
     */
    private record Block(String netKey, boolean netChild, List<DisplayRow> rows) {}

    private final List<LocalDate> dates;
    private final List<String> columns;
    private final String tableName;
    private final TreeMap<Double, List<MatchedRow>> byOrder = new TreeMap<>();
    private final Map<String, Double> nodeOrders = new HashMap<>();
    private final Map<Double, HierarchyContext.Entry> entryByOrder = new HashMap<>();
    private final HierarchyContext context;

    TableLayout(List<MatchedRow> rows, List<LocalDate> dates, String tableName) {
        this.dates = dates;
        this.columns = dates.stream().map(LocalDate::toString).toList();
        this.tableName = tableName;

        for (MatchedRow row : rows) {
            byOrder.computeIfAbsent(row.order(), o -> new ArrayList<>()).add(row);
            if (row.hierarchyNodeId() != null) nodeOrders.merge(row.hierarchyNodeId(), row.order(), Math::min);
        }

        List<HierarchyContext.Entry> entries = new ArrayList<>();
        byOrder.forEach((order, orderRows) -> {
            HierarchyContext.Entry entry = representative(order, orderRows);
            entries.add(entry);
            entryByOrder.put(order, entry);
        });
        this.context = new HierarchyContext(entries);
    }

    /**
     * Per order, an explicit header wins over a data row; among ties the longest title.
     */
    static HierarchyContext.Entry representative(double order, List<MatchedRow> rows) {
        MatchedRow best = null;
        for (MatchedRow row : rows) {
            if (best == null) {
                best = row;
                continue;
            }
            if (row.categoryHeader() != best.categoryHeader()) {
                if (row.categoryHeader()) best = row;
                continue;
            }
            if (length(row.title()) > length(best.title())) best = row;
        }
        return new HierarchyContext.Entry(order, TitleText.stripTitleSuffix(best.title()), best.level(),
                best.categoryHeader());
    }

    HierarchyContext context() {
        return context;
    }

    List<DisplayRow> layout() {
        List<Line> lines = buildLines();
        Set<Double> ordersWithData = new HashSet<>();
        lines.forEach(l -> ordersWithData.add(l.order));

        Set<Double> parentOrders = new HashSet<>();
        for (Double order : ordersWithData) {
            Double parent = parentOrder(order);
            Set<Double> visited = new HashSet<>();
            while (parent != null && visited.add(parent)) {
                parentOrders.add(parent);
                parent = parentOrder(parent);
            }
        }
        Set<Double> displayed = new HashSet<>(parentOrders);
        displayed.addAll(ordersWithData);

        List<String> multiDims = multiValueDimensions(lines);
        for (Line line : lines) {
            line.groupDims = multiDims;
            line.groupKey = multiDims.stream().map(d -> line.dimCodes.getOrDefault(d, "")).toList();
        }

        String uniformSuffix = uniformSuffix(lines);
        List<DisplayRow> out = new ArrayList<>();
        boolean tableHeader = needsTableHeader();
        if (tableHeader) {
            String title = HEADER_MARK + tableName + (uniformSuffix != null ? uniformSuffix : "");
            out.add(new DisplayRow(title, null, null, null, true, 0, emptyValues()));
        }
        String extraIndent = tableHeader ? INDENT : "";

        Map<Double, List<Line>> linesByOrder = new HashMap<>();
        lines.forEach(l -> linesByOrder.computeIfAbsent(l.order, o -> new ArrayList<>()).add(l));

        Set<Double> skippedHeaders = new HashSet<>();
        List<Block> blocks = new ArrayList<>();
        for (Map.Entry<Double, List<MatchedRow>> e : byOrder.entrySet()) {
            double order = e.getKey();
            HierarchyContext.Entry entry = entryByOrder.get(order);
            int level = Math.max(0, entry.level() - promotion(order, skippedHeaders));

            if (!ordersWithData.contains(order)) {
                if (!parentOrders.contains(order)) continue;
                String title = headerTitle(entry.title());
                if (TitleText.isBopSuffixOnly(title)) {
                    skippedHeaders.add(order);
                    continue;
                }
                UnitScale us = effectiveUnitScale(order);
                String suffix = unitSuffix(level, tableHeader, uniformSuffix, us.unit(), us.scale());
                String text = extraIndent + INDENT.repeat(level) + HEADER_MARK + title + suffix;
                blocks.add(new Block(null, false,
                        List.of(new DisplayRow(text, null, us.unit(), us.scale(), true, level, emptyValues()))));
                continue;
            }

            List<Line> orderLines = linesByOrder.get(order);
            String rawTitle = TitleText.stripTitleSuffix(orderLines.get(0).title);
            String netKey = null;
            boolean netChild = false;
            boolean net = false;
            if (rawTitle.endsWith(", Net")) {
                String base = rawTitle.substring(0, rawTitle.length() - ", Net".length());
                netKey = key(order, base);
                net = context.trueSiblings(order).stream()
                        .filter(sibling -> displayed.contains(sibling.order()))
                        .anyMatch(sibling -> (base + ", Credit").equals(sibling.title())
                                || (base + ", Debit").equals(sibling.title()));
            } else {
                String bopPrefix = context.findBopGroupPrefix(order, rawTitle, displayed);
                if (bopPrefix != null) {
                    netKey = key(order, bopPrefix.substring(0, bopPrefix.length() - 2));
                    netChild = true;
                    level++;
                }
            }
            String title = context.simplifyTitle(order, rawTitle, displayed);
            blocks.add(new Block(netKey, netChild,
                    dataRows(orderLines, title, level, extraIndent, tableHeader, uniformSuffix, net)));
        }

        out.addAll(assemble(blocks));
        return out;
    }

    /**
     * Emits each Net block ahead of the first Credit or Debit block that shares its base.
     */
    private static List<DisplayRow> assemble(List<Block> blocks) {
        Map<String, Block> netBlocks = new HashMap<>();
        for (Block block : blocks) {
            if (block.netKey() != null && !block.netChild()) netBlocks.putIfAbsent(block.netKey(), block);
        }
        Set<Block> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
        List<DisplayRow> out = new ArrayList<>();
        for (Block block : blocks) {
            if (emitted.contains(block)) continue;
            if (block.netChild()) {
                Block net = netBlocks.get(block.netKey());
                if (net != null && emitted.add(net)) out.addAll(net.rows());
            }
            emitted.add(block);
            out.addAll(block.rows());
        }
        return out;
    }

    private List<DisplayRow> dataRows(List<Line> orderLines, String title, int level, String extraIndent,
                                      boolean tableHeader, String uniformSuffix, boolean net) {
        String indent = extraIndent + INDENT.repeat(level);
        String mark = net ? HEADER_MARK : DATA_MARK;
        List<DisplayRow> rows = new ArrayList<>();

        Set<List<String>> groups = new LinkedHashSet<>();
        orderLines.forEach(l -> groups.add(l.groupKey));
        boolean breakdown = groups.size() > 1;

        if (!breakdown) {
            List<Line> sorted = new ArrayList<>(orderLines);
            sorted.sort(Comparator.comparing(l -> Objects.toString(l.country, "")));
            for (Line line : sorted) {
                String suffix = unitSuffix(level, tableHeader, uniformSuffix, line.unit, line.scale);
                rows.add(row(indent + mark + title + suffix, line, net, level));
            }
            return rows;
        }

        Line world = orderLines.stream().filter(l -> WORLD.equals(l.dimCodes.get(COUNTERPART))).findFirst()
                .orElse(null);
        Line first = world != null ? world : orderLines.get(0);
        String suffix = unitSuffix(level, tableHeader, uniformSuffix, first.unit, first.scale);
        if (world != null) {
            rows.add(row(indent + mark + title + suffix, world, net, level));
        } else {
            rows.add(new DisplayRow(indent + mark + title + suffix, null, first.unit, first.scale, net, level,
                    emptyValues()));
        }

        String childIndent = indent + INDENT;
        List<Line> rest = orderLines.stream().filter(l -> l != world && !l.allZero()).toList();
        boolean counterpart = first.dimCodes.containsKey(COUNTERPART)
                && orderLines.stream().map(l -> l.dimCodes.get(COUNTERPART)).distinct().count() > 1;
        if (counterpart) {
            Comparator<Line> byMagnitude = Comparator.comparingDouble((Line l) -> l.latestMagnitude(dates)).reversed();
            List<Line> aggregates = rest.stream()
                    .filter(l -> isCounterpartGroup(l.dimCodes.get(COUNTERPART))).sorted(byMagnitude).toList();
            List<Line> economies = rest.stream()
                    .filter(l -> !isCounterpartGroup(l.dimCodes.get(COUNTERPART))).sorted(byMagnitude).toList();
            for (Line line : aggregates) {
                rows.add(row(childIndent + HEADER_MARK + breakdownLabel(line), line, false, level + 1));
            }
            for (Line line : economies) {
                rows.add(row(childIndent + DATA_MARK + breakdownLabel(line), line, false, level + 1));
            }
            return rows;
        }

        List<Line> sorted = new ArrayList<>(rest);
        sorted.sort(Comparator.comparing(TableLayout::breakdownLabel)
                .thenComparing(l -> Objects.toString(l.country, "")));
        for (Line line : sorted) {
            rows.add(row(childIndent + DATA_MARK + breakdownLabel(line), line, false, level + 1));
        }
        return rows;
    }

    private DisplayRow row(String text, Line line, boolean header, int level) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (LocalDate date : dates) values.put(date.toString(), line.values.get(date));
        return new DisplayRow(text, line.country, line.unit, line.scale, header, level, values);
    }

    private Map<String, Double> emptyValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        columns.forEach(c -> values.put(c, null));
        return values;
    }

    private List<Line> buildLines() {
        Set<LocalDate> window = new HashSet<>(dates);
        Map<String, Line> lines = new LinkedHashMap<>();
        for (Map.Entry<Double, List<MatchedRow>> e : byOrder.entrySet()) {
            for (MatchedRow row : e.getValue()) {
                if (row.categoryHeader() || row.value() == null || row.date() == null) continue;
                String key = e.getKey() + "|" + row.country() + "|" + row.seriesId() + "|" + groupingCodes(row);
                Line line = lines.computeIfAbsent(key, k -> newLine(e.getKey(), row));
                if (window.contains(row.date())) line.values.putIfAbsent(row.date(), row.value());
            }
        }
        return lines.values().stream().filter(Line::hasData).toList();
    }

    private Line newLine(double order, MatchedRow row) {
        String title = row.title() != null ? row.title() : Objects.toString(row.indicatorCode(), "");
        Line line = new Line(order, row.country(), title);
        UnitScale inherited = effectiveUnitScale(order);
        line.unit = UnitText.isPresent(row.unit()) ? row.unit() : inherited.unit();
        line.scale = UnitText.isPresent(row.scale()) ? row.scale() : inherited.scale();
        for (String dim : GROUPING_DIMENSIONS) {
            String code = row.codes().get(dim);
            if (code == null) continue;
            line.dimCodes.put(dim, code);
            line.dimLabels.put(dim, row.labels() != null ? row.labels().getOrDefault(dim, code) : code);
        }
        return line;
    }

    private static String groupingCodes(MatchedRow row) {
        StringBuilder sb = new StringBuilder();
        for (String dim : GROUPING_DIMENSIONS) {
            String code = row.codes().get(dim);
            if (code != null) sb.append(dim).append('=').append(code).append(';');
        }
        return sb.toString();
    }

    private static List<String> multiValueDimensions(List<Line> lines) {
        List<String> dims = new ArrayList<>();
        for (String dim : GROUPING_DIMENSIONS) {
            long distinct = lines.stream().map(l -> l.dimCodes.get(dim)).filter(Objects::nonNull).distinct().count();
            if (distinct > 1) dims.add(dim);
        }
        return dims;
    }

    /**
     * {@code " (unit, scale)"} when every line shares one unit; the scale is included only when it is shared too.
     */
    private static String uniformSuffix(List<Line> lines) {
        Set<String> units = new HashSet<>();
        Set<String> scales = new HashSet<>();
        for (Line line : lines) {
            units.add(UnitText.isPresent(line.unit) ? line.unit : "");
            scales.add(UnitText.isPresent(line.scale) ? line.scale : "");
        }
        if (units.size() != 1 || units.contains("")) return null;
        String scale = scales.size() == 1 ? scales.iterator().next() : null;
        return UnitText.formatUnitSuffix(units.iterator().next(), scale);
    }

    private static String unitSuffix(int level, boolean tableHeader, String uniformSuffix, String unit, String scale) {
        if (uniformSuffix != null) return level == 0 && !tableHeader ? uniformSuffix : "";
        return UnitText.formatUnitSuffix(unit, scale);
    }

    private boolean needsTableHeader() {
        if (tableName == null || tableName.isBlank()) return false;
        for (HierarchyContext.Entry entry : context.entries()) {
            if (entry.level() != 0) continue;
            return !entry.header() || !tableName.equals(entry.title());
        }
        return false;
    }

    /**
     * Own unit and scale of the order, else those of the nearest ancestor that has one.
     */
    UnitScale effectiveUnitScale(double order) {
        Double current = order;
        Set<Double> visited = new HashSet<>();
        while (current != null && visited.add(current)) {
            UnitScale own = ownUnitScale(current);
            if (!own.isEmpty()) return own;
            current = parentOrder(current);
        }
        return UnitScale.NONE;
    }

    private UnitScale ownUnitScale(double order) {
        List<MatchedRow> rows = byOrder.get(order);
        if (rows == null) return UnitScale.NONE;
        for (MatchedRow row : rows) {
            if (UnitText.isPresent(row.unit()) || UnitText.isPresent(row.scale())) {
                return new UnitScale(UnitText.isPresent(row.unit()) ? row.unit() : null,
                        UnitText.isPresent(row.scale()) ? row.scale() : null);
            }
        }
        for (MatchedRow row : rows) {
            UnitScale fromTitle = UnitText.extractUnitScaleFromTitle(row.title());
            if (!fromTitle.isEmpty()) return fromTitle;
        }
        return UnitScale.NONE;
    }

    Double parentOrder(double order) {
        List<MatchedRow> rows = byOrder.get(order);
        if (rows == null || rows.isEmpty()) return null;
        String parentId = rows.get(0).parentId();
        if (parentId == null) return null;
        Double parent = nodeOrders.get(parentId);
        return parent != null && parent != order ? parent : null;
    }

    private int promotion(double order, Set<Double> skippedHeaders) {
        int count = 0;
        Double parent = parentOrder(order);
        Set<Double> visited = new HashSet<>();
        while (parent != null && visited.add(parent)) {
            if (skippedHeaders.contains(parent)) count++;
            parent = parentOrder(parent);
        }
        return count;
    }

    private static String headerTitle(String title) {
        for (String prefix : HEADER_PREFIXES) {
            if (title.startsWith(prefix) && title.length() > prefix.length()) return title.substring(prefix.length());
        }
        return title;
    }

    private static String breakdownLabel(Line line) {
        List<String> parts = new ArrayList<>();
        for (String dim : line.groupDims) {
            String code = line.dimCodes.get(dim);
            if (code != null) parts.add(line.dimLabels.getOrDefault(dim, code));
        }
        return parts.isEmpty() ? line.title : String.join(" - ", parts);
    }

    private static boolean isCounterpartGroup(String code) {
        return code != null && COUNTERPART_GROUP.matcher(code).matches();
    }

    private String key(double order, String base) {
        return parentOrder(order) + "|" + base;
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }
}
