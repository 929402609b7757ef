package com.statlens.tables.data;

import com.statlens.tables.exception.EmptyDataException;
import com.statlens.tables.exception.RemoteServiceException;
import com.statlens.tables.registry.IndicatorDimensions;
import com.statlens.tables.text.UnitScale;
import com.statlens.tables.text.UnitText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads SDMX-ML 3.0 structure-specific data messages into {@link ObservationRow}s.
 */
public class ObservationParser {

    private static final Logger log = LoggerFactory.getLogger(ObservationParser.class);

    private static final Set<String> COUNTRY_DIMENSIONS = Set.of("COUNTRY", "REF_AREA", "JURISDICTION");
    private static final String COUNTERPART_COUNTRY = "COUNTERPART_COUNTRY";
    private static final String TYPE_OF_TRANSFORMATION = "TYPE_OF_TRANSFORMATION";
    private static final String UNIT = "UNIT";
    private static final String SCALE = "SCALE";

    private static final Set<String> TITLE_EXCLUDED = Set.of(
            "COUNTRY", "REF_AREA", "TIME_PERIOD", "SCALE", "UNIT", "FREQ", "FREQUENCY", "OBS_VALUE", "OBS_STATUS");
    private static final Set<String> IGNORED_ATTRIBUTES = Set.of(
            "IFS_FLAG", "OVERLAP", "OBS_STATUS", "DECIMALS_DISPLAYED", "COUNTRY_UPDATE_DATE");
    private static final Set<String> MISSING_VALUES = Set.of("", "D");
    private static final Set<String> NON_UNIT_SUFFIXES = Set.of("ALL", "FE", "RFI", "REXFI");
    private static final Set<String> GENERIC_SCALES = Set.of("Units", "units", "");

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY = newFactory();

    private record GroupAttributes(Map<String, String> key, Map<String, String> values) {}

    private record TitlePart(int position, String dimensionId, String text) {}

    private static final class SeriesState {
        final Map<String, String> codes = new LinkedHashMap<>();
        final Map<String, String> labels = new LinkedHashMap<>();
        final Map<String, String> attributes = new LinkedHashMap<>();
        final List<TitlePart> titleParts = new ArrayList<>();
        final List<String> indicatorDimensions = new ArrayList<>();
        String country;
        String countryCode;
        String unit;
        String scale;
        Double unitMultiplier;
    }

    public ObservationData parse(ParseContext context, String url, String xml) {
        Document document = read(url, xml);
        NodeList dataSets = document.getElementsByTagNameNS("*", "DataSet");
        if (dataSets.getLength() == 0) {
            throw new EmptyDataException("No data found in the response.", url);
        }
        Element dataSet = (Element) dataSets.item(0);

        List<GroupAttributes> groups = new ArrayList<>();
        for (Element group : children(dataSet, "Group")) {
            GroupAttributes attrs = readGroup(group);
            if (!attrs.key().isEmpty() && !attrs.values().isEmpty()) groups.add(attrs);
        }

        List<ObservationRow> rows = new ArrayList<>();
        Map<String, Set<String>> derivationTypes = new LinkedHashMap<>();
        Set<String> indicators = new LinkedHashSet<>();

        for (Element series : children(dataSet, "Series")) {
            SeriesState state = readSeries(context, series);
            for (GroupAttributes group : groups) {
                if (matches(group, state.codes)) applyGroup(context, group, state);
            }
            if (state.unit == null) inferUnit(context, state);

            String title = state.titleParts.stream()
                    .sorted(Comparator.comparingInt(TitlePart::position).thenComparing(TitlePart::dimensionId))
                    .map(TitlePart::text)
                    .reduce((a, b) -> a + " - " + b)
                    .orElse(null);
            String indicatorCode = indicatorCode(state);
            String seriesId = seriesId(context, state);
            if (indicatorCode != null) indicators.add(indicatorCode);

            for (Element obs : children(series, "Obs")) {
                String value = observationValue(obs);
                if (value == null || MISSING_VALUES.contains(value)) continue;
                double number;
                try {
                    number = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    log.debug("Skipping non-numeric observation '{}' in {}", value, seriesId);
                    continue;
                }

                String timePeriod = firstNonEmpty(obs.getAttribute("TIME_PERIOD"), obs.getAttribute("TIME"));
                String unit = state.unit;
                String scale = state.scale;
                Double multiplier = state.unitMultiplier;
                String obsUnit = obs.getAttribute(UNIT);
                if (!obsUnit.isEmpty()) unit = context.unitLabels().getOrDefault(obsUnit, obsUnit);
                String obsScale = obs.getAttribute(SCALE);
                if (!obsScale.isEmpty()) {
                    scale = scaleLabel(context, obsScale);
                    multiplier = multiplierOf(obsScale);
                }
                String derivation = obs.getAttribute("DERIVATION_TYPE");
                if (!derivation.isEmpty() && indicatorCode != null) {
                    derivationTypes.computeIfAbsent(indicatorCode, k -> new TreeSet<>())
                            .add(context.derivationLabels().getOrDefault(derivation, derivation));
                }

                rows.add(new ObservationRow(context.dataflowId(), seriesId, title, Map.copyOf(state.codes),
                        Map.copyOf(state.labels), state.country, state.countryCode, unit, scale, multiplier,
                        timePeriod, TimePeriods.periodEnd(timePeriod), number, Map.copyOf(state.attributes)));
            }
        }

        if (rows.isEmpty()) {
            throw new EmptyDataException("No data rows found for dataflow '" + context.dataflowId()
                    + "'. The availability service reports this combination as valid, but no observations were "
                    + "returned. URL -> " + url, url);
        }

        Map<String, SeriesInfo> metadata = new LinkedHashMap<>();
        for (String indicator : indicators) {
            Set<String> derivations = derivationTypes.get(indicator);
            metadata.put(context.dataflowId() + "::" + indicator, new SeriesInfo(indicator,
                    context.indicatorDescriptions().getOrDefault(indicator, ""),
                    derivations == null ? null : String.join("; ", derivations)));
        }
        log.debug("Parsed {} observations for {}", rows.size(), context.dataflowId());
        return new ObservationData(url, rows, metadata);
    }

    private SeriesState readSeries(ParseContext context, Element series) {
        SeriesState state = new SeriesState();
        for (Attr attr : plainAttributes(series)) {
            String name = attr.getName();
            String code = attr.getValue();
            boolean dimension = context.dimensionOrder().contains(name);

            if (IndicatorDimensions.isSeriesCode(name)) {
                String label = context.labelOf(name, code);
                state.codes.put(name, code);
                state.labels.put(name, label);
                state.indicatorDimensions.add(name);
                state.titleParts.add(new TitlePart(context.position(name), name, label));
            } else if (COUNTRY_DIMENSIONS.contains(name)) {
                state.codes.put(name, code);
                state.labels.put(name, context.labelOf(name, code));
                if (state.countryCode == null) {
                    state.countryCode = code;
                    state.country = context.labelOf(name, code);
                }
            } else if (SCALE.equals(name)) {
                state.scale = scaleLabel(context, code);
                state.unitMultiplier = multiplierOf(code);
            } else if (UNIT.equals(name)) {
                state.unit = context.unitLabels().getOrDefault(code, code);
            } else if (dimension || COUNTERPART_COUNTRY.equals(name)) {
                String label = context.labelOf(name, code);
                state.codes.put(name, code);
                state.labels.put(name, label);
                if (!TITLE_EXCLUDED.contains(name)) {
                    state.titleParts.add(new TitlePart(context.position(name), name, label));
                }
            } else if (!IGNORED_ATTRIBUTES.contains(name)) {
                state.attributes.put(name, context.labelOf(name, code));
            }
        }
        return state;
    }

    private static GroupAttributes readGroup(Element group) {
        Map<String, String> key = new LinkedHashMap<>();
        for (Attr attr : plainAttributes(group)) {
            key.put(attr.getName(), attr.getValue());
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (Element comp : children(group, "Comp")) {
            String id = comp.getAttribute("id");
            List<Element> valueElements = children(comp, "Value");
            if (id.isEmpty() || valueElements.isEmpty()) continue;
            String text = valueElements.get(0).getTextContent();
            if (text != null && !text.isBlank()) values.put(id, text.trim());
        }
        return new GroupAttributes(key, values);
    }

    private static boolean matches(GroupAttributes group, Map<String, String> codes) {
        for (Map.Entry<String, String> entry : group.key().entrySet()) {
            if (!entry.getValue().equals(codes.get(entry.getKey()))) return false;
        }
        return true;
    }

    private static void applyGroup(ParseContext context, GroupAttributes group, SeriesState state) {
        for (Map.Entry<String, String> entry : group.values().entrySet()) {
            String id = entry.getKey();
            String value = entry.getValue();
            if (UNIT.equals(id)) {
                if (state.unit == null) state.unit = context.unitLabels().getOrDefault(value, value);
            } else if (SCALE.equals(id)) {
                if (state.scale == null) {
                    state.scale = scaleLabel(context, value);
                    state.unitMultiplier = multiplierOf(value);
                }
            } else if (!state.codes.containsKey(id)) {
                state.attributes.putIfAbsent(id, context.labelOf(id, value));
            }
        }
    }

    /**
     * Unit from the transformation label, the indicator label, a unit-code suffix of the indicator code,
     * or finally from the title, in that order.
     */
    private static void inferUnit(ParseContext context, SeriesState state) {
        String transformation = state.labels.get(TYPE_OF_TRANSFORMATION);
        if (transformation != null) {
            String lower = transformation.toLowerCase(Locale.ROOT);
            if (Set.of("Index", "Weight", "Ratio").contains(transformation)) {
                state.unit = transformation;
            } else if (lower.contains("percent change")) {
                state.unit = "Percent change";
                if (lower.contains("year-over-year")) state.scale = "Year-over-year";
                else if (lower.contains("period-over-period")) state.scale = "Period-over-period";
            } else if (transformation.contains(", ")) {
                String last = transformation.substring(transformation.lastIndexOf(", ") + 2).trim();
                state.unit = Set.of("Index", "Percent", "Weight", "Ratio").contains(last) ? last : transformation;
            } else {
                state.unit = transformation;
            }
        }

        UnitScale extracted = UnitScale.NONE;
        String indicatorLabel = state.labels.get("INDICATOR");
        if (indicatorLabel != null) {
            String unitString = UnitText.extractUnitFromLabel(indicatorLabel);
            if (unitString != null) extracted = UnitText.parseUnitAndScale(unitString);
        }

        if (state.unit == null) {
            String code = state.codes.get("INDICATOR");
            if (code != null && code.contains("_")) {
                String suffix = code.substring(code.lastIndexOf('_') + 1);
                if (!NON_UNIT_SUFFIXES.contains(suffix) && context.unitLabels().containsKey(suffix)) {
                    state.unit = context.unitLabels().get(suffix);
                }
            }
        }

        if (extracted.scale() != null && (state.scale == null || GENERIC_SCALES.contains(state.scale))) {
            state.scale = extracted.scale();
        }
        if (state.unit == null && extracted.unit() != null) state.unit = extracted.unit();

        if (state.unit == null) {
            List<String> sources = new ArrayList<>();
            state.titleParts.forEach(part -> sources.add(part.text()));
            sources.add(state.labels.get("PRODUCTION_INDEX"));
            sources.add(state.labels.get("INDEX_TYPE"));
            for (String source : sources) {
                if (source == null) continue;
                String unitString = UnitText.extractUnitFromLabel(source);
                if (unitString == null) continue;
                UnitScale parsed = UnitText.parseUnitAndScale(unitString);
                if (parsed.unit() != null) state.unit = parsed.unit();
                if (parsed.scale() != null && state.scale == null) state.scale = parsed.scale();
                break;
            }
        }
    }

    private static String indicatorCode(SeriesState state) {
        for (String dimensionId : IndicatorDimensions.ROW_INDICATOR) {
            String code = state.codes.get(dimensionId);
            if (code != null) return code;
        }
        if (state.indicatorDimensions.isEmpty()) return null;
        return state.codes.get(state.indicatorDimensions.get(state.indicatorDimensions.size() - 1));
    }

    private static String seriesId(ParseContext context, SeriesState state) {
        if (state.indicatorDimensions.isEmpty()) return null;
        String codes = state.indicatorDimensions.stream()
                .sorted(Comparator.comparingInt(context::position).thenComparing(Comparator.naturalOrder()))
                .map(state.codes::get)
                .reduce((a, b) -> a + "_" + b)
                .orElse("");
        return context.dataflowId() + "::" + codes;
    }

    private static String observationValue(Element obs) {
        String value = firstNonEmpty(obs.getAttribute("OBS_VALUE"), obs.getAttribute("OBSERVATION"));
        if (value != null) return value;
        for (Element child : children(obs, null)) {
            String local = localName(child).toUpperCase(Locale.ROOT);
            if (local.equals("OBSVALUE") || local.equals("OBS_VALUE") || local.equals("VALUE")) {
                String text = firstNonEmpty(child.getAttribute("value"), child.getTextContent());
                if (text != null) return text.trim();
            }
        }
        return null;
    }

    private static String scaleLabel(ParseContext context, String code) {
        try {
            Integer.parseInt(code);
        } catch (NumberFormatException e) {
            return code;
        }
        return context.scaleLabels().getOrDefault(code, "10^" + code);
    }

    private static Double multiplierOf(String code) {
        try {
            int exponent = Integer.parseInt(code);
            return exponent == 0 ? 1.0 : Math.pow(10, exponent);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Document read(String url, String xml) {
        try {
            DocumentBuilder builder = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new RemoteServiceException("Failed to parse XML response: " + e.getMessage(), url, e);
        }
    }

    private static List<Attr> plainAttributes(Element element) {
        List<Attr> attributes = new ArrayList<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            // xmlns declarations and xsi:type carry no component values
            if (attr.getNamespaceURI() != null || attr.getName().startsWith("xmlns")) continue;
            attributes.add(attr);
        }
        return attributes;
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) continue;
            Element element = (Element) node;
            if (localName == null || localName.equals(localName(element))) elements.add(element);
        }
        return elements;
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    private static String firstNonEmpty(String first, String second) {
        if (first != null && !first.isEmpty()) return first;
        if (second != null && !second.isEmpty()) return second;
        return null;
    }

    private static DocumentBuilderFactory newFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Document builder configuration failed", e);
        }
        return factory;
    }
}
