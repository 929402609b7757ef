package com.statlens.tables.registry;

import com.statlens.tables.SnapshotFixtures;
import com.statlens.tables.registry.SdmxStructures.Code;
import com.statlens.tables.registry.SdmxStructures.Codelist;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CodelistResolverTest {

    private CodelistCache cache;
    private CodelistResolver resolver;

    @BeforeEach
    void setUp() {
        cache = new CodelistCache(SnapshotFixtures.mockHttp());
        resolver = new CodelistResolver(cache);
    }

    private void known(String... ids) {
        for (String id : ids) cache.register(new Codelist(id, "IMF.STA", List.of(new Code("X", "X", "X"))));
    }

    private static ResolutionContext context(String dataflow, String structure, String dimension, String scheme) {
        return new ResolutionContext(dataflow, structure, new Dimension(dimension, 0, dimension, scheme, null));
    }

    @Test
    void countryDimension_prefersIsoCountryList() {
        known("CL_GFS_ISO_COUNTRY", "CL_COUNTRY");
        assertThat(resolver.resolve(context("GFS_BS", "DSD_GFS", "COUNTRY", null))).contains("CL_GFS_ISO_COUNTRY");
    }

    @Test
    void baseDataflowVariant_isTried() {
        known("CL_GFS_SECTOR");
        assertThat(resolver.resolve(context("GFS_BS", "DSD_X", "SECTOR", null))).contains("CL_GFS_SECTOR");
    }

    @Test
    void structurePattern_stripsDsdPrefix() {
        known("CL_MFS_CB_ACCOUNT");
        assertThat(resolver.resolve(context("MFS", "DSD_MFS_CB", "ACCOUNT", null))).contains("CL_MFS_CB_ACCOUNT");
    }

    @Test
    void conceptScheme_becomesCodelistStem() {
        known("CL_NSDP_FREQ");
        assertThat(resolver.resolve(context("XYZ", null, "FREQ", "CS_NSDP"))).contains("CL_NSDP_FREQ");
    }

    @Test
    void counterpartDimension_fallsBackToItsBaseDimension() {
        known("CL_SECTOR");
        assertThat(resolver.resolve(context("XYZ", null, "COUNTERPART_SECTOR", null))).contains("CL_SECTOR");
    }

    @Test
    void fuzzyMatch_ignoresMasterLists() {
        known("CL_MASTER_WIDGET_KIND", "CL_SPECIAL_WIDGET_KIND_V2");
        assertThat(resolver.resolve(context("ABC", null, "WIDGET_KIND", null))).contains("CL_SPECIAL_WIDGET_KIND_V2");
    }

    @Test
    void fuzzyMatch_ignoresTheCaseOfTheDimensionId() {
        known("CL_EXTRA_GADGET_PART");
        assertThat(resolver.resolve(context("ABC", null, "gadget_part", null))).contains("CL_EXTRA_GADGET_PART");
    }

    @Test
    void segmentMatch_ignoresTheCaseOfTheDimensionId() {
        known("CL_PART_OF_GADGET");
        assertThat(resolver.resolve(context("ABC", null, "gadget_part", null))).contains("CL_PART_OF_GADGET");
    }

    @Test
    void nothingMatches_returnsEmpty() {
        known("CL_UNRELATED");
        assertThat(resolver.resolve(context("ABC", null, "NOTHING_LIKE_IT", null))).isEmpty();
    }
}
