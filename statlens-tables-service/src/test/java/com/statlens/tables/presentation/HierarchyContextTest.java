package com.statlens.tables.presentation;

import com.statlens.tables.presentation.HierarchyContext.Entry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class HierarchyContextTest {

    private static HierarchyContext context(Entry... entries) {
        return new HierarchyContext(List.of(entries));
    }

    private static Set<Double> all(HierarchyContext context) {
        return Set.copyOf(context.entries().stream().map(Entry::order).toList());
    }

    @Test
    void ancestorPrefix_isRemoved() {
        HierarchyContext context = context(
                new Entry(1, "Direct investment", 0, true),
                new Entry(2, "Direct investment, Equity", 1, false));

        assertThat(context.simplifyTitle(2, "Direct investment, Equity", all(context))).isEqualTo("Equity");
    }

    @Test
    void prefixSharedByThreeDisplayedSiblings_isRemoved() {
        HierarchyContext context = context(
                new Entry(1, "Reserves", 0, true),
                new Entry(2, "Official reserve assets, Gold", 1, false),
                new Entry(3, "Official reserve assets, SDR holdings", 1, false),
                new Entry(4, "Official reserve assets, Reserve position in the IMF", 1, false));

        assertThat(context.simplifyTitle(2, "Official reserve assets, Gold", all(context))).isEqualTo("Gold");
        assertThat(context.simplifyTitle(2, "Official reserve assets, Gold", Set.of(1.0, 2.0, 3.0)))
                .isEqualTo("Official reserve assets, Gold");
    }

    @Test
    void creditUnderANetSibling_keepsOnlyItsQualifier() {
        HierarchyContext context = context(
                new Entry(1, "Current account", 0, true),
                new Entry(2, "Goods, Credit", 1, false),
                new Entry(3, "Goods, Debit", 1, false),
                new Entry(4, "Goods, Net", 1, false));

        assertThat(context.simplifyTitle(2, "Goods, Credit", all(context))).isEqualTo("Credit");
        assertThat(context.simplifyTitle(4, "Goods, Net", all(context))).isEqualTo("Goods, Net");
        assertThat(context.findBopGroupPrefix(3, "Goods, Debit", all(context))).isEqualTo("Goods, ");
        assertThat(context.findBopGroupPrefix(4, "Goods, Net", all(context))).isNull();
    }

    @Test
    void withoutANetSibling_creditKeepsItsBase() {
        HierarchyContext context = context(
                new Entry(1, "Goods", 0, true),
                new Entry(2, "Goods, Credit", 1, false),
                new Entry(3, "Goods, Debit", 1, false));

        assertThat(context.simplifyTitle(2, "Goods, Credit", all(context))).isEqualTo("Goods, Credit");
    }

    @Test
    void titleEqualToItsAncestor_isNeverEmptied() {
        HierarchyContext context = context(
                new Entry(1, "Goods", 0, true),
                new Entry(2, "Goods", 1, false));

        assertThat(context.simplifyTitle(2, "Goods", all(context))).isEqualTo("Goods");
    }

    @Test
    void qualifierLeftAlone_fallsBackToTheFullTitle() {
        HierarchyContext context = context(
                new Entry(1, "Goods", 0, true),
                new Entry(2, "Goods, Net", 1, false));

        assertThat(context.simplifyTitle(2, "Goods, Net", all(context))).isEqualTo("Goods, Net");
    }

    @Test
    void simplifying_isIdempotent() {
        HierarchyContext context = context(
                new Entry(1, "Current account", 0, true),
                new Entry(2, "Goods, Credit", 1, false),
                new Entry(3, "Goods, Net", 1, false),
                new Entry(4, "Direct investment", 0, true),
                new Entry(5, "Direct investment, Equity", 1, false));
        Set<Double> displayed = all(context);

        for (Entry entry : context.entries()) {
            String once = context.simplifyTitle(entry.order(), entry.title(), displayed);
            assertThat(context.simplifyTitle(entry.order(), once, displayed)).isEqualTo(once);
        }
    }

    @Test
    void trueSiblings_stopAtTheEnclosingParent() {
        HierarchyContext context = context(
                new Entry(1, "A", 0, true),
                new Entry(2, "A1", 1, false),
                new Entry(3, "A2", 1, false),
                new Entry(4, "B", 0, true),
                new Entry(5, "B1", 1, false));

        assertThat(context.trueSiblings(2)).extracting(Entry::title).containsExactly("A1", "A2");
        assertThat(context.trueSiblings(4)).extracting(Entry::title).containsExactly("A", "B");
        assertThat(context.trueSiblings(9)).isEmpty();
    }

    @Test
    void prefixSegments_keepTheirSeparator() {
        assertThat(HierarchyContext.prefixSegments("A, B, C")).containsExactly("A, ", "B, ");
        assertThat(HierarchyContext.prefixSegments("A")).isEmpty();
    }
}
