package com.partnerlink.model;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import java.util.List;

class PartnerRecordTest {

    @Test
    void testNameFieldsCanonicalFirstThenAliasesInOrder() {
        PartnerRecord partner = PartnerRecord.builder("4")
                .canonicalName("スターバックス コーヒー ジャパン株式会社")
                .longName("スターバックスコーヒージャパン")
                .shortcut1("スタバ")
                .shortcut2("  ")
                .build();

        assertThat(partner.nameFields()).extracting(NameField::field)
                .containsExactly("name", "long_name", "shortcut1");
        assertThat(partner.displayName()).isEqualTo("スターバックス コーヒー ジャパン株式会社");
    }

    @Test
    void testDisplayNameFallsBackToFirstAlias() {
        PartnerRecord partner = new PartnerRecord("8", null, List.of(new NameField("shortcut1", "ローソン")), null);

        assertThat(partner.displayName()).isEqualTo("ローソン");
        assertThat(partner.hasAnyName()).isTrue();
    }

    @Test
    void testDuplicateAliasValuesAreKept() {
        PartnerRecord partner = PartnerRecord.builder("3")
                .canonicalName("ファミリーマート")
                .shortcut2("ファミリーマート")
                .build();

        assertThat(partner.nameFields()).hasSize(2);
    }

    @Test
    void testIdentifierTrimmedAndBlankMeansAbsent() {
        assertThat(PartnerRecord.builder("1").externalIdentifier(" 8011101021428 ").build().getExternalIdentifier())
                .contains("8011101021428");
        assertThat(PartnerRecord.builder("1").externalIdentifier("   ").build().getExternalIdentifier()).isEmpty();
    }

    @Test
    void testNoNames() {
        PartnerRecord partner = PartnerRecord.builder("5").canonicalName("").build();

        assertThat(partner.hasAnyName()).isFalse();
        assertThat(partner.displayName()).isEmpty();
    }
}
