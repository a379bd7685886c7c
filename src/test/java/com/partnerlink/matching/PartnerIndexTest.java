package com.partnerlink.matching;

import static com.partnerlink.matching.PartnerFixtures.*;
import static org.assertj.core.api.Assertions.*;

import com.partnerlink.model.PartnerRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

class PartnerIndexTest {

    @Test
    void testBuildKeepsSnapshotOrder() {
        PartnerIndex index = PartnerIndex.build(directory());

        assertThat(index.size()).isEqualTo(4);
        assertThat(index.partners()).containsExactly(SEVEN_ELEVEN, TOYS_R_US, FAMILY_MART, STARBUCKS);
        assertThat(index.stats()).isEqualTo(new IndexStats(4, 4, 0, 0));
    }

    @Test
    void testFindByIdentifierIsVerbatimApartFromTrim() {
        PartnerIndex index = PartnerIndex.build(directory());

        assertThat(index.findByIdentifier("4010401089234")).contains(TOYS_R_US);
        assertThat(index.findByIdentifier(" 4010401089234 ")).contains(TOYS_R_US);
        assertThat(index.findByIdentifier("0000000000000")).isEmpty();
        assertThat(index.findByIdentifier(null)).isEmpty();
    }

    @Test
    void testFindByNormalizedName() {
        PartnerIndex index = PartnerIndex.build(directory());

        assertThat(index.findByNormalizedName("(株)ファミリーマート")).containsExactly(FAMILY_MART);
        assertThat(index.findByNormalizedName("スターバックス・コーヒー・ジャパン")).containsExactly(STARBUCKS);
        assertThat(index.findByNormalizedName("ローソン")).isEmpty();
    }

    @Test
    void testPartnerListedOnceWhenFieldsNormalizeAlike() {
        // 株式会社ファミリーマート and shortcut2 ファミリーマート share one key
        PartnerIndex index = PartnerIndex.build(directory());

        assertThat(index.findByNormalizedName("ファミリーマート")).hasSize(1).containsExactly(FAMILY_MART);
        assertThat(index.findByNormalizedName("スターバックスコーヒージャパン")).hasSize(1);
    }

    @Test
    void testSharedNormalizedAliasListsEveryPartner() {
        PartnerRecord other = PartnerRecord.builder("9")
                .canonicalName("ファミマ有限会社")
                .build();
        PartnerIndex index = PartnerIndex.build(List.of(FAMILY_MART, other));

        assertThat(index.findByNormalizedName("ファミマ")).containsExactly(FAMILY_MART, other);
    }

    @Test
    void testRecordsWithoutNamesOrDuplicateIdsAreExcluded() {
        PartnerRecord nameless = PartnerRecord.builder("5").canonicalName(" ").shortcut1("").build();
        PartnerRecord duplicate = PartnerRecord.builder("1").canonicalName("ローソン").build();
        List<PartnerRecord> snapshot = new ArrayList<>(Arrays.asList(SEVEN_ELEVEN, nameless, null, duplicate));

        PartnerIndex index = PartnerIndex.build(snapshot);

        assertThat(index.partners()).containsExactly(SEVEN_ELEVEN);
        assertThat(index.stats().excluded()).isEqualTo(3);
        assertThat(index.findByNormalizedName("ローソン")).isEmpty();
    }

    @Test
    void testFirstPartnerKeepsSharedIdentifier() {
        PartnerRecord sameNumber = PartnerRecord.builder("7")
                .canonicalName("ローソン")
                .externalIdentifier("8011101021428")
                .build();
        PartnerIndex index = PartnerIndex.build(List.of(SEVEN_ELEVEN, sameNumber));

        assertThat(index.findByIdentifier("8011101021428")).contains(SEVEN_ELEVEN);
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void testNormalizedFieldsInPriorityOrder() {
        PartnerIndex index = PartnerIndex.build(directory());

        assertThat(index.normalizedFields(STARBUCKS))
                .extracting(PartnerIndex.NormalizedField::field)
                .containsExactly("name", "long_name", "shortcut1");
        assertThat(index.normalizedFields(STARBUCKS))
                .extracting(PartnerIndex.NormalizedField::normalized)
                .containsExactly("スターバックスコーヒージャパン", "スターバックスコーヒージャパン", "スタバ");
    }

    @Test
    void testEmptySnapshot() {
        PartnerIndex index = PartnerIndex.build(List.of());

        assertThat(index.size()).isZero();
        assertThat(index.stats()).isEqualTo(new IndexStats(0, 0, 0, 0));
        assertThat(PartnerIndex.build(null).size()).isZero();
    }
}
