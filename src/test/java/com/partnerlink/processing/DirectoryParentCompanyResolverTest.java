package com.partnerlink.processing;

import static org.assertj.core.api.Assertions.*;

import com.partnerlink.matching.CandidateRanker;
import com.partnerlink.matching.PartnerIndex;
import com.partnerlink.model.ConfidenceBand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DirectoryParentCompanyResolverTest {

    private DirectoryParentCompanyResolver resolver;

    @BeforeEach
    void setUp() {
        PartnerIndex index = PartnerIndex.build(new PartnerDirectoryLoader().loadResource("directory/partners.json"));
        resolver = new DirectoryParentCompanyResolver(new CandidateRanker(index));
    }

    @Test
    void testStoreResolvesToOperatingCompany() {
        ParentCompanyResult result = resolver.resolve("トイザらス熊本店");

        assertThat(result.isResolved()).isTrue();
        assertThat(result.parentCompany()).contains("日本トイザらス株式会社");
        assertThat(result.confidence()).isEqualTo(ConfidenceBand.MEDIUM);
        assertThat(result.originalName()).isEqualTo("トイザらス熊本店");
    }

    @Test
    void testWeakMatchHasLowConfidence() {
        ParentCompanyResult result = resolver.resolve("スターバックス新宿ショップ");

        assertThat(result.parentCompany()).contains("スターバックス コーヒー ジャパン株式会社");
        assertThat(result.confidence()).isEqualTo(ConfidenceBand.LOW);
    }

    @Test
    void testUnknownStoreIsUnresolved() {
        ParentCompanyResult result = resolver.resolve("ローソン");

        assertThat(result.isResolved()).isFalse();
        assertThat(result.confidence()).isEqualTo(ConfidenceBand.UNKNOWN);
    }

    @Test
    void testNothingLeftAfterCleaning() {
        assertThat(resolver.resolve("123").isResolved()).isFalse();
        assertThat(resolver.resolve("").isResolved()).isFalse();
    }
}
