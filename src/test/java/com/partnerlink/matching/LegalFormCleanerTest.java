package com.partnerlink.matching;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LegalFormCleanerTest {

    @Test
    void testLegalFormsLoaded() {
        // 10 from legal_forms.json, 3 from addition_legal_forms.txt
        assertThat(LegalFormCleaner.getLegalFormsCount()).isEqualTo(13);
    }

    @Test
    void testIsLegalForm() {
        assertThat(LegalFormCleaner.isLegalForm("株式会社")).isTrue();
        assertThat(LegalFormCleaner.isLegalForm("㈲")).isTrue();
        assertThat(LegalFormCleaner.isLegalForm("LIMITED")).isTrue();
        assertThat(LegalFormCleaner.isLegalForm("Ｌｉｍｉｔｅｄ")).isTrue();
        assertThat(LegalFormCleaner.isLegalForm("Ltd.")).isTrue();
        assertThat(LegalFormCleaner.isLegalForm("ファミマ")).isFalse();
        assertThat(LegalFormCleaner.isLegalForm(null)).isFalse();
    }

    @Test
    void testLongestFormRemovedFirst() {
        assertThat(LegalFormCleaner.removeLegalForms("株式会社ローソン")).isEqualTo("ローソン");
        assertThat(LegalFormCleaner.removeLegalForms("ローソン株")).isEqualTo("ローソン");
    }

    @Test
    void testExposedFormIsRemovedWhole() {
        // removing 株式会社 from the middle leaves 株式会社 again, not 式会社
        assertThat(LegalFormCleaner.removeLegalForms("株株式会社式会社")).isEmpty();
        assertThat(LegalFormCleaner.removeLegalForms("ローソン株株式会社式会社")).isEqualTo("ローソン");
    }

    @Test
    void testRemoveFromEmpty() {
        assertThat(LegalFormCleaner.removeLegalForms(null)).isEmpty();
        assertThat(LegalFormCleaner.removeLegalForms("")).isEmpty();
    }
}
