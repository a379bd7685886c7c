package com.partnerlink.processing;

import static org.assertj.core.api.Assertions.*;

import com.partnerlink.exception.DataFormatException;
import com.partnerlink.matching.PartnerIndex;
import com.partnerlink.model.NameField;
import com.partnerlink.model.PartnerRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class PartnerDirectoryLoaderTest {

    private final PartnerDirectoryLoader loader = new PartnerDirectoryLoader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testLoadResource() {
        List<PartnerRecord> partners = loader.loadResource("directory/partners.json");

        assertThat(partners).hasSize(5);
        assertThat(partners).extracting(PartnerRecord::getId).containsExactly("1", "2", "3", "4", "5");

        PartnerRecord starbucks = partners.get(3);
        assertThat(starbucks.getCanonicalName()).isEqualTo("スターバックス コーヒー ジャパン株式会社");
        assertThat(starbucks.getAliases()).extracting(NameField::field).containsExactly("long_name", "shortcut1");
        assertThat(starbucks.getExternalIdentifier()).contains("9010401039817");

        PartnerRecord nameless = partners.get(4);
        assertThat(nameless.hasAnyName()).isFalse();
        assertThat(nameless.getExternalIdentifier()).isEmpty();
    }

    @Test
    void testNamelessRecordExcludedFromIndex() {
        PartnerIndex index = PartnerIndex.build(loader.loadResource("directory/partners.json"));

        assertThat(index.size()).isEqualTo(4);
        assertThat(index.stats().excluded()).isEqualTo(1);
    }

    @Test
    void testLoadPlainArray() {
        List<PartnerRecord> partners = loader.load(json(
                "[{\"id\": \"a\", \"name\": \"株式会社ローソン\", \"shortcut1\": \"ローソン\"}]"), "inline");

        assertThat(partners).hasSize(1);
        assertThat(partners.get(0).nameFields()).extracting(NameField::value).containsExactly("株式会社ローソン", "ローソン");
    }

    @Test
    void testLoadFromPath(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("partners.json");
        Files.writeString(file, "{\"partners\": [{\"id\": 10, \"name\": \"ミニストップ株式会社\"}]}", StandardCharsets.UTF_8);

        List<PartnerRecord> partners = loader.load(file);

        assertThat(partners).extracting(PartnerRecord::getId).containsExactly("10");
    }

    @Test
    void testMissingIdRejected() {
        DataFormatException e = catchThrowableOfType(DataFormatException.class,
                () -> loader.load(json("[{\"name\": \"ローソン\"}]"), "inline"));

        assertThat(e).hasMessageContaining("position 0");
        assertThat(e.getSource()).isEqualTo("inline");
    }

    @Test
    void testInvalidJsonRejected() {
        assertThatThrownBy(() -> loader.load(json("{partners: ["), "inline"))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void testUnexpectedShapeRejected() {
        assertThatThrownBy(() -> loader.load(json("{\"items\": []}"), "inline"))
                .isInstanceOf(DataFormatException.class);
    }

    @Test
    void testMissingResourceRejected() {
        assertThatThrownBy(() -> loader.loadResource("directory/missing.json"))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void testMissingFileRejected(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(DataFormatException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
