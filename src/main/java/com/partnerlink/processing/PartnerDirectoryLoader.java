package com.partnerlink.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partnerlink.exception.DataFormatException;
import com.partnerlink.model.PartnerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a partner directory snapshot exported from the accounting system.
 *
 * <p>Accepts either a JSON array of partners or an object with a {@code partners} array.
 * Each partner needs an {@code id}; {@code name}, {@code long_name}, {@code shortcut1},
 * {@code shortcut2} and {@code corporate_number} are optional. Aliases are recorded in the
 * order long_name, shortcut1, shortcut2.
 */
public class PartnerDirectoryLoader {

    private static final Logger logger = LoggerFactory.getLogger(PartnerDirectoryLoader.class);

    private final ObjectMapper objectMapper;

    public PartnerDirectoryLoader() {
        this(new ObjectMapper());
    }

    public PartnerDirectoryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<PartnerRecord> load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, path.toString());
        } catch (IOException e) {
            throw new DataFormatException("Failed to read partner directory", path.toString(), e);
        }
    }

    public List<PartnerRecord> loadResource(String resourcePath) {
        InputStream is = PartnerDirectoryLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new DataFormatException("Partner directory resource not found", resourcePath);
        }
        try (is) {
            return load(is, resourcePath);
        } catch (IOException e) {
            throw new DataFormatException("Failed to read partner directory", resourcePath, e);
        }
    }

    /**
     * @param is     JSON input, not closed by this method
     * @param source description of the input used in error messages
     */
    public List<PartnerRecord> load(InputStream is, String source) {
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(is);
        } catch (IOException e) {
            throw new DataFormatException("Partner directory is not valid JSON", source, e);
        }

        JsonNode partnersNode = rootNode != null && rootNode.isObject() ? rootNode.get("partners") : rootNode;
        if (partnersNode == null || !partnersNode.isArray()) {
            throw new DataFormatException("Expected a JSON array of partners or an object with a 'partners' array", source);
        }

        List<PartnerRecord> partners = new ArrayList<>(partnersNode.size());
        int position = 0;
        for (JsonNode node : partnersNode) {
            partners.add(toPartner(node, source, position++));
        }

        logger.info("Loaded {} partners from {}", partners.size(), source);
        return partners;
    }

    private PartnerRecord toPartner(JsonNode node, String source, int position) {
        String id = text(node, "id");
        if (id == null) {
            throw new DataFormatException("Partner at position " + position + " has no id", source);
        }

        return PartnerRecord.builder(id)
                .canonicalName(text(node, "name"))
                .longName(text(node, "long_name"))
                .shortcut1(text(node, "shortcut1"))
                .shortcut2(text(node, "shortcut2"))
                .externalIdentifier(text(node, "corporate_number"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
