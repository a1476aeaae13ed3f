package com.autocoder.features.service;

import com.autocoder.features.config.AutocoderProperties;
import com.autocoder.features.model.Feature;
import com.autocoder.features.repository.FeatureRepository;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One-shot import of the old file-based feature list.
 *
 * Projects created before the database existed keep their backlog in
 * feature_list.json. At startup, if that file is present and the features
 * table is empty, its entries are loaded in file order (priority 1..N) and
 * the file is renamed to *.migrated so the import never runs twice.
 */
@Component
public class LegacyFeatureImporter implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LegacyFeatureImporter.class);

    static final String MIGRATED_SUFFIX = ".migrated";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LegacyFeature(String category, String name, String description,
                         List<String> steps, boolean passes) {}

    private static final TypeReference<List<LegacyFeature>> LEGACY_LIST_TYPE = new TypeReference<>() {};

    private final FeatureRepository   featureRepo;
    private final ObjectMapper        objectMapper;
    private final AutocoderProperties properties;

    public LegacyFeatureImporter(FeatureRepository featureRepo,
                                 ObjectMapper objectMapper,
                                 AutocoderProperties properties) {
        this.featureRepo  = featureRepo;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        importIfPresent();
    }

    /**
     * All rows are written by a single saveAll() call, which is one
     * transaction. The file is only renamed after that commit.
     *
     * @return number of imported features (0 when there was nothing to do)
     * @throws IllegalStateException if the file is malformed or an entry is invalid
     */
    public int importIfPresent() {
        Path projectDir = properties.projectPath();
        try {
            Files.createDirectories(projectDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create project directory " + projectDir, e);
        }

        Path legacyFile = projectDir.resolve(properties.getLegacyFeatureFile());
        if (!Files.isRegularFile(legacyFile)) {
            return 0;
        }
        if (featureRepo.count() > 0) {
            log.info("Ignoring {}: features table already populated", legacyFile);
            return 0;
        }

        List<LegacyFeature> legacy;
        try {
            legacy = objectMapper.readValue(legacyFile.toFile(), LEGACY_LIST_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("Malformed legacy feature list " + legacyFile, e);
        }

        List<Feature> rows = new ArrayList<>(legacy.size());
        for (int i = 0; i < legacy.size(); i++) {
            LegacyFeature lf = legacy.get(i);
            NewFeature entry = lf == null ? null
                    : new NewFeature(lf.category(), lf.name(), lf.description(), lf.steps());
            List<String> invalid = FeatureQueueService.invalidFields(entry);
            if (!invalid.isEmpty()) {
                throw new IllegalStateException("Legacy feature list " + legacyFile
                        + ": entry " + i + " missing or invalid fields " + invalid);
            }
            Feature feature = new Feature(i + 1, lf.category(), lf.name(), lf.description(), lf.steps());
            if (lf.passes()) {
                feature.markPassing();
            }
            rows.add(feature);
        }
        featureRepo.saveAll(rows);

        Path migrated = legacyFile.resolveSibling(legacyFile.getFileName() + MIGRATED_SUFFIX);
        try {
            Files.move(legacyFile, migrated, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Imported features but could not rename " + legacyFile, e);
        }
        log.info("Imported {} features from {} (renamed to {})", rows.size(), legacyFile, migrated.getFileName());
        return rows.size();
    }
}
