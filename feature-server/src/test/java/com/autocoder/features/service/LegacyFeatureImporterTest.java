package com.autocoder.features.service;

import com.autocoder.features.config.AutocoderProperties;
import com.autocoder.features.model.Feature;
import com.autocoder.features.repository.FeatureRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LegacyFeatureImporterTest {

    @TempDir Path projectDir;

    @Mock FeatureRepository featureRepo;

    @Captor ArgumentCaptor<List<Feature>> rowsCaptor;

    LegacyFeatureImporter importer;

    @BeforeEach
    void setUp() {
        AutocoderProperties props = new AutocoderProperties();
        props.setProjectDir(projectDir.toString());
        importer = new LegacyFeatureImporter(featureRepo, new ObjectMapper(), props);
    }

    @Test
    void noLegacyFile_importsNothing() {
        assertThat(importer.importIfPresent()).isZero();

        verifyNoInteractions(featureRepo);
    }

    @Test
    void legacyFile_emptyStore_importsInFileOrderAndRenamesFile() throws Exception {
        Path legacy = projectDir.resolve("feature_list.json");
        Files.writeString(legacy, """
                [
                  {"category":"auth","name":"Login","description":"log in","steps":["open"],"passes":true},
                  {"category":"auth","name":"Logout","description":"log out","steps":["click"],"passes":false,"extra":1}
                ]
                """);
        when(featureRepo.count()).thenReturn(0L);

        int imported = importer.importIfPresent();

        assertThat(imported).isEqualTo(2);
        verify(featureRepo).saveAll(rowsCaptor.capture());
        List<Feature> rows = rowsCaptor.getValue();
        assertThat(rows).extracting(Feature::getName).containsExactly("Login", "Logout");
        assertThat(rows).extracting(Feature::getPriority).containsExactly(1, 2);
        assertThat(rows).extracting(Feature::isPasses).containsExactly(true, false);

        assertThat(Files.exists(legacy)).isFalse();
        assertThat(Files.exists(projectDir.resolve("feature_list.json.migrated"))).isTrue();
    }

    @Test
    void legacyFile_storeAlreadyPopulated_leavesFileAlone() throws Exception {
        Path legacy = projectDir.resolve("feature_list.json");
        Files.writeString(legacy, "[]");
        when(featureRepo.count()).thenReturn(12L);

        assertThat(importer.importIfPresent()).isZero();

        verify(featureRepo, never()).saveAll(any());
        assertThat(Files.exists(legacy)).isTrue();
    }

    @Test
    void malformedLegacyFile_failsStartup() throws Exception {
        Files.writeString(projectDir.resolve("feature_list.json"), "{ not a list");
        when(featureRepo.count()).thenReturn(0L);

        assertThatThrownBy(() -> importer.importIfPresent())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed legacy feature list");
        verify(featureRepo, never()).saveAll(any());
    }

    @Test
    void legacyEntryWithoutStepsOrName_failsStartupAndKeepsFile() throws Exception {
        Path legacy = projectDir.resolve("feature_list.json");
        Files.writeString(legacy, """
                [
                  {"category":"auth","name":"Login","description":"log in","steps":["open"]},
                  {"category":"auth","name":" ","description":"log out","steps":[]}
                ]
                """);
        when(featureRepo.count()).thenReturn(0L);

        assertThatThrownBy(() -> importer.importIfPresent())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("entry 1")
                .hasMessageContaining("[name, steps]");
        verify(featureRepo, never()).saveAll(any());
        assertThat(Files.exists(legacy)).isTrue();
    }

    @Test
    void legacyEntryWithNullStep_failsStartup() throws Exception {
        Files.writeString(projectDir.resolve("feature_list.json"), """
                [{"category":"auth","name":"Login","description":"log in","steps":["open", null]}]
                """);
        when(featureRepo.count()).thenReturn(0L);

        assertThatThrownBy(() -> importer.importIfPresent())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("entry 0");
        verify(featureRepo, never()).saveAll(any());
    }
}
