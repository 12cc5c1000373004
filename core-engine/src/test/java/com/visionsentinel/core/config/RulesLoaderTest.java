package com.visionsentinel.core.config;

import com.visionsentinel.core.model.AlarmRule;
import com.visionsentinel.core.model.ChannelType;
import com.visionsentinel.core.postprocess.PostProcessingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RulesLoader}.
 */
class RulesLoaderTest {

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        RulesConfig config = RulesLoader.fromClasspath("test-rules.yml");

        assertThat(config.getRules()).hasSize(2);
        AlarmRule person = config.getRules().get(0);
        assertThat(person.getId()).isEqualTo("person-alert");
        assertThat(person.getClassNames()).containsExactly("person");
        assertThat(person.getMinConfidence()).isEqualTo(0.6);
        assertThat(person.getConsecutiveFrames()).isEqualTo(2);
        assertThat(person.getCooldownSeconds()).isEqualTo(10);
        assertThat(person.getTimeRange().getStartTime()).isEqualTo(LocalTime.of(8, 0));
        assertThat(person.getTimeRange().getEndTime()).isEqualTo(LocalTime.of(18, 0));
        assertThat(person.getChannels()).containsExactly(ChannelType.LOG, ChannelType.CALLBACK);
    }

    @Test
    @DisplayName("Should fill defaults for fields a rule leaves out")
    void shouldApplyRuleDefaults() {
        AlarmRule catchAll = RulesLoader.fromClasspath("test-rules.yml").getRules().get(1);

        assertThat(catchAll.getSessionIds()).containsExactly("cam-1", "cam-2");
        assertThat(catchAll.getClassNames()).isEmpty();
        assertThat(catchAll.getConsecutiveFrames()).isEqualTo(3);
        assertThat(catchAll.getCooldownSeconds()).isEqualTo(30);
        assertThat(catchAll.isEnabled()).isTrue();
        assertThat(catchAll.getChannels()).containsExactly(ChannelType.LOG);
    }

    @Test
    @DisplayName("Should load the algorithm catalog")
    void shouldLoadAlgorithms() {
        RulesConfig config = RulesLoader.fromClasspath("test-rules.yml");

        assertThat(config.getAlgorithms()).hasSize(1);
        AlgorithmDefinition fire = config.getAlgorithms().get(0);
        assertThat(fire.getCode()).isEqualTo("fire_detection");
        assertThat(fire.getModelId()).isEqualTo("models/fire.pt");
        assertThat(fire.getTargetClasses()).containsExactly("fire", "smoke");
        assertThat(fire.getPostProcessing()).isEqualTo(PostProcessingPolicy.NONE);
    }

    @Test
    @DisplayName("Should load the bundled default rules")
    void shouldLoadBundledDefaults() {
        RulesConfig config = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE);

        assertThat(config.getRules()).extracting(AlarmRule::getId).contains("default");
        assertThat(config.getAlgorithms()).extracting(AlgorithmDefinition::getCode)
                .contains("person_detection", "helmet_detection");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should report every invalid entry at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("invalid-rules.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("consecutiveFrames")
                .hasMessageContaining("minConfidence")
                .hasMessageContaining("Duplicate rule id: 'dup'")
                .hasMessageContaining("requires 'modelId'");
    }

    @Test
    @DisplayName("Should load rules from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.yml");
        Files.writeString(file, "rules:\n  - id: fire\n    classNames: [fire]\n    channels: [MESSAGE_BUS]\n");

        RulesConfig config = RulesLoader.fromFile(file.toString());

        assertThat(config.getRules()).hasSize(1);
        assertThat(config.getRules().get(0).getChannels()).containsExactly(ChannelType.MESSAGE_BUS);
    }

    @Test
    @DisplayName("Should throw when the rules file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> RulesLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should treat an empty file as an empty configuration")
    void shouldAcceptEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        RulesConfig config = RulesLoader.fromFile(file.toString());

        assertThat(config.getRules()).isEmpty();
        assertThat(config.getAlgorithms()).isEmpty();
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "rules:\n  - id: [unclosed\n");

        assertThatThrownBy(() -> RulesLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }
}
