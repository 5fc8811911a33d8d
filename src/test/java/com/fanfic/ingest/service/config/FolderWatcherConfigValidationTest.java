package com.fanfic.ingest.service.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class FolderWatcherConfigValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void bindsAllProperties() {
        contextRunner
                .withPropertyValues(
                        "fanfic.folder-watcher.folder-path=/tmp/drop",
                        "fanfic.folder-watcher.poll-interval-seconds=15",
                        "fanfic.folder-watcher.ffnet-disable=true")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    FolderWatcherConfig config = context.getBean(FolderWatcherConfig.class);
                    assertThat(config.getFolderPath()).isEqualTo("/tmp/drop");
                    assertThat(config.getPollIntervalSeconds()).isEqualTo(15);
                    assertThat(config.isFfnetDisable()).isTrue();
                    assertThat(config.isEnabled()).isTrue();
                });
    }

    @Test
    void missingFolderPathFailsStartup() {
        contextRunner
                .withPropertyValues("fanfic.folder-watcher.poll-interval-seconds=15")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void blankFolderPathFailsStartup() {
        contextRunner
                .withPropertyValues("fanfic.folder-watcher.folder-path=  ")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void nonPositiveIntervalFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "fanfic.folder-watcher.folder-path=/tmp/drop",
                        "fanfic.folder-watcher.poll-interval-seconds=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(FolderWatcherConfig.class)
    static class PropertiesConfiguration {
    }
}
