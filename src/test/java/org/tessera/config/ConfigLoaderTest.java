package org.tessera.config;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tessera.junit.extensions.logging.ExpectLog;
import org.tessera.junit.extensions.logging.LogLevel;
import org.tessera.junit.extensions.logging.LogWatchExtension;
import org.tessera.runtime.api.TileLayout;
import org.tessera.runtime.model.GridProperties;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    @ExpectLog(level = LogLevel.INFO, loggerPattern = "org.tessera.config.ConfigLoader",
               messagePattern = "Configuration file 'tessera.conf' not found. Using defaults from classpath.")
    void defaultsComeFromTheClasspath() {
        Config layout = ConfigLoader.layoutSection(ConfigLoader.load());

        GridProperties properties = new GridProperties(layout);
        assertThat(properties.getRowCount()).isEqualTo(6);
        assertThat(properties.getColumnCount()).isEqualTo(4);
        assertThat(properties.getVerticalSpan()).isEqualTo(100);
        assertThat(properties.getHorizontalSpan()).isEqualTo(150);
        assertThat(properties.getVerticalSpacing()).isEqualTo(5);
        assertThat(properties.getHorizontalSpacing()).isEqualTo(5);
        assertThat(layout.getBoolean("dragAndDrop")).isTrue();
        assertThat(layout.getBoolean("resizable")).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.INFO, loggerPattern = "org.tessera.config.ConfigLoader",
               messagePattern = "Loading configuration from file: .*custom.conf")
    void explicitFileOverridesDefaults(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "tessera.layout { rowCount = 3, resizable = false }\n");

        Config layout = ConfigLoader.layoutSection(ConfigLoader.load(file.toFile()));
        TileLayout<String> tileLayout = new TileLayout<>(layout);

        assertThat(tileLayout.rowCount()).isEqualTo(3);
        assertThat(tileLayout.columnCount()).isEqualTo(4);
        assertThat(tileLayout.isResizingAccepted()).isFalse();
        assertThat(tileLayout.isDragAndDropAccepted()).isTrue();
    }

    @Test
    void missingExplicitFileIsRejected(@TempDir Path tempDir) {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing.conf");
    }
}
