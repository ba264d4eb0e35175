package com.ttennebkram.imageeditor.config;

import com.ttennebkram.imageeditor.model.FilterParameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.prefs.Preferences;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EditorSettingsTest {

    @Mock
    private Preferences prefs;

    @Test
    void defaultsNeedNoPreferences() {
        EditorSettings settings = EditorSettings.defaults();

        assertThat(settings.getJpegQuality()).isEqualTo(95);
        assertThat(settings.getDefaultParameters()).isEqualTo(FilterParameters.defaults());
        assertThat(settings.getRecentFiles()).isEmpty();
        assertThat(settings.getLastFile()).isNull();
    }

    @Test
    void jpegQualityIsClamped() {
        EditorSettings settings = EditorSettings.defaults();

        settings.setJpegQuality(0);
        assertThat(settings.getJpegQuality()).isEqualTo(1);

        settings.setJpegQuality(250);
        assertThat(settings.getJpegQuality()).isEqualTo(100);

        settings.setJpegQuality(70);
        assertThat(settings.getJpegQuality()).isEqualTo(70);
    }

    @Test
    void readsStoredValuesAndSkipsMissingRecentFiles(@TempDir Path dir) throws Exception {
        Path existing = Files.createFile(dir.resolve("kept.png"));
        String missing = dir.resolve("gone.png").toString();
        when(prefs.getInt(EditorSettings.JPEG_QUALITY_KEY, 95)).thenReturn(400);
        when(prefs.getDouble(eq(EditorSettings.BRIGHTNESS_KEY), anyDouble())).thenReturn(15.0);
        when(prefs.getDouble(eq(EditorSettings.CONTRAST_KEY), anyDouble())).thenReturn(-5.0);
        when(prefs.getInt(eq(EditorSettings.BLUR_RADIUS_KEY), anyInt())).thenReturn(7);
        when(prefs.get(EditorSettings.LAST_FILE_KEY, null)).thenReturn(existing.toString());
        when(prefs.get(EditorSettings.RECENT_FILES_KEY, "")).thenReturn(missing + "\n" + existing);

        EditorSettings settings = EditorSettings.fromPreferences(prefs);

        assertThat(settings.getJpegQuality()).isEqualTo(100);
        assertThat(settings.getDefaultParameters()).isEqualTo(new FilterParameters(15, -5, 7));
        assertThat(settings.getLastFile()).isEqualTo(existing.toString());
        assertThat(settings.getRecentFiles()).containsExactly(existing.toString());
    }

    @Test
    void recentFilesAreMostRecentFirstAndBounded() {
        EditorSettings settings = EditorSettings.defaults();
        for (int i = 0; i < 12; i++) {
            settings.addRecentFile("file" + i + ".png");
        }
        settings.addRecentFile("file5.png");

        assertThat(settings.getRecentFiles()).hasSize(EditorSettings.MAX_RECENT_FILES);
        assertThat(settings.getRecentFiles().get(0)).isEqualTo("file5.png");
        assertThat(settings.getRecentFiles()).containsOnlyOnce("file5.png");
        assertThat(settings.getRecentFiles()).doesNotContain("file0.png", "file1.png");
        assertThat(settings.getLastFile()).isEqualTo("file5.png");
    }

    @Test
    void recentFilesAreWrittenBackAsSoonAsTheyChange(@TempDir Path dir) throws Exception {
        Path image = Files.createFile(dir.resolve("photo.png"));
        InMemoryPreferences store = new InMemoryPreferences();
        EditorSettings settings = EditorSettings.fromPreferences(store);

        settings.addRecentFile(image.toString());

        EditorSettings reloaded = EditorSettings.fromPreferences(store);
        assertThat(reloaded.getRecentFiles()).containsExactly(image.toString());
        assertThat(reloaded.getLastFile()).isEqualTo(image.toString());

        settings.clearRecentFiles();
        assertThat(EditorSettings.fromPreferences(store).getRecentFiles()).isEmpty();
    }

    @Test
    void saveWritesBackToTheNodeItWasReadFrom() {
        InMemoryPreferences store = new InMemoryPreferences();
        EditorSettings settings = EditorSettings.fromPreferences(store);
        settings.setJpegQuality(42);
        settings.setDefaultParameters(new FilterParameters(-8, 12, 6));

        settings.save();

        EditorSettings reloaded = EditorSettings.fromPreferences(store);
        assertThat(reloaded.getJpegQuality()).isEqualTo(42);
        assertThat(reloaded.getDefaultParameters()).isEqualTo(new FilterParameters(-8, 12, 6));
    }

    @Test
    void defaultsHaveNothingToSaveTo() {
        EditorSettings settings = EditorSettings.defaults();
        settings.addRecentFile("a.png");

        settings.save();

        assertThat(settings.getRecentFiles()).containsExactly("a.png");
    }

    @Test
    void saveWritesEveryKey() throws Exception {
        EditorSettings settings = EditorSettings.defaults();
        settings.setJpegQuality(60);
        settings.setDefaultParameters(new FilterParameters(1, 2, 4));
        settings.addRecentFile("a.png");
        settings.addRecentFile("b.png");

        settings.saveTo(prefs);

        verify(prefs).putInt(EditorSettings.JPEG_QUALITY_KEY, 60);
        verify(prefs).putDouble(EditorSettings.BRIGHTNESS_KEY, 1.0);
        verify(prefs).putDouble(EditorSettings.CONTRAST_KEY, 2.0);
        verify(prefs).putInt(EditorSettings.BLUR_RADIUS_KEY, 4);
        verify(prefs).put(EditorSettings.LAST_FILE_KEY, "b.png");
        verify(prefs).put(EditorSettings.RECENT_FILES_KEY, "b.png\na.png");
        verify(prefs).flush();
    }
}
