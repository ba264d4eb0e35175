package com.ttennebkram.imageeditor.processors;

import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.InvalidDimensionsException;
import com.ttennebkram.imageeditor.model.RasterBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static com.ttennebkram.imageeditor.model.RasterBuffer.ALPHA;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BLUE;
import static com.ttennebkram.imageeditor.model.RasterBuffer.GREEN;
import static com.ttennebkram.imageeditor.model.RasterBuffer.RED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterEngineTest {

    private static final FilterParameters DEFAULTS = FilterParameters.defaults();

    @Test
    void grayscaleUsesLuminosityWeights() {
        RasterBuffer source = RasterBuffer.filled(1, 1, 100, 150, 200, 255);

        RasterBuffer result = FilterEngine.transform(source, FilterType.GRAYSCALE, DEFAULTS);

        assertPixel(result, 0, 0, 159, 159, 159, 255);
    }

    @Test
    void grayscaleIsIdempotent() {
        RasterBuffer source = randomBuffer(16, 16, 42L);

        RasterBuffer once = FilterEngine.transform(source, FilterType.GRAYSCALE, DEFAULTS);
        RasterBuffer twice = FilterEngine.transform(once, FilterType.GRAYSCALE, DEFAULTS);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void grayscaleMapsEveryGrayLevelToItself() {
        byte[] data = new byte[256 * 4];
        for (int level = 0; level < 256; level++) {
            data[level * 4 + BLUE] = (byte) level;
            data[level * 4 + GREEN] = (byte) level;
            data[level * 4 + RED] = (byte) level;
            data[level * 4 + ALPHA] = (byte) 255;
        }
        RasterBuffer grayRamp = new RasterBuffer(256, 1, data);

        assertThat(FilterEngine.transform(grayRamp, FilterType.GRAYSCALE, DEFAULTS)).isEqualTo(grayRamp);
    }

    @Test
    void brightnessAddsTruncatedOffsetAndClamps() {
        RasterBuffer source = RasterBuffer.filled(1, 1, 100, 150, 200, 255);

        RasterBuffer result = FilterEngine.transform(source, FilterType.BRIGHTNESS, DEFAULTS.withBrightness(30));

        assertPixel(result, 0, 0, 176, 226, 255, 255);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-100, -37.5, 0, 12, 100, 250})
    void brightnessNeverLeavesByteRange(double brightness) {
        RasterBuffer source = randomBuffer(8, 8, 7L);

        RasterBuffer result = FilterEngine.transform(source, FilterType.BRIGHTNESS,
                DEFAULTS.withBrightness(brightness));

        int offset = PixelOps.brightnessOffset(brightness);
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                int expected = PixelOps.clampByte(source.channel(x, y, RED) + offset);
                assertThat(result.channel(x, y, RED)).isEqualTo(expected).isBetween(0, 255);
                assertThat(result.alpha(x, y)).isEqualTo(source.alpha(x, y));
            }
        }
    }

    @Test
    void zeroBrightnessAndZeroContrastAreIdentity() {
        RasterBuffer source = randomBuffer(10, 7, 3L);

        assertThat(FilterEngine.transform(source, FilterType.BRIGHTNESS, DEFAULTS.withBrightness(0)))
                .isEqualTo(source);
        assertThat(FilterEngine.transform(source, FilterType.CONTRAST, DEFAULTS.withContrast(0)))
                .isEqualTo(source);
        assertThat(FilterEngine.transform(source, FilterType.BRIGHTNESS_CONTRAST, DEFAULTS))
                .isEqualTo(source);
    }

    @Test
    void contrastPivotsAroundMidpoint() {
        RasterBuffer source = RasterBuffer.filled(1, 1, 100, 150, 200, 255);

        RasterBuffer doubled = FilterEngine.transform(source, FilterType.CONTRAST, DEFAULTS.withContrast(100));
        RasterBuffer flattened = FilterEngine.transform(source, FilterType.CONTRAST, DEFAULTS.withContrast(-100));
        RasterBuffer beyond = FilterEngine.transform(source, FilterType.CONTRAST, DEFAULTS.withContrast(-250));

        assertPixel(doubled, 0, 0, 72, 172, 255, 255);
        assertPixel(flattened, 0, 0, 128, 128, 128, 255);
        assertThat(beyond).isEqualTo(flattened);
    }

    @Test
    void brightnessContrastTruncatesOnceAfterCombining() {
        RasterBuffer source = RasterBuffer.filled(1, 1, 100, 150, 200, 40);

        RasterBuffer result = FilterEngine.transform(source, FilterType.BRIGHTNESS_CONTRAST,
                new FilterParameters(10, 20, 3));

        assertPixel(result, 0, 0, 119, 179, 239, 40);
    }

    @Test
    void blurOfUniformBlackStaysBlack() {
        RasterBuffer source = RasterBuffer.filled(2, 2, 0, 0, 0, 255);

        RasterBuffer result = FilterEngine.transform(source, FilterType.GAUSSIAN_BLUR, DEFAULTS.withBlurRadius(1));

        assertThat(result).isEqualTo(source);
    }

    @Test
    void blurAveragesOnlyInBoundsSamples() {
        byte[] data = new byte[3 * 4];
        data[4 + BLUE] = (byte) 90;
        data[4 + GREEN] = (byte) 90;
        data[4 + RED] = (byte) 90;
        data[ALPHA] = 1;
        data[4 + ALPHA] = 2;
        data[8 + ALPHA] = 3;
        RasterBuffer source = new RasterBuffer(3, 1, data);

        RasterBuffer result = FilterEngine.transform(source, FilterType.GAUSSIAN_BLUR, DEFAULTS.withBlurRadius(1));

        // 0,90,0 -> 45,30,45 -> 37,40,37 -> 38,38,38
        for (int x = 0; x < 3; x++) {
            assertThat(result.channel(x, 0, RED)).isEqualTo(38);
            assertThat(result.alpha(x, 0)).isEqualTo(x + 1);
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -4})
    void nonPositiveBlurRadiusIsIdentity(int radius) {
        RasterBuffer source = randomBuffer(5, 5, 11L);

        RasterBuffer result = FilterEngine.transform(source, FilterType.GAUSSIAN_BLUR,
                DEFAULTS.withBlurRadius(radius));

        assertThat(result).isEqualTo(source).isNotSameAs(source);
    }

    @Test
    void edgeDetectionOnCenterDotLeavesBorderTransparent() {
        RasterBuffer source = RasterBuffer.filled(3, 3, 0, 0, 0, 255);
        byte[] data = source.getBytes();
        int center = (3 + 1) * 4;
        data[center + BLUE] = (byte) 255;
        data[center + GREEN] = (byte) 255;
        data[center + RED] = (byte) 255;

        RasterBuffer result = FilterEngine.transform(new RasterBuffer(3, 3, data),
                FilterType.EDGE_DETECTION, DEFAULTS);

        // Both Sobel kernels weight the center by zero, so a lone dot has no gradient at itself
        assertPixel(result, 1, 1, 0, 0, 0, 255);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                if (x == 1 && y == 1) continue;
                assertPixel(result, x, y, 0, 0, 0, 0);
            }
        }
    }

    @Test
    void edgeDetectionFindsVerticalEdge() {
        RasterBuffer source = RasterBuffer.filled(3, 3, 255, 255, 255, 255);
        byte[] data = source.getBytes();
        for (int y = 0; y < 3; y++) {
            int idx = y * 12;
            data[idx + BLUE] = 0;
            data[idx + GREEN] = 0;
            data[idx + RED] = 0;
        }

        RasterBuffer result = FilterEngine.transform(new RasterBuffer(3, 3, data),
                FilterType.EDGE_DETECTION, DEFAULTS);

        assertPixel(result, 1, 1, 255, 255, 255, 255);
        assertPixel(result, 0, 0, 0, 0, 0, 0);
        assertPixel(result, 2, 2, 0, 0, 0, 0);
    }

    @Test
    void edgeDetectionOnTinyImageIsAllTransparent() {
        RasterBuffer source = RasterBuffer.filled(2, 2, 255, 255, 255, 255);

        RasterBuffer result = FilterEngine.transform(source, FilterType.EDGE_DETECTION, DEFAULTS);

        assertThat(result).isEqualTo(RasterBuffer.blank(2, 2));
    }

    @Test
    void sepiaAppliesToneMatrix() {
        RasterBuffer source = RasterBuffer.filled(1, 1, 100, 150, 200, 128);

        RasterBuffer result = FilterEngine.transform(source, FilterType.SEPIA, DEFAULTS);

        assertPixel(result, 0, 0, 147, 189, 212, 128);
    }

    @Test
    void sepiaClampsBrightInput() {
        RasterBuffer source = RasterBuffer.filled(1, 1, 255, 255, 255, 255);

        RasterBuffer result = FilterEngine.transform(source, FilterType.SEPIA, DEFAULTS);

        // 0.272 + 0.534 + 0.131 = 0.937 of 255 for blue; red and green overflow
        assertPixel(result, 0, 0, 238, 255, 255, 255);
    }

    @Test
    void noneAndNullTypeReturnIndependentClone() {
        RasterBuffer source = randomBuffer(4, 3, 5L);

        RasterBuffer none = FilterEngine.transform(source, FilterType.NONE, DEFAULTS);
        RasterBuffer nullType = FilterEngine.transform(source, null, null);

        assertThat(none).isEqualTo(source).isNotSameAs(source);
        assertThat(nullType).isEqualTo(source);
        assertThat(none.rawBytes()).isNotSameAs(source.rawBytes());
    }

    @ParameterizedTest
    @EnumSource(FilterType.class)
    void everyFilterPreservesDimensionsAndLeavesSourceUntouched(FilterType type) {
        RasterBuffer source = randomBuffer(6, 4, 99L);
        RasterBuffer before = source.copy();

        RasterBuffer result = FilterEngine.transform(source, type, new FilterParameters(40, -30, 2));

        assertThat(result.getWidth()).isEqualTo(6);
        assertThat(result.getHeight()).isEqualTo(4);
        assertThat(result).isNotSameAs(source);
        assertThat(source).isEqualTo(before);
    }

    @Test
    void nullSourceIsInvalidDimensions() {
        assertThatThrownBy(() -> FilterEngine.transform(null, FilterType.GRAYSCALE, DEFAULTS))
                .isInstanceOf(InvalidDimensionsException.class);
    }

    @Test
    void registryCoversEveryFilterType() {
        for (FilterType type : FilterType.values()) {
            assertThat(FilterProcessorRegistry.hasProcessor(type)).isTrue();
            assertThat(FilterProcessorRegistry.get(type).getFilterType()).isEqualTo(type);
        }
        assertThat(FilterProcessorRegistry.get(null).getFilterType()).isEqualTo(FilterType.NONE);
    }

    static RasterBuffer randomBuffer(int width, int height, long seed) {
        byte[] data = new byte[width * height * 4];
        new Random(seed).nextBytes(data);
        return new RasterBuffer(width, height, data);
    }

    static void assertPixel(RasterBuffer buffer, int x, int y, int blue, int green, int red, int alpha) {
        assertThat(new int[] {
                buffer.channel(x, y, BLUE), buffer.channel(x, y, GREEN),
                buffer.channel(x, y, RED), buffer.channel(x, y, ALPHA)})
                .as("pixel (%d,%d)", x, y)
                .containsExactly(blue, green, red, alpha);
    }
}
