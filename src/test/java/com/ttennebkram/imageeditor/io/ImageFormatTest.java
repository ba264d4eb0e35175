package com.ttennebkram.imageeditor.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class ImageFormatTest {

    @Test
    void formatFollowsExtension() {
        assertThat(ImageFormat.forPath(Paths.get("a.JPG"))).isEqualTo(ImageFormat.JPEG);
        assertThat(ImageFormat.forPath(Paths.get("a.jpeg"))).isEqualTo(ImageFormat.JPEG);
        assertThat(ImageFormat.forPath(Paths.get("dir", "a.bmp"))).isEqualTo(ImageFormat.BMP);
        assertThat(ImageFormat.forPath(Paths.get("a.tiff"))).isEqualTo(ImageFormat.PNG);
        assertThat(ImageFormat.forPath(Paths.get("noextension"))).isEqualTo(ImageFormat.PNG);
    }

    @Test
    void onlyPngKeepsAlpha() {
        assertThat(ImageFormat.PNG.keepsAlpha()).isTrue();
        assertThat(ImageFormat.JPEG.keepsAlpha()).isFalse();
        assertThat(ImageFormat.BMP.keepsAlpha()).isFalse();
    }
}
