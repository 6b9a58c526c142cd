package com.phillippitts.catalogintel.service.ingest;

import com.phillippitts.catalogintel.exception.IngestException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageFormatsTest {

    @Test
    void extensionIgnoresQueryAndCase() {
        assertThat(ImageFormats.extensionOf("https://x.test/a/B.PNG?size=large")).isEqualTo(".png");
        assertThat(ImageFormats.extensionOf("https://x.test/photo.webp#top")).isEqualTo(".webp");
    }

    @Test
    void missingExtensionDefaultsToJpeg() {
        assertThat(ImageFormats.extensionOf("https://x.test/images/12345")).isEqualTo(".jpg");
        assertThat(ImageFormats.extensionOf("https://x.test/images.d/12345")).isEqualTo(".jpg");
    }

    @Test
    void unsupportedExtensionIsRejected() {
        assertThatThrownBy(() -> ImageFormats.extensionOf("https://x.test/anim.gif"))
                .isInstanceOf(IngestException.class)
                .hasMessageContaining(".gif");
    }

    @Test
    void cachedFileNameUsesSlugAndDigest() {
        String name = ImageFormats.cachedFileName("Sofa / Grey #1", "https://x.test/s.jpg", ".jpg");

        assertThat(name).matches("sofa-grey-1_[0-9a-f]{10}\\.jpg");
    }

    @Test
    void slugFallsBackForSymbolOnlyIds() {
        assertThat(ImageFormats.slug("***")).isEqualTo("product");
    }
}
