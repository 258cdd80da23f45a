package com.delta.adsync.sync.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaUrlsTest {

    @Test
    void readsDimensionsFromQueryParameters() {
        MediaUrls.Dimensions dims = MediaUrls.dimensionsFromUrl("https://cdn.example.com/img.jpg?w=1280&h=720");
        assertThat(dims.width()).isEqualTo(1280);
        assertThat(dims.height()).isEqualTo(720);
        assertThat(dims.known()).isTrue();
    }

    @Test
    void readsDimensionsFromStpTransformAndPathSegments() {
        MediaUrls.Dimensions fromStp = MediaUrls.dimensionsFromUrl("https://cdn.example.com/x.jpg?stp=dst-jpg_s1080x1080&oh=abc");
        assertThat(fromStp.width()).isEqualTo(1080);
        assertThat(fromStp.height()).isEqualTo(1080);

        MediaUrls.Dimensions fromPath = MediaUrls.dimensionsFromUrl("https://cdn.example.com/v/t45/p720x720/abc.jpg");
        assertThat(fromPath.width()).isEqualTo(720);
        assertThat(fromPath.height()).isEqualTo(720);
    }

    @Test
    void unknownDimensionsWhenNoHintIsPresent() {
        assertThat(MediaUrls.dimensionsFromUrl("https://cdn.example.com/abc.jpg").known()).isFalse();
        assertThat(MediaUrls.dimensionsFromUrl(null).known()).isFalse();
        assertThat(MediaUrls.dimensionsFromUrl("  ").known()).isFalse();
    }

    @Test
    void detectsLowQualityOnlyInThePath() {
        assertThat(MediaUrls.isLowQualityUrl("https://cdn.example.com/v/p64x64/abc.jpg")).isTrue();
        assertThat(MediaUrls.isLowQualityUrl("https://cdn.example.com/v/p128x128/abc.jpg")).isTrue();
        assertThat(MediaUrls.isLowQualityUrl("https://cdn.example.com/abc.jpg?size=p64x64")).isFalse();
        assertThat(MediaUrls.isLowQualityUrl("https://cdn.example.com/v/p720x720/abc.jpg")).isFalse();
        assertThat(MediaUrls.isLowQualityUrl(null)).isFalse();
    }

    @Test
    void upgradesLowResolutionSegments() {
        assertThat(MediaUrls.upgradeResolution("https://cdn.example.com/v/p64x64/abc.jpg"))
            .isEqualTo("https://cdn.example.com/v/p720x720/abc.jpg");
        assertThat(MediaUrls.upgradeResolution("https://cdn.example.com/v/abc.jpg"))
            .isEqualTo("https://cdn.example.com/v/abc.jpg");
    }

    @Test
    void redactsAccessTokens() {
        assertThat(MediaUrls.redactToken("https://graph.example.com/v21.0/me?access_token=SECRET&fields=id"))
            .isEqualTo("https://graph.example.com/v21.0/me?access_token=***&fields=id");
    }
}
