package com.delta.adsync.sync.creative;

import com.delta.adsync.sync.TestFixtures;
import com.delta.adsync.sync.model.CreativeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CreativeTypeDetectorTest {

    @Test
    void detectsTypesFromFixtures() {
        assertEquals(CreativeType.IMAGE, detect(TestFixtures.text("ad_link_image.json")));
        assertEquals(CreativeType.VIDEO, detect(TestFixtures.text("ad_video.json")));
        assertEquals(CreativeType.CAROUSEL, detect(TestFixtures.text("ad_carousel.json")));
        assertEquals(CreativeType.IMAGE, detect(TestFixtures.text("ad_post_only.json")));
    }

    @Test
    void videoWinsOverCarouselAndAssetFeed() {
        String json = """
            {"id":"1","creative":{"asset_feed_spec":{"videos":[{"video_id":"v1"}],"images":[{"hash":"h"}]},
             "object_story_spec":{"link_data":{"child_attachments":[{"picture":"a"},{"picture":"b"}]}}}}
            """;
        assertEquals(CreativeType.VIDEO, detect(json));
    }

    @Test
    void assetFeedWithoutVideosIsDynamic() {
        assertEquals(CreativeType.DYNAMIC, detect("""
            {"id":"1","creative":{"asset_feed_spec":{"titles":[{"text":"A"}],"bodies":[{"text":"B"}]}}}
            """));
    }

    @Test
    void catalogTemplatesAreDynamic() {
        assertEquals(CreativeType.DYNAMIC, detect("""
            {"id":"1","creative":{"name":"{{product.name}} deal"}}
            """));
        assertEquals(CreativeType.DYNAMIC, detect("""
            {"id":"1","creative":{"object_story_spec":{"template_data":{"message":"Shop now"}}}}
            """));
    }

    @Test
    void singleChildIsNotACarousel() {
        assertEquals(CreativeType.IMAGE, detect("""
            {"id":"1","creative":{"image_url":"https://cdn.example.com/a.jpg",
             "object_story_spec":{"link_data":{"child_attachments":[{"picture":"https://cdn.example.com/a.jpg"}]}}}}
            """));
    }

    @Test
    void missingCreativeIsUnknown() {
        assertEquals(CreativeType.UNKNOWN, detect("{\"id\":\"1\",\"name\":\"No creative\"}"));
        assertEquals(CreativeType.UNKNOWN, detect("{\"id\":\"1\",\"creative\":{\"id\":\"c\"}}"));
    }

    @Test
    void fallsBackToFirstAdCreativeInTheList() {
        assertEquals(CreativeType.VIDEO, detect("""
            {"id":"1","adcreatives":{"data":[{"id":"c","video_id":"v9"}]}}
            """));
    }

    private CreativeType detect(String json) {
        return CreativeTypeDetector.detect(new CreativePayload(TestFixtures.parse(json)));
    }
}
