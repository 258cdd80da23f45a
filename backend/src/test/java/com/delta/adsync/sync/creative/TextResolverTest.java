package com.delta.adsync.sync.creative;

import com.delta.adsync.sync.TestFixtures;
import com.delta.adsync.sync.http.GraphApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextResolverTest {
    @Mock
    private GraphApiClient graphApiClient;

    private TextResolver resolver;
    private ResolutionContext context;

    @BeforeEach
    void setUp() {
        lenient().when(graphApiClient.graphUrl(anyString(), anyMap())).thenAnswer(invocation -> invocation.getArgument(0));
        resolver = new TextResolver(new CreativeLookups(graphApiClient));
        context = new ResolutionContext("tenant-a", "42", "tok");
    }

    @Test
    void readsLinkAdFieldsWithoutRemoteCalls() {
        TextResolver.ResolvedTexts texts = resolve(TestFixtures.json("ad_link_image.json"));

        assertEquals("Spring sale", texts.title());
        assertEquals("Everything 20% off this week", texts.body());
        assertEquals("Free shipping over 50", texts.description());
        assertEquals("SHOP_NOW", texts.callToAction());
        assertEquals("https://shop.example.com/spring", texts.linkUrl());
        assertTrue(texts.complete());
        verify(graphApiClient, never()).getJson(anyString());
    }

    @Test
    void readsVideoDataFields() {
        TextResolver.ResolvedTexts texts = resolve(TestFixtures.json("ad_video.json"));

        assertEquals("Meet the new model", texts.title());
        assertEquals("Watch the launch", texts.body());
        assertEquals("LEARN_MORE", texts.callToAction());
        assertEquals("https://brand.example.com/launch", texts.linkUrl());
        assertNull(texts.description());
    }

    @Test
    void creativeLevelFieldsWinOverStorySpec() {
        TextResolver.ResolvedTexts texts = resolve(TestFixtures.parse("""
            {"id":"1","creative":{"title":"Creative title","body":"Creative body","call_to_action_type":"SIGN_UP",
             "object_story_spec":{"link_data":{"name":"Link name","message":"Link message",
             "call_to_action":{"type":"SHOP_NOW"}}}}}
            """));

        assertEquals("Creative title", texts.title());
        assertEquals("Creative body", texts.body());
        assertEquals("SIGN_UP", texts.callToAction());
    }

    @Test
    void assetFeedAndCarouselChildrenFillGaps() {
        TextResolver.ResolvedTexts feed = resolve(TestFixtures.parse("""
            {"id":"1","creative":{"asset_feed_spec":{"titles":[{"text":"Feed title"}],"bodies":[{"text":"Feed body"}],
             "descriptions":[{"text":"Feed description"}],"call_to_action_types":["BOOK_TRAVEL"],
             "link_urls":[{"website_url":"https://travel.example.com"}]}}}
            """));
        assertEquals("Feed title", feed.title());
        assertEquals("Feed body", feed.body());
        assertEquals("Feed description", feed.description());
        assertEquals("BOOK_TRAVEL", feed.callToAction());
        assertEquals("https://travel.example.com", feed.linkUrl());

        TextResolver.ResolvedTexts carousel = resolve(TestFixtures.json("ad_carousel.json"));
        assertEquals("Red", carousel.title());
        assertEquals("Pick your favourite", carousel.body());
        assertEquals("The red one", carousel.description());
    }

    @Test
    void originatingPostOnlyFillsMissingFields() {
        when(graphApiClient.getJson("111_999")).thenReturn(TestFixtures.json("post_full_picture.json"));

        TextResolver.ResolvedTexts texts = resolve(TestFixtures.parse("""
            {"id":"1","creative":{"title":"Own title","effective_object_story_id":"111_999"}}
            """));

        assertEquals("Own title", texts.title());
        assertEquals("Our biggest drop yet", texts.body());
        assertEquals("See the full range", texts.description());
        assertEquals("SHOP_NOW", texts.callToAction());
        assertEquals("https://shop.example.com/new", texts.linkUrl());
    }

    @Test
    void noPostLookupWithoutPostId() {
        TextResolver.ResolvedTexts texts = resolve(TestFixtures.parse("{\"id\":\"1\",\"creative\":{\"body\":\"Just a body\"}}"));

        assertEquals("Just a body", texts.body());
        assertNull(texts.title());
        verify(graphApiClient, never()).getJson(anyString());
    }

    private TextResolver.ResolvedTexts resolve(JsonNode ad) {
        return resolver.resolve(new CreativePayload(ad), context);
    }
}
