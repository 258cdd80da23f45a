package com.delta.adsync.sync.creative;

import com.delta.adsync.sync.model.ResolutionQuality;
import com.delta.adsync.sync.util.MediaUrls;

/**
 * A media URL produced by one step of the waterfall. Explicit dimensions win over hints parsed
 * from the URL.
 */
public record MediaCandidate(String url, Integer width, Integer height, String source) {

    public static MediaCandidate of(String url, Integer width, Integer height, String source) {
        if (width != null && height != null && width > 0 && height > 0) {
            return new MediaCandidate(url, width, height, source);
        }
        MediaUrls.Dimensions hint = MediaUrls.dimensionsFromUrl(url);
        return new MediaCandidate(url, hint.width(), hint.height(), source);
    }

    public static MediaCandidate of(String url, String source) {
        return of(url, null, null, source);
    }

    public ResolutionQuality quality() {
        return ResolutionQuality.classify(width, height);
    }
}
