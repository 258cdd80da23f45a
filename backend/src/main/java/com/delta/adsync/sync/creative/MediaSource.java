package com.delta.adsync.sync.creative;

import com.delta.adsync.sync.model.CreativeType;

import java.util.Optional;

/** One step of the media waterfall. An empty result hands over to the next step. */
@FunctionalInterface
interface MediaSource {
    Optional<MediaCandidate> resolve(CreativePayload payload, CreativeType type, ResolutionContext context);
}
