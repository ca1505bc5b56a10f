package io.geostream.spi;

import io.geostream.BoundingBox;

/**
 * Upstream service delivering a live, filtered stream of posts.
 *
 * <p>A {@link io.geostream.stream.StreamSupervisor} calls {@link #connect} once per
 * subscription attempt and then drives the returned {@link FeedConnection}.
 */
public interface FeedSource {

    /**
     * Authenticates and opens a subscription restricted to the given bounding box.
     *
     * @param filter the geographic filter for the whole stream
     * @return an open connection, ready for {@link FeedConnection#deliver}
     * @throws io.geostream.auth.AuthException              if credentials are missing or rejected (fatal)
     * @throws io.geostream.stream.SubscriptionException if the subscription cannot be established (recoverable)
     */
    FeedConnection connect(BoundingBox filter);
}
