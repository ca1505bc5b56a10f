/**
 * Feed source for the Twitter v1.1 streaming filter endpoint.
 *
 * <p>{@link io.geostream.twitter.TwitterFeedSource} signs the subscription with
 * {@link io.geostream.twitter.OAuth1Signer}, reads newline-delimited JSON over
 * {@link java.net.http.HttpClient} and decodes each line with
 * {@link io.geostream.twitter.TweetDecoder} (Jackson).
 */
package io.geostream.twitter;
