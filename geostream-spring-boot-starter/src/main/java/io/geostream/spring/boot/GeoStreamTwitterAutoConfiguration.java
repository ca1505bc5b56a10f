package io.geostream.spring.boot;

import io.geostream.auth.CredentialProvider;
import io.geostream.auth.EnvironmentCredentialProvider;
import io.geostream.auth.PropertiesFileCredentialProvider;
import io.geostream.spi.FeedSource;
import io.geostream.twitter.TwitterFeedSource;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Registers a {@link TwitterFeedSource} when the Twitter adapter is on the classpath.
 *
 * <p>Credentials come from {@code geostream.twitter.credentials-file} when set, otherwise from
 * the {@code GEOSTREAM_*} environment variables. Runs before
 * {@link GeoStreamAutoConfiguration} so the feed source is visible to its bean condition.
 */
@AutoConfiguration(before = GeoStreamAutoConfiguration.class)
@ConditionalOnClass(TwitterFeedSource.class)
@EnableConfigurationProperties(GeoStreamProperties.class)
public class GeoStreamTwitterAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public CredentialProvider credentialProvider(GeoStreamProperties props) {
    String file = props.getTwitter().getCredentialsFile();
    if (file != null && !file.isBlank()) {
      return new PropertiesFileCredentialProvider(Path.of(file));
    }
    return new EnvironmentCredentialProvider();
  }

  @Bean
  @ConditionalOnMissingBean(FeedSource.class)
  public TwitterFeedSource twitterFeedSource(GeoStreamProperties props, CredentialProvider credentialProvider) {
    return TwitterFeedSource.builder()
        .endpoint(props.getTwitter().getEndpoint())
        .stallTimeout(props.getTwitter().getStallTimeout())
        .credentialProvider(credentialProvider)
        .build();
  }
}
