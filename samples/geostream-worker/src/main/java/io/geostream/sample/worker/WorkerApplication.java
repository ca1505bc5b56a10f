package io.geostream.sample.worker;

import io.geostream.GeoStream;
import io.geostream.auth.AuthException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Long-running archiver: subscribes to the configured feed and archives every geotagged
 * post until the process is stopped or authentication fails.
 *
 * <p>Credentials come from {@code GEOSTREAM_CONSUMER_KEY} and friends, or from the file named
 * by {@code geostream.twitter.credentials-file}. Set {@code geostream.azure.connection-string}
 * to archive to Azure Blob Storage; otherwise records land under {@code ./archive}.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/geostream-worker/pom.xml spring-boot:run
 */
@SpringBootApplication
public class WorkerApplication {

  private static final Logger log = LoggerFactory.getLogger(WorkerApplication.class);

  public static void main(String[] args) {
    SpringApplication.run(WorkerApplication.class, args);
  }

  @Bean
  CommandLineRunner awaitStream(GeoStream geoStream) {
    return args -> {
      log.info("Archiving geotagged posts (Ctrl+C to stop)");
      try {
        geoStream.awaitTermination();
        log.info("Stream terminated, state={}", geoStream.state());
      } catch (AuthException e) {
        log.error("Authentication failed, worker stopping: {}", e.getMessage());
        throw e;
      }
    };
  }
}
