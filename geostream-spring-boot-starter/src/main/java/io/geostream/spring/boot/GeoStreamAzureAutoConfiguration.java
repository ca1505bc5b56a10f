package io.geostream.spring.boot;

import io.geostream.azure.AzureBlobArchiveStore;
import io.geostream.spi.ArchiveStore;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Archives to Azure Blob Storage when the Azure adapter is on the classpath and
 * {@code geostream.azure.connection-string} is set.
 */
@AutoConfiguration(before = GeoStreamAutoConfiguration.class)
@ConditionalOnClass(AzureBlobArchiveStore.class)
@ConditionalOnProperty(prefix = "geostream.azure", name = "connection-string")
@EnableConfigurationProperties(GeoStreamProperties.class)
public class GeoStreamAzureAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ArchiveStore.class)
  public AzureBlobArchiveStore azureBlobArchiveStore(GeoStreamProperties props) {
    return AzureBlobArchiveStore.fromConnectionString(
        props.getAzure().getConnectionString(), props.getAzure().isCreateContainers());
  }
}
