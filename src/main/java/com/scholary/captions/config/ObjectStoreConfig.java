package com.scholary.captions.config;

import com.scholary.captions.objectstore.CaptionPublisher;
import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreProperties;
import com.scholary.captions.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Only active with {@code objectstore.enabled=true}. Without it no publisher bean exists and
 * captions stay on local disk.
 */
@Configuration
@ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public CaptionPublisher captionPublisher(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new CaptionPublisher(objectStoreClient, properties);
  }
}
