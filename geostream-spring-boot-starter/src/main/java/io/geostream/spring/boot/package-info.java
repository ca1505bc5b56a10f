/**
 * Spring Boot auto-configuration for GeoStream.
 *
 * <p>Add the starter plus the adapter modules you need ({@code geostream-twitter},
 * {@code geostream-azure}, {@code geostream-micrometer}); beans are configured from
 * {@code geostream.*} properties.
 */
package io.geostream.spring.boot;
