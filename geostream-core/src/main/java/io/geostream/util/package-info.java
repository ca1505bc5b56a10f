/**
 * Small concurrency helpers shared by the pipeline components.
 */
package io.geostream.util;
