/**
 * Per-event orchestration of filter, staging, upload and cleanup.
 */
package io.geostream.handler;
