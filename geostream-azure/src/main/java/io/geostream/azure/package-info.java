/**
 * Azure Blob Storage archive backend.
 */
package io.geostream.azure;
