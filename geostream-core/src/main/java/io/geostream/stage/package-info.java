/**
 * Local staging of event payloads between receipt and archival.
 *
 * @see io.geostream.stage.StageWriter
 */
package io.geostream.stage;
