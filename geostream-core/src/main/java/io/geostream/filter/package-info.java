/**
 * Event predicates applied before anything is written to disk.
 */
package io.geostream.filter;
