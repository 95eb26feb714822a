/**
 * File-system output of the published block list variants.
 */
package ca.gc.cra.blocklist.infrastructure.output;
