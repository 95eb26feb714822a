/**
 * Application layer: ports plus the use cases that orchestrate fetching, filtering, verification, and output.
 */
package ca.gc.cra.blocklist.application;
