/**
 * Pure block list model: domain shape rules, line formats, whitelist predicates, public-suffix data, and the
 * hierarchical reduction. Nothing here performs I/O.
 */
package ca.gc.cra.blocklist.domain;
