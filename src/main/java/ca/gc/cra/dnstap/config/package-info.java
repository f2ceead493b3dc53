/**
 * Configuration loading (defaults, YAML, overrides) and the composition root that wires adapters to the handler.
 */
package ca.gc.cra.dnstap.config;
