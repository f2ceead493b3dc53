/**
 * dnstap transaction record model: message types, roles, socket metadata, and the decoded record itself.
 * <p><strong>Role:</strong> Domain layer; free of transport and serialization concerns.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 */
package ca.gc.cra.dnstap.domain.dnstap;
