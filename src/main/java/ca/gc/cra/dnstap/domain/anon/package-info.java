/**
 * Privacy transforms applied to every published DNS event: address prefix masking and domain suffix labels.
 * <p><strong>Concurrency:</strong> Stateless or immutable; safe for concurrent handler invocations.</p>
 */
package ca.gc.cra.dnstap.domain.anon;
