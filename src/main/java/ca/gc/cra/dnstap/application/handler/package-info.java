/**
 * The dnstap-to-event translator: record classification, field extraction, anonymization, and publish.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.dnstap.application.handler.DnstapEventHandler} holds no mutable
 * state and may be shared by every pipeline worker.</p>
 */
package ca.gc.cra.dnstap.application.handler;
