package ca.gc.cra.dnstap.domain.dnstap;

/**
 * Position of the observing software in the DNS resolution chain.
 *
 * @since 0.1.0
 */
public enum DnstapRole {
  /** Authoritative server. */
  AUTH,
  /** Recursive resolver talking to upstream authorities. */
  RESOLVER,
  /** Recursive resolver talking to its downstream clients. */
  CLIENT,
  /** Forwarder relaying to another resolver. */
  FORWARDER,
  /** Stub resolver. */
  STUB,
  /** Diagnostic tool such as a query generator. */
  TOOL
}
