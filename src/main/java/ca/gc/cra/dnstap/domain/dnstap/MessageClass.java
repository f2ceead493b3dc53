package ca.gc.cra.dnstap.domain.dnstap;

/**
 * Direction of an observed DNS transaction: the query leg or the response leg.
 *
 * @since 0.1.0
 */
public enum MessageClass {
  /** A DNS query observed on its way to a server. */
  QUERY,
  /** A DNS response observed on its way back to the requester. */
  RESPONSE
}
