/**
 * DNS wire decoding adapter built on dnsjava.
 */
package ca.gc.cra.dnstap.infrastructure.dns;
