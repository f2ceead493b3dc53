/**
 * Input validation helpers shared by configuration loading and the record model.
 * <p><strong>Role:</strong> Domain support utilities; throw {@link java.lang.IllegalArgumentException} with the
 * offending key in the message.</p>
 */
package ca.gc.cra.dnstap.validation;
