/**
 * Recipient eligibility and channel selection.
 */
package notifier.recipient;
