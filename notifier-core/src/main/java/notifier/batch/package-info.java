/**
 * Batching of non-urgent notifications into periodic digests.
 */
package notifier.batch;
