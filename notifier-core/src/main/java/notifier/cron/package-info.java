/**
 * Five-field cron parsing and next-run computation.
 *
 * <p>{@link notifier.cron.CronEvaluator} is a pure function of expression, zone and
 * reference instant; it holds no schedule state.
 */
package notifier.cron;
