/**
 * Collaborator interfaces the scheduler and dispatch engine call out to.
 *
 * <p>Job creation, run counting, persistence, template rendering and metrics are
 * supplied by the host application. JDBC implementations of the stores live in the
 * {@code notifier-jdbc} module.
 */
package notifier.spi;
