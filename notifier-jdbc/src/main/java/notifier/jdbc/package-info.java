/**
 * JDBC implementations of the notifier persistence collaborators.
 *
 * <p>{@link notifier.jdbc.JdbcScheduleStore} keeps schedules,
 * {@link notifier.jdbc.JdbcDeferredDispatchStore} keeps requests scheduled for later and
 * {@link notifier.jdbc.JdbcDispatchRecordStore} records dispatch outcomes. Tables can be
 * created with {@link notifier.jdbc.JdbcSchema}.
 */
package notifier.jdbc;
