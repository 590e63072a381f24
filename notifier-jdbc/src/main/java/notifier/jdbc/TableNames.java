package notifier.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores. Every name is validated as a plain SQL identifier
 * because it is concatenated into statements.
 *
 * @param schedules          schedule rows
 * @param deferredDispatches requests waiting for their {@code scheduledFor} time
 * @param dispatchRecords    one row per completed dispatch
 * @param deliveryOutcomes   one row per delivery attempt of a dispatch
 */
public record TableNames(String schedules, String deferredDispatches, String dispatchRecords,
    String deliveryOutcomes) {

  public static final String DEFAULT_SCHEDULES = "notifier_schedule";
  public static final String DEFAULT_DEFERRED_DISPATCHES = "notifier_deferred_dispatch";
  public static final String DEFAULT_DISPATCH_RECORDS = "notifier_dispatch_record";
  public static final String DEFAULT_DELIVERY_OUTCOMES = "notifier_delivery_outcome";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public TableNames {
    validate(schedules);
    validate(deferredDispatches);
    validate(dispatchRecords);
    validate(deliveryOutcomes);
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_SCHEDULES, DEFAULT_DEFERRED_DISPATCHES, DEFAULT_DISPATCH_RECORDS,
        DEFAULT_DELIVERY_OUTCOMES);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
