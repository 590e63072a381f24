package notifier.batch;

import notifier.Category;

import java.util.Objects;

/**
 * Requests with equal keys are combined into one digest.
 *
 * @param category request category
 * @param type     request type
 */
public record BatchKey(Category category, String type) {

  public BatchKey {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(type, "type");
  }

  @Override
  public String toString() {
    return category.code() + "_" + type;
  }
}
