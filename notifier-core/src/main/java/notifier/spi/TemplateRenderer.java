package notifier.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Pure function from a template name and data to rendered content.
 */
@FunctionalInterface
public interface TemplateRenderer {

  /** Renderer that knows no templates; messages fall back to title and message text. */
  TemplateRenderer NONE = (template, data) -> Optional.empty();

  /**
   * Renders a template.
   *
   * @param template the template name
   * @param data     template data
   * @return the rendered content, or empty if the template is unknown
   */
  Optional<RenderedContent> render(String template, Map<String, Object> data);
}
