package notifier.spi;

/**
 * Output of a {@link TemplateRenderer}. Any part may be null.
 *
 * @param subject subject line (email) or heading
 * @param text    plain-text body
 * @param html    HTML body
 */
public record RenderedContent(String subject, String text, String html) {
}
