package notifier.dispatch;

import notifier.Channel;
import notifier.DispatchRequest;
import notifier.Recipient;
import notifier.delivery.ChatMessage;
import notifier.delivery.EmailMessage;
import notifier.delivery.OutboundMessage;
import notifier.delivery.SmsMessage;
import notifier.delivery.WebhookMessage;
import notifier.spi.RenderedContent;
import notifier.spi.TemplateRenderer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the channel-specific message for one recipient.
 *
 * <p>When the request names a template, the {@link TemplateRenderer} is asked for the
 * subject and bodies; anything it does not supply falls back to the request's title
 * and message.
 */
public final class MessageComposer {
  private static final Logger logger = Logger.getLogger(MessageComposer.class.getName());

  private final TemplateRenderer templateRenderer;

  public MessageComposer(TemplateRenderer templateRenderer) {
    this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer");
  }

  public OutboundMessage compose(Channel channel, DispatchRequest request, Recipient recipient, String address) {
    RenderedContent content = render(request, recipient);
    String subject = content.subject() != null ? content.subject() : request.title();
    String text = content.text() != null ? content.text() : request.message();

    switch (channel) {
      case EMAIL:
        return new EmailMessage(address, subject, text, content.html());
      case CHAT:
        return new ChatMessage(address, subject.isEmpty() ? text : subject + "\n" + text,
            recipient.chatWorkspace());
      case WEBHOOK:
        return new WebhookMessage(address, "POST", Map.of("X-Notification-Id", request.id()),
            webhookBody(request, subject, text));
      case SMS:
        return new SmsMessage(address, subject.isEmpty() ? text : subject + ": " + text);
      default:
        throw new IllegalArgumentException("Unsupported channel: " + channel);
    }
  }

  private RenderedContent render(DispatchRequest request, Recipient recipient) {
    if (request.template() == null) {
      return new RenderedContent(null, null, null);
    }
    Map<String, Object> data = new LinkedHashMap<>(request.templateData());
    data.putIfAbsent("title", request.title());
    data.putIfAbsent("message", request.message());
    data.putIfAbsent("severity", request.severity().name());
    data.putIfAbsent("category", request.category().name());
    data.putIfAbsent("recipientId", recipient.id());
    Optional<RenderedContent> rendered = templateRenderer.render(request.template(), data);
    if (rendered.isEmpty()) {
      logger.log(Level.FINE, "Template {0} not rendered, using title and message", request.template());
      return new RenderedContent(null, null, null);
    }
    return rendered.get();
  }

  private static Map<String, Object> webhookBody(DispatchRequest request, String title, String text) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("id", request.id());
    body.put("type", request.type());
    body.put("category", request.category().code());
    body.put("severity", request.severity().name());
    body.put("title", title);
    body.put("message", text);
    if (!request.templateData().isEmpty()) {
      body.put("data", request.templateData());
    }
    if (!request.metadata().isEmpty()) {
      body.put("metadata", request.metadata());
    }
    return body;
  }
}
