package notifier.delivery;

import notifier.Channel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * @param url     target URL
 * @param method  HTTP method, {@code POST} by default
 * @param headers extra request headers
 * @param body    payload fields, serialized by the provider
 */
public record WebhookMessage(String url, String method, Map<String, String> headers, Map<String, Object> body)
    implements OutboundMessage {

  public WebhookMessage {
    Objects.requireNonNull(url, "url");
    method = method == null ? "POST" : method;
    headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    body = body == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
  }

  @Override
  public Channel channel() {
    return Channel.WEBHOOK;
  }

  @Override
  public String destination() {
    return url;
  }
}
