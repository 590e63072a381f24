/**
 * The dispatch engine and its helpers.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * DispatchEngine engine = DispatchEngine.builder()
 *     .providers(new ProviderRegistry()
 *         .register(smtp)
 *         .register(chat))
 *     .deferredStore(deferredStore)
 *     .fallbackPolicy(new DefaultChannelFallback("#ops-alerts"))
 *     .build();
 * engine.start();
 *
 * DispatchResult result = engine.dispatch(
 *     DispatchRequest.builder("deploy_failed", Category.ALERT, Severity.HIGH)
 *         .title("Deploy failed")
 *         .message("api-server rollout aborted")
 *         .recipients(onCall)
 *         .build());
 * }</pre>
 */
package notifier.dispatch;
