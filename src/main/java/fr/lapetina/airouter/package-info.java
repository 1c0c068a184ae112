/**
 * AI Request Router - routes canonical completion requests across hosted LLM providers.
 *
 * <p>Requests in a provider-agnostic form are resolved to an ordered list of provider
 * candidates, dispatched one after another with per-attempt timeouts, and failed over on
 * availability errors. Responses carry token usage, cost and failover metadata.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.airouter.RoutingEngineFactory} - Main entry point for creating
 *       a fully-configured engine from YAML configuration</li>
 *   <li>{@link fr.lapetina.airouter.routing.FailoverRouter} - Blocking, asynchronous and
 *       streaming routing</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RoutingEngineFactory engine = RoutingEngineFactory.create("config.yaml").start()) {
 *     CanonicalRequest request = CanonicalRequest.builder()
 *             .model("fast-model")
 *             .message(CanonicalRequest.Message.user("Hello!"))
 *             .build();
 *
 *     CanonicalResponse response = engine.getRouter().route(request);
 *     System.out.println(response.content());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>OpenAI, Anthropic, Gemini and Ollama adapters behind one capability interface</li>
 *   <li>Health-aware candidate ordering with background and on-failure probing</li>
 *   <li>Pull-based streaming with vendor framing normalized away</li>
 *   <li>Micrometer metrics with Prometheus export, fed through a Disruptor event bus</li>
 * </ul>
 *
 * @see fr.lapetina.airouter.RoutingEngineFactory
 * @see fr.lapetina.airouter.routing.FailoverRouter
 */
package fr.lapetina.airouter;
