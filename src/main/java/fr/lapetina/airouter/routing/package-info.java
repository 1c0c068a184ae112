/**
 * Candidate resolution, request admission and failover.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.airouter.routing.FailoverRouter} - Sequential attempts under per-attempt
 *       and overall deadlines</li>
 *   <li>{@link fr.lapetina.airouter.routing.CandidateResolver} - Alias and {@code provider/model}
 *       resolution, health ordering</li>
 *   <li>{@link fr.lapetina.airouter.routing.RequestValidator} - Rejects malformed requests</li>
 *   <li>{@link fr.lapetina.airouter.routing.BudgetGuard} - Worst-case cost ceiling</li>
 *   <li>{@link fr.lapetina.airouter.routing.RoutingEventSink} - Observability hook injected into the router</li>
 * </ul>
 *
 * <h2>Failover Policy</h2>
 * <ul>
 *   <li>{@code auth}, {@code bad_request} - routing stops, the request is reported invalid</li>
 *   <li>{@code rate_limited}, {@code upstream_5xx}, {@code timeout}, {@code unknown} - next candidate</li>
 *   <li>Streams fail over only until their first chunk reaches the caller</li>
 * </ul>
 */
package fr.lapetina.airouter.routing;
