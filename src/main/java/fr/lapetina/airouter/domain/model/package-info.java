/**
 * Canonical, provider-agnostic value types exchanged between the router and its adapters.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.airouter.domain.model.CanonicalRequest} - Immutable request in canonical form</li>
 *   <li>{@link fr.lapetina.airouter.domain.model.CanonicalResponse} - Immutable normalized completion</li>
 *   <li>{@link fr.lapetina.airouter.domain.model.Usage} - Token counts; total is always derived</li>
 *   <li>{@link fr.lapetina.airouter.domain.model.ProviderHealth} - Health snapshot written by the monitor</li>
 *   <li>{@link fr.lapetina.airouter.domain.model.ErrorKind} - Failure taxonomy that drives failover</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything in this package is an immutable record or enum.
 */
package fr.lapetina.airouter.domain.model;
