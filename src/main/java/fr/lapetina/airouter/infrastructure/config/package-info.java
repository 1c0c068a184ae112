/**
 * Configuration loading.
 *
 * <p>This package parses the YAML configuration once at startup and validates it before
 * any component is wired.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.airouter.infrastructure.config.RouterConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.airouter.infrastructure.config.ConfigLoader} - YAML loading, placeholders, validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code providers} - Upstream vendors, credentials and per-call timeouts</li>
 *   <li>{@code models} - Logical aliases mapped to ordered {@code provider/model} candidates</li>
 *   <li>{@code pricing} - Per-million-token prices by provider and model</li>
 *   <li>{@code routing} - Attempt timeout, overall deadline, optional cost ceiling</li>
 *   <li>{@code healthCheck} - Probe interval, timeout and unhealthy threshold</li>
 *   <li>{@code validation} - Content length limit and model allow-list</li>
 *   <li>{@code events} - Ring buffer and wait strategy settings</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.airouter.infrastructure.config.RouterConfig
 * @see fr.lapetina.airouter.infrastructure.config.ConfigLoader
 */
package fr.lapetina.airouter.infrastructure.config;
