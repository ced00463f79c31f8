/**
 * Outbound ports of the governance engine.
 *
 * <p>Adapters live in module-app: effect dispatchers (journal, webhook) and the Spring event
 * bridge.
 *
 * @since 1.0
 */
package pooled.treasury.core.port.out;
