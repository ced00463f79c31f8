/**
 * Treasury governance engine (pure Java, no framework dependencies).
 *
 * <p>This package contains the registries, ledgers and the quorum policy that decide whether a
 * submitted action or proposal may execute.
 *
 * <h3>Responsibilities:</h3>
 *
 * <ul>
 *   <li>Membership and contribution bookkeeping
 *   <li>Approval tallying with per-voter captured weight
 *   <li>Exactly-once execution with rollback on effect failure
 *   <li>No I/O, no locking (the host serializes calls)
 * </ul>
 *
 * @since 1.0
 */
package pooled.treasury.domain.service;
