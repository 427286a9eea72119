/**
 * Protocol-centric core for the Supercast bindings.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Wire constants and header helpers</li>
 *   <li>The configuration snapshot and its process-wide holder</li>
 *   <li>The canonical response record and the error taxonomy</li>
 * </ul>
 *
 * <p>HTTP bindings and the request executor live in other modules.
 */
package io.supercast.core;
