/**
 * Attempt outcome package.
 *
 * <p>This package defines the sealed interface hierarchy used by the retry loop to decide
 * whether another attempt is allowed.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.outcome.Ok} - Successful attempt carrying the value</li>
 *   <li>{@link com.ryuqq.resilience.core.outcome.Retry} - Retryable failure</li>
 *   <li>{@link com.ryuqq.resilience.core.outcome.Fail} - Permanent failure (stops the loop)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Resilience Team
 */
package com.ryuqq.resilience.core.outcome;
