/**
 * Per-user statistical baselines built from the historical query window.
 *
 * @since 1.0.0
 */
package com.querysentinel.core.baseline;
