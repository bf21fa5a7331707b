/**
 * Feature extraction for recent query activity: local hour, text length and
 * accessed table.
 *
 * @since 1.0.0
 */
package com.querysentinel.core.extract;
