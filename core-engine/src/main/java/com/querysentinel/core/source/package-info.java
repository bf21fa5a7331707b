/**
 * Contract between the detection pipeline and the store that holds the query
 * history.
 *
 * @since 1.0.0
 */
package com.querysentinel.core.source;
