/**
 * Contracts for the engine's external collaborators: the raw event source,
 * the trend store and the optional summarizer.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.store;
