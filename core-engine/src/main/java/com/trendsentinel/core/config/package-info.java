/**
 * YAML-backed engine configuration.
 *
 * <p>
 * {@link com.trendsentinel.core.config.ConfigLoader} parses
 * {@link com.trendsentinel.core.config.EngineConfig} and
 * {@link com.trendsentinel.core.config.SubscriptionsConfig} with SnakeYAML and
 * validates them before returning.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.config;
