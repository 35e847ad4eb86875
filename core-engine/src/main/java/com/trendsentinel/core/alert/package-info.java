/**
 * Alert matching and delivery.
 *
 * <p>
 * {@link com.trendsentinel.core.alert.AlertEvaluator} matches each stored
 * trend against the active subscriptions and hands the resulting events to an
 * {@link com.trendsentinel.core.alert.AlertNotifier}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.alert;
