/**
 * Time-window policies and the per-session gate consulted on every worker
 * iteration.
 *
 * <p>
 * Three policy types exist: an absolute date-time range (the only one that
 * expires), a set of months with a daily window, and a daily window alone.
 * Daily windows whose end is before their start wrap past midnight.
 * </p>
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.schedule;
