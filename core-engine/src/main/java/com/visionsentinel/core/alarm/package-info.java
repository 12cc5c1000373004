/**
 * Alarm rule evaluation with consecutive-frame debounce and cooldown.
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.alarm;
