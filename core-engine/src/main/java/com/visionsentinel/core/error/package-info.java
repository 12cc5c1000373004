/**
 * Error taxonomy shared by every engine component.
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.error;
