/**
 * Frame acquisition contracts implemented outside the engine.
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.source;
