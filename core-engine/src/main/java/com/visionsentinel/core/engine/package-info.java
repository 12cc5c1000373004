/**
 * Top-level assembly of the engine.
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.engine;
