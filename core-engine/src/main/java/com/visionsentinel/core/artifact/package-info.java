/**
 * Naming of per-detection artifact directories and URLs.
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.artifact;
