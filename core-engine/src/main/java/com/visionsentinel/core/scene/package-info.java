/**
 * Scene deployments: algorithm catalog, device address resolution and the
 * scheduler that turns a deployment request into running sessions.
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.scene;
