/**
 * Runnable service around the core engine: environment configuration, the
 * device platform client and the health endpoint.
 *
 * @since 1.0.0
 */
package com.visionsentinel.app;
