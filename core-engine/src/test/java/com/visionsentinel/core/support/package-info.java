/**
 * Hand-written fakes shared by the engine tests.
 */
package com.visionsentinel.core.support;
