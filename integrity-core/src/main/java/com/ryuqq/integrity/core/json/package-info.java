/**
 * Shared Jackson configuration for entity attributes, audit images and the realtime wire format.
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.core.json;
