/**
 * In-memory realtime transport with simulated disconnect/reconnect.
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.adapter.inmemory.transport;
