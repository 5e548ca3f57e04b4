/**
 * In-memory operator alert sink.
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.adapter.inmemory.alert;
