/**
 * Realtime change event model and wire codec.
 *
 * <p>A {@link com.ryuqq.integrity.core.realtime.ChangeEvent} is derived from each committed
 * mutation and published to three channels (see {@link com.ryuqq.integrity.core.realtime.Channels}).
 * Delivery is best effort; clients order events only through the mandatory per-entity version.</p>
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.core.realtime;
