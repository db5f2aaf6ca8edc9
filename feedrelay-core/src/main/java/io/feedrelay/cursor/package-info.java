/**
 * Lazy, cancellable result sequences.
 *
 * <p>{@link io.feedrelay.cursor.RecordCursor} is a forward-only iterator that owns the
 * resources behind it; {@link io.feedrelay.cursor.CancellationToken} carries shutdown and
 * deadline signals into every cursor and collaborator call.
 */
package io.feedrelay.cursor;
