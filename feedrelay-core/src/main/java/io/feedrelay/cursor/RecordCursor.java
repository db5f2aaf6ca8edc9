package io.feedrelay.cursor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, forward-only, single-consumer sequence of records backed by an open resource.
 *
 * <p>Implementations release the underlying resource when the sequence is drained,
 * when {@link #close()} is called, or when their {@link CancellationToken} fires,
 * whichever happens first. A read error ends the sequence early; records already
 * returned stay valid. Cursors are not restartable.
 *
 * <p>Always use with try-with-resources:
 * <pre>{@code
 * try (RecordCursor<Feed> feeds = store.streamFeeds(conn, token)) {
 *   while (feeds.hasNext()) {
 *     process(feeds.next());
 *   }
 * }
 * }</pre>
 *
 * @param <T> record type
 */
public interface RecordCursor<T> extends Iterator<T>, AutoCloseable {

  /**
   * Releases the underlying resource. Idempotent; never throws.
   */
  @Override
  void close();

  /**
   * Drains the remaining records into a list and closes the cursor.
   */
  default List<T> toList() {
    try {
      List<T> out = new ArrayList<>();
      while (hasNext()) {
        out.add(next());
      }
      return out;
    } finally {
      close();
    }
  }

  /**
   * Exposes the remaining records as a sequential stream that closes this cursor when
   * the stream is closed.
   */
  default Stream<T> stream() {
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
        .onClose(this::close);
  }

  /**
   * Wraps a materialized list.
   */
  static <T> RecordCursor<T> of(List<T> records) {
    Iterator<T> it = List.copyOf(records).iterator();
    return new RecordCursor<>() {
      private boolean closed;

      @Override
      public boolean hasNext() {
        return !closed && it.hasNext();
      }

      @Override
      public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return it.next();
      }

      @Override
      public void close() {
        closed = true;
      }
    };
  }

  /**
   * Returns a cursor that also closes {@code resource} after {@code delegate} is closed.
   * Used to tie a connection's lifetime to a cursor handed to a caller.
   */
  static <T> RecordCursor<T> closing(RecordCursor<T> delegate, AutoCloseable resource) {
    Objects.requireNonNull(delegate, "delegate");
    Objects.requireNonNull(resource, "resource");
    return new RecordCursor<>() {
      private boolean closed;

      @Override
      public boolean hasNext() {
        if (closed) {
          return false;
        }
        if (!delegate.hasNext()) {
          close();
          return false;
        }
        return true;
      }

      @Override
      public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return delegate.next();
      }

      @Override
      public void close() {
        if (closed) {
          return;
        }
        closed = true;
        try {
          delegate.close();
        } finally {
          try {
            resource.close();
          } catch (Exception e) {
            Logger.getLogger(RecordCursor.class.getName())
                .log(Level.WARNING, "Failed to release cursor resource", e);
          }
        }
      }
    };
  }
}
