package org.javai.commonmark.inline;

/**
 * Snapshot of a {@link Cursor}, taken with {@link Cursor#saveState()}.
 *
 * @param position the offset the cursor was at
 */
public record CursorState(int position) {
}
