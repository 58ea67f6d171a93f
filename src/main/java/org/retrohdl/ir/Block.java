/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.retrohdl.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * An ordered sequence of Operations, represented as a doubly-linked list threaded through the
 * Operations themselves.
 *
 * <p>Iterating over a Block advances to the next Operation before returning the current one, so the
 * caller may erase or move the current Operation, or insert new Operations immediately after it,
 * without disturbing the iteration (Operations inserted after the current one are not visited).
 */
public final class Block implements Iterable<Operation> {
  private Operation first;
  private Operation last;
  private int size;

  /** The operation whose region this is, or null for a module body. */
  private final @Nullable Operation parentOp;

  Block(@Nullable Operation parentOp) {
    this.parentOp = parentOp;
  }

  public @Nullable Operation parentOp() {
    return parentOp;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int size() {
    return size;
  }

  public @Nullable Operation first() {
    return first;
  }

  public @Nullable Operation last() {
    return last;
  }

  /** Returns a snapshot of the current contents of this Block. */
  public ImmutableList<Operation> operations() {
    ImmutableList.Builder<Operation> builder = ImmutableList.builderWithExpectedSize(size);
    for (Operation op = first; op != null; op = op.next) {
      builder.add(op);
    }
    return builder.build();
  }

  /** Adds a detached Operation at the end of this Block. */
  public void append(Operation op) {
    link(op, null);
  }

  /** Inserts a detached Operation immediately before {@code anchor}, which is in this Block. */
  public void insertBefore(Operation anchor, Operation op) {
    Preconditions.checkArgument(anchor.parent == this);
    link(op, anchor);
  }

  /**
   * Moves every Operation of {@code source} (preserving their order) to immediately before {@code
   * anchor}, or to the end of this Block if {@code anchor} is null. Leaves {@code source} empty.
   */
  public void spliceBefore(@Nullable Operation anchor, Block source) {
    Preconditions.checkArgument(source != this);
    Preconditions.checkArgument(anchor == null || anchor.parent == this);
    while (source.first != null) {
      Operation op = source.first;
      source.unlink(op);
      link(op, anchor);
    }
  }

  /** Links {@code op} before {@code before}, or at the end if {@code before} is null. */
  private void link(Operation op, @Nullable Operation before) {
    Preconditions.checkArgument(op.parent == null && !op.isErased(), "%s is not detached", op);
    Operation after = (before == null) ? last : before.prev;
    op.prev = after;
    op.next = before;
    if (after == null) {
      first = op;
    } else {
      after.next = op;
    }
    if (before == null) {
      last = op;
    } else {
      before.prev = op;
    }
    op.parent = this;
    ++size;
  }

  /** Removes {@code op} from this Block, leaving it detached. */
  void unlink(Operation op) {
    assert op.parent == this;
    if (op.prev == null) {
      first = op.next;
    } else {
      op.prev.next = op.next;
    }
    if (op.next == null) {
      last = op.prev;
    } else {
      op.next.prev = op.prev;
    }
    op.prev = null;
    op.next = null;
    op.parent = null;
    --size;
  }

  /** Erases every Operation in this Block. */
  void eraseAll() {
    while (last != null) {
      last.erase();
    }
  }

  @Override
  public Iterator<Operation> iterator() {
    return new Iterator<>() {
      Operation cursor = first;

      @Override
      public boolean hasNext() {
        return cursor != null;
      }

      @Override
      public Operation next() {
        if (cursor == null) {
          throw new NoSuchElementException();
        }
        Operation result = cursor;
        cursor = result.next;
        return result;
      }
    };
  }
}
