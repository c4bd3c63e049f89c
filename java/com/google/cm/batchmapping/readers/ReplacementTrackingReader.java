/*
 * Copyright 2025 Google LLC
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

package com.google.cm.batchmapping.readers;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.commons.csv.CSVRecord;

/**
 * UTF-8 {@link Reader} that substitutes U+FFFD for each malformed byte sequence and remembers the
 * character offset of every substitution, so that callers can tell which records of a file were
 * not valid UTF-8 without losing the rest of the file.
 */
final class ReplacementTrackingReader extends Reader {

  static final char REPLACEMENT = '\uFFFD';
  private static final int BUFFER_SIZE = 8192;

  private final InputStream stream;
  private final CharsetDecoder decoder =
      StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT);
  private final ByteBuffer bytes = ByteBuffer.allocate(BUFFER_SIZE).flip();
  // Ascending, since characters are handed out in order
  private final Deque<Long> replacedOffsets = new ArrayDeque<>();

  private long charsRead = 0;
  private boolean endOfInput = false;
  private boolean flushed = false;
  private boolean readFailed = false;

  ReplacementTrackingReader(InputStream stream) {
    this.stream = stream;
  }

  @Override
  public int read(char[] buffer, int offset, int length) throws IOException {
    if (length == 0) {
      return 0;
    }
    CharBuffer chars = CharBuffer.wrap(buffer, offset, length);
    while (chars.hasRemaining() && !flushed) {
      CoderResult result = decoder.decode(bytes, chars, endOfInput);
      if (result.isError()) {
        replacedOffsets.addLast(charsRead + chars.position() - offset);
        chars.put(REPLACEMENT);
        bytes.position(bytes.position() + result.length());
      } else if (result.isOverflow()) {
        break;
      } else if (endOfInput) {
        if (decoder.flush(chars).isOverflow()) {
          break;
        }
        flushed = true;
      } else if (chars.position() > offset) {
        break;
      } else {
        fill();
      }
    }
    int count = chars.position() - offset;
    charsRead += count;
    return count == 0 && flushed ? -1 : count;
  }

  private void fill() throws IOException {
    bytes.compact();
    try {
      int count =
          stream.read(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
      if (count < 0) {
        endOfInput = true;
      } else {
        bytes.position(bytes.position() + count);
      }
    } catch (IOException ex) {
      readFailed = true;
      throw ex;
    } finally {
      bytes.flip();
    }
  }

  /**
   * Whether a malformed byte sequence was replaced inside {@code record}, which ends where the
   * record after it starts. {@code nextRecordPosition} is {@link Long#MAX_VALUE} when no record
   * follows or the following one could not be parsed; the record must then hold a U+FFFD itself.
   *
   * <p>Records must be checked in file order; offsets before the record are discarded.
   */
  boolean hasReplacementsIn(CSVRecord record, long nextRecordPosition) {
    if (nextRecordPosition == Long.MAX_VALUE
        && record.stream().noneMatch(value -> value.indexOf(REPLACEMENT) >= 0)) {
      return false;
    }
    long start = record.getCharacterPosition();
    while (!replacedOffsets.isEmpty() && replacedOffsets.peekFirst() < start) {
      replacedOffsets.removeFirst();
    }
    Long first = replacedOffsets.peekFirst();
    return first != null && first < nextRecordPosition;
  }

  /** Whether the underlying stream threw while being read. */
  boolean hasReadFailed() {
    return readFailed;
  }

  @Override
  public void close() throws IOException {
    stream.close();
  }
}
