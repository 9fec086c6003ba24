// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

/// The value we are trying to get chosen. As this library is neutral to the application the value is completely
/// opaque to the protocol. The application is responsible for encoding and decoding it from and to a byte array.
///
/// @param bytes The application specific binary encoding of the value.
public record Value(byte[] bytes) {

  public Value {
    if (bytes == null) {
      throw new IllegalArgumentException("bytes cannot be null");
    }
    bytes = bytes.clone();
  }

  public static Value of(String utf8) {
    return new Value(utf8.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  public String asString() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    return Arrays.equals(bytes, ((Value) other).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    if (bytes.length <= 32) {
      return "Value[" + asString() + "]";
    }
    CRC32 crc32 = new CRC32();
    crc32.update(bytes);
    return String.format("Value[bytes=byte[%d]:CRC32=%d]", bytes.length, crc32.getValue());
  }
}
