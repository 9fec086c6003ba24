// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

/// The closed set of protocol message kinds. Switching over this enum in a switch expression lets the compiler check
/// that every kind is routed.
public enum MessageType {
  PREPARE,
  PROMISE,
  NACK,
  ACCEPT,
  ACCEPTED,
  DECIDED
}
