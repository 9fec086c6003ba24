// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.Value;

import java.util.Objects;

/// Decided announces the chosen value of a slot. Learners that receive it do not need to count accepts.
public record Decided(NodeId from, long slot, Value value) implements PaxosMessage {
  public Decided {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public MessageType type() {
    return MessageType.DECIDED;
  }
}
