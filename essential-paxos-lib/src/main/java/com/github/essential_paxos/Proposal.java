// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Objects;

/// A value paired with the id of the round that proposed it. This is the `{N,V}` of the paper Paxos Made Simple.
public record Proposal(ProposalId id, Value value) {
  public Proposal {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(value, "value");
  }

  public int compareIds(Proposal other) {
    return id.compareTo(other.id);
  }
}
