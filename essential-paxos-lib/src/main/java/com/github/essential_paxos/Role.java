// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

/// The roles a node can play. The messenger is not a protocol role but it is a source of metrics events.
public enum Role {
  PROPOSER,
  ACCEPTOR,
  LEARNER,
  MESSENGER
}
