// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.metrics;

/// The kinds of metrics events. Proposer events come first then acceptor events then messenger events.
public enum EventType {
  PREPARE_SENT,
  PROMISE_RECV,
  NACK_RECV,
  ACCEPT_SENT,
  ACCEPTED_RECV,
  DECIDED,
  RETRY,
  TIMEOUT,
  PROMISE_SENT,
  NACK_SENT,
  ACCEPTED_SENT,
  PERSISTENCE_FAILURE,
  SENT,
  DELIVERED,
  DROPPED,
  DUPLICATED
}
