// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.ProposalId;

/// Messages sent by an acceptor back to a proposer. They echo the proposal id they answer so that the proposer can
/// discard replies that belong to a round it has already abandoned.
public sealed interface ReplyMessage extends PaxosMessage permits Promise, Nack, Accepted {
  ProposalId id();
}
