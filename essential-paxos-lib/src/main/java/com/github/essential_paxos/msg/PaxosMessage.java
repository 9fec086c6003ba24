// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.NodeId;

/// PaxosMessage is the base interface for all messages in the protocol.
public sealed interface PaxosMessage permits
    Prepare,
    Promise,
    Nack,
    Accept,
    Accepted,
    Decided,
    ReplyMessage {

  /// @return the node in the cluster that sent this message.
  NodeId from();

  /// @return the consensus instance this message is about.
  long slot();

  /// @return the type tag used for routing with an exhaustive switch.
  MessageType type();
}
